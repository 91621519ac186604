package com.example.backupengine.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.UUID;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.error.BackupErrors.IntegrityException;
import com.example.backupengine.error.BackupErrors.LockUnavailableException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Centraliza abstrações e utilitários do armazenamento local de backups.
 *
 * Layout no diretório de destino:
 * <pre>
 * destino/
 *   cfg_host_20240101_120000.tar.zst
 *   cfg_host_20240101_120000.tar.zst.sha256
 *   cfg_host_20240101_120000.tar.zst.lease   (só durante um restore)
 *   .metadata/cfg/&lt;id&gt;.json
 *   .locks/cfg.lock
 * </pre>
 */
public final class Storage {

    private static final Logger log = LoggerFactory.getLogger(Storage.class);

    public static final String METADATA_DIR = ".metadata";
    public static final String LOCKS_DIR = ".locks";
    public static final String SIDECAR_SUFFIX = ".sha256";
    public static final String LEASE_SUFFIX = ".lease";

    private Storage() {}

    // ---- Escrita atômica ---------------------------------------------------

    /**
     * Escreve {@code content} em um temporário oculto no mesmo diretório, sincroniza e renomeia
     * para {@code target}. Leitores nunca enxergam o arquivo pela metade.
     */
    public static void writeAtomically(Path target, byte[] content) throws IOException {
        Path parent = target.toAbsolutePath().getParent();
        Files.createDirectories(parent);
        Path temp = parent.resolve("." + target.getFileName() + ".tmp-" + UUID.randomUUID());
        boolean moved = false;
        try {
            try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(content);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            try {
                Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
            }
            moved = true;
        } finally {
            if (!moved) {
                deleteQuietly(temp);
            }
        }
    }

    /** Verdadeiro para temporários criados por {@link #writeAtomically} ou pelo Packager. */
    public static boolean isTemporaryName(String fileName) {
        return fileName.startsWith(".") && fileName.contains(".tmp-");
    }

    static void deleteQuietly(Path path) {
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            log.warn("Falha ao remover {}: {}", path, e.toString());
        }
    }

    // ---- Registro de metadados ---------------------------------------------

    /**
     * Registro durável de um backup concluído com sucesso.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static final class BackupMetadata {
        @JsonProperty("id")
        private final String id;
        private final Instant createdAt;
        @JsonProperty("config_name")
        private final String configName;
        @JsonProperty("archive_filename")
        private final String archiveFilename;
        @JsonProperty("size_bytes")
        private final long sizeBytes;
        @JsonProperty("checksum")
        private final String checksum;
        @JsonProperty("checksum_algorithm")
        private final String checksumAlgorithm;
        @JsonProperty("hostname")
        private final String hostname;
        @JsonProperty("source_path")
        private final String sourcePath;
        @JsonProperty("files_count")
        private final long filesCount;
        @JsonProperty("compression")
        private final String compression;

        private BackupMetadata(Builder b) {
            this.id = requireText(b.id, "id");
            this.createdAt = Objects.requireNonNull(b.createdAt, "createdAt");
            this.configName = requireText(b.configName, "configName");
            this.archiveFilename = requireText(b.archiveFilename, "archiveFilename");
            this.sizeBytes = b.sizeBytes;
            this.checksum = requireText(b.checksum, "checksum");
            this.checksumAlgorithm = b.checksumAlgorithm != null ? b.checksumAlgorithm : "SHA-256";
            this.hostname = b.hostname;
            this.sourcePath = b.sourcePath;
            this.filesCount = b.filesCount;
            this.compression = b.compression;
        }

        @JsonCreator
        static BackupMetadata fromJson(@JsonProperty("id") String id,
                                       @JsonProperty("created_at") String createdAt,
                                       @JsonProperty("config_name") String configName,
                                       @JsonProperty("archive_filename") String archiveFilename,
                                       @JsonProperty("size_bytes") long sizeBytes,
                                       @JsonProperty("checksum") String checksum,
                                       @JsonProperty("checksum_algorithm") String checksumAlgorithm,
                                       @JsonProperty("hostname") String hostname,
                                       @JsonProperty("source_path") String sourcePath,
                                       @JsonProperty("files_count") long filesCount,
                                       @JsonProperty("compression") String compression) {
            if (createdAt == null) {
                throw new IllegalArgumentException("created_at ausente");
            }
            Instant parsed;
            try {
                parsed = Instant.parse(createdAt);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("created_at inválido: " + createdAt, e);
            }
            return builder()
                    .id(id).createdAt(parsed).configName(configName).archiveFilename(archiveFilename)
                    .sizeBytes(sizeBytes).checksum(checksum).checksumAlgorithm(checksumAlgorithm)
                    .hostname(hostname).sourcePath(sourcePath).filesCount(filesCount).compression(compression)
                    .build();
        }

        public static Builder builder() {
            return new Builder();
        }

        public String id() { return id; }
        public Instant createdAt() { return createdAt; }
        public String configName() { return configName; }
        public String archiveFilename() { return archiveFilename; }
        public long sizeBytes() { return sizeBytes; }
        public String checksum() { return checksum; }
        public String checksumAlgorithm() { return checksumAlgorithm; }
        public String hostname() { return hostname; }
        public String sourcePath() { return sourcePath; }
        public long filesCount() { return filesCount; }
        public String compression() { return compression; }

        @JsonProperty("created_at")
        String createdAtIso() { return createdAt.toString(); }

        /** Ordem canônica: mais novo primeiro; empate resolvido por id decrescente. */
        public static final Comparator<BackupMetadata> NEWEST_FIRST =
                Comparator.comparing(BackupMetadata::createdAt)
                        .thenComparing(BackupMetadata::id)
                        .reversed();

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BackupMetadata)) return false;
            BackupMetadata that = (BackupMetadata) o;
            return id.equals(that.id) && configName.equals(that.configName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(id, configName);
        }

        @Override
        public String toString() {
            return "BackupMetadata{" + configName + "/" + id + ", " + archiveFilename + ", " + createdAt + "}";
        }

        private static String requireText(String value, String field) {
            if (value == null || value.isBlank()) {
                throw new IllegalArgumentException(field + " obrigatório");
            }
            return value;
        }

        public static final class Builder {
            private String id;
            private Instant createdAt;
            private String configName;
            private String archiveFilename;
            private long sizeBytes;
            private String checksum;
            private String checksumAlgorithm;
            private String hostname;
            private String sourcePath;
            private long filesCount;
            private String compression;

            public Builder id(String v) { this.id = v; return this; }
            public Builder createdAt(Instant v) { this.createdAt = v; return this; }
            public Builder configName(String v) { this.configName = v; return this; }
            public Builder archiveFilename(String v) { this.archiveFilename = v; return this; }
            public Builder sizeBytes(long v) { this.sizeBytes = v; return this; }
            public Builder checksum(String v) { this.checksum = v; return this; }
            public Builder checksumAlgorithm(String v) { this.checksumAlgorithm = v; return this; }
            public Builder hostname(String v) { this.hostname = v; return this; }
            public Builder sourcePath(String v) { this.sourcePath = v; return this; }
            public Builder filesCount(long v) { this.filesCount = v; return this; }
            public Builder compression(String v) { this.compression = v; return this; }

            public BackupMetadata build() {
                return new BackupMetadata(this);
            }
        }
    }

    /** Persistência dos registros de backup. */
    public interface MetadataStore {

        /**
         * Grava um novo registro. Falha se já existir um registro com o mesmo id.
         */
        void append(BackupMetadata metadata) throws IOException;

        /** Registros de uma configuração, do mais novo para o mais antigo. */
        List<BackupMetadata> list(String configName) throws IOException;

        /** Todos os registros de todas as configurações, do mais novo para o mais antigo. */
        List<BackupMetadata> listAll() throws IOException;

        Optional<BackupMetadata> find(String configName, String id) throws IOException;

        /**
         * Remove exatamente um registro. Idempotente.
         *
         * @return true se o registro existia
         */
        boolean delete(String configName, String id) throws IOException;
    }

    /**
     * MetadataStore em disco: um JSON por backup em {@code <destino>/.metadata/<config>/<id>.json}.
     */
    public static final class LocalMetadataStore implements MetadataStore {

        private static final Logger log = LoggerFactory.getLogger(LocalMetadataStore.class);
        private static final Pattern SAFE_SEGMENT = Pattern.compile("[A-Za-z0-9._-]+");

        private final Path root;
        private final ObjectMapper mapper;

        public LocalMetadataStore(Path destination) {
            this.root = Objects.requireNonNull(destination, "destination").resolve(METADATA_DIR);
            this.mapper = new ObjectMapper();
            this.mapper.enable(SerializationFeature.INDENT_OUTPUT);
        }

        public Path root() { return root; }

        @Override
        public void append(BackupMetadata metadata) throws IOException {
            Objects.requireNonNull(metadata, "metadata");
            Path file = recordPath(metadata.configName(), metadata.id());
            if (Files.exists(file)) {
                throw new FileAlreadyExistsException(file.toString(), null,
                        "Registro de backup já existe: " + metadata.id());
            }
            writeAtomically(file, mapper.writeValueAsBytes(metadata));
            log.debug("Registro gravado: {}", file);
        }

        @Override
        public List<BackupMetadata> list(String configName) throws IOException {
            List<BackupMetadata> records = new ArrayList<>();
            Path dir = root.resolve(safeSegment(configName));
            readDirectory(dir, records);
            records.sort(BackupMetadata.NEWEST_FIRST);
            return records;
        }

        @Override
        public List<BackupMetadata> listAll() throws IOException {
            List<BackupMetadata> records = new ArrayList<>();
            if (!Files.isDirectory(root)) {
                return records;
            }
            try (DirectoryStream<Path> configs = Files.newDirectoryStream(root, Files::isDirectory)) {
                for (Path dir : configs) {
                    readDirectory(dir, records);
                }
            }
            records.sort(BackupMetadata.NEWEST_FIRST);
            return records;
        }

        @Override
        public Optional<BackupMetadata> find(String configName, String id) throws IOException {
            Path file = recordPath(configName, id);
            if (!Files.isRegularFile(file)) {
                return Optional.empty();
            }
            return Optional.ofNullable(readRecord(file));
        }

        @Override
        public boolean delete(String configName, String id) throws IOException {
            boolean removed = Files.deleteIfExists(recordPath(configName, id));
            if (removed) {
                log.debug("Registro removido: {}/{}", configName, id);
            }
            return removed;
        }

        private void readDirectory(Path dir, List<BackupMetadata> sink) throws IOException {
            if (!Files.isDirectory(dir)) {
                return;
            }
            try (DirectoryStream<Path> files = Files.newDirectoryStream(dir, "*.json")) {
                for (Path file : files) {
                    if (isTemporaryName(file.getFileName().toString())) {
                        continue;
                    }
                    BackupMetadata record = readRecord(file);
                    if (record != null) {
                        sink.add(record);
                    }
                }
            }
        }

        /** Registro ilegível é ignorado com aviso; não derruba a listagem. */
        private BackupMetadata readRecord(Path file) {
            try {
                return mapper.readValue(file.toFile(), BackupMetadata.class);
            } catch (NoSuchFileException e) {
                log.debug("Registro removido durante a leitura: {}", file);
                return null;
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Registro de metadados ilegível ignorado: {} ({})", file, e.getMessage());
                return null;
            }
        }

        private Path recordPath(String configName, String id) {
            return root.resolve(safeSegment(configName)).resolve(safeSegment(id) + ".json");
        }

        private static String safeSegment(String value) {
            if (value == null || !SAFE_SEGMENT.matcher(value).matches() || value.equals(".") || value.equals("..")) {
                throw new IllegalArgumentException("Identificador inválido: " + value);
            }
            return value;
        }
    }

    // ---- Arquivo lateral de checksum ----------------------------------------

    /**
     * Arquivo {@code <arquivo>.sha256} com uma linha {@code <hex>  <nome-do-arquivo>\n},
     * compatível com {@code sha256sum -c}.
     */
    public static final class ChecksumSidecar {

        private ChecksumSidecar() {}

        public static Path pathFor(Path archive) {
            return archive.resolveSibling(archive.getFileName() + SIDECAR_SUFFIX);
        }

        public static String line(String checksum, Path archive) {
            return checksum.toLowerCase(Locale.ROOT) + "  " + archive.getFileName() + "\n";
        }

        public static Path write(Path archive, String checksum) throws IOException {
            Path sidecar = pathFor(archive);
            writeAtomically(sidecar, line(checksum, archive).getBytes(StandardCharsets.UTF_8));
            return sidecar;
        }

        /**
         * Lê o digest do sidecar, se existir.
         *
         * @throws IntegrityException se o conteúdo não estiver no formato esperado
         */
        public static Optional<String> read(Path archive) throws IOException {
            Path sidecar = pathFor(archive);
            if (!Files.isRegularFile(sidecar)) {
                return Optional.empty();
            }
            String content = Files.readString(sidecar, StandardCharsets.UTF_8);
            return Optional.of(parse(content, sidecar));
        }

        static String parse(String content, Path sidecar) throws IntegrityException {
            String first = content.strip().split("\\R", 2)[0].trim();
            String digest = first.split("\\s+", 2)[0];
            if (digest.isEmpty() || !digest.matches("[0-9a-fA-F]+") || digest.length() % 2 != 0) {
                throw new IntegrityException("Arquivo de checksum inválido: " + sidecar);
            }
            return digest.toLowerCase(Locale.ROOT);
        }
    }

    // ---- Lock por configuração ---------------------------------------------

    /**
     * Lock exclusivo consultivo em {@code <destino>/.locks/<config>.lock}. Falha rápido se outro
     * processo (ou outra thread desta JVM) já segura o lock.
     */
    public static final class ConfigLock implements AutoCloseable {

        private static final Logger log = LoggerFactory.getLogger(ConfigLock.class);

        private final Path path;
        private final FileChannel channel;
        private final FileLock lock;

        private ConfigLock(Path path, FileChannel channel, FileLock lock) {
            this.path = path;
            this.channel = channel;
            this.lock = lock;
        }

        public static ConfigLock acquire(Path destination, String configName) throws IOException {
            Path dir = destination.resolve(LOCKS_DIR);
            Files.createDirectories(dir);
            Path path = dir.resolve(configName + ".lock");
            FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE, StandardOpenOption.WRITE);
            FileLock lock;
            try {
                lock = channel.tryLock();
            } catch (OverlappingFileLockException e) {
                channel.close();
                throw new LockUnavailableException("Configuração " + configName + " já está em execução nesta JVM", e);
            } catch (IOException e) {
                channel.close();
                throw e;
            }
            if (lock == null) {
                channel.close();
                throw new LockUnavailableException("Configuração " + configName + " já está em execução por outro processo");
            }
            log.debug("Lock adquirido: {}", path);
            return new ConfigLock(path, channel, lock);
        }

        public Path path() { return path; }

        @Override
        public void close() throws IOException {
            try {
                if (lock.isValid()) {
                    lock.release();
                }
            } finally {
                channel.close();
            }
        }
    }

    // ---- Lease de uso durante restore ---------------------------------------

    /**
     * Marcador {@code <arquivo>.lease} que sinaliza que um restore está lendo o arquivo.
     * O conteúdo é o PID do dono; leases de processos mortos são tratados como vencidos.
     */
    public static final class ArchiveLease implements AutoCloseable {

        private static final Logger log = LoggerFactory.getLogger(ArchiveLease.class);

        private final Path marker;

        private ArchiveLease(Path marker) {
            this.marker = marker;
        }

        public static Path markerFor(Path archive) {
            return archive.resolveSibling(archive.getFileName() + LEASE_SUFFIX);
        }

        public static ArchiveLease acquire(Path archive) throws IOException {
            Path marker = markerFor(archive);
            byte[] owner = Long.toString(ProcessHandle.current().pid()).getBytes(StandardCharsets.UTF_8);
            try {
                Files.write(marker, owner, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            } catch (FileAlreadyExistsException e) {
                if (isLeased(archive)) {
                    throw new LockUnavailableException("Arquivo em uso por outro restore: " + archive.getFileName(), e);
                }
                log.info("Lease vencido encontrado em {}; substituindo", marker);
                Files.write(marker, owner, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            } catch (IOException e) {
                // marcador vazio seria lido como lease ativo
                deleteQuietly(marker);
                throw e;
            }
            return new ArchiveLease(marker);
        }

        /** Verdadeiro se existe lease cujo processo dono ainda está vivo. */
        public static boolean isLeased(Path archive) {
            Path marker = markerFor(archive);
            if (!Files.isRegularFile(marker)) {
                return false;
            }
            OptionalLong pid = ownerPid(marker);
            if (pid.isEmpty()) {
                return true;
            }
            return ProcessHandle.of(pid.getAsLong()).map(ProcessHandle::isAlive).orElse(false);
        }

        private static OptionalLong ownerPid(Path marker) {
            try {
                String raw = Files.readString(marker, StandardCharsets.UTF_8).trim();
                return raw.isEmpty() ? OptionalLong.empty() : OptionalLong.of(Long.parseLong(raw));
            } catch (IOException | NumberFormatException e) {
                log.debug("Lease sem dono legível {}: {}", marker, e.toString());
                return OptionalLong.empty();
            }
        }

        @Override
        public void close() throws IOException {
            Files.deleteIfExists(marker);
        }
    }
}
