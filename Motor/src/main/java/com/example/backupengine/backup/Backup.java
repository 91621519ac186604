package com.example.backupengine.backup;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.error.BackupErrors.ConfigException;
import com.example.backupengine.error.BackupErrors.ErrorDetail;
import com.example.backupengine.error.BackupErrors.HookFailedException;
import com.example.backupengine.error.BackupErrors.HookTimeoutException;
import com.example.backupengine.hooks.Hooks.HookCommand;
import com.example.backupengine.hooks.Hooks.HookRunner;
import com.example.backupengine.packager.PackagerModule.ArchiveNaming;
import com.example.backupengine.packager.PackagerModule.PackagedArchive;
import com.example.backupengine.packager.PackagerModule.Packager;
import com.example.backupengine.packager.TarFormat;
import com.example.backupengine.retention.Retention.RetentionPolicy;
import com.example.backupengine.scan.Scanner.ExclusionFilter;
import com.example.backupengine.scan.Scanner.ScanResult;
import com.example.backupengine.scan.Scanner.ScanService;
import com.example.backupengine.storage.Storage.BackupMetadata;
import com.example.backupengine.storage.Storage.ChecksumSidecar;
import com.example.backupengine.storage.Storage.ConfigLock;
import com.example.backupengine.storage.Storage.LocalMetadataStore;
import com.example.backupengine.storage.Storage.MetadataStore;

/**
 * Criação de backups: configuração, job e o coordenador que gera arquivo + checksum + registro.
 */
public final class Backup {

    private Backup() {}

    // =====================
    // CONFIGURAÇÃO
    // =====================

    /**
     * Definição imutável de um backup: o que copiar, para onde, como comprimir e quanto reter.
     */
    public static final class BackupConfig {

        private static final Pattern VALID_NAME = Pattern.compile("[A-Za-z0-9._-]+");

        private final String name;
        private final Path source;
        private final Path destination;
        private final boolean compression;
        private final List<String> excludePatterns;
        private final HookCommand preHook;
        private final HookCommand postHook;
        private final RetentionPolicy retention;

        private BackupConfig(Builder b) {
            this.name = b.name;
            this.source = b.source;
            this.destination = b.destination;
            this.compression = b.compression;
            this.excludePatterns = List.copyOf(b.excludePatterns);
            this.preHook = b.preHook;
            this.postHook = b.postHook;
            this.retention = b.retention != null ? b.retention : RetentionPolicy.defaults();
        }

        public static Builder builder() {
            return new Builder();
        }

        public String name() { return name; }
        public Path source() { return source; }
        public Path destination() { return destination; }
        public boolean compression() { return compression; }
        public List<String> excludePatterns() { return excludePatterns; }
        public Optional<HookCommand> preHook() { return Optional.ofNullable(preHook); }
        public Optional<HookCommand> postHook() { return Optional.ofNullable(postHook); }
        public RetentionPolicy retention() { return retention; }

        /**
         * Valida nome, origem, destino e padrões de exclusão.
         *
         * @throws ConfigException na primeira inconsistência encontrada
         */
        public void validate() throws ConfigException {
            validateName();
            if (source == null) {
                throw new ConfigException("[" + name + "] Origem não informada");
            }
            if (!Files.exists(source)) {
                throw new ConfigException("[" + name + "] Origem não existe: " + source);
            }
            if (!Files.isDirectory(source)) {
                throw new ConfigException("[" + name + "] Origem não é um diretório: " + source);
            }
            if (destination == null) {
                throw new ConfigException("[" + name + "] Destino não informado");
            }
            if (Files.exists(destination) && !Files.isDirectory(destination)) {
                throw new ConfigException("[" + name + "] Destino existe e não é um diretório: " + destination);
            }
            if (destination.toAbsolutePath().normalize().startsWith(source.toAbsolutePath().normalize())) {
                throw new ConfigException("[" + name + "] Destino não pode ficar dentro da origem: " + destination);
            }
            try {
                ExclusionFilter.ofGlobs(excludePatterns);
            } catch (IllegalArgumentException e) {
                throw new ConfigException("[" + name + "] " + e.getMessage(), e);
            }
        }

        /** Valida só o nome (usado também no registro de configurações). */
        public void validateName() throws ConfigException {
            if (name == null || name.isBlank()) {
                throw new ConfigException("Nome da configuração é obrigatório");
            }
            if (!VALID_NAME.matcher(name).matches() || name.equals(".") || name.equals("..")) {
                throw new ConfigException("Nome de configuração inválido: '" + name + "' (use letras, dígitos, '.', '_' ou '-')");
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof BackupConfig)) return false;
            BackupConfig c = (BackupConfig) o;
            return compression == c.compression
                    && Objects.equals(name, c.name)
                    && Objects.equals(source, c.source)
                    && Objects.equals(destination, c.destination)
                    && excludePatterns.equals(c.excludePatterns)
                    && Objects.equals(preHook, c.preHook)
                    && Objects.equals(postHook, c.postHook)
                    && retention.equals(c.retention);
        }

        @Override
        public int hashCode() {
            return Objects.hash(name, source, destination, compression, excludePatterns, preHook, postHook, retention);
        }

        @Override
        public String toString() {
            return "BackupConfig{" + name + ", " + source + " -> " + destination
                    + (compression ? ", comprimido" : "") + ", excludes=" + excludePatterns + "}";
        }

        public static final class Builder {
            private String name;
            private Path source;
            private Path destination;
            private boolean compression = true;
            private final List<String> excludePatterns = new ArrayList<>();
            private HookCommand preHook;
            private HookCommand postHook;
            private RetentionPolicy retention;

            public Builder name(String v) { this.name = v; return this; }
            public Builder source(Path v) { this.source = v; return this; }
            public Builder destination(Path v) { this.destination = v; return this; }
            public Builder compression(boolean v) { this.compression = v; return this; }
            public Builder exclude(String pattern) { this.excludePatterns.add(Objects.requireNonNull(pattern, "pattern")); return this; }
            public Builder excludes(List<String> patterns) { patterns.forEach(this::exclude); return this; }
            public Builder preHook(HookCommand v) { this.preHook = v; return this; }
            public Builder postHook(HookCommand v) { this.postHook = v; return this; }
            public Builder retention(RetentionPolicy v) { this.retention = v; return this; }

            public BackupConfig build() {
                return new BackupConfig(this);
            }
        }
    }

    // =====================
    // JOB
    // =====================

    public enum JobStatus { PENDING, RUNNING, SUCCEEDED, FAILED }

    /**
     * Uma tentativa de backup. Imutável: cada transição gera uma nova instância.
     */
    public static final class BackupJob {
        private final String id;
        private final String configName;
        private final JobStatus status;
        private final Instant startedAt;
        private final Instant finishedAt;
        private final Path archivePath;
        private final long sizeBytes;
        private final long filesCount;
        private final String checksum;
        private final ErrorDetail error;
        private final List<String> warnings;

        private BackupJob(Builder b) {
            this.id = Objects.requireNonNull(b.id, "id");
            this.configName = b.configName;
            this.status = Objects.requireNonNull(b.status, "status");
            this.startedAt = Objects.requireNonNull(b.startedAt, "startedAt");
            this.finishedAt = b.finishedAt;
            this.archivePath = b.archivePath;
            this.sizeBytes = b.sizeBytes;
            this.filesCount = b.filesCount;
            this.checksum = b.checksum;
            this.error = b.error;
            this.warnings = List.copyOf(b.warnings);
        }

        public static BackupJob pending(String id, String configName, Instant startedAt) {
            Builder b = new Builder();
            b.id = id;
            b.configName = configName;
            b.status = JobStatus.PENDING;
            b.startedAt = startedAt;
            return b.build();
        }

        public BackupJob running() {
            return toBuilder().status(JobStatus.RUNNING).build();
        }

        public BackupJob succeeded(PackagedArchive archive, Instant finishedAt, List<String> warnings) {
            return toBuilder()
                    .status(JobStatus.SUCCEEDED)
                    .finishedAt(finishedAt)
                    .archivePath(archive.path())
                    .sizeBytes(archive.size())
                    .filesCount(archive.filesIncluded())
                    .checksum(archive.checksum())
                    .warnings(warnings)
                    .build();
        }

        public BackupJob failed(Throwable cause, Instant finishedAt) {
            return toBuilder()
                    .status(JobStatus.FAILED)
                    .finishedAt(finishedAt)
                    .archivePath(null)
                    .sizeBytes(0)
                    .error(ErrorDetail.of(cause))
                    .build();
        }

        public String id() { return id; }
        public String configName() { return configName; }
        public JobStatus status() { return status; }
        public Instant startedAt() { return startedAt; }
        public Optional<Instant> finishedAt() { return Optional.ofNullable(finishedAt); }
        public Optional<Path> archivePath() { return Optional.ofNullable(archivePath); }
        public long sizeBytes() { return sizeBytes; }
        public long filesCount() { return filesCount; }
        public Optional<String> checksum() { return Optional.ofNullable(checksum); }
        public Optional<ErrorDetail> error() { return Optional.ofNullable(error); }
        public List<String> warnings() { return warnings; }
        public boolean isSucceeded() { return status == JobStatus.SUCCEEDED; }

        private Builder toBuilder() {
            Builder b = new Builder();
            b.id = id;
            b.configName = configName;
            b.status = status;
            b.startedAt = startedAt;
            b.finishedAt = finishedAt;
            b.archivePath = archivePath;
            b.sizeBytes = sizeBytes;
            b.filesCount = filesCount;
            b.checksum = checksum;
            b.error = error;
            b.warnings = new ArrayList<>(warnings);
            return b;
        }

        @Override
        public String toString() {
            return "BackupJob{" + id + ", " + configName + ", " + status
                    + (archivePath != null ? ", " + archivePath.getFileName() : "")
                    + (error != null ? ", " + error : "") + "}";
        }

        private static final class Builder {
            private String id;
            private String configName;
            private JobStatus status;
            private Instant startedAt;
            private Instant finishedAt;
            private Path archivePath;
            private long sizeBytes;
            private long filesCount;
            private String checksum;
            private ErrorDetail error;
            private List<String> warnings = new ArrayList<>();

            Builder status(JobStatus v) { this.status = v; return this; }
            Builder finishedAt(Instant v) { this.finishedAt = v; return this; }
            Builder archivePath(Path v) { this.archivePath = v; return this; }
            Builder sizeBytes(long v) { this.sizeBytes = v; return this; }
            Builder filesCount(long v) { this.filesCount = v; return this; }
            Builder checksum(String v) { this.checksum = v; return this; }
            Builder error(ErrorDetail v) { this.error = v; return this; }
            Builder warnings(List<String> v) { this.warnings = new ArrayList<>(v); return this; }

            BackupJob build() {
                return new BackupJob(this);
            }
        }
    }

    // =====================
    // COORDENADOR
    // =====================

    /**
     * Executa um backup de ponta a ponta:
     * validação, lock, pre-hook, scan, arquivo, sidecar, registro, post-hook.
     *
     * Falhas nunca escapam como exceção: o job volta com status FAILED e o detalhe do erro,
     * depois que os artefatos parciais desta execução foram removidos.
     */
    public static final class BackupCoordinator {
        private static final Logger log = LoggerFactory.getLogger(BackupCoordinator.class);

        private final ScanService scanService;
        private final Packager packager;
        private final HookRunner hookRunner;
        private final Clock clock;
        private final String hostname;
        private final String compressionCodec;

        /** Um sinal por execução em andamento; configurações distintas podem rodar em paralelo. */
        private final Set<AtomicBoolean> running = ConcurrentHashMap.newKeySet();

        public BackupCoordinator(ScanService scanService, Packager packager, HookRunner hookRunner,
                                 Clock clock, String hostname, String compressionCodec) {
            this.scanService = Objects.requireNonNull(scanService, "scanService");
            this.packager = Objects.requireNonNull(packager, "packager");
            this.hookRunner = Objects.requireNonNull(hookRunner, "hookRunner");
            this.clock = Objects.requireNonNull(clock, "clock");
            this.hostname = ArchiveNaming.sanitizeHost(hostname);
            this.compressionCodec = compressionCodec != null ? compressionCodec : "zstd";
        }

        /** Solicita cancelamento de todos os backups em andamento. */
        public void requestCancel() {
            running.forEach(token -> token.set(true));
        }

        public BackupJob run(BackupConfig config) {
            Objects.requireNonNull(config, "config");
            AtomicBoolean cancelled = new AtomicBoolean(false);
            running.add(cancelled);
            try {
                return run(config, cancelled);
            } finally {
                running.remove(cancelled);
            }
        }

        private BackupJob run(BackupConfig config, AtomicBoolean cancelled) {
            BackupJob job = BackupJob.pending(UUID.randomUUID().toString(), config.name(), clock.instant());

            Path archive = null;
            Path sidecar = null;
            try {
                config.validate();
                Files.createDirectories(config.destination());

                try (ConfigLock ignored = ConfigLock.acquire(config.destination(), config.name())) {
                    job = job.running();
                    log.info("[{}] Backup iniciado (job {})", config.name(), job.id());

                    if (config.preHook().isPresent()) {
                        hookRunner.run("pre", config.preHook().get());
                    }
                    checkCancelled(cancelled);

                    List<String> warnings = new ArrayList<>();
                    ScanResult scan = scanService.scan(config.source(), ExclusionFilter.ofGlobs(config.excludePatterns()));
                    log.info("[{}] Scan: {} arquivos, {} bytes", config.name(), scan.fileCount(), scan.totalBytes());
                    if (scan.statistics().errors() > 0) {
                        warnings.add(scan.statistics().errors() + " caminho(s) inacessível(is) ignorado(s) no scan");
                    }
                    checkCancelled(cancelled);

                    TarFormat.Codec codec = TarFormat.Codec.resolve(config.compression(), compressionCodec);
                    Instant createdAt = clock.instant();
                    Path target = config.destination().resolve(
                            ArchiveNaming.fileName(config.name(), hostname, createdAt, codec));

                    PackagedArchive packaged = packager.create(scan, target, codec, cancelled::get);
                    archive = packaged.path();
                    for (String changed : packaged.changedFiles()) {
                        warnings.add("arquivo alterado durante o backup: " + changed);
                    }
                    checkCancelled(cancelled);

                    sidecar = ChecksumSidecar.write(archive, packaged.checksum());
                    checkCancelled(cancelled);

                    MetadataStore store = new LocalMetadataStore(config.destination());
                    store.append(BackupMetadata.builder()
                            .id(job.id())
                            .createdAt(createdAt)
                            .configName(config.name())
                            .archiveFilename(archive.getFileName().toString())
                            .sizeBytes(packaged.size())
                            .checksum(packaged.checksum())
                            .checksumAlgorithm(packaged.checksumAlgorithm())
                            .hostname(hostname)
                            .sourcePath(scan.root().toString())
                            .filesCount(packaged.filesIncluded())
                            .compression(codec.name().toLowerCase(Locale.ROOT))
                            .build());
                    // a partir daqui o backup está completo; falhas do post-hook viram aviso
                    archive = null;
                    sidecar = null;

                    if (config.postHook().isPresent()) {
                        try {
                            hookRunner.run("post", config.postHook().get());
                        } catch (HookFailedException | HookTimeoutException e) {
                            log.warn("[{}] Post-hook falhou: {}", config.name(), e.getMessage());
                            warnings.add("post-hook: " + e.getMessage());
                        }
                    }

                    job = job.succeeded(packaged, clock.instant(), warnings);
                    log.info("[{}] Backup concluído: {} ({} bytes, {} arquivos)", config.name(),
                            packaged.path().getFileName(), packaged.size(), packaged.filesIncluded());
                    return job;
                }
            } catch (IOException | RuntimeException e) {
                discard(sidecar);
                discard(archive);
                log.error("[{}] Backup falhou: {}", config.name(), e.toString());
                return job.failed(e, clock.instant());
            }
        }

        private static void checkCancelled(AtomicBoolean cancelled) throws InterruptedIOException {
            if (cancelled.get() || Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Backup cancelado");
            }
        }

        private static void discard(Path path) {
            if (path == null) return;
            try {
                Files.deleteIfExists(path);
                log.debug("Artefato parcial removido: {}", path);
            } catch (IOException e) {
                log.warn("Falha ao remover artefato parcial {}: {}", path, e.toString());
            }
        }
    }
}
