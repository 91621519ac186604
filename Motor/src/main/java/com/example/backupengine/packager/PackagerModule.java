package com.example.backupengine.packager;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.UnknownHostException;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.DigestOutputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.function.BooleanSupplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.error.BackupErrors.ConfigException;
import com.example.backupengine.scan.Scanner.ScanResult;

/**
 * Módulo de empacotamento - orquestra a criação do arquivo de backup usando TarFormat.
 *
 * Responsabilidades:
 * - Nomeação: config + host + timestamp UTC + extensão do codec
 * - Escrita segura: arquivo temporário oculto, fsync e rename atômico
 * - Checksum: digest calculado sobre os bytes finais enquanto são escritos
 */
public final class PackagerModule {

    private PackagerModule() {}

    /**
     * Arquivo empacotado e já movido para o nome final.
     */
    public static final class PackagedArchive {
        private final Path path;
        private final long size;
        private final String checksum;
        private final String checksumAlgorithm;
        private final int filesIncluded;
        private final List<String> changedFiles;
        private final TarFormat.Codec codec;

        public PackagedArchive(Path path, long size, String checksum, String checksumAlgorithm,
                               int filesIncluded, List<String> changedFiles, TarFormat.Codec codec) {
            this.path = Objects.requireNonNull(path, "path");
            this.size = size;
            this.checksum = Objects.requireNonNull(checksum, "checksum");
            this.checksumAlgorithm = Objects.requireNonNull(checksumAlgorithm, "checksumAlgorithm");
            this.filesIncluded = filesIncluded;
            this.changedFiles = List.copyOf(changedFiles);
            this.codec = Objects.requireNonNull(codec, "codec");
        }

        public Path path() { return path; }
        public long size() { return size; }
        public String checksum() { return checksum; }
        public String checksumAlgorithm() { return checksumAlgorithm; }
        public int filesIncluded() { return filesIncluded; }
        /** Arquivos cujo tamanho mudou enquanto eram lidos; gravados com o tamanho do scan. */
        public List<String> changedFiles() { return changedFiles; }
        public TarFormat.Codec codec() { return codec; }
    }

    /**
     * Regras de nome dos arquivos: {@code <config>_<host>_<yyyyMMdd_HHmmss><ext>}.
     */
    public static final class ArchiveNaming {

        private static final Logger log = LoggerFactory.getLogger(ArchiveNaming.class);
        private static final DateTimeFormatter STAMP =
                DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

        private ArchiveNaming() {}

        public static String fileName(String configName, String host, Instant createdAt, TarFormat.Codec codec) {
            return configName + "_" + sanitizeHost(host) + "_" + STAMP.format(createdAt) + codec.extension();
        }

        /** Remove do host tudo que não cabe em um nome de arquivo portátil. */
        public static String sanitizeHost(String host) {
            if (host == null || host.isBlank()) return "localhost";
            String cleaned = host.trim().replaceAll("[^A-Za-z0-9.-]", "-");
            return cleaned.isEmpty() ? "localhost" : cleaned;
        }

        /** Hostname da máquina; "localhost" se não for resolvível. */
        public static String localHostname() {
            try {
                return InetAddress.getLocalHost().getHostName();
            } catch (UnknownHostException e) {
                log.warn("Hostname não resolvido, usando 'localhost': {}", e.getMessage());
                return "localhost";
            }
        }

        /** Nome oculto usado durante a escrita, no mesmo diretório do destino final. */
        static Path temporaryFor(Path target) {
            return target.resolveSibling("." + target.getFileName() + ".tmp-" + UUID.randomUUID());
        }
    }

    /**
     * Packager: gera um arquivo tar (comprimido ou não) a partir de um scan.
     */
    public static final class Packager {

        private static final Logger log = LoggerFactory.getLogger(Packager.class);
        private static final HexFormat HEX = HexFormat.of();

        private final int zstdLevel;
        private final String checksumAlgorithm;

        public Packager(String checksumAlgorithm) {
            this(4, checksumAlgorithm);
        }

        public Packager(int zstdLevel, String checksumAlgorithm) {
            this.zstdLevel = zstdLevel;
            this.checksumAlgorithm = Objects.requireNonNull(checksumAlgorithm, "checksumAlgorithm");
        }

        public String checksumAlgorithm() { return checksumAlgorithm; }

        /**
         * Escreve o arquivo em {@code target}. O arquivo final só aparece depois de completo e
         * sincronizado em disco; em qualquer falha o temporário é removido.
         *
         * @throws ConfigException se {@code target} já existir (colisão de nome)
         */
        public PackagedArchive create(ScanResult scan, Path target, TarFormat.Codec codec,
                                      BooleanSupplier cancelled) throws IOException {
            if (Files.exists(target)) {
                throw new ConfigException("Arquivo de backup já existe: " + target.getFileName());
            }
            MessageDigest digest = newDigest(checksumAlgorithm);
            Path temp = ArchiveNaming.temporaryFor(target);
            TarFormat.Writer writer = new TarFormat.Writer(codec, zstdLevel);

            boolean moved = false;
            try {
                TarFormat.Written written;
                try (OutputStream fileOut = Files.newOutputStream(temp, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
                     DigestOutputStream digestOut = new DigestOutputStream(new BufferedOutputStream(fileOut, 256 * 1024), digest)) {
                    written = writer.write(scan.root(), scan.entries(), digestOut, cancelled);
                }
                try (FileChannel channel = FileChannel.open(temp, StandardOpenOption.WRITE)) {
                    channel.force(true);
                }
                if (Files.exists(target)) {
                    throw new ConfigException("Arquivo de backup já existe: " + target.getFileName());
                }
                moveAtomically(temp, target);
                moved = true;

                long size = Files.size(target);
                String checksum = HEX.formatHex(digest.digest());
                log.info("Arquivo criado: {} ({} bytes, {} arquivos, {} {})",
                        target.getFileName(), size, written.files(), checksumAlgorithm, checksum);
                return new PackagedArchive(target, size, checksum, checksumAlgorithm, written.files(),
                        written.changedFiles(), codec);
            } finally {
                if (!moved) {
                    deleteQuietly(temp);
                }
            }
        }

        static MessageDigest newDigest(String algorithm) throws IOException {
            try {
                return MessageDigest.getInstance(algorithm);
            } catch (NoSuchAlgorithmException e) {
                throw new ConfigException("Algoritmo de checksum não suportado: " + algorithm, e);
            }
        }

        private static void moveAtomically(Path source, Path target) throws IOException {
            try {
                Files.move(source, target, StandardCopyOption.ATOMIC_MOVE);
            } catch (AtomicMoveNotSupportedException e) {
                log.debug("ATOMIC_MOVE não suportado ({}), usando move simples", e.getMessage());
                Files.move(source, target);
            }
        }

        private static void deleteQuietly(Path path) {
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                log.warn("Falha ao remover temporário {}: {}", path, e.toString());
            }
        }
    }
}
