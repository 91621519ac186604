package com.example.backupengine.verify;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.DigestInputStream;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.packager.TarFormat;
import com.example.backupengine.storage.Storage.ChecksumSidecar;

/**
 * Verificação de integridade de um arquivo de backup, somente leitura.
 */
public final class Verify {

    private Verify() {}

    /**
     * Resultado de uma verificação. Nunca persistido; cada chamada produz um novo.
     */
    public static final class VerificationResult {
        private final Path archive;
        private final boolean checksumOk;
        private final boolean extractable;
        private final List<String> errors;
        private final long sizeBytes;
        private final long entryCount;
        private final Instant verifiedAt;

        public VerificationResult(Path archive, boolean checksumOk, boolean extractable, List<String> errors,
                                  long sizeBytes, long entryCount, Instant verifiedAt) {
            this.archive = archive;
            this.checksumOk = checksumOk;
            this.extractable = extractable;
            this.errors = List.copyOf(errors);
            this.sizeBytes = sizeBytes;
            this.entryCount = entryCount;
            this.verifiedAt = Objects.requireNonNull(verifiedAt, "verifiedAt");
        }

        public Path archive() { return archive; }
        public boolean isValid() { return checksumOk && extractable; }
        public boolean checksumOk() { return checksumOk; }
        public boolean extractable() { return extractable; }
        public List<String> errors() { return errors; }
        public long sizeBytes() { return sizeBytes; }
        public long entryCount() { return entryCount; }
        public Instant verifiedAt() { return verifiedAt; }

        @Override
        public String toString() {
            return "VerificationResult{" + (archive != null ? archive.getFileName() : "-")
                    + ", valid=" + isValid() + ", checksum=" + checksumOk + ", extractable=" + extractable
                    + ", entries=" + entryCount + ", errors=" + errors + "}";
        }
    }

    /**
     * Verificador: recalcula o checksum e percorre todas as entradas do tar, lendo o conteúdo
     * sem gravar nada em disco.
     */
    public static final class BackupVerifier {

        private static final Logger log = LoggerFactory.getLogger(BackupVerifier.class);
        private static final HexFormat HEX = HexFormat.of();

        private final String checksumAlgorithm;
        private final Clock clock;

        public BackupVerifier(String checksumAlgorithm) {
            this(checksumAlgorithm, Clock.systemUTC());
        }

        public BackupVerifier(String checksumAlgorithm, Clock clock) {
            this.checksumAlgorithm = Objects.requireNonNull(checksumAlgorithm, "checksumAlgorithm");
            this.clock = Objects.requireNonNull(clock, "clock");
        }

        /** Verifica usando o sidecar como referência. */
        public VerificationResult verify(Path archive) {
            return verify(archive, null);
        }

        /**
         * Verifica o arquivo. A referência de checksum é o sidecar; sem sidecar, usa
         * {@code expectedChecksum} (pode ser null).
         */
        public VerificationResult verify(Path archive, String expectedChecksum) {
            Objects.requireNonNull(archive, "archive");
            Instant now = clock.instant();
            List<String> errors = new ArrayList<>();

            if (!Files.isRegularFile(archive)) {
                errors.add("Arquivo de backup não encontrado: " + archive);
                return new VerificationResult(archive, false, false, errors, 0, 0, now);
            }

            long size = 0;
            try {
                size = Files.size(archive);
            } catch (IOException e) {
                errors.add("Falha ao obter tamanho: " + e.getMessage());
            }

            boolean checksumOk = verifyChecksum(archive, expectedChecksum, errors);
            long[] entries = {0};
            boolean extractable = verifyStructure(archive, entries, errors);

            VerificationResult result = new VerificationResult(archive, checksumOk, extractable, errors, size, entries[0], now);
            if (result.isValid()) {
                log.info("Backup válido: {} ({} entradas)", archive.getFileName(), entries[0]);
            } else {
                log.warn("Backup inválido: {} -> {}", archive.getFileName(), errors);
            }
            return result;
        }

        /** Digest hexadecimal do arquivo inteiro. */
        public String computeChecksum(Path archive) throws IOException {
            MessageDigest digest;
            try {
                digest = MessageDigest.getInstance(checksumAlgorithm);
            } catch (NoSuchAlgorithmException e) {
                throw new IOException("Algoritmo de checksum não suportado: " + checksumAlgorithm, e);
            }
            try (InputStream in = new DigestInputStream(Files.newInputStream(archive), digest)) {
                in.transferTo(OutputStream.nullOutputStream());
            }
            return HEX.formatHex(digest.digest());
        }

        private boolean verifyChecksum(Path archive, String expectedChecksum, List<String> errors) {
            Optional<String> reference;
            try {
                reference = ChecksumSidecar.read(archive);
            } catch (IOException e) {
                errors.add("Arquivo de checksum ilegível: " + e.getMessage());
                return false;
            }
            if (reference.isEmpty() && expectedChecksum != null && !expectedChecksum.isBlank()) {
                reference = Optional.of(expectedChecksum.trim().toLowerCase(Locale.ROOT));
            }
            if (reference.isEmpty()) {
                errors.add("Nenhum checksum de referência disponível (sidecar ausente)");
                return false;
            }
            try {
                String actual = computeChecksum(archive);
                if (!actual.equalsIgnoreCase(reference.get())) {
                    errors.add("Checksum divergente: esperado " + reference.get() + ", calculado " + actual);
                    return false;
                }
                return true;
            } catch (IOException e) {
                errors.add("Falha ao calcular checksum: " + e.getMessage());
                return false;
            }
        }

        private boolean verifyStructure(Path archive, long[] entries, List<String> errors) {
            try (TarFormat.Reader reader = TarFormat.Reader.open(archive)) {
                TarArchiveEntry entry;
                while ((entry = reader.next()) != null) {
                    entries[0]++;
                    if (entry.isFile()) {
                        long read = reader.content().transferTo(OutputStream.nullOutputStream());
                        if (read != entry.getSize()) {
                            errors.add("Entrada truncada: " + entry.getName());
                            return false;
                        }
                    }
                }
            } catch (IOException | RuntimeException e) {
                errors.add("Arquivo não extraível: " + describe(e));
                return false;
            }
            if (entries[0] == 0) {
                errors.add("Arquivo não contém entradas");
                return false;
            }
            return true;
        }

        private static String describe(Exception e) {
            String message = e.getMessage();
            return (message == null || message.isBlank()) ? e.getClass().getSimpleName() : e.getClass().getSimpleName() + ": " + message;
        }
    }
}
