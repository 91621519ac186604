package com.example.backupengine.verify;

import static org.assertj.core.api.Assertions.assertThat;

import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.backupengine.packager.PackagerModule.PackagedArchive;
import com.example.backupengine.packager.PackagerModule.Packager;
import com.example.backupengine.packager.TarFormat;
import com.example.backupengine.scan.Scanner.ExclusionFilter;
import com.example.backupengine.scan.Scanner.ScanService;
import com.example.backupengine.storage.Storage.ChecksumSidecar;
import com.example.backupengine.verify.Verify.BackupVerifier;
import com.example.backupengine.verify.Verify.VerificationResult;

class BackupVerifierTest {

    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @TempDir
    Path work;

    private final BackupVerifier verifier = new BackupVerifier("SHA-256", Clock.fixed(NOW, ZoneOffset.UTC));
    private PackagedArchive archive;

    @BeforeEach
    void setUp() throws IOException {
        Path source = Files.createDirectories(work.resolve("docs"));
        byte[] big = new byte[256 * 1024];
        for (int i = 0; i < big.length; i++) {
            big[i] = (byte) (i * 31 + i / 7);
        }
        Files.write(source.resolve("big.bin"), big);
        Files.writeString(source.resolve("small.txt"), "conteúdo");
        Path destination = Files.createDirectories(work.resolve("out"));

        archive = new Packager("SHA-256").create(new ScanService().scan(source, ExclusionFilter.none()),
                destination.resolve("docs_h_20240601_120000.tar.zst"), TarFormat.Codec.ZSTD, () -> false);
        ChecksumSidecar.write(archive.path(), archive.checksum());
    }

    @Test
    void intactArchiveIsValid() {
        VerificationResult result = verifier.verify(archive.path());

        assertThat(result.isValid()).isTrue();
        assertThat(result.checksumOk()).isTrue();
        assertThat(result.extractable()).isTrue();
        assertThat(result.errors()).isEmpty();
        assertThat(result.entryCount()).isEqualTo(3);
        assertThat(result.sizeBytes()).isEqualTo(archive.size());
        assertThat(result.verifiedAt()).isEqualTo(NOW);
    }

    @Test
    void flippedByteBreaksChecksum() throws IOException {
        try (RandomAccessFile raf = new RandomAccessFile(archive.path().toFile(), "rw")) {
            long middle = raf.length() / 2;
            raf.seek(middle);
            int b = raf.read();
            raf.seek(middle);
            raf.write(b ^ 0xFF);
        }

        VerificationResult result = verifier.verify(archive.path());

        assertThat(result.checksumOk()).isFalse();
        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).anyMatch(e -> e.contains("Checksum divergente"));
    }

    @Test
    void truncatedArchiveIsNotExtractable() throws IOException {
        try (FileChannel channel = FileChannel.open(archive.path(), StandardOpenOption.WRITE)) {
            channel.truncate(archive.size() / 2);
        }

        VerificationResult result = verifier.verify(archive.path());

        assertThat(result.extractable()).isFalse();
        assertThat(result.checksumOk()).isFalse();
        assertThat(result.errors()).isNotEmpty();
    }

    @Test
    void suppliedDigestIsUsedWhenSidecarIsMissing() throws IOException {
        Files.delete(ChecksumSidecar.pathFor(archive.path()));

        assertThat(verifier.verify(archive.path(), archive.checksum().toUpperCase()).isValid()).isTrue();

        VerificationResult withoutReference = verifier.verify(archive.path());
        assertThat(withoutReference.checksumOk()).isFalse();
        assertThat(withoutReference.extractable()).isTrue();
        assertThat(withoutReference.errors()).anyMatch(e -> e.contains("sidecar ausente"));
    }

    @Test
    void sidecarWinsOverSuppliedDigest() {
        assertThat(verifier.verify(archive.path(), "00ff").isValid()).isTrue();
    }

    @Test
    void missingArchiveIsReportedNotThrown() {
        VerificationResult result = verifier.verify(work.resolve("nope.tar.zst"));

        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).hasSize(1).allMatch(e -> e.contains("não encontrado"));
    }

    @Test
    void garbageFileIsNotExtractable() throws IOException {
        Path junk = Files.write(work.resolve("junk.tar"), new byte[]{1, 2, 3, 4, 5, 6, 7, 8, 9});

        VerificationResult result = verifier.verify(junk, "aa");

        assertThat(result.extractable()).isFalse();
    }
}
