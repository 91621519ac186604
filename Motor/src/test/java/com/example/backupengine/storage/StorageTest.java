package com.example.backupengine.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.backupengine.error.BackupErrors.IntegrityException;
import com.example.backupengine.error.BackupErrors.LockUnavailableException;
import com.example.backupengine.storage.Storage.ArchiveLease;
import com.example.backupengine.storage.Storage.ChecksumSidecar;
import com.example.backupengine.storage.Storage.ConfigLock;

class StorageTest {

    @TempDir
    Path dir;

    @Test
    void sidecarUsesSha256sumLineFormat() throws IOException {
        Path archive = Files.writeString(dir.resolve("docs_h_20240101_000000.tar.zst"), "x");

        Path sidecar = ChecksumSidecar.write(archive, "ABCD");

        assertThat(sidecar.getFileName().toString()).isEqualTo("docs_h_20240101_000000.tar.zst.sha256");
        assertThat(Files.readString(sidecar, StandardCharsets.UTF_8))
                .isEqualTo("abcd  docs_h_20240101_000000.tar.zst\n");
        assertThat(ChecksumSidecar.read(archive)).hasValue("abcd");
    }

    @Test
    void missingSidecarIsEmptyAndGarbageIsAnIntegrityError() throws IOException {
        Path archive = Files.writeString(dir.resolve("a.tar"), "x");
        assertThat(ChecksumSidecar.read(archive)).isEmpty();

        Files.writeString(ChecksumSidecar.pathFor(archive), "not-a-digest  a.tar\n");
        assertThatThrownBy(() -> ChecksumSidecar.read(archive)).isInstanceOf(IntegrityException.class);
    }

    @Test
    void writeAtomicallyReplacesContentAndLeavesNoTemporaries() throws IOException {
        Path target = dir.resolve("sub/file.json");

        Storage.writeAtomically(target, "one".getBytes(StandardCharsets.UTF_8));
        Storage.writeAtomically(target, "two".getBytes(StandardCharsets.UTF_8));

        assertThat(Files.readString(target)).isEqualTo("two");
        try (Stream<Path> files = Files.list(target.getParent())) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("file.json");
        }
        assertThat(Storage.isTemporaryName(".file.json.tmp-abc")).isTrue();
        assertThat(Storage.isTemporaryName("file.json")).isFalse();
    }

    @Test
    void secondConfigLockFailsFastUntilReleased() throws IOException {
        try (ConfigLock first = ConfigLock.acquire(dir, "docs")) {
            assertThat(first.path()).isEqualTo(dir.resolve(".locks/docs.lock"));
            assertThatThrownBy(() -> ConfigLock.acquire(dir, "docs")).isInstanceOf(LockUnavailableException.class);

            // outra configuração no mesmo destino não é afetada
            try (ConfigLock other = ConfigLock.acquire(dir, "fotos")) {
                assertThat(other.path()).exists();
            }
        }
        try (ConfigLock again = ConfigLock.acquire(dir, "docs")) {
            assertThat(again.path()).exists();
        }
    }

    @Test
    void leaseMarksArchiveInUseWhileHeld() throws IOException {
        Path archive = Files.writeString(dir.resolve("a.tar"), "x");

        try (ArchiveLease lease = ArchiveLease.acquire(archive)) {
            assertThat(ArchiveLease.isLeased(archive)).isTrue();
            assertThatThrownBy(() -> ArchiveLease.acquire(archive)).isInstanceOf(LockUnavailableException.class);
        }
        assertThat(ArchiveLease.isLeased(archive)).isFalse();
        assertThat(ArchiveLease.markerFor(archive)).doesNotExist();
    }

    @Test
    void leaseOfDeadProcessIsStale() throws IOException {
        Path archive = Files.writeString(dir.resolve("a.tar"), "x");
        Files.writeString(ArchiveLease.markerFor(archive), Long.toString(Long.MAX_VALUE));

        assertThat(ArchiveLease.isLeased(archive)).isFalse();
        try (ArchiveLease lease = ArchiveLease.acquire(archive)) {
            assertThat(Files.readString(ArchiveLease.markerFor(archive)))
                    .isEqualTo(Long.toString(ProcessHandle.current().pid()));
        }
    }
}
