package com.example.backupengine.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.backupengine.error.BackupErrors.ConfigException;
import com.example.backupengine.error.BackupErrors.LockUnavailableException;
import com.example.backupengine.error.BackupErrors.RetentionViolationException;
import com.example.backupengine.retention.Retention.CleanupReport;
import com.example.backupengine.retention.Retention.CleanupService;
import com.example.backupengine.retention.Retention.RetentionPlanner;
import com.example.backupengine.retention.Retention.RetentionPolicy;
import com.example.backupengine.storage.Storage.ArchiveLease;
import com.example.backupengine.storage.Storage.BackupMetadata;
import com.example.backupengine.storage.Storage.ChecksumSidecar;
import com.example.backupengine.storage.Storage.ConfigLock;
import com.example.backupengine.storage.Storage.LocalMetadataStore;

class CleanupServiceTest {

    private static final Instant BASE = Instant.parse("2024-04-01T03:00:00Z");

    @TempDir
    Path destination;

    private final CleanupService service = new CleanupService(new RetentionPlanner(ZoneOffset.UTC));
    private LocalMetadataStore store;
    private final List<BackupMetadata> records = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        store = new LocalMetadataStore(destination);
        for (int day = 0; day < 10; day++) {
            String id = String.format("id-%02d", day);
            String name = String.format("docs_h_202404%02d_030000.tar.zst", day + 1);
            Path archive = Files.write(destination.resolve(name), new byte[100 + day]);
            ChecksumSidecar.write(archive, "abcd");
            BackupMetadata record = BackupMetadata.builder()
                    .id(id)
                    .createdAt(BASE.plus(day, ChronoUnit.DAYS))
                    .configName("docs")
                    .archiveFilename(name)
                    .sizeBytes(100 + day)
                    .checksum("abcd")
                    .build();
            store.append(record);
            records.add(record);
        }
    }

    private List<String> visibleFiles() throws IOException {
        try (Stream<Path> files = Files.list(destination)) {
            return files.map(p -> p.getFileName().toString())
                    .filter(n -> !n.startsWith("."))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    @Test
    void dryRunReportsWithoutTouchingDisk() throws IOException {
        List<String> before = visibleFiles();

        CleanupReport report = service.cleanup("docs", destination, new RetentionPolicy(7, 0, 0, 0, 3), true);

        assertThat(report.dryRun()).isTrue();
        assertThat(report.deletedCount()).isEqualTo(3);
        assertThat(report.kept()).isEqualTo(7);
        assertThat(report.bytesFreed()).isEqualTo(100 + 101 + 102);
        assertThat(visibleFiles()).isEqualTo(before);
        assertThat(store.list("docs")).hasSize(10);
    }

    @Test
    void executeRemovesArchiveSidecarAndRecordAsAUnit() throws IOException {
        CleanupReport report = service.cleanup("docs", destination, new RetentionPolicy(7, 0, 0, 0, 3), false);

        assertThat(report.hasErrors()).isFalse();
        assertThat(report.deleted()).extracting(BackupMetadata::id).containsExactly("id-02", "id-01", "id-00");
        assertThat(report.bytesFreed()).isEqualTo(303);
        assertThat(store.list("docs")).hasSize(7);
        assertThat(visibleFiles()).hasSize(14)
                .doesNotContain("docs_h_20240401_030000.tar.zst", "docs_h_20240401_030000.tar.zst.sha256");
        try (Stream<Path> files = Files.list(destination)) {
            assertThat(files.map(p -> p.getFileName().toString())).noneMatch(n -> n.contains(".deleting-"));
        }
    }

    @Test
    void cleanupIsIdempotent() throws IOException {
        RetentionPolicy policy = new RetentionPolicy(7, 0, 0, 0, 3);
        service.cleanup("docs", destination, policy, false);

        CleanupReport second = service.cleanup("docs", destination, policy, false);

        assertThat(second.deletedCount()).isZero();
        assertThat(second.kept()).isEqualTo(7);
    }

    @Test
    void archiveLeasedByRestoreIsSkipped() throws IOException {
        Path oldest = destination.resolve(records.get(0).archiveFilename());

        try (ArchiveLease lease = ArchiveLease.acquire(oldest)) {
            CleanupReport report = service.cleanup("docs", destination, new RetentionPolicy(7, 0, 0, 0, 3), false);

            assertThat(report.skippedInUse()).extracting(BackupMetadata::id).containsExactly("id-00");
            assertThat(report.deleted()).extracting(BackupMetadata::id).containsExactly("id-02", "id-01");
            assertThat(oldest).exists();
        }
        assertThat(store.find("docs", "id-00")).isPresent();
    }

    @Test
    void executeWhileBackupHoldsLockFailsFast() throws IOException {
        try (ConfigLock lock = ConfigLock.acquire(destination, "docs")) {
            assertThatThrownBy(() -> service.cleanup("docs", destination, RetentionPolicy.defaults(), false))
                    .isInstanceOf(LockUnavailableException.class);

            // dry-run não precisa do lock
            assertThat(service.cleanup("docs", destination, RetentionPolicy.defaults(), true).dryRun()).isTrue();
        }
    }

    @Test
    void manualDeleteRespectsMinimum() throws IOException {
        RetentionPolicy policy = new RetentionPolicy(0, 0, 0, 0, 10);

        assertThatThrownBy(() -> service.delete("docs", destination, "id-05", policy))
                .isInstanceOf(RetentionViolationException.class);
        assertThat(store.list("docs")).hasSize(10);

        BackupMetadata removed = service.delete("docs", destination, "id-05", new RetentionPolicy(0, 0, 0, 0, 9));

        assertThat(removed.id()).isEqualTo("id-05");
        assertThat(destination.resolve(removed.archiveFilename())).doesNotExist();
        assertThat(ChecksumSidecar.pathFor(destination.resolve(removed.archiveFilename()))).doesNotExist();
        assertThat(store.find("docs", "id-05")).isEmpty();
    }

    @Test
    void manualDeleteOfUnknownIdIsAConfigError() {
        assertThatThrownBy(() -> service.delete("docs", destination, "nope", RetentionPolicy.defaults()))
                .isInstanceOf(ConfigException.class);
    }

    @Test
    void missingArchiveFileStillDropsRecord() throws IOException {
        Files.delete(destination.resolve(records.get(0).archiveFilename()));

        CleanupReport report = service.cleanup("docs", destination, new RetentionPolicy(7, 0, 0, 0, 3), false);

        assertThat(report.deletedCount()).isEqualTo(3);
        assertThat(store.find("docs", "id-00")).isEmpty();
    }
}
