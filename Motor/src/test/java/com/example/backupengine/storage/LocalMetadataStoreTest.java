package com.example.backupengine.storage;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.example.backupengine.storage.Storage.BackupMetadata;
import com.example.backupengine.storage.Storage.LocalMetadataStore;

class LocalMetadataStoreTest {

    @TempDir
    Path destination;

    private static BackupMetadata record(String config, String id, String createdAt) {
        return BackupMetadata.builder()
                .id(id)
                .createdAt(Instant.parse(createdAt))
                .configName(config)
                .archiveFilename(config + "_host_" + id + ".tar.zst")
                .sizeBytes(1234)
                .checksum("ABCDEF01")
                .hostname("host")
                .sourcePath("/data/" + config)
                .filesCount(3)
                .compression("zstd")
                .build();
    }

    @Test
    void appendedRecordsAreListedNewestFirst() throws IOException {
        LocalMetadataStore store = new LocalMetadataStore(destination);
        store.append(record("docs", "a", "2024-01-01T10:00:00Z"));
        store.append(record("docs", "c", "2024-01-03T10:00:00Z"));
        store.append(record("docs", "b", "2024-01-02T10:00:00Z"));
        store.append(record("fotos", "x", "2024-01-04T10:00:00Z"));

        assertThat(store.list("docs")).extracting(BackupMetadata::id).containsExactly("c", "b", "a");
        assertThat(store.listAll()).extracting(BackupMetadata::id).containsExactly("x", "c", "b", "a");
        assertThat(store.list("unknown")).isEmpty();
    }

    @Test
    void recordSurvivesReopenWithAllFields() throws IOException {
        new LocalMetadataStore(destination).append(record("docs", "id-1", "2024-05-06T07:08:09Z"));

        BackupMetadata read = new LocalMetadataStore(destination).find("docs", "id-1").orElseThrow();

        assertThat(read.createdAt()).isEqualTo(Instant.parse("2024-05-06T07:08:09Z"));
        assertThat(read.archiveFilename()).isEqualTo("docs_host_id-1.tar.zst");
        assertThat(read.sizeBytes()).isEqualTo(1234);
        assertThat(read.checksum()).isEqualTo("ABCDEF01");
        assertThat(read.checksumAlgorithm()).isEqualTo("SHA-256");
        assertThat(read.hostname()).isEqualTo("host");
        assertThat(read.filesCount()).isEqualTo(3);
        assertThat(read.compression()).isEqualTo("zstd");

        String json = Files.readString(destination.resolve(".metadata/docs/id-1.json"));
        assertThat(json).contains("\"created_at\" : \"2024-05-06T07:08:09Z\"", "\"archive_filename\"");
    }

    @Test
    void duplicateIdIsRejected() throws IOException {
        LocalMetadataStore store = new LocalMetadataStore(destination);
        store.append(record("docs", "a", "2024-01-01T10:00:00Z"));

        assertThatThrownBy(() -> store.append(record("docs", "a", "2024-01-02T10:00:00Z")))
                .isInstanceOf(FileAlreadyExistsException.class);
    }

    @Test
    void deleteRemovesExactlyOneRecordAndIsIdempotent() throws IOException {
        LocalMetadataStore store = new LocalMetadataStore(destination);
        store.append(record("docs", "a", "2024-01-01T10:00:00Z"));
        store.append(record("docs", "b", "2024-01-02T10:00:00Z"));

        assertThat(store.delete("docs", "a")).isTrue();
        assertThat(store.delete("docs", "a")).isFalse();
        assertThat(store.list("docs")).extracting(BackupMetadata::id).containsExactly("b");
    }

    @Test
    void unreadableAndTemporaryFilesAreIgnored() throws IOException {
        LocalMetadataStore store = new LocalMetadataStore(destination);
        store.append(record("docs", "ok", "2024-01-01T10:00:00Z"));
        Path dir = destination.resolve(".metadata/docs");
        Files.writeString(dir.resolve("broken.json"), "{ not json");
        Files.writeString(dir.resolve(".x.json.tmp-123.json"), "{}");
        Files.writeString(dir.resolve("nodate.json"), "{\"id\":\"nodate\",\"config_name\":\"docs\"}");

        List<BackupMetadata> records = store.list("docs");

        assertThat(records).extracting(BackupMetadata::id).containsExactly("ok");
    }

    @Test
    void unknownFieldsAreTolerated() throws IOException {
        Path dir = Files.createDirectories(destination.resolve(".metadata/docs"));
        Files.writeString(dir.resolve("n.json"), "{\"id\":\"n\",\"created_at\":\"2024-01-01T00:00:00Z\","
                + "\"config_name\":\"docs\",\"archive_filename\":\"f.tar\",\"size_bytes\":5,"
                + "\"checksum\":\"aa\",\"future_field\":true}");

        assertThat(new LocalMetadataStore(destination).find("docs", "n"))
                .hasValueSatisfying(m -> assertThat(m.sizeBytes()).isEqualTo(5));
    }

    @Test
    void pathTraversalInIdentifiersIsRejected() {
        LocalMetadataStore store = new LocalMetadataStore(destination);

        assertThatThrownBy(() -> store.list("../etc")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.find("docs", "..")).isInstanceOf(IllegalArgumentException.class);
    }
}
