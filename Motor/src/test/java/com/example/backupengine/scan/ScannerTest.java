package com.example.backupengine.scan;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

import com.example.backupengine.scan.Scanner.ExclusionFilter;
import com.example.backupengine.scan.Scanner.FileMetadata;
import com.example.backupengine.scan.Scanner.ScanResult;
import com.example.backupengine.scan.Scanner.ScanService;

class ScannerTest {

    @TempDir
    Path root;

    private final ScanService service = new ScanService();

    @Test
    void listsFilesAndDirectoriesSortedByPath() throws IOException {
        Files.createDirectories(root.resolve("b/sub"));
        Files.writeString(root.resolve("b/sub/z.txt"), "zz");
        Files.writeString(root.resolve("a.txt"), "abc");
        Files.createDirectories(root.resolve("empty"));

        ScanResult result = service.scan(root, ExclusionFilter.none());

        assertThat(result.entries()).extracting(FileMetadata::normalizedPath)
                .containsExactly("a.txt", "b", "b/sub", "b/sub/z.txt", "empty");
        assertThat(result.fileCount()).isEqualTo(2);
        assertThat(result.totalBytes()).isEqualTo(5);
        assertThat(result.statistics().errors()).isZero();
    }

    @Test
    void excludesFilesByGlobAtAnyDepth() throws IOException {
        Files.createDirectories(root.resolve("logs/old"));
        Files.writeString(root.resolve("logs/old/app.log"), "x");
        Files.writeString(root.resolve("keep.txt"), "x");
        Files.writeString(root.resolve("top.log"), "x");

        ScanResult result = service.scan(root, ExclusionFilter.ofGlobs(List.of("*.log")));

        assertThat(result.entries()).extracting(FileMetadata::normalizedPath)
                .containsExactly("keep.txt", "logs", "logs/old");
        assertThat(result.statistics().filesExcludedByFilter()).isEqualTo(2);
    }

    @Test
    void excludedDirectorySkipsWholeSubtree() throws IOException {
        Files.createDirectories(root.resolve("src/node_modules/pkg"));
        Files.writeString(root.resolve("src/node_modules/pkg/index.js"), "x");
        Files.writeString(root.resolve("src/main.js"), "x");

        ScanResult result = service.scan(root, ExclusionFilter.ofGlobs(List.of("node_modules/")));

        assertThat(result.entries()).extracting(FileMetadata::normalizedPath)
                .containsExactly("src", "src/main.js");
        assertThat(result.statistics().directoriesSkippedByFilter()).isEqualTo(1);
    }

    @Test
    @DisabledOnOs(OS.WINDOWS)
    void doesNotFollowSymbolicLinks() throws IOException {
        Path outside = Files.createTempDirectory("scan-outside");
        try {
            Files.writeString(outside.resolve("secret.txt"), "x");
            Files.createSymbolicLink(root.resolve("link"), outside);
            Files.writeString(root.resolve("real.txt"), "x");

            ScanResult result = service.scan(root, ExclusionFilter.none());

            assertThat(result.entries()).extracting(FileMetadata::normalizedPath).containsExactly("real.txt");
        } finally {
            Files.deleteIfExists(outside.resolve("secret.txt"));
            Files.deleteIfExists(outside);
        }
    }

    @Test
    void invalidGlobIsRejected() {
        assertThatThrownBy(() -> ExclusionFilter.ofGlobs(List.of("[abc")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("[abc");
    }

    @Test
    void rootThatIsNotADirectoryFails() throws IOException {
        Path file = Files.writeString(root.resolve("file.txt"), "x");

        assertThatThrownBy(() -> service.scan(file, ExclusionFilter.none()))
                .isInstanceOf(IOException.class);
    }
}
