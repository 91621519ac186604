package com.example.backupengine.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.file.Path;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Map;

import org.junit.jupiter.api.Test;

class AppConfigTest {

    @Test
    void defaultsWhenNothingIsSet() {
        AppConfig config = AppConfig.fromMap(Map.of());

        assertThat(config.configFile()).isEqualTo(Path.of("backup-configs.json"));
        assertThat(config.compression()).isEqualTo("zstd");
        assertThat(config.zstdLevel()).isEqualTo(4);
        assertThat(config.hashAlgorithm()).isEqualTo("SHA-256");
        assertThat(config.hookTimeout()).isEqualTo(Duration.ofMinutes(5));
        assertThat(config.hostname()).isEmpty();
        assertThat(config.retentionZone()).isEqualTo(ZoneOffset.UTC);
    }

    @Test
    void numericValuesAreClampedOrFallBackToDefault() {
        AppConfig config = AppConfig.fromMap(Map.of(
                AppConfig.ZSTD_LEVEL, "99",
                AppConfig.HOOK_TIMEOUT_SECONDS, "abc"));

        assertThat(config.zstdLevel()).isEqualTo(22);
        assertThat(config.hookTimeout()).isEqualTo(Duration.ofSeconds(300));

        config.override(AppConfig.HOOK_TIMEOUT_SECONDS, "999999");
        assertThat(config.hookTimeout()).isEqualTo(Duration.ofSeconds(AppConfig.MAX_HOOK_TIMEOUT_SECONDS));
    }

    @Test
    void invalidCompressionFailsEarly() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.COMPRESSION, "lz4"));

        assertThatThrownBy(config::compression).isInstanceOf(IllegalStateException.class);
        assertThat(config.toString()).contains("compression=error:IllegalStateException");
    }

    @Test
    void overrideWinsAndCanBeRemoved() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.COMPRESSION, "zstd"));

        config.override(AppConfig.COMPRESSION, "GZIP");
        assertThat(config.compression()).isEqualTo("gzip");

        config.override(AppConfig.COMPRESSION, null);
        assertThat(config.compression()).isEqualTo("zstd");
    }

    @Test
    void retentionZoneIsParsed() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.RETENTION_ZONE, "America/Sao_Paulo"));
        assertThat(config.retentionZone()).isEqualTo(ZoneId.of("America/Sao_Paulo"));

        config.override(AppConfig.RETENTION_ZONE, "Mars/Olympus");
        assertThatThrownBy(config::retentionZone).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void blankValueCountsAsAbsent() {
        AppConfig config = AppConfig.fromMap(Map.of(AppConfig.HOSTNAME, "  "));

        assertThat(config.hostname()).isEmpty();
        assertThat(config.find(AppConfig.HOSTNAME)).isEmpty();
        assertThat(config.getOrDefault(AppConfig.HOSTNAME, "padrao")).isEqualTo("padrao");
    }
}
