package com.example.backupengine.config;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.backup.Backup.BackupConfig;
import com.example.backupengine.error.BackupErrors.ConfigException;
import com.example.backupengine.hooks.Hooks.HookCommand;
import com.example.backupengine.retention.Retention.RetentionPolicy;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Lê o arquivo JSON com as configurações de backup.
 *
 * <pre>
 * {
 *   "backups": [
 *     {
 *       "name": "documentos",
 *       "source": "/home/ana/docs",
 *       "destination": "/mnt/backup",
 *       "compression": true,
 *       "exclude_patterns": ["*.tmp", "cache"],
 *       "pre_hook": { "command": ["sh", "-c", "pg_dump ..."], "timeout_seconds": 600 },
 *       "retention": { "keep_daily": 7, "keep_weekly": 4, "keep_monthly": 6, "keep_yearly": 1, "min_backups": 3 }
 *     }
 *   ]
 * }
 * </pre>
 *
 * Caminhos relativos são resolvidos a partir do diretório do próprio arquivo.
 */
public final class BackupConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(BackupConfigLoader.class);

    private final ObjectMapper mapper;
    private final Duration defaultHookTimeout;

    public BackupConfigLoader(AppConfig appConfig) {
        this(appConfig.hookTimeout());
    }

    public BackupConfigLoader(Duration defaultHookTimeout) {
        this.defaultHookTimeout = Objects.requireNonNull(defaultHookTimeout, "defaultHookTimeout");
        this.mapper = new ObjectMapper();
        this.mapper.enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    /**
     * Carrega e valida a lista. Nomes duplicados ou campos inválidos falham com ConfigException.
     */
    public List<BackupConfig> load(Path file) throws IOException {
        if (!Files.isRegularFile(file)) {
            throw new ConfigException("Arquivo de configuração não encontrado: " + file);
        }
        ConfigFileDto dto;
        try {
            dto = mapper.readValue(file.toFile(), ConfigFileDto.class);
        } catch (JsonProcessingException e) {
            throw new ConfigException("Arquivo de configuração inválido: " + file + " (" + e.getOriginalMessage() + ")", e);
        }
        Path base = file.toAbsolutePath().getParent();

        List<BackupConfig> configs = new ArrayList<>();
        Set<String> names = new HashSet<>();
        for (BackupDto item : dto.backups != null ? dto.backups : List.<BackupDto>of()) {
            if (item == null) continue;
            BackupConfig config = toConfig(item, base);
            if (!names.add(String.valueOf(config.name()))) {
                throw new ConfigException("Configuração duplicada: " + config.name());
            }
            configs.add(config);
        }
        log.info("{} configuração(ões) de backup carregada(s) de {}", configs.size(), file);
        return configs;
    }

    private BackupConfig toConfig(BackupDto item, Path base) throws ConfigException {
        if (item.name == null || item.name.isBlank()) {
            throw new ConfigException("Configuração sem nome em " + base);
        }
        if (item.source == null || item.destination == null) {
            throw new ConfigException("[" + item.name + "] 'source' e 'destination' são obrigatórios");
        }
        BackupConfig.Builder builder = BackupConfig.builder()
                .name(item.name.trim())
                .source(base.resolve(item.source).normalize())
                .destination(base.resolve(item.destination).normalize())
                .compression(item.compression == null || item.compression)
                .retention(toPolicy(item.retention));
        if (item.excludePatterns != null) {
            for (String pattern : item.excludePatterns) {
                if (pattern != null) builder.exclude(pattern);
            }
        }
        if (item.preHook != null) builder.preHook(toHook(item.name, "pre_hook", item.preHook));
        if (item.postHook != null) builder.postHook(toHook(item.name, "post_hook", item.postHook));
        return builder.build();
    }

    private HookCommand toHook(String configName, String field, HookDto hook) throws ConfigException {
        Duration timeout = hook.timeoutSeconds != null ? Duration.ofSeconds(hook.timeoutSeconds) : defaultHookTimeout;
        try {
            return new HookCommand(hook.command != null ? hook.command : List.of(), timeout);
        } catch (IllegalArgumentException e) {
            throw new ConfigException("[" + configName + "] " + field + " inválido: " + e.getMessage(), e);
        }
    }

    private static RetentionPolicy toPolicy(RetentionDto r) throws ConfigException {
        if (r == null) {
            return RetentionPolicy.defaults();
        }
        RetentionPolicy d = RetentionPolicy.defaults();
        return new RetentionPolicy(
                r.keepDaily != null ? r.keepDaily : d.keepDaily(),
                r.keepWeekly != null ? r.keepWeekly : d.keepWeekly(),
                r.keepMonthly != null ? r.keepMonthly : d.keepMonthly(),
                r.keepYearly != null ? r.keepYearly : d.keepYearly(),
                r.minBackups != null ? r.minBackups : d.minBackups());
    }

    // ---- DTOs Jackson ----

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class ConfigFileDto {
        @JsonProperty("backups") public List<BackupDto> backups;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class BackupDto {
        @JsonProperty("name") public String name;
        @JsonProperty("source") public String source;
        @JsonProperty("destination") public String destination;
        @JsonProperty("compression") public Boolean compression;
        @JsonProperty("exclude_patterns") public List<String> excludePatterns;
        @JsonProperty("pre_hook") public HookDto preHook;
        @JsonProperty("post_hook") public HookDto postHook;
        @JsonProperty("retention") public RetentionDto retention;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class HookDto {
        @JsonProperty("command") public List<String> command;
        @JsonProperty("timeout_seconds") public Long timeoutSeconds;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    static class RetentionDto {
        @JsonProperty("keep_daily") public Integer keepDaily;
        @JsonProperty("keep_weekly") public Integer keepWeekly;
        @JsonProperty("keep_monthly") public Integer keepMonthly;
        @JsonProperty("keep_yearly") public Integer keepYearly;
        @JsonProperty("min_backups") public Integer minBackups;
    }
}
