package com.example.backupengine.config;

import io.github.cdimascio.dotenv.Dotenv;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * AppConfig
 * ----------
 * Responsável por carregar, validar e expor configurações do motor de backup.
 *
 * PRINCÍPIOS:
 * - Falhar cedo (validar assim que possível).
 * - Evitar "strings mágicas" (constantes centralizadas).
 * - Precedência previsível: System properties > variáveis de ambiente > .env.
 * - Métodos tipados com limites (int/long/segundos) para evitar "foot-guns".
 *
 * NOTAS:
 * - Usa Dotenv apenas como *última* fonte, preservando prioridade do ambiente.
 * - Valores numéricos fora da faixa são grampeados; valores não numéricos caem no padrão.
 */
public final class AppConfig {

    // ======= CHAVES DE CONFIGURAÇÃO =======

    /** Arquivo JSON com a lista de configurações de backup. */
    public static final String CONFIG_FILE = "BACKUP_CONFIG_FILE";
    /** Codec de compressão quando a configuração pede compressão: "zstd" (padrão) ou "gzip". */
    public static final String COMPRESSION = "BACKUP_COMPRESSION";
    /** Nível do Zstd (1..22). Padrão 4 (bom equilíbrio). */
    public static final String ZSTD_LEVEL = "BACKUP_ZSTD_LEVEL";
    /** Algoritmo de hash do arquivo lateral (ex.: SHA-256). */
    public static final String HASH_ALGORITHM = "BACKUP_HASH_ALGORITHM";
    /** Timeout padrão (segundos) dos hooks pre/post. Padrão 300 (5 min). */
    public static final String HOOK_TIMEOUT_SECONDS = "BACKUP_HOOK_TIMEOUT_SECONDS";
    /** Nome do host gravado no nome do arquivo; padrão é o hostname da máquina. */
    public static final String HOSTNAME = "BACKUP_HOSTNAME";
    /** Fuso usado para classificar backups em dia/semana/mês/ano. Padrão UTC. */
    public static final String RETENTION_ZONE = "BACKUP_RETENTION_ZONE";

    /** Limite superior aceito para timeout de hook (24h). */
    public static final long MAX_HOOK_TIMEOUT_SECONDS = 86_400L;

    // ======= ARMAZENAMENTO INTERNO =======

    /**
     * Mapa de overrides em runtime (ex.: testes). Tem precedência sobre qualquer fonte.
     */
    private final ConcurrentHashMap<String, String> overrides = new ConcurrentHashMap<>();

    /** Valores efetivos carregados (System properties > ENV > .env). */
    private final ConcurrentHashMap<String, String> values;

    private AppConfig(Map<String, String> values) {
        this.values = new ConcurrentHashMap<>(values);
    }

    /**
     * Carrega configurações de três fontes, com a seguinte precedência:
     * 1) System properties (java -Dchave=valor)
     * 2) Variáveis de ambiente (System.getenv)
     * 3) Arquivo .env (se existir)
     */
    public static AppConfig load() {
        Dotenv dotenv = Dotenv.configure()
                .ignoreIfMissing()
                .load();

        Map<String, String> map = new ConcurrentHashMap<>();

        // 1) .env preenche a base
        dotenv.entries().forEach(e -> map.put(e.getKey(), e.getValue()));

        // 2) Variáveis de ambiente sobrescrevem o .env
        System.getenv().forEach(map::put);

        // 3) System properties têm a última palavra
        System.getProperties().forEach((k, v) -> {
            if (k != null && v != null) {
                map.put(String.valueOf(k), String.valueOf(v));
            }
        });

        return new AppConfig(map);
    }

    /**
     * Útil para testes: cria AppConfig a partir de um Map já resolvido.
     */
    public static AppConfig fromMap(Map<String, String> values) {
        return new AppConfig(values);
    }

    // ======= API BÁSICA DE ACESSO =======

    /**
     * Busca valor (overrides > values) e devolve Optional sem brancos.
     */
    public Optional<String> find(String key) {
        Objects.requireNonNull(key, "key");
        String override = overrides.get(key);
        if (override != null) {
            return Optional.of(override);
        }
        String value = values.get(key);
        return value != null && !value.isBlank() ? Optional.of(value.trim()) : Optional.empty();
    }

    /**
     * Busca valor com padrão; evita null/blank.
     */
    public String getOrDefault(String key, String defaultValue) {
        return find(key).orElse(defaultValue);
    }

    /**
     * Seta/remove override em runtime. Se value==null, remove o override.
     */
    public void override(String key, String value) {
        if (value == null) {
            overrides.remove(key);
        } else {
            overrides.put(key, value);
        }
    }

    // ======= GETTERS ESPECÍFICOS (COM VALIDAÇÃO) =======

    /**
     * Caminho do arquivo de configurações de backup. Padrão: ./backup-configs.json
     */
    public Path configFile() {
        return Path.of(getOrDefault(CONFIG_FILE, "backup-configs.json"));
    }

    /**
     * Codec de compressão: "zstd" (padrão) ou "gzip". Qualquer outro valor falha cedo.
     */
    public String compression() {
        String v = getOrDefault(COMPRESSION, "zstd").trim().toLowerCase(Locale.ROOT);
        if (!v.equals("zstd") && !v.equals("gzip")) {
            throw new IllegalStateException("BACKUP_COMPRESSION inválido: use 'zstd' ou 'gzip'");
        }
        return v;
    }

    /**
     * Nível de compressão Zstd: 1..22. Padrão 4.
     */
    public int zstdLevel() {
        return intConfig(ZSTD_LEVEL, 4, 1, 22);
    }

    /**
     * Algoritmo de hash para o checksum do arquivo (ex.: "SHA-256").
     */
    public String hashAlgorithm() {
        return getOrDefault(HASH_ALGORITHM, "SHA-256");
    }

    /**
     * Timeout padrão dos hooks. Limites: [1, 86400] segundos. Padrão 300.
     */
    public Duration hookTimeout() {
        return Duration.ofSeconds(longConfig(HOOK_TIMEOUT_SECONDS, 300, 1, MAX_HOOK_TIMEOUT_SECONDS));
    }

    /**
     * Hostname configurado, se houver. Quem chama decide o fallback.
     */
    public Optional<String> hostname() {
        return find(HOSTNAME);
    }

    /**
     * Fuso para os buckets de retenção. Valor inválido falha cedo.
     */
    public ZoneId retentionZone() {
        Optional<String> raw = find(RETENTION_ZONE);
        if (raw.isEmpty()) {
            return ZoneOffset.UTC;
        }
        try {
            return ZoneId.of(raw.get());
        } catch (DateTimeException e) {
            throw new IllegalStateException("BACKUP_RETENTION_ZONE inválido: " + raw.get(), e);
        }
    }

    // ======= HELPERS TIPADOS =======

    /** Parser long com faixa [min, max]; se inválido, retorna default. */
    private long longConfig(String key, long def, long min, long max) {
        String raw = getOrDefault(key, Long.toString(def));
        try {
            long v = Long.parseLong(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** Parser int com faixa [min, max]; se inválido, retorna default. */
    private int intConfig(String key, int def, int min, int max) {
        String raw = getOrDefault(key, Integer.toString(def));
        try {
            int v = Integer.parseInt(raw.trim());
            if (v < min) return min;
            if (v > max) return max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }

    // ======= LOGGING SEGURO =======

    /**
     * Representação para logs/diagnóstico. Usa safe() para não lançar caso algum valor seja inválido.
     */
    @Override
    public String toString() {
        return "AppConfig{" +
                "configFile=" + configFile() +
                ", compression=" + safe(this::compression) +
                ", zstd=" + zstdLevel() +
                ", hash=" + hashAlgorithm() +
                ", hookTimeout=" + hookTimeout().getSeconds() + "s" +
                ", hostname=" + hostname().orElse("auto") +
                ", zone=" + safe(() -> retentionZone().getId()) +
                "}";
    }

    /** Helper para não explodir toString() caso getters lancem. */
    private static String safe(SupplierLike supplier) {
        try { return supplier.get(); } catch (RuntimeException e) { return "error:" + e.getClass().getSimpleName(); }
    }

    @FunctionalInterface
    private interface SupplierLike { String get(); }
}
