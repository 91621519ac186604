package com.example.backupengine;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.backup.Backup.BackupConfig;
import com.example.backupengine.backup.Backup.BackupCoordinator;
import com.example.backupengine.backup.Backup.BackupJob;
import com.example.backupengine.config.AppConfig;
import com.example.backupengine.error.BackupErrors.ConfigException;
import com.example.backupengine.hooks.Hooks.HookRunner;
import com.example.backupengine.packager.PackagerModule.ArchiveNaming;
import com.example.backupengine.packager.PackagerModule.Packager;
import com.example.backupengine.restore.Restore.RestoreExecutor;
import com.example.backupengine.restore.Restore.RestoreOptions;
import com.example.backupengine.restore.Restore.RestoreOutcome;
import com.example.backupengine.retention.Retention.CleanupReport;
import com.example.backupengine.retention.Retention.CleanupService;
import com.example.backupengine.retention.Retention.RetentionPlanner;
import com.example.backupengine.scan.Scanner.ScanService;
import com.example.backupengine.storage.Storage.BackupMetadata;
import com.example.backupengine.storage.Storage.LocalMetadataStore;
import com.example.backupengine.verify.Verify.BackupVerifier;
import com.example.backupengine.verify.Verify.VerificationResult;

/**
 * Fachada do motor: as operações de ciclo de vida de backup sobre um registro de configurações.
 *
 * create/verify/restore nunca lançam por falha da operação: o erro volta dentro do objeto de
 * resultado. list/cleanup/delete lançam as exceções tipadas de {@code BackupErrors}.
 */
public final class BackupEngine {

    private static final Logger log = LoggerFactory.getLogger(BackupEngine.class);

    private final Map<String, BackupConfig> configs = new ConcurrentHashMap<>();
    private final Clock clock;
    private final BackupCoordinator coordinator;
    private final CleanupService cleanupService;
    private final BackupVerifier verifier;
    private final RestoreExecutor restoreExecutor;

    public BackupEngine(AppConfig appConfig) {
        this(appConfig, Clock.systemUTC());
    }

    public BackupEngine(AppConfig appConfig, Clock clock) {
        Objects.requireNonNull(appConfig, "appConfig");
        this.clock = Objects.requireNonNull(clock, "clock");
        String hostname = appConfig.hostname().orElseGet(ArchiveNaming::localHostname);
        this.verifier = new BackupVerifier(appConfig.hashAlgorithm(), clock);
        this.coordinator = new BackupCoordinator(
                new ScanService(),
                new Packager(appConfig.zstdLevel(), appConfig.hashAlgorithm()),
                new HookRunner(),
                clock,
                hostname,
                appConfig.compression());
        this.cleanupService = new CleanupService(new RetentionPlanner(appConfig.retentionZone()));
        this.restoreExecutor = new RestoreExecutor(verifier);
    }

    // ---------------- Registro de configurações ----------------

    /**
     * Registra uma configuração. Registrar de novo a mesma definição é permitido; reutilizar o
     * nome com outra definição é erro.
     */
    public void register(BackupConfig config) throws ConfigException {
        Objects.requireNonNull(config, "config");
        config.validateName();
        BackupConfig previous = configs.putIfAbsent(config.name(), config);
        if (previous != null && !previous.equals(config)) {
            throw new ConfigException("Já existe outra configuração com o nome " + config.name());
        }
    }

    public void registerAll(Collection<BackupConfig> all) throws ConfigException {
        for (BackupConfig config : all) {
            register(config);
        }
    }

    public Optional<BackupConfig> config(String name) {
        return Optional.ofNullable(name).map(configs::get);
    }

    public List<BackupConfig> configs() {
        return List.copyOf(configs.values());
    }

    private BackupConfig requireConfig(String name) throws ConfigException {
        return config(name).orElseThrow(() -> new ConfigException("Configuração desconhecida: " + name));
    }

    // ---------------- Operações ----------------

    /** Cria um backup da configuração (registrando-a, se ainda não estiver). */
    public BackupJob create(BackupConfig config) {
        Objects.requireNonNull(config, "config");
        try {
            register(config);
        } catch (ConfigException e) {
            log.error("Configuração rejeitada: {}", e.getMessage());
            return BackupJob.pending(UUID.randomUUID().toString(), config.name(), clock.instant())
                    .failed(e, clock.instant());
        }
        return coordinator.run(config);
    }

    public BackupJob create(String configName) throws ConfigException {
        return coordinator.run(requireConfig(configName));
    }

    /**
     * Backups registrados, do mais novo para o mais antigo. Com {@code configName} nulo, lista
     * todos os destinos conhecidos.
     */
    public List<BackupMetadata> list(String configName) throws IOException {
        if (configName != null) {
            BackupConfig config = requireConfig(configName);
            return new LocalMetadataStore(config.destination()).list(configName);
        }
        Set<Path> destinations = new LinkedHashSet<>();
        configs.values().forEach(c -> destinations.add(c.destination().toAbsolutePath().normalize()));
        List<BackupMetadata> all = new ArrayList<>();
        for (Path destination : destinations) {
            all.addAll(new LocalMetadataStore(destination).listAll());
        }
        all.sort(BackupMetadata.NEWEST_FIRST);
        return all;
    }

    public CleanupReport cleanup(String configName, boolean dryRun) throws IOException {
        BackupConfig config = requireConfig(configName);
        CleanupReport report = cleanupService.cleanup(configName, config.destination(), config.retention(), dryRun);
        log.info("Limpeza {}: {}", configName, report);
        return report;
    }

    public VerificationResult verify(Path archive) {
        return verifier.verify(archive);
    }

    /** Verifica todos os backups de uma configuração, indexados por id. */
    public Map<String, VerificationResult> verifyAll(String configName) throws IOException {
        BackupConfig config = requireConfig(configName);
        Map<String, VerificationResult> results = new LinkedHashMap<>();
        for (BackupMetadata record : new LocalMetadataStore(config.destination()).list(configName)) {
            Path archive = config.destination().resolve(record.archiveFilename());
            results.put(record.id(), verifier.verify(archive, record.checksum()));
        }
        long invalid = results.values().stream().filter(r -> !r.isValid()).count();
        log.info("Verificação de {}: {} backup(s), {} inválido(s)", configName, results.size(), invalid);
        return results;
    }

    public RestoreOutcome restore(Path archive, Path destination, boolean overwrite, boolean bestEffort) {
        return restore(archive, destination, RestoreOptions.builder().overwrite(overwrite).bestEffort(bestEffort).build());
    }

    public RestoreOutcome restore(Path archive, Path destination, RestoreOptions options) {
        try {
            return restoreExecutor.restore(archive, destination, options);
        } catch (IOException | RuntimeException e) {
            log.error("Restore de {} falhou: {}", archive, e.toString());
            return RestoreOutcome.failed(archive, destination, e);
        }
    }

    /**
     * Remove manualmente um backup (arquivo, sidecar e registro).
     *
     * @throws com.example.backupengine.error.BackupErrors.RetentionViolationException se a
     *         configuração ficaria abaixo de min_backups
     */
    public BackupMetadata delete(String configName, String id) throws IOException {
        BackupConfig config = requireConfig(configName);
        return cleanupService.delete(configName, config.destination(), id, config.retention());
    }

    /** Cancela o backup e o restore em andamento, se houver. */
    public void requestCancel() {
        coordinator.requestCancel();
        restoreExecutor.requestCancel();
    }
}
