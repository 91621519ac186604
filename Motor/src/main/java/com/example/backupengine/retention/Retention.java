package com.example.backupengine.retention;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.temporal.IsoFields;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.function.ToIntFunction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.error.BackupErrors.ConfigException;
import com.example.backupengine.error.BackupErrors.LockUnavailableException;
import com.example.backupengine.error.BackupErrors.RetentionViolationException;
import com.example.backupengine.storage.Storage.ArchiveLease;
import com.example.backupengine.storage.Storage.BackupMetadata;
import com.example.backupengine.storage.Storage.ChecksumSidecar;
import com.example.backupengine.storage.Storage.ConfigLock;
import com.example.backupengine.storage.Storage.LocalMetadataStore;
import com.example.backupengine.storage.Storage.MetadataStore;

/**
 * Retenção em camadas (diário, semanal, mensal, anual) com piso mínimo de backups.
 *
 * O cálculo ({@link RetentionPlanner}) é puro: recebe um snapshot dos registros e devolve a
 * decisão. A execução ({@link CleanupService}) aplica a decisão no disco.
 */
public final class Retention {

    private Retention() {}

    // ==================== POLÍTICA ====================

    /**
     * Quantos backups manter por camada, mais o piso {@code minBackups}.
     */
    public static final class RetentionPolicy {
        private final int keepDaily;
        private final int keepWeekly;
        private final int keepMonthly;
        private final int keepYearly;
        private final int minBackups;

        public RetentionPolicy(int keepDaily, int keepWeekly, int keepMonthly, int keepYearly, int minBackups)
                throws ConfigException {
            requireNonNegative("keep_daily", keepDaily);
            requireNonNegative("keep_weekly", keepWeekly);
            requireNonNegative("keep_monthly", keepMonthly);
            requireNonNegative("keep_yearly", keepYearly);
            requireNonNegative("min_backups", minBackups);
            this.keepDaily = keepDaily;
            this.keepWeekly = keepWeekly;
            this.keepMonthly = keepMonthly;
            this.keepYearly = keepYearly;
            this.minBackups = minBackups;
        }

        /** Padrão: 7 diários, 4 semanais, 6 mensais, 1 anual, mínimo 3. */
        public static RetentionPolicy defaults() {
            try {
                return new RetentionPolicy(7, 4, 6, 1, 3);
            } catch (ConfigException e) {
                throw new IllegalStateException(e);
            }
        }

        public int keepDaily() { return keepDaily; }
        public int keepWeekly() { return keepWeekly; }
        public int keepMonthly() { return keepMonthly; }
        public int keepYearly() { return keepYearly; }
        public int minBackups() { return minBackups; }

        int quota(Tier tier) {
            return tier.quota.applyAsInt(this);
        }

        private static void requireNonNegative(String field, int value) throws ConfigException {
            if (value < 0) {
                throw new ConfigException("Política de retenção inválida: " + field + " = " + value + " (deve ser >= 0)");
            }
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof RetentionPolicy)) return false;
            RetentionPolicy p = (RetentionPolicy) o;
            return keepDaily == p.keepDaily && keepWeekly == p.keepWeekly && keepMonthly == p.keepMonthly
                    && keepYearly == p.keepYearly && minBackups == p.minBackups;
        }

        @Override
        public int hashCode() {
            return Objects.hash(keepDaily, keepWeekly, keepMonthly, keepYearly, minBackups);
        }

        @Override
        public String toString() {
            return "RetentionPolicy{daily=" + keepDaily + ", weekly=" + keepWeekly + ", monthly=" + keepMonthly
                    + ", yearly=" + keepYearly + ", min=" + minBackups + "}";
        }
    }

    /** Camada de retenção; a ordem de declaração é a ordem de avaliação. */
    public enum Tier {
        DAILY(RetentionPolicy::keepDaily),
        WEEKLY(RetentionPolicy::keepWeekly),
        MONTHLY(RetentionPolicy::keepMonthly),
        YEARLY(RetentionPolicy::keepYearly);

        private final ToIntFunction<RetentionPolicy> quota;

        Tier(ToIntFunction<RetentionPolicy> quota) {
            this.quota = quota;
        }

        /** Chave do bucket ao qual o instante pertence, no fuso informado. */
        public String bucketOf(Instant instant, ZoneId zone) {
            ZonedDateTime t = instant.atZone(zone);
            switch (this) {
                case DAILY:
                    return t.toLocalDate().toString();
                case WEEKLY:
                    return t.get(IsoFields.WEEK_BASED_YEAR) + "-W" + String.format("%02d", t.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR));
                case MONTHLY:
                    return t.getYear() + "-" + String.format("%02d", t.getMonthValue());
                default:
                    return Integer.toString(t.getYear());
            }
        }
    }

    /** Motivo pelo qual um registro foi mantido. */
    public enum KeepReason { DAILY, WEEKLY, MONTHLY, YEARLY, MIN_BACKUPS }

    // ==================== DECISÃO ====================

    /**
     * Resultado do planejamento: o que fica, o que sai, e por quê.
     */
    public static final class RetentionDecision {
        private final List<BackupMetadata> keep;
        private final List<BackupMetadata> delete;
        private final Map<String, Set<KeepReason>> reasons;
        private final boolean floorReached;

        RetentionDecision(List<BackupMetadata> keep, List<BackupMetadata> delete,
                          Map<String, Set<KeepReason>> reasons, boolean floorReached) {
            this.keep = List.copyOf(keep);
            this.delete = List.copyOf(delete);
            this.reasons = Collections.unmodifiableMap(new LinkedHashMap<>(reasons));
            this.floorReached = floorReached;
        }

        /** Registros mantidos, do mais novo para o mais antigo. */
        public List<BackupMetadata> keep() { return keep; }
        /** Registros a remover, do mais novo para o mais antigo. */
        public List<BackupMetadata> delete() { return delete; }
        /** Motivos de retenção por id; vazio para registros a remover. */
        public Set<KeepReason> reasonsFor(String id) { return reasons.getOrDefault(id, Set.of()); }
        /** Falso quando não há registros suficientes para atingir min_backups. */
        public boolean floorReached() { return floorReached; }

        public long bytesToFree() {
            return delete.stream().mapToLong(BackupMetadata::sizeBytes).sum();
        }
    }

    /**
     * Planejador puro: mesmo snapshot + mesma política + mesmo fuso = mesma decisão.
     *
     * Para cada camada, percorre os registros do mais novo ao mais antigo; o primeiro registro
     * de cada bucket distinto o representa. Se ainda não está mantido, passa a ser e consome uma
     * vaga da cota; se já está mantido por outra camada, não consome. Depois, completa com os
     * mais novos até atingir min_backups.
     */
    public static final class RetentionPlanner {

        private final ZoneId zone;

        public RetentionPlanner() {
            this(ZoneOffset.UTC);
        }

        public RetentionPlanner(ZoneId zone) {
            this.zone = Objects.requireNonNull(zone, "zone");
        }

        public RetentionDecision plan(List<BackupMetadata> snapshot, RetentionPolicy policy) {
            Objects.requireNonNull(policy, "policy");
            List<BackupMetadata> records = new ArrayList<>(Objects.requireNonNull(snapshot, "snapshot"));
            records.sort(BackupMetadata.NEWEST_FIRST);

            boolean[] kept = new boolean[records.size()];
            Map<String, Set<KeepReason>> reasons = new LinkedHashMap<>();
            int keptCount = 0;

            for (Tier tier : Tier.values()) {
                int quota = policy.quota(tier);
                if (quota == 0) continue;
                Set<String> seenBuckets = new HashSet<>();
                int used = 0;
                for (int i = 0; i < records.size() && used < quota; i++) {
                    BackupMetadata record = records.get(i);
                    if (!seenBuckets.add(tier.bucketOf(record.createdAt(), zone))) {
                        continue;
                    }
                    reasons.computeIfAbsent(record.id(), k -> EnumSet.noneOf(KeepReason.class))
                            .add(KeepReason.valueOf(tier.name()));
                    if (!kept[i]) {
                        kept[i] = true;
                        keptCount++;
                        used++;
                    }
                }
            }

            for (int i = 0; i < records.size() && keptCount < policy.minBackups(); i++) {
                if (!kept[i]) {
                    kept[i] = true;
                    keptCount++;
                    reasons.computeIfAbsent(records.get(i).id(), k -> EnumSet.noneOf(KeepReason.class))
                            .add(KeepReason.MIN_BACKUPS);
                }
            }

            List<BackupMetadata> keep = new ArrayList<>();
            List<BackupMetadata> delete = new ArrayList<>();
            for (int i = 0; i < records.size(); i++) {
                (kept[i] ? keep : delete).add(records.get(i));
            }
            return new RetentionDecision(keep, delete, reasons, keptCount >= policy.minBackups());
        }
    }

    // ==================== EXECUÇÃO ====================

    /**
     * Estatísticas de uma limpeza (real ou simulada).
     */
    public static final class CleanupReport {
        private final String configName;
        private final boolean dryRun;
        private final int kept;
        private final List<BackupMetadata> deleted;
        private final List<BackupMetadata> skippedInUse;
        private final long bytesFreed;
        private final boolean floorReached;
        private final List<String> errors;

        public CleanupReport(String configName, boolean dryRun, int kept, List<BackupMetadata> deleted,
                             List<BackupMetadata> skippedInUse, long bytesFreed, boolean floorReached,
                             List<String> errors) {
            this.configName = configName;
            this.dryRun = dryRun;
            this.kept = kept;
            this.deleted = List.copyOf(deleted);
            this.skippedInUse = List.copyOf(skippedInUse);
            this.bytesFreed = bytesFreed;
            this.floorReached = floorReached;
            this.errors = List.copyOf(errors);
        }

        public String configName() { return configName; }
        public boolean dryRun() { return dryRun; }
        public int kept() { return kept; }
        /** Removidos (ou que seriam removidos, em dry-run). */
        public List<BackupMetadata> deleted() { return deleted; }
        public int deletedCount() { return deleted.size(); }
        /** Pulados porque um restore segura o lease do arquivo. */
        public List<BackupMetadata> skippedInUse() { return skippedInUse; }
        /** Bytes liberados (ou que seriam liberados, em dry-run). */
        public long bytesFreed() { return bytesFreed; }
        public boolean floorReached() { return floorReached; }
        public List<String> errors() { return errors; }
        public boolean hasErrors() { return !errors.isEmpty(); }

        @Override
        public String toString() {
            return "CleanupReport{" + configName + (dryRun ? ", dry-run" : "") + ", kept=" + kept
                    + ", deleted=" + deleted.size() + ", skipped=" + skippedInUse.size()
                    + ", bytesFreed=" + bytesFreed + ", floorReached=" + floorReached
                    + ", errors=" + errors.size() + "}";
        }
    }

    /**
     * Aplica a retenção no diretório de destino de uma configuração.
     *
     * Cada backup removido sai como uma unidade: arquivo e sidecar são renomeados para nomes
     * ocultos, o registro é apagado e só então os arquivos renomeados são removidos. Se apagar o
     * registro falhar, os renames são desfeitos.
     */
    public static final class CleanupService {

        private static final Logger log = LoggerFactory.getLogger(CleanupService.class);

        private final RetentionPlanner planner;

        public CleanupService(RetentionPlanner planner) {
            this.planner = Objects.requireNonNull(planner, "planner");
        }

        public CleanupReport cleanup(String configName, Path destination, RetentionPolicy policy, boolean dryRun)
                throws IOException {
            MetadataStore store = new LocalMetadataStore(destination);
            if (dryRun) {
                return run(configName, destination, store, policy, true);
            }
            try (ConfigLock ignored = ConfigLock.acquire(destination, configName)) {
                return run(configName, destination, store, policy, false);
            }
        }

        private CleanupReport run(String configName, Path destination, MetadataStore store,
                                  RetentionPolicy policy, boolean dryRun) throws IOException {
            List<BackupMetadata> snapshot = store.list(configName);
            RetentionDecision decision = planner.plan(snapshot, policy);
            if (!decision.floorReached()) {
                log.info("[{}] {} backups disponíveis, abaixo do mínimo de {}; nada será removido",
                        configName, snapshot.size(), policy.minBackups());
            }

            List<BackupMetadata> removed = new ArrayList<>();
            List<BackupMetadata> skipped = new ArrayList<>();
            List<String> errors = new ArrayList<>();
            long bytes = 0;

            for (BackupMetadata record : decision.delete()) {
                Path archive = destination.resolve(record.archiveFilename());
                if (ArchiveLease.isLeased(archive)) {
                    log.warn("[{}] Backup {} em uso por um restore; pulando", configName, record.id());
                    skipped.add(record);
                    continue;
                }
                if (dryRun) {
                    log.info("[{}] (dry-run) removeria {} ({} bytes)", configName, record.archiveFilename(), record.sizeBytes());
                    removed.add(record);
                    bytes += record.sizeBytes();
                    continue;
                }
                try {
                    removeUnit(destination, store, record);
                    removed.add(record);
                    bytes += record.sizeBytes();
                    log.info("[{}] Backup removido: {} ({} bytes)", configName, record.archiveFilename(), record.sizeBytes());
                } catch (IOException e) {
                    log.error("[{}] Falha ao remover backup {}: {}", configName, record.id(), e.toString());
                    errors.add(record.id() + ": " + e.getMessage());
                }
            }

            int kept = snapshot.size() - removed.size();
            return new CleanupReport(configName, dryRun, kept, removed, skipped, bytes, decision.floorReached(), errors);
        }

        /**
         * Remoção manual de um backup. Recusa se a configuração ficaria abaixo de min_backups.
         */
        public BackupMetadata delete(String configName, Path destination, String id, RetentionPolicy policy)
                throws IOException {
            MetadataStore store = new LocalMetadataStore(destination);
            try (ConfigLock ignored = ConfigLock.acquire(destination, configName)) {
                List<BackupMetadata> snapshot = store.list(configName);
                Optional<BackupMetadata> target = snapshot.stream().filter(m -> m.id().equals(id)).findFirst();
                if (target.isEmpty()) {
                    throw new ConfigException("Backup não encontrado: " + configName + "/" + id);
                }
                if (snapshot.size() - 1 < policy.minBackups()) {
                    throw new RetentionViolationException("Remover " + id + " deixaria " + configName + " com "
                            + (snapshot.size() - 1) + " backups (mínimo " + policy.minBackups() + ")");
                }
                BackupMetadata record = target.get();
                if (ArchiveLease.isLeased(destination.resolve(record.archiveFilename()))) {
                    throw new LockUnavailableException("Backup em uso por um restore: " + record.archiveFilename());
                }
                removeUnit(destination, store, record);
                log.info("[{}] Backup removido manualmente: {}", configName, record.archiveFilename());
                return record;
            }
        }

        private void removeUnit(Path destination, MetadataStore store, BackupMetadata record) throws IOException {
            Path archive = destination.resolve(record.archiveFilename());
            Path sidecar = ChecksumSidecar.pathFor(archive);
            String token = UUID.randomUUID().toString();

            Path archiveAside = null;
            Path sidecarAside = null;
            try {
                archiveAside = moveAside(archive, token);
                sidecarAside = moveAside(sidecar, token);
                store.delete(record.configName(), record.id());
            } catch (IOException e) {
                restore(sidecarAside, sidecar);
                restore(archiveAside, archive);
                throw e;
            }
            deleteAside(archiveAside);
            deleteAside(sidecarAside);
        }

        private static Path moveAside(Path file, String token) throws IOException {
            if (!Files.exists(file)) {
                return null;
            }
            Path aside = file.resolveSibling("." + file.getFileName() + ".deleting-" + token);
            Files.move(file, aside, StandardCopyOption.ATOMIC_MOVE);
            return aside;
        }

        private static void restore(Path aside, Path original) {
            if (aside == null) return;
            try {
                Files.move(aside, original, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                log.error("Falha ao desfazer remoção de {}: {}", original, e.toString());
            }
        }

        private static void deleteAside(Path aside) {
            if (aside == null) return;
            try {
                Files.deleteIfExists(aside);
            } catch (IOException e) {
                log.warn("Arquivo renomeado para remoção ficou para trás: {} ({})", aside, e.toString());
            }
        }
    }
}
