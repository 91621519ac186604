package com.example.backupengine.retention;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.Test;

import com.example.backupengine.error.BackupErrors.ConfigException;
import com.example.backupengine.retention.Retention.KeepReason;
import com.example.backupengine.retention.Retention.RetentionDecision;
import com.example.backupengine.retention.Retention.RetentionPlanner;
import com.example.backupengine.retention.Retention.RetentionPolicy;
import com.example.backupengine.retention.Retention.Tier;
import com.example.backupengine.storage.Storage.BackupMetadata;

class RetentionPlannerTest {

    private static final Instant BASE = Instant.parse("2024-03-01T02:00:00Z");

    private final RetentionPlanner planner = new RetentionPlanner(ZoneOffset.UTC);

    private static BackupMetadata record(String id, Instant createdAt, long size) {
        return BackupMetadata.builder()
                .id(id)
                .createdAt(createdAt)
                .configName("docs")
                .archiveFilename("docs_host_" + id + ".tar.zst")
                .sizeBytes(size)
                .checksum("ab")
                .build();
    }

    private static List<BackupMetadata> consecutiveDays(int days) {
        List<BackupMetadata> records = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            records.add(record(String.format("r%02d", i), BASE.plus(i, ChronoUnit.DAYS), 100L + i));
        }
        return records;
    }

    @Test
    void keepsSevenNewestDailiesAndFreesTheRest() throws Exception {
        List<BackupMetadata> records = consecutiveDays(10);

        RetentionDecision decision = planner.plan(records, new RetentionPolicy(7, 0, 0, 0, 3));

        assertThat(decision.keep()).hasSize(7);
        assertThat(decision.delete()).extracting(BackupMetadata::id).containsExactly("r02", "r01", "r00");
        assertThat(decision.bytesToFree()).isEqualTo(100 + 101 + 102);
        assertThat(decision.floorReached()).isTrue();
        assertThat(decision.reasonsFor("r09")).containsExactly(KeepReason.DAILY);
        assertThat(decision.reasonsFor("r00")).isEmpty();
    }

    @Test
    void belowMinimumNothingIsDeleted() throws Exception {
        List<BackupMetadata> records = consecutiveDays(2);

        RetentionDecision decision = planner.plan(records, new RetentionPolicy(0, 0, 0, 0, 3));

        assertThat(decision.delete()).isEmpty();
        assertThat(decision.keep()).hasSize(2);
        assertThat(decision.floorReached()).isFalse();
    }

    @Test
    void minBackupsTopsUpWithNewestRecords() throws Exception {
        // três backups no mesmo dia: só o mais novo representa o dia
        List<BackupMetadata> records = List.of(
                record("a", BASE, 1),
                record("b", BASE.plus(1, ChronoUnit.HOURS), 1),
                record("c", BASE.plus(2, ChronoUnit.HOURS), 1),
                record("d", BASE.plus(3, ChronoUnit.HOURS), 1));

        RetentionDecision decision = planner.plan(records, new RetentionPolicy(1, 0, 0, 0, 2));

        assertThat(decision.keep()).extracting(BackupMetadata::id).containsExactly("d", "c");
        assertThat(decision.reasonsFor("d")).containsExactly(KeepReason.DAILY);
        assertThat(decision.reasonsFor("c")).containsExactly(KeepReason.MIN_BACKUPS);
        assertThat(decision.delete()).extracting(BackupMetadata::id).containsExactly("b", "a");
    }

    @Test
    void recordKeptByEarlierTierDoesNotConsumeLaterQuota() throws Exception {
        // 2024-01-31 e 2024-02-29 (mesmo ano, meses diferentes)
        BackupMetadata feb = record("feb", Instant.parse("2024-02-29T10:00:00Z"), 1);
        BackupMetadata jan = record("jan", Instant.parse("2024-01-31T10:00:00Z"), 1);

        RetentionDecision decision = planner.plan(List.of(jan, feb), new RetentionPolicy(1, 0, 1, 0, 0));

        // "feb" já é diário, então o bucket de fevereiro não gasta a vaga mensal
        assertThat(decision.keep()).extracting(BackupMetadata::id).containsExactly("feb", "jan");
        assertThat(decision.reasonsFor("feb")).containsExactlyInAnyOrder(KeepReason.DAILY, KeepReason.MONTHLY);
        assertThat(decision.reasonsFor("jan")).containsExactly(KeepReason.MONTHLY);
    }

    @Test
    void planIsDeterministicRegardlessOfInputOrder() throws Exception {
        List<BackupMetadata> records = consecutiveDays(40);
        List<BackupMetadata> shuffled = new ArrayList<>(records);
        Collections.shuffle(shuffled, new Random(7));
        RetentionPolicy policy = new RetentionPolicy(3, 2, 1, 1, 2);

        RetentionDecision first = planner.plan(records, policy);
        RetentionDecision second = planner.plan(shuffled, policy);

        assertThat(second.keep()).containsExactlyElementsOf(first.keep());
        assertThat(second.delete()).containsExactlyElementsOf(first.delete());
    }

    @Test
    void sameInstantTieBreaksByIdDescending() throws Exception {
        List<BackupMetadata> records = List.of(record("a", BASE, 1), record("b", BASE, 1));

        RetentionDecision decision = planner.plan(records, new RetentionPolicy(1, 0, 0, 0, 0));

        assertThat(decision.keep()).extracting(BackupMetadata::id).containsExactly("b");
        assertThat(decision.delete()).extracting(BackupMetadata::id).containsExactly("a");
    }

    @Test
    void weeklyBucketUsesIsoWeekBasedYear() {
        // 2024-12-30 pertence à semana 1 de 2025
        assertThat(Tier.WEEKLY.bucketOf(Instant.parse("2024-12-30T12:00:00Z"), ZoneOffset.UTC)).isEqualTo("2025-W01");
        assertThat(Tier.MONTHLY.bucketOf(Instant.parse("2024-12-30T12:00:00Z"), ZoneOffset.UTC)).isEqualTo("2024-12");
        assertThat(Tier.YEARLY.bucketOf(Instant.parse("2024-12-30T12:00:00Z"), ZoneOffset.UTC)).isEqualTo("2024");
    }

    @Test
    void bucketsFollowConfiguredZone() {
        Instant lateUtc = Instant.parse("2024-03-01T23:30:00Z");
        assertThat(Tier.DAILY.bucketOf(lateUtc, ZoneOffset.ofHours(3))).isEqualTo("2024-03-02");
        assertThat(Tier.DAILY.bucketOf(lateUtc, ZoneOffset.UTC)).isEqualTo("2024-03-01");
    }

    @Test
    void emptySnapshotWithZeroMinimumReachesFloor() throws Exception {
        RetentionDecision decision = planner.plan(List.of(), new RetentionPolicy(7, 4, 6, 1, 0));
        assertThat(decision.keep()).isEmpty();
        assertThat(decision.delete()).isEmpty();
        assertThat(decision.floorReached()).isTrue();
    }

    @Test
    void negativeQuotaIsRejected() {
        assertThatThrownBy(() -> new RetentionPolicy(-1, 0, 0, 0, 0))
                .isInstanceOf(ConfigException.class)
                .hasMessageContaining("keep_daily");
    }
}
