package com.example.backupengine.restore;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.LinkOption;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.nio.file.attribute.PosixFilePermission;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;
import java.util.regex.Pattern;
import java.util.stream.Stream;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.error.BackupErrors.BackupException;
import com.example.backupengine.error.BackupErrors.ErrorDetail;
import com.example.backupengine.error.BackupErrors.IntegrityException;
import com.example.backupengine.error.BackupErrors.UnsafeEntryException;
import com.example.backupengine.packager.TarFormat;
import com.example.backupengine.storage.Storage.ArchiveLease;
import com.example.backupengine.storage.Storage.ChecksumSidecar;
import com.example.backupengine.verify.Verify.BackupVerifier;

/**
 * Agrega as classes do fluxo de restauração.
 * <p>
 * Inclui:
 * 1. Opções e resultado (DTOs imutáveis).
 * 2. Executor: valida todas as entradas, extrai para staging e move para o destino.
 */
public final class Restore {

    private Restore() {}

    // ==================================================================================
    // DTOs (Data Transfer Objects) - Imutáveis
    // ==================================================================================

    /** Opções de restauração. */
    public static final class RestoreOptions {
        private final boolean overwrite;
        private final boolean bestEffort;
        private final boolean verifyChecksum;

        private RestoreOptions(Builder b) {
            this.overwrite = b.overwrite;
            this.bestEffort = b.bestEffort;
            this.verifyChecksum = b.verifyChecksum;
        }

        /** Estrito, sem sobrescrita, conferindo o checksum quando houver sidecar. */
        public static RestoreOptions defaults() {
            return builder().build();
        }

        public static Builder builder() {
            return new Builder();
        }

        public boolean overwrite() { return overwrite; }
        public boolean bestEffort() { return bestEffort; }
        public boolean verifyChecksum() { return verifyChecksum; }

        public static final class Builder {
            private boolean overwrite = false;
            private boolean bestEffort = false;
            private boolean verifyChecksum = true;

            public Builder overwrite(boolean v) { this.overwrite = v; return this; }
            public Builder bestEffort(boolean v) { this.bestEffort = v; return this; }
            public Builder verifyChecksum(boolean v) { this.verifyChecksum = v; return this; }

            public RestoreOptions build() {
                return new RestoreOptions(this);
            }
        }
    }

    /** Entrada recusada por motivo de segurança (modo best-effort). */
    public static final class SkippedEntry {
        private final String name;
        private final String reason;

        public SkippedEntry(String name, String reason) {
            this.name = name;
            this.reason = reason;
        }

        public String name() { return name; }
        public String reason() { return reason; }

        @Override
        public String toString() {
            return name + " (" + reason + ")";
        }
    }

    /** Resultado de uma restauração. */
    public static final class RestoreOutcome {
        private final Path archive;
        private final Path destination;
        private final boolean success;
        private final long entriesWritten;
        private final long bytesWritten;
        private final List<SkippedEntry> skipped;
        private final ErrorDetail error;

        private RestoreOutcome(Path archive, Path destination, boolean success, long entriesWritten,
                               long bytesWritten, List<SkippedEntry> skipped, ErrorDetail error) {
            this.archive = archive;
            this.destination = destination;
            this.success = success;
            this.entriesWritten = entriesWritten;
            this.bytesWritten = bytesWritten;
            this.skipped = Collections.unmodifiableList(List.copyOf(skipped));
            this.error = error;
        }

        public static RestoreOutcome succeeded(Path archive, Path destination, long entries, long bytes,
                                               List<SkippedEntry> skipped) {
            return new RestoreOutcome(archive, destination, true, entries, bytes, skipped, null);
        }

        public static RestoreOutcome failed(Path archive, Path destination, Throwable error) {
            return new RestoreOutcome(archive, destination, false, 0, 0, List.of(), ErrorDetail.of(error));
        }

        public Path archive() { return archive; }
        public Path destination() { return destination; }
        public boolean success() { return success; }
        public long entriesWritten() { return entriesWritten; }
        public long bytesWritten() { return bytesWritten; }
        public List<SkippedEntry> skipped() { return skipped; }
        public Optional<ErrorDetail> error() { return Optional.ofNullable(error); }
    }

    // ==================================================================================
    // EXECUTOR
    // ==================================================================================

    /**
     * Restaura um arquivo tar em um diretório.
     *
     * Passo 1 lê o arquivo inteiro sem gravar nada: valida cada entrada e detecta conflitos.
     * Passo 2 extrai as entradas aceitas para um staging oculto dentro do destino.
     * Passo 3 move do staging para o lugar final. Qualquer falha remove o staging e o que esta
     * execução criou no destino.
     */
    public static final class RestoreExecutor {

        private static final Logger log = LoggerFactory.getLogger(RestoreExecutor.class);
        private static final Pattern WINDOWS_ABSOLUTE = Pattern.compile("^[A-Za-z]:.*");
        private static final String STAGING_PREFIX = ".restore-staging-";

        private final BackupVerifier verifier;
        private final Set<AtomicBoolean> running = ConcurrentHashMap.newKeySet();

        public RestoreExecutor(BackupVerifier verifier) {
            this.verifier = Objects.requireNonNull(verifier, "verifier");
        }

        /** Solicita cancelamento dos restores em andamento; cada um para na próxima entrada e limpa o que criou. */
        public void requestCancel() {
            running.forEach(token -> token.set(true));
        }

        public RestoreOutcome restore(Path archive, Path destination, RestoreOptions options) throws IOException {
            return restore(archive, destination, options, () -> false);
        }

        /**
         * Como {@link #restore(Path, Path, RestoreOptions)}, mas também para quando {@code cancelled}
         * passar a responder verdadeiro.
         */
        public RestoreOutcome restore(Path archive, Path destination, RestoreOptions options,
                                      BooleanSupplier cancelled) throws IOException {
            Objects.requireNonNull(archive, "archive");
            Objects.requireNonNull(destination, "destination");
            Objects.requireNonNull(options, "options");
            Objects.requireNonNull(cancelled, "cancelled");
            AtomicBoolean token = new AtomicBoolean(false);
            running.add(token);
            try {
                return run(archive, destination, options, () -> token.get() || cancelled.getAsBoolean());
            } finally {
                running.remove(token);
            }
        }

        private RestoreOutcome run(Path archive, Path destination, RestoreOptions options,
                                   BooleanSupplier cancelled) throws IOException {
            if (!Files.isRegularFile(archive)) {
                throw new NoSuchFileException(archive.toString(), null, "Arquivo de backup não encontrado");
            }
            if (Files.exists(destination) && !Files.isDirectory(destination)) {
                throw new IOException("Destino existe e não é um diretório: " + destination);
            }

            try (ArchiveLease ignored = ArchiveLease.acquire(archive)) {
                if (options.verifyChecksum()) {
                    checkSidecar(archive);
                }

                Path root = Files.exists(destination) ? destination.toRealPath() : destination.toAbsolutePath().normalize();
                Plan plan = plan(archive, root, options, cancelled);

                List<Path> createdParents = missingDirectories(destination.toAbsolutePath().normalize());
                Files.createDirectories(destination);
                try {
                    return execute(archive, destination.toRealPath(), plan, options, cancelled);
                } catch (IOException | RuntimeException e) {
                    // só some o que esta execução criou; um destino preexistente fica
                    rollback(createdParents);
                    throw e;
                }
            }
        }

        private void checkSidecar(Path archive) throws IOException {
            Optional<String> expected = ChecksumSidecar.read(archive);
            if (expected.isEmpty()) {
                log.info("Sem arquivo de checksum para {}; pulando conferência", archive.getFileName());
                return;
            }
            String actual = verifier.computeChecksum(archive);
            if (!actual.equalsIgnoreCase(expected.get())) {
                throw new IntegrityException("Checksum divergente para " + archive.getFileName()
                        + ": esperado " + expected.get() + ", calculado " + actual);
            }
        }

        // ---------------- Passo 1: validação ----------------

        private Plan plan(Path archive, Path root, RestoreOptions options, BooleanSupplier cancelled) throws IOException {
            Plan plan = new Plan();
            try (TarFormat.Reader reader = TarFormat.Reader.open(archive)) {
                TarArchiveEntry entry;
                while ((entry = nextEntry(reader)) != null) {
                    checkCancelled(cancelled);
                    String name = entry.getName();
                    Optional<String> rejection = validate(entry, root);
                    if (rejection.isPresent()) {
                        if (!options.bestEffort()) {
                            throw new UnsafeEntryException(name, rejection.get());
                        }
                        log.warn("Entrada ignorada: {} ({})", name, rejection.get());
                        plan.skipped.add(new SkippedEntry(name, rejection.get()));
                        continue;
                    }
                    Path relative = root.relativize(root.resolve(name).normalize());
                    if (relative.toString().isEmpty()) {
                        continue;
                    }
                    checkConflict(root.resolve(relative), entry.isDirectory(), options.overwrite());
                    plan.accepted.put(relative, entry.isDirectory());
                    if (entry.isDirectory()) {
                        plan.directoryTimes.put(relative, FileTime.from(entry.getModTime().toInstant()));
                    }
                }
            }
            return plan;
        }

        private Optional<String> validate(TarArchiveEntry entry, Path root) {
            String name = entry.getName();
            if (name == null || name.isEmpty()) {
                return Optional.of("nome vazio");
            }
            if (name.indexOf('\0') >= 0) {
                return Optional.of("nome contém NUL");
            }
            if (entry.isSymbolicLink() || entry.isLink()) {
                return Optional.of("links não são restaurados");
            }
            if (entry.isCharacterDevice() || entry.isBlockDevice() || entry.isFIFO()) {
                return Optional.of("dispositivo ou arquivo especial");
            }
            if (!entry.isFile() && !entry.isDirectory()) {
                return Optional.of("tipo de entrada não suportado");
            }
            if (name.startsWith("/") || name.startsWith("\\") || WINDOWS_ABSOLUTE.matcher(name).matches()) {
                return Optional.of("caminho absoluto");
            }
            Path target;
            try {
                target = root.resolve(name).normalize();
            } catch (InvalidPathException e) {
                return Optional.of("caminho inválido");
            }
            if (!target.startsWith(root)) {
                return Optional.of("caminho escapa do destino");
            }
            return escapesThroughSymlink(root, target)
                    ? Optional.of("atravessa link simbólico para fora do destino")
                    : Optional.empty();
        }

        /** Verdadeiro se algum componente existente entre root e target é um link que sai do root. */
        private static boolean escapesThroughSymlink(Path root, Path target) {
            Path current = root;
            for (Path part : root.relativize(target)) {
                current = current.resolve(part);
                if (Files.isSymbolicLink(current)) {
                    try {
                        if (!current.toRealPath().startsWith(root)) {
                            return true;
                        }
                    } catch (IOException e) {
                        // link quebrado: não há como provar que fica dentro
                        return true;
                    }
                } else if (!Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
                    return false;
                }
            }
            return false;
        }

        private static void checkConflict(Path target, boolean directory, boolean overwrite) throws IOException {
            if (!Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                return;
            }
            boolean existingDir = Files.isDirectory(target, LinkOption.NOFOLLOW_LINKS);
            if (directory && existingDir) {
                return;
            }
            if (directory != existingDir || !overwrite) {
                throw new FileAlreadyExistsException(target.toString(), null,
                        "Arquivo já existe no destino (use overwrite)");
            }
        }

        // ---------------- Passos 2 e 3: extração e movimentação ----------------

        private RestoreOutcome execute(Path archive, Path root, Plan plan, RestoreOptions options,
                                       BooleanSupplier cancelled) throws IOException {
            Path staging = Files.createTempDirectory(root, STAGING_PREFIX);
            List<Path> created = new ArrayList<>();
            boolean done = false;
            try {
                long bytes = extract(archive, root, staging, plan, cancelled);

                long entries = 0;
                for (Map.Entry<Path, Boolean> item : plan.accepted.entrySet()) {
                    checkCancelled(cancelled);
                    Path relative = item.getKey();
                    Path target = root.resolve(relative);
                    if (item.getValue()) {
                        createDirectories(root, target, created);
                    } else {
                        createDirectories(root, target.getParent(), created);
                        boolean existed = Files.exists(target, LinkOption.NOFOLLOW_LINKS);
                        moveIntoPlace(staging.resolve(relative), target, options.overwrite());
                        if (!existed) {
                            created.add(target);
                        }
                    }
                    entries++;
                }
                applyDirectoryTimes(root, plan);
                done = true;
                log.info("Restore concluído: {} -> {} ({} entradas, {} bytes, {} ignoradas)",
                        archive.getFileName(), root, entries, bytes, plan.skipped.size());
                return RestoreOutcome.succeeded(archive, root, entries, bytes, plan.skipped);
            } finally {
                deleteTree(staging);
                if (!done) {
                    rollback(created);
                }
            }
        }

        private long extract(Path archive, Path root, Path staging, Plan plan, BooleanSupplier cancelled) throws IOException {
            long bytes = 0;
            try (TarFormat.Reader reader = TarFormat.Reader.open(archive)) {
                TarArchiveEntry entry;
                while ((entry = nextEntry(reader)) != null) {
                    checkCancelled(cancelled);
                    Path relative;
                    try {
                        relative = root.relativize(root.resolve(entry.getName()).normalize());
                    } catch (InvalidPathException e) {
                        continue;
                    }
                    Boolean directory = plan.accepted.get(relative);
                    if (directory == null) {
                        continue;
                    }
                    Path staged = staging.resolve(relative);
                    if (directory) {
                        Files.createDirectories(staged);
                    } else {
                        Files.createDirectories(staged.getParent());
                        try {
                            bytes += Files.copy(reader.content(), staged, StandardCopyOption.REPLACE_EXISTING);
                        } catch (IOException e) {
                            throw new IntegrityException("Falha ao ler entrada " + entry.getName() + ": " + e.getMessage(), e);
                        }
                    }
                    applyAttributes(staged, entry);
                }
            }
            return bytes;
        }

        private static TarArchiveEntry nextEntry(TarFormat.Reader reader) throws IOException {
            try {
                return reader.next();
            } catch (BackupException e) {
                throw e;
            } catch (IOException | RuntimeException e) {
                throw new IntegrityException("Arquivo de backup corrompido: " + e.getMessage(), e);
            }
        }

        private static void applyAttributes(Path staged, TarArchiveEntry entry) {
            try {
                if (Files.getFileStore(staged).supportsFileAttributeView("posix")) {
                    Files.setPosixFilePermissions(staged, permissions(entry.getMode(), entry.isDirectory()));
                }
                Files.setLastModifiedTime(staged, FileTime.from(entry.getModTime().toInstant()));
            } catch (IOException | UnsupportedOperationException e) {
                log.debug("Atributos não aplicados em {}: {}", staged, e.toString());
            }
        }

        private static Set<PosixFilePermission> permissions(int mode, boolean directory) {
            Set<PosixFilePermission> perms = EnumSet.noneOf(PosixFilePermission.class);
            PosixFilePermission[] order = {
                    PosixFilePermission.OTHERS_EXECUTE, PosixFilePermission.OTHERS_WRITE, PosixFilePermission.OTHERS_READ,
                    PosixFilePermission.GROUP_EXECUTE, PosixFilePermission.GROUP_WRITE, PosixFilePermission.GROUP_READ,
                    PosixFilePermission.OWNER_EXECUTE, PosixFilePermission.OWNER_WRITE, PosixFilePermission.OWNER_READ
            };
            for (int bit = 0; bit < order.length; bit++) {
                if ((mode & (1 << bit)) != 0) {
                    perms.add(order[bit]);
                }
            }
            // o dono precisa conseguir mexer no que foi restaurado
            perms.add(PosixFilePermission.OWNER_READ);
            perms.add(PosixFilePermission.OWNER_WRITE);
            if (directory) {
                perms.add(PosixFilePermission.OWNER_EXECUTE);
            }
            return perms;
        }

        /** Diretórios recebem o mtime do arquivo depois que os filhos já foram movidos. */
        private static void applyDirectoryTimes(Path root, Plan plan) {
            for (Map.Entry<Path, FileTime> item : plan.directoryTimes.entrySet()) {
                try {
                    Files.setLastModifiedTime(root.resolve(item.getKey()), item.getValue());
                } catch (IOException e) {
                    log.debug("mtime não aplicado em {}: {}", item.getKey(), e.toString());
                }
            }
        }

        private static void createDirectories(Path root, Path dir, List<Path> created) throws IOException {
            if (dir == null || Files.isDirectory(dir)) {
                return;
            }
            for (Path p : missingDirectories(dir)) {
                if (p.startsWith(root) && !p.equals(root)) {
                    Files.createDirectory(p);
                    created.add(p);
                }
            }
        }

        /** Diretórios de {@code dir} para cima que ainda não existem, do mais externo ao mais interno. */
        private static List<Path> missingDirectories(Path dir) {
            List<Path> missing = new ArrayList<>();
            for (Path p = dir; p != null && !Files.exists(p, LinkOption.NOFOLLOW_LINKS); p = p.getParent()) {
                missing.add(p);
            }
            Collections.reverse(missing);
            return missing;
        }

        private static void moveIntoPlace(Path staged, Path target, boolean overwrite) throws IOException {
            StandardCopyOption[] options = overwrite
                    ? new StandardCopyOption[]{StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING}
                    : new StandardCopyOption[]{StandardCopyOption.ATOMIC_MOVE};
            if (!overwrite && Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
                throw new FileAlreadyExistsException(target.toString());
            }
            try {
                Files.move(staged, target, options);
            } catch (AtomicMoveNotSupportedException e) {
                if (overwrite) {
                    Files.move(staged, target, StandardCopyOption.REPLACE_EXISTING);
                } else {
                    Files.move(staged, target);
                }
            }
        }

        private static void checkCancelled(BooleanSupplier cancelled) throws InterruptedIOException {
            if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Restore cancelado");
            }
        }

        private static void rollback(List<Path> created) {
            for (int i = created.size() - 1; i >= 0; i--) {
                Path path = created.get(i);
                try {
                    Files.deleteIfExists(path);
                } catch (IOException e) {
                    log.warn("Falha ao desfazer {}: {}", path, e.toString());
                }
            }
        }

        private static void deleteTree(Path dir) {
            if (dir == null || !Files.exists(dir)) return;
            try (Stream<Path> walk = Files.walk(dir)) {
                walk.sorted(Comparator.reverseOrder()).forEach(p -> {
                    try {
                        Files.deleteIfExists(p);
                    } catch (IOException e) {
                        log.warn("Falha ao remover {} do staging: {}", p, e.toString());
                    }
                });
            } catch (IOException e) {
                log.warn("Falha ao limpar staging {}: {}", dir, e.toString());
            }
        }

        /** Entradas aceitas (relativas, em ordem) e recusadas. */
        private static final class Plan {
            private final Map<Path, Boolean> accepted = new LinkedHashMap<>();
            private final Map<Path, FileTime> directoryTimes = new LinkedHashMap<>();
            private final List<SkippedEntry> skipped = new ArrayList<>();
        }
    }
}
