package com.example.backupengine.scan;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitOption;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.regex.PatternSyntaxException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Módulo de varredura da árvore de origem usada pelo Archiver.
 *
 * Responsabilidades principais:
 * - Caminhar a árvore a partir de um root, sem seguir links simbólicos;
 * - Aplicar os padrões glob de exclusão (arquivos e subárvores inteiras);
 * - Ser resiliente a erros pontuais (permissão negada), reportando-os sem derrubar o job.
 */
public final class Scanner {

    private Scanner() {}

    /** Tipo de entrada encontrada no scan. */
    public enum EntryKind { FILE, DIRECTORY }

    /**
     * Representa um arquivo ou diretório encontrado durante o scan.
     *
     * Contém o caminho relativo ao root e o tamanho (snapshot no momento do scan). É imutável.
     */
    public static final class FileMetadata {
        private final Path relativePath;
        private final EntryKind kind;
        private final long size;

        public FileMetadata(Path relativePath, EntryKind kind, long size) {
            this.relativePath = Objects.requireNonNull(relativePath, "relativePath");
            this.kind = Objects.requireNonNull(kind, "kind");
            this.size = size;
        }

        public Path relativePath() { return relativePath; }
        public EntryKind kind() { return kind; }
        public boolean isDirectory() { return kind == EntryKind.DIRECTORY; }
        public long size() { return size; }

        /**
         * Caminho normalizado (sempre com '/') para uso consistente no tar.
         */
        public String normalizedPath() {
            return relativePath.toString().replace('\\', '/');
        }
    }

    /**
     * Estatísticas agregadas de um scan.
     */
    public static final class ScanStatistics {
        private final long filesProcessed;
        private final long filesExcludedByFilter;
        private final long directoriesVisited;
        private final long directoriesSkippedByFilter;
        private final long errors;

        public ScanStatistics(long filesProcessed,
                              long filesExcludedByFilter,
                              long directoriesVisited,
                              long directoriesSkippedByFilter,
                              long errors) {
            this.filesProcessed = filesProcessed;
            this.filesExcludedByFilter = filesExcludedByFilter;
            this.directoriesVisited = directoriesVisited;
            this.directoriesSkippedByFilter = directoriesSkippedByFilter;
            this.errors = errors;
        }

        public long filesProcessed() { return filesProcessed; }
        public long filesExcludedByFilter() { return filesExcludedByFilter; }
        public long directoriesVisited() { return directoriesVisited; }
        public long directoriesSkippedByFilter() { return directoriesSkippedByFilter; }
        public long errors() { return errors; }
    }

    /**
     * Resultado de um scan completo: root, entradas (ordenadas por caminho) e estatísticas.
     */
    public static final class ScanResult {
        private final Path root;
        private final List<FileMetadata> entries;
        private final ScanStatistics statistics;

        public ScanResult(Path root, List<FileMetadata> entries, ScanStatistics statistics) {
            this.root = Objects.requireNonNull(root, "root");
            this.entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
            this.statistics = Objects.requireNonNull(statistics, "statistics");
        }

        public Path root() { return root; }
        public List<FileMetadata> entries() { return entries; }
        public ScanStatistics statistics() { return statistics; }

        public long fileCount() {
            return entries.stream().filter(e -> !e.isDirectory()).count();
        }

        public long totalBytes() {
            return entries.stream().filter(e -> !e.isDirectory()).mapToLong(FileMetadata::size).sum();
        }
    }

    /**
     * Filtro de exclusão baseado em padrões glob.
     *
     * Um padrão relativo casa com um caminho quando casa com qualquer sufixo dele:
     * "*.log" exclui "a/b/c.log" e "cache" exclui um diretório "cache" em qualquer nível
     * (junto com toda a subárvore).
     */
    public static final class ExclusionFilter {

        private final List<PathMatcher> matchers;

        private ExclusionFilter(List<PathMatcher> matchers) {
            this.matchers = List.copyOf(matchers);
        }

        public static Builder builder() {
            return new Builder();
        }

        /**
         * Filtro "nenhum" (não exclui nada).
         */
        public static ExclusionFilter none() {
            return new Builder().build();
        }

        /**
         * Cria um filtro a partir de uma lista de globs.
         *
         * @throws IllegalArgumentException se algum glob for sintaticamente inválido
         */
        public static ExclusionFilter ofGlobs(List<String> globs) {
            Builder builder = builder();
            for (String glob : globs) {
                builder.excludeGlob(glob);
            }
            return builder.build();
        }

        /**
         * Retorna true se o caminho (relativo ao root do scan) deve ser excluído.
         */
        public boolean shouldExclude(Path relativePath) {
            if (relativePath == null || matchers.isEmpty()) return false;
            int names = relativePath.getNameCount();
            if (names == 0 || relativePath.toString().isEmpty()) return false;

            for (PathMatcher matcher : matchers) {
                for (int i = 0; i < names; i++) {
                    if (matcher.matches(relativePath.subpath(i, names))) {
                        return true;
                    }
                }
            }
            return false;
        }

        /**
         * Builder do ExclusionFilter.
         */
        public static final class Builder {
            private final List<PathMatcher> matchers = new ArrayList<>();

            /**
             * Exclui por glob. Barras finais ("node_modules/") são ignoradas.
             */
            public Builder excludeGlob(String glob) {
                if (glob == null || glob.isBlank()) {
                    return this;
                }
                String normalized = glob.trim();
                while (normalized.length() > 1 && normalized.endsWith("/")) {
                    normalized = normalized.substring(0, normalized.length() - 1);
                }
                try {
                    matchers.add(FileSystems.getDefault().getPathMatcher("glob:" + normalized));
                } catch (PatternSyntaxException e) {
                    throw new IllegalArgumentException("Padrão de exclusão inválido: " + glob, e);
                }
                return this;
            }

            public ExclusionFilter build() {
                return new ExclusionFilter(matchers);
            }
        }
    }

    /**
     * Callback para erros não-fatais do scan (ex.: permissão negada).
     */
    @FunctionalInterface
    public interface ScanErrorListener {
        void onError(Path path, String message, IOException exc);
    }

    /**
     * Serviço de varredura de diretórios.
     *
     * - Nunca segue links simbólicos (evita loops e "vazamento" para outros volumes);
     * - Links e arquivos especiais são ignorados; só arquivos regulares e diretórios entram;
     * - Erros pontuais são reportados ao {@link ScanErrorListener} e contados.
     */
    public static final class ScanService {

        private static final Logger log = LoggerFactory.getLogger(ScanService.class);

        private final ScanErrorListener errorListener;

        public ScanService() {
            this((path, message, exc) -> log.warn("{}: {} ({})", message, path, exc != null ? exc.toString() : "-"));
        }

        public ScanService(ScanErrorListener errorListener) {
            this.errorListener = Objects.requireNonNull(errorListener, "errorListener");
        }

        /**
         * Varre {@code root} aplicando o filtro. O root em si não é filtrado nem listado.
         *
         * @throws IOException se o root não for um diretório ou a varredura falhar por completo
         */
        public ScanResult scan(Path root, ExclusionFilter filter) throws IOException {
            Objects.requireNonNull(root, "root");
            final ExclusionFilter effectiveFilter = (filter != null) ? filter : ExclusionFilter.none();
            final Path canonical = root.toAbsolutePath().normalize();

            if (!Files.isDirectory(canonical)) {
                throw new IOException("Caminho não é um diretório válido: " + canonical);
            }

            final List<FileMetadata> entries = new ArrayList<>();
            final long[] filesProcessed = new long[1];
            final long[] filesExcluded = new long[1];
            final long[] dirsVisited = new long[1];
            final long[] dirsSkipped = new long[1];
            final long[] errors = new long[1];

            try {
                Files.walkFileTree(canonical, EnumSet.noneOf(FileVisitOption.class), Integer.MAX_VALUE, new SimpleFileVisitor<>() {

                    @Override
                    public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
                        dirsVisited[0]++;
                        if (dir.equals(canonical)) {
                            return FileVisitResult.CONTINUE;
                        }
                        Path relative = canonical.relativize(dir);
                        if (effectiveFilter.shouldExclude(relative)) {
                            dirsSkipped[0]++;
                            return FileVisitResult.SKIP_SUBTREE;
                        }
                        entries.add(new FileMetadata(relative, EntryKind.DIRECTORY, 0L));
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
                        if (!attrs.isRegularFile()) {
                            log.debug("Ignorando entrada que não é arquivo regular: {}", file);
                            return FileVisitResult.CONTINUE;
                        }
                        Path relative = canonical.relativize(file);
                        if (effectiveFilter.shouldExclude(relative)) {
                            filesExcluded[0]++;
                            return FileVisitResult.CONTINUE;
                        }
                        entries.add(new FileMetadata(relative, EntryKind.FILE, attrs.size()));
                        filesProcessed[0]++;
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult visitFileFailed(Path file, IOException exc) {
                        errors[0]++;
                        errorListener.onError(file, "Falha ao acessar caminho", exc);
                        return FileVisitResult.CONTINUE;
                    }

                    @Override
                    public FileVisitResult postVisitDirectory(Path dir, IOException exc) {
                        if (exc != null) {
                            errors[0]++;
                            errorListener.onError(dir, "Erro ao finalizar diretório", exc);
                        }
                        return FileVisitResult.CONTINUE;
                    }
                });
            } catch (IOException e) {
                throw new IOException("Falha fatal na varredura: " + e.getMessage(), e);
            }

            entries.sort(Comparator.comparing(FileMetadata::normalizedPath));
            return new ScanResult(canonical, entries, new ScanStatistics(
                    filesProcessed[0], filesExcluded[0], dirsVisited[0], dirsSkipped[0], errors[0]));
        }
    }
}
