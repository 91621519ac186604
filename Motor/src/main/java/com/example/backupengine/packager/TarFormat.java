package com.example.backupengine.packager;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.function.BooleanSupplier;
import java.util.zip.GZIPInputStream;
import java.util.zip.GZIPOutputStream;

import org.apache.commons.compress.archivers.tar.TarArchiveEntry;
import org.apache.commons.compress.archivers.tar.TarArchiveInputStream;
import org.apache.commons.compress.archivers.tar.TarArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.scan.Scanner.FileMetadata;
import com.github.luben.zstd.ZstdInputStream;
import com.github.luben.zstd.ZstdOutputStream;

/**
 * Formato do arquivo de backup: container tar, opcionalmente comprimido com Zstd ou GZIP.
 *
 * Estrutura:
 * - Entradas prefixadas pelo nome do diretório de origem (convenção "tar -C pai nome");
 * - Diretórios vazios preservados; nomes longos em PAX;
 * - Codec detectado na leitura pelos bytes mágicos, não pela extensão.
 *
 * Responsabilidades:
 * - Escrita (Writer): serializar um scan em um stream
 * - Leitura (Reader): enumerar entradas de forma sequencial
 */
public final class TarFormat {

    private static final Logger log = LoggerFactory.getLogger(TarFormat.class);
    private static final byte[] ZSTD_MAGIC = {(byte) 0x28, (byte) 0xB5, (byte) 0x2F, (byte) 0xFD};
    private static final byte[] GZIP_MAGIC = {(byte) 0x1F, (byte) 0x8B};

    private TarFormat() {}

    // ==================== CODECS ====================

    /** Compressão aplicada sobre o tar. */
    public enum Codec {
        NONE(".tar"),
        GZIP(".tar.gz"),
        ZSTD(".tar.zst");

        private final String extension;

        Codec(String extension) {
            this.extension = extension;
        }

        public String extension() { return extension; }

        /** Resolve o codec a partir do nome configurado ("zstd"/"gzip") e da flag de compressão. */
        public static Codec resolve(boolean compression, String configured) {
            if (!compression) return NONE;
            return "gzip".equalsIgnoreCase(configured) ? GZIP : ZSTD;
        }

        /** Detecta o codec pelos primeiros bytes do arquivo. */
        public static Codec detect(byte[] header) {
            if (startsWith(header, ZSTD_MAGIC)) return ZSTD;
            if (startsWith(header, GZIP_MAGIC)) return GZIP;
            return NONE;
        }

        private static boolean startsWith(byte[] header, byte[] magic) {
            if (header.length < magic.length) return false;
            for (int i = 0; i < magic.length; i++) {
                if (header[i] != magic[i]) return false;
            }
            return true;
        }
    }

    // ==================== WRITER ====================

    /**
     * Writer: escreve as entradas de um scan como tar no stream informado.
     * O stream não é fechado pelo Writer além do que o codec exige para finalizar o frame.
     */
    public static final class Writer {
        private final Codec codec;
        private final int zstdLevel;

        public Writer(Codec codec, int zstdLevel) {
            this.codec = Objects.requireNonNull(codec, "codec");
            this.zstdLevel = zstdLevel;
        }

        public Codec codec() { return codec; }

        /**
         * Escreve todas as entradas.
         *
         * @param sourceRoot diretório de origem (as entradas são relativas a ele)
         * @param entries    entradas do scan, já filtradas e ordenadas
         * @param out        destino; é fechado ao final (fecha o frame do codec)
         * @param cancelled  consultado entre entradas; true aborta com InterruptedIOException
         * @return arquivos escritos e os que mudaram de tamanho durante a leitura
         */
        public Written write(Path sourceRoot, List<FileMetadata> entries, OutputStream out,
                             BooleanSupplier cancelled) throws IOException {
            String prefix = rootName(sourceRoot);
            int files = 0;
            List<String> changed = new ArrayList<>();
            try (OutputStream codecOut = wrap(out);
                 TarArchiveOutputStream tar = new TarArchiveOutputStream(codecOut)) {
                tar.setLongFileMode(TarArchiveOutputStream.LONGFILE_POSIX);
                tar.setBigNumberMode(TarArchiveOutputStream.BIGNUMBER_POSIX);
                tar.setAddPaxHeadersForNonAsciiNames(true);

                putEntry(tar, sourceRoot, prefix + "/");

                for (FileMetadata meta : entries) {
                    if (cancelled.getAsBoolean() || Thread.currentThread().isInterrupted()) {
                        throw new InterruptedIOException("Escrita do arquivo cancelada");
                    }
                    Path absolute = sourceRoot.resolve(meta.relativePath());
                    String name = prefix + "/" + meta.normalizedPath() + (meta.isDirectory() ? "/" : "");
                    if (meta.isDirectory()) {
                        putEntry(tar, absolute, name);
                    } else {
                        if (putFile(tar, absolute, name, meta.size())) {
                            changed.add(meta.normalizedPath());
                        }
                        files++;
                    }
                }
                tar.finish();
            }
            return new Written(files, changed);
        }

        private void putEntry(TarArchiveOutputStream tar, Path path, String name) throws IOException {
            TarArchiveEntry entry = new TarArchiveEntry(path, name, LinkOption.NOFOLLOW_LINKS);
            tar.putArchiveEntry(entry);
            tar.closeArchiveEntry();
        }

        /**
         * Grava o arquivo com o tamanho visto no scan: o que cresceu depois é cortado e o que
         * encolheu é completado com zeros.
         *
         * @return true se o tamanho do arquivo mudou durante a leitura
         */
        private boolean putFile(TarArchiveOutputStream tar, Path path, String name, long scannedSize) throws IOException {
            TarArchiveEntry entry = new TarArchiveEntry(path, name, LinkOption.NOFOLLOW_LINKS);
            entry.setSize(scannedSize);
            tar.putArchiveEntry(entry);
            long remaining = entry.getSize();
            byte[] buffer = new byte[64 * 1024];
            boolean grew;
            try (InputStream in = Files.newInputStream(path)) {
                while (remaining > 0) {
                    int n = in.read(buffer, 0, (int) Math.min(buffer.length, remaining));
                    if (n < 0) break;
                    tar.write(buffer, 0, n);
                    remaining -= n;
                }
                grew = remaining == 0 && in.read() >= 0;
            }
            boolean shrank = remaining > 0;
            if (shrank) {
                Arrays.fill(buffer, (byte) 0);
                while (remaining > 0) {
                    int n = (int) Math.min(buffer.length, remaining);
                    tar.write(buffer, 0, n);
                    remaining -= n;
                }
            }
            tar.closeArchiveEntry();
            if (grew || shrank) {
                log.warn("Arquivo alterado durante o backup: {} ({} bytes no header)", path, entry.getSize());
            }
            return grew || shrank;
        }

        private OutputStream wrap(OutputStream out) throws IOException {
            switch (codec) {
                case ZSTD:
                    return new ZstdOutputStream(out, zstdLevel);
                case GZIP:
                    return new GZIPOutputStream(out, 64 * 1024);
                default:
                    return out;
            }
        }

        private static String rootName(Path sourceRoot) {
            Path fileName = sourceRoot.toAbsolutePath().normalize().getFileName();
            return fileName != null ? fileName.toString() : "root";
        }
    }

    /** Resultado de uma escrita: arquivos regulares gravados e os que mudaram durante a leitura. */
    public static final class Written {
        private final int files;
        private final List<String> changedFiles;

        public Written(int files, List<String> changedFiles) {
            this.files = files;
            this.changedFiles = List.copyOf(changedFiles);
        }

        public int files() { return files; }
        public List<String> changedFiles() { return changedFiles; }
    }

    // ==================== READER ====================

    /**
     * Reader sequencial: detecta o codec e expõe as entradas do tar uma a uma.
     */
    public static final class Reader implements AutoCloseable {
        private final Codec codec;
        private final TarArchiveInputStream tar;

        private Reader(Codec codec, TarArchiveInputStream tar) {
            this.codec = codec;
            this.tar = tar;
        }

        public static Reader open(Path archive) throws IOException {
            InputStream raw = new BufferedInputStream(Files.newInputStream(archive), 64 * 1024);
            try {
                raw.mark(8);
                byte[] header = raw.readNBytes(4);
                raw.reset();
                Codec codec = Codec.detect(header);
                InputStream decoded;
                switch (codec) {
                    case ZSTD:
                        decoded = new ZstdInputStream(raw);
                        break;
                    case GZIP:
                        decoded = new GZIPInputStream(raw, 64 * 1024);
                        break;
                    default:
                        decoded = raw;
                }
                log.debug("Abrindo {} (codec {})", archive, codec);
                return new Reader(codec, new TarArchiveInputStream(decoded));
            } catch (IOException | RuntimeException e) {
                raw.close();
                throw e;
            }
        }

        public Codec codec() { return codec; }

        /** Próxima entrada, ou null no fim do arquivo. */
        public TarArchiveEntry next() throws IOException {
            return tar.getNextEntry();
        }

        /** Stream do conteúdo da entrada atual; não deve ser fechado por quem chama. */
        public InputStream content() {
            return tar;
        }

        @Override
        public void close() throws IOException {
            tar.close();
        }
    }
}
