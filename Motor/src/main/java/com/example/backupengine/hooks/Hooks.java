package com.example.backupengine.hooks;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.RandomAccessFile;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.example.backupengine.config.AppConfig;
import com.example.backupengine.error.BackupErrors.HookFailedException;
import com.example.backupengine.error.BackupErrors.HookTimeoutException;

/**
 * Hooks pre/post backup executados como processos externos.
 */
public final class Hooks {

    private Hooks() {}

    /**
     * Comando de hook: argv explícito (sem shell implícito) e timeout de parede.
     */
    public static final class HookCommand {
        private final List<String> command;
        private final Duration timeout;

        public HookCommand(List<String> command, Duration timeout) {
            Objects.requireNonNull(command, "command");
            if (command.isEmpty() || command.get(0) == null || command.get(0).isBlank()) {
                throw new IllegalArgumentException("Comando de hook vazio");
            }
            Objects.requireNonNull(timeout, "timeout");
            if (timeout.compareTo(Duration.ofSeconds(1)) < 0
                    || timeout.compareTo(Duration.ofSeconds(AppConfig.MAX_HOOK_TIMEOUT_SECONDS)) > 0) {
                throw new IllegalArgumentException("Timeout de hook fora da faixa [1s, 24h]: " + timeout);
            }
            this.command = List.copyOf(command);
            this.timeout = timeout;
        }

        public List<String> command() { return command; }
        public Duration timeout() { return timeout; }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof HookCommand)) return false;
            HookCommand other = (HookCommand) o;
            return command.equals(other.command) && timeout.equals(other.timeout);
        }

        @Override
        public int hashCode() {
            return Objects.hash(command, timeout);
        }

        @Override
        public String toString() {
            return String.join(" ", command) + " (timeout " + timeout.getSeconds() + "s)";
        }
    }

    /**
     * Executa hooks com timeout rígido.
     *
     * Saída padrão e de erro vão para um arquivo temporário; o final dela entra na mensagem
     * de erro quando o hook falha. No timeout o processo e seus descendentes são terminados
     * à força.
     */
    public static final class HookRunner {

        private static final Logger log = LoggerFactory.getLogger(HookRunner.class);
        private static final int OUTPUT_TAIL_BYTES = 2048;
        private static final long KILL_GRACE_SECONDS = 5;

        private final Path workingDirectory;

        public HookRunner() {
            this(null);
        }

        public HookRunner(Path workingDirectory) {
            this.workingDirectory = workingDirectory;
        }

        /**
         * Roda o hook e espera o término.
         *
         * @param name nome lógico para logs e erros ("pre", "post")
         * @throws HookFailedException  código de saída diferente de zero ou falha ao iniciar
         * @throws HookTimeoutException o processo excedeu o timeout
         * @throws InterruptedIOException a thread foi interrompida enquanto esperava
         */
        public void run(String name, HookCommand hook) throws IOException {
            Objects.requireNonNull(hook, "hook");
            Path output = Files.createTempFile("backup-hook-" + name + "-", ".log");
            try {
                ProcessBuilder builder = new ProcessBuilder(hook.command())
                        .redirectErrorStream(true)
                        .redirectOutput(output.toFile());
                if (workingDirectory != null) {
                    builder.directory(workingDirectory.toFile());
                }
                log.info("Executando hook {}: {}", name, hook);

                Process process;
                try {
                    process = builder.start();
                } catch (IOException e) {
                    throw new HookFailedException(name, e);
                }

                boolean finished;
                try {
                    finished = process.waitFor(hook.timeout().toMillis(), TimeUnit.MILLISECONDS);
                } catch (InterruptedException e) {
                    terminate(process);
                    Thread.currentThread().interrupt();
                    InterruptedIOException cancelled = new InterruptedIOException("Hook " + name + " interrompido");
                    cancelled.initCause(e);
                    throw cancelled;
                }

                if (!finished) {
                    terminate(process);
                    log.warn("Hook {} excedeu {}s e foi terminado", name, hook.timeout().getSeconds());
                    throw new HookTimeoutException(name, hook.timeout());
                }

                int exit = process.exitValue();
                if (exit != 0) {
                    throw new HookFailedException(name, exit, tail(output));
                }
                log.info("Hook {} concluído", name);
            } finally {
                try {
                    Files.deleteIfExists(output);
                } catch (IOException e) {
                    log.debug("Falha ao remover log do hook {}: {}", output, e.toString());
                }
            }
        }

        private static void terminate(Process process) {
            process.descendants().forEach(ProcessHandle::destroyForcibly);
            process.destroyForcibly();
            try {
                if (!process.waitFor(KILL_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Processo {} não terminou após destroyForcibly", process.pid());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        private static String tail(Path output) {
            try (RandomAccessFile raf = new RandomAccessFile(output.toFile(), "r")) {
                long length = raf.length();
                int size = (int) Math.min(length, OUTPUT_TAIL_BYTES);
                byte[] buffer = new byte[size];
                raf.seek(length - size);
                raf.readFully(buffer);
                return new String(buffer, StandardCharsets.UTF_8).trim();
            } catch (IOException e) {
                log.debug("Saída do hook indisponível: {}", e.toString());
                return "";
            }
        }
    }
}
