package com.example.backupengine.error;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.channels.ClosedByInterruptException;
import java.time.Duration;
import java.util.Objects;

/**
 * Taxonomia de erros do motor de backup.
 * <p>
 * Todas as exceções estendem {@link IOException} para atravessar as assinaturas
 * {@code throws IOException} sem embrulho. {@link ErrorKind} classifica qualquer falha
 * e define o código de saída do processo.
 */
public final class BackupErrors {

    private BackupErrors() {}

    /** Categoria da falha, com o código de saída correspondente. */
    public enum ErrorKind {
        CONFIG(2),
        IO(3),
        HOOK_FAILED(4),
        HOOK_TIMEOUT(4),
        INTEGRITY(5),
        SECURITY(6),
        RETENTION_VIOLATION(7),
        CANCELLED(3),
        UNEXPECTED(1);

        private final int exitCode;

        ErrorKind(int exitCode) {
            this.exitCode = exitCode;
        }

        public int exitCode() { return exitCode; }

        /** Classifica uma falha qualquer. */
        public static ErrorKind of(Throwable error) {
            if (error instanceof BackupException) {
                return ((BackupException) error).kind();
            }
            if (error instanceof InterruptedIOException || error instanceof ClosedByInterruptException) {
                return CANCELLED;
            }
            if (error instanceof IOException) {
                return IO;
            }
            return UNEXPECTED;
        }
    }

    /** Detalhe imutável de um erro capturado em um objeto de resultado. */
    public static final class ErrorDetail {
        private final ErrorKind kind;
        private final String message;

        public ErrorDetail(ErrorKind kind, String message) {
            this.kind = Objects.requireNonNull(kind, "kind");
            this.message = message != null ? message : "";
        }

        public static ErrorDetail of(Throwable error) {
            String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
            return new ErrorDetail(ErrorKind.of(error), message);
        }

        public ErrorKind kind() { return kind; }
        public String message() { return message; }

        @Override
        public String toString() {
            return kind + ": " + message;
        }
    }

    /** Base das falhas tipadas. */
    public abstract static class BackupException extends IOException {
        private static final long serialVersionUID = 1L;

        protected BackupException(String message) {
            super(message);
        }

        protected BackupException(String message, Throwable cause) {
            super(message, cause);
        }

        public abstract ErrorKind kind();
    }

    /** Configuração inválida: nome, origem, destino, colisão de nome de arquivo. */
    public static final class ConfigException extends BackupException {
        private static final long serialVersionUID = 1L;

        public ConfigException(String message) { super(message); }
        public ConfigException(String message, Throwable cause) { super(message, cause); }

        @Override public ErrorKind kind() { return ErrorKind.CONFIG; }
    }

    /** Hook terminou com código de saída diferente de zero. */
    public static final class HookFailedException extends BackupException {
        private static final long serialVersionUID = 1L;
        private final int exitCode;

        public HookFailedException(String hookName, int exitCode, String outputTail) {
            super("Hook " + hookName + " falhou com código " + exitCode
                    + (outputTail == null || outputTail.isBlank() ? "" : ": " + outputTail));
            this.exitCode = exitCode;
        }

        public HookFailedException(String hookName, Throwable cause) {
            super("Hook " + hookName + " não pôde ser executado: " + cause.getMessage(), cause);
            this.exitCode = -1;
        }

        public int exitCode() { return exitCode; }

        @Override public ErrorKind kind() { return ErrorKind.HOOK_FAILED; }
    }

    /** Hook excedeu o timeout e foi terminado à força. */
    public static final class HookTimeoutException extends BackupException {
        private static final long serialVersionUID = 1L;

        public HookTimeoutException(String hookName, Duration timeout) {
            super("Hook " + hookName + " excedeu o timeout de " + timeout.getSeconds() + "s e foi terminado");
        }

        @Override public ErrorKind kind() { return ErrorKind.HOOK_TIMEOUT; }
    }

    /** Checksum divergente ou arquivo corrompido. */
    public static final class IntegrityException extends BackupException {
        private static final long serialVersionUID = 1L;

        public IntegrityException(String message) { super(message); }
        public IntegrityException(String message, Throwable cause) { super(message, cause); }

        @Override public ErrorKind kind() { return ErrorKind.INTEGRITY; }
    }

    /** Entrada do arquivo rejeitada no restore (path traversal, link, caminho absoluto). */
    public static final class UnsafeEntryException extends BackupException {
        private static final long serialVersionUID = 1L;
        private final String entryName;

        public UnsafeEntryException(String entryName, String reason) {
            super("Entrada insegura no arquivo: " + entryName + " (" + reason + ")");
            this.entryName = entryName;
        }

        public String entryName() { return entryName; }

        @Override public ErrorKind kind() { return ErrorKind.SECURITY; }
    }

    /** Operação recusada porque derrubaria a contagem abaixo de min_backups. */
    public static final class RetentionViolationException extends BackupException {
        private static final long serialVersionUID = 1L;

        public RetentionViolationException(String message) { super(message); }

        @Override public ErrorKind kind() { return ErrorKind.RETENTION_VIOLATION; }
    }

    /** Outro processo/thread já segura o lock exclusivo da configuração. */
    public static final class LockUnavailableException extends BackupException {
        private static final long serialVersionUID = 1L;

        public LockUnavailableException(String message) { super(message); }
        public LockUnavailableException(String message, Throwable cause) { super(message, cause); }

        @Override public ErrorKind kind() { return ErrorKind.IO; }
    }
}
