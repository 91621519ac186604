package com.example.backupengine;

import com.example.backupengine.backup.Backup.BackupJob;
import com.example.backupengine.config.AppConfig;
import com.example.backupengine.config.BackupConfigLoader;
import com.example.backupengine.error.BackupErrors.ErrorKind;
import com.example.backupengine.restore.Restore.RestoreOutcome;
import com.example.backupengine.retention.Retention.CleanupReport;
import com.example.backupengine.storage.Storage.BackupMetadata;
import com.example.backupengine.verify.Verify.VerificationResult;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entrada de linha de comando do motor de backup.
 *
 * <pre>
 * create &lt;config&gt;
 * list [config]
 * cleanup &lt;config&gt; [--dry-run]
 * verify &lt;arquivo&gt;
 * verify-all &lt;config&gt;
 * restore &lt;arquivo&gt; &lt;destino&gt; [--overwrite] [--best-effort]
 * delete &lt;config&gt; &lt;id&gt;
 * </pre>
 *
 * O código de saída segue {@link ErrorKind#exitCode()}.
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    /** Comandos que operam sobre um arquivo e não dependem das configurações de backup. */
    private static final Set<String> STANDALONE_COMMANDS = Set.of("verify", "restore");

    private final PrintStream out;

    Main(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int code = new Main(System.out).run(AppConfig.load(), args);
        System.exit(code);
    }

    int run(AppConfig config, String[] args) {
        if (args.length == 0) {
            usage();
            return ErrorKind.CONFIG.exitCode();
        }
        List<String> positional = new ArrayList<>();
        List<String> flags = new ArrayList<>();
        for (int i = 1; i < args.length; i++) {
            (args[i].startsWith("--") ? flags : positional).add(args[i]);
        }

        try {
            LOGGER.fine(() -> "Configuração efetiva: " + config);
            BackupEngine engine = new BackupEngine(config);
            if (!STANDALONE_COMMANDS.contains(args[0])) {
                engine.registerAll(new BackupConfigLoader(config).load(config.configFile()));
            }
            Runtime.getRuntime().addShutdownHook(new Thread(engine::requestCancel));

            switch (args[0]) {
                case "create":
                    return create(engine, arg(positional, 0, "config"));
                case "list":
                    return list(engine, positional.isEmpty() ? null : positional.get(0));
                case "cleanup":
                    return cleanup(engine, arg(positional, 0, "config"), flags.contains("--dry-run"));
                case "verify":
                    return verify(engine, Path.of(arg(positional, 0, "arquivo")));
                case "verify-all":
                    return verifyAll(engine, arg(positional, 0, "config"));
                case "restore":
                    return restore(engine, Path.of(arg(positional, 0, "arquivo")), Path.of(arg(positional, 1, "destino")),
                            flags.contains("--overwrite"), flags.contains("--best-effort"));
                case "delete":
                    BackupMetadata removed = engine.delete(arg(positional, 0, "config"), arg(positional, 1, "id"));
                    out.println("Removido: " + removed.archiveFilename());
                    return 0;
                default:
                    usage();
                    return ErrorKind.CONFIG.exitCode();
            }
        } catch (IllegalArgumentException | IllegalStateException e) {
            LOGGER.severe("Argumentos ou configuração inválidos: " + e.getMessage());
            return ErrorKind.CONFIG.exitCode();
        } catch (IOException e) {
            ErrorKind kind = ErrorKind.of(e);
            LOGGER.severe(kind + ": " + e.getMessage());
            return kind.exitCode();
        } catch (RuntimeException e) {
            LOGGER.log(Level.SEVERE, "Erro inesperado", e);
            return ErrorKind.UNEXPECTED.exitCode();
        }
    }

    private int create(BackupEngine engine, String name) throws IOException {
        BackupJob job = engine.create(name);
        if (job.isSucceeded()) {
            out.println(job.archivePath().map(Path::toString).orElse("") + " (" + job.sizeBytes() + " bytes)");
            job.warnings().forEach(w -> LOGGER.warning(w));
            return 0;
        }
        job.error().ifPresent(e -> LOGGER.severe(e.toString()));
        return job.error().map(e -> e.kind().exitCode()).orElse(ErrorKind.UNEXPECTED.exitCode());
    }

    private int list(BackupEngine engine, String name) throws IOException {
        for (BackupMetadata m : engine.list(name)) {
            out.println(m.createdAt() + "  " + m.configName() + "  " + m.id() + "  " + m.archiveFilename() + "  " + m.sizeBytes());
        }
        return 0;
    }

    private int cleanup(BackupEngine engine, String name, boolean dryRun) throws IOException {
        CleanupReport report = engine.cleanup(name, dryRun);
        out.println((dryRun ? "Seriam removidos: " : "Removidos: ") + report.deletedCount()
                + ", mantidos: " + report.kept() + ", bytes: " + report.bytesFreed()
                + (report.floorReached() ? "" : " (mínimo de backups não atingido)"));
        report.errors().forEach(LOGGER::warning);
        return report.hasErrors() ? ErrorKind.IO.exitCode() : 0;
    }

    private int verify(BackupEngine engine, Path archive) {
        VerificationResult result = engine.verify(archive);
        print(archive.getFileName().toString(), result);
        return result.isValid() ? 0 : ErrorKind.INTEGRITY.exitCode();
    }

    private int verifyAll(BackupEngine engine, String name) throws IOException {
        Map<String, VerificationResult> results = engine.verifyAll(name);
        results.forEach(this::print);
        return results.values().stream().allMatch(VerificationResult::isValid) ? 0 : ErrorKind.INTEGRITY.exitCode();
    }

    private int restore(BackupEngine engine, Path archive, Path destination, boolean overwrite, boolean bestEffort) {
        RestoreOutcome outcome = engine.restore(archive, destination, overwrite, bestEffort);
        if (outcome.success()) {
            out.println("Restaurado em " + outcome.destination() + ": " + outcome.entriesWritten()
                    + " entradas, " + outcome.bytesWritten() + " bytes");
            outcome.skipped().forEach(s -> LOGGER.warning("Ignorado: " + s));
            return 0;
        }
        outcome.error().ifPresent(e -> LOGGER.severe(e.toString()));
        return outcome.error().map(e -> e.kind().exitCode()).orElse(ErrorKind.UNEXPECTED.exitCode());
    }

    private void print(String label, VerificationResult result) {
        out.println(label + ": " + (result.isValid() ? "OK" : "INVÁLIDO"));
        result.errors().forEach(e -> out.println("  - " + e));
    }

    private static String arg(List<String> positional, int index, String name) {
        if (positional.size() <= index) {
            throw new IllegalArgumentException("Argumento obrigatório ausente: " + name);
        }
        return positional.get(index);
    }

    private void usage() {
        out.println("Uso: create <config> | list [config] | cleanup <config> [--dry-run] | verify <arquivo>"
                + " | verify-all <config> | restore <arquivo> <destino> [--overwrite] [--best-effort] | delete <config> <id>");
    }
}
