package com.mediacheck.app.cli;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.JsonNode;
import com.mediacheck.app.config.Config;
import com.mediacheck.app.pipeline.BatchProcessor;
import com.mediacheck.app.pipeline.BatchReport;
import com.mediacheck.app.pipeline.MediaItem;
import com.mediacheck.app.pipeline.Pipeline;
import com.mediacheck.app.pipeline.PipelineSettings;
import com.mediacheck.app.pipeline.Pipelines;
import com.mediacheck.app.report.ReportJson;

public final class cli {

    private static final Logger logger = LoggerFactory.getLogger(cli.class);

    private cli() {}

    public static void main(String[] args) {
        int exitCode = execute(args);
        if (exitCode != 0) System.exit(exitCode);
    }

    public static int execute(String[] args) {
        if (args == null || args.length == 0) {
            printUsage();
            return 0;
        }

        String cmd = safeLower(args[0]);
        String[] rest = Arrays.copyOfRange(args, 1, args.length);

        try {
            return switch (cmd) {
                case "analyze" -> runBatch(Pipeline.IMAGE, rest);
                case "verify-video" -> runBatch(Pipeline.VIDEO, rest);
                case "help", "-h", "--help" -> {
                    printUsage();
                    yield 0;
                }
                default -> {
                    System.err.println("Comando invalido: " + args[0]);
                    printUsage();
                    yield 2;
                }
            };
        } catch (Exception e) {
            logger.error("Erro fatal", e);
            System.err.println("Erro fatal: " + safeMsg(e));
            return 1;
        }
    }

    // ----------------- analyze / verify-video -----------------

    private static int runBatch(Pipeline pipeline, String[] args) throws IOException {
        ParseResult<BatchArgs> parsed = BatchArgs.parse(args, pipeline);
        if (parsed.help()) {
            printBatchUsage(pipeline);
            return 0;
        }
        if (parsed.error() != null) {
            System.err.println(parsed.error());
            printBatchUsage(pipeline);
            return 2;
        }

        BatchArgs a = parsed.value();
        List<MediaItem> items = new ArrayList<>(a.files().size());
        for (String f : a.files()) {
            Path p;
            try {
                p = Path.of(f).toAbsolutePath().normalize();
            } catch (Exception e) {
                System.err.println("Caminho invalido: " + safeMsg(e));
                return 2;
            }
            if (!Files.isRegularFile(p)) {
                System.err.println("Arquivo nao existe: " + p);
                return 2;
            }
            items.add(MediaItem.ofFile(p));
        }

        PipelineSettings settings = Config.loadPipelineSettings();
        // arquivos do usuário são analisados no lugar: nada a limpar
        BatchProcessor processor = Pipelines.create(pipeline, settings, item -> {});

        JsonNode body;
        int exitCode;
        try {
            BatchReport report = processor.process(a.claimId(), items, a.notes(), cli::log);
            body = ReportJson.toJson(report);
            exitCode = 0;
        } catch (IllegalArgumentException e) {
            body = ReportJson.error("bad_request", safeMsg(e));
            exitCode = 1;
        } catch (IllegalStateException e) {
            body = ReportJson.error("internal_error", safeMsg(e));
            exitCode = 1;
        }

        String json = ReportJson.write(body);
        if (a.out() != null) {
            Path out = Path.of(a.out()).toAbsolutePath().normalize();
            Files.writeString(out, json, StandardCharsets.UTF_8);
            log("Relatorio salvo em " + out);
        } else {
            System.out.println(json);
        }
        return exitCode;
    }

    // ----------------- usage -----------------

    private static void printUsage() {
        System.out.println("""
                MediaCheck CLI
                Comandos:
                  analyze --claim-id <id> [--notes <texto>] [--out <arquivo>] <arquivos...>
                  verify-video [--claim-id <id>] [--out <arquivo>] <arquivos...>
                  help
                """);
    }

    private static void printBatchUsage(Pipeline pipeline) {
        if (pipeline == Pipeline.VIDEO) {
            System.out.println("""
                    Uso:
                      verify-video [--claim-id <id>] [--notes <texto>] [--out <arquivo>] <videos...>

                    Exemplo:
                      verify-video --out relatorio.json clip1.mp4 clip2.mov
                    """);
        } else {
            System.out.println("""
                    Uso:
                      analyze --claim-id <id> [--notes <texto>] [--out <arquivo>] <arquivos...>

                    Exemplo:
                      analyze --claim-id CLM-1042 --notes "colisao traseira" foto1.jpg foto2.png
                    """);
        }
    }

    // ----------------- parsing -----------------

    private static final class ArgCursor {
        private final String[] args;
        private int i;

        ArgCursor(String[] args) {
            this.args = args == null ? new String[0] : args;
        }

        boolean hasNext() { return i < args.length; }

        String next() { return args[i++]; }

        String requireNext(String opt) {
            if (!hasNext()) throw new IllegalArgumentException("Valor ausente para " + opt);
            return next();
        }
    }

    private record ParseResult<T>(T value, boolean help, String error) {
        static <T> ParseResult<T> okResult(T v) { return new ParseResult<>(v, false, null); }
        static <T> ParseResult<T> helpResult() { return new ParseResult<>(null, true, null); }
        static <T> ParseResult<T> errorResult(String e) { return new ParseResult<>(null, false, e); }
    }

    private record BatchArgs(String claimId, String notes, String out, List<String> files) {
        static ParseResult<BatchArgs> parse(String[] args, Pipeline pipeline) {
            String claimId = null, notes = null, out = null;
            List<String> files = new ArrayList<>();

            try {
                ArgCursor c = new ArgCursor(args);
                while (c.hasNext()) {
                    String t = c.next();
                    switch (t) {
                        case "-h", "--help" -> { return ParseResult.helpResult(); }
                        case "--claim-id" -> claimId = c.requireNext("--claim-id");
                        case "--notes" -> notes = c.requireNext("--notes");
                        case "--out" -> out = c.requireNext("--out");
                        default -> {
                            if (t.startsWith("--")) return ParseResult.errorResult("Opcao invalida: " + t);
                            files.add(t);
                        }
                    }
                }
            } catch (IllegalArgumentException e) {
                return ParseResult.errorResult(safeMsg(e));
            }

            if (files.isEmpty()) {
                return ParseResult.errorResult("Informe ao menos um arquivo");
            }
            if (isBlank(claimId)) {
                if (pipeline == Pipeline.IMAGE) {
                    return ParseResult.errorResult("Parametro obrigatorio: --claim-id");
                }
                claimId = UUID.randomUUID().toString().substring(0, 8);
            }
            return ParseResult.okResult(new BatchArgs(claimId, notes, out, List.copyOf(files)));
        }
    }

    // ----------------- misc -----------------

    private static String safeLower(String s) {
        return s == null ? "" : s.trim().toLowerCase(Locale.ROOT);
    }

    private static String safeMsg(Throwable t) {
        String m = (t == null) ? null : t.getMessage();
        return (m == null || m.isBlank())
                ? (t == null ? "Erro" : t.getClass().getSimpleName())
                : m;
    }

    private static boolean isBlank(String v) {
        return v == null || v.isBlank();
    }

    // stdout fica reservado para o JSON do relatório
    private static void log(String msg) {
        if (!isBlank(msg)) System.err.println(msg);
    }
}
