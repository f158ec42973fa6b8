package com.mediacheck.app.detection;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Invoca o detector externo como processo separado: {@code <comando...> <arquivo>}.
 * Espera um único objeto JSON na saída padrão. Stderr é só diagnóstico.
 */
public final class ProcessDeepDetector implements DeepDetector {

    private static final Logger logger = LoggerFactory.getLogger(ProcessDeepDetector.class);

    private static final int MAX_STDERR_CHARS = 2000;
    private static final long KILL_WAIT_SECONDS = 5;

    // stdout e stderr precisam ser drenados em paralelo para o processo não travar no pipe
    private static final ExecutorService IO_POOL = Executors.newCachedThreadPool(namedFactory("mediacheck-detector-io-"));

    private final List<String> command;
    private final Duration timeout;

    public ProcessDeepDetector(List<String> command, Duration timeout) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Comando do detector não configurado");
        }
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("Timeout do detector deve ser positivo");
        }
        this.command = List.copyOf(command);
        this.timeout = timeout;
    }

    @Override
    public DetectorResult detect(Path file, String originalName) {
        List<String> cmd = new ArrayList<>(command);
        cmd.add(file.toAbsolutePath().toString());

        logger.info("Iniciando análise profunda de {}", originalName);
        long t0 = System.nanoTime();

        Process p;
        try {
            p = new ProcessBuilder(cmd).start();
        } catch (IOException e) {
            logger.warn("Falha ao iniciar detector {}: {}", cmd.get(0), safeMsg(e));
            return DetectorResult.failed(AdapterError.Kind.LAUNCH_FAILED,
                    "TruthScan analysis failed: " + safeMsg(e));
        }

        try {
            p.getOutputStream().close();
        } catch (IOException ignored) {
            // stdin não é usado
        }

        CompletableFuture<String> stdout = CompletableFuture.supplyAsync(() -> drain(p.getInputStream()), IO_POOL);
        CompletableFuture<String> stderr = CompletableFuture.supplyAsync(() -> drain(p.getErrorStream()), IO_POOL);

        try {
            if (!p.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
                kill(p, stdout, stderr);
                logger.warn("Detector excedeu {}s para {}; processo encerrado", timeout.toSeconds(), originalName);
                return DetectorResult.failed(AdapterError.Kind.TIMEOUT,
                        "TruthScan analysis timed out after " + timeout.toSeconds() + "s");
            }
        } catch (InterruptedException e) {
            kill(p, stdout, stderr);
            Thread.currentThread().interrupt();
            logger.warn("Análise profunda de {} interrompida; processo encerrado", originalName);
            throw new DetectorInterruptedException(originalName, e);
        }

        int exit = p.exitValue();
        String out = await(stdout, originalName);
        String err = truncate(await(stderr, originalName));
        long ms = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - t0);

        logger.info("Detector finalizado para {}: exit={} em {} ms", originalName, exit, ms);

        if (exit != 0) {
            logger.warn("Detector saiu com código {}: {}", exit, err);
            return DetectorResult.failed(AdapterError.Kind.NON_ZERO_EXIT,
                    "TruthScan analysis failed: " + (err.isBlank() ? "Unknown error" : err));
        }
        if (!err.isBlank()) {
            logger.debug("Detector stderr ({}): {}", originalName, err);
        }
        return DetectorResponseParser.parse(out);
    }

    private static String drain(InputStream in) {
        try (in) {
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            return "";
        }
    }

    /**
     * Encerra o processo e os descendentes (que podem herdar o pipe de stdout e
     * prender a thread de leitura), espera o término e descarta as leituras.
     * Chamado com a flag de interrupção limpa.
     */
    private static void kill(Process p, CompletableFuture<?>... drains) {
        List<ProcessHandle> descendants = p.descendants().toList();
        descendants.forEach(ProcessHandle::destroyForcibly);
        p.destroyForcibly();
        try {
            if (!p.waitFor(KILL_WAIT_SECONDS, TimeUnit.SECONDS)) {
                logger.warn("Processo do detector (pid {}) não terminou após destroyForcibly", p.pid());
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (CompletableFuture<?> f : drains) {
            f.cancel(true);
        }
    }

    private static String await(CompletableFuture<String> f, String originalName) {
        try {
            return f.get(KILL_WAIT_SECONDS, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DetectorInterruptedException(originalName, e);
        } catch (ExecutionException | TimeoutException e) {
            logger.debug("Falha ao coletar saída do detector", e);
            return "";
        }
    }

    private static String truncate(String s) {
        String t = s == null ? "" : s.trim();
        return t.length() > MAX_STDERR_CHARS ? t.substring(t.length() - MAX_STDERR_CHARS) : t;
    }

    private static String safeMsg(Throwable t) {
        return (t.getMessage() == null || t.getMessage().isBlank())
                ? t.getClass().getSimpleName()
                : t.getMessage();
    }

    private static ThreadFactory namedFactory(String prefix) {
        return new ThreadFactory() {
            private final ThreadFactory base = Executors.defaultThreadFactory();
            private final AtomicInteger seq = new AtomicInteger(1);
            @Override public Thread newThread(Runnable r) {
                Thread t = base.newThread(r);
                t.setName(prefix + seq.getAndIncrement());
                t.setDaemon(true);
                return t;
            }
        };
    }
}
