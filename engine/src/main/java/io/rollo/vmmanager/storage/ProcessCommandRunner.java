package io.rollo.vmmanager.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nonnull;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * {@link CommandRunner} backed by {@link ProcessBuilder}.
 *
 * <p>Output is drained on a shared pool of named daemon threads.</p>
 */
public class ProcessCommandRunner implements CommandRunner {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProcessCommandRunner.class);

    static final String THREAD_PREFIX = "VmManager-ProcessOutput-";

    private static final AtomicInteger THREAD_COUNTER = new AtomicInteger();
    private static final ExecutorService OUTPUT_READERS = Executors.newCachedThreadPool(r -> {
        Thread t = new Thread(r, THREAD_PREFIX + THREAD_COUNTER.incrementAndGet());
        t.setDaemon(true);
        return t;
    });

    @Override
    @Nonnull
    public CommandResult run(@Nonnull List<String> command, @Nonnull Duration timeout) throws IOException {
        LOGGER.debug("Command: {}", String.join(" ", command));

        ProcessBuilder builder = new ProcessBuilder(command);
        builder.redirectErrorStream(true);
        Process process = builder.start();

        CompletableFuture<String> output = CompletableFuture.supplyAsync(() -> readOutput(process), OUTPUT_READERS);

        try {
            boolean exited = process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (!exited) {
                process.destroyForcibly();
                throw new IOException("Command timed out after " + timeout.toSeconds() + "s: " + command.get(0));
            }
            return new CommandResult(process.exitValue(), output.get(5, TimeUnit.SECONDS));
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new IOException("Interrupted while running " + command.get(0), e);
        } catch (ExecutionException | TimeoutException e) {
            LOGGER.warn("Output of {} could not be read: {}", command.get(0), e.getMessage());
            output.cancel(true);
            return new CommandResult(process.exitValue(), "");
        }
    }

    private static String readOutput(Process process) {
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            return reader.lines().collect(Collectors.joining("\n"));
        } catch (IOException e) {
            LOGGER.debug("Error reading command output: {}", e.getMessage());
            return "";
        }
    }
}
