package io.rollo.vmmanager.storage;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.time.Duration;
import java.util.List;

/**
 * Runs an external command to completion.
 */
@FunctionalInterface
public interface CommandRunner {

    /**
     * Run a command and wait for it.
     *
     * @param command program and arguments
     * @param timeout maximum wait
     * @return exit code and combined output
     * @throws IOException if the command cannot be started or times out
     */
    @Nonnull
    CommandResult run(@Nonnull List<String> command, @Nonnull Duration timeout) throws IOException;

    /**
     * Outcome of a finished command.
     *
     * @param exitCode process exit code
     * @param output combined stdout and stderr
     */
    record CommandResult(int exitCode, @Nonnull String output) {

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }
}
