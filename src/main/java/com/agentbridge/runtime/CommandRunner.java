package com.agentbridge.runtime;

import lombok.Value;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs an external command with stderr merged into stdout. Output is drained on
 * its own thread so the timeout holds even when the command keeps writing.
 */
public final class CommandRunner {

    private CommandRunner() {
    }

    public static Result run(List<String> command, Duration timeout)
            throws IOException, InterruptedException, TimeoutException {
        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);

        Process process = pb.start();
        FutureTask<String> output = new FutureTask<>(() -> readProcessOutput(process));
        Thread drain = new Thread(output, "command-output");
        drain.setDaemon(true);
        drain.start();

        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            process.destroyForcibly();
            throw new TimeoutException("Command timed out after " + timeout.toMillis() + " ms: " + String.join(" ", command));
        }

        try {
            return new Result(process.exitValue(), output.get());
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException io) {
                throw io;
            }
            throw new IOException("Failed to read output of " + command.get(0), e.getCause());
        }
    }

    private static String readProcessOutput(Process process) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                output.append(line).append("\n");
            }
        }
        return output.toString();
    }

    @Value
    public static class Result {
        int exitCode;
        String output;

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }
}
