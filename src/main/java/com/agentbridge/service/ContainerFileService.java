package com.agentbridge.service;

import com.agentbridge.config.BridgeProperties;
import com.agentbridge.runtime.CommandRunner;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * Copies downloaded attachments into sandboxed agent containers with the
 * docker CLI.
 */
@Service
@Slf4j
public class ContainerFileService {

    private static final Duration COMMAND_TIMEOUT = Duration.ofSeconds(30);

    private final String dockerCommand;
    private final long maxInjectBytes;
    private final String containerFilesDir;

    public ContainerFileService(BridgeProperties properties) {
        this.dockerCommand = properties.getContainer().getDockerCommand();
        this.maxInjectBytes = properties.getContainer().getMaxInjectBytes();
        this.containerFilesDir = properties.getContainer().filesDir();
    }

    public String containerFilesDir() {
        return containerFilesDir;
    }

    /**
     * @return true when the file now exists under {@code containerDir} in the container
     */
    public boolean injectFile(String containerId, Path localPath, String containerDir) {
        try {
            long size = Files.size(localPath);
            if (size > maxInjectBytes) {
                log.warn("Not injecting {} into {}: {} bytes exceeds the {} byte limit",
                    localPath, containerId, size, maxInjectBytes);
                return false;
            }
        } catch (IOException e) {
            log.warn("Cannot read {} for container injection: {}", localPath, e.getMessage());
            return false;
        }

        if (!run(List.of(dockerCommand, "exec", containerId, "mkdir", "-p", containerDir))) {
            return false;
        }
        String destination = containerDir.endsWith("/") ? containerDir : containerDir + "/";
        return run(List.of(dockerCommand, "cp", localPath.toString(), containerId + ":" + destination));
    }

    private boolean run(List<String> command) {
        try {
            int exitCode = execute(command);
            if (exitCode != 0) {
                log.warn("{} exited with {}", String.join(" ", command), exitCode);
                return false;
            }
            return true;
        } catch (IOException e) {
            log.warn("Failed to run {}: {}", command.get(0), e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    protected int execute(List<String> command) throws IOException, InterruptedException {
        try {
            CommandRunner.Result result = CommandRunner.run(command, COMMAND_TIMEOUT);
            if (!result.isSuccess()) {
                log.debug("docker output: {}", result.getOutput().trim());
            }
            return result.getExitCode();
        } catch (TimeoutException e) {
            log.warn(e.getMessage());
            return -1;
        }
    }
}
