package com.agentbridge.runtime;

import com.agentbridge.config.BridgeProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.TimeoutException;

/**
 * {@link AgentRuntime} backed by the tmux CLI. Every call shells out once.
 */
@Component
@Slf4j
public class TmuxRuntime implements AgentRuntime {

    private final String tmuxCommand;
    private final Duration timeout;

    public TmuxRuntime(BridgeProperties properties) {
        this.tmuxCommand = properties.getTmux().getCommand();
        this.timeout = properties.getTmux().getCommandTimeout();
    }

    @Override
    public void typeKeysToWindow(String sessionId, String windowName, String text, String agentType) {
        // -l sends the text literally, so words like "Enter" or "C-c" are not read as key names
        run("send-keys", "-t", target(sessionId, windowName), "-l", "--", text);
    }

    @Override
    public void sendEnterToWindow(String sessionId, String windowName, String agentType) {
        run("send-keys", "-t", target(sessionId, windowName), "Enter");
    }

    @Override
    public String getWindowBuffer(String sessionId, String windowName) {
        return run("capture-pane", "-p", "-J", "-t", target(sessionId, windowName));
    }

    @Override
    public boolean windowExists(String sessionId, String windowName) {
        try {
            String output = run("list-windows", "-t", sessionId, "-F", "#{window_name}");
            return output.lines().anyMatch(line -> line.trim().equals(windowName));
        } catch (RuntimeCommandException e) {
            log.debug("list-windows failed for {}: {}", sessionId, e.getMessage());
            return false;
        }
    }

    static String target(String sessionId, String windowName) {
        return sessionId + ":" + windowName;
    }

    List<String> command(String... args) {
        List<String> command = new ArrayList<>();
        command.add(tmuxCommand);
        command.addAll(Arrays.asList(args));
        return command;
    }

    private String run(String... args) {
        return execute(command(args));
    }

    /**
     * Runs the command and returns its combined output.
     *
     * @throws RuntimeCommandException on a non-zero exit, a timeout or a start failure
     */
    protected String execute(List<String> command) {
        try {
            CommandRunner.Result result = CommandRunner.run(command, timeout);
            if (!result.isSuccess()) {
                throw new RuntimeCommandException(result.getOutput().trim(), result.getExitCode());
            }
            return result.getOutput();
        } catch (TimeoutException e) {
            throw new RuntimeCommandException(e.getMessage(), -1);
        } catch (IOException e) {
            throw new RuntimeCommandException("Failed to run " + command.get(0) + ": " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new RuntimeCommandException("Interrupted while running " + command.get(0), e);
        }
    }
}
