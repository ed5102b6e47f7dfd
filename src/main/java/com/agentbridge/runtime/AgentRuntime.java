package com.agentbridge.runtime;

import com.agentbridge.model.StyledFrame;

import java.util.Optional;

/**
 * Terminal runtime hosting the agent processes. Windows are addressed by a
 * session id and a window name inside it.
 */
public interface AgentRuntime {

    /**
     * Types {@code text} into the window literally, without submitting it.
     */
    void typeKeysToWindow(String sessionId, String windowName, String text, String agentType);

    void sendEnterToWindow(String sessionId, String windowName, String agentType);

    default void sendKeysToWindow(String sessionId, String windowName, String text, String agentType) {
        typeKeysToWindow(sessionId, windowName, text, agentType);
        sendEnterToWindow(sessionId, windowName, agentType);
    }

    /**
     * Raw text of the window's visible buffer. May contain ANSI escape sequences.
     */
    String getWindowBuffer(String sessionId, String windowName);

    /**
     * Styled snapshot of the window, for runtimes that render their own screens.
     */
    default Optional<StyledFrame> getWindowFrame(String sessionId, String windowName) {
        return Optional.empty();
    }

    boolean windowExists(String sessionId, String windowName);
}
