package com.agentbridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Optional;

/**
 * Payload posted by the agent-side hook scripts to {@code /opencode-event}.
 * All agent adapters produce this one shape; {@code type} selects the handler.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class HookEvent {

    public static final String DEFAULT_AGENT_TYPE = "opencode";

    private String type;
    private String projectName;
    private String agentType;
    private String instanceId;

    private String text;
    private String message;

    // session.idle / session.error
    private String turnText;
    private String thinking;
    private String intermediateText;
    private String promptText;

    // session.start / session.end / session.notification
    private String source;
    private String model;
    private String reason;
    private String notificationType;

    public Optional<HookEventType> eventType() {
        return HookEventType.fromWire(type);
    }

    public String agentTypeOrDefault() {
        return agentType != null && !agentType.isBlank() ? agentType : DEFAULT_AGENT_TYPE;
    }

    /**
     * Event text, preferring {@code text} over the older {@code message} field.
     * Blank values count as absent.
     */
    public Optional<String> resolvedText() {
        if (text != null && !text.isBlank()) {
            return Optional.of(text);
        }
        if (message != null && !message.isBlank()) {
            return Optional.of(message);
        }
        return Optional.empty();
    }
}
