package com.agentbridge.service;

import lombok.Builder;
import lombok.Value;

/**
 * Where a fallback poll reads from and where it delivers to.
 */
@Value
@Builder
public class FallbackTarget {
    String projectName;
    String agentType;
    String instanceId;
    String channelId;
    String sessionId;
    String windowName;

    public String key() {
        return PendingMessageTracker.key(projectName, agentType, instanceId);
    }
}
