package com.agentbridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PendingEntry {
    private String channelId;
    private String messageId;       // user's chat message; null for agent-initiated turns
    private String startMessageId;  // "Processing..." placeholder, anchor for thread replies

    public boolean hasMessageId() {
        return messageId != null && !messageId.isEmpty();
    }

    public boolean hasThreadAnchor() {
        return startMessageId != null && !startMessageId.isEmpty();
    }
}
