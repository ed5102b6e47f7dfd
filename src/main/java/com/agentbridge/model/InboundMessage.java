package com.agentbridge.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * A user message received from a mapped chat channel.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class InboundMessage {
    private String agentType;
    private String text;
    private String projectName;
    private String channelId;
    private String messageId;
    private String mappedInstanceId;
    private List<MessageAttachment> attachments;

    public boolean hasAttachments() {
        return attachments != null && !attachments.isEmpty();
    }
}
