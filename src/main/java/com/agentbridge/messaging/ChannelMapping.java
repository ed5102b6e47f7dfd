package com.agentbridge.messaging;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ChannelMapping {
    private String channelId;
    private String projectName;
    private String agentType;
    private String instanceId;
}
