package com.agentbridge.model;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One running agent process, mapped 1:1 to a chat channel within a project.
 * Replaced wholesale when the project is reloaded; never mutated mid-turn.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class AgentInstance {
    private String instanceId;
    private String agentType;

    @JsonAlias("discordChannelId")
    private String channelId;

    @JsonProperty("tmuxWindow")
    private String runtimeWindowId;

    // Container isolation
    private boolean containerMode;
    private String containerId;
    private String containerName;

    /**
     * Window the runtime should target. Falls back to the instance id, which is
     * how windows are named when the state store does not record one.
     */
    @JsonIgnore
    public String windowName() {
        if (runtimeWindowId != null && !runtimeWindowId.isBlank()) {
            return runtimeWindowId;
        }
        return instanceId;
    }
}
