package com.agentbridge.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * A project as recorded in the bridge state file. The bridge only reads it;
 * {@code lastActive} is the one field it ever writes back.
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class Project {
    private String projectName;
    private String projectPath;

    @JsonProperty("tmuxSession")
    private String runtimeSessionId;

    private Map<String, AgentInstance> instances = new LinkedHashMap<>();

    // Legacy flat maps, only consulted when instances is empty
    private Map<String, Boolean> agents = new LinkedHashMap<>();

    @JsonProperty("discordChannels")
    private Map<String, String> channelsByAgentType = new LinkedHashMap<>();

    @JsonProperty("tmuxWindows")
    private Map<String, String> windowsByAgentType = new LinkedHashMap<>();

    private Instant createdAt;
    private Instant lastActive;

    public Project addInstance(AgentInstance instance) {
        if (instances == null) {
            instances = new LinkedHashMap<>();
        }
        instances.put(instance.getInstanceId(), instance);
        return this;
    }

    /**
     * Instances sorted by id. When the instance map carries no usable entry,
     * one instance per enabled legacy agent type is derived instead.
     */
    public List<AgentInstance> listInstances() {
        List<AgentInstance> result = new ArrayList<>();
        if (instances != null) {
            instances.forEach((key, raw) -> {
                if (raw == null || raw.getAgentType() == null || raw.getAgentType().isBlank()) {
                    return;
                }
                String id = raw.getInstanceId() != null && !raw.getInstanceId().isBlank()
                    ? raw.getInstanceId()
                    : key;
                if (id == null || id.isBlank()) {
                    return;
                }
                result.add(id.equals(raw.getInstanceId()) ? raw : raw.toBuilder().instanceId(id).build());
            });
        }
        if (result.isEmpty()) {
            result.addAll(legacyInstances());
        }
        result.sort(Comparator.comparing(AgentInstance::getInstanceId));
        return result;
    }

    public Optional<AgentInstance> findInstance(String instanceId) {
        if (instanceId == null || instanceId.isBlank()) {
            return Optional.empty();
        }
        return listInstances().stream()
            .filter(instance -> instanceId.equals(instance.getInstanceId()))
            .findFirst();
    }

    public Optional<AgentInstance> findInstanceByChannel(String channelId) {
        if (channelId == null || channelId.isBlank()) {
            return Optional.empty();
        }
        return listInstances().stream()
            .filter(instance -> channelId.equals(instance.getChannelId()))
            .findFirst();
    }

    public Optional<AgentInstance> primaryInstanceFor(String agentType) {
        return listInstances().stream()
            .filter(instance -> Objects.equals(agentType, instance.getAgentType()))
            .findFirst();
    }

    private List<AgentInstance> legacyInstances() {
        Map<String, Boolean> enabled = agents != null ? agents : Map.of();
        Map<String, String> channels = channelsByAgentType != null ? channelsByAgentType : Map.of();
        Map<String, String> windows = windowsByAgentType != null ? windowsByAgentType : Map.of();

        Set<String> agentTypes = new LinkedHashSet<>();
        enabled.forEach((agentType, on) -> {
            if (Boolean.TRUE.equals(on)) {
                agentTypes.add(agentType);
            }
        });
        for (String agentType : channels.keySet()) {
            if (!Boolean.FALSE.equals(enabled.get(agentType))) {
                agentTypes.add(agentType);
            }
        }

        List<AgentInstance> derived = new ArrayList<>();
        for (String agentType : agentTypes) {
            if (agentType == null || agentType.isBlank()) {
                continue;
            }
            derived.add(AgentInstance.builder()
                .instanceId(agentType)
                .agentType(agentType)
                .channelId(channels.get(agentType))
                .runtimeWindowId(windows.get(agentType))
                .build());
        }
        return derived;
    }
}
