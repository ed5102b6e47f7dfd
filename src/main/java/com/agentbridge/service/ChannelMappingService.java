package com.agentbridge.service;

import com.agentbridge.messaging.ChannelMapping;
import com.agentbridge.messaging.MessagingClient;
import com.agentbridge.model.AgentInstance;
import com.agentbridge.model.Project;
import com.agentbridge.state.StateStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Keeps the messaging client's channel → instance table in step with the
 * state store.
 */
@Service
@Slf4j
public class ChannelMappingService {

    private final StateStore stateStore;
    private final MessagingClient messaging;

    public ChannelMappingService(StateStore stateStore, MessagingClient messaging) {
        this.stateStore = stateStore;
        this.messaging = messaging;
    }

    @PostConstruct
    public void init() {
        messaging.registerChannelMappings(buildMappings());
    }

    /**
     * Re-reads the state store and republishes every mapping.
     */
    public void reload() {
        stateStore.reload();
        List<ChannelMapping> mappings = buildMappings();
        messaging.registerChannelMappings(mappings);
        log.info("Reloaded {} channel mapping(s)", mappings.size());
    }

    List<ChannelMapping> buildMappings() {
        List<ChannelMapping> mappings = new ArrayList<>();
        for (Project project : stateStore.listProjects()) {
            for (AgentInstance instance : project.listInstances()) {
                if (instance.getChannelId() == null || instance.getChannelId().isBlank()) {
                    continue;
                }
                mappings.add(new ChannelMapping(
                    instance.getChannelId(),
                    project.getProjectName(),
                    instance.getAgentType(),
                    instance.getInstanceId()));
            }
        }
        return mappings;
    }
}
