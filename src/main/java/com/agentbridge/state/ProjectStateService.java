package com.agentbridge.state;

import com.agentbridge.config.BridgeProperties;
import com.agentbridge.model.Project;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link StateStore} over the JSON state file shared with the CLI
 * ({@code {"projects": {"<name>": {...}}}}).
 *
 * <p>The raw JSON tree is kept next to the parsed projects so that writing
 * {@code lastActive} back preserves fields this service does not model.
 */
@Service
@Slf4j
public class ProjectStateService implements StateStore {

    private final Path stateFile;
    private final Clock clock;
    private final ObjectMapper mapper;

    private ObjectNode root;
    private Map<String, Project> projects = new LinkedHashMap<>();

    public ProjectStateService(BridgeProperties properties, Clock clock) {
        this.stateFile = Paths.get(properties.getStateFile());
        this.clock = clock;
        this.mapper = new ObjectMapper();
        this.mapper.registerModule(new JavaTimeModule());
        this.mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }

    @PostConstruct
    public void init() {
        reload();
    }

    @Override
    public synchronized Optional<Project> getProject(String projectName) {
        if (projectName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(projects.get(projectName));
    }

    @Override
    public synchronized List<Project> listProjects() {
        return new ArrayList<>(projects.values());
    }

    @Override
    public synchronized void updateLastActive(String projectName) {
        Project project = projects.get(projectName);
        if (project == null) {
            return;
        }
        Instant now = Instant.now(clock);
        project.setLastActive(now);

        JsonNode node = root.path("projects").path(projectName);
        if (node instanceof ObjectNode projectNode) {
            projectNode.put("lastActive", now.toString());
        }
        save();
    }

    @Override
    public synchronized void reload() {
        root = readRoot();
        Map<String, Project> loaded = new LinkedHashMap<>();

        JsonNode projectsNode = root.path("projects");
        Iterator<Map.Entry<String, JsonNode>> fields = projectsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            try {
                Project project = mapper.treeToValue(field.getValue(), Project.class);
                if (project.getProjectName() == null || project.getProjectName().isBlank()) {
                    project.setProjectName(field.getKey());
                }
                loaded.put(field.getKey(), project);
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Skipping unreadable project '{}' in {}: {}", field.getKey(), stateFile, e.getMessage());
            }
        }

        projects = loaded;
        log.info("Loaded {} project(s) from {}", loaded.size(), stateFile);
    }

    private ObjectNode readRoot() {
        if (!Files.exists(stateFile)) {
            return emptyState();
        }
        try {
            JsonNode node = mapper.readTree(stateFile.toFile());
            if (node instanceof ObjectNode objectNode) {
                if (!objectNode.path("projects").isObject()) {
                    objectNode.putObject("projects");
                }
                return objectNode;
            }
            log.warn("State file {} is not a JSON object; starting empty", stateFile);
        } catch (IOException e) {
            log.error("Failed to read state file {}", stateFile, e);
        }
        return emptyState();
    }

    private ObjectNode emptyState() {
        ObjectNode node = mapper.createObjectNode();
        node.putObject("projects");
        return node;
    }

    private void save() {
        try {
            Path parent = stateFile.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            mapper.writerWithDefaultPrettyPrinter().writeValue(stateFile.toFile(), root);
        } catch (IOException e) {
            log.error("Failed to save state file {}", stateFile, e);
        }
    }
}
