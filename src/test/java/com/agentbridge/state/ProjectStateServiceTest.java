package com.agentbridge.state;

import com.agentbridge.config.BridgeProperties;
import com.agentbridge.model.AgentInstance;
import com.agentbridge.model.Project;
import com.agentbridge.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProjectStateServiceTest {

    @TempDir
    Path tempDir;

    private Path stateFile;
    private MutableClock clock;

    private static final String STATE = "{\n"
        + "  \"version\": 2,\n"
        + "  \"projects\": {\n"
        + "    \"myapp\": {\n"
        + "      \"projectName\": \"myapp\",\n"
        + "      \"projectPath\": \"/home/dev/myapp\",\n"
        + "      \"tmuxSession\": \"bridge\",\n"
        + "      \"createdAt\": \"2025-01-01T10:00:00Z\",\n"
        + "      \"customSetting\": true,\n"
        + "      \"instances\": {\n"
        + "        \"claude\": {\"instanceId\": \"claude\", \"agentType\": \"claude\", \"channelId\": \"C1\", \"tmuxWindow\": \"myapp-claude\"},\n"
        + "        \"claude-2\": {\"instanceId\": \"claude-2\", \"agentType\": \"claude\", \"discordChannelId\": \"C2\", \"containerMode\": true, \"containerId\": \"abc\"}\n"
        + "      }\n"
        + "    },\n"
        + "    \"legacy\": {\n"
        + "      \"projectPath\": \"/home/dev/legacy\",\n"
        + "      \"tmuxSession\": \"bridge\",\n"
        + "      \"agents\": {\"opencode\": true},\n"
        + "      \"discordChannels\": {\"opencode\": \"C9\"}\n"
        + "    }\n"
        + "  }\n"
        + "}\n";

    @BeforeEach
    void setUp() throws IOException {
        stateFile = tempDir.resolve("state.json");
        Files.writeString(stateFile, STATE);
        clock = MutableClock.startingAtEpoch();
    }

    private ProjectStateService service() {
        BridgeProperties properties = new BridgeProperties();
        properties.setStateFile(stateFile.toString());
        ProjectStateService service = new ProjectStateService(properties, clock);
        service.init();
        return service;
    }

    @Test
    void shouldLoadProjectsAndInstances() {
        ProjectStateService service = service();

        Project project = service.getProject("myapp").orElseThrow();
        assertEquals("bridge", project.getRuntimeSessionId());
        assertEquals("2025-01-01T10:00:00Z", project.getCreatedAt().toString());

        List<AgentInstance> instances = project.listInstances();
        assertEquals(2, instances.size());
        assertEquals("myapp-claude", instances.get(0).windowName());
        AgentInstance second = instances.get(1);
        assertEquals("C2", second.getChannelId());
        assertTrue(second.isContainerMode());
        assertEquals("claude-2", second.windowName());
    }

    @Test
    void shouldNameProjectsByKeyAndDeriveLegacyInstances() {
        Project legacy = service().getProject("legacy").orElseThrow();

        assertEquals("legacy", legacy.getProjectName());
        AgentInstance instance = legacy.findInstanceByChannel("C9").orElseThrow();
        assertEquals("opencode", instance.getInstanceId());
        assertEquals("opencode", instance.getAgentType());
    }

    @Test
    void shouldStartEmptyWithoutStateFile() throws IOException {
        Files.delete(stateFile);

        ProjectStateService service = service();

        assertTrue(service.listProjects().isEmpty());
        assertTrue(service.getProject("myapp").isEmpty());
    }

    @Test
    void shouldStartEmptyWithCorruptStateFile() throws IOException {
        Files.writeString(stateFile, "{not json");

        assertTrue(service().listProjects().isEmpty());
    }

    @Test
    void shouldPersistLastActiveAndKeepUnknownFields() throws IOException {
        ProjectStateService service = service();

        service.updateLastActive("myapp");

        assertEquals(clock.instant(), service.getProject("myapp").orElseThrow().getLastActive());
        JsonNode saved = new ObjectMapper().readTree(stateFile.toFile());
        assertEquals(clock.instant().toString(), saved.path("projects").path("myapp").path("lastActive").asText());
        assertTrue(saved.path("projects").path("myapp").path("customSetting").asBoolean());
        assertEquals(2, saved.path("version").asInt());
    }

    @Test
    void shouldIgnoreLastActiveForUnknownProject() throws IOException {
        ProjectStateService service = service();

        service.updateLastActive("ghost");

        assertEquals(STATE, Files.readString(stateFile));
    }

    @Test
    void shouldPickUpChangesOnReload() throws IOException {
        ProjectStateService service = service();
        Files.writeString(stateFile, "{\"projects\": {\"other\": {\"projectPath\": \"/tmp/other\"}}}");

        service.reload();

        assertTrue(service.getProject("myapp").isEmpty());
        assertTrue(service.getProject("other").isPresent());
    }
}
