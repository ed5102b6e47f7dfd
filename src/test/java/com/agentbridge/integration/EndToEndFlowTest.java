package com.agentbridge.integration;

import com.agentbridge.messaging.SlackMessagingClient;
import com.agentbridge.model.InboundMessage;
import com.agentbridge.runtime.TmuxRuntime;
import com.agentbridge.service.BufferFallbackPoller;
import com.agentbridge.service.MessageRouterService;
import com.agentbridge.service.PendingMessageTracker;
import com.agentbridge.state.StateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.springframework.test.web.servlet.MockMvc;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
class EndToEndFlowTest {

    private static final String STATE = """
        {
          "projects": {
            "myapp": {
              "projectName": "myapp",
              "projectPath": "/tmp/myapp",
              "tmuxSession": "bridge",
              "instances": {
                "claude": {"instanceId": "claude", "agentType": "claude", "tmuxWindow": "myapp-claude", "channelId": "C1"},
                "claude-2": {"instanceId": "claude-2", "agentType": "claude", "tmuxWindow": "myapp-claude-2", "channelId": "C2"}
              }
            }
          }
        }
        """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private MessageRouterService router;

    @Autowired
    private PendingMessageTracker pendingTracker;

    @Autowired
    private BufferFallbackPoller fallbackPoller;

    @Autowired
    private StateStore stateStore;

    @MockBean
    private SlackMessagingClient slackClient;

    @MockBean
    private TmuxRuntime tmuxRuntime;

    @DynamicPropertySource
    static void bridgeProperties(DynamicPropertyRegistry registry) {
        try {
            Path stateFile = Files.createTempFile("bridge-state", ".json");
            Files.writeString(stateFile, STATE);
            registry.add("bridge.state-file", stateFile::toString);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
        // Keep the fallback poll from firing while a test runs
        registry.add("bridge.fallback.initial-delay", () -> "10m");
    }

    @BeforeEach
    void setUp() {
        when(slackClient.maxMessageLength()).thenReturn(3900);
        when(slackClient.sendToChannelWithId(anyString(), anyString())).thenReturn(Optional.of("start-1"));
        when(slackClient.replyInThread(anyString(), anyString(), anyString())).thenReturn(true);
    }

    private static InboundMessage inbound(String channelId, String mappedInstanceId, String text, String ts) {
        return InboundMessage.builder()
            .projectName("myapp")
            .agentType("claude")
            .channelId(channelId)
            .mappedInstanceId(mappedInstanceId)
            .messageId(ts)
            .text(text)
            .build();
    }

    @Test
    void shouldLoadProjectsFromStateFile() {
        assertTrue(stateStore.getProject("myapp").isPresent());
        assertEquals(2, stateStore.getProject("myapp").get().listInstances().size());
    }

    @Test
    void shouldCompleteTurnFromChatToHookReply() throws Exception {
        router.onMessage(inbound("C2", "claude-2", "run the tests", "100.1"));

        InOrder keys = inOrder(tmuxRuntime);
        keys.verify(tmuxRuntime).typeKeysToWindow("bridge", "myapp-claude-2", "run the tests", "claude");
        keys.verify(tmuxRuntime).sendEnterToWindow("bridge", "myapp-claude-2", "claude");
        verify(slackClient).addReactionToMessage("C2", "100.1", "⏳");
        assertTrue(pendingTracker.hasPending("myapp", "claude", "claude-2"));
        assertTrue(fallbackPoller.isScheduled("myapp", "claude", "claude-2"));

        mockMvc.perform(post("/opencode-event")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"session.idle\",\"projectName\":\"myapp\",\"agentType\":\"claude\","
                    + "\"instanceId\":\"claude-2\",\"text\":\"All 42 tests passed\",\"thinking\":\"check the runner\"}"))
            .andExpect(status().isOk());

        verify(slackClient).replyInThread(eq("C2"), eq("start-1"), contains("check the runner"));
        verify(slackClient).sendToChannel("C2", "All 42 tests passed");
        verify(slackClient).replaceOwnReactionOnMessage("C2", "100.1", "⏳", "✅");
        assertFalse(pendingTracker.hasPending("myapp", "claude", "claude-2"));
        verify(slackClient, never()).sendToChannel(eq("C1"), anyString());
    }

    @Test
    void shouldReportDeliveryFailureToChannel() {
        doThrow(new IllegalStateException("can't find window: myapp-claude"))
            .when(tmuxRuntime).typeKeysToWindow(anyString(), anyString(), anyString(), anyString());

        router.onMessage(inbound("C1", null, "hello", "200.1"));

        verify(slackClient).replaceOwnReactionOnMessage("C1", "200.1", "⏳", "❌");
        verify(slackClient).sendToChannel(eq("C1"), contains("agent tmux window is not running"));
        assertFalse(fallbackPoller.isScheduled("myapp", "claude", "claude"));
    }

    @Test
    void shouldRejectHookForUnknownProject() throws Exception {
        mockMvc.perform(post("/opencode-event")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"session.idle\",\"projectName\":\"ghost\",\"text\":\"hi\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Unknown project: ghost"));
    }
}
