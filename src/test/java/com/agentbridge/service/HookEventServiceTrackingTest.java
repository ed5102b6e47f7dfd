package com.agentbridge.service;

import com.agentbridge.config.BridgeProperties;
import com.agentbridge.messaging.MessagingClient;
import com.agentbridge.model.AgentInstance;
import com.agentbridge.model.HookEvent;
import com.agentbridge.model.HookResult;
import com.agentbridge.model.Project;
import com.agentbridge.state.StateStore;
import com.agentbridge.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Hook handling against a real {@link PendingMessageTracker}, so the messaging
 * calls the tracker itself makes are visible too.
 */
@ExtendWith(MockitoExtension.class)
class HookEventServiceTrackingTest {

    @Mock
    private MessagingClient messaging;

    @Mock
    private StateStore stateStore;

    private PendingMessageTracker tracker;
    private HookEventService service;

    @BeforeEach
    void setUp() {
        tracker = new PendingMessageTracker(messaging, MutableClock.startingAtEpoch(), new BridgeProperties());
        service = new HookEventService(messaging, stateStore, tracker);

        Project project = new Project();
        project.setProjectName("myapp");
        project.setProjectPath("/tmp/myapp");
        project.addInstance(AgentInstance.builder().instanceId("opencode").agentType("opencode").channelId("ch-1").build());
        lenient().when(stateStore.getProject("myapp")).thenReturn(Optional.of(project));
        lenient().when(messaging.maxMessageLength()).thenReturn(3900);
        lenient().when(messaging.sendToChannelWithId("ch-1", "⏳ Processing...")).thenReturn(Optional.of("ts-1"));
    }

    private HookEvent.HookEventBuilder event(String type) {
        return HookEvent.builder().type(type).projectName("myapp").agentType("opencode");
    }

    @Test
    void shouldNotOpenATurnForEmptyIdle() {
        HookResult result = service.handleEvent(event("session.idle").text("").build());

        assertEquals(200, result.getStatus());
        verifyNoInteractions(messaging);
        assertFalse(tracker.getPending("myapp", "opencode", "opencode").isPresent());
    }

    @Test
    void shouldNotOpenATurnForToolActivity() {
        HookResult result = service.handleEvent(event("tool.activity").text("Read a.java").build());

        assertEquals(200, result.getStatus());
        verifyNoInteractions(messaging);
        assertFalse(tracker.hasPending("myapp", "opencode", "opencode"));
    }

    @Test
    void shouldThreadToolActivityBehindACompletedTurn() {
        tracker.markPending("myapp", "opencode", "ch-1", "msg-1", "opencode");
        assertTrue(service.handleEvent(event("session.idle").text("done").build()).isOk());

        HookResult result = service.handleEvent(event("tool.activity").text("Read a.java").build());

        assertEquals(200, result.getStatus());
        verify(messaging).replyInThread("ch-1", "ts-1", "Read a.java");
        verify(messaging).replaceOwnReactionOnMessage("ch-1", "msg-1", "⏳", "✅");
    }

    @Test
    void shouldOpenAndCloseAnAgentInitiatedTurn() {
        HookResult result = service.handleEvent(event("session.idle").text("scheduled job finished").build());

        assertEquals(200, result.getStatus());
        verify(messaging).sendToChannelWithId("ch-1", "⏳ Processing...");
        verify(messaging).sendToChannel("ch-1", "scheduled job finished");
        verify(messaging, never()).replaceOwnReactionOnMessage(anyString(), anyString(), anyString(), anyString());
        assertFalse(tracker.hasPending("myapp", "opencode", "opencode"));
    }
}
