package com.agentbridge.controller;

import com.agentbridge.model.HookEvent;
import com.agentbridge.model.HookResult;
import com.agentbridge.model.SendFilesRequest;
import com.agentbridge.service.ChannelMappingService;
import com.agentbridge.service.HookEventService;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HookController.class)
class HookControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private HookEventService hookEventService;

    @MockBean
    private ChannelMappingService channelMappingService;

    @Test
    void shouldPassParsedEventToService() throws Exception {
        when(hookEventService.handleEvent(any())).thenReturn(HookResult.ok());

        mockMvc.perform(post("/opencode-event")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"session.idle\",\"projectName\":\"myapp\",\"agentType\":\"claude\","
                    + "\"instanceId\":\"claude-2\",\"text\":\"done\",\"hookVersion\":3}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.message").value("OK"));

        ArgumentCaptor<HookEvent> event = ArgumentCaptor.forClass(HookEvent.class);
        verify(hookEventService).handleEvent(event.capture());
        assertEquals("session.idle", event.getValue().getType());
        assertEquals("claude-2", event.getValue().getInstanceId());
        assertEquals("done", event.getValue().getText());
    }

    @Test
    void shouldRejectMalformedJson() throws Exception {
        mockMvc.perform(post("/opencode-event")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{not json"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Invalid JSON"));

        verifyNoInteractions(hookEventService);
    }

    @Test
    void shouldRenderServiceStatus() throws Exception {
        when(hookEventService.handleEvent(any())).thenReturn(HookResult.badRequest("Unknown project"));

        mockMvc.perform(post("/opencode-event")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"type\":\"session.idle\",\"projectName\":\"ghost\"}"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Unknown project"));
    }

    @Test
    void shouldPassNullForEmptyBody() throws Exception {
        when(hookEventService.handleEvent(isNull())).thenReturn(HookResult.badRequest("Missing projectName"));

        mockMvc.perform(post("/opencode-event").contentType(MediaType.APPLICATION_JSON))
            .andExpect(status().isBadRequest());
    }

    @Test
    void shouldForwardSendFilesRequest() throws Exception {
        when(hookEventService.sendFiles(any())).thenReturn(HookResult.serverError("Failed to send files"));

        mockMvc.perform(post("/send-files")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"projectName\":\"myapp\",\"files\":[\"/tmp/myapp/out.png\"]}"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.message").value("Failed to send files"));

        ArgumentCaptor<SendFilesRequest> request = ArgumentCaptor.forClass(SendFilesRequest.class);
        verify(hookEventService).sendFiles(request.capture());
        assertEquals(List.of("/tmp/myapp/out.png"), request.getValue().getFiles());
    }

    @Test
    void shouldReloadMappings() throws Exception {
        mockMvc.perform(post("/reload"))
            .andExpect(status().isOk());

        verify(channelMappingService).reload();
    }

    @Test
    void shouldAnswerOkEvenWhenReloadFails() throws Exception {
        doThrow(new IllegalStateException("state unreadable")).when(channelMappingService).reload();

        mockMvc.perform(post("/reload"))
            .andExpect(status().isOk());
    }
}
