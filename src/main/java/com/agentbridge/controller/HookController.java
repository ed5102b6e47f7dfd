package com.agentbridge.controller;

import com.agentbridge.model.HookEvent;
import com.agentbridge.model.HookResult;
import com.agentbridge.model.SendFilesRequest;
import com.agentbridge.service.ChannelMappingService;
import com.agentbridge.service.HookEventService;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * HTTP surface called by the agent-side hook scripts.
 */
@Slf4j
@RestController
public class HookController {

    @Autowired
    private HookEventService hookEventService;

    @Autowired
    private ChannelMappingService channelMappingService;

    @Autowired
    private ObjectMapper objectMapper;

    @PostMapping("/opencode-event")
    public ResponseEntity<?> handleEvent(@RequestBody(required = false) String body) {
        HookEvent event;
        try {
            event = parse(body, HookEvent.class);
        } catch (JsonProcessingException e) {
            return respond(HookResult.badRequest("Invalid JSON"));
        }
        return respond(hookEventService.handleEvent(event));
    }

    @PostMapping("/send-files")
    public ResponseEntity<?> sendFiles(@RequestBody(required = false) String body) {
        SendFilesRequest request;
        try {
            request = parse(body, SendFilesRequest.class);
        } catch (JsonProcessingException e) {
            return respond(HookResult.badRequest("Invalid JSON"));
        }
        return respond(hookEventService.sendFiles(request));
    }

    @PostMapping("/reload")
    public ResponseEntity<?> reload() {
        try {
            channelMappingService.reload();
        } catch (Exception e) {
            log.error("Channel mapping reload failed", e);
        }
        return respond(HookResult.ok());
    }

    private <T> T parse(String body, Class<T> type) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            return null;
        }
        return objectMapper.readValue(body, type);
    }

    private ResponseEntity<?> respond(HookResult result) {
        return ResponseEntity.status(result.getStatus()).body(Map.of("message", result.getMessage()));
    }
}
