package com.agentbridge.controller;

import com.agentbridge.messaging.SlackMessagingClient;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/slack")
public class SlackController {

    @Autowired
    private SlackMessagingClient slackClient;

    @PostMapping("/events")
    public ResponseEntity<?> handleSlackEvent(@RequestBody Map<String, Object> payload,
                                              @RequestHeader(value = "X-Slack-Retry-Num", required = false) String retryNum) {
        if (payload.containsKey("challenge")) {
            return ResponseEntity.ok(Map.of("challenge", payload.get("challenge")));
        }

        // Slack redelivers when the first ack was slow; the original delivery is already queued
        if (retryNum != null) {
            log.debug("Ignoring Slack retry #{}", retryNum);
            return ResponseEntity.ok().build();
        }

        slackClient.processEvent(payload);
        return ResponseEntity.ok().build();
    }

    @GetMapping("/health")
    public ResponseEntity<?> health() {
        return ResponseEntity.ok(Map.of("status", "healthy"));
    }
}
