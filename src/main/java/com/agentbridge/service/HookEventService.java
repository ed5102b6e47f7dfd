package com.agentbridge.service;

import com.agentbridge.messaging.MessagingClient;
import com.agentbridge.model.AgentInstance;
import com.agentbridge.model.HookEvent;
import com.agentbridge.model.HookEventType;
import com.agentbridge.model.HookResult;
import com.agentbridge.model.PendingEntry;
import com.agentbridge.model.Project;
import com.agentbridge.model.SendFilesRequest;
import com.agentbridge.state.StateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Handles lifecycle events reported by the agent-side hooks and relays them to
 * the instance's chat channel.
 *
 * <p>Each call returns a {@link HookResult} instead of throwing, so one failed
 * request never affects the next.
 */
@Service
@Slf4j
public class HookEventService {

    static final String REASONING_HEADER = "🧠 *Reasoning*";
    static final String ERROR_PREFIX = "⚠️ Agent session error: ";

    private final MessagingClient messaging;
    private final StateStore stateStore;
    private final PendingMessageTracker pendingTracker;

    public HookEventService(MessagingClient messaging, StateStore stateStore, PendingMessageTracker pendingTracker) {
        this.messaging = messaging;
        this.stateStore = stateStore;
        this.pendingTracker = pendingTracker;
    }

    public HookResult handleEvent(HookEvent event) {
        if (event == null || isBlank(event.getProjectName())) {
            return HookResult.badRequest("Missing projectName");
        }
        Optional<Project> project = stateStore.getProject(event.getProjectName());
        if (project.isEmpty()) {
            return HookResult.badRequest("Unknown project: " + event.getProjectName());
        }
        Optional<AgentInstance> instance = resolveInstance(project.get(), event.getInstanceId(), event.agentTypeOrDefault());
        if (instance.isEmpty() || isBlank(instance.get().getChannelId())) {
            return HookResult.badRequest("No channel found for project/agent");
        }

        HookTarget target = new HookTarget(project.get(), instance.get());
        Optional<String> text = event.resolvedText();
        log.info("[{}] event={} text={}", target.tag(), event.getType(),
            text.map(t -> "(" + t.length() + " chars)").orElse("(empty)"));

        Optional<HookEventType> type = event.eventType();
        if (type.isEmpty()) {
            log.info("[{}] ignoring unsupported event type {}", target.tag(), event.getType());
            return HookResult.ok();
        }

        switch (type.get()) {
            case SESSION_IDLE:
                return handleIdle(target, event);
            case SESSION_ERROR:
                return handleError(target, event);
            case TOOL_ACTIVITY:
                return handleToolActivity(target, text.orElse(null));
            case SESSION_START:
                notifyBestEffort(target, "▶️ Session started" + (isBlank(event.getModel()) ? "" : " (" + event.getModel() + ")"));
                return HookResult.ok();
            case SESSION_END:
                notifyBestEffort(target, "⏹️ Session ended" + (isBlank(event.getReason()) ? "" : ": " + event.getReason()));
                return HookResult.ok();
            case SESSION_NOTIFICATION:
                text.ifPresent(t -> notifyBestEffort(target, "🔔 " + t));
                if (!isBlank(event.getPromptText())) {
                    notifyBestEffort(target, event.getPromptText());
                }
                return HookResult.ok();
            default:
                return HookResult.ok();
        }
    }

    public HookResult sendFiles(SendFilesRequest request) {
        if (request == null || isBlank(request.getProjectName())) {
            return HookResult.badRequest("Missing projectName");
        }
        List<String> files = request.getFiles() != null ? request.getFiles() : List.of();
        if (files.isEmpty()) {
            return HookResult.badRequest("No files provided");
        }
        Optional<Project> project = stateStore.getProject(request.getProjectName());
        if (project.isEmpty()) {
            return HookResult.badRequest("Unknown project: " + request.getProjectName());
        }
        String agentType = isBlank(request.getAgentType()) ? HookEvent.DEFAULT_AGENT_TYPE : request.getAgentType();
        Optional<AgentInstance> instance = resolveInstance(project.get(), request.getInstanceId(), agentType);
        if (instance.isEmpty() || isBlank(instance.get().getChannelId())) {
            return HookResult.badRequest("No channel found for project/agent");
        }

        List<Path> valid = validateFilePaths(files, project.get().getProjectPath());
        if (valid.isEmpty()) {
            return HookResult.badRequest("No valid files");
        }

        HookTarget target = new HookTarget(project.get(), instance.get());
        log.info("[{}] send-files: {} file(s)", target.tag(), valid.size());
        try {
            messaging.sendToChannelWithFiles(target.channelId(), "", valid);
        } catch (Exception e) {
            log.error("[{}] send-files failed", target.tag(), e);
            return HookResult.serverError("Failed to send files");
        }
        return HookResult.ok();
    }

    private HookResult handleIdle(HookTarget target, HookEvent event) {
        HookResult result = relayTurnOutput(target, event, event.resolvedText().orElse(null));
        if (!result.isOk()) {
            return result;
        }
        try {
            pendingTracker.markCompleted(target.projectName(), target.agentType(), target.instanceId());
        } catch (Exception e) {
            log.warn("[{}] markCompleted failed: {}", target.tag(), e.getMessage());
        }
        return result;
    }

    private HookResult handleError(HookTarget target, HookEvent event) {
        String text = ERROR_PREFIX + event.resolvedText().orElse("unknown error");
        HookResult result = relayTurnOutput(target, event, text);
        try {
            pendingTracker.markError(target.projectName(), target.agentType(), target.instanceId());
        } catch (Exception e) {
            log.warn("[{}] markError failed: {}", target.tag(), e.getMessage());
        }
        return result;
    }

    /**
     * Shared body of {@code session.idle} and {@code session.error}: reasoning and
     * intermediate text go to the turn's thread, {@code text} and the prompt go to
     * the channel. An event with nothing to post never opens a turn.
     */
    private HookResult relayTurnOutput(HookTarget target, HookEvent event, String text) {
        boolean threaded = !isBlank(event.getThinking()) || !isBlank(event.getIntermediateText());
        if (text == null && !threaded) {
            return HookResult.ok();
        }

        Optional<PendingEntry> entry;
        try {
            pendingTracker.ensurePending(target.projectName(), target.agentType(), target.channelId(), target.instanceId());
            entry = pendingTracker.getPending(target.projectName(), target.agentType(), target.instanceId());
        } catch (Exception e) {
            log.error("[{}] could not establish a pending turn", target.tag(), e);
            return HookResult.serverError("Failed to track turn");
        }

        if (!isBlank(event.getThinking())) {
            replyBestEffort(target, entry, formatReasoning(event.getThinking()));
        }
        if (!isBlank(event.getIntermediateText())) {
            replyBestEffort(target, entry, event.getIntermediateText());
        }

        if (text != null) {
            try {
                deliverText(target, text, event.getTurnText());
                if (!isBlank(event.getPromptText())) {
                    messaging.sendToChannel(target.channelId(), event.getPromptText());
                }
            } catch (Exception e) {
                log.error("[{}] failed to deliver {} output", target.tag(), event.getType(), e);
                return HookResult.serverError("Failed to deliver output");
            }
        }
        return HookResult.ok();
    }

    private void deliverText(HookTarget target, String text, String turnText) {
        // turnText holds the whole turn, so paths mentioned before the final message are still found
        String searchText = !isBlank(turnText) ? turnText : text;
        List<Path> files = validateFilePaths(ChatTextFormatter.extractFilePaths(searchText), target.project.getProjectPath());

        String display = text;
        if (!files.isEmpty()) {
            List<String> shared = new ArrayList<>();
            files.forEach(file -> shared.add(file.toString()));
            display = ChatTextFormatter.stripFilePaths(text, shared);
        }

        for (String chunk : ChatTextFormatter.split(display, messaging.maxMessageLength())) {
            if (!chunk.isEmpty()) {
                messaging.sendToChannel(target.channelId(), chunk);
            }
        }
        if (!files.isEmpty()) {
            messaging.sendToChannelWithFiles(target.channelId(), "", files);
        }
    }

    /**
     * Threads tool activity under the current or just-finished turn. Activity
     * for an unknown turn is dropped; it never opens one.
     */
    private HookResult handleToolActivity(HookTarget target, String text) {
        Optional<PendingEntry> entry;
        try {
            entry = pendingTracker.getPending(target.projectName(), target.agentType(), target.instanceId());
        } catch (Exception e) {
            log.error("[{}] pending lookup failed for tool activity", target.tag(), e);
            return HookResult.serverError("Failed to track turn");
        }

        if (text == null || entry.isEmpty() || !entry.get().hasThreadAnchor()) {
            return HookResult.ok();
        }
        try {
            messaging.replyInThread(target.channelId(), entry.get().getStartMessageId(), text);
        } catch (Exception e) {
            log.error("[{}] failed to deliver tool activity", target.tag(), e);
            return HookResult.serverError("Failed to deliver tool activity");
        }
        return HookResult.ok();
    }

    private void replyBestEffort(HookTarget target, Optional<PendingEntry> entry, String text) {
        if (entry.isEmpty() || !entry.get().hasThreadAnchor()) {
            log.debug("[{}] no thread anchor, dropping threaded reply", target.tag());
            return;
        }
        try {
            messaging.replyInThread(target.channelId(), entry.get().getStartMessageId(), text);
        } catch (Exception e) {
            log.warn("[{}] thread reply failed: {}", target.tag(), e.getMessage());
        }
    }

    private void notifyBestEffort(HookTarget target, String text) {
        try {
            messaging.sendToChannel(target.channelId(), text);
        } catch (Exception e) {
            log.warn("[{}] notification failed: {}", target.tag(), e.getMessage());
        }
    }

    /**
     * Reasoning as a fenced block under a header, shortened from the front so
     * the whole reply stays within the platform limit.
     */
    String formatReasoning(String thinking) {
        String prefix = REASONING_HEADER + "\n```\n";
        String suffix = "\n```";
        String body = thinking.trim();
        int room = messaging.maxMessageLength() - prefix.length() - suffix.length();
        if (room > 3 && body.length() > room) {
            body = "..." + body.substring(body.length() - (room - 3));
        }
        return prefix + body + suffix;
    }

    private Optional<AgentInstance> resolveInstance(Project project, String instanceId, String agentType) {
        if (!isBlank(instanceId)) {
            Optional<AgentInstance> byId = project.findInstance(instanceId);
            if (byId.isPresent()) {
                return byId;
            }
        }
        return project.primaryInstanceFor(agentType);
    }

    /**
     * Keeps the paths that exist and resolve, after following links, inside the
     * project directory.
     */
    static List<Path> validateFilePaths(List<String> paths, String projectPath) {
        List<Path> valid = new ArrayList<>();
        if (isBlank(projectPath)) {
            return valid;
        }
        Path root;
        try {
            root = Paths.get(projectPath).toRealPath();
        } catch (IOException e) {
            return valid;
        }
        for (String candidate : paths) {
            try {
                Path real = Paths.get(candidate).toRealPath();
                if (real.startsWith(root) && Files.isRegularFile(real)) {
                    valid.add(Paths.get(candidate));
                }
            } catch (IOException | RuntimeException e) {
                log.debug("Rejecting file path {}: {}", candidate, e.getMessage());
            }
        }
        return valid;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    private static final class HookTarget {
        private final Project project;
        private final AgentInstance instance;

        private HookTarget(Project project, AgentInstance instance) {
            this.project = project;
            this.instance = instance;
        }

        String projectName() {
            return project.getProjectName();
        }

        String agentType() {
            return instance.getAgentType();
        }

        String instanceId() {
            return instance.getInstanceId();
        }

        String channelId() {
            return instance.getChannelId();
        }

        String tag() {
            return projectName() + "/" + agentType() + "#" + instanceId();
        }
    }
}
