package com.agentbridge.service;

import com.agentbridge.config.BridgeProperties;
import com.agentbridge.messaging.MessagingClient;
import com.agentbridge.model.AgentInstance;
import com.agentbridge.model.DownloadedFile;
import com.agentbridge.model.InboundMessage;
import com.agentbridge.model.Project;
import com.agentbridge.runtime.AgentRuntime;
import com.agentbridge.state.StateStore;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Turns inbound chat messages into keystrokes in the mapped agent window.
 *
 * <p>The target instance is chosen by channel (or the adapter's mapped instance
 * id), never by agent type alone, so two instances of one agent type in a
 * project stay isolated.
 */
@Service
@Slf4j
public class MessageRouterService {

    static final String INVALID_MESSAGE =
        "⚠️ Invalid message: empty, too long (>10000 chars), or contains invalid characters";
    static final String INSTANCE_NOT_FOUND = "⚠️ Agent instance mapping not found for this channel";

    private static final Pattern MISSING_WINDOW = Pattern.compile("can't find (window|pane)", Pattern.CASE_INSENSITIVE);

    private final MessagingClient messaging;
    private final StateStore stateStore;
    private final AgentRuntime runtime;
    private final PendingMessageTracker pendingTracker;
    private final BufferFallbackPoller fallbackPoller;
    private final InputSanitizer sanitizer;
    private final FileAttachmentService attachmentService;
    private final ContainerFileService containerFileService;
    private final BridgeProperties.Submit submitSettings;

    public MessageRouterService(MessagingClient messaging,
                                StateStore stateStore,
                                AgentRuntime runtime,
                                PendingMessageTracker pendingTracker,
                                BufferFallbackPoller fallbackPoller,
                                InputSanitizer sanitizer,
                                FileAttachmentService attachmentService,
                                ContainerFileService containerFileService,
                                BridgeProperties properties) {
        this.messaging = messaging;
        this.stateStore = stateStore;
        this.runtime = runtime;
        this.pendingTracker = pendingTracker;
        this.fallbackPoller = fallbackPoller;
        this.sanitizer = sanitizer;
        this.attachmentService = attachmentService;
        this.containerFileService = containerFileService;
        this.submitSettings = properties.getSubmit();
    }

    @PostConstruct
    public void register() {
        messaging.onMessage(this::onMessage);
        log.info("Message router registered with {} client", messaging.platform());
    }

    public void onMessage(InboundMessage message) {
        String projectName = message.getProjectName();
        String channelId = message.getChannelId();
        log.info("[{}/{}{}] inbound message: {}", projectName, message.getAgentType(),
            message.getMappedInstanceId() != null ? "#" + message.getMappedInstanceId() : "",
            preview(message.getText()));

        Optional<Project> found = stateStore.getProject(projectName);
        if (found.isEmpty()) {
            log.warn("Project {} not found in state", projectName);
            notify(channelId, "⚠️ Project \"" + projectName + "\" not found in state");
            return;
        }
        Project project = found.get();

        Optional<AgentInstance> resolved = message.getMappedInstanceId() != null
            ? project.findInstance(message.getMappedInstanceId())
            : project.findInstanceByChannel(channelId);
        if (resolved.isEmpty()) {
            notify(channelId, INSTANCE_NOT_FOUND);
            return;
        }
        AgentInstance instance = resolved.get();
        String agentType = instance.getAgentType();
        String instanceId = instance.getInstanceId();

        // The previous turn's poll must not deliver once a newer message is on its way
        fallbackPoller.cancel(projectName, agentType, instanceId);

        String text = message.getText() != null ? message.getText() : "";
        if (message.hasAttachments()) {
            text = text + attachFiles(message, project, instance);
        }

        Optional<String> sanitized = sanitizer.sanitize(text);
        if (sanitized.isEmpty()) {
            notify(channelId, INVALID_MESSAGE);
            return;
        }

        pendingTracker.markPending(projectName, agentType, channelId, message.getMessageId(), instanceId);

        String sessionId = project.getRuntimeSessionId();
        String windowName = instance.windowName();
        try {
            submit(sessionId, windowName, sanitized.get(), agentType);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.warn("[{}/{}#{}] delivery to {}:{} failed: {}", projectName, agentType, instanceId,
                sessionId, windowName, e.getMessage());
            pendingTracker.markError(projectName, agentType, instanceId);
            notify(channelId, deliveryFailureGuidance(projectName, e));
            return;
        }

        fallbackPoller.schedule(FallbackTarget.builder()
            .projectName(projectName)
            .agentType(agentType)
            .instanceId(instanceId)
            .channelId(channelId)
            .sessionId(sessionId)
            .windowName(windowName)
            .build());

        stateStore.updateLastActive(projectName);
    }

    /**
     * Types the prompt, waits, then presses Enter. Some agent CLIs only pick up a
     * leading slash command when the two arrive separately.
     */
    private void submit(String sessionId, String windowName, String prompt, String agentType) throws InterruptedException {
        runtime.typeKeysToWindow(sessionId, windowName, prompt.stripTrailing(), agentType);
        long delayMs = submitSettings.delayFor(agentType);
        if (delayMs > 0) {
            Thread.sleep(delayMs);
        }
        runtime.sendEnterToWindow(sessionId, windowName, agentType);
    }

    private String attachFiles(InboundMessage message, Project project, AgentInstance instance) {
        try {
            List<DownloadedFile> downloaded = attachmentService.download(message.getAttachments(), project.getProjectPath());
            if (downloaded.isEmpty()) {
                return "";
            }
            if (instance.isContainerMode() && instance.getContainerId() != null) {
                String containerDir = containerFileService.containerFilesDir();
                for (DownloadedFile file : downloaded) {
                    if (!containerFileService.injectFile(instance.getContainerId(), file.getLocalPath(), containerDir)) {
                        log.warn("Could not inject {} into container {}", file.getLocalPath(), instance.getContainerId());
                    }
                }
            }
            log.info("[{}/{}] {} file(s) attached", project.getProjectName(), instance.getInstanceId(), downloaded.size());
            return attachmentService.buildFileMarkers(downloaded);
        } catch (Exception e) {
            log.warn("Failed to process file attachments: {}", e.getMessage());
            return "";
        }
    }

    static String deliveryFailureGuidance(String projectName, Exception error) {
        String reason = error.getMessage() != null ? error.getMessage() : "";
        if (MISSING_WINDOW.matcher(reason).find()) {
            return "⚠️ I couldn't deliver your message because the agent tmux window is not running.\n"
                + "Please restart the agent session, then send your message again:\n"
                + "1) `discode new --name " + projectName + "`\n"
                + "2) `discode attach " + projectName + "`";
        }
        return "⚠️ I couldn't deliver your message to the tmux agent session.\n"
            + "Please confirm the agent is running, then try again.\n"
            + "If needed, restart with `discode new --name " + projectName + "`.";
    }

    private void notify(String channelId, String text) {
        try {
            messaging.sendToChannel(channelId, text);
        } catch (Exception e) {
            log.warn("Failed to notify channel {}: {}", channelId, e.getMessage());
        }
    }

    private static String preview(String text) {
        if (text == null) {
            return "";
        }
        return text.length() > 50 ? text.substring(0, 50) + "..." : text;
    }
}
