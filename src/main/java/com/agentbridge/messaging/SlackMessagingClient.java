package com.agentbridge.messaging;

import com.agentbridge.model.InboundMessage;
import com.agentbridge.model.MessageAttachment;
import com.slack.api.methods.MethodsClient;
import com.slack.api.methods.SlackApiException;
import com.slack.api.methods.SlackApiTextResponse;
import com.slack.api.methods.request.chat.ChatPostMessageRequest;
import com.slack.api.methods.request.files.FilesUploadV2Request;
import com.slack.api.methods.request.reactions.ReactionsAddRequest;
import com.slack.api.methods.request.reactions.ReactionsRemoveRequest;
import com.slack.api.methods.response.chat.ChatPostMessageResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Slack implementation of {@link MessagingClient} on top of the Slack Web API.
 * Inbound events reach it through {@code SlackController}.
 */
@Service
@Slf4j
public class SlackMessagingClient implements MessagingClient {

    static final int SLACK_MESSAGE_LIMIT = 3900;

    private static final Map<String, String> EMOJI_NAMES = Map.of(
        "⏳", "hourglass_flowing_sand",
        "✅", "white_check_mark",
        "❌", "x",
        "⚠️", "warning",
        "🔔", "bell"
    );

    private final MethodsClient methods;
    private final ExecutorService executor;
    private final String slackBotToken;

    private final Map<String, ChannelMapping> channelMappings = new ConcurrentHashMap<>();
    // Tail of the delivery chain per channel; keeps one channel's messages in arrival order
    private final Map<String, CompletableFuture<Void>> channelQueues = new ConcurrentHashMap<>();
    private volatile InboundMessageListener listener;

    public SlackMessagingClient(MethodsClient methods,
                                @Qualifier("inboundMessageExecutor") ExecutorService executor,
                                @Value("${slack.bot.token:}") String slackBotToken) {
        this.methods = methods;
        this.executor = executor;
        this.slackBotToken = slackBotToken;
    }

    @Override
    public String platform() {
        return "slack";
    }

    @Override
    public int maxMessageLength() {
        return SLACK_MESSAGE_LIMIT;
    }

    @Override
    public void sendToChannel(String channelId, String text) {
        postMessage(channelId, null, text);
    }

    @Override
    public Optional<String> sendToChannelWithId(String channelId, String text) {
        return Optional.ofNullable(postMessage(channelId, null, text));
    }

    @Override
    public boolean replyInThread(String channelId, String anchorMessageId, String text) {
        postMessage(channelId, anchorMessageId, text);
        return true;
    }

    @Override
    public void sendToChannelWithFiles(String channelId, String text, List<Path> filePaths) {
        String comment = text;
        for (Path filePath : filePaths) {
            FilesUploadV2Request request = FilesUploadV2Request.builder()
                .channel(channelId)
                .file(filePath.toFile())
                .filename(filePath.getFileName().toString())
                .initialComment(comment == null || comment.isEmpty() ? null : comment)
                .build();
            call("files.uploadV2 " + filePath.getFileName(), () -> methods.filesUploadV2(request));
            // Only the first upload carries the comment
            comment = null;
        }
    }

    @Override
    public void addReactionToMessage(String channelId, String messageId, String emoji) {
        ReactionsAddRequest request = ReactionsAddRequest.builder()
            .channel(channelId)
            .timestamp(messageId)
            .name(toSlackName(emoji))
            .build();
        call("reactions.add", () -> methods.reactionsAdd(request));
    }

    @Override
    public void replaceOwnReactionOnMessage(String channelId, String messageId, String fromEmoji, String toEmoji) {
        ReactionsRemoveRequest remove = ReactionsRemoveRequest.builder()
            .channel(channelId)
            .timestamp(messageId)
            .name(toSlackName(fromEmoji))
            .build();
        try {
            call("reactions.remove", () -> methods.reactionsRemove(remove));
        } catch (MessagingException e) {
            // The old reaction may already be gone; still add the new one
            log.debug("Could not remove {} on {}/{}: {}", fromEmoji, channelId, messageId, e.getMessage());
        }
        addReactionToMessage(channelId, messageId, toEmoji);
    }

    @Override
    public void onMessage(InboundMessageListener listener) {
        this.listener = listener;
    }

    @Override
    public void registerChannelMappings(List<ChannelMapping> mappings) {
        channelMappings.clear();
        for (ChannelMapping mapping : mappings) {
            channelMappings.put(mapping.getChannelId(), mapping);
        }
        log.info("Registered {} Slack channel mapping(s)", channelMappings.size());
    }

    public Optional<ChannelMapping> getChannelMapping(String channelId) {
        return Optional.ofNullable(channelMappings.get(channelId));
    }

    /**
     * Handles an Events API callback. Only plain user messages (or file shares)
     * in mapped channels reach the listener; bot echoes and system subtypes are dropped.
     */
    public void processEvent(Map<String, Object> payload) {
        Map<String, Object> event = (Map<String, Object>) payload.get("event");
        if (event == null || !"message".equals(event.get("type"))) {
            return;
        }
        if (event.get("user") == null || event.get("bot_id") != null) {
            return;
        }
        Object subtype = event.get("subtype");
        if (subtype != null && !"file_share".equals(subtype)) {
            return;
        }

        String channelId = (String) event.get("channel");
        ChannelMapping mapping = channelId != null ? channelMappings.get(channelId) : null;
        if (mapping == null) {
            return;
        }

        InboundMessage message = InboundMessage.builder()
            .agentType(mapping.getAgentType())
            .text(event.get("text") instanceof String text ? text : "")
            .projectName(mapping.getProjectName())
            .channelId(channelId)
            .messageId((String) event.get("ts"))
            .mappedInstanceId(mapping.getInstanceId())
            .attachments(toAttachments(event.get("files")))
            .build();

        channelQueues.compute(channelId, (id, tail) -> {
            CompletableFuture<Void> previous = tail != null ? tail : CompletableFuture.completedFuture(null);
            return previous.thenRunAsync(() -> deliver(message), executor);
        });
    }

    private void deliver(InboundMessage message) {
        InboundMessageListener current = listener;
        if (current == null) {
            log.warn("No inbound listener registered; dropping message for {}", message.getChannelId());
            return;
        }
        try {
            current.onMessage(message);
        } catch (Exception e) {
            log.error("Slack message handler error [{}/{}] channel={}",
                message.getProjectName(), message.getAgentType(), message.getChannelId(), e);
        }
    }

    private List<MessageAttachment> toAttachments(Object files) {
        if (!(files instanceof List<?> list) || list.isEmpty()) {
            return null;
        }
        List<MessageAttachment> attachments = new ArrayList<>();
        for (Object item : list) {
            if (!(item instanceof Map)) {
                continue;
            }
            Map<String, Object> file = (Map<String, Object>) item;
            Object url = file.get("url_private_download") != null ? file.get("url_private_download") : file.get("url_private");
            attachments.add(MessageAttachment.builder()
                .url(url != null ? url.toString() : "")
                .filename(file.get("name") != null ? file.get("name").toString() : "unknown")
                .contentType(file.get("mimetype") != null ? file.get("mimetype").toString() : null)
                .size(file.get("size") instanceof Number n ? n.longValue() : 0L)
                .authHeaders(Map.of("Authorization", "Bearer " + slackBotToken))
                .build());
        }
        return attachments.isEmpty() ? null : attachments;
    }

    private String postMessage(String channel, String threadTs, String text) {
        ChatPostMessageRequest request = ChatPostMessageRequest.builder()
            .channel(channel)
            .threadTs(threadTs)
            .text(text)
            .build();
        ChatPostMessageResponse response = call("chat.postMessage", () -> methods.chatPostMessage(request));
        return response.getTs();
    }

    private <T extends SlackApiTextResponse> T call(String method, SlackCall<T> call) {
        T response;
        try {
            response = call.execute();
        } catch (IOException | SlackApiException e) {
            throw new MessagingException("Slack " + method + " failed: " + e.getMessage(), e);
        }
        if (response == null || !response.isOk()) {
            String error = response != null ? response.getError() : "no response";
            throw new MessagingException("Slack " + method + " failed: " + error);
        }
        return response;
    }

    static String toSlackName(String emoji) {
        String name = EMOJI_NAMES.get(emoji);
        if (name != null) {
            return name;
        }
        return emoji.replace(":", "");
    }

    @FunctionalInterface
    private interface SlackCall<T> {
        T execute() throws IOException, SlackApiException;
    }
}
