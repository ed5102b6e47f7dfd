package com.agentbridge.messaging;

import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * Platform-agnostic chat client. One implementation per chat platform.
 *
 * <p>Send methods throw {@link MessagingException} when the platform rejects the
 * call. Methods with a default body are optional capabilities: a platform that
 * cannot provide them keeps the default.
 */
public interface MessagingClient {

    String platform();

    /**
     * Longest message body the platform accepts comfortably; longer output is split.
     */
    int maxMessageLength();

    void sendToChannel(String channelId, String text);

    /**
     * Sends a message and returns its platform id, or empty when the platform
     * cannot report sent-message ids.
     */
    default Optional<String> sendToChannelWithId(String channelId, String text) {
        return Optional.empty();
    }

    void sendToChannelWithFiles(String channelId, String text, List<Path> filePaths);

    void addReactionToMessage(String channelId, String messageId, String emoji);

    void replaceOwnReactionOnMessage(String channelId, String messageId, String fromEmoji, String toEmoji);

    /**
     * Posts {@code text} as a threaded reply under {@code anchorMessageId}.
     *
     * @return false when the platform has no thread support and nothing was sent
     */
    default boolean replyInThread(String channelId, String anchorMessageId, String text) {
        return false;
    }

    void onMessage(InboundMessageListener listener);

    void registerChannelMappings(List<ChannelMapping> mappings);
}
