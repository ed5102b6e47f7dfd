package com.agentbridge.service;

import com.agentbridge.config.BridgeProperties;
import com.agentbridge.messaging.MessagingClient;
import com.agentbridge.model.PendingEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Acknowledgement state per in-flight turn, keyed by project and instance.
 *
 * <p>A turn goes pending (⏳) and ends completed (✅) or errored (❌). Completed
 * entries stay readable through {@link #getPending} for a short while so that
 * tool activity racing behind the completion still finds its thread anchor.
 * Messaging failures are logged here and never reach the caller.
 */
@Service
@Slf4j
public class PendingMessageTracker {

    static final String PENDING_EMOJI = "⏳";
    static final String COMPLETED_EMOJI = "✅";
    static final String ERROR_EMOJI = "❌";
    static final String PROCESSING_TEXT = "⏳ Processing...";

    private final MessagingClient messaging;
    private final Clock clock;
    private final Duration recentlyCompletedTtl;

    private final Map<String, PendingEntry> pending = new ConcurrentHashMap<>();
    private final Map<String, CompletedEntry> recentlyCompleted = new ConcurrentHashMap<>();

    public PendingMessageTracker(MessagingClient messaging, Clock clock, BridgeProperties properties) {
        this.messaging = messaging;
        this.clock = clock;
        this.recentlyCompletedTtl = properties.getPending().getRecentlyCompletedTtl();
    }

    public void markPending(String projectName, String agentType, String channelId, String messageId, String instanceId) {
        String key = key(projectName, agentType, instanceId);
        recentlyCompleted.remove(key);

        if (messageId != null && !messageId.isEmpty()) {
            try {
                messaging.addReactionToMessage(channelId, messageId, PENDING_EMOJI);
            } catch (Exception e) {
                log.warn("Failed to add pending reaction [{}]: {}", key, e.getMessage());
            }
        }

        String startMessageId = null;
        try {
            startMessageId = messaging.sendToChannelWithId(channelId, PROCESSING_TEXT).orElse(null);
        } catch (Exception e) {
            log.warn("Failed to send processing placeholder [{}]: {}", key, e.getMessage());
        }

        pending.put(key, PendingEntry.builder()
            .channelId(channelId)
            .messageId(messageId)
            .startMessageId(startMessageId)
            .build());
    }

    public void markCompleted(String projectName, String agentType, String instanceId) {
        String key = key(projectName, agentType, instanceId);
        finish(key, pending.remove(key), COMPLETED_EMOJI);
    }

    /**
     * Completes the turn only if {@code turn} is still the active entry for the
     * key. A newer {@code markPending} for the same instance leaves it untouched.
     *
     * @return true when {@code turn} was completed
     */
    public boolean markCompletedIfCurrent(String projectName, String agentType, String instanceId, PendingEntry turn) {
        String key = key(projectName, agentType, instanceId);
        if (turn == null) {
            return false;
        }
        // Identity, not equals: two turns without message ids compare equal
        AtomicBoolean removed = new AtomicBoolean();
        pending.computeIfPresent(key, (k, current) -> {
            if (current != turn) {
                return current;
            }
            removed.set(true);
            return null;
        });
        if (!removed.get()) {
            return false;
        }
        finish(key, turn, COMPLETED_EMOJI);
        return true;
    }

    public void markError(String projectName, String agentType, String instanceId) {
        String key = key(projectName, agentType, instanceId);
        finish(key, pending.remove(key), ERROR_EMOJI);
    }

    public boolean hasPending(String projectName, String agentType, String instanceId) {
        return pending.containsKey(key(projectName, agentType, instanceId));
    }

    /**
     * The active entry only; the recently-completed cache is not consulted.
     */
    public Optional<PendingEntry> getActive(String projectName, String agentType, String instanceId) {
        return Optional.ofNullable(pending.get(key(projectName, agentType, instanceId)));
    }

    /**
     * Active entry for the key, else a recently completed one still inside its
     * retention window.
     */
    public Optional<PendingEntry> getPending(String projectName, String agentType, String instanceId) {
        String key = key(projectName, agentType, instanceId);
        PendingEntry active = pending.get(key);
        if (active != null) {
            return Optional.of(active);
        }
        return recent(key);
    }

    /**
     * Starts tracking an agent-initiated turn unless one is already known for the
     * key. Safe to call for every event of a turn.
     */
    public void ensurePending(String projectName, String agentType, String channelId, String instanceId) {
        String key = key(projectName, agentType, instanceId);
        if (pending.containsKey(key) || recent(key).isPresent()) {
            return;
        }
        markPending(projectName, agentType, channelId, null, instanceId);
    }

    private void finish(String key, PendingEntry entry, String emoji) {
        if (entry == null) {
            return;
        }
        if (entry.hasMessageId()) {
            try {
                messaging.replaceOwnReactionOnMessage(entry.getChannelId(), entry.getMessageId(), PENDING_EMOJI, emoji);
            } catch (Exception e) {
                log.warn("Failed to set {} reaction [{}]: {}", emoji, key, e.getMessage());
            }
        }
        recentlyCompleted.put(key, new CompletedEntry(entry, Instant.now(clock)));
    }

    private Optional<PendingEntry> recent(String key) {
        CompletedEntry completed = recentlyCompleted.get(key);
        if (completed == null) {
            return Optional.empty();
        }
        if (completed.completedAt.plus(recentlyCompletedTtl).isBefore(Instant.now(clock))) {
            recentlyCompleted.remove(key, completed);
            return Optional.empty();
        }
        return Optional.of(completed.entry);
    }

    static String key(String projectName, String agentType, String instanceId) {
        String instance = instanceId != null && !instanceId.isEmpty() ? instanceId : agentType;
        return projectName + ":" + instance;
    }

    private static final class CompletedEntry {
        private final PendingEntry entry;
        private final Instant completedAt;

        private CompletedEntry(PendingEntry entry, Instant completedAt) {
            this.entry = entry;
            this.completedAt = completedAt;
        }
    }
}
