package com.agentbridge.service;

import com.agentbridge.config.BridgeProperties;
import com.agentbridge.messaging.MessagingClient;
import com.agentbridge.model.PendingEntry;
import com.agentbridge.model.StyledFrame;
import com.agentbridge.runtime.AgentRuntime;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;

/**
 * Delivers the agent's screen when a turn never reports completion through a
 * hook, as happens with interactive menus such as {@code /model}.
 *
 * <p>After a submit, the window is captured at the initial delay and then at
 * each stable interval. Two consecutive identical captures mean the agent is
 * idle; the last prompt block is then posted as a code block and the turn is
 * completed. A buffer still changing after the last check is never posted.
 *
 * <p>There is at most one poll per instance. Scheduling a new one cancels the
 * previous poll, and a cancelled poll has no further side effects.
 */
@Service
@Slf4j
public class BufferFallbackPoller {

    private final TaskScheduler scheduler;
    private final AgentRuntime runtime;
    private final MessagingClient messaging;
    private final PendingMessageTracker pendingTracker;
    private final BridgeProperties.Fallback settings;

    private final Map<String, FallbackPoll> polls = new ConcurrentHashMap<>();

    public BufferFallbackPoller(TaskScheduler scheduler,
                                AgentRuntime runtime,
                                MessagingClient messaging,
                                PendingMessageTracker pendingTracker,
                                BridgeProperties properties) {
        this.scheduler = scheduler;
        this.runtime = runtime;
        this.messaging = messaging;
        this.pendingTracker = pendingTracker;
        this.settings = properties.getFallback();
    }

    public void schedule(FallbackTarget target) {
        PendingEntry turn = pendingTracker
            .getActive(target.getProjectName(), target.getAgentType(), target.getInstanceId())
            .orElse(null);
        FallbackPoll poll = new FallbackPoll(target, turn);
        FallbackPoll previous = polls.put(target.key(), poll);
        if (previous != null) {
            previous.cancel();
        }
        poll.scheduleNext(settings.getInitialDelay());
    }

    /**
     * Cancels the instance's poll, if any. Polls of other instances are untouched.
     */
    public void cancel(String projectName, String agentType, String instanceId) {
        FallbackPoll previous = polls.remove(PendingMessageTracker.key(projectName, agentType, instanceId));
        if (previous != null) {
            previous.cancel();
            log.debug("[{}] fallback cancelled", previous.target.key());
        }
    }

    public boolean isScheduled(String projectName, String agentType, String instanceId) {
        return polls.containsKey(PendingMessageTracker.key(projectName, agentType, instanceId));
    }

    /**
     * Current window text with escapes removed and trailing blank lines dropped,
     * or null when nothing could be captured.
     */
    String captureWindowText(String sessionId, String windowName) {
        try {
            Optional<StyledFrame> frame = runtime.getWindowFrame(sessionId, windowName);
            if (frame.isPresent()) {
                String text = TerminalOutput.trimTrailingBlankLines(TerminalOutput.frameText(frame.get()));
                if (!text.isBlank()) {
                    return text;
                }
            }
        } catch (Exception e) {
            log.debug("Frame capture failed for {}:{}, using buffer: {}", sessionId, windowName, e.getMessage());
        }

        try {
            String buffer = runtime.getWindowBuffer(sessionId, windowName);
            if (buffer == null) {
                return null;
            }
            String text = TerminalOutput.trimTrailingBlankLines(TerminalOutput.stripAnsi(buffer));
            return text.isBlank() ? null : text;
        } catch (Exception e) {
            log.debug("Buffer capture failed for {}:{}: {}", sessionId, windowName, e.getMessage());
            return null;
        }
    }

    private final class FallbackPoll {
        private final FallbackTarget target;
        // Turn this poll was started for; null when nothing was pending at schedule time
        private final PendingEntry turn;
        private volatile boolean cancelled;
        private volatile ScheduledFuture<?> future;
        private int checks;
        private String lastSnapshot;

        private FallbackPoll(FallbackTarget target, PendingEntry turn) {
            this.target = target;
            this.turn = turn;
        }

        void scheduleNext(Duration delay) {
            Instant at = scheduler.getClock().instant().plus(delay);
            future = scheduler.schedule(this::check, at);
        }

        void cancel() {
            cancelled = true;
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }

        private boolean isLive() {
            return !cancelled && polls.get(target.key()) == this;
        }

        private void finish() {
            polls.remove(target.key(), this);
        }

        private synchronized void check() {
            if (!isLive()) {
                return;
            }
            String key = target.key();
            checks++;

            if (!turnStillPending()) {
                log.info("[{}] fallback check #{}: turn already resolved", key, checks);
                finish();
                return;
            }

            String snapshot = captureWindowText(target.getSessionId(), target.getWindowName());
            if (snapshot != null && snapshot.equals(lastSnapshot)) {
                deliver(snapshot);
                finish();
                return;
            }

            if (snapshot == null) {
                log.info("[{}] fallback check #{}: nothing captured", key, checks);
            } else {
                log.info("[{}] fallback check #{}: buffer changed ({} chars)", key, checks, snapshot.length());
            }
            lastSnapshot = snapshot;

            if (checks >= settings.getMaxChecks()) {
                log.info("[{}] fallback: buffer never settled after {} checks, leaving it to the hook", key, checks);
                finish();
                return;
            }
            scheduleNext(settings.getStableInterval());
        }

        private boolean turnStillPending() {
            Optional<PendingEntry> active =
                pendingTracker.getActive(target.getProjectName(), target.getAgentType(), target.getInstanceId());
            return active.isPresent() && (turn == null || active.get() == turn);
        }

        private void deliver(String snapshot) {
            String block = TerminalOutput.extractLastCommandBlock(snapshot, settings.getPromptMarker());
            if (block.isBlank()) {
                return;
            }
            // A newer message may have replaced this poll while the capture ran
            if (!isLive()) {
                return;
            }
            log.info("[{}] fallback: buffer stable ({} -> {} chars), sending", target.key(), snapshot.length(), block.length());
            try {
                messaging.sendToChannel(target.getChannelId(), "```\n" + block + "\n```");
            } catch (Exception e) {
                log.warn("[{}] fallback send failed: {}", target.key(), e.getMessage());
                return;
            }
            if (turn == null) {
                if (isLive()) {
                    pendingTracker.markCompleted(target.getProjectName(), target.getAgentType(), target.getInstanceId());
                }
                return;
            }
            if (!pendingTracker.markCompletedIfCurrent(target.getProjectName(), target.getAgentType(), target.getInstanceId(), turn)) {
                log.info("[{}] fallback: a newer turn started during the send, leaving it pending", target.key());
            }
        }
    }
}
