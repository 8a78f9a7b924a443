package com.wayfinder.core.conversation;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Writes the per-session conversation log with consistent entry shapes for every
 * interaction type and serves history for classification and replay.
 */
@Service
public class ConversationManager {

    private static final Logger log = LoggerFactory.getLogger(ConversationManager.class);

    private final ConversationStore store;
    private final ConversationProperties properties;
    private final Clock clock;

    private final ScheduledExecutorService sweeper = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "conversation-sweeper");
        t.setDaemon(true);
        return t;
    });

    public ConversationManager(ConversationStore store, ConversationProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    void startSweeper() {
        long interval = properties.getCleanupInterval().toMillis();
        sweeper.scheduleAtFixedRate(this::sweep, interval, interval, TimeUnit.MILLISECONDS);
    }

    @PreDestroy
    void stopSweeper() {
        sweeper.shutdown();
        try {
            if (!sweeper.awaitTermination(2, TimeUnit.SECONDS)) {
                sweeper.shutdownNow();
            }
        } catch (InterruptedException e) {
            sweeper.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    public void ensureSession(String sessionId) {
        if (!store.exists(sessionId)) {
            log.info("Initializing conversation for session {}", sessionId);
            store.create(sessionId);
        }
    }

    public void addUserMessage(String sessionId, String text) {
        append(sessionId, ConversationEntry.user(text));
    }

    public void addAssistantMessage(String sessionId, String text, String source) {
        append(sessionId, ConversationEntry.assistant(text, source));
    }

    /**
     * Records a tool invocation made outside the model loop.
     *
     * @return the correlation id to pass to {@link #addToolResult}
     */
    public String addToolUsage(String sessionId, String toolName, Map<String, Object> input) {
        String toolUseId = uniqueToolUseId(sessionId, toolName);
        append(sessionId, ConversationEntry.toolUse(toolUseId, toolName, input));
        return toolUseId;
    }

    public void addToolResult(String sessionId, String toolUseId, Map<String, Object> data,
                              List<ContentBlock.Image> images) {
        append(sessionId, ConversationEntry.toolResult(ContentBlock.ToolResult.of(toolUseId, data, images)));
    }

    public void append(String sessionId, ConversationEntry entry) {
        ensureSession(sessionId);
        store.append(sessionId, entry);
        log.debug("Appended {} entry to session {}", entry.role(), sessionId);
    }

    public List<ConversationEntry> getHistory(String sessionId) {
        return getHistory(sessionId, properties.getMaxMessages());
    }

    /**
     * Most recent {@code maxMessages} entries. A leading tool-result entry whose tool use
     * was cut off is dropped too.
     */
    public List<ConversationEntry> getHistory(String sessionId, int maxMessages) {
        List<ConversationEntry> entries = store.load(sessionId);
        if (maxMessages <= 0 || entries.size() <= maxMessages) {
            return entries;
        }
        log.debug("Trimming conversation for session {} from {} to {} entries",
                sessionId, entries.size(), maxMessages);
        List<ConversationEntry> trimmed = entries.subList(entries.size() - maxMessages, entries.size());
        int start = 0;
        while (start < trimmed.size() && trimmed.get(start).hasOnlyToolResults()) {
            start++;
        }
        return List.copyOf(trimmed.subList(start, trimmed.size()));
    }

    public void clear(String sessionId) {
        if (store.delete(sessionId)) {
            log.info("Cleared conversation for session {}", sessionId);
        }
    }

    int sweep() {
        try {
            int removed = store.cleanupExpired();
            if (removed > 0) {
                log.info("Removed {} stale conversation log(s)", removed);
            }
            return removed;
        } catch (RuntimeException e) {
            log.warn("Conversation sweep failed: {}", e.getMessage(), e);
            return 0;
        }
    }

    private String uniqueToolUseId(String sessionId, String toolName) {
        String base = toolName + "-" + clock.instant().getEpochSecond();
        List<ConversationEntry> entries = store.load(sessionId);
        String candidate = base;
        int suffix = 1;
        while (containsToolUseId(entries, candidate)) {
            candidate = base + "-" + suffix++;
        }
        return candidate;
    }

    private static boolean containsToolUseId(List<ConversationEntry> entries, String id) {
        for (ConversationEntry entry : entries) {
            for (ContentBlock.ToolUse use : entry.toolUses()) {
                if (use.toolUseId().equals(id)) return true;
            }
        }
        return false;
    }
}
