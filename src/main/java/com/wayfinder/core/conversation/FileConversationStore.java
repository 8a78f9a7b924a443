package com.wayfinder.core.conversation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * One JSON file per session. Files untouched for longer than {@code retention} are purged.
 */
public class FileConversationStore implements ConversationStore {

    private static final Logger log = LoggerFactory.getLogger(FileConversationStore.class);
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");
    private static final TypeReference<List<ConversationEntry>> ENTRY_LIST = new TypeReference<>() {};

    private final Path directory;
    private final Clock clock;
    private final Duration retention;
    private final ObjectMapper mapper;
    private final ReentrantLock lock = new ReentrantLock();

    public FileConversationStore(Path directory, Clock clock, Duration retention) {
        this.directory = directory;
        this.clock = clock;
        this.retention = retention;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create conversation directory " + directory, e);
        }
    }

    @Override
    public boolean exists(String sessionId) {
        return isSafe(sessionId) && Files.exists(fileFor(sessionId));
    }

    @Override
    public List<ConversationEntry> load(String sessionId) {
        if (!isSafe(sessionId)) {
            return List.of();
        }
        lock.lock();
        try {
            return readLocked(sessionId);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void append(String sessionId, ConversationEntry entry) {
        requireSafe(sessionId);
        lock.lock();
        try {
            var entries = new ArrayList<>(readLocked(sessionId));
            entries.add(entry);
            write(sessionId, entries);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void create(String sessionId) {
        requireSafe(sessionId);
        lock.lock();
        try {
            if (!Files.exists(fileFor(sessionId))) {
                write(sessionId, List.of());
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String sessionId) {
        if (!isSafe(sessionId)) {
            return false;
        }
        lock.lock();
        try {
            return Files.deleteIfExists(fileFor(sessionId));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete conversation " + sessionId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int cleanupExpired() {
        FileTime cutoff = FileTime.from(clock.instant().minus(retention));
        int removed = 0;
        lock.lock();
        try (Stream<Path> files = Files.list(directory)) {
            for (Path file : (Iterable<Path>) files::iterator) {
                if (file.getFileName().toString().endsWith(".json")
                        && Files.getLastModifiedTime(file).compareTo(cutoff) < 0) {
                    Files.deleteIfExists(file);
                    removed++;
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to purge conversations in " + directory, e);
        } finally {
            lock.unlock();
        }
        return removed;
    }

    private List<ConversationEntry> readLocked(String sessionId) {
        Path file = fileFor(sessionId);
        if (!Files.exists(file)) {
            return List.of();
        }
        try {
            return mapper.readValue(file.toFile(), ENTRY_LIST);
        } catch (IOException e) {
            log.warn("Conversation file for session {} is unreadable, starting fresh: {}", sessionId, e.getMessage());
            return List.of();
        }
    }

    private void write(String sessionId, List<ConversationEntry> entries) {
        Path target = fileFor(sessionId);
        Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
        try {
            mapper.writeValue(tmp.toFile(), entries);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write conversation " + sessionId, e);
        }
    }

    private Path fileFor(String sessionId) {
        return directory.resolve(sessionId + ".json");
    }

    private static boolean isSafe(String sessionId) {
        return sessionId != null && SAFE_ID.matcher(sessionId).matches();
    }

    private static void requireSafe(String sessionId) {
        if (!isSafe(sessionId)) {
            throw new IllegalArgumentException("Unsafe session id: " + sessionId);
        }
    }
}
