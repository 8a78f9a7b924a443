package com.wayfinder.core.session;

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
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Stores one JSON file per session under a directory.
 * <p>
 * Unreadable files are treated as absent and removed; write failures propagate
 * as {@link UncheckedIOException} so the manager can retry.
 */
public class FileSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(FileSessionStore.class);
    private static final Pattern SAFE_ID = Pattern.compile("[A-Za-z0-9_-]{1,128}");

    private final Path directory;
    private final Clock clock;
    private volatile Consumer<Session> evictionListener = s -> { };
    private final ObjectMapper mapper;
    private final ReentrantLock lock = new ReentrantLock();

    public FileSessionStore(Path directory, Clock clock) {
        this.directory = directory;
        this.clock = clock;
        this.mapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        try {
            Files.createDirectories(directory);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot create session directory " + directory, e);
        }
        log.info("File session store at {}", directory.toAbsolutePath());
    }

    @Override
    public void onEviction(Consumer<Session> listener) {
        this.evictionListener = listener;
    }

    @Override
    public Optional<Session> get(String sessionId) {
        if (sessionId == null || !SAFE_ID.matcher(sessionId).matches()) {
            return Optional.empty();
        }
        Session evicted;
        lock.lock();
        try {
            Path file = fileFor(sessionId);
            if (!Files.exists(file)) {
                return Optional.empty();
            }
            Session session = read(file);
            if (session == null) {
                return Optional.empty();
            }
            if (!session.isExpired(clock.instant())) {
                return Optional.of(session);
            }
            Files.deleteIfExists(file);
            evicted = session;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to access session " + sessionId, e);
        } finally {
            lock.unlock();
        }
        evictionListener.accept(evicted);
        return Optional.empty();
    }

    @Override
    public void save(Session session) {
        if (!SAFE_ID.matcher(session.getId()).matches()) {
            throw new IllegalArgumentException("Unsafe session id: " + session.getId());
        }
        lock.lock();
        try {
            Path target = fileFor(session.getId());
            Path tmp = target.resolveSibling(target.getFileName() + ".tmp");
            mapper.writeValue(tmp.toFile(), session);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save session " + session.getId(), e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean delete(String sessionId) {
        if (sessionId == null || !SAFE_ID.matcher(sessionId).matches()) {
            return false;
        }
        lock.lock();
        try {
            return Files.deleteIfExists(fileFor(sessionId));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to delete session " + sessionId, e);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public List<Session> listActive() {
        var now = clock.instant();
        var active = new ArrayList<Session>();
        for (Session session : readAll()) {
            if (session.isActive(now)) {
                active.add(session);
            }
        }
        return active;
    }

    @Override
    public List<Session> removeExpired() {
        var now = clock.instant();
        var removed = new ArrayList<Session>();
        lock.lock();
        try {
            for (Session session : readAllLocked()) {
                if (session.isExpired(now)) {
                    Files.deleteIfExists(fileFor(session.getId()));
                    removed.add(session);
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to sweep expired sessions", e);
        } finally {
            lock.unlock();
        }
        return removed;
    }

    private List<Session> readAll() {
        lock.lock();
        try {
            return readAllLocked();
        } finally {
            lock.unlock();
        }
    }

    private List<Session> readAllLocked() {
        var sessions = new ArrayList<Session>();
        try (Stream<Path> files = Files.list(directory)) {
            files.filter(p -> p.getFileName().toString().endsWith(".json"))
                    .forEach(p -> {
                        Session s = read(p);
                        if (s != null) sessions.add(s);
                    });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list sessions in " + directory, e);
        }
        return sessions;
    }

    private Session read(Path file) {
        try {
            return mapper.readValue(file.toFile(), Session.class);
        } catch (IOException e) {
            log.warn("Discarding unreadable session file {}: {}", file.getFileName(), e.getMessage());
            try {
                Files.deleteIfExists(file);
            } catch (IOException deleteError) {
                log.warn("Could not remove unreadable session file {}: {}", file.getFileName(), deleteError.getMessage());
            }
            return null;
        }
    }

    private Path fileFor(String sessionId) {
        return directory.resolve(sessionId + ".json");
    }
}
