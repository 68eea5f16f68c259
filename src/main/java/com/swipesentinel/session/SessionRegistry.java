package com.swipesentinel.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Named live sessions and their lifecycle: create, start, stop, await, remove.
 *
 * Each started session runs on its own single-thread executor, so the cycle
 * phases of one session never overlap and sessions never share loop state.
 *
 * ## Thread Safety
 * All operations may be called from any thread.
 */
public class SessionRegistry {

    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private static final class Entry {
        final LiveSession             session;
        volatile ExecutorService      executor;
        volatile Future<SessionResult> future;

        Entry(LiveSession session) { this.session = session; }
    }

    private final Map<String, Entry> sessions = new ConcurrentHashMap<>();

    /** @throws IllegalStateException if a session with the same name is already registered */
    public LiveSession create(LiveSession session) {
        Entry existing = sessions.putIfAbsent(session.getName(), new Entry(session));
        if (existing != null) {
            throw new IllegalStateException("Session '" + session.getName() + "' already exists");
        }
        log.info("SessionRegistry: created '{}'", session.getName());
        return session;
    }

    /** @throws IllegalStateException if the session is unknown or already started */
    public synchronized void start(String name) {
        Entry entry = require(name);
        if (entry.future != null) throw new IllegalStateException("Session '" + name + "' already started");
        entry.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "session-" + name);
            t.setDaemon(true);
            return t;
        });
        entry.future = entry.executor.submit(entry.session::run);
        log.info("SessionRegistry: started '{}'", name);
    }

    /** Signals the session to stop before its next cycle. Does not wait. */
    public void stop(String name) {
        require(name).session.requestStop();
    }

    /**
     * Waits for a started session to finish.
     *
     * @throws IllegalStateException if the session was never started, failed, or did not finish in time
     */
    public SessionResult await(String name, Duration timeout) {
        Entry entry = require(name);
        if (entry.future == null) throw new IllegalStateException("Session '" + name + "' was not started");
        try {
            return entry.future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while awaiting session '" + name + "'", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Session '" + name + "' failed: " + e.getCause().getMessage(), e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Session '" + name + "' did not finish within " + timeout, e);
        }
    }

    /** Stops (if running) and forgets the session. */
    public void remove(String name) {
        Entry entry = sessions.remove(name);
        if (entry == null) return;
        entry.session.requestStop();
        if (entry.executor != null) entry.executor.shutdown();
        log.info("SessionRegistry: removed '{}'", name);
    }

    public Optional<LiveSession> get(String name) {
        Entry entry = sessions.get(name);
        return entry != null ? Optional.of(entry.session) : Optional.empty();
    }

    public boolean isRunning(String name) {
        Entry entry = sessions.get(name);
        return entry != null && entry.future != null && !entry.future.isDone();
    }

    public Set<String> names() {
        return Set.copyOf(sessions.keySet());
    }

    /** Stops and removes every session. */
    public void shutdownAll() {
        for (String name : names()) remove(name);
    }

    private Entry require(String name) {
        Entry entry = sessions.get(name);
        if (entry == null) throw new IllegalStateException("Unknown session '" + name + "'");
        return entry;
    }
}
