package io.github.jakubt4.satti.service.store;

import io.github.jakubt4.satti.model.Command;
import io.github.jakubt4.satti.model.GroundStation;
import io.github.jakubt4.satti.model.Satellite;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory home of satellites, ground stations and commands, guarded by one exclusive lock.
 *
 * <p>All three collections share a single mutual-exclusion domain. The collection accessors
 * refuse to run unless the calling thread already holds the lock, so every read or write has
 * to go through {@link #withLock(Supplier)} or {@link #runLocked(Runnable)}. Callers keep the
 * critical section short: no sleeping, disk or network I/O while holding it.
 *
 * <p>Insertion order is preserved so listings come back in creation order. Nothing survives a
 * restart.
 */
@Component
public class MissionStore {

    private final ReentrantLock lock = new ReentrantLock();

    private final Map<String, Satellite> satellites = new LinkedHashMap<>();
    private final Map<String, GroundStation> groundStations = new LinkedHashMap<>();
    private final Map<String, Command> commands = new LinkedHashMap<>();

    public <T> T withLock(final Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    public void runLocked(final Runnable action) {
        lock.lock();
        try {
            action.run();
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Satellite> satellites() {
        requireLock();
        return satellites;
    }

    public Map<String, GroundStation> groundStations() {
        requireLock();
        return groundStations;
    }

    public Map<String, Command> commands() {
        requireLock();
        return commands;
    }

    private void requireLock() {
        if (!lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Mission store accessed without holding its lock");
        }
    }
}
