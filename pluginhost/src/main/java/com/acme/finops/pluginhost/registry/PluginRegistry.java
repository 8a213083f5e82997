package com.acme.finops.pluginhost.registry;

import com.acme.finops.pluginhost.manifest.PluginKey;
import com.acme.finops.pluginhost.process.PluginHandle;
import com.acme.finops.pluginhost.process.PluginState;
import com.acme.finops.pluginhost.process.PluginStateChange;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Live plugin handles in declaration order.
 *
 * <p>Each entry has its own read-write lock: issuing a call takes the read lock, reaping a crashed or
 * stopped handle takes the write lock, so no call starts on a handle after it was reaped. A key keeps its
 * declaration rank for the registry's lifetime, so a restarted plugin keeps its precedence.</p>
 *
 * <p>When constructed with a state-change queue, a daemon pump thread drains it and reaps entries whose
 * handle reached CRASHED or STOPPED.</p>
 */
public final class PluginRegistry implements AutoCloseable {
    private static final Logger LOG = Logger.getLogger(PluginRegistry.class.getName());

    private final ConcurrentHashMap<PluginKey, Entry> entries = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<PluginKey, Long> ranks = new ConcurrentHashMap<>();
    private final AtomicLong nextRank = new AtomicLong();
    private final CopyOnWriteArrayList<Consumer<PluginStateChange>> listeners = new CopyOnWriteArrayList<>();
    private final AtomicBoolean running = new AtomicBoolean(true);
    private final Thread pump;

    public PluginRegistry() {
        this.pump = null;
    }

    public PluginRegistry(BlockingQueue<PluginStateChange> stateChanges) {
        Objects.requireNonNull(stateChanges, "stateChanges");
        this.pump = new Thread(() -> pumpLoop(stateChanges), "plugin-registry-pump");
        this.pump.setDaemon(true);
        this.pump.start();
    }

    /**
     * Adds or replaces the handle for its key.
     */
    public void register(PluginHandle handle) {
        Objects.requireNonNull(handle, "handle");
        long rank = ranks.computeIfAbsent(handle.key(), k -> nextRank.getAndIncrement());
        entries.compute(handle.key(), (k, existing) -> {
            if (existing == null) {
                return new Entry(handle, rank);
            }
            existing.lock.writeLock().lock();
            try {
                existing.handle = handle;
            } finally {
                existing.lock.writeLock().unlock();
            }
            return existing;
        });
        LOG.fine(() -> "registry register plugin=" + handle.key() + " rank=" + rank);
    }

    public Optional<PluginHandle> get(PluginKey key) {
        Entry e = entries.get(key);
        return e == null ? Optional.empty() : Optional.of(e.handle);
    }

    public Optional<PluginHandle> remove(PluginKey key) {
        Entry e = entries.remove(key);
        return e == null ? Optional.empty() : Optional.of(e.handle);
    }

    /**
     * All registered handles, in declaration order, whatever their state.
     */
    public List<PluginHandle> handles() {
        List<PluginHandle> out = new ArrayList<>();
        for (Entry e : ordered()) {
            out.add(e.handle);
        }
        return out;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Applies {@code action} to every READY handle in declaration order while holding that entry's read
     * lock. Entries that are not ready are skipped. The lock is released when {@code action} returns, so
     * {@code action} should only issue work, not wait for it.
     */
    public <T> List<T> withReadyHandles(Function<PluginHandle, Optional<T>> action) {
        List<T> out = new ArrayList<>();
        for (Entry e : ordered()) {
            e.lock.readLock().lock();
            try {
                PluginHandle h = e.handle;
                if (h.state() == PluginState.READY) {
                    action.apply(h).ifPresent(out::add);
                }
            } finally {
                e.lock.readLock().unlock();
            }
        }
        return out;
    }

    public void addListener(Consumer<PluginStateChange> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Handles one lifecycle event: terminal states reap the matching entry.
     */
    public void onStateChange(PluginStateChange change) {
        if (change.to().isTerminal()) {
            Entry e = entries.get(change.key());
            if (e != null) {
                e.lock.writeLock().lock();
                try {
                    if (e.handle.handleId() == change.handleId()) {
                        entries.remove(change.key(), e);
                        LOG.info(() -> "registry reaped plugin=" + change.key() + " state=" + change.to()
                            + " reason=" + change.reason());
                    }
                } finally {
                    e.lock.writeLock().unlock();
                }
            }
        }
        for (Consumer<PluginStateChange> l : listeners) {
            try {
                l.accept(change);
            } catch (RuntimeException ex) {
                LOG.log(Level.WARNING, "registry listener failed for change " + change, ex);
            }
        }
    }

    private void pumpLoop(BlockingQueue<PluginStateChange> stateChanges) {
        while (running.get()) {
            try {
                onStateChange(stateChanges.take());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
        }
    }

    private List<Entry> ordered() {
        List<Entry> snapshot = new ArrayList<>(entries.values());
        snapshot.sort(Comparator.comparingLong(e -> e.rank));
        return snapshot;
    }

    @Override
    public void close() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        if (pump != null) {
            pump.interrupt();
        }
    }

    private static final class Entry {
        private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
        private final long rank;
        private volatile PluginHandle handle;

        private Entry(PluginHandle handle, long rank) {
            this.handle = handle;
            this.rank = rank;
        }
    }
}
