package com.skylarkarms.cell;

import java.util.NoSuchElementException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Explicit owner of a group of {@link PublishedCell}s, keyed by type.
 * <p> Values are constructed once per key, even when opened concurrently,
 * threads that lose the race wait for the winner's publication.
 * <p> {@link #close()} tears every cell down in reverse registration order.
 * */
public final class CellScope implements AutoCloseable {
    private final ConcurrentHashMap<Class<?>, PublishedCell<?>> cells = new ConcurrentHashMap<>();
    private final ConcurrentLinkedDeque<PublishedCell<?>> order = new ConcurrentLinkedDeque<>();
    private final AtomicBoolean closed = new AtomicBoolean();
    private final Locks.Config config;

    public CellScope() {
        this(Locks.getGlobalConfig());
    }

    /**
     * @param config the waiting strategy of every cell opened by this scope.
     * */
    public CellScope(Locks.Config config) {
        if (config == null) throw new NullPointerException("`config` was null");
        this.config = config;
    }

    private void closedException() {
        if (closed.get()) throw new IllegalStateException("CellScope@" + hashCode() + " is closed.");
    }

    /**
     * @see #open(Class, Destructor, Supplier)
     * */
    public <T> T open(Class<T> key, Supplier<? extends T> constructor) {
        return open(key, Destructor.defaultDestruct(), constructor);
    }

    /**
     * Returns the instance registered under {@code key}, constructing it with {@code constructor}
     * if no cell was registered yet.
     * <p> If another thread is constructing the same key, this call waits for it.
     * @throws IllegalStateException if this scope is closed, or the winning constructor failed.
     * */
    public <T> T open(Class<T> key, Destructor<? super T> destructor, Supplier<? extends T> constructor) {
        if (key == null) throw new NullPointerException("`key` was null");
        closedException();
        PublishedCell<?> existing = cells.get(key);
        if (existing != null) return key.cast(existing.get());

        PublishedCell<T> fresh = new PublishedCell<>(destructor, config);
        PublishedCell<?> prev = cells.putIfAbsent(key, fresh);
        if (prev != null) return key.cast(prev.get());

        order.push(fresh);
        T res = fresh.construct(constructor);
        if (closed.get()) {
            fresh.tearDown();
            throw new IllegalStateException("CellScope@" + hashCode() + " was closed while constructing " + key.getName());
        }
        return res;
    }

    /**
     * Adopts an externally built cell, its teardown will be performed by {@link #close()}.
     * */
    public <T> PublishedCell<T> register(PublishedCell<T> cell) {
        if (cell == null) throw new NullPointerException("`cell` was null");
        closedException();
        order.push(cell);
        if (closed.get()) {
            cell.tearDown();
            throw new IllegalStateException("CellScope@" + hashCode() + " was closed while registering " + cell);
        }
        return cell;
    }

    /**
     * @throws NoSuchElementException if nothing was opened under {@code key}.
     * */
    public <T> T get(Class<T> key) {
        closedException();
        PublishedCell<?> cell = cells.get(key);
        if (cell == null) throw new NoSuchElementException("No cell opened for " + key);
        return key.cast(cell.get());
    }

    public boolean contains(Class<?> key) { return cells.containsKey(key); }

    public boolean isClosed() { return closed.get(); }

    /**
     * Tears down every cell, last registered first.
     * <p> All cells are attempted, the first failure is thrown with the rest as suppressed exceptions.
     * Subsequent calls have no effect.
     * */
    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) return;
        RuntimeException failure = null;
        PublishedCell<?> cell;
        while ((cell = order.poll()) != null) {
            try {
                cell.tearDown();
            } catch (RuntimeException e) {
                if (failure == null) failure = e;
                else failure.addSuppressed(e);
            }
        }
        cells.clear();
        if (failure != null) throw failure;
    }

    @Override
    public String toString() {
        return "CellScope@" + hashCode() + "{" +
                "\n >>> closed=" + closed.get() +
                ",\n >>> keys=" + cells.keySet() +
                ",\n >>> config=\n" + config.toString().indent(3) +
                "}";
    }
}
