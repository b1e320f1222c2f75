package com.skylarkarms.cell;

import java.util.function.Supplier;

/**
 * Single-slot arena owned by one {@link PublishedCell}.
 * <p> Holds at most one live instance at a time.
 * The field is plain, visibility to other threads is given by the owner's publication.
 * */
final class Slot<T> {
    private T object;

    /**
     * Builds the instance in this slot.
     * @throws IllegalStateException if a live instance is already present.
     * @throws NullPointerException if the {@code constructor} returned null, the slot remains empty.
     * */
    T emplace(Supplier<? extends T> constructor) {
        if (object != null) throw new IllegalStateException("Slot already holds a live instance: " + object);
        T res = constructor.get();
        if (res == null) throw new NullPointerException("Constructor " + constructor + " returned null.");
        object = res;
        return res;
    }

    /**
     * Runs the {@code destructor} on the live instance and empties the slot.
     * The slot is emptied even if the destructor fails.
     * */
    void destroy(Destructor<? super T> destructor) throws Exception {
        T current = object;
        if (current == null) return;
        object = null;
        destructor.destruct(current);
    }

    boolean isOccupied() { return object != null; }

    @Override
    public String toString() {
        return "Slot{occupied=" + isOccupied() + "}";
    }
}
