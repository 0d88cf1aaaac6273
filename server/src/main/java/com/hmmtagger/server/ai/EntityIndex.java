package com.hmmtagger.server.ai;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Assigns each distinct symbol a stable zero-based position in registration
 * order. Once frozen (which happens when a matrix is built over it) the index
 * can no longer grow, so every matrix sharing it agrees on the positions.
 *
 * @param <T> symbol type, {@link State} or {@link Observation}
 */
public final class EntityIndex<T> {
    private final Map<T, Integer> positions = new HashMap<>();
    private final List<T> entries = new ArrayList<>();
    private boolean frozen = false;

    public static <T> EntityIndex<T> of(Collection<? extends T> symbols) {
        EntityIndex<T> index = new EntityIndex<>();
        for (T symbol : symbols) {
            index.assign(symbol);
        }
        index.freeze();
        return index;
    }

    /**
     * Registers the symbol and returns its position. Registering a known
     * symbol again returns the position it already has.
     */
    public synchronized int assign(T symbol) {
        Objects.requireNonNull(symbol, "symbol");
        Integer existing = positions.get(symbol);
        if (existing != null) {
            return existing;
        }
        if (frozen) {
            throw new IllegalStateException("Index is frozen, cannot register " + symbol);
        }
        int index = entries.size();
        entries.add(symbol);
        positions.put(symbol, index);
        return index;
    }

    public int indexOf(T symbol) {
        Integer index = symbol == null ? null : positions.get(symbol);
        if (index == null) {
            throw new UnregisteredEntityException(symbol);
        }
        return index;
    }

    public boolean contains(T symbol) {
        return symbol != null && positions.containsKey(symbol);
    }

    public T get(int index) {
        Objects.checkIndex(index, entries.size());
        return entries.get(index);
    }

    public int size() {
        return entries.size();
    }

    public List<T> entries() {
        return Collections.unmodifiableList(entries);
    }

    public synchronized void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    @Override
    public String toString() {
        return "EntityIndex" + entries;
    }
}
