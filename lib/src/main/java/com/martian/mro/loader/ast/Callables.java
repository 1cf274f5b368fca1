package com.martian.mro.loader.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Stages and pipelines in declaration order, addressable by id. */
public final class Callables {
    private final List<Callable> list = new ArrayList<>();
    private final Map<String, Callable> table = new HashMap<>();

    /**
     * Adds the callable unless one with the same id is already present.
     *
     * @return the previously registered callable with that id, or {@code null} if it was added
     */
    public Callable add(Callable callable) {
        Callable existing = table.putIfAbsent(callable.getId(), callable);
        if (existing == null) {
            list.add(callable);
        }
        return existing;
    }

    public List<Callable> getList() {
        return Collections.unmodifiableList(list);
    }

    public Callable get(String id) {
        return table.get(id);
    }

    public boolean isEmpty() {
        return list.isEmpty();
    }

    public int size() {
        return list.size();
    }
}
