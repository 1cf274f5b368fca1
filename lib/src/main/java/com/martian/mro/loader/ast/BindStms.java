package com.martian.mro.loader.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public final class BindStms {
    private final AstNode node;
    private final List<BindStm> list = new ArrayList<>();
    private final Map<String, BindStm> table = new HashMap<>();

    public BindStms(AstNode node) {
        this.node = Objects.requireNonNull(node, "node");
    }

    public BindStms(AstNode node, List<BindStm> bindings) {
        this(node);
        for (BindStm binding : bindings) {
            add(binding);
        }
    }

    /**
     * Appends the binding unless its id is already bound.
     *
     * @return the existing binding for that id, or {@code null} if the binding was added
     */
    public BindStm add(BindStm binding) {
        BindStm existing = table.putIfAbsent(binding.getId(), binding);
        if (existing == null) {
            list.add(binding);
        }
        return existing;
    }

    public AstNode getNode() {
        return node;
    }

    public List<BindStm> getList() {
        return Collections.unmodifiableList(list);
    }

    public BindStm get(String id) {
        return table.get(id);
    }

    public boolean isEmpty() {
        return list.isEmpty();
    }
}
