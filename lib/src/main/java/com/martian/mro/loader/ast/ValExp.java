package com.martian.mro.loader.ast;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/** A literal value. Map entries keep source order; formatting sorts them by key. */
public final class ValExp implements Exp {

    public enum Kind {
        INT,
        FLOAT,
        STRING,
        BOOL,
        NULL,
        ARRAY,
        MAP
    }

    private final AstNode node;
    private final Kind kind;
    private final Object scalar;
    private final List<Exp> array;
    private final Map<String, Exp> map;

    private ValExp(AstNode node, Kind kind, Object scalar, List<Exp> array, Map<String, Exp> map) {
        this.node = Objects.requireNonNull(node, "node");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.scalar = scalar;
        this.array = array;
        this.map = map;
    }

    private static ValExp scalar(AstNode node, Kind kind, Object value) {
        return new ValExp(node, kind, value, null, null);
    }

    public static ValExp ofInt(AstNode node, long value) {
        return scalar(node, Kind.INT, value);
    }

    public static ValExp ofFloat(AstNode node, double value) {
        return scalar(node, Kind.FLOAT, value);
    }

    public static ValExp ofString(AstNode node, String value) {
        return scalar(node, Kind.STRING, Objects.requireNonNull(value, "value"));
    }

    public static ValExp ofBool(AstNode node, boolean value) {
        return scalar(node, Kind.BOOL, value);
    }

    public static ValExp ofNull(AstNode node) {
        return scalar(node, Kind.NULL, null);
    }

    public static ValExp ofArray(AstNode node, List<Exp> values) {
        return new ValExp(node, Kind.ARRAY, null, List.copyOf(values), null);
    }

    public static ValExp ofMap(AstNode node, Map<String, Exp> values) {
        return new ValExp(node, Kind.MAP, null, null, Collections.unmodifiableMap(new LinkedHashMap<>(values)));
    }

    @Override
    public AstNode getNode() {
        return node;
    }

    public Kind getKind() {
        return kind;
    }

    public long asInt() {
        return (Long) scalar;
    }

    public double asFloat() {
        return (Double) scalar;
    }

    public String asString() {
        return (String) scalar;
    }

    public boolean asBool() {
        return (Boolean) scalar;
    }

    /** Elements of an ARRAY value, {@code null} for other kinds. */
    public List<Exp> asArray() {
        return array;
    }

    /** Entries of a MAP value, {@code null} for other kinds. */
    public Map<String, Exp> asMap() {
        return map;
    }
}
