package com.martian.mro.loader.ast;

/**
 * Call modifiers. The bare keywords after {@code call} set the flags; the {@code using (...)}
 * block after the argument list populates {@link #getBindings()}.
 */
public final class Modifiers {
    public static final String LOCAL = "local";
    public static final String PREFLIGHT = "preflight";
    public static final String VOLATILE = "volatile";
    public static final String DISABLED = "disabled";

    private final boolean local;
    private final boolean preflight;
    private final boolean volatileFlag;
    private final BindStms bindings;

    public Modifiers(boolean local, boolean preflight, boolean volatileFlag, BindStms bindings) {
        this.local = local;
        this.preflight = preflight;
        this.volatileFlag = volatileFlag;
        this.bindings = bindings;
    }

    public boolean isLocal() {
        return local;
    }

    public boolean isPreflight() {
        return preflight;
    }

    public boolean isVolatile() {
        return volatileFlag;
    }

    /** Returns the bound-form modifiers, or {@code null} when there is no {@code using} block. */
    public BindStms getBindings() {
        return bindings;
    }

    public boolean isEmpty() {
        return !local && !preflight && !volatileFlag && (bindings == null || bindings.isEmpty());
    }
}
