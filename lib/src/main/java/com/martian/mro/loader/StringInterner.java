package com.martian.mro.loader;

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;

/**
 * Deduplicates identifier and type-name strings within one compilation unit. Create one per
 * load; instances are not shared between units.
 */
public final class StringInterner {
    private final Interner<String> interner = Interners.newStrongInterner();

    public String intern(String value) {
        return value == null ? null : interner.intern(value);
    }
}
