package com.maxdemarzi.kmap.quine;

import java.util.Locale;

/**
 * Two-level form to render. POS minimizes the zero rows and flips literal polarity.
 */
public enum Mode {
    SOP,
    POS;

    public static Mode of(String name) {
        if (name == null || name.isBlank()) {
            return SOP;
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Mode must be SOP or POS, got " + name, e);
        }
    }
}
