package com.raditha.optchain.model;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * One constituent of a statically inferred union type.
 */
public enum TypeTag {
    NULL,
    UNDEFINED,
    /** Any object type, including arrays and functions. */
    OBJECT,
    ANY,
    UNKNOWN,
    STRING,
    NUMBER,
    BIGINT,
    /** The literal type {@code true}. */
    TRUE,
    /** The literal type {@code false}. */
    FALSE,
    SYMBOL,
    VOID,
    NEVER;

    /**
     * Expand a type name into its constituent tags. {@code boolean} is {@code true | false}.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static Set<TypeTag> parse(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Type name cannot be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("boolean")) {
            return EnumSet.of(TRUE, FALSE);
        }
        for (TypeTag tag : values()) {
            if (tag.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return EnumSet.of(tag);
            }
        }
        throw new IllegalArgumentException("Unknown type tag: " + name);
    }

    public boolean isNullish() {
        return this == NULL || this == UNDEFINED;
    }
}
