package com.raditha.optchain.config;

/**
 * Configuration for optional-chain detection.
 * Controls which inferred types are accepted when a bare or negated operand is
 * used as a loose truthy/falsy guard.
 *
 * @param checkAny       accept operands typed as {@code any}
 * @param checkUnknown   accept operands typed as {@code unknown}
 * @param checkString    accept operands typed as {@code string}
 * @param checkNumber    accept operands typed as {@code number}
 * @param checkBoolean   accept operands typed as {@code boolean}
 * @param checkBigInt    accept operands typed as {@code bigint}
 * @param requireNullish accept loose guards only when the type includes null or undefined
 */
public record DetectorConfig(
        boolean checkAny,
        boolean checkUnknown,
        boolean checkString,
        boolean checkNumber,
        boolean checkBoolean,
        boolean checkBigInt,
        boolean requireNullish) {

    public static final String PRESET_DEFAULT = "default";
    public static final String PRESET_NULLISH_ONLY = "nullish-only";

    /**
     * Default preset: every type category is accepted as a loose guard.
     */
    public static DetectorConfig defaults() {
        return new DetectorConfig(
                true, // checkAny
                true, // checkUnknown
                true, // checkString
                true, // checkNumber
                true, // checkBoolean
                true, // checkBigInt
                false); // requireNullish
    }

    /**
     * Nullish-only preset: loose guards count only when the operand can be null or undefined.
     */
    public static DetectorConfig nullishOnly() {
        return new DetectorConfig(true, true, true, true, true, true, true);
    }

    /**
     * Resolve a preset by name.
     *
     * @throws IllegalArgumentException for an unknown preset
     */
    public static DetectorConfig preset(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Preset name cannot be null");
        }
        return switch (name) {
            case PRESET_DEFAULT -> defaults();
            case PRESET_NULLISH_ONLY -> nullishOnly();
            default -> throw new IllegalArgumentException(
                    "Unknown preset: " + name + ". Must be: " + PRESET_DEFAULT + " or " + PRESET_NULLISH_ONLY);
        };
    }

    public DetectorConfig withCheckAny(boolean value) {
        return new DetectorConfig(value, checkUnknown, checkString, checkNumber, checkBoolean, checkBigInt, requireNullish);
    }

    public DetectorConfig withCheckUnknown(boolean value) {
        return new DetectorConfig(checkAny, value, checkString, checkNumber, checkBoolean, checkBigInt, requireNullish);
    }

    public DetectorConfig withCheckString(boolean value) {
        return new DetectorConfig(checkAny, checkUnknown, value, checkNumber, checkBoolean, checkBigInt, requireNullish);
    }

    public DetectorConfig withCheckNumber(boolean value) {
        return new DetectorConfig(checkAny, checkUnknown, checkString, value, checkBoolean, checkBigInt, requireNullish);
    }

    public DetectorConfig withCheckBoolean(boolean value) {
        return new DetectorConfig(checkAny, checkUnknown, checkString, checkNumber, value, checkBigInt, requireNullish);
    }

    public DetectorConfig withCheckBigInt(boolean value) {
        return new DetectorConfig(checkAny, checkUnknown, checkString, checkNumber, checkBoolean, value, requireNullish);
    }

    public DetectorConfig withRequireNullish(boolean value) {
        return new DetectorConfig(checkAny, checkUnknown, checkString, checkNumber, checkBoolean, checkBigInt, value);
    }

    /**
     * Get summary for reports, e.g. "any, unknown, string, number, boolean, bigint".
     */
    public String describe() {
        if (requireNullish) {
            return "nullish types only";
        }
        StringBuilder sb = new StringBuilder();
        append(sb, checkAny, "any");
        append(sb, checkUnknown, "unknown");
        append(sb, checkString, "string");
        append(sb, checkNumber, "number");
        append(sb, checkBoolean, "boolean");
        append(sb, checkBigInt, "bigint");
        return sb.length() == 0 ? "object types only" : sb.toString();
    }

    private static void append(StringBuilder sb, boolean enabled, String name) {
        if (!enabled) {
            return;
        }
        if (sb.length() > 0) {
            sb.append(", ");
        }
        sb.append(name);
    }
}
