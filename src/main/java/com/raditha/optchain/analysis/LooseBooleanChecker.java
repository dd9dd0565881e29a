package com.raditha.optchain.analysis;

import com.raditha.optchain.config.DetectorConfig;
import com.raditha.optchain.model.LogicalOperator;
import com.raditha.optchain.model.TypeTag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a bare or negated operand can stand in for a nullish check.
 * <p>
 * {@code foo && foo.bar} only collapses into {@code foo?.bar} when every value
 * {@code foo} can hold is either nullish or something the configuration lets
 * us treat as a plain existence test.
 */
public class LooseBooleanChecker {

    private static final Logger logger = LoggerFactory.getLogger(LooseBooleanChecker.class);

    /**
     * Whether the operand appears as itself or negated with {@code !}.
     */
    public enum BooleanSense {
        POSITIVE,
        NEGATIVE
    }

    private final DetectorConfig config;
    private final TypeService typeService;

    public LooseBooleanChecker(DetectorConfig config, TypeService typeService) {
        this.config = config;
        this.typeService = typeService;
    }

    /**
     * Check one operand.
     *
     * @param nodeId   the operand, or the argument of a {@code !}
     * @param operator operator of the enclosing run
     * @param sense    whether the operand is negated
     * @return true when the operand may join an optional chain
     */
    public boolean isSafe(int nodeId, LogicalOperator operator, BooleanSense sense) {
        Optional<Set<TypeTag>> inferred = typeService.typeOf(nodeId);
        if (inferred.isEmpty() || inferred.get().isEmpty()) {
            logger.debug("No type information for node {}, rejecting loose check", nodeId);
            return false;
        }
        Set<TypeTag> types = inferred.get();

        // the test has already narrowed `false` out of the type at this point
        boolean narrowsOutFalse = (operator == LogicalOperator.OR && sense == BooleanSense.NEGATIVE)
                || (operator == LogicalOperator.AND && sense == BooleanSense.POSITIVE);
        if (narrowsOutFalse && types.contains(TypeTag.FALSE)) {
            return false;
        }

        if (config.requireNullish()) {
            return types.stream().anyMatch(TypeTag::isNullish);
        }
        return types.stream().allMatch(this::isAllowed);
    }

    private boolean isAllowed(TypeTag tag) {
        return switch (tag) {
            case NULL, UNDEFINED, OBJECT -> true;
            case ANY -> config.checkAny();
            case UNKNOWN -> config.checkUnknown();
            case STRING -> config.checkString();
            case NUMBER -> config.checkNumber();
            case TRUE, FALSE -> config.checkBoolean();
            case BIGINT -> config.checkBigInt();
            case SYMBOL, VOID, NEVER -> false;
        };
    }
}
