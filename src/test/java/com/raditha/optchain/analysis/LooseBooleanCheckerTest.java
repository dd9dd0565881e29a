package com.raditha.optchain.analysis;

import com.raditha.optchain.analysis.LooseBooleanChecker.BooleanSense;
import com.raditha.optchain.config.DetectorConfig;
import com.raditha.optchain.model.LogicalOperator;
import com.raditha.optchain.model.TypeTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.EnumSet;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LooseBooleanCheckerTest {

    private static final int NODE = 7;

    @Mock
    private TypeService typeService;

    private LooseBooleanChecker checker;

    @BeforeEach
    void setUp() {
        checker = new LooseBooleanChecker(DetectorConfig.defaults(), typeService);
    }

    private void typed(TypeTag first, TypeTag... rest) {
        when(typeService.typeOf(NODE)).thenReturn(Optional.of(EnumSet.of(first, rest)));
    }

    @Test
    void testObjectOrUndefinedIsSafe() {
        typed(TypeTag.OBJECT, TypeTag.UNDEFINED);
        assertTrue(checker.isSafe(NODE, LogicalOperator.AND, BooleanSense.POSITIVE));
    }

    @Test
    void testMissingTypeIsUnsafe() {
        when(typeService.typeOf(NODE)).thenReturn(Optional.empty());
        assertFalse(checker.isSafe(NODE, LogicalOperator.AND, BooleanSense.POSITIVE));
    }

    @Test
    void testFalseIsNarrowedOutByTruthyAnd() {
        typed(TypeTag.FALSE, TypeTag.OBJECT);
        assertFalse(checker.isSafe(NODE, LogicalOperator.AND, BooleanSense.POSITIVE));
    }

    @Test
    void testFalseIsNarrowedOutByNegatedOr() {
        typed(TypeTag.FALSE, TypeTag.OBJECT);
        assertFalse(checker.isSafe(NODE, LogicalOperator.OR, BooleanSense.NEGATIVE));
    }

    @Test
    void testFalseIsAcceptedInOtherPositions() {
        typed(TypeTag.FALSE, TypeTag.OBJECT);
        assertTrue(checker.isSafe(NODE, LogicalOperator.AND, BooleanSense.NEGATIVE));
        assertTrue(checker.isSafe(NODE, LogicalOperator.OR, BooleanSense.POSITIVE));
    }

    @Test
    void testCategoryFlags() {
        typed(TypeTag.STRING, TypeTag.UNDEFINED);
        assertTrue(checker.isSafe(NODE, LogicalOperator.AND, BooleanSense.POSITIVE));

        LooseBooleanChecker strict = new LooseBooleanChecker(
                DetectorConfig.defaults().withCheckString(false), typeService);
        assertFalse(strict.isSafe(NODE, LogicalOperator.AND, BooleanSense.POSITIVE));
    }

    @Test
    void testEachFlagGuardsItsCategory() {
        assertCategoryGuarded(TypeTag.ANY, DetectorConfig.defaults().withCheckAny(false));
        assertCategoryGuarded(TypeTag.UNKNOWN, DetectorConfig.defaults().withCheckUnknown(false));
        assertCategoryGuarded(TypeTag.NUMBER, DetectorConfig.defaults().withCheckNumber(false));
        assertCategoryGuarded(TypeTag.BIGINT, DetectorConfig.defaults().withCheckBigInt(false));
        assertCategoryGuarded(TypeTag.TRUE, DetectorConfig.defaults().withCheckBoolean(false));
    }

    private void assertCategoryGuarded(TypeTag tag, DetectorConfig disabled) {
        AnnotatedTypeService types = new AnnotatedTypeService();
        types.annotate(1, EnumSet.of(tag, TypeTag.NULL));
        assertTrue(new LooseBooleanChecker(DetectorConfig.defaults(), types)
                .isSafe(1, LogicalOperator.AND, BooleanSense.POSITIVE), tag + " accepted by default");
        assertFalse(new LooseBooleanChecker(disabled, types)
                .isSafe(1, LogicalOperator.AND, BooleanSense.POSITIVE), tag + " rejected when disabled");
    }

    @Test
    void testSymbolIsNeverSafe() {
        typed(TypeTag.SYMBOL, TypeTag.UNDEFINED);
        assertFalse(checker.isSafe(NODE, LogicalOperator.AND, BooleanSense.POSITIVE));
    }

    @Test
    void testRequireNullish() {
        LooseBooleanChecker nullish = new LooseBooleanChecker(DetectorConfig.nullishOnly(), typeService);

        typed(TypeTag.OBJECT);
        assertFalse(nullish.isSafe(NODE, LogicalOperator.AND, BooleanSense.POSITIVE));

        typed(TypeTag.STRING, TypeTag.NULL);
        assertTrue(nullish.isSafe(NODE, LogicalOperator.AND, BooleanSense.POSITIVE));
    }
}
