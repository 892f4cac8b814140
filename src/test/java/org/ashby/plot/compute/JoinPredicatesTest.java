package org.ashby.plot.compute;

import org.ashby.plot.api.DataAccessException;
import org.ashby.plot.api.IncompatibleOperandsException;
import org.ashby.plot.api.data.FieldValue;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class JoinPredicatesTest {

    private final IJoinPredicate diff = JoinPredicates.standard().get(JoinPredicates.DIFF);

    @Test
    void testDiffOfIntegersStaysInteger() throws Exception {
        FieldValue result = diff.apply(FieldValue.of(10L), FieldValue.of(4L));

        assertThat(result).isEqualTo(FieldValue.of(6L));
    }

    @Test
    void testDiffWithFloatOperandWidensToFloat() throws Exception {
        assertThat(diff.apply(FieldValue.of(10L), FieldValue.of(2.5))).isEqualTo(FieldValue.of(7.5));
        assertThat(diff.apply(FieldValue.of(1.5), FieldValue.of(1L))).isEqualTo(FieldValue.of(0.5));
    }

    @Test
    void testDiffOfNonNumeric_throwsWithKinds() {
        assertThatThrownBy(() -> diff.apply(FieldValue.text("a"), FieldValue.of(1L)))
            .isInstanceOf(IncompatibleOperandsException.class)
            .hasMessageContaining("diff")
            .hasMessageContaining("TEXT")
            .hasMessageContaining("INTEGER");
    }

    @Test
    void testDiffOverflow_isDataAccessError() {
        assertThatThrownBy(() -> diff.apply(FieldValue.of(Long.MIN_VALUE), FieldValue.of(1L)))
            .isInstanceOf(DataAccessException.class)
            .isNotInstanceOf(IncompatibleOperandsException.class)
            .hasMessageContaining("diff")
            .hasMessageContaining("overflow");
    }

    @Test
    void testNullName_isUnknown() {
        assertThat(JoinPredicates.standard().get(null)).isNull();
    }

    @Test
    void testCustomPredicateCanBeRegistered() throws Exception {
        JoinPredicates predicates = JoinPredicates.standard()
            .register("ratio", (l, r) -> FieldValue.of(l.toDouble() / r.toDouble()));

        assertThat(predicates.getNames()).containsExactlyInAnyOrder("diff", "ratio");
        assertThat(predicates.get("ratio").apply(FieldValue.of(1L), FieldValue.of(4L))).isEqualTo(FieldValue.of(0.25));
        assertThat(predicates.get("sum")).isNull();
    }
}
