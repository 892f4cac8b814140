package org.ashby.plot.api.data;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for FieldValue kind mapping and canonical key text.
 */
@Tag("unit")
class FieldValueTest {

    @Test
    void testIntegerAndFloatShareCanonicalText() {
        assertThat(FieldValue.of(3L).canonicalText()).isEqualTo("3");
        assertThat(FieldValue.of(3.0).canonicalText()).isEqualTo("3");
        assertThat(FieldValue.of(2.50).canonicalText()).isEqualTo("2.5");
    }

    @Test
    void testTimestampCanonicalTextIsRfc3339Utc() {
        Instant t = OffsetDateTime.of(2024, 3, 4, 10, 15, 30, 999, ZoneOffset.ofHours(2)).toInstant();

        assertThat(FieldValue.timestamp(t).canonicalText()).isEqualTo("2024-03-04T08:15:30Z");
    }

    @Test
    void testFromObject_mapsJavaTypesToKinds() {
        assertThat(FieldValue.fromObject(null).getKind()).isEqualTo(FieldValue.Kind.ABSENT);
        assertThat(FieldValue.fromObject(7).getKind()).isEqualTo(FieldValue.Kind.INTEGER);
        assertThat(FieldValue.fromObject(new BigDecimal("1.25")).getKind()).isEqualTo(FieldValue.Kind.FLOATING);
        assertThat(FieldValue.fromObject("x").getKind()).isEqualTo(FieldValue.Kind.TEXT);
        assertThat(FieldValue.fromObject(true).getKind()).isEqualTo(FieldValue.Kind.BOOLEAN);
        assertThat(FieldValue.fromObject(Instant.EPOCH).getKind()).isEqualTo(FieldValue.Kind.TIMESTAMP);
        assertThat(FieldValue.fromObject(Duration.ofSeconds(5)).getKind()).isEqualTo(FieldValue.Kind.DURATION);
    }

    @Test
    void testJsonValueOfAbsentAndErrorIsNull() {
        assertThat(FieldValue.absent().toJsonValue()).isNull();
        assertThat(FieldValue.error("boom").toJsonValue()).isNull();
        assertThat(FieldValue.of(4L).toJsonValue()).isEqualTo(4L);
        assertThat(FieldValue.duration(Duration.ofMillis(1500)).toJsonValue()).isEqualTo(1.5);
    }

    @Test
    void testBigIntegerWiderThanLongBecomesFloat() {
        assertThat(FieldValue.fromObject(BigInteger.valueOf(Long.MIN_VALUE))).isEqualTo(FieldValue.of(Long.MIN_VALUE));

        FieldValue wide = FieldValue.fromObject(BigInteger.TWO.pow(64));
        assertThat(wide.getKind()).isEqualTo(FieldValue.Kind.FLOATING);
        assertThat(wide.toDouble()).isEqualTo(Math.pow(2, 64));
    }

    @Test
    void testJsonValueOfNonFiniteFloatIsNull() {
        assertThat(FieldValue.of(Double.NaN).toJsonValue()).isNull();
        assertThat(FieldValue.of(Double.POSITIVE_INFINITY).toJsonValue()).isNull();
        assertThat(FieldValue.of(2.5).toJsonValue()).isEqualTo(2.5);
    }

    @Test
    void testAccessorOfWrongKind_throws() {
        FieldValue text = FieldValue.text("abc");

        assertThatThrownBy(text::asLong).isInstanceOf(IllegalStateException.class);
        assertThatThrownBy(text::toDouble).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void testNullTextIsAbsent() {
        assertThat(FieldValue.text(null).isAbsent()).isTrue();
    }
}
