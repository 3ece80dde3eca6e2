package io.taxlots.service.money;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class MoneyMathTest {

    @Test
    void testExactArithmetic() {
        assertEquals(new BigDecimal("1126.00"), MoneyMath.value(4, new BigDecimal("281.50")));
        assertEquals(new BigDecimal("72160.047800"), MoneyMath.convert(new BigDecimal("1126.00"), new BigDecimal("64.0853")));
    }

    @Test
    void testReportScaleRoundsHalfUp() {
        assertEquals(new BigDecimal("22235.19"), MoneyMath.toReportScale(new BigDecimal("22235.1922")));
        assertEquals(new BigDecimal("178.53"), MoneyMath.toReportScale(new BigDecimal("178.525")));
        assertEquals(new BigDecimal("-0.13"), MoneyMath.toReportScale(new BigDecimal("-0.125")));
        assertEquals(new BigDecimal("5.00"), MoneyMath.toReportScale(new BigDecimal("5")));
    }

    @Test
    void testFormat() {
        assertEquals("$12.30", MoneyMath.format(new BigDecimal("12.3"), "$"));
        assertEquals("-$3.60", MoneyMath.format(new BigDecimal("-3.6"), "$"));
        assertEquals("$0.00", MoneyMath.format(BigDecimal.ZERO, "$"));
    }
}
