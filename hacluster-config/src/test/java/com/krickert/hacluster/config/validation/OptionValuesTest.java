package com.krickert.hacluster.config.validation;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OptionValuesTest {

    @Test
    void isInteger_handlesLargeAndPaddedValues() {
        assertTrue(OptionValues.isInteger("99999999999999999999999"));
        assertTrue(OptionValues.isInteger(" 42 "));
        assertFalse(OptionValues.isInteger("4.2"));
        assertFalse(OptionValues.isInteger(""));
        assertFalse(OptionValues.isInteger(null));
    }

    @Test
    void isInteger_bounds() {
        assertTrue(OptionValues.isInteger("1000", 1000L, 120000L));
        assertFalse(OptionValues.isInteger("999", 1000L, 120000L));
        assertFalse(OptionValues.isInteger("120001", 1000L, 120000L));
        assertTrue(OptionValues.isInteger("-3", null, null));
    }

    @Test
    void ipAddressFamilies() {
        assertTrue(OptionValues.isIpv4Address("10.0.0.1"));
        assertFalse(OptionValues.isIpv4Address("::1"));
        assertTrue(OptionValues.isIpv6Address("::1"));
        assertFalse(OptionValues.isIpv6Address("10.0.0.1"));
        assertFalse(OptionValues.isIpAddress("300.0.0.1"));
        assertFalse(OptionValues.isIpAddress("localhost"));
    }

    @Test
    void scopedIpv6Address_isNotALiteral() {
        assertFalse(OptionValues.isIpv6Address("fe80::1%eth0"));
        assertFalse(OptionValues.isIpv6Address("fe80::1%2"));
        assertFalse(OptionValues.isIpAddress("fe80::1%eth0"));
        assertTrue(OptionValues.isIpv6Address("fe80::1"));
    }

    @Test
    void isScore() {
        assertTrue(OptionValues.isScore("INFINITY"));
        assertTrue(OptionValues.isScore("-INFINITY"));
        assertTrue(OptionValues.isScore("+INFINITY"));
        assertTrue(OptionValues.isScore("-100"));
        assertFalse(OptionValues.isScore("infinity"));
        assertFalse(OptionValues.isScore(""));
    }
}
