package com.krickert.hacluster.config.validation;

import com.google.common.net.InetAddresses;

import java.math.BigInteger;

/**
 * Predicates over normalized option values.
 */
public final class OptionValues {

    private OptionValues() {
    }

    public static boolean isEmpty(String value) {
        return value == null || value.isEmpty();
    }

    public static boolean isInteger(String value) {
        return parseInteger(value) != null;
    }

    /**
     * @param atLeast Lower bound, inclusive, null for none.
     * @param atMost  Upper bound, inclusive, null for none.
     */
    public static boolean isInteger(String value, Long atLeast, Long atMost) {
        BigInteger number = parseInteger(value);
        if (number == null) {
            return false;
        }
        if (atLeast != null && number.compareTo(BigInteger.valueOf(atLeast)) < 0) {
            return false;
        }
        return atMost == null || number.compareTo(BigInteger.valueOf(atMost)) <= 0;
    }

    public static boolean isPortNumber(String value) {
        return isInteger(value, 1L, 65535L);
    }

    public static boolean isIpv4Address(String value) {
        return isPlainAddressLiteral(value) && !value.contains(":");
    }

    /**
     * A plain IPv6 literal. Scoped forms such as {@code fe80::1%eth0} are not accepted.
     */
    public static boolean isIpv6Address(String value) {
        return isPlainAddressLiteral(value) && value.contains(":");
    }

    public static boolean isIpAddress(String value) {
        return isIpv4Address(value) || isIpv6Address(value);
    }

    private static boolean isPlainAddressLiteral(String value) {
        return value != null && value.indexOf('%') < 0 && InetAddresses.isInetAddress(value);
    }

    /**
     * INFINITY, +INFINITY, -INFINITY or an integer.
     */
    public static boolean isScore(String value) {
        if (value == null) {
            return false;
        }
        String unsigned = (value.startsWith("+") || value.startsWith("-")) ? value.substring(1) : value;
        return "INFINITY".equals(unsigned) || isInteger(value);
    }

    private static BigInteger parseInteger(String value) {
        if (value == null) {
            return null;
        }
        try {
            return new BigInteger(value.strip());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
