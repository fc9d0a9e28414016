/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.commons.multiprecision;

import java.util.Arrays;
import java.util.function.IntFunction;

/**
 * The leading significant decimal digits of a number and its decimal exponent.
 * The digits {@code d} and exponent {@code e} represent the value
 * {@code d[0].d[1]d[2]... * 10^e}. The leading digit is non-zero unless the value is zero.
 *
 * <p>Also contains the formatting of digits to plain and scientific notation.
 */
public final class DecimalDigits {
    /** Error message for an invalid digit count. */
    private static final String INVALID_COUNT = "Invalid number of digits: %d";
    /** Error message for an invalid number of decimal places. */
    private static final String INVALID_PLACES = "Invalid number of decimal places: %d";

    /** The digits. */
    private final int[] digits;
    /** The decimal exponent of the leading digit. */
    private final int exponent;

    /**
     * Create an instance.
     *
     * @param digits Digits.
     * @param exponent Exponent.
     */
    private DecimalDigits(int[] digits, int exponent) {
        this.digits = digits;
        this.exponent = exponent;
    }

    /**
     * Create digits of zero.
     *
     * @param count Number of digits.
     * @return the digits
     */
    static DecimalDigits zero(int count) {
        return new DecimalDigits(new int[count], 0);
    }

    /**
     * Create digits from the raw digits extracted from a number. The raw digits contain
     * one more digit than required which is used for rounding half-up. Raw digits may
     * be outside the range {@code [0, 9]}; these are corrected by borrowing or carrying
     * from the preceding digit.
     *
     * @param raw Raw digits (modified in-place).
     * @param exponent Decimal exponent of the first raw digit.
     * @return the digits
     * @throws IllegalStateException if the leading digit is negative after correction
     */
    static DecimalDigits of(int[] raw, int exponent) {
        final int n = raw.length;
        int e = exponent;
        correct(raw, n);

        if (raw[0] == 0) {
            // The leading digit was borrowed from
            System.arraycopy(raw, 1, raw, 0, n - 1);
            raw[n - 1] = 0;
            e--;
        } else if (raw[0] > 9) {
            System.arraycopy(raw, 0, raw, 1, n - 1);
            raw[1] = raw[0] % 10;
            raw[0] /= 10;
            e++;
        }
        if (raw[0] < 0) {
            throw new IllegalStateException("Negative leading digit: " + raw[0]);
        }

        final int[] d = Arrays.copyOf(raw, n - 1);
        if (raw[n - 1] >= 5) {
            // Round up
            int i = d.length - 1;
            while (i >= 0 && d[i] == 9) {
                d[i--] = 0;
            }
            if (i < 0) {
                d[0] = 1;
                e++;
            } else {
                d[i]++;
            }
        }
        return new DecimalDigits(d, e);
    }

    /**
     * Correct digits in-place to the range {@code [0, 9]} with the exception of the
     * leading digit.
     *
     * @param d Digits.
     * @param n Number of digits.
     */
    private static void correct(int[] d, int n) {
        for (int i = n - 1; i > 0; i--) {
            final int carry = Math.floorDiv(d[i], 10);
            d[i] -= carry * 10;
            d[i - 1] += carry;
        }
    }

    /**
     * Gets a copy of the digits.
     *
     * @return the digits
     */
    public int[] getDigits() {
        return digits.clone();
    }

    /**
     * Gets the decimal exponent of the leading digit.
     *
     * @return the exponent
     */
    public int getExponent() {
        return exponent;
    }

    /**
     * Gets the number of digits.
     *
     * @return the count
     */
    public int size() {
        return digits.length;
    }

    /**
     * Check the digit count is strictly positive.
     *
     * @param count Count.
     * @throws IllegalArgumentException if {@code count < 1}
     */
    static void checkCount(int count) {
        if (count < 1) {
            throw new IllegalArgumentException(String.format(INVALID_COUNT, count));
        }
    }

    /**
     * Check the number of decimal places is positive.
     *
     * @param places Decimal places.
     * @throws IllegalArgumentException if {@code places < 0}
     */
    static void checkPlaces(int places) {
        if (places < 0) {
            throw new IllegalArgumentException(String.format(INVALID_PLACES, places));
        }
    }

    /**
     * Format a non-finite value.
     *
     * @param nan Set if the value is NaN.
     * @param negative Set if the value is negative.
     * @return the string
     */
    static String toNonFiniteString(boolean nan, boolean negative) {
        if (nan) {
            return "NaN";
        }
        return negative ? "-Infinity" : "Infinity";
    }

    /**
     * Format the digits in fixed-point notation. Trailing zeros in the fraction are
     * removed.
     *
     * @param negative Set if the value is negative.
     * @param d Digits.
     * @return the string
     */
    static String toPlainString(boolean negative, DecimalDigits d) {
        final int[] x = d.digits;
        final int n = significantLength(x);
        final int e = d.exponent;
        final StringBuilder sb = new StringBuilder(n + Math.abs(e) + 3);
        if (negative) {
            sb.append('-');
        }
        if (e < 0) {
            sb.append("0.");
            for (int i = -1; i > e; i--) {
                sb.append('0');
            }
            append(sb, x, 0, n);
        } else {
            // Integer part
            for (int i = 0; i <= e; i++) {
                sb.append(i < n ? (char) ('0' + x[i]) : '0');
            }
            if (n > e + 1) {
                sb.append('.');
                append(sb, x, e + 1, n);
            }
        }
        return sb.toString();
    }

    /**
     * Format in fixed-point notation with the specified number of decimal places.
     * The value is rounded half-up.
     *
     * <p>The source provides the leading digits of the absolute value for a given count.
     * The first call uses the precision of the number to identify the decimal exponent.
     *
     * @param negative Set if the value is negative.
     * @param source Source of digits.
     * @param precision Number of significant digits supported by the source.
     * @param places Number of decimal places.
     * @return the string
     * @throws IllegalArgumentException if {@code places} is negative
     */
    static String toFixedString(boolean negative, IntFunction<DecimalDigits> source,
                                int precision, int places) {
        checkPlaces(places);
        final DecimalDigits estimate = source.apply(precision);
        final int count = estimate.exponent + 1 + places;
        final DecimalDigits d;
        if (count > 0) {
            d = source.apply(count);
        } else if (count == 0 && estimate.digits[0] >= 5) {
            // Rounds up to the last decimal place
            d = new DecimalDigits(new int[] {1}, -places);
        } else {
            d = zero(1);
        }

        final int[] x = d.digits;
        final int e = d.exponent;
        final StringBuilder sb = new StringBuilder(Math.max(e, 0) + places + 3);
        if (negative) {
            sb.append('-');
        }
        for (int p = Math.max(e, 0); p >= -places; p--) {
            if (p == -1) {
                sb.append('.');
            }
            final int i = e - p;
            sb.append(i >= 0 && i < x.length ? (char) ('0' + x[i]) : '0');
        }
        return sb.toString();
    }

    /**
     * Format the digits in scientific notation, e.g. {@code 1.23e-4}.
     *
     * @param negative Set if the value is negative.
     * @param d Digits.
     * @param trim Set to remove trailing zeros in the fraction.
     * @return the string
     */
    static String toScientificString(boolean negative, DecimalDigits d, boolean trim) {
        final int[] x = d.digits;
        final int n = trim ? significantLength(x) : x.length;
        final StringBuilder sb = new StringBuilder(n + 8);
        if (negative) {
            sb.append('-');
        }
        sb.append((char) ('0' + x[0]));
        if (n > 1) {
            sb.append('.');
            append(sb, x, 1, n);
        }
        return sb.append('e').append(d.exponent).toString();
    }

    /**
     * Get the length of the digits after removing trailing zeros. The minimum
     * length is 1.
     *
     * @param x Digits.
     * @return the length
     */
    private static int significantLength(int[] x) {
        int n = x.length;
        while (n > 1 && x[n - 1] == 0) {
            n--;
        }
        return n;
    }

    /**
     * Append the digits in the range {@code [from, to)}.
     *
     * @param sb Output.
     * @param x Digits.
     * @param from Start (inclusive).
     * @param to End (exclusive).
     */
    private static void append(StringBuilder sb, int[] x, int from, int to) {
        for (int i = from; i < to; i++) {
            sb.append((char) ('0' + x[i]));
        }
    }

    @Override
    public String toString() {
        return toScientificString(false, this, false);
    }
}
