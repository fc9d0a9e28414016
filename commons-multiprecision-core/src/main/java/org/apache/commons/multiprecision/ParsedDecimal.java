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

/**
 * The lexical form of a decimal number: a sign, a string of significant digits and a
 * power of ten. The value is {@code (-1)^sign * digits * 10^exponent}.
 *
 * <p>Accepted input:
 * <pre>
 * [whitespace] [+|-] (nan | inf | infinity | mantissa [(e|E) [+|-] integer]) [whitespace]
 * mantissa = digits with an optional single '.' and any number of '_' separators
 * </pre>
 *
 * <p>The literals are case-insensitive. The mantissa must contain at least one digit.
 */
final class ParsedDecimal {
    /** Largest power of ten applied in a single scaling step. */
    static final int MAX_POWER = 300;

    /** Maximum number of significant digits retained. Further digits are beyond
     * the precision of a quad-double. */
    private static final int MAX_DIGITS = 80;
    /** Limit on the magnitude of the decimal exponent. Any larger exponent will
     * overflow or underflow. */
    private static final int MAX_EXPONENT = 10000;

    /** Not-a-number. */
    private static final ParsedDecimal NAN = new ParsedDecimal(false, true, false, "", 0);
    /** Positive infinity. */
    private static final ParsedDecimal POSITIVE_INFINITY = new ParsedDecimal(false, false, true, "", 0);
    /** Negative infinity. */
    private static final ParsedDecimal NEGATIVE_INFINITY = new ParsedDecimal(true, false, true, "", 0);

    /** Set if the sign is negative. */
    private final boolean negative;
    /** Set if the value is NaN. */
    private final boolean nan;
    /** Set if the value is infinite. */
    private final boolean infinite;
    /** The significant digits without leading zeros. Empty for zero. */
    private final String digits;
    /** The decimal exponent. */
    private final int exponent;

    /**
     * Create an instance.
     *
     * @param negative Set if the sign is negative.
     * @param nan Set if the value is NaN.
     * @param infinite Set if the value is infinite.
     * @param digits Significant digits.
     * @param exponent Decimal exponent.
     */
    private ParsedDecimal(boolean negative, boolean nan, boolean infinite, String digits, int exponent) {
        this.negative = negative;
        this.nan = nan;
        this.infinite = infinite;
        this.digits = digits;
        this.exponent = exponent;
    }

    /**
     * Parse the string.
     *
     * @param s String.
     * @return the parsed decimal
     * @throws NullPointerException if the string is null
     * @throws DecimalParseException if the string is empty or not a valid number
     */
    static ParsedDecimal parse(String s) {
        final String str = s.trim();
        if (str.isEmpty()) {
            throw DecimalParseException.empty();
        }

        int start = 0;
        boolean neg = false;
        final char first = str.charAt(0);
        if (first == '-' || first == '+') {
            neg = first == '-';
            start = 1;
        }
        final String body = str.substring(start);
        if ("nan".equalsIgnoreCase(body)) {
            return NAN;
        }
        if ("inf".equalsIgnoreCase(body) || "infinity".equalsIgnoreCase(body)) {
            return neg ? NEGATIVE_INFINITY : POSITIVE_INFINITY;
        }

        final StringBuilder sb = new StringBuilder();
        long exp = 0;
        boolean point = false;
        boolean anyDigit = false;
        for (int i = start; i < str.length(); i++) {
            final char c = str.charAt(i);
            if (c >= '0' && c <= '9') {
                anyDigit = true;
                if (sb.length() == 0 && c == '0') {
                    // Leading zero
                    if (point) {
                        exp--;
                    }
                } else if (sb.length() < MAX_DIGITS) {
                    sb.append(c);
                    if (point) {
                        exp--;
                    }
                } else if (!point) {
                    // Dropped integer digit
                    exp++;
                }
            } else if (c == '.') {
                if (point) {
                    throw DecimalParseException.invalid(s, i);
                }
                point = true;
            } else if (c == 'e' || c == 'E') {
                if (!anyDigit) {
                    throw DecimalParseException.invalid(s, i);
                }
                exp += parseExponent(s, str.substring(i + 1), i + 1);
                break;
            } else if (c != '_') {
                // Includes a sign that is not leading
                throw DecimalParseException.invalid(s, i);
            }
        }
        if (!anyDigit) {
            throw DecimalParseException.invalid(s, start);
        }
        return new ParsedDecimal(neg, false, false, sb.toString(),
            (int) Math.max(-MAX_EXPONENT, Math.min(MAX_EXPONENT, exp)));
    }

    /**
     * Parse the exponent.
     *
     * @param input Full input (for the error message).
     * @param exponent Exponent string.
     * @param index Index of the exponent in the input.
     * @return the exponent
     * @throws DecimalParseException if the exponent is not a valid integer
     */
    private static int parseExponent(String input, String exponent, int index) {
        try {
            return Integer.parseInt(exponent);
        } catch (final NumberFormatException ex) {
            final DecimalParseException pe = DecimalParseException.invalid(input, index);
            pe.initCause(ex);
            throw pe;
        }
    }

    /**
     * Checks if the sign is negative.
     *
     * @return true if negative
     */
    boolean isNegative() {
        return negative;
    }

    /**
     * Checks if the value is NaN.
     *
     * @return true if NaN
     */
    boolean isNaN() {
        return nan;
    }

    /**
     * Checks if the value is infinite.
     *
     * @return true if infinite
     */
    boolean isInfinite() {
        return infinite;
    }

    /**
     * Gets the significant digits. This is empty for a value of zero.
     *
     * @return the digits
     */
    String getDigits() {
        return digits;
    }

    /**
     * Gets the decimal exponent applied to the integer formed by the digits.
     *
     * @return the exponent
     */
    int getExponent() {
        return exponent;
    }
}
