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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Tests for {@link ParsedDecimal} and {@link DecimalParseException}.
 */
public class ParsedDecimalTest {
    @ParameterizedTest
    @CsvSource({
        "0, false, '', 0",
        "-0, true, '', 0",
        "000.000, false, '', -3",
        "1, false, 1, 0",
        "+1, false, 1, 0",
        "-12.5, true, 125, -1",
        "0.0012, false, 12, -4",
        "1_000, false, 1000, 0",
        "1.5e3, false, 15, 2",
        "1.5E-3, false, 15, -4",
        "1e+5, false, 1, 5",
        "'  42  ', false, 42, 0",
        ".5, false, 5, -1",
        "5., false, 5, 0",
    })
    void testParse(String s, boolean negative, String digits, int exponent) {
        final ParsedDecimal d = ParsedDecimal.parse(s);
        Assertions.assertFalse(d.isNaN());
        Assertions.assertFalse(d.isInfinite());
        Assertions.assertEquals(negative, d.isNegative());
        Assertions.assertEquals(digits, d.getDigits());
        Assertions.assertEquals(exponent, d.getExponent());
    }

    @ParameterizedTest
    @ValueSource(strings = {"nan", "NaN", "-NAN", "+nan"})
    void testParseNaN(String s) {
        Assertions.assertTrue(ParsedDecimal.parse(s).isNaN());
    }

    @ParameterizedTest
    @CsvSource({
        "inf, false",
        "Infinity, false",
        "+INF, false",
        "-inf, true",
        "-infinity, true",
    })
    void testParseInfinity(String s, boolean negative) {
        final ParsedDecimal d = ParsedDecimal.parse(s);
        Assertions.assertTrue(d.isInfinite());
        Assertions.assertFalse(d.isNaN());
        Assertions.assertEquals(negative, d.isNegative());
    }

    @Test
    void testParseTruncatesDigits() {
        final StringBuilder sb = new StringBuilder("1");
        for (int i = 0; i < 99; i++) {
            sb.append('2');
        }
        final ParsedDecimal d = ParsedDecimal.parse(sb.toString());
        Assertions.assertEquals(80, d.getDigits().length());
        // The dropped integer digits are carried in the exponent
        Assertions.assertEquals(20, d.getExponent());

        final ParsedDecimal f = ParsedDecimal.parse("0." + sb);
        Assertions.assertEquals(80, f.getDigits().length());
        Assertions.assertEquals(-80, f.getExponent());
    }

    @Test
    void testParseClampsExponent() {
        Assertions.assertEquals(10000, ParsedDecimal.parse("1e20000").getExponent());
        Assertions.assertEquals(-10000, ParsedDecimal.parse("1e-20000").getExponent());
    }

    @ParameterizedTest
    @ValueSource(strings = {"", " ", "\t\n"})
    void testParseEmpty(String s) {
        final DecimalParseException ex = Assertions.assertThrows(DecimalParseException.class,
            () -> ParsedDecimal.parse(s));
        Assertions.assertEquals(DecimalParseException.Kind.EMPTY, ex.getKind());
        Assertions.assertEquals("Empty input", ex.getMessage());
    }

    @ParameterizedTest
    @CsvSource({
        "1.2.3, 3",
        "1-2, 1",
        "--1, 1",
        "1e, 2",
        "e5, 0",
        "abc, 0",
        "., 0",
        "+, 1",
        "1e5x, 2",
        "1e5.5, 2",
        "1 2, 1",
        "0x10, 1",
    })
    void testParseInvalid(String s, int index) {
        final DecimalParseException ex = Assertions.assertThrows(DecimalParseException.class,
            () -> ParsedDecimal.parse(s));
        Assertions.assertEquals(DecimalParseException.Kind.INVALID, ex.getKind());
        Assertions.assertEquals("Invalid decimal '" + s + "' at index " + index, ex.getMessage());
    }

    @Test
    void testInvalidExponentHasCause() {
        final DecimalParseException ex = Assertions.assertThrows(DecimalParseException.class,
            () -> ParsedDecimal.parse("1e1x"));
        Assertions.assertTrue(ex.getCause() instanceof NumberFormatException);
    }

    @Test
    void testExceptionIsNumberFormatException() {
        Assertions.assertThrows(NumberFormatException.class, () -> DoubleDouble.parse("one"));
        Assertions.assertThrows(NumberFormatException.class, () -> QuadDouble.parse("one"));
        Assertions.assertThrows(NullPointerException.class, () -> ParsedDecimal.parse(null));
    }
}
