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

import java.math.BigDecimal;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Tests for parsing and formatting of {@link QuadDouble}.
 */
public class QuadDoubleFormatTest {
    /** Relative tolerance for parsing. */
    private static final double EPS = 1e-60;

    @ParameterizedTest
    @CsvSource({
        "0.1",
        "-0.1",
        "3.1415926535897932384626433832795028841971693993751058209749445923078164062862",
        "123456789012345678901234567890123456789012345678901234567890",
        "6.02214076e23",
        "1.602176634e-19",
        "1e300",
        "-2.5e-100",
    })
    void testParse(String s) {
        TestUtils.assertRelativeError(new BigDecimal(s), QuadDouble.parse(s), EPS);
    }

    @Test
    void testParseSpecialValues() {
        Assertions.assertSame(QuadDouble.NaN, QuadDouble.parse("NAN"));
        Assertions.assertSame(QuadDouble.POSITIVE_INFINITY, QuadDouble.parse("+inf"));
        Assertions.assertSame(QuadDouble.NEGATIVE_INFINITY, QuadDouble.parse("-Infinity"));
        Assertions.assertEquals(QuadDouble.ZERO, QuadDouble.parse("0.0"));
        Assertions.assertEquals(QuadDouble.NEGATIVE_ZERO, QuadDouble.parse("-0"));
        Assertions.assertEquals(QuadDouble.of(1729), QuadDouble.parse("1_729"));
        Assertions.assertEquals(QuadDouble.POSITIVE_INFINITY, QuadDouble.parse("1e400"));
        Assertions.assertTrue(QuadDouble.parse("-1e-400").isZero());
        Assertions.assertThrows(DecimalParseException.class, () -> QuadDouble.parse("1e"));
        Assertions.assertThrows(DecimalParseException.class, () -> QuadDouble.parse("   "));
    }

    @Test
    void testToString() {
        Assertions.assertEquals("3.1415926535897932384626433832795028841971693993751058209749446",
            QuadDouble.PI.toString());
        Assertions.assertEquals("-3.1415926535897932384626433832795028841971693993751058209749446",
            QuadDouble.PI.negate().toString());
        Assertions.assertEquals("2.7182818284590452353602874713526624977572470936999595749669676",
            QuadDouble.E.toString());
        Assertions.assertEquals("1.4142135623730950488016887242096980785696718753769480731766797",
            QuadDouble.SQRT_2.toString());
        Assertions.assertEquals("23", QuadDouble.of(23).toString());
        Assertions.assertEquals("-17", QuadDouble.of(-17).toString());
        Assertions.assertEquals("0.5", QuadDouble.of(0.5).toString());
        Assertions.assertEquals("0.00001", QuadDouble.parse("0.00001").toString());
        Assertions.assertEquals("0", QuadDouble.ZERO.toString());
        Assertions.assertEquals("-0", QuadDouble.NEGATIVE_ZERO.toString());
        Assertions.assertEquals("NaN", QuadDouble.NaN.toString());
        Assertions.assertEquals("-Infinity", QuadDouble.NEGATIVE_INFINITY.toString());
    }

    @Test
    void testToStringWithPlaces() {
        Assertions.assertEquals("3.1415926536", QuadDouble.PI.toString(10));
        Assertions.assertEquals("-3.14", QuadDouble.PI.negate().toString(2));
        Assertions.assertEquals("0.01678", QuadDouble.of(0.016777216).toString(5));
        Assertions.assertEquals("1", QuadDouble.of(0.5).toString(0));
        Assertions.assertEquals("99999999999999999999999999999",
            QuadDouble.parse("99999999999999999999999999999").toString(0));
        Assertions.assertEquals("Infinity", QuadDouble.POSITIVE_INFINITY.toString(2));
        Assertions.assertThrows(IllegalArgumentException.class, () -> QuadDouble.ONE.toString(-1));
    }

    @Test
    void testToScientificString() {
        Assertions.assertEquals("2.3e1", QuadDouble.of(23).toScientificString());
        Assertions.assertEquals("1.729e3", QuadDouble.of(1729).toScientificString());
        Assertions.assertEquals("5e-1", QuadDouble.of(0.5).toScientificString());
        Assertions.assertEquals("0e0", QuadDouble.ZERO.toScientificString());
        Assertions.assertEquals("3.14159e0", QuadDouble.PI.toScientificString(5));
        Assertions.assertEquals("1.80e308", QuadDouble.of(Double.MAX_VALUE).toScientificString(2));
        Assertions.assertEquals("4.94e-324", QuadDouble.of(Double.MIN_VALUE).toScientificString(2));
        Assertions.assertEquals("NaN", QuadDouble.NaN.toScientificString(2));
        Assertions.assertThrows(IllegalArgumentException.class, () -> QuadDouble.ONE.toScientificString(-1));
    }

    @Test
    void testToDigits() {
        final DecimalDigits d = QuadDouble.PI.toDigits(62);
        Assertions.assertEquals(62, d.size());
        Assertions.assertEquals(0, d.getExponent());
        Assertions.assertEquals(6, d.getDigits()[61]);
        Assertions.assertThrows(IllegalArgumentException.class, () -> QuadDouble.ONE.toDigits(0));
        Assertions.assertThrows(IllegalArgumentException.class, () -> QuadDouble.NaN.toDigits(1));
    }

    @Test
    void testRoundTrip() {
        final UniformRandomProvider rng = RandomSource.create(RandomSource.XO_RO_SHI_RO_1024_PP, 27182L);
        for (int i = 0; i < 100; i++) {
            final QuadDouble x = TestUtils.randomQuadDouble(rng, 200);
            final BigDecimal expected = TestUtils.toBigDecimal(x);
            TestUtils.assertRelativeError(expected, QuadDouble.parse(x.toString()), EPS);
            TestUtils.assertRelativeError(expected, QuadDouble.parse(x.toScientificString()), EPS);
        }
    }
}
