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
import java.math.MathContext;
import java.util.function.BiFunction;
import java.util.function.BinaryOperator;
import java.util.stream.Stream;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Tests for the arithmetic of {@link DoubleDouble}.
 */
public class DoubleDoubleTest {
    /** Relative tolerance for arithmetic. */
    private static final double EPS = 1e-30;
    /** Math context for the reference computations. */
    private static final MathContext MC = new MathContext(60);

    @Test
    void testConstants() {
        Assertions.assertEquals(Math.PI, DoubleDouble.PI.hi());
        Assertions.assertEquals(Math.E, DoubleDouble.E.hi());
        Assertions.assertEquals(0x1.0p-104, DoubleDouble.EPSILON.hi());
        TestUtils.assertRelativeError("3.14159265358979323846264338327950288419716939937510582", DoubleDouble.PI, 1e-32);
        TestUtils.assertRelativeError("2.71828182845904523536028747135266249775724709369995957", DoubleDouble.E, 1e-32);
        TestUtils.assertRelativeError("0.69314718055994530941723212145817656807550013436025525", DoubleDouble.LN_2, 1e-32);
        TestUtils.assertRelativeError("2.30258509299404568401799145468436420760110148862877297", DoubleDouble.LN_10, 1e-32);
        TestUtils.assertRelativeError("1.41421356237309504880168872420969807856967187537694807", DoubleDouble.SQRT_2, 1e-32);
        TestUtils.assertRelativeError("1.57079632679489661923132169163975144209858469968755291", DoubleDouble.HALF_PI, 1e-32);
        TestUtils.assertRelativeError("0.78539816339744830961566084581987572104929234984377645", DoubleDouble.QUARTER_PI, 1e-32);
        TestUtils.assertRelativeError("6.28318530717958647692528676655900576839433879875021164", DoubleDouble.TWO_PI, 1e-32);
    }

    @Test
    void testOfDouble() {
        final DoubleDouble x = DoubleDouble.of(1.5);
        Assertions.assertEquals(1.5, x.hi());
        Assertions.assertEquals(0.0, x.lo());
        Assertions.assertEquals(1.5, x.doubleValue());
        Assertions.assertSame(DoubleDouble.NaN, DoubleDouble.of(Double.NaN));
        Assertions.assertEquals(DoubleDouble.POSITIVE_INFINITY, DoubleDouble.of(Double.POSITIVE_INFINITY));
    }

    @Test
    void testOfParts() {
        // Renormalized
        final DoubleDouble x = DoubleDouble.of(1.0, 1.0);
        Assertions.assertEquals(2.0, x.hi());
        Assertions.assertEquals(0.0, x.lo());
        final DoubleDouble y = DoubleDouble.of(0x1.0p-60, 1.0);
        Assertions.assertEquals(1.0, y.hi());
        Assertions.assertEquals(0x1.0p-60, y.lo());
    }

    @Test
    void testOfLong() {
        final UniformRandomProvider rng = RandomSource.create(RandomSource.XO_RO_SHI_RO_1024_PP, 1729L);
        final long[] values = {0, 1, -1, Long.MAX_VALUE, Long.MIN_VALUE, (1L << 53) + 1, -(1L << 60) - 7};
        for (final long v : values) {
            Assertions.assertEquals(0, BigDecimal.valueOf(v).compareTo(TestUtils.toBigDecimal(DoubleDouble.of(v))),
                () -> Long.toString(v));
        }
        for (int i = 0; i < 100; i++) {
            final long v = rng.nextLong();
            Assertions.assertEquals(0, BigDecimal.valueOf(v).compareTo(TestUtils.toBigDecimal(DoubleDouble.of(v))),
                () -> Long.toString(v));
        }
        Assertions.assertEquals(DoubleDouble.of(42.0), DoubleDouble.of(42));
    }

    @Test
    void testOfSumProductDifference() {
        final UniformRandomProvider rng = RandomSource.create(RandomSource.XO_RO_SHI_RO_1024_PP, 31415L);
        for (int i = 0; i < 200; i++) {
            final double a = TestUtils.randomDouble(rng, 200);
            final double b = TestUtils.randomDouble(rng, 200);
            final BigDecimal ba = new BigDecimal(a);
            final BigDecimal bb = new BigDecimal(b);
            Assertions.assertEquals(0, ba.add(bb).compareTo(TestUtils.toBigDecimal(DoubleDouble.ofSum(a, b))));
            Assertions.assertEquals(0, ba.subtract(bb).compareTo(
                TestUtils.toBigDecimal(DoubleDouble.ofDifference(a, b))));
            Assertions.assertEquals(0, ba.multiply(bb).compareTo(
                TestUtils.toBigDecimal(DoubleDouble.ofProduct(a, b))));
            TestUtils.assertRelativeError(ba.divide(bb, MC), DoubleDouble.ofQuotient(a, b), EPS);
        }
    }

    @Test
    void testOfQuotient() {
        TestUtils.assertRelativeError("0.333333333333333333333333333333333333333333",
            DoubleDouble.ofQuotient(1, 3), 1e-31);
        Assertions.assertEquals(DoubleDouble.of(0.5), DoubleDouble.ofQuotient(1, 2));
        Assertions.assertEquals(DoubleDouble.POSITIVE_INFINITY, DoubleDouble.ofQuotient(1, 0));
        Assertions.assertTrue(DoubleDouble.ofQuotient(0, 0).isNaN());
    }

    static Stream<Arguments> arithmeticOperators() {
        return Stream.of(
            Arguments.of("add", (BinaryOperator<DoubleDouble>) DoubleDouble::add,
                         (BinaryOperator<BigDecimal>) BigDecimal::add),
            Arguments.of("subtract", (BinaryOperator<DoubleDouble>) DoubleDouble::subtract,
                         (BinaryOperator<BigDecimal>) BigDecimal::subtract),
            Arguments.of("multiply", (BinaryOperator<DoubleDouble>) DoubleDouble::multiply,
                         (BinaryOperator<BigDecimal>) BigDecimal::multiply),
            Arguments.of("divide", (BinaryOperator<DoubleDouble>) DoubleDouble::divide,
                         (BinaryOperator<BigDecimal>) (x, y) -> x.divide(y, MC))
        );
    }

    @ParameterizedTest(name = "{0}")
    @MethodSource("arithmeticOperators")
    void testArithmetic(String name, BinaryOperator<DoubleDouble> op, BinaryOperator<BigDecimal> ref) {
        final UniformRandomProvider rng = RandomSource.create(RandomSource.XO_RO_SHI_RO_1024_PP, name.hashCode());
        for (int i = 0; i < 500; i++) {
            final DoubleDouble a = TestUtils.randomDoubleDouble(rng, 100);
            final DoubleDouble b = TestUtils.randomDoubleDouble(rng, 100);
            final BigDecimal expected = ref.apply(TestUtils.toBigDecimal(a), TestUtils.toBigDecimal(b));
            TestUtils.assertRelativeError(expected, op.apply(a, b), EPS);
        }
    }

    @Test
    void testArithmeticWithDouble() {
        final DoubleDouble x = DoubleDouble.PI;
        Assertions.assertEquals(x.add(DoubleDouble.of(2.5)), x.add(2.5));
        Assertions.assertEquals(x.subtract(DoubleDouble.of(2.5)), x.subtract(2.5));
        Assertions.assertEquals(x.multiply(DoubleDouble.of(2.5)), x.multiply(2.5));
        Assertions.assertEquals(x.divide(DoubleDouble.of(2.5)), x.divide(2.5));
    }

    @Test
    void testCancellation() {
        // Catastrophic cancellation of the high parts is exact
        final DoubleDouble a = DoubleDouble.ofSum(1.0, 0x1.0p-70);
        final DoubleDouble b = DoubleDouble.ofSum(1.0, 0x1.0p-80);
        final DoubleDouble d = a.subtract(b);
        Assertions.assertEquals(0x1.0p-70 - 0x1.0p-80, d.hi());
        Assertions.assertEquals(0.0, d.lo());
        Assertions.assertEquals(DoubleDouble.ZERO, DoubleDouble.PI.subtract(DoubleDouble.PI));
    }

    @Test
    void testSquare() {
        final UniformRandomProvider rng = RandomSource.create(RandomSource.XO_RO_SHI_RO_1024_PP, 999L);
        for (int i = 0; i < 200; i++) {
            final DoubleDouble a = TestUtils.randomDoubleDouble(rng, 200);
            final BigDecimal x = TestUtils.toBigDecimal(a);
            TestUtils.assertRelativeError(x.multiply(x), a.square(), EPS);
        }
        Assertions.assertEquals(DoubleDouble.of(9.0), DoubleDouble.of(-3.0).square());
        Assertions.assertEquals(DoubleDouble.POSITIVE_INFINITY, DoubleDouble.NEGATIVE_INFINITY.square());
        Assertions.assertTrue(DoubleDouble.NaN.square().isNaN());
    }

    @Test
    void testReciprocal() {
        TestUtils.assertRelativeError("0.318309886183790671537767526745028724068919291480912897",
            DoubleDouble.PI.reciprocal(), EPS);
        Assertions.assertEquals(DoubleDouble.POSITIVE_INFINITY, DoubleDouble.ZERO.reciprocal());
        Assertions.assertEquals(DoubleDouble.NEGATIVE_INFINITY, DoubleDouble.NEGATIVE_ZERO.reciprocal());
    }

    static Stream<Arguments> multiplySpecialCases() {
        final double inf = Double.POSITIVE_INFINITY;
        return Stream.of(
            Arguments.of(Double.NaN, 1.0, Double.NaN),
            Arguments.of(1.0, Double.NaN, Double.NaN),
            Arguments.of(0.0, inf, Double.NaN),
            Arguments.of(inf, 0.0, Double.NaN),
            Arguments.of(-0.0, inf, Double.NaN),
            Arguments.of(0.0, 2.0, 0.0),
            Arguments.of(-0.0, 2.0, -0.0),
            Arguments.of(0.0, -2.0, -0.0),
            Arguments.of(-0.0, -2.0, 0.0),
            Arguments.of(inf, 2.0, inf),
            Arguments.of(inf, -2.0, -inf),
            Arguments.of(-inf, -2.0, inf),
            Arguments.of(inf, inf, inf),
            Arguments.of(inf, -inf, -inf),
            Arguments.of(-inf, -inf, inf)
        );
    }

    @ParameterizedTest
    @MethodSource("multiplySpecialCases")
    void testMultiplySpecialCases(double a, double b, double expected) {
        assertSpecial(expected, DoubleDouble.of(a).multiply(DoubleDouble.of(b)));
        assertSpecial(expected, DoubleDouble.of(a).multiply(b));
    }

    static Stream<Arguments> divideSpecialCases() {
        final double inf = Double.POSITIVE_INFINITY;
        return Stream.of(
            Arguments.of(Double.NaN, 1.0, Double.NaN),
            Arguments.of(1.0, Double.NaN, Double.NaN),
            Arguments.of(0.0, 0.0, Double.NaN),
            Arguments.of(inf, inf, Double.NaN),
            Arguments.of(-inf, inf, Double.NaN),
            Arguments.of(1.0, 0.0, inf),
            Arguments.of(1.0, -0.0, -inf),
            Arguments.of(-1.0, 0.0, -inf),
            Arguments.of(1.0, inf, 0.0),
            Arguments.of(1.0, -inf, -0.0),
            Arguments.of(-1.0, -inf, 0.0),
            Arguments.of(inf, 2.0, inf),
            Arguments.of(inf, -2.0, -inf),
            Arguments.of(0.0, 2.0, 0.0),
            Arguments.of(-0.0, 2.0, -0.0)
        );
    }

    @ParameterizedTest
    @MethodSource("divideSpecialCases")
    void testDivideSpecialCases(double a, double b, double expected) {
        assertSpecial(expected, DoubleDouble.of(a).divide(DoubleDouble.of(b)));
        assertSpecial(expected, DoubleDouble.of(a).divide(b));
    }

    static Stream<Arguments> addSpecialCases() {
        final double inf = Double.POSITIVE_INFINITY;
        return Stream.of(
            Arguments.of(Double.NaN, 1.0, Double.NaN),
            Arguments.of(1.0, Double.NaN, Double.NaN),
            Arguments.of(inf, -inf, Double.NaN),
            Arguments.of(inf, 1.0, inf),
            Arguments.of(-inf, 1.0, -inf),
            Arguments.of(inf, inf, inf),
            Arguments.of(-0.0, -0.0, -0.0),
            Arguments.of(-0.0, 0.0, 0.0),
            Arguments.of(0.0, 0.0, 0.0),
            Arguments.of(1.0, -1.0, 0.0),
            Arguments.of(Double.MAX_VALUE, Double.MAX_VALUE, inf),
            Arguments.of(-Double.MAX_VALUE, -Double.MAX_VALUE, -inf)
        );
    }

    @ParameterizedTest
    @MethodSource("addSpecialCases")
    void testAddSpecialCases(double a, double b, double expected) {
        assertSpecial(expected, DoubleDouble.of(a).add(DoubleDouble.of(b)));
        assertSpecial(expected, DoubleDouble.of(a).add(b));
    }

    @Test
    void testOverflow() {
        final DoubleDouble max = DoubleDouble.of(Double.MAX_VALUE);
        Assertions.assertEquals(DoubleDouble.POSITIVE_INFINITY, max.multiply(2));
        Assertions.assertEquals(DoubleDouble.NEGATIVE_INFINITY, max.multiply(-2));
        Assertions.assertEquals(DoubleDouble.POSITIVE_INFINITY, max.divide(0.5));
        Assertions.assertEquals(DoubleDouble.POSITIVE_INFINITY, max.square());
        Assertions.assertTrue(max.multiply(0.5).isFinite());
    }

    /**
     * Assert the result is the special value. The low part must be zero for a non-NaN
     * result and the sign of zero must match.
     *
     * @param expected Expected value.
     * @param actual Actual value.
     */
    private static void assertSpecial(double expected, DoubleDouble actual) {
        if (Double.isNaN(expected)) {
            Assertions.assertTrue(actual.isNaN(), () -> "Expected NaN: " + actual.hi() + ", " + actual.lo());
        } else {
            Assertions.assertEquals(expected, actual.hi());
            Assertions.assertEquals(0.0, actual.lo(), 0.0);
        }
    }

    @Test
    void testPredicates() {
        Assertions.assertTrue(DoubleDouble.NaN.isNaN());
        Assertions.assertFalse(DoubleDouble.NaN.isFinite());
        Assertions.assertFalse(DoubleDouble.NaN.isInfinite());
        Assertions.assertTrue(DoubleDouble.POSITIVE_INFINITY.isInfinite());
        Assertions.assertTrue(DoubleDouble.NEGATIVE_INFINITY.isInfinite());
        Assertions.assertFalse(DoubleDouble.POSITIVE_INFINITY.isFinite());
        Assertions.assertTrue(DoubleDouble.PI.isFinite());
        Assertions.assertTrue(DoubleDouble.ZERO.isZero());
        Assertions.assertTrue(DoubleDouble.NEGATIVE_ZERO.isZero());
        Assertions.assertTrue(DoubleDouble.NEGATIVE_ZERO.isSignNegative());
        Assertions.assertTrue(DoubleDouble.ZERO.isSignPositive());
        Assertions.assertTrue(DoubleDouble.NEGATIVE_INFINITY.isSignNegative());
        Assertions.assertFalse(DoubleDouble.ONE.isZero());
    }

    @Test
    void testSignum() {
        Assertions.assertEquals(DoubleDouble.ONE, DoubleDouble.PI.signum());
        Assertions.assertEquals(DoubleDouble.of(-1.0), DoubleDouble.PI.negate().signum());
        Assertions.assertEquals(DoubleDouble.ONE, DoubleDouble.POSITIVE_INFINITY.signum());
        Assertions.assertSame(DoubleDouble.NEGATIVE_ZERO, DoubleDouble.NEGATIVE_ZERO.signum());
        Assertions.assertTrue(DoubleDouble.NaN.signum().isNaN());
    }

    @Test
    void testNegateAndAbs() {
        final DoubleDouble x = DoubleDouble.PI.negate();
        Assertions.assertEquals(-Math.PI, x.hi());
        Assertions.assertEquals(-DoubleDouble.PI.lo(), x.lo());
        Assertions.assertEquals(DoubleDouble.PI, x.abs());
        Assertions.assertSame(DoubleDouble.PI, DoubleDouble.PI.abs());
        Assertions.assertEquals(DoubleDouble.POSITIVE_INFINITY, DoubleDouble.NEGATIVE_INFINITY.abs());
    }

    @Test
    void testScalb() {
        final DoubleDouble x = DoubleDouble.PI.scalb(3);
        Assertions.assertEquals(Math.PI * 8, x.hi());
        Assertions.assertEquals(DoubleDouble.PI.lo() * 8, x.lo());
        Assertions.assertEquals(DoubleDouble.PI, x.scalb(-3));
    }

    @Test
    void testFloorAndCeil() {
        final DoubleDouble below3 = DoubleDouble.ofSum(3.0, -1e-17);
        final DoubleDouble above3 = DoubleDouble.ofSum(3.0, 1e-17);
        Assertions.assertEquals(DoubleDouble.of(2.0), below3.floor());
        Assertions.assertEquals(DoubleDouble.of(3.0), below3.ceil());
        Assertions.assertEquals(DoubleDouble.of(3.0), above3.floor());
        Assertions.assertEquals(DoubleDouble.of(4.0), above3.ceil());
        Assertions.assertEquals(DoubleDouble.of(2.0), DoubleDouble.of(2.5).floor());
        Assertions.assertEquals(DoubleDouble.of(-3.0), DoubleDouble.of(-2.5).floor());
        Assertions.assertEquals(DoubleDouble.of(-2.0), DoubleDouble.of(-2.5).ceil());
        Assertions.assertEquals(DoubleDouble.of(3.0), DoubleDouble.PI.floor());
        Assertions.assertEquals(DoubleDouble.of(4.0), DoubleDouble.PI.ceil());
        // Integer with a fractional low part
        final DoubleDouble big = DoubleDouble.ofSum(0x1.0p60, 0.5);
        Assertions.assertEquals(DoubleDouble.of(0x1.0p60), big.floor());
        Assertions.assertEquals(DoubleDouble.ofSum(0x1.0p60, 1.0), big.ceil());
        Assertions.assertEquals(DoubleDouble.POSITIVE_INFINITY, DoubleDouble.POSITIVE_INFINITY.floor());
        Assertions.assertTrue(DoubleDouble.NaN.ceil().isNaN());
    }

    @Test
    void testPowInt() {
        Assertions.assertEquals(DoubleDouble.ONE, DoubleDouble.PI.pow(0));
        Assertions.assertEquals(DoubleDouble.ONE, DoubleDouble.ZERO.pow(0));
        Assertions.assertSame(DoubleDouble.PI, DoubleDouble.PI.pow(1));
        Assertions.assertEquals(DoubleDouble.of(0x1.0p100), DoubleDouble.of(2).pow(100));
        Assertions.assertEquals(DoubleDouble.of(0.25), DoubleDouble.of(2).pow(-2));
        TestUtils.assertRelativeError(BigDecimal.valueOf(3).pow(40), DoubleDouble.of(3).pow(40), EPS);
        TestUtils.assertRelativeError(BigDecimal.ONE.divide(BigDecimal.valueOf(7).pow(13), MC),
            DoubleDouble.of(7).pow(-13), EPS);
        final BigDecimal pi = TestUtils.toBigDecimal(DoubleDouble.PI);
        TestUtils.assertRelativeError(pi.pow(11, MC), DoubleDouble.PI.pow(11), EPS);
        Assertions.assertEquals(DoubleDouble.POSITIVE_INFINITY, DoubleDouble.of(10).pow(400));
        Assertions.assertEquals(DoubleDouble.ZERO, DoubleDouble.of(10).pow(-400));
        Assertions.assertEquals(DoubleDouble.ONE, DoubleDouble.ONE.pow(Integer.MIN_VALUE));
    }

    @Test
    void testCompareTo() {
        final DoubleDouble a = DoubleDouble.ONE;
        final DoubleDouble b = DoubleDouble.ofSum(1.0, 1e-20);
        Assertions.assertTrue(a.compareTo(b) < 0);
        Assertions.assertTrue(b.compareTo(a) > 0);
        Assertions.assertEquals(0, a.compareTo(DoubleDouble.of(1.0)));
        Assertions.assertTrue(DoubleDouble.NEGATIVE_ZERO.compareTo(DoubleDouble.ZERO) < 0);
        Assertions.assertTrue(DoubleDouble.NaN.compareTo(DoubleDouble.POSITIVE_INFINITY) > 0);
        Assertions.assertTrue(DoubleDouble.NEGATIVE_INFINITY.compareTo(DoubleDouble.of(-Double.MAX_VALUE)) < 0);
    }

    @Test
    void testMinMax() {
        final DoubleDouble a = DoubleDouble.ONE;
        final DoubleDouble b = DoubleDouble.ofSum(1.0, 1e-20);
        Assertions.assertSame(a, a.min(b));
        Assertions.assertSame(a, b.min(a));
        Assertions.assertSame(b, a.max(b));
        Assertions.assertSame(b, b.max(a));
        Assertions.assertTrue(a.min(DoubleDouble.NaN).isNaN());
        Assertions.assertTrue(DoubleDouble.NaN.max(a).isNaN());
    }

    @Test
    void testEqualsAndHashCode() {
        final DoubleDouble a = DoubleDouble.ofSum(1.0, 1e-20);
        final DoubleDouble b = DoubleDouble.ofSum(1e-20, 1.0);
        Assertions.assertEquals(a, a);
        Assertions.assertEquals(a, b);
        Assertions.assertEquals(a.hashCode(), b.hashCode());
        Assertions.assertNotEquals(a, DoubleDouble.ONE);
        Assertions.assertNotEquals(DoubleDouble.ZERO, DoubleDouble.NEGATIVE_ZERO);
        Assertions.assertNotEquals(a, new Object());
        Assertions.assertNotEquals(a, null);
        Assertions.assertEquals(DoubleDouble.NaN, DoubleDouble.ZERO.divide(DoubleDouble.ZERO));
    }

    @Test
    void testOperationsAreConsistentWithQuadDouble() {
        // Arithmetic in the larger precision truncated to double-double
        final UniformRandomProvider rng = RandomSource.create(RandomSource.XO_RO_SHI_RO_1024_PP, 777L);
        final BiFunction<DoubleDouble, DoubleDouble, QuadDouble> mul =
            (x, y) -> QuadDouble.of(x).multiply(QuadDouble.of(y));
        for (int i = 0; i < 100; i++) {
            final DoubleDouble a = TestUtils.randomDoubleDouble(rng, 50);
            final DoubleDouble b = TestUtils.randomDoubleDouble(rng, 50);
            final BigDecimal expected = TestUtils.toBigDecimal(mul.apply(a, b));
            TestUtils.assertRelativeError(expected, a.multiply(b), EPS);
        }
    }
}
