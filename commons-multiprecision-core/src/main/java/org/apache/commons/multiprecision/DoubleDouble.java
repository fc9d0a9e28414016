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

import java.io.Serializable;

/**
 * A number represented as the unevaluated sum of two {@code double} values
 * {@code (hi, lo)} with {@code |lo| <= ulp(hi) / 2}. This provides approximately
 * 106 bits (31 decimal digits) of precision with the exponent range of a {@code double}.
 *
 * <p>Instances are immutable. Special values follow IEEE754 semantics and are carried in
 * the high part: the low part of an infinite or zero value is zero, and any NaN part
 * marks the value as NaN.
 *
 * <p>The arithmetic is based on the double-double algorithms of
 * <a href="https://www.davidhbailey.com/dhbpapers/qd.pdf">
 * Hida, Li and Bailey (2000) Quad-Double Arithmetic: Algorithms, Implementation, and Application</a>
 * using the error-free transformations of
 * <a href="https://doi.org/10.1007/BF01397083">
 * Dekker (1971) A floating-point technique for extending the available precision</a>.
 */
public final class DoubleDouble implements Comparable<DoubleDouble>, Serializable {
    /** A double-double with value 0.0. */
    public static final DoubleDouble ZERO = new DoubleDouble(0.0, 0.0);
    /** A double-double with value -0.0. */
    public static final DoubleDouble NEGATIVE_ZERO = new DoubleDouble(-0.0, 0.0);
    /** A double-double with value 1.0. */
    public static final DoubleDouble ONE = new DoubleDouble(1.0, 0.0);
    /** A double-double with value 10.0. */
    public static final DoubleDouble TEN = new DoubleDouble(10.0, 0.0);
    /** A double-double with value NaN. */
    public static final DoubleDouble NaN = new DoubleDouble(Double.NaN, Double.NaN);
    /** A double-double with value positive infinity. */
    public static final DoubleDouble POSITIVE_INFINITY = new DoubleDouble(Double.POSITIVE_INFINITY, 0.0);
    /** A double-double with value negative infinity. */
    public static final DoubleDouble NEGATIVE_INFINITY = new DoubleDouble(Double.NEGATIVE_INFINITY, 0.0);
    /** The relative precision of a double-double: {@code 2^-104}. */
    public static final DoubleDouble EPSILON = new DoubleDouble(0x1.0p-104, 0.0);

    /** The constant pi. */
    public static final DoubleDouble PI = new DoubleDouble(3.141592653589793, 1.2246467991473532e-16);
    /** The constant 2 pi. */
    public static final DoubleDouble TWO_PI = new DoubleDouble(6.283185307179586, 2.4492935982947064e-16);
    /** The constant pi / 2. */
    public static final DoubleDouble HALF_PI = new DoubleDouble(1.5707963267948966, 6.123233995736766e-17);
    /** The constant pi / 4. */
    public static final DoubleDouble QUARTER_PI = new DoubleDouble(0.7853981633974483, 3.061616997868383e-17);
    /** The constant e, the base of the natural logarithm. */
    public static final DoubleDouble E = new DoubleDouble(2.718281828459045, 1.4456468917292502e-16);
    /** The natural logarithm of 2. */
    public static final DoubleDouble LN_2 = new DoubleDouble(0.6931471805599453, 2.3190468138462996e-17);
    /** The natural logarithm of 10. */
    public static final DoubleDouble LN_10 = new DoubleDouble(2.302585092994046, -2.1707562233822494e-16);
    /** The square root of 2. */
    public static final DoubleDouble SQRT_2 = new DoubleDouble(1.4142135623730951, -9.667293313452913e-17);

    /** The constant 3 pi / 4. */
    private static final DoubleDouble THREE_QUARTER_PI = new DoubleDouble(2.356194490192345, 9.184850993605148e-17);
    /** The constant pi / 16. */
    private static final DoubleDouble SIXTEENTH_PI = new DoubleDouble(0.19634954084936207, 7.654042494670958e-18);

    /** Inverse factorials 1/3! to 1/17!. */
    private static final DoubleDouble[] INV_FACTORIALS = {
        new DoubleDouble(0.16666666666666666, 9.25185853854297e-18),
        new DoubleDouble(0.041666666666666664, 2.3129646346357427e-18),
        new DoubleDouble(0.008333333333333333, 1.1564823173178714e-19),
        new DoubleDouble(0.001388888888888889, -5.300543954373577e-20),
        new DoubleDouble(0.0001984126984126984, 1.7209558293420705e-22),
        new DoubleDouble(2.48015873015873e-5, 2.1511947866775882e-23),
        new DoubleDouble(2.7557319223985893e-6, -1.858393274046472e-22),
        new DoubleDouble(2.755731922398589e-7, 2.3767714622250297e-23),
        new DoubleDouble(2.505210838544172e-8, -1.448814070935912e-24),
        new DoubleDouble(2.08767569878681e-9, -1.20734505911326e-25),
        new DoubleDouble(1.6059043836821613e-10, 1.2585294588752098e-26),
        new DoubleDouble(1.1470745597729725e-11, 2.0655512752830745e-28),
        new DoubleDouble(7.647163731819816e-13, 7.03872877733453e-30),
        new DoubleDouble(4.779477332387385e-14, 4.399205485834081e-31),
        new DoubleDouble(2.8114572543455206e-15, 1.6508842730861433e-31),
    };
    /** sin(k pi / 16) for k = 1 to 4. */
    private static final DoubleDouble[] SINES = {
        new DoubleDouble(0.19509032201612828, -7.991079068461731e-18),
        new DoubleDouble(0.3826834323650898, -1.0050772696461588e-17),
        new DoubleDouble(0.5555702330196022, 4.709410940561677e-17),
        new DoubleDouble(0.7071067811865476, -4.833646656726457e-17),
    };
    /** cos(k pi / 16) for k = 1 to 4. */
    private static final DoubleDouble[] COSINES = {
        new DoubleDouble(0.9807852804032304, 1.8546939997825006e-17),
        new DoubleDouble(0.9238795325112867, 1.7645047084336677e-17),
        new DoubleDouble(0.8314696123025452, 1.4073856984728024e-18),
        new DoubleDouble(0.7071067811865476, -4.833646656726457e-17),
    };

    /** Number of significant decimal digits output by {@link #toString()}. */
    static final int DIGITS = 31;

    /** Arguments at or below this value have an exponential of zero. */
    private static final double EXP_LOWER_LIMIT = -600;
    /** Arguments above this value have an infinite exponential. */
    private static final double EXP_UPPER_LIMIT = 708;
    /** The power of 2 used to reduce the exponential argument: {@code k = 2^9 = 512}. */
    private static final int EXP_REDUCTION_BITS = 9;
    /** Taylor series terms below this magnitude are negligible for the reduced exponential. */
    private static final double EXP_TOLERANCE = 0x1.0p-104 / 512;
    /** Maximum index into the inverse factorial table for the exponential series. */
    private static final int EXP_MAX_TERM = 5;
    /** Binary exponent above which the logarithm argument is scaled towards 1. */
    private static final int LOG_SCALE_EXPONENT = 500;
    /** Maximum number of Newton iterations for the logarithm. */
    private static final int LOG_MAX_ITERATIONS = 20;
    /** Binary exponent above which the square root argument is scaled towards 1. */
    private static final int SQRT_SCALE_EXPONENT = 500;
    /** Binary exponent above which the n-th root operand is scaled. */
    private static final int ROOT_SCALE_EXPONENT = 500;
    /** Number of Newton iterations for the n-th root. */
    private static final int ROOT_ITERATIONS = 1;
    /** Number of Newton iterations for atan2. */
    private static final int ATAN2_ITERATIONS = 3;

    /** Serializable version identifier. */
    private static final long serialVersionUID = 20261017L;

    /** The high part. */
    private final double hi;
    /** The low part. */
    private final double lo;

    /**
     * Create an instance.
     *
     * @param hi High part.
     * @param lo Low part.
     */
    private DoubleDouble(double hi, double lo) {
        this.hi = hi;
        this.lo = lo;
    }

    /**
     * Create a double-double with the value of the {@code double}.
     *
     * @param x Value.
     * @return the double-double
     */
    public static DoubleDouble of(double x) {
        return special(x);
    }

    /**
     * Create a double-double from the unevaluated sum {@code x + xx}. The parts are
     * renormalized so they need not be ordered or non-overlapping.
     *
     * @param x High part.
     * @param xx Low part.
     * @return the double-double
     */
    public static DoubleDouble of(double x, double xx) {
        return ofSum(x, xx);
    }

    /**
     * Create a double-double with the value of the {@code int}.
     *
     * @param x Value.
     * @return the double-double
     */
    public static DoubleDouble of(int x) {
        return new DoubleDouble(x, 0.0);
    }

    /**
     * Create a double-double with the exact value of the {@code long}.
     *
     * @param x Value.
     * @return the double-double
     */
    public static DoubleDouble of(long x) {
        // Both halves are exact in a double
        final double a = (double) (x >> 32) * 0x1.0p32;
        final double b = x & 0xffffffffL;
        return ofSum(a, b);
    }

    /**
     * Create a double-double with the exact sum of two {@code double} values.
     *
     * @param a First value.
     * @param b Second value.
     * @return a + b
     */
    public static DoubleDouble ofSum(double a, double b) {
        final double s = a + b;
        if (!Double.isFinite(s)) {
            return special(s);
        }
        return new DoubleDouble(s, DoublePrecision.twoSumLow(a, b, s));
    }

    /**
     * Create a double-double with the exact difference of two {@code double} values.
     *
     * @param a First value.
     * @param b Second value.
     * @return a - b
     */
    public static DoubleDouble ofDifference(double a, double b) {
        return ofSum(a, -b);
    }

    /**
     * Create a double-double with the exact product of two {@code double} values.
     *
     * @param a First factor.
     * @param b Second factor.
     * @return a * b
     */
    public static DoubleDouble ofProduct(double a, double b) {
        final double p = a * b;
        if (p == 0 || !Double.isFinite(p)) {
            return special(p);
        }
        return ofOrdered(p, DoublePrecision.productLow(a, b, p));
    }

    /**
     * Create a double-double with the quotient of two {@code double} values
     * to double-double precision.
     *
     * @param a Dividend.
     * @param b Divisor.
     * @return a / b
     */
    public static DoubleDouble ofQuotient(double a, double b) {
        final double q1 = a / b;
        if (q1 == 0 || !Double.isFinite(q1)) {
            return special(q1);
        }
        // Exact remainder: a - q1 * b
        final double p = q1 * b;
        final double r = (a - p) - DoublePrecision.productLow(q1, b, p);
        return ofOrdered(q1, r / b);
    }

    /**
     * Parses a decimal string to a double-double.
     *
     * <p>The string may have leading and trailing whitespace, an optional sign, digits with
     * optional {@code '_'} separators, at most one decimal point and an optional exponent
     * introduced by {@code 'e'} or {@code 'E'}. The case-insensitive literals {@code "nan"},
     * {@code "inf"} and {@code "infinity"} (with an optional sign) are also accepted.
     *
     * @param s String.
     * @return the double-double
     * @throws DecimalParseException if the string is empty or not a valid number
     */
    public static DoubleDouble parse(String s) {
        final ParsedDecimal d = ParsedDecimal.parse(s);
        if (d.isNaN()) {
            return NaN;
        }
        if (d.isInfinite()) {
            return d.isNegative() ? NEGATIVE_INFINITY : POSITIVE_INFINITY;
        }
        // Powers of ten are only exact to a few ulp: evaluate with extra precision
        final DoubleDouble r = QuadDouble.ofMagnitude(d).toDoubleDouble();
        return d.isNegative() ? r.negate() : r;
    }

    /**
     * Create a double-double from ordered parts {@code |x| >= |xx|} using a fast two-sum.
     * Non-finite results are returned as the value carried by the high part.
     *
     * @param x High part.
     * @param xx Low part.
     * @return the double-double
     */
    private static DoubleDouble ofOrdered(double x, double xx) {
        final double s = x + xx;
        if (Double.isFinite(s)) {
            return new DoubleDouble(s, DoublePrecision.fastTwoSumLow(x, xx, s));
        }
        // Overflow, or an invalid low part from an overflow in the error term
        return Double.isNaN(s) && !Double.isNaN(x) ? new DoubleDouble(x, 0.0) : special(s);
    }

    /**
     * Create a double-double from a special value (NaN, infinite or zero) or a value
     * that is exact in a single {@code double}.
     *
     * @param x Value.
     * @return the double-double
     */
    private static DoubleDouble special(double x) {
        return Double.isNaN(x) ? NaN : new DoubleDouble(x, 0.0);
    }

    /**
     * Gets the high part of the double-double.
     *
     * @return the high part
     */
    public double hi() {
        return hi;
    }

    /**
     * Gets the low part of the double-double.
     *
     * @return the low part
     */
    public double lo() {
        return lo;
    }

    /**
     * Gets the value as a {@code double}. This is the high part which is the
     * closest {@code double} to the value.
     *
     * @return the value
     */
    public double doubleValue() {
        return hi;
    }

    /**
     * Returns {@code true} if either part is NaN.
     *
     * @return {@code true} if this is NaN
     */
    public boolean isNaN() {
        return Double.isNaN(hi) || Double.isNaN(lo);
    }

    /**
     * Returns {@code true} if the value is infinite and not NaN.
     *
     * @return {@code true} if this is infinite
     */
    public boolean isInfinite() {
        return Double.isInfinite(hi) && !Double.isNaN(lo);
    }

    /**
     * Returns {@code true} if both parts are finite.
     *
     * @return {@code true} if this is finite
     */
    public boolean isFinite() {
        return Double.isFinite(hi) && Double.isFinite(lo);
    }

    /**
     * Returns {@code true} if the value is positive or negative zero.
     *
     * @return {@code true} if this is zero
     */
    public boolean isZero() {
        return hi == 0;
    }

    /**
     * Returns {@code true} if the sign bit of the high part is set. This is
     * {@code true} for negative numbers, negative zero and negative infinity.
     *
     * @return {@code true} if this has a negative sign
     */
    public boolean isSignNegative() {
        return Math.copySign(1.0, hi) < 0;
    }

    /**
     * Returns {@code true} if the sign bit of the high part is not set.
     *
     * @return {@code true} if this has a positive sign
     */
    public boolean isSignPositive() {
        return !isSignNegative();
    }

    /**
     * Returns the signum function of the value: zero if the value is zero (with the
     * sign of the value), 1 if it is greater than zero, -1 if less than zero, and NaN
     * if it is NaN.
     *
     * @return the sign of the value
     */
    public DoubleDouble signum() {
        if (isNaN()) {
            return NaN;
        }
        return isZero() ? this : of(Math.signum(hi));
    }

    /**
     * Returns a double-double whose value is {@code (this + y)}.
     *
     * @param y Value to add.
     * @return {@code this + y}
     */
    public DoubleDouble add(DoubleDouble y) {
        return sum(hi, lo, y.hi, y.lo);
    }

    /**
     * Returns a double-double whose value is {@code (this + y)}.
     *
     * @param y Value to add.
     * @return {@code this + y}
     */
    public DoubleDouble add(double y) {
        return sum(hi, lo, y, 0.0);
    }

    /**
     * Returns a double-double whose value is {@code (this - y)}.
     *
     * @param y Value to subtract.
     * @return {@code this - y}
     */
    public DoubleDouble subtract(DoubleDouble y) {
        return sum(hi, lo, -y.hi, -y.lo);
    }

    /**
     * Returns a double-double whose value is {@code (this - y)}.
     *
     * @param y Value to subtract.
     * @return {@code this - y}
     */
    public DoubleDouble subtract(double y) {
        return sum(hi, lo, -y, 0.0);
    }

    /**
     * Compute the sum of {@code (x, xx)} and {@code (y, yy)}.
     *
     * <p>Infinite and NaN operands follow IEEE754 addition. A zero result has the sign
     * of the IEEE754 sum of the high parts, thus {@code -0 + -0 = -0}.
     *
     * @param x High part of the first value.
     * @param xx Low part of the first value.
     * @param y High part of the second value.
     * @param yy Low part of the second value.
     * @return the sum
     */
    private static DoubleDouble sum(double x, double xx, double y, double yy) {
        if (Double.isNaN(xx) || Double.isNaN(yy)) {
            return NaN;
        }
        final double s = x + y;
        if (!Double.isFinite(s)) {
            // Infinite operand, overflow or inf - inf
            return special(s);
        }
        double e = DoublePrecision.twoSumLow(x, y, s);
        final double t = xx + yy;
        final double f = DoublePrecision.twoSumLow(xx, yy, t);
        e += t;
        double z = s + e;
        e = DoublePrecision.fastTwoSumLow(s, e, z);
        e += f;
        final double zz = z + e;
        if (zz == 0) {
            // Exact cancellation. The sign follows the sum of the high parts.
            return new DoubleDouble(s == 0 ? s : 0.0, 0.0);
        }
        e = DoublePrecision.fastTwoSumLow(z, e, zz);
        z = zz;
        if (!Double.isFinite(z)) {
            return special(z);
        }
        return new DoubleDouble(z, e);
    }

    /**
     * Returns a double-double whose value is {@code (this * y)}.
     *
     * @param y Factor.
     * @return {@code this * y}
     */
    public DoubleDouble multiply(DoubleDouble y) {
        return product(hi, lo, y.hi, y.lo);
    }

    /**
     * Returns a double-double whose value is {@code (this * y)}.
     *
     * @param y Factor.
     * @return {@code this * y}
     */
    public DoubleDouble multiply(double y) {
        return product(hi, lo, y, 0.0);
    }

    /**
     * Compute the product of {@code (x, xx)} and {@code (y, yy)}.
     *
     * <p>Special cases follow IEEE754 multiplication of the high parts: a zero or
     * infinite result has the sign of the exclusive-or of the operand signs and
     * {@code 0 * inf} is NaN.
     *
     * @param x High part of the first value.
     * @param xx Low part of the first value.
     * @param y High part of the second value.
     * @param yy Low part of the second value.
     * @return the product
     */
    private static DoubleDouble product(double x, double xx, double y, double yy) {
        if (Double.isNaN(xx) || Double.isNaN(yy)) {
            return NaN;
        }
        final double p = x * y;
        if (p == 0 || !Double.isFinite(p)) {
            return special(p);
        }
        final double e = DoublePrecision.productLow(x, y, p) + (x * yy + xx * y);
        return ofOrdered(p, e);
    }

    /**
     * Returns a double-double whose value is {@code (this / y)}.
     *
     * <p>Special cases follow IEEE754 division of the high parts: {@code 0 / 0} and
     * {@code inf / inf} are NaN, a finite value divided by zero is a signed infinity, and
     * a finite value divided by infinity is a signed zero.
     *
     * @param y Divisor.
     * @return {@code this / y}
     */
    public DoubleDouble divide(DoubleDouble y) {
        if (isNaN() || y.isNaN()) {
            return NaN;
        }
        final double q1 = hi / y.hi;
        if (q1 == 0 || !Double.isFinite(q1)) {
            return special(q1);
        }
        // Long division with three quotient terms
        DoubleDouble r = subtract(y.multiply(q1));
        final double q2 = r.hi / y.hi;
        r = r.subtract(y.multiply(q2));
        final double q3 = r.hi / y.hi;
        return ofOrdered(q1, q2).add(q3);
    }

    /**
     * Returns a double-double whose value is {@code (this / y)}.
     *
     * @param y Divisor.
     * @return {@code this / y}
     * @see #divide(DoubleDouble)
     */
    public DoubleDouble divide(double y) {
        return divide(of(y));
    }

    /**
     * Returns a double-double whose value is {@code (1 / this)}.
     *
     * @return {@code 1 / this}
     */
    public DoubleDouble reciprocal() {
        return ONE.divide(this);
    }

    /**
     * Returns a double-double whose value is {@code (-this)}.
     *
     * @return {@code -this}
     */
    public DoubleDouble negate() {
        // A zero low part remains positive zero
        return new DoubleDouble(-hi, lo == 0 ? 0.0 : -lo);
    }

    /**
     * Returns the absolute value.
     *
     * @return {@code |this|}
     */
    public DoubleDouble abs() {
        return isSignNegative() ? negate() : this;
    }

    /**
     * Returns a double-double whose value is {@code (this * this)}.
     *
     * @return {@code this^2}
     */
    public DoubleDouble square() {
        if (Double.isNaN(lo)) {
            return NaN;
        }
        final double p = hi * hi;
        if (p == 0 || !Double.isFinite(p)) {
            return special(p);
        }
        final double e = DoublePrecision.squareLow(hi, p) + (2 * hi * lo + lo * lo);
        return ofOrdered(p, e);
    }

    /**
     * Returns a double-double whose value is {@code this * 2^n}. The scaling is exact
     * unless the result is sub-normal or overflows.
     *
     * @param n Power of 2.
     * @return {@code this * 2^n}
     */
    public DoubleDouble scalb(int n) {
        return new DoubleDouble(Math.scalb(hi, n), Math.scalb(lo, n));
    }

    /**
     * Returns the largest value that is less than or equal to this and is an integer.
     *
     * @return the floor
     */
    public DoubleDouble floor() {
        if (!isFinite()) {
            return isNaN() ? NaN : this;
        }
        final double x = Math.floor(hi);
        final double xx = x == hi ? Math.floor(lo) : 0.0;
        return xx == 0 ? new DoubleDouble(x, 0.0) : ofOrdered(x, xx);
    }

    /**
     * Returns the smallest value that is greater than or equal to this and is an integer.
     *
     * @return the ceiling
     */
    public DoubleDouble ceil() {
        if (!isFinite()) {
            return isNaN() ? NaN : this;
        }
        final double x = Math.ceil(hi);
        final double xx = x == hi ? Math.ceil(lo) : 0.0;
        return xx == 0 ? new DoubleDouble(x, 0.0) : ofOrdered(x, xx);
    }

    /**
     * Returns the square root.
     *
     * <p>Uses a single Karp-Markstein iteration from a {@code double} estimate
     * {@code x = 1 / sqrt(a)}:
     * <pre>
     * sqrt(a) = a * x + (a - (a * x)^2) * x / 2
     * </pre>
     *
     * <p>The square root of zero is zero of the same sign; of a negative value is NaN.
     *
     * @return {@code sqrt(this)}
     * @see <a href="https://doi.org/10.1145/279232.279237">
     * Karp and Markstein (1997) High-precision division and square root</a>
     */
    public DoubleDouble sqrt() {
        if (isZero()) {
            return this;
        }
        if (isNaN() || hi < 0) {
            return NaN;
        }
        if (isInfinite()) {
            return this;
        }
        final int k = Math.getExponent(hi);
        if (Math.abs(k) > SQRT_SCALE_EXPONENT) {
            // Even power of 2 so the root is exact
            final int e = k & ~1;
            return scalb(-e).sqrt().scalb(e / 2);
        }
        final DoubleDouble x = ofQuotient(1.0, Math.sqrt(hi));
        final DoubleDouble ax = multiply(x);
        return ax.add(subtract(ax.square()).multiply(x).scalb(-1));
    }

    /**
     * Returns the cube root.
     *
     * @return {@code cbrt(this)}
     * @see #nroot(int)
     */
    public DoubleDouble cbrt() {
        return nroot(3);
    }

    /**
     * Returns the n-th root.
     *
     * <p>Solves {@code f(x) = x^-n - a} for {@code x = a^(-1/n)} using Newton's iteration
     * from a {@code double} estimate, then returns the reciprocal:
     * <pre>
     * x' = x + x * (1 - a * x^n) / n
     * </pre>
     *
     * <p>Returns NaN if {@code n <= 0}, or if {@code n} is even and this is negative.
     *
     * @param n Degree of the root.
     * @return {@code this^(1/n)}
     */
    public DoubleDouble nroot(int n) {
        if (n <= 0 || isNaN() || ((n & 1) == 0 && isSignNegative() && !isZero())) {
            return NaN;
        }
        if (n == 1) {
            return this;
        }
        if (n == 2) {
            return sqrt();
        }
        if (isZero() || isInfinite()) {
            return this;
        }
        final int k = Math.getExponent(hi);
        if (Math.abs(k) > ROOT_SCALE_EXPONENT) {
            // a^(1/n) = (a * 2^-nq)^(1/n) * 2^q
            final int q = (int) Math.round((double) k / n);
            final int e = k - n * q;
            if (Math.abs(e) <= ROOT_SCALE_EXPONENT) {
                return scalb(-n * q).nroot(n).scalb(q);
            }
            // Large n: a^(1/n) = (a * 2^-k)^(1/n) * exp(k * ln2 / n)
            return scalb(-k).nroot(n).multiply(LN_2.multiply(k).divide(n).exp());
        }
        final DoubleDouble r = abs();
        DoubleDouble x = of(Math.exp(-Math.log(r.hi) / n));
        for (int i = 0; i < ROOT_ITERATIONS; i++) {
            x = x.add(x.multiply(ONE.subtract(r.multiply(x.pow(n)))).divide(n));
        }
        if (isSignNegative()) {
            x = x.negate();
        }
        return x.reciprocal();
    }

    /**
     * Returns this raised to the integer power {@code n} using binary exponentiation.
     * A negative power returns the reciprocal of the positive power. Any value raised
     * to the power zero is one.
     *
     * @param n Power.
     * @return {@code this^n}
     */
    public DoubleDouble pow(int n) {
        if (n == 0) {
            return ONE;
        }
        long k = Math.abs((long) n);
        DoubleDouble s;
        if (k == 1) {
            s = this;
        } else {
            DoubleDouble r = this;
            s = ONE;
            while (k > 0) {
                if ((k & 1) == 1) {
                    s = s.multiply(r);
                }
                k >>>= 1;
                if (k > 0) {
                    r = r.square();
                }
            }
        }
        return n < 0 ? s.reciprocal() : s;
    }

    /**
     * Returns this raised to the power {@code y}, computed as {@code exp(y * log(this))}.
     *
     * <p>Special cases:
     * <ul>
     * <li>If either value is NaN the result is NaN.
     * <li>If this is zero: {@code 0^0} is NaN, {@code 0^y} is zero for positive {@code y}
     *     and positive infinity for negative {@code y}.
     * <li>If {@code y} is infinite: {@code 1^y} is NaN, otherwise the result is positive
     *     infinity for positive {@code y} and zero for negative {@code y}.
     * <li>If this is negative the result is NaN.
     * </ul>
     *
     * @param y Power.
     * @return {@code this^y}
     */
    public DoubleDouble pow(DoubleDouble y) {
        if (isNaN() || y.isNaN()) {
            return NaN;
        }
        if (isZero()) {
            if (y.isZero()) {
                return NaN;
            }
            return y.isSignPositive() ? ZERO : POSITIVE_INFINITY;
        }
        if (y.isInfinite()) {
            if (isOne()) {
                return NaN;
            }
            return y.isSignPositive() ? POSITIVE_INFINITY : ZERO;
        }
        return y.multiply(log()).exp();
    }

    /**
     * Returns Euler's number e raised to the power of this value.
     *
     * <p>The argument is reduced as {@code x = m ln(2) + 512 r} with {@code |r| <= ln(2) / 1024}.
     * A Taylor series computes {@code exp(r) - 1} which is raised to the power 512 by
     * nine iterations of {@code s' = 2s + s^2} (the expansion of {@code (1 + s)^2 - 1}),
     * and the result is scaled by {@code 2^m}.
     *
     * <p>Arguments at or below -600 return zero; above 708 return positive infinity.
     *
     * @return {@code e^this}
     */
    public DoubleDouble exp() {
        if (isNaN()) {
            return NaN;
        }
        if (hi <= EXP_LOWER_LIMIT) {
            return ZERO;
        }
        if (hi > EXP_UPPER_LIMIT) {
            return POSITIVE_INFINITY;
        }
        if (isZero()) {
            return ONE;
        }
        if (isOne()) {
            return E;
        }

        final double m = Math.floor(hi / LN_2.hi + 0.5);
        final DoubleDouble r = subtract(LN_2.multiply(m)).scalb(-EXP_REDUCTION_BITS);

        // Taylor series: r + r^2/2! + r^3/3! + ...
        DoubleDouble p = r.square();
        DoubleDouble s = r.add(p.scalb(-1));
        p = p.multiply(r);
        DoubleDouble t = p.multiply(INV_FACTORIALS[0]);
        int i = 0;
        do {
            s = s.add(t);
            p = p.multiply(r);
            t = p.multiply(INV_FACTORIALS[++i]);
        } while (Math.abs(t.hi) > EXP_TOLERANCE && i < EXP_MAX_TERM);
        s = s.add(t);

        // (1 + s)^512 - 1
        for (int j = 0; j < EXP_REDUCTION_BITS; j++) {
            s = s.scalb(1).add(s.square());
        }
        return s.add(1.0).scalb((int) m);
    }

    /**
     * Returns the natural logarithm.
     *
     * <p>Uses Newton's iteration on {@code f(x) = exp(x) - a} from a {@code double} estimate:
     * <pre>
     * x' = x + a * exp(-x) - 1
     * </pre>
     *
     * <p>Arguments with a large binary exponent {@code k} are computed as
     * {@code log(a * 2^-k) + k ln(2)}.
     *
     * @return {@code log(this)}
     * @throws IllegalStateException if the iteration does not converge
     */
    public DoubleDouble log() {
        if (isNaN()) {
            return NaN;
        }
        if (isZero()) {
            return NEGATIVE_INFINITY;
        }
        if (hi < 0) {
            return NaN;
        }
        if (isInfinite()) {
            return this;
        }
        if (isOne()) {
            return ZERO;
        }
        final int k = Math.getExponent(hi);
        if (Math.abs(k) > LOG_SCALE_EXPONENT) {
            return scalb(-k).log().add(LN_2.multiply(k));
        }

        DoubleDouble x = of(Math.log(hi));
        final double tolerance = Math.scalb(EPSILON.hi, Math.max(Math.getExponent(x.hi), 0) + 2);
        for (int i = 0; i < LOG_MAX_ITERATIONS; i++) {
            final DoubleDouble r = x.add(multiply(x.negate().exp())).subtract(1.0);
            if (Math.abs(x.subtract(r).hi) < tolerance) {
                return r;
            }
            x = r;
        }
        throw new IllegalStateException("Logarithm did not converge: " + this);
    }

    /**
     * Returns the base 10 logarithm.
     *
     * @return {@code log10(this)}
     */
    public DoubleDouble log10() {
        return log().divide(LN_10);
    }

    /**
     * Returns the base 2 logarithm.
     *
     * @return {@code log2(this)}
     */
    public DoubleDouble log2() {
        return log().divide(LN_2);
    }

    /**
     * Returns the logarithm in the specified base.
     *
     * @param base Base.
     * @return {@code log(this) / log(base)}
     */
    public DoubleDouble log(double base) {
        return log().divide(of(base).log());
    }

    /**
     * Returns the trigonometric sine.
     *
     * @return {@code sin(this)}
     */
    public DoubleDouble sin() {
        return sinCos()[0];
    }

    /**
     * Returns the trigonometric cosine.
     *
     * @return {@code cos(this)}
     */
    public DoubleDouble cos() {
        return sinCos()[1];
    }

    /**
     * Returns the trigonometric tangent.
     *
     * @return {@code tan(this)}
     */
    public DoubleDouble tan() {
        final DoubleDouble[] sc = sinCos();
        return sc[0].divide(sc[1]);
    }

    /**
     * Returns the arc tangent in the range {@code [-pi/2, pi/2]}.
     *
     * @return {@code atan(this)}
     */
    public DoubleDouble atan() {
        return atan2(ONE);
    }

    /**
     * Returns the angle theta from the conversion of rectangular coordinates {@code (x, y)}
     * to polar coordinates {@code (r, theta)}, where this value is {@code y}.
     *
     * <p>Newton's iteration is applied to {@code sin(z) = y / r} when {@code |x| > |y|},
     * otherwise to {@code cos(z) = x / r}, with {@code r = sqrt(x^2 + y^2)}, starting
     * from the {@code double} estimate. A fixed number of iterations is used.
     *
     * <p>Special cases:
     * <ul>
     * <li>If either value is NaN the result is NaN.
     * <li>If {@code x} is zero: {@code y} zero is NaN, otherwise {@code +/-pi/2} with the
     *     sign of {@code y}.
     * <li>If {@code y} is zero: {@code 0} for positive {@code x}, {@code pi} for negative
     *     {@code x}.
     * <li>If {@code y} is infinite: {@code x} infinite is NaN, otherwise {@code +/-pi/2}
     *     with the sign of {@code y}.
     * <li>If {@code x} is positive infinity: zero with the sign of {@code y}; if
     *     {@code x} is negative infinity: {@code +/-pi} with the sign of {@code y}.
     * <li>{@code y == x} is {@code pi/4} or {@code -3pi/4}; {@code y == -x} is
     *     {@code 3pi/4} or {@code -pi/4}.
     * </ul>
     *
     * @param x Abscissa.
     * @return {@code atan2(this, x)}
     */
    public DoubleDouble atan2(DoubleDouble x) {
        if (isNaN() || x.isNaN()) {
            return NaN;
        }
        final boolean negative = isSignNegative();
        if (x.isZero()) {
            if (isZero()) {
                return NaN;
            }
            return negative ? HALF_PI.negate() : HALF_PI;
        }
        if (isZero()) {
            return x.isSignPositive() ? ZERO : PI;
        }
        if (isInfinite()) {
            if (x.isInfinite()) {
                return NaN;
            }
            return negative ? HALF_PI.negate() : HALF_PI;
        }
        if (x.isInfinite()) {
            if (x.isSignPositive()) {
                return negative ? NEGATIVE_ZERO : ZERO;
            }
            return negative ? PI.negate() : PI;
        }
        if (compareTo(x) == 0) {
            return negative ? THREE_QUARTER_PI.negate() : QUARTER_PI;
        }
        if (compareTo(x.negate()) == 0) {
            return negative ? QUARTER_PI.negate() : THREE_QUARTER_PI;
        }

        // Scale to avoid over/underflow of the squares
        final int scale = Math.max(Math.getExponent(hi), Math.getExponent(x.hi));
        final DoubleDouble ys = scalb(-scale);
        final DoubleDouble xs = x.scalb(-scale);
        final DoubleDouble r = ys.square().add(xs.square()).sqrt();
        final DoubleDouble xr = xs.divide(r);
        final DoubleDouble yr = ys.divide(r);

        DoubleDouble z = of(Math.atan2(hi, x.hi));
        final boolean useSine = Math.abs(xr.hi) > Math.abs(yr.hi);
        for (int i = 0; i < ATAN2_ITERATIONS; i++) {
            final DoubleDouble[] sc = z.sinCos();
            z = useSine ?
                z.add(yr.subtract(sc[0]).divide(sc[1])) :
                z.subtract(xr.subtract(sc[1]).divide(sc[0]));
        }
        return z;
    }

    /**
     * Compute the sine and cosine.
     *
     * <p>The argument is reduced modulo {@code 2 pi}, then by a multiple {@code j} of
     * {@code pi/2} and a multiple {@code k} of {@code pi/16}. The sine of the remainder
     * {@code t} uses a Taylor series and the cosine is {@code sqrt(1 - sin^2 t)}. The
     * result is reconstructed using the tabulated values of {@code sin(k pi/16)} and
     * {@code cos(k pi/16)}.
     *
     * @return {@code [sin(this), cos(this)]}
     */
    private DoubleDouble[] sinCos() {
        if (!isFinite()) {
            return new DoubleDouble[] {NaN, NaN};
        }
        if (isZero()) {
            return new DoubleDouble[] {this, ONE};
        }

        final double z = Math.floor(divide(TWO_PI).hi + 0.5);
        final DoubleDouble r = subtract(TWO_PI.multiply(z));

        double q = Math.floor(r.hi / HALF_PI.hi + 0.5);
        DoubleDouble t = r.subtract(HALF_PI.multiply(q));
        final int j = (int) q;
        q = Math.floor(t.hi / SIXTEENTH_PI.hi + 0.5);
        t = t.subtract(SIXTEENTH_PI.multiply(q));
        final int k = (int) q;

        DoubleDouble s;
        DoubleDouble c;
        if (t.isZero()) {
            s = ZERO;
            c = ONE;
        } else {
            s = sinTaylor(t);
            c = ONE.subtract(s.square()).sqrt();
        }
        if (k != 0) {
            final int absK = Math.abs(k);
            final DoubleDouble u = COSINES[absK - 1];
            final DoubleDouble v = SINES[absK - 1];
            final DoubleDouble sinT = s;
            if (k > 0) {
                s = u.multiply(sinT).add(v.multiply(c));
                c = u.multiply(c).subtract(v.multiply(sinT));
            } else {
                s = u.multiply(sinT).subtract(v.multiply(c));
                c = u.multiply(c).add(v.multiply(sinT));
            }
        }

        switch (j) {
        case 0:
            return new DoubleDouble[] {s, c};
        case 1:
            return new DoubleDouble[] {c, s.negate()};
        case -1:
            return new DoubleDouble[] {c.negate(), s};
        default:
            return new DoubleDouble[] {s.negate(), c.negate()};
        }
    }

    /**
     * Compute the sine of a small argument using the Taylor series.
     *
     * @param a Argument ({@code |a| <= pi/32}).
     * @return {@code sin(a)}
     */
    private static DoubleDouble sinTaylor(DoubleDouble a) {
        final double threshold = 0.5 * Math.abs(a.hi) * EPSILON.hi;
        final DoubleDouble x = a.square().negate();
        DoubleDouble s = a;
        DoubleDouble r = a;
        DoubleDouble t;
        int i = 0;
        do {
            r = r.multiply(x);
            t = r.multiply(INV_FACTORIALS[i]);
            s = s.add(t);
            i += 2;
        } while (i < INV_FACTORIALS.length && Math.abs(t.hi) > threshold);
        return s;
    }

    /**
     * Returns the leading significant decimal digits of the absolute value.
     *
     * <p>The digits {@code d} and exponent {@code e} represent
     * {@code d[0].d[1]d[2]... * 10^e} rounded half-up at the last digit. A zero value
     * has all zero digits and an exponent of zero. The value must be finite.
     *
     * @param count Number of significant digits.
     * @return the digits
     * @throws IllegalArgumentException if the count is not strictly positive or the value
     * is not finite
     */
    public DecimalDigits toDigits(int count) {
        DecimalDigits.checkCount(count);
        if (!isFinite()) {
            throw new IllegalArgumentException("Non-finite value: " + hi);
        }
        if (isZero()) {
            return DecimalDigits.zero(count);
        }
        // Digits are extracted with extra precision so the powers of ten and the
        // repeated multiplication by 10 do not perturb the last digits
        return QuadDouble.of(this).toDigits(count);
    }

    /**
     * Returns the smaller of this and {@code y} using the ordering of
     * {@link #compareTo(DoubleDouble)}. If either value is NaN the result is NaN.
     *
     * @param y Value.
     * @return the minimum
     */
    public DoubleDouble min(DoubleDouble y) {
        if (isNaN() || y.isNaN()) {
            return NaN;
        }
        return compareTo(y) <= 0 ? this : y;
    }

    /**
     * Returns the larger of this and {@code y} using the ordering of
     * {@link #compareTo(DoubleDouble)}. If either value is NaN the result is NaN.
     *
     * @param y Value.
     * @return the maximum
     */
    public DoubleDouble max(DoubleDouble y) {
        if (isNaN() || y.isNaN()) {
            return NaN;
        }
        return compareTo(y) >= 0 ? this : y;
    }

    /**
     * Returns {@code true} if this is exactly one.
     *
     * @return {@code true} if one
     */
    private boolean isOne() {
        return hi == 1 && lo == 0;
    }

    /**
     * Compares this double-double with the specified double-double. The high parts are
     * compared using {@link Double#compare(double, double)} and ties are resolved using
     * the low parts. This ordering is consistent with {@link #equals(Object)}; as with
     * {@code Double}, {@code -0.0} is less than {@code 0.0} and NaN is greater than all
     * other values.
     *
     * @param o Double-double to be compared.
     * @return a negative integer, zero, or a positive integer as this is less than, equal
     * to, or greater than the argument
     */
    @Override
    public int compareTo(DoubleDouble o) {
        final int c = Double.compare(hi, o.hi);
        return c != 0 ? c : Double.compare(lo, o.lo);
    }

    /**
     * Test for equality with another object. Two double-doubles are equal if both parts
     * have the same bits as reported by {@link Double#doubleToLongBits(double)}.
     *
     * @param other Object to test for equality with this instance.
     * @return {@code true} if the objects are equal
     */
    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (other instanceof DoubleDouble) {
            final DoubleDouble y = (DoubleDouble) other;
            return Double.doubleToLongBits(hi) == Double.doubleToLongBits(y.hi) &&
                   Double.doubleToLongBits(lo) == Double.doubleToLongBits(y.lo);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * Double.hashCode(hi) + Double.hashCode(lo);
    }

    /**
     * Returns a string representation in fixed-point notation with 31 significant digits.
     * Trailing zeros in the fraction are removed. Non-finite values are represented as
     * {@code "NaN"}, {@code "Infinity"} or {@code "-Infinity"}.
     *
     * @return the string
     */
    @Override
    public String toString() {
        if (!isFinite()) {
            return DecimalDigits.toNonFiniteString(isNaN(), isSignNegative());
        }
        return DecimalDigits.toPlainString(isSignNegative(), toDigits(DIGITS));
    }

    /**
     * Returns a string representation in fixed-point notation with the specified number
     * of digits after the decimal point. The value is rounded half-up.
     *
     * @param places Number of fractional digits.
     * @return the string
     * @throws IllegalArgumentException if {@code places} is negative
     */
    public String toString(int places) {
        if (!isFinite()) {
            return DecimalDigits.toNonFiniteString(isNaN(), isSignNegative());
        }
        return DecimalDigits.toFixedString(isSignNegative(), this::toDigits, DIGITS, places);
    }

    /**
     * Returns a string representation in scientific notation with 31 significant digits,
     * e.g. {@code "2.3e1"}. Trailing zeros in the fraction are removed.
     *
     * @return the string
     */
    public String toScientificString() {
        if (!isFinite()) {
            return DecimalDigits.toNonFiniteString(isNaN(), isSignNegative());
        }
        return DecimalDigits.toScientificString(isSignNegative(), toDigits(DIGITS), true);
    }

    /**
     * Returns a string representation in scientific notation with the specified number
     * of digits after the decimal point, e.g. {@code "1.678e-2"}.
     *
     * @param places Number of fractional digits.
     * @return the string
     * @throws IllegalArgumentException if {@code places} is negative
     */
    public String toScientificString(int places) {
        if (!isFinite()) {
            return DecimalDigits.toNonFiniteString(isNaN(), isSignNegative());
        }
        DecimalDigits.checkPlaces(places);
        return DecimalDigits.toScientificString(isSignNegative(), toDigits(places + 1), false);
    }
}
