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
import java.util.Arrays;

/**
 * A number represented as the unevaluated sum of four {@code double} limbs
 * {@code (x0, x1, x2, x3)} that are non-overlapping and ordered by decreasing magnitude.
 * This provides approximately 212 bits (62 decimal digits) of precision with the
 * exponent range of a {@code double}.
 *
 * <p>Instances are immutable. Special values follow IEEE754 semantics and are carried in
 * the leading limb: the remaining limbs of an infinite or zero value are zero, and any
 * NaN limb marks the value as NaN.
 *
 * <p>Addition uses an exact merge of the limbs of both operands. Multiplication omits
 * partial products below the precision of the result.
 *
 * @see <a href="https://www.davidhbailey.com/dhbpapers/qd.pdf">
 * Hida, Li and Bailey (2000) Quad-Double Arithmetic: Algorithms, Implementation, and Application</a>
 */
public final class QuadDouble implements Comparable<QuadDouble>, Serializable {
    /** A quad-double with value 0.0. */
    public static final QuadDouble ZERO = new QuadDouble(0.0, 0.0, 0.0, 0.0);
    /** A quad-double with value -0.0. */
    public static final QuadDouble NEGATIVE_ZERO = new QuadDouble(-0.0, 0.0, 0.0, 0.0);
    /** A quad-double with value 1.0. */
    public static final QuadDouble ONE = new QuadDouble(1.0, 0.0, 0.0, 0.0);
    /** A quad-double with value 10.0. */
    public static final QuadDouble TEN = new QuadDouble(10.0, 0.0, 0.0, 0.0);
    /** A quad-double with value NaN. */
    public static final QuadDouble NaN = new QuadDouble(Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    /** A quad-double with value positive infinity. */
    public static final QuadDouble POSITIVE_INFINITY = new QuadDouble(Double.POSITIVE_INFINITY, 0.0, 0.0, 0.0);
    /** A quad-double with value negative infinity. */
    public static final QuadDouble NEGATIVE_INFINITY = new QuadDouble(Double.NEGATIVE_INFINITY, 0.0, 0.0, 0.0);
    /** The relative precision of a quad-double: {@code 2^-209}. */
    public static final QuadDouble EPSILON = new QuadDouble(0x1.0p-209, 0.0, 0.0, 0.0);

    /** The constant pi. */
    public static final QuadDouble PI = new QuadDouble(
        3.141592653589793, 1.2246467991473532e-16, -2.9947698097183397e-33, 1.1124542208633653e-49);
    /** The constant 2 pi. */
    public static final QuadDouble TWO_PI = new QuadDouble(
        6.283185307179586, 2.4492935982947064e-16, -5.989539619436679e-33, 2.2249084417267306e-49);
    /** The constant pi / 2. */
    public static final QuadDouble HALF_PI = new QuadDouble(
        1.5707963267948966, 6.123233995736766e-17, -1.4973849048591698e-33, 5.562271104316826e-50);
    /** The constant pi / 4. */
    public static final QuadDouble QUARTER_PI = new QuadDouble(
        0.7853981633974483, 3.061616997868383e-17, -7.486924524295849e-34, 2.781135552158413e-50);
    /** The constant e, the base of the natural logarithm. */
    public static final QuadDouble E = new QuadDouble(
        2.718281828459045, 1.4456468917292502e-16, -2.1277171080381768e-33, 1.5156301598412191e-49);
    /** The natural logarithm of 2. */
    public static final QuadDouble LN_2 = new QuadDouble(
        0.6931471805599453, 2.3190468138462996e-17, 5.707708438416212e-34, -3.5824322106018114e-50);
    /** The natural logarithm of 10. */
    public static final QuadDouble LN_10 = new QuadDouble(
        2.302585092994046, -2.1707562233822494e-16, -9.984262454465777e-33, -4.023357454450206e-49);
    /** The square root of 2. */
    public static final QuadDouble SQRT_2 = new QuadDouble(
        1.4142135623730951, -9.667293313452913e-17, 4.1386753086994136e-33, 4.935546991468351e-50);

    /** The constant 3 pi / 4. */
    private static final QuadDouble THREE_QUARTER_PI = new QuadDouble(
        2.356194490192345, 9.184850993605148e-17, 3.9168984647504e-33, -2.5867981632704864e-49);
    /** The constant pi / 16. */
    private static final QuadDouble SIXTEENTH_PI = new QuadDouble(
        0.19634954084936207, 7.654042494670958e-18, -1.8717311310739623e-34, 6.952838880396033e-51);

    /** Inverse factorials 1/3! to 1/32!. */
    private static final QuadDouble[] INV_FACTORIALS = {
        new QuadDouble(0.16666666666666666, 9.25185853854297e-18, 5.135813185032629e-34, 2.850949024098342e-50),
        new QuadDouble(0.041666666666666664, 2.3129646346357427e-18, 1.2839532962581572e-34, 7.127372560245855e-51),
        new QuadDouble(0.008333333333333333, 1.1564823173178714e-19, 1.6049416203226965e-36, 2.2273039250768297e-53),
        new QuadDouble(0.001388888888888889, -5.300543954373577e-20, -1.7386867553495878e-36, -1.6333562117230084e-52),
        new QuadDouble(0.0001984126984126984, 1.7209558293420705e-22, 1.4926912391394127e-40, 1.2947032674600247e-58),
        new QuadDouble(2.48015873015873e-5, 2.1511947866775882e-23, 1.865864048924266e-41, 1.6183790843250309e-59),
        new QuadDouble(2.7557319223985893e-6, -1.858393274046472e-22, 8.491754604881993e-39, -5.726616407894296e-55),
        new QuadDouble(2.755731922398589e-7, 2.3767714622250297e-23, -3.263188903340883e-40, 1.6143511186040442e-56),
        new QuadDouble(2.505210838544172e-8, -1.448814070935912e-24, 2.0426735146714455e-41, -8.496326720071632e-58),
        new QuadDouble(2.08767569878681e-9, -1.20734505911326e-25, 1.702227928892871e-42, 1.416095321503967e-58),
        new QuadDouble(1.6059043836821613e-10, 1.2585294588752098e-26, -5.31334602762985e-43, 3.5402147259760553e-59),
        new QuadDouble(1.1470745597729725e-11, 2.0655512752830745e-28, 6.889079232466646e-45, 5.729200026551091e-61),
        new QuadDouble(7.647163731819816e-13, 7.03872877733453e-30, -7.827539277162583e-48, 1.9213864944379024e-64),
        new QuadDouble(4.779477332387385e-14, 4.399205485834081e-31, -4.892212048226615e-49, 1.200866559023689e-65),
        new QuadDouble(2.8114572543455206e-15, 1.6508842730861433e-31, -2.877771793074479e-50, 4.2711068925629355e-67),
        new QuadDouble(1.5619206968586225e-16, 1.1910679660273754e-32, -4.577506059629983e-49, 2.874941423408996e-67),
        new QuadDouble(8.22063524662433e-18, 2.2141894119604265e-34, -1.508914023774199e-50, 1.4007295151478155e-67),
        new QuadDouble(4.110317623312165e-19, 1.4412973378659527e-36, -5.285627548789812e-53, -4.147647256357657e-70),
        new QuadDouble(1.9572941063391263e-20, -1.3643503830087908e-36, 1.3392348251125064e-53, -6.821089424149331e-70),
        new QuadDouble(8.896791392450574e-22, -7.911402614872376e-38, -3.1877976790570933e-54, 1.2705781017520566e-70),
        new QuadDouble(3.868170170630684e-23, -8.843177655482344e-40, 3.8718157106173247e-56, -1.9565257531522557e-72),
        new QuadDouble(1.6117375710961184e-24, -3.6846573564509766e-41, 1.613256546090552e-57, -8.1521906381344e-74),
        new QuadDouble(6.446950284384474e-26, -1.9330404233703465e-42, -1.5213023807039144e-58, 6.643772737212958e-75),
        new QuadDouble(2.4795962632247976e-27, -1.2953730964765229e-43, 6.403390159849962e-60, -8.460245627706746e-77),
        new QuadDouble(9.183689863795546e-29, 1.4303150396787322e-45, -8.551226774650505e-62, 8.381467100234538e-78),
        new QuadDouble(3.279889237069838e-30, 1.5117542744029879e-46, 8.058517719519716e-63, -9.096480530710929e-81),
        new QuadDouble(1.1309962886447716e-31, 1.0498015412959506e-47, -4.346150929397795e-64, -4.966779800140056e-81),
        new QuadDouble(3.7699876288159054e-33, 2.5870347832750324e-49, 3.23789002742564e-66, 2.5612859105788573e-82),
        new QuadDouble(1.216125041553518e-34, 5.586290567888806e-51, 6.615948578082792e-68, -3.162044228952086e-84),
        new QuadDouble(3.8003907548547434e-36, 1.7457158024652518e-52, 2.0674839306508725e-69, -9.881388215475268e-86),
    };
    /** sin(k pi / 16) for k = 1 to 4. */
    private static final QuadDouble[] SINES = {
        new QuadDouble(0.19509032201612828, -7.991079068461731e-18, 6.184627002422071e-34, -3.5840270918032937e-50),
        new QuadDouble(0.3826834323650898, -1.0050772696461588e-17, -2.0605316302806695e-34, -1.2717724698085205e-50),
        new QuadDouble(0.5555702330196022, 4.709410940561677e-17, -2.064052038368292e-33, 1.2290163188567138e-49),
        new QuadDouble(0.7071067811865476, -4.833646656726457e-17, 2.0693376543497068e-33, 2.4677734957341755e-50),
    };
    /** cos(k pi / 16) for k = 1 to 4. */
    private static final QuadDouble[] COSINES = {
        new QuadDouble(0.9807852804032304, 1.8546939997825006e-17, -1.0696564445530757e-33, 6.666817447526496e-50),
        new QuadDouble(0.9238795325112867, 1.7645047084336677e-17, -5.044253732158682e-34, -4.047867771682389e-50),
        new QuadDouble(0.8314696123025452, 1.4073856984728024e-18, 4.6951315383980835e-35, -2.023388151938257e-52),
        new QuadDouble(0.7071067811865476, -4.833646656726457e-17, 2.0693376543497068e-33, 2.4677734957341755e-50),
    };

    /** Number of significant decimal digits output by {@link #toString()}. */
    static final int DIGITS = 62;

    /** Number of limbs. */
    private static final int SIZE = 4;
    /** Arguments at or below this value have an exponential of zero. */
    private static final double EXP_LOWER_LIMIT = -600;
    /** Arguments above this value have an infinite exponential. */
    private static final double EXP_UPPER_LIMIT = 708;
    /** The power of 2 used to reduce the exponential argument: {@code k = 2^9 = 512}. */
    private static final int EXP_REDUCTION_BITS = 9;
    /** Taylor series terms below this magnitude are negligible for the reduced exponential. */
    private static final double EXP_TOLERANCE = 0x1.0p-209 / 512;
    /** Maximum index into the inverse factorial table for the exponential series. */
    private static final int EXP_MAX_TERM = 16;
    /** Binary exponent above which the logarithm argument is scaled towards 1. */
    private static final int LOG_SCALE_EXPONENT = 500;
    /** Maximum number of Newton iterations for the logarithm. */
    private static final int LOG_MAX_ITERATIONS = 20;
    /** Binary exponent above which the square root argument is scaled towards 1. */
    private static final int SQRT_SCALE_EXPONENT = 500;
    /** Number of Newton iterations for the reciprocal square root. */
    private static final int SQRT_ITERATIONS = 2;
    /** Binary exponent above which the n-th root operand is scaled. */
    private static final int ROOT_SCALE_EXPONENT = 500;
    /** Number of Newton iterations for the n-th root. */
    private static final int ROOT_ITERATIONS = 3;
    /** Number of Newton iterations for atan2. */
    private static final int ATAN2_ITERATIONS = 3;

    /** Serializable version identifier. */
    private static final long serialVersionUID = 20261017L;

    /** The limbs. */
    private final double[] x;

    /**
     * Create an instance. The limbs must be normalized.
     *
     * @param x0 Limb 0.
     * @param x1 Limb 1.
     * @param x2 Limb 2.
     * @param x3 Limb 3.
     */
    private QuadDouble(double x0, double x1, double x2, double x3) {
        this(new double[] {x0, x1, x2, x3});
    }

    /**
     * Create an instance using the array. The limbs must be normalized.
     *
     * @param x Limbs (not copied).
     */
    private QuadDouble(double[] x) {
        this.x = x;
    }

    /**
     * Create a quad-double with the value of the {@code double}.
     *
     * @param x Value.
     * @return the quad-double
     */
    public static QuadDouble of(double x) {
        return special(x);
    }

    /**
     * Create a quad-double from the unevaluated sum of the limbs. The limbs are
     * renormalized and may be given in any order. If the sum overflows the result is
     * the infinity of the {@code double} sum of the limbs.
     *
     * @param x0 Limb 0.
     * @param x1 Limb 1.
     * @param x2 Limb 2.
     * @param x3 Limb 3.
     * @return the quad-double
     */
    public static QuadDouble of(double x0, double x1, double x2, double x3) {
        final double[] limbs = {x0, x1, x2, x3};
        if (anyNaN(limbs)) {
            return NaN;
        }
        // Standard precision result for overflow; the leading limb carries the sign of zero
        final double z = x0 + x1 + x2 + x3;
        return create(Renormalization.renormalize(limbs, SIZE), Double.isFinite(z) ? x0 : z);
    }

    /**
     * Create a quad-double with the value of the {@code int}.
     *
     * @param x Value.
     * @return the quad-double
     */
    public static QuadDouble of(int x) {
        return new QuadDouble(x, 0.0, 0.0, 0.0);
    }

    /**
     * Create a quad-double with the exact value of the {@code long}.
     *
     * @param x Value.
     * @return the quad-double
     */
    public static QuadDouble of(long x) {
        return of(DoubleDouble.of(x));
    }

    /**
     * Create a quad-double with the exact value of the double-double.
     *
     * @param x Value.
     * @return the quad-double
     */
    public static QuadDouble of(DoubleDouble x) {
        if (x.isNaN()) {
            return NaN;
        }
        return new QuadDouble(x.hi(), x.lo(), 0.0, 0.0);
    }

    /**
     * Create a quad-double with the exact sum of two {@code double} values.
     *
     * @param a First value.
     * @param b Second value.
     * @return a + b
     */
    public static QuadDouble ofSum(double a, double b) {
        return of(DoubleDouble.ofSum(a, b));
    }

    /**
     * Create a quad-double with the exact difference of two {@code double} values.
     *
     * @param a First value.
     * @param b Second value.
     * @return a - b
     */
    public static QuadDouble ofDifference(double a, double b) {
        return of(DoubleDouble.ofDifference(a, b));
    }

    /**
     * Create a quad-double with the exact product of two {@code double} values.
     *
     * @param a First factor.
     * @param b Second factor.
     * @return a * b
     */
    public static QuadDouble ofProduct(double a, double b) {
        return of(DoubleDouble.ofProduct(a, b));
    }

    /**
     * Create a quad-double with the quotient of two {@code double} values
     * to quad-double precision.
     *
     * @param a Dividend.
     * @param b Divisor.
     * @return a / b
     */
    public static QuadDouble ofQuotient(double a, double b) {
        return of(a).divide(b);
    }

    /**
     * Parses a decimal string to a quad-double.
     *
     * @param s String.
     * @return the quad-double
     * @throws DecimalParseException if the string is empty or not a valid number
     * @see DoubleDouble#parse(String)
     */
    public static QuadDouble parse(String s) {
        final ParsedDecimal d = ParsedDecimal.parse(s);
        if (d.isNaN()) {
            return NaN;
        }
        if (d.isInfinite()) {
            return d.isNegative() ? NEGATIVE_INFINITY : POSITIVE_INFINITY;
        }
        final QuadDouble r = ofMagnitude(d);
        return d.isNegative() ? r.negate() : r;
    }

    /**
     * Create a quad-double with the magnitude of the finite parsed decimal.
     *
     * @param d Parsed decimal.
     * @return the absolute value of the decimal
     */
    static QuadDouble ofMagnitude(ParsedDecimal d) {
        QuadDouble r = ZERO;
        final String digits = d.getDigits();
        for (int i = 0; i < digits.length(); i++) {
            r = r.multiply(10).add(digits.charAt(i) - '0');
        }
        if (!r.isZero()) {
            r = r.scaleByPowerOfTen(d.getExponent());
        }
        return r;
    }

    /**
     * Create a quad-double from a special value (NaN, infinite or zero) or a value
     * that is exact in a single {@code double}.
     *
     * @param x Value.
     * @return the quad-double
     */
    private static QuadDouble special(double x) {
        return Double.isNaN(x) ? NaN : new QuadDouble(x, 0.0, 0.0, 0.0);
    }

    /**
     * Create a quad-double from renormalized limbs. If the limbs are not finite then the
     * result is the standard precision result {@code z} of the operation when it is
     * finite, otherwise the special value of the leading limb. A zero result is returned
     * with the sign of {@code z} if {@code z} is zero, otherwise as positive zero.
     *
     * @param r Renormalized limbs.
     * @param z Standard precision result of the operation.
     * @return the quad-double
     */
    private static QuadDouble create(double[] r, double z) {
        if (Double.isFinite(r[0]) && Double.isFinite(r[SIZE - 1])) {
            if (r[0] == 0) {
                return special(z == 0 ? z : 0.0);
            }
            return new QuadDouble(r);
        }
        // Overflow of the leading limb, or an invalid round-off
        if (Double.isFinite(z)) {
            return special(Double.isNaN(r[0]) ? z : r[0]);
        }
        return special(z);
    }

    /**
     * Checks if any of the limbs are NaN.
     *
     * @param x Limbs.
     * @return true if any limb is NaN
     */
    private static boolean anyNaN(double[] x) {
        for (final double v : x) {
            if (Double.isNaN(v)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Gets the limb at the specified index.
     *
     * @param index Index.
     * @return the limb
     * @throws IndexOutOfBoundsException if the index is not in {@code [0, 3]}
     */
    public double get(int index) {
        if (index < 0 || index >= SIZE) {
            throw new IndexOutOfBoundsException("Limb index out of range [0, 3]: " + index);
        }
        return x[index];
    }

    /**
     * Gets a copy of the limbs.
     *
     * @return the limbs
     */
    public double[] toArray() {
        return x.clone();
    }

    /**
     * Gets the value as a {@code double}. This is the leading limb which is the
     * closest {@code double} to the value.
     *
     * @return the value
     */
    public double doubleValue() {
        return x[0];
    }

    /**
     * Gets the value as a double-double. The value is truncated to the leading two limbs.
     *
     * @return the value
     */
    public DoubleDouble toDoubleDouble() {
        if (isNaN()) {
            return DoubleDouble.NaN;
        }
        return DoubleDouble.of(x[0], x[1]);
    }

    /**
     * Returns {@code true} if any limb is NaN.
     *
     * @return {@code true} if this is NaN
     */
    public boolean isNaN() {
        return anyNaN(x);
    }

    /**
     * Returns {@code true} if any limb is infinite and no limb is NaN.
     *
     * @return {@code true} if this is infinite
     */
    public boolean isInfinite() {
        for (final double v : x) {
            if (Double.isInfinite(v)) {
                return !isNaN();
            }
        }
        return false;
    }

    /**
     * Returns {@code true} if all limbs are finite.
     *
     * @return {@code true} if this is finite
     */
    public boolean isFinite() {
        for (final double v : x) {
            if (!Double.isFinite(v)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns {@code true} if the value is positive or negative zero.
     *
     * @return {@code true} if this is zero
     */
    public boolean isZero() {
        return x[0] == 0;
    }

    /**
     * Returns {@code true} if the sign bit of the leading limb is set.
     *
     * @return {@code true} if this has a negative sign
     */
    public boolean isSignNegative() {
        return Math.copySign(1.0, x[0]) < 0;
    }

    /**
     * Returns {@code true} if the sign bit of the leading limb is not set.
     *
     * @return {@code true} if this has a positive sign
     */
    public boolean isSignPositive() {
        return !isSignNegative();
    }

    /**
     * Returns the signum function of the value.
     *
     * @return the sign of the value
     * @see DoubleDouble#signum()
     */
    public QuadDouble signum() {
        if (isNaN()) {
            return NaN;
        }
        return isZero() ? this : of(Math.signum(x[0]));
    }

    /**
     * Returns a quad-double whose value is {@code (this + y)}.
     *
     * <p>The limbs of both operands are merged in order of decreasing magnitude into a
     * two-limb accumulator which emits limbs of the result when full.
     *
     * @param y Value to add.
     * @return {@code this + y}
     */
    public QuadDouble add(QuadDouble y) {
        return sum(x, y.x);
    }

    /**
     * Returns a quad-double whose value is {@code (this + y)}.
     *
     * @param y Value to add.
     * @return {@code this + y}
     */
    public QuadDouble add(double y) {
        return sum(x, new double[] {y, 0.0, 0.0, 0.0});
    }

    /**
     * Returns a quad-double whose value is {@code (this - y)}.
     *
     * @param y Value to subtract.
     * @return {@code this - y}
     */
    public QuadDouble subtract(QuadDouble y) {
        return sum(x, y.negate().x);
    }

    /**
     * Returns a quad-double whose value is {@code (this - y)}.
     *
     * @param y Value to subtract.
     * @return {@code this - y}
     */
    public QuadDouble subtract(double y) {
        return sum(x, new double[] {-y, 0.0, 0.0, 0.0});
    }

    /**
     * Compute the sum of the limbs {@code a} and {@code b}.
     *
     * @param a First value.
     * @param b Second value.
     * @return the sum
     */
    private static QuadDouble sum(double[] a, double[] b) {
        if (anyNaN(a) || anyNaN(b)) {
            return NaN;
        }
        final double z = a[0] + b[0];
        if (!Double.isFinite(z)) {
            return special(z);
        }

        final double[] r = new double[SIZE];
        int i = 0;
        int j = 0;
        final double u;
        final double v;
        if (Math.abs(a[i]) > Math.abs(b[j])) {
            u = a[i++];
        } else {
            u = b[j++];
        }
        if (Math.abs(a[i]) > Math.abs(b[j])) {
            v = a[i++];
        } else {
            v = b[j++];
        }
        final double s = u + v;
        final double[] acc = {s, DoublePrecision.fastTwoSumLow(u, v, s)};

        int k = 0;
        while (k < SIZE) {
            if (i >= SIZE && j >= SIZE) {
                r[k] = acc[0];
                if (k < SIZE - 1) {
                    r[++k] = acc[1];
                }
                break;
            }
            final double t;
            if (i >= SIZE) {
                t = b[j++];
            } else if (j >= SIZE || Math.abs(a[i]) > Math.abs(b[j])) {
                t = a[i++];
            } else {
                t = b[j++];
            }
            final double limb = Renormalization.accumulate(acc, t);
            if (limb != 0) {
                r[k++] = limb;
            }
        }

        // Remaining terms are below the precision of the result
        for (; i < SIZE; i++) {
            r[SIZE - 1] += a[i];
        }
        for (; j < SIZE; j++) {
            r[SIZE - 1] += b[j];
        }
        return create(Renormalization.renormalize(r, SIZE), z);
    }

    /**
     * Returns a quad-double whose value is {@code (this * y)}.
     *
     * <p>Partial products {@code x_i * y_j} are computed exactly for {@code i + j <= 1},
     * to standard precision with round-off for {@code i + j = 2}, and to standard
     * precision for {@code i + j = 3}. Remaining terms are omitted.
     *
     * @param y Factor.
     * @return {@code this * y}
     */
    public QuadDouble multiply(QuadDouble y) {
        if (isNaN() || y.isNaN()) {
            return NaN;
        }
        final double[] a = x;
        final double[] b = y.x;
        final double p0 = a[0] * b[0];
        if (p0 == 0 || !Double.isFinite(p0)) {
            return special(p0);
        }
        final double q0 = DoublePrecision.productLow(a[0], b[0], p0);
        final double p1 = a[0] * b[1];
        final double q1 = DoublePrecision.productLow(a[0], b[1], p1);
        final double p2 = a[1] * b[0];
        final double q2 = DoublePrecision.productLow(a[1], b[0], p2);
        final double p3 = a[0] * b[2];
        final double q3 = DoublePrecision.productLow(a[0], b[2], p3);
        final double p4 = a[1] * b[1];
        final double q4 = DoublePrecision.productLow(a[1], b[1], p4);
        final double p5 = a[2] * b[0];
        final double q5 = DoublePrecision.productLow(a[2], b[0], p5);

        // Terms: p1, p2, q0, q1, q2, p3, p4, p5
        final double[] t = {p1, p2, q0, q1, q2, p3, p4, p5};
        // O(eps) terms
        Renormalization.threeSum(t, 0, 1, 2);
        // O(eps^2) terms
        Renormalization.threeSum(t, 1, 3, 4);
        Renormalization.threeSum(t, 5, 6, 7);

        double s0 = t[1] + t[5];
        double t0 = DoublePrecision.twoSumLow(t[1], t[5], s0);
        double s1 = t[3] + t[6];
        final double t1 = DoublePrecision.twoSumLow(t[3], t[6], s1);
        double s2 = t[4] + t[7];
        final double u = s1 + t0;
        t0 = DoublePrecision.twoSumLow(s1, t0, u);
        s1 = u;
        s2 += t0 + t1;

        // O(eps^3) terms
        s1 += a[0] * b[3] + a[1] * b[2] + a[2] * b[1] + a[3] * b[0] + t[2] + q3 + q4 + q5;
        return create(Renormalization.renormalize(new double[] {p0, t[0], s0, s1, s2}, SIZE), p0);
    }

    /**
     * Returns a quad-double whose value is {@code (this * y)}.
     *
     * @param y Factor.
     * @return {@code this * y}
     */
    public QuadDouble multiply(double y) {
        if (isNaN()) {
            return NaN;
        }
        final double[] a = x;
        final double p0 = a[0] * y;
        if (p0 == 0 || !Double.isFinite(p0)) {
            return special(p0);
        }
        final double q0 = DoublePrecision.productLow(a[0], y, p0);
        final double p1 = a[1] * y;
        final double q1 = DoublePrecision.productLow(a[1], y, p1);
        final double p2 = a[2] * y;
        final double q2 = DoublePrecision.productLow(a[2], y, p2);
        final double p3 = a[3] * y;

        final double s1 = q0 + p1;
        final double[] t = {DoublePrecision.twoSumLow(q0, p1, s1), q1, p2};
        Renormalization.threeSum(t, 0, 1, 2);
        final double[] w = {t[1], q2, p3};
        Renormalization.threeSum2(w, 0, 1, 2);
        final double s4 = w[1] + t[2];
        return create(Renormalization.renormalize(new double[] {p0, s1, t[0], w[0], s4}, SIZE), p0);
    }

    /**
     * Returns a quad-double whose value is {@code (this / y)}.
     *
     * <p>Uses long division to compute five quotient terms.
     *
     * @param y Divisor.
     * @return {@code this / y}
     * @see DoubleDouble#divide(DoubleDouble)
     */
    public QuadDouble divide(QuadDouble y) {
        if (isNaN() || y.isNaN()) {
            return NaN;
        }
        final double b0 = y.x[0];
        final double q0 = x[0] / b0;
        if (q0 == 0 || !Double.isFinite(q0)) {
            return special(q0);
        }
        final double[] q = new double[SIZE + 1];
        q[0] = q0;
        QuadDouble r = subtract(y.multiply(q0));
        for (int i = 1; i < q.length; i++) {
            q[i] = r.x[0] / b0;
            if (i < SIZE) {
                r = r.subtract(y.multiply(q[i]));
            }
        }
        return create(Renormalization.renormalize(q, SIZE), q0);
    }

    /**
     * Returns a quad-double whose value is {@code (this / y)}.
     *
     * @param y Divisor.
     * @return {@code this / y}
     */
    public QuadDouble divide(double y) {
        return divide(of(y));
    }

    /**
     * Returns a quad-double whose value is {@code (1 / this)}.
     *
     * @return {@code 1 / this}
     */
    public QuadDouble reciprocal() {
        return ONE.divide(this);
    }

    /**
     * Returns a quad-double whose value is {@code (-this)}.
     *
     * @return {@code -this}
     */
    public QuadDouble negate() {
        return new QuadDouble(-x[0], negateLimb(x[1]), negateLimb(x[2]), negateLimb(x[3]));
    }

    /**
     * Negate a trailing limb. A zero limb remains positive zero.
     *
     * @param v Limb.
     * @return the negated limb
     */
    private static double negateLimb(double v) {
        return v == 0 ? 0.0 : -v;
    }

    /**
     * Returns the absolute value.
     *
     * @return {@code |this|}
     */
    public QuadDouble abs() {
        return isSignNegative() ? negate() : this;
    }

    /**
     * Returns a quad-double whose value is {@code (this * this)}.
     *
     * @return {@code this^2}
     */
    public QuadDouble square() {
        if (isNaN()) {
            return NaN;
        }
        final double a0 = x[0];
        final double a1 = x[1];
        final double a2 = x[2];
        final double a3 = x[3];
        final double h0 = a0 * a0;
        if (h0 == 0 || !Double.isFinite(h0)) {
            return special(h0);
        }
        final double l0 = DoublePrecision.squareLow(a0, h0);
        final double twoA0 = 2 * a0;
        final double h1 = twoA0 * a1;
        final double l1 = DoublePrecision.productLow(twoA0, a1, h1);
        final double h2 = twoA0 * a2;
        final double l2 = DoublePrecision.productLow(twoA0, a2, h2);
        final double h3 = a1 * a1;
        final double l3 = DoublePrecision.squareLow(a1, h3);
        final double h4 = twoA0 * a3;
        final double h5 = 2 * a1 * a2;

        // O(eps)
        final double r1 = h1 + l0;
        final double e1 = DoublePrecision.twoSumLow(h1, l0, r1);

        // O(eps^2)
        final double b0 = e1 + l1;
        final double b1 = DoublePrecision.twoSumLow(e1, l1, b0);
        final double c0 = h2 + h3;
        final double c1 = DoublePrecision.twoSumLow(h2, h3, c0);
        final double d0 = b0 + c0;
        final double d1 = DoublePrecision.twoSumLow(b0, c0, d0);
        final double f0 = b1 + c1;
        final double f1 = DoublePrecision.twoSumLow(b1, c1, f0);
        final double g0 = d1 + f0;
        final double g1 = DoublePrecision.twoSumLow(d1, f0, g0);
        final double g2 = f1 + g1;
        final double i0 = g0 + g2;
        final double i1 = DoublePrecision.fastTwoSumLow(g0, g2, i0);
        final double r2 = d0 + i0;
        final double j1 = DoublePrecision.fastTwoSumLow(d0, i0, r2);

        // O(eps^3)
        final double k0 = i1 + j1;
        final double k1 = DoublePrecision.fastTwoSumLow(i1, j1, k0);
        final double m0 = h4 + h5;
        final double m1 = DoublePrecision.twoSumLow(h4, h5, m0);
        final double n0 = l2 + l3;
        final double n1 = DoublePrecision.twoSumLow(l2, l3, n0);
        final double o0 = m0 + n0;
        final double o1 = DoublePrecision.twoSumLow(m0, n0, o0);
        final double r3 = k0 + o0;
        final double s1 = DoublePrecision.twoSumLow(k0, o0, r3);

        // O(eps^4)
        final double r4 = m1 + n1 + o1 + k1 + s1;
        return create(Renormalization.renormalize(new double[] {h0, r1, r2, r3, r4}, SIZE), h0);
    }

    /**
     * Returns a quad-double whose value is {@code this * 2^n}.
     *
     * @param n Power of 2.
     * @return {@code this * 2^n}
     */
    public QuadDouble scalb(int n) {
        return new QuadDouble(Math.scalb(x[0], n), Math.scalb(x[1], n),
                              Math.scalb(x[2], n), Math.scalb(x[3], n));
    }

    /**
     * Returns the largest value that is less than or equal to this and is an integer.
     *
     * @return the floor
     */
    public QuadDouble floor() {
        if (!isFinite()) {
            return isNaN() ? NaN : this;
        }
        final double[] r = new double[SIZE];
        for (int i = 0; i < SIZE; i++) {
            r[i] = Math.floor(x[i]);
            if (r[i] != x[i]) {
                break;
            }
        }
        return create(Renormalization.renormalize(r, SIZE), r[0]);
    }

    /**
     * Returns the smallest value that is greater than or equal to this and is an integer.
     *
     * @return the ceiling
     */
    public QuadDouble ceil() {
        if (!isFinite()) {
            return isNaN() ? NaN : this;
        }
        final double[] r = new double[SIZE];
        for (int i = 0; i < SIZE; i++) {
            r[i] = Math.ceil(x[i]);
            if (r[i] != x[i]) {
                break;
            }
        }
        return create(Renormalization.renormalize(r, SIZE), r[0]);
    }

    /**
     * Returns the square root.
     *
     * <p>Two Newton iterations of {@code x' = x + (1/2 - (a/2) x^2) x} refine the
     * reciprocal square root from a {@code double} estimate; a final Karp-Markstein
     * step computes {@code sqrt(a) = a x + (a - (a x)^2) x / 2}.
     *
     * @return {@code sqrt(this)}
     * @see DoubleDouble#sqrt()
     */
    public QuadDouble sqrt() {
        if (isZero()) {
            return this;
        }
        if (isNaN() || x[0] < 0) {
            return NaN;
        }
        if (isInfinite()) {
            return this;
        }
        final int k = Math.getExponent(x[0]);
        if (Math.abs(k) > SQRT_SCALE_EXPONENT) {
            final int e = k & ~1;
            return scalb(-e).sqrt().scalb(e / 2);
        }
        QuadDouble r = ONE.divide(Math.sqrt(x[0]));
        final QuadDouble h = scalb(-1);
        for (int i = 0; i < SQRT_ITERATIONS; i++) {
            r = r.add(of(0.5).subtract(h.multiply(r.square())).multiply(r));
        }
        final QuadDouble ax = multiply(r);
        return ax.add(subtract(ax.square()).multiply(r.scalb(-1)));
    }

    /**
     * Returns the cube root.
     *
     * @return {@code cbrt(this)}
     * @see #nroot(int)
     */
    public QuadDouble cbrt() {
        return nroot(3);
    }

    /**
     * Returns the n-th root.
     *
     * <p>Returns NaN if {@code n <= 0}, or if {@code n} is even and this is negative.
     *
     * @param n Degree of the root.
     * @return {@code this^(1/n)}
     * @see DoubleDouble#nroot(int)
     */
    public QuadDouble nroot(int n) {
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
        final int k = Math.getExponent(x[0]);
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
        final QuadDouble r = abs();
        QuadDouble z = of(Math.exp(-Math.log(r.x[0]) / n));
        for (int i = 0; i < ROOT_ITERATIONS; i++) {
            z = z.add(z.multiply(ONE.subtract(r.multiply(z.pow(n)))).divide(n));
        }
        if (isSignNegative()) {
            z = z.negate();
        }
        return z.reciprocal();
    }

    /**
     * Returns this raised to the integer power {@code n} using binary exponentiation.
     *
     * @param n Power.
     * @return {@code this^n}
     * @see DoubleDouble#pow(int)
     */
    public QuadDouble pow(int n) {
        if (n == 0) {
            return ONE;
        }
        long k = Math.abs((long) n);
        QuadDouble s;
        if (k == 1) {
            s = this;
        } else {
            QuadDouble r = this;
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
     * @param y Power.
     * @return {@code this^y}
     * @see DoubleDouble#pow(DoubleDouble)
     */
    public QuadDouble pow(QuadDouble y) {
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
     * <p>Arguments at or below -600 return zero; above 708 return positive infinity.
     *
     * @return {@code e^this}
     * @see DoubleDouble#exp()
     */
    public QuadDouble exp() {
        if (isNaN()) {
            return NaN;
        }
        final double a0 = x[0];
        if (a0 <= EXP_LOWER_LIMIT) {
            return ZERO;
        }
        if (a0 > EXP_UPPER_LIMIT) {
            return POSITIVE_INFINITY;
        }
        if (isZero()) {
            return ONE;
        }
        if (isOne()) {
            return E;
        }

        final double m = Math.floor(a0 / LN_2.x[0] + 0.5);
        final QuadDouble r = subtract(LN_2.multiply(m)).scalb(-EXP_REDUCTION_BITS);

        QuadDouble p = r.square();
        QuadDouble s = r.add(p.scalb(-1));
        p = p.multiply(r);
        QuadDouble t = p.multiply(INV_FACTORIALS[0]);
        int i = 0;
        do {
            s = s.add(t);
            p = p.multiply(r);
            t = p.multiply(INV_FACTORIALS[++i]);
        } while (Math.abs(t.x[0]) > EXP_TOLERANCE && i < EXP_MAX_TERM);
        s = s.add(t);

        for (int j = 0; j < EXP_REDUCTION_BITS; j++) {
            s = s.scalb(1).add(s.square());
        }
        return s.add(1.0).scalb((int) m);
    }

    /**
     * Returns the natural logarithm.
     *
     * @return {@code log(this)}
     * @throws IllegalStateException if the iteration does not converge
     * @see DoubleDouble#log()
     */
    public QuadDouble log() {
        if (isNaN()) {
            return NaN;
        }
        if (isZero()) {
            return NEGATIVE_INFINITY;
        }
        if (x[0] < 0) {
            return NaN;
        }
        if (isInfinite()) {
            return this;
        }
        if (isOne()) {
            return ZERO;
        }
        final int k = Math.getExponent(x[0]);
        if (Math.abs(k) > LOG_SCALE_EXPONENT) {
            return scalb(-k).log().add(LN_2.multiply(k));
        }

        QuadDouble z = of(Math.log(x[0]));
        final double tolerance = Math.scalb(EPSILON.x[0], Math.max(Math.getExponent(z.x[0]), 0) + 2);
        for (int i = 0; i < LOG_MAX_ITERATIONS; i++) {
            final QuadDouble r = z.add(multiply(z.negate().exp())).subtract(1.0);
            if (Math.abs(z.subtract(r).x[0]) < tolerance) {
                return r;
            }
            z = r;
        }
        throw new IllegalStateException("Logarithm did not converge: " + this);
    }

    /**
     * Returns the base 10 logarithm.
     *
     * @return {@code log10(this)}
     */
    public QuadDouble log10() {
        return log().divide(LN_10);
    }

    /**
     * Returns the base 2 logarithm.
     *
     * @return {@code log2(this)}
     */
    public QuadDouble log2() {
        return log().divide(LN_2);
    }

    /**
     * Returns the logarithm in the specified base.
     *
     * @param base Base.
     * @return {@code log(this) / log(base)}
     */
    public QuadDouble log(double base) {
        return log().divide(of(base).log());
    }

    /**
     * Returns the trigonometric sine.
     *
     * @return {@code sin(this)}
     */
    public QuadDouble sin() {
        return sinCos()[0];
    }

    /**
     * Returns the trigonometric cosine.
     *
     * @return {@code cos(this)}
     */
    public QuadDouble cos() {
        return sinCos()[1];
    }

    /**
     * Returns the trigonometric tangent.
     *
     * @return {@code tan(this)}
     */
    public QuadDouble tan() {
        final QuadDouble[] sc = sinCos();
        return sc[0].divide(sc[1]);
    }

    /**
     * Returns the arc tangent in the range {@code [-pi/2, pi/2]}.
     *
     * @return {@code atan(this)}
     */
    public QuadDouble atan() {
        return atan2(ONE);
    }

    /**
     * Returns the angle theta from the conversion of rectangular coordinates {@code (x, y)}
     * to polar coordinates {@code (r, theta)}, where this value is {@code y}.
     *
     * @param b Abscissa {@code x}.
     * @return {@code atan2(this, x)}
     * @see DoubleDouble#atan2(DoubleDouble)
     */
    public QuadDouble atan2(QuadDouble b) {
        if (isNaN() || b.isNaN()) {
            return NaN;
        }
        final boolean negative = isSignNegative();
        if (b.isZero()) {
            if (isZero()) {
                return NaN;
            }
            return negative ? HALF_PI.negate() : HALF_PI;
        }
        if (isZero()) {
            return b.isSignPositive() ? ZERO : PI;
        }
        if (isInfinite()) {
            if (b.isInfinite()) {
                return NaN;
            }
            return negative ? HALF_PI.negate() : HALF_PI;
        }
        if (b.isInfinite()) {
            if (b.isSignPositive()) {
                return negative ? NEGATIVE_ZERO : ZERO;
            }
            return negative ? PI.negate() : PI;
        }
        if (compareTo(b) == 0) {
            return negative ? THREE_QUARTER_PI.negate() : QUARTER_PI;
        }
        if (compareTo(b.negate()) == 0) {
            return negative ? QUARTER_PI.negate() : THREE_QUARTER_PI;
        }

        final int scale = Math.max(Math.getExponent(x[0]), Math.getExponent(b.x[0]));
        final QuadDouble ys = scalb(-scale);
        final QuadDouble xs = b.scalb(-scale);
        final QuadDouble r = ys.square().add(xs.square()).sqrt();
        final QuadDouble xr = xs.divide(r);
        final QuadDouble yr = ys.divide(r);

        QuadDouble z = of(Math.atan2(x[0], b.x[0]));
        final boolean useSine = Math.abs(xr.x[0]) > Math.abs(yr.x[0]);
        for (int i = 0; i < ATAN2_ITERATIONS; i++) {
            final QuadDouble[] sc = z.sinCos();
            z = useSine ?
                z.add(yr.subtract(sc[0]).divide(sc[1])) :
                z.subtract(xr.subtract(sc[1]).divide(sc[0]));
        }
        return z;
    }

    /**
     * Compute the sine and cosine.
     *
     * @return {@code [sin(this), cos(this)]}
     * @see DoubleDouble#sin()
     */
    private QuadDouble[] sinCos() {
        if (!isFinite()) {
            return new QuadDouble[] {NaN, NaN};
        }
        if (isZero()) {
            return new QuadDouble[] {this, ONE};
        }

        final double z = Math.floor(divide(TWO_PI).x[0] + 0.5);
        final QuadDouble r = subtract(TWO_PI.multiply(z));

        double q = Math.floor(r.x[0] / HALF_PI.x[0] + 0.5);
        QuadDouble t = r.subtract(HALF_PI.multiply(q));
        final int j = (int) q;
        q = Math.floor(t.x[0] / SIXTEENTH_PI.x[0] + 0.5);
        t = t.subtract(SIXTEENTH_PI.multiply(q));
        final int k = (int) q;

        QuadDouble s;
        QuadDouble c;
        if (t.isZero()) {
            s = ZERO;
            c = ONE;
        } else {
            s = sinTaylor(t);
            c = ONE.subtract(s.square()).sqrt();
        }
        if (k != 0) {
            final int absK = Math.abs(k);
            final QuadDouble u = COSINES[absK - 1];
            final QuadDouble v = SINES[absK - 1];
            final QuadDouble sinT = s;
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
            return new QuadDouble[] {s, c};
        case 1:
            return new QuadDouble[] {c, s.negate()};
        case -1:
            return new QuadDouble[] {c.negate(), s};
        default:
            return new QuadDouble[] {s.negate(), c.negate()};
        }
    }

    /**
     * Compute the sine of a small argument using the Taylor series.
     *
     * @param a Argument ({@code |a| <= pi/32}).
     * @return {@code sin(a)}
     */
    private static QuadDouble sinTaylor(QuadDouble a) {
        final double threshold = 0.5 * Math.abs(a.x[0]) * EPSILON.x[0];
        final QuadDouble y = a.square().negate();
        QuadDouble s = a;
        QuadDouble r = a;
        QuadDouble t;
        int i = 0;
        do {
            r = r.multiply(y);
            t = r.multiply(INV_FACTORIALS[i]);
            s = s.add(t);
            i += 2;
        } while (i < INV_FACTORIALS.length && Math.abs(t.x[0]) > threshold);
        return s;
    }

    /**
     * Returns {@code this * 10^n}. Large negative powers are applied in stages.
     *
     * @param n Power of 10.
     * @return the scaled value
     */
    private QuadDouble scaleByPowerOfTen(int n) {
        if (n >= 0) {
            return multiply(TEN.pow(n));
        }
        QuadDouble r = this;
        int e = n;
        while (e < -ParsedDecimal.MAX_POWER) {
            r = r.divide(TEN.pow(ParsedDecimal.MAX_POWER));
            e += ParsedDecimal.MAX_POWER;
        }
        return r.divide(TEN.pow(-e));
    }

    /**
     * Returns the leading significant decimal digits of the absolute value.
     *
     * @param count Number of significant digits.
     * @return the digits
     * @throws IllegalArgumentException if the count is not strictly positive or the value
     * is not finite
     * @see DoubleDouble#toDigits(int)
     */
    public DecimalDigits toDigits(int count) {
        DecimalDigits.checkCount(count);
        if (!isFinite()) {
            throw new IllegalArgumentException("Non-finite value: " + x[0]);
        }
        if (isZero()) {
            return DecimalDigits.zero(count);
        }
        QuadDouble r = abs();
        int e = (int) Math.floor(Math.log10(r.x[0]));
        if (e < -ParsedDecimal.MAX_POWER) {
            r = r.multiply(TEN.pow(ParsedDecimal.MAX_POWER)).multiply(TEN.pow(-e - ParsedDecimal.MAX_POWER));
        } else if (e > ParsedDecimal.MAX_POWER) {
            r = r.scalb(-53).divide(TEN.pow(e)).scalb(53);
        } else if (e < 0) {
            r = r.multiply(TEN.pow(-e));
        } else {
            r = r.divide(TEN.pow(e));
        }
        if (r.compareTo(TEN) >= 0) {
            r = r.divide(10);
            e++;
        } else if (r.compareTo(ONE) < 0) {
            r = r.multiply(10);
            e--;
        }

        final int[] raw = new int[count + 1];
        for (int i = 0; i < raw.length; i++) {
            final int d = (int) r.x[0];
            r = r.subtract(d).multiply(10);
            raw[i] = d;
        }
        return DecimalDigits.of(raw, e);
    }

    /**
     * Returns the smaller of this and {@code y} using the ordering of
     * {@link #compareTo(QuadDouble)}. If either value is NaN the result is NaN.
     *
     * @param y Value.
     * @return the minimum
     */
    public QuadDouble min(QuadDouble y) {
        if (isNaN() || y.isNaN()) {
            return NaN;
        }
        return compareTo(y) <= 0 ? this : y;
    }

    /**
     * Returns the larger of this and {@code y} using the ordering of
     * {@link #compareTo(QuadDouble)}. If either value is NaN the result is NaN.
     *
     * @param y Value.
     * @return the maximum
     */
    public QuadDouble max(QuadDouble y) {
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
        return x[0] == 1 && x[1] == 0;
    }

    /**
     * Compares this quad-double with the specified quad-double. The limbs are compared
     * in order using {@link Double#compare(double, double)}.
     *
     * @param o Quad-double to be compared.
     * @return a negative integer, zero, or a positive integer as this is less than, equal
     * to, or greater than the argument
     */
    @Override
    public int compareTo(QuadDouble o) {
        for (int i = 0; i < SIZE; i++) {
            final int c = Double.compare(x[i], o.x[i]);
            if (c != 0) {
                return c;
            }
        }
        return 0;
    }

    /**
     * Test for equality with another object. Two quad-doubles are equal if all limbs
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
        if (other instanceof QuadDouble) {
            return Arrays.equals(x, ((QuadDouble) other).x);
        }
        return false;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(x);
    }

    /**
     * Returns a string representation in fixed-point notation with 62 significant digits.
     *
     * @return the string
     * @see DoubleDouble#toString()
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
     * Returns a string representation in scientific notation with 62 significant digits.
     * Trailing zeros in the fraction are removed.
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
     * of digits after the decimal point.
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
