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
 * Error-free transformations of the sum and product of two {@code double} values.
 *
 * <p>The caller computes the rounded result {@code z} and passes it to a method that
 * returns the exact round-off {@code zz}, so that {@code z + zz} is the exact result:
 * <pre>
 * double z = x * y;
 * double zz = DoublePrecision.productLow(x, y, z);
 * </pre>
 *
 * <p>The round-off is exact when no intermediate result overflows. Callers check
 * {@code z} for overflow before computing the round-off.
 *
 * @see <a href="https://doi.org/10.1007/BF01397083">
 * Dekker (1971) A floating-point technique for extending the available precision</a>
 * @see <a href="http://www-2.cs.cmu.edu/afs/cs/project/quake/public/papers/robust-arithmetic.ps">
 * Shewchuk (1997) Arbitrary Precision Floating-Point Arithmetic</a>
 */
final class DoublePrecision {
    // Do not simplify the arithmetic: the expressions depend on IEEE754 rounding.

    /** The split multiplier {@code 2^27 + 1} for a 53-bit mantissa. */
    private static final double MULTIPLIER = 1.34217729E8;
    /** Magnitude at or above which the split multiplication may overflow: 2^(1023 - 27). */
    private static final double SAFE_UPPER = 0x1.0p996;
    /** Exact down-scaling applied before splitting a large value. */
    private static final double DOWN_SCALE = 0x1.0p-30;
    /** Inverse of {@link #DOWN_SCALE}. */
    private static final double UP_SCALE = 0x1.0p30;
    /** Mask to clear the lower 27 bits of the mantissa. */
    private static final long ZERO_LOWER_27_BITS = 0xffff_ffff_f800_0000L;

    /** Private constructor. */
    private DoublePrecision() {
        // intentionally empty.
    }

    /**
     * Split a value into a 26-bit high part using Dekker's method. The low part
     * {@code value - hi} is exact and does not overlap the high part.
     * <pre>
     * c = (2^27 + 1) * value
     * hi = c - (c - value)
     * </pre>
     *
     * <p>Values of magnitude {@code 2^996} or above are scaled down for the split. A NaN
     * or infinite value returns NaN.
     *
     * @param value Value.
     * @return the high part of the value
     */
    static double highPart(double value) {
        if (Math.abs(value) >= SAFE_UPPER) {
            final double x = value * DOWN_SCALE;
            final double c = MULTIPLIER * x;
            final double hi = (c - (c - x)) * UP_SCALE;
            if (Double.isInfinite(hi)) {
                // The split rounded up past MAX_VALUE: use the upper 26 bits of the mantissa
                return Double.longBitsToDouble(Double.doubleToRawLongBits(value) & ZERO_LOWER_27_BITS);
            }
            return hi;
        }
        final double c = MULTIPLIER * value;
        return c - (c - value);
    }

    /**
     * Compute the round-off of the product {@code x * y} using Dekker's mult12
     * algorithm on the split factors.
     *
     * <p>The high parts of the split may be larger in magnitude than the factors, so a
     * product {@code xy} close to overflow can give a non-finite round-off.
     *
     * @param x First factor.
     * @param y Second factor.
     * @param xy Product of the factors (x * y).
     * @return <code>lx * ly - (((xy - hx * hy) - lx * hy) - hx * ly)</code>
     */
    static double productLow(double x, double y, double xy) {
        final double hx = highPart(x);
        final double lx = x - hx;
        final double hy = highPart(y);
        final double ly = y - hy;
        return lx * ly - (((xy - hx * hy) - lx * hy) - hx * ly);
    }

    /**
     * Compute the round-off of the square {@code x * x}. The value is split once and the
     * two cross terms are combined.
     *
     * @param x Value.
     * @param x2 Square of the value (x * x).
     * @return <code>lx * lx - ((x2 - hx * hx) - 2 * lx * hx)</code>
     */
    static double squareLow(double x, double x2) {
        final double hx = highPart(x);
        final double lx = x - hx;
        return lx * lx - ((x2 - hx * hx) - 2 * lx * hx);
    }

    /**
     * Compute the round-off of the sum {@code a + b} when {@code |a| >= |b|}. Unordered
     * values give a finite value that is not the round-off.
     *
     * @param a First part of sum.
     * @param b Second part of sum.
     * @param sum Sum of the parts (a + b).
     * @return <code>b - (sum - a)</code>
     */
    static double fastTwoSumLow(double a, double b, double sum) {
        return b - (sum - a);
    }

    /**
     * Compute the round-off of the sum {@code a + b} for values in any order using
     * Knuth's two-sum.
     *
     * @param a First part of sum.
     * @param b Second part of sum.
     * @param sum Sum of the parts (a + b).
     * @return <code>(a - (sum - (sum - a))) + (b - (sum - a))</code>
     */
    static double twoSumLow(double a, double b, double sum) {
        final double bVirtual = sum - a;
        return (a - (sum - bVirtual)) + (b - bVirtual);
    }
}
