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
package org.apache.commons.multiprecision.examples.jmh;

import java.math.BigDecimal;

/**
 * Computes the round-off error of the product of two {@code double} values using
 * different methods. The round-off {@code e} satisfies {@code a * b = p + e} exactly
 * where {@code p} is the floating-point product.
 *
 * <p>Dekker's method splits each factor into two 26-bit parts so the partial products
 * are exact. Alternatively a fused multiply-add computes the round-off in a single
 * operation.
 *
 * <p>Reference: Dekker, T.J. (1971)
 * <a href="https://doi.org/10.1007/BF01397083">
 * A floating-point technique for extending the available precision</a>
 * Numerische Mathematik, 18:224-242.
 */
final class TwoProduct {
    /**
     * The multiplier used to split the double value into high and low parts. From
     * Dekker (1971): "The constant should be chosen equal to 2^(p - p/2) + 1,
     * where p is the number of binary digits in the mantissa". Here p is 53
     * and the multiplier is {@code 2^27 + 1}.
     */
    private static final double MULTIPLIER = 1.0 + 0x1.0p27;
    /** The upper limit above which a number may overflow during the split into a high part. */
    private static final double SAFE_UPPER = 0x1.0p996;
    /** The scale to use when down-scaling during a split into a high part. */
    private static final double DOWN_SCALE = 0x1.0p-30;
    /** The scale to use when re-scaling during a split into a high part. */
    private static final double UP_SCALE = 0x1.0p30;
    /** The mask to zero the lower 27-bits of a long . */
    private static final long ZERO_LOWER_27_BITS = 0xffff_ffff_f800_0000L;

    /** Private constructor. */
    private TwoProduct() {
        // intentionally empty.
    }

    /**
     * Compute the high part of the value using Dekker's split with scaling of large
     * magnitudes to avoid overflow.
     *
     * @param value Value.
     * @return the high part of the value.
     */
    static double highPart(double value) {
        if (value >= SAFE_UPPER || value <= -SAFE_UPPER) {
            final double x = value * DOWN_SCALE;
            final double c = MULTIPLIER * x;
            final double hi = (c - (c - x)) * UP_SCALE;
            if (Double.isInfinite(hi)) {
                // Close to Double.MAX_VALUE: use the raw upper bits of the mantissa
                return Double.longBitsToDouble(Double.doubleToRawLongBits(value) & ZERO_LOWER_27_BITS);
            }
            return hi;
        }
        final double c = MULTIPLIER * value;
        return c - (c - value);
    }

    /**
     * Compute the high part of the value using Dekker's split without overflow protection.
     *
     * @param value Value.
     * @return the high part of the value.
     */
    static double highPartUnscaled(double value) {
        final double c = MULTIPLIER * value;
        return c - (c - value);
    }

    /**
     * Compute the round-off of the product using Dekker's split with overflow protection.
     *
     * @param a First factor.
     * @param b Second factor.
     * @param p Product of the factors.
     * @return the round-off of the product
     */
    static double productLow(double a, double b, double p) {
        final double hx = highPart(a);
        final double lx = a - hx;
        final double hy = highPart(b);
        final double ly = b - hy;
        return lx * ly - (((p - hx * hy) - lx * hy) - hx * ly);
    }

    /**
     * Compute the round-off of the product using Dekker's split without overflow protection.
     * The result is invalid if either factor is above {@code 2^996} in magnitude.
     *
     * @param a First factor.
     * @param b Second factor.
     * @param p Product of the factors.
     * @return the round-off of the product
     */
    static double productLowUnscaled(double a, double b, double p) {
        final double hx = highPartUnscaled(a);
        final double lx = a - hx;
        final double hy = highPartUnscaled(b);
        final double ly = b - hy;
        return lx * ly - (((p - hx * hy) - lx * hy) - hx * ly);
    }

    /**
     * Compute the round-off of the product using a fused multiply-add.
     *
     * @param a First factor.
     * @param b Second factor.
     * @param p Product of the factors.
     * @return the round-off of the product
     */
    static double productLowFma(double a, double b, double p) {
        return Math.fma(a, b, -p);
    }

    /**
     * Compute the round-off of the product using exact {@link BigDecimal} arithmetic.
     *
     * @param a First factor.
     * @param b Second factor.
     * @param p Product of the factors.
     * @return the round-off of the product
     */
    static double productLowBigDecimal(double a, double b, double p) {
        return new BigDecimal(a).multiply(new BigDecimal(b)).subtract(new BigDecimal(p)).doubleValue();
    }
}
