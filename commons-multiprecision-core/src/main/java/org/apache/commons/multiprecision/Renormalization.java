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
 * Restores a sequence of {@code double} limbs to the canonical form of a multi-limb number:
 * a fixed number of non-overlapping limbs ordered by decreasing magnitude.
 *
 * <p>Also contains the accumulation helpers used to sum the partial terms of
 * quad-double arithmetic. These operate on an array of terms in-place.
 *
 * @see <a href="https://www.davidhbailey.com/dhbpapers/qd.pdf">
 * Hida, Li and Bailey (2000) Quad-Double Arithmetic: Algorithms, Implementation, and Application</a>
 */
final class Renormalization {
    /** Error message when the output size is invalid. */
    private static final String INVALID_SIZE = "Invalid number of limbs: %d";

    /** Private constructor. */
    private Renormalization() {
        // intentionally empty.
    }

    /**
     * Renormalize the limbs to the specified number of non-overlapping limbs.
     *
     * <p>The limbs are typically ordered by decreasing magnitude, as produced by the
     * partial sums of an extended precision operation, but any order is allowed. The input
     * is compressed from the last limb upwards using an exact two-sum, then a second pass
     * from the largest limb emits a new limb whenever the running sum has a non-zero
     * round-off. Once {@code size - 1} limbs have been emitted all remaining limbs are
     * added to the final limb; any precision beyond the final limb is lost.
     *
     * <p>If the leading limb is infinite the limbs are returned unchanged (truncated or
     * padded with zeros to the required size).
     *
     * @param limbs Limbs.
     * @param size Number of limbs in the result.
     * @return the renormalized limbs
     * @throws IllegalArgumentException if the size is not strictly positive or the
     * limbs are empty
     */
    static double[] renormalize(double[] limbs, int size) {
        if (size < 1) {
            throw new IllegalArgumentException(String.format(INVALID_SIZE, size));
        }
        final int n = limbs.length;
        if (n == 0) {
            throw new IllegalArgumentException(String.format(INVALID_SIZE, n));
        }
        final double[] result = new double[size];
        if (Double.isInfinite(limbs[0])) {
            System.arraycopy(limbs, 0, result, 0, Math.min(n, size));
            return result;
        }

        // Compress: carry from the smallest limb to the largest.
        final double[] t = new double[n];
        double s = limbs[n - 1];
        for (int i = n - 2; i >= 0; i--) {
            final double a = limbs[i];
            final double sum = a + s;
            t[i + 1] = DoublePrecision.twoSumLow(a, s, sum);
            s = sum;
        }
        t[0] = s;

        // Emit limbs with non-zero round-off
        int k = 0;
        s = t[0];
        for (int i = 1; i < n; i++) {
            if (k == size - 1) {
                // No more room: fold the tail into the last limb
                s += t[i];
            } else {
                final double sum = s + t[i];
                final double e = DoublePrecision.twoSumLow(s, t[i], sum);
                if (e != 0) {
                    result[k++] = sum;
                    s = e;
                } else {
                    s = sum;
                }
            }
        }
        result[k] = s;
        return result;
    }

    /**
     * Accumulate a term into a two-limb accumulator {@code (u, v)} held in
     * {@code acc[0]} and {@code acc[1]}. If the accumulator overflows its two limbs the
     * largest part is returned as a finished limb and the accumulator holds the
     * remainder; otherwise the accumulator is updated in-place and zero is returned.
     *
     * @param acc Accumulator (updated in-place).
     * @param term Term to add.
     * @return the finished limb, or zero
     */
    static double accumulate(double[] acc, double term) {
        final double u = acc[0];
        final double v = acc[1];
        final double s = v + term;
        final double vv = DoublePrecision.twoSumLow(v, term, s);
        final double sum = u + s;
        final double uu = DoublePrecision.twoSumLow(u, s, sum);

        if (uu != 0 && vv != 0) {
            acc[0] = uu;
            acc[1] = vv;
            return sum;
        }
        acc[0] = sum;
        acc[1] = vv == 0 ? uu : vv;
        return 0;
    }

    /**
     * Sum the three terms {@code (x[a], x[b], x[c])} in-place to a three limb
     * result {@code (x[a], x[b], x[c])} with no loss of precision.
     *
     * @param x Terms.
     * @param a Index of the first term.
     * @param b Index of the second term.
     * @param c Index of the third term.
     */
    static void threeSum(double[] x, int a, int b, int c) {
        final double t1 = x[a] + x[b];
        final double t2 = DoublePrecision.twoSumLow(x[a], x[b], t1);
        final double s = x[c] + t1;
        final double t3 = DoublePrecision.twoSumLow(x[c], t1, s);
        final double u = t2 + t3;
        x[a] = s;
        x[b] = u;
        x[c] = DoublePrecision.twoSumLow(t2, t3, u);
    }

    /**
     * Sum the three terms {@code (x[a], x[b], x[c])} in-place to a two limb
     * result {@code (x[a], x[b])}. The third term is left unchanged.
     *
     * @param x Terms.
     * @param a Index of the first term.
     * @param b Index of the second term.
     * @param c Index of the third term.
     */
    static void threeSum2(double[] x, int a, int b, int c) {
        final double t1 = x[a] + x[b];
        final double t2 = DoublePrecision.twoSumLow(x[a], x[b], t1);
        final double s = x[c] + t1;
        final double t3 = DoublePrecision.twoSumLow(x[c], t1, s);
        x[a] = s;
        x[b] = t2 + t3;
    }
}
