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

import java.util.concurrent.TimeUnit;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.openjdk.jmh.annotations.Benchmark;
import org.openjdk.jmh.annotations.BenchmarkMode;
import org.openjdk.jmh.annotations.Fork;
import org.openjdk.jmh.annotations.Measurement;
import org.openjdk.jmh.annotations.Mode;
import org.openjdk.jmh.annotations.OutputTimeUnit;
import org.openjdk.jmh.annotations.Param;
import org.openjdk.jmh.annotations.Scope;
import org.openjdk.jmh.annotations.Setup;
import org.openjdk.jmh.annotations.State;
import org.openjdk.jmh.annotations.Warmup;
import org.openjdk.jmh.infra.Blackhole;

/**
 * Executes a benchmark to measure the speed of computing the exact product of two
 * {@code double} values using the methods in {@link TwoProduct}.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-server", "-Xms512M", "-Xmx512M"})
public class ProductPerformance {
    /**
     * Define the round-off function of a product.
     */
    interface ProductLowFunction {
        /**
         * Compute the round-off of the product.
         *
         * @param a First factor.
         * @param b Second factor.
         * @param p Product of the factors.
         * @return the round-off
         */
        double apply(double a, double b, double p);
    }

    /**
     * The factors to multiply.
     */
    @State(Scope.Benchmark)
    public static class Factors {
        /** The mask for the sign bit and the mantissa. */
        private static final long SIGN_MATISSA_MASK = 0x800f_ffff_ffff_ffffL;
        /** The exponent for small numbers. */
        private static final long EXP_SMALL = Double.doubleToRawLongBits(1.0);
        /** The exponent for big numbers. */
        private static final long EXP_BIG = Double.doubleToRawLongBits(0x1.0p996);

        /**
         * The number of factors.
         */
        @Param({"10000"})
        private int size;

        /**
         * The fraction of small factors. Big factors require scaling to avoid overflow
         * in the split.
         */
        @Param({"1", "0.99", "0.9"})
        private double small;

        /** Factors a. */
        private double[] a;
        /** Factors b. */
        private double[] b;

        /**
         * Gets the a factors.
         *
         * @return Factors.
         */
        public double[] getA() {
            return a;
        }

        /**
         * Gets the b factors.
         *
         * @return Factors.
         */
        public double[] getB() {
            return b;
        }

        /**
         * Create the factors.
         */
        @Setup
        public void setup() {
            final UniformRandomProvider rng = RandomSource.create(RandomSource.XO_RO_SHI_RO_1024_PP);
            a = createFactors(rng);
            b = createFactors(rng);
        }

        /**
         * Create the factors. Each is small or big with the configured probability.
         *
         * @param rng Random number generator.
         * @return the factors
         */
        private double[] createFactors(UniformRandomProvider rng) {
            final double[] x = new double[size];
            for (int i = 0; i < size; i++) {
                long bits = rng.nextLong() & SIGN_MATISSA_MASK;
                if (rng.nextDouble() < small) {
                    bits |= EXP_SMALL;
                } else {
                    bits |= EXP_BIG;
                }
                x[i] = Double.longBitsToDouble(bits);
            }
            return x;
        }
    }

    /**
     * Compute the round-off of the product of each pair of factors.
     *
     * @param factors Factors.
     * @param bh Data sink.
     * @param fun Round-off function.
     */
    private static void apply(Factors factors, Blackhole bh, ProductLowFunction fun) {
        final double[] a = factors.getA();
        final double[] b = factors.getB();
        for (int i = 0; i < a.length; i++) {
            final double x = a[i];
            final double y = b[i];
            bh.consume(fun.apply(x, y, x * y));
        }
    }

    // Benchmark methods.
    //
    // The methods are partially documented as the names are self-documenting.
    // CHECKSTYLE: stop JavadocMethod
    // CHECKSTYLE: stop DesignForExtension

    /**
     * Baseline returning the product.
     *
     * @param factors Factors.
     * @param bh Data sink.
     */
    @Benchmark
    public void baseline(Factors factors, Blackhole bh) {
        apply(factors, bh, (a, b, p) -> p);
    }

    @Benchmark
    public void dekker(Factors factors, Blackhole bh) {
        apply(factors, bh, TwoProduct::productLow);
    }

    @Benchmark
    public void dekkerUnscaled(Factors factors, Blackhole bh) {
        apply(factors, bh, TwoProduct::productLowUnscaled);
    }

    @Benchmark
    public void fma(Factors factors, Blackhole bh) {
        apply(factors, bh, TwoProduct::productLowFma);
    }

    @Benchmark
    public void bigDecimal(Factors factors, Blackhole bh) {
        apply(factors, bh, TwoProduct::productLowBigDecimal);
    }
}
