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

import java.util.function.DoubleSupplier;
import java.util.stream.DoubleStream;
import org.apache.commons.multiprecision.DoubleDouble;
import org.apache.commons.multiprecision.QuadDouble;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.sampling.distribution.ZigguratNormalizedGaussianSampler;

/**
 * Creates random numbers for the benchmarks.
 */
final class NumberGenerators {
    /** Gaussian numbers. */
    static final String GAUSSIAN = "gaussian";
    /** Log-uniform numbers in {@code [1, 2^30)}. */
    static final String LOG_UNIFORM = "log-uniform";
    /** Uniform numbers in {@code [-1, 1)}. */
    static final String UNIFORM = "uniform";
    /** Numbers with a random exponent in {@code [-500, 500)} and a random sign. */
    static final String WIDE = "wide";

    /** The range for the log-uniform random numbers: 2^30. */
    private static final double LOG_RANGE = Math.log(0x1.0p30);
    /** The range of the exponent for the wide numbers. */
    private static final int EXPONENT_RANGE = 500;

    /** Private constructor. */
    private NumberGenerators() {
        // intentionally empty.
    }

    /**
     * Creates random double numbers of the named type.
     *
     * @param type Type of the numbers.
     * @param size Number of values.
     * @param rng Random number generator.
     * @return the numbers
     * @throws IllegalStateException if the type is not known
     */
    static double[] createDoubles(String type, int size, UniformRandomProvider rng) {
        final DoubleSupplier generator;
        if (GAUSSIAN.equals(type)) {
            final ZigguratNormalizedGaussianSampler s = ZigguratNormalizedGaussianSampler.of(rng);
            generator = s::sample;
        } else if (LOG_UNIFORM.equals(type)) {
            // e^(uniform(ln(upper) - ln(lower)) with a lower bound of 1
            generator = () -> Math.exp(rng.nextDouble() * LOG_RANGE);
        } else if (UNIFORM.equals(type)) {
            generator = () -> rng.nextDouble() * 2 - 1;
        } else if (WIDE.equals(type)) {
            generator = () -> Math.scalb(rng.nextDouble() * 2 - 1,
                rng.nextInt(2 * EXPONENT_RANGE) - EXPONENT_RANGE);
        } else {
            throw new IllegalStateException("Unknown number type: " + type);
        }
        return DoubleStream.generate(generator).limit(size).toArray();
    }

    /**
     * Creates random double-double numbers of the named type. The low part is a random
     * round-off of the high part.
     *
     * @param type Type of the numbers.
     * @param size Number of values.
     * @param rng Random number generator.
     * @return the numbers
     * @throws IllegalStateException if the type is not known
     */
    static DoubleDouble[] createDoubleDoubles(String type, int size, UniformRandomProvider rng) {
        final double[] x = createDoubles(type, size, rng);
        final DoubleDouble[] result = new DoubleDouble[size];
        for (int i = 0; i < size; i++) {
            result[i] = DoubleDouble.ofSum(x[i], x[i] * 0x1.0p-53 * rng.nextDouble());
        }
        return result;
    }

    /**
     * Creates random quad-double numbers of the named type. The trailing limbs are random
     * round-off of the leading limb.
     *
     * @param type Type of the numbers.
     * @param size Number of values.
     * @param rng Random number generator.
     * @return the numbers
     * @throws IllegalStateException if the type is not known
     */
    static QuadDouble[] createQuadDoubles(String type, int size, UniformRandomProvider rng) {
        final double[] x = createDoubles(type, size, rng);
        final QuadDouble[] result = new QuadDouble[size];
        for (int i = 0; i < size; i++) {
            final double v = x[i];
            result[i] = QuadDouble.of(v,
                                      v * 0x1.0p-53 * rng.nextDouble(),
                                      v * 0x1.0p-106 * rng.nextDouble(),
                                      v * 0x1.0p-159 * rng.nextDouble());
        }
        return result;
    }
}
