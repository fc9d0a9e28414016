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
import java.math.MathContext;
import java.util.Arrays;
import java.util.concurrent.TimeUnit;
import java.util.function.BinaryOperator;
import java.util.function.UnaryOperator;
import org.apache.commons.multiprecision.DoubleDouble;
import org.apache.commons.multiprecision.QuadDouble;
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
 * Executes a benchmark to measure the speed of arithmetic in the {@link DoubleDouble}
 * and {@link QuadDouble} classes. {@link BigDecimal} arithmetic with the equivalent
 * number of decimal digits is provided for reference.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-server", "-Xms512M", "-Xmx512M"})
public class ArithmeticPerformance {
    /** Decimal context with the precision of a double-double. */
    private static final MathContext MC_32 = new MathContext(32);
    /** Decimal context with the precision of a quad-double. */
    private static final MathContext MC_64 = new MathContext(64);

    /**
     * Contains the size and type of numbers.
     */
    @State(Scope.Benchmark)
    public static class NumberType {
        /**
         * The size of the data.
         */
        @Param({"1000"})
        private int size;

        /**
         * The type of the data.
         */
        @Param({NumberGenerators.GAUSSIAN, NumberGenerators.LOG_UNIFORM,
                NumberGenerators.UNIFORM, NumberGenerators.WIDE})
        private String type;

        /**
         * Gets the size.
         *
         * @return the size
         */
        public int getSize() {
            return size;
        }

        /**
         * Gets the type.
         *
         * @return the type
         */
        public String getType() {
            return type;
        }
    }

    /**
     * Contains two arrays of double-double numbers.
     */
    @State(Scope.Benchmark)
    public static class DoubleDoubleNumbers extends NumberType {
        /** The first numbers. */
        private DoubleDouble[] numbers;
        /** The second numbers. */
        private DoubleDouble[] numbers2;

        /**
         * Gets the first numbers.
         *
         * @return the numbers
         */
        public DoubleDouble[] getNumbers() {
            return numbers;
        }

        /**
         * Gets the second numbers.
         *
         * @return the numbers
         */
        public DoubleDouble[] getNumbers2() {
            return numbers2;
        }

        /**
         * Create the numbers.
         */
        @Setup
        public void setup() {
            final UniformRandomProvider rng = RandomSource.create(RandomSource.XO_RO_SHI_RO_128_PP);
            numbers = NumberGenerators.createDoubleDoubles(getType(), getSize(), rng);
            numbers2 = NumberGenerators.createDoubleDoubles(getType(), getSize(), rng);
        }
    }

    /**
     * Contains two arrays of quad-double numbers.
     */
    @State(Scope.Benchmark)
    public static class QuadDoubleNumbers extends NumberType {
        /** The first numbers. */
        private QuadDouble[] numbers;
        /** The second numbers. */
        private QuadDouble[] numbers2;

        /**
         * Gets the first numbers.
         *
         * @return the numbers
         */
        public QuadDouble[] getNumbers() {
            return numbers;
        }

        /**
         * Gets the second numbers.
         *
         * @return the numbers
         */
        public QuadDouble[] getNumbers2() {
            return numbers2;
        }

        /**
         * Create the numbers.
         */
        @Setup
        public void setup() {
            final UniformRandomProvider rng = RandomSource.create(RandomSource.XO_RO_SHI_RO_128_PP);
            numbers = NumberGenerators.createQuadDoubles(getType(), getSize(), rng);
            numbers2 = NumberGenerators.createQuadDoubles(getType(), getSize(), rng);
        }
    }

    /**
     * Contains two arrays of decimal numbers. These are the exact values of random
     * quad-double numbers.
     */
    @State(Scope.Benchmark)
    public static class DecimalNumbers extends NumberType {
        /** The first numbers. */
        private BigDecimal[] numbers;
        /** The second numbers. */
        private BigDecimal[] numbers2;

        /**
         * Gets the first numbers.
         *
         * @return the numbers
         */
        public BigDecimal[] getNumbers() {
            return numbers;
        }

        /**
         * Gets the second numbers.
         *
         * @return the numbers
         */
        public BigDecimal[] getNumbers2() {
            return numbers2;
        }

        /**
         * Create the numbers.
         */
        @Setup
        public void setup() {
            final UniformRandomProvider rng = RandomSource.create(RandomSource.XO_RO_SHI_RO_128_PP);
            numbers = toBigDecimal(NumberGenerators.createQuadDoubles(getType(), getSize(), rng));
            numbers2 = toBigDecimal(NumberGenerators.createQuadDoubles(getType(), getSize(), rng));
        }

        /**
         * Convert the numbers to their exact decimal value.
         *
         * @param x Numbers.
         * @return the decimal numbers
         */
        private static BigDecimal[] toBigDecimal(QuadDouble[] x) {
            return Arrays.stream(x).map(ArithmeticPerformance::toBigDecimal).toArray(BigDecimal[]::new);
        }
    }

    /**
     * Get the exact value of the quad-double.
     *
     * @param x Value.
     * @return the value
     */
    static BigDecimal toBigDecimal(QuadDouble x) {
        BigDecimal sum = BigDecimal.ZERO;
        for (final double v : x.toArray()) {
            sum = sum.add(new BigDecimal(v));
        }
        return sum;
    }

    /**
     * Apply the function to all the numbers.
     *
     * @param <T> Type of the numbers.
     * @param numbers Numbers.
     * @param bh Data sink.
     * @param fun Function.
     */
    private static <T> void apply(T[] numbers, Blackhole bh, UnaryOperator<T> fun) {
        for (int i = 0; i < numbers.length; i++) {
            bh.consume(fun.apply(numbers[i]));
        }
    }

    /**
     * Apply the function to the paired numbers.
     *
     * @param <T> Type of the numbers.
     * @param numbers First numbers of the pairs.
     * @param numbers2 Second numbers of the pairs.
     * @param bh Data sink.
     * @param fun Function.
     */
    private static <T> void apply(T[] numbers, T[] numbers2, Blackhole bh, BinaryOperator<T> fun) {
        for (int i = 0; i < numbers.length; i++) {
            bh.consume(fun.apply(numbers[i], numbers2[i]));
        }
    }

    // Benchmark methods.
    //
    // The methods are partially documented as the names are self-documenting.
    // CHECKSTYLE: stop JavadocMethod
    // CHECKSTYLE: stop DesignForExtension

    @Benchmark
    public void doubleDoubleAdd(DoubleDoubleNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), numbers.getNumbers2(), bh, DoubleDouble::add);
    }

    @Benchmark
    public void doubleDoubleMultiply(DoubleDoubleNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), numbers.getNumbers2(), bh, DoubleDouble::multiply);
    }

    @Benchmark
    public void doubleDoubleDivide(DoubleDoubleNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), numbers.getNumbers2(), bh, DoubleDouble::divide);
    }

    @Benchmark
    public void doubleDoubleSquare(DoubleDoubleNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), bh, DoubleDouble::square);
    }

    @Benchmark
    public void doubleDoubleSqrt(DoubleDoubleNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), bh, x -> x.abs().sqrt());
    }

    @Benchmark
    public void quadDoubleAdd(QuadDoubleNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), numbers.getNumbers2(), bh, QuadDouble::add);
    }

    @Benchmark
    public void quadDoubleMultiply(QuadDoubleNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), numbers.getNumbers2(), bh, QuadDouble::multiply);
    }

    @Benchmark
    public void quadDoubleDivide(QuadDoubleNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), numbers.getNumbers2(), bh, QuadDouble::divide);
    }

    @Benchmark
    public void quadDoubleSquare(QuadDoubleNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), bh, QuadDouble::square);
    }

    @Benchmark
    public void quadDoubleSqrt(QuadDoubleNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), bh, x -> x.abs().sqrt());
    }

    @Benchmark
    public void bigDecimalAdd(DecimalNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), numbers.getNumbers2(), bh, (x, y) -> x.add(y, MC_64));
    }

    @Benchmark
    public void bigDecimalMultiply32(DecimalNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), numbers.getNumbers2(), bh, (x, y) -> x.multiply(y, MC_32));
    }

    @Benchmark
    public void bigDecimalMultiply64(DecimalNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), numbers.getNumbers2(), bh, (x, y) -> x.multiply(y, MC_64));
    }

    @Benchmark
    public void bigDecimalDivide32(DecimalNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), numbers.getNumbers2(), bh, (x, y) -> x.divide(y, MC_32));
    }

    @Benchmark
    public void bigDecimalDivide64(DecimalNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), numbers.getNumbers2(), bh, (x, y) -> x.divide(y, MC_64));
    }

    @Benchmark
    public void bigDecimalSqrt64(DecimalNumbers numbers, Blackhole bh) {
        apply(numbers.getNumbers(), bh, x -> x.abs().sqrt(MC_64));
    }
}
