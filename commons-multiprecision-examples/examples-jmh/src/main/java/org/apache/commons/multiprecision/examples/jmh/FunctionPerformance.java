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
import java.util.function.DoubleUnaryOperator;
import java.util.function.UnaryOperator;
import org.apache.commons.math3.util.FastMath;
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
 * Executes a benchmark to measure the speed of the elementary functions of the
 * {@link DoubleDouble} and {@link QuadDouble} classes. The {@code double} functions
 * of {@link Math} and {@link FastMath} are provided for reference.
 */
@BenchmarkMode(Mode.AverageTime)
@OutputTimeUnit(TimeUnit.NANOSECONDS)
@Warmup(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@Measurement(iterations = 5, time = 1, timeUnit = TimeUnit.SECONDS)
@State(Scope.Benchmark)
@Fork(value = 1, jvmArgs = {"-server", "-Xms512M", "-Xmx512M"})
public class FunctionPerformance {
    /**
     * Contains the function arguments.
     */
    @State(Scope.Benchmark)
    public static class FunctionArguments {
        /**
         * The size of the data.
         */
        @Param({"100"})
        private int size;

        /**
         * The magnitude of the arguments. The arguments are uniform in {@code [-range, range)}.
         */
        @Param({"1", "100"})
        private double range;

        /** The arguments. */
        private double[] doubles;
        /** The arguments as double-double numbers. */
        private DoubleDouble[] doubleDoubles;
        /** The arguments as quad-double numbers. */
        private QuadDouble[] quadDoubles;

        /**
         * Gets the double arguments.
         *
         * @return the arguments
         */
        public double[] getDoubles() {
            return doubles;
        }

        /**
         * Gets the double-double arguments.
         *
         * @return the arguments
         */
        public DoubleDouble[] getDoubleDoubles() {
            return doubleDoubles;
        }

        /**
         * Gets the quad-double arguments.
         *
         * @return the arguments
         */
        public QuadDouble[] getQuadDoubles() {
            return quadDoubles;
        }

        /**
         * Create the arguments.
         */
        @Setup
        public void setup() {
            final UniformRandomProvider rng = RandomSource.create(RandomSource.XO_RO_SHI_RO_128_PP);
            doubles = NumberGenerators.createDoubles(NumberGenerators.UNIFORM, size, rng);
            doubleDoubles = new DoubleDouble[size];
            quadDoubles = new QuadDouble[size];
            for (int i = 0; i < size; i++) {
                doubles[i] *= range;
                doubleDoubles[i] = DoubleDouble.of(doubles[i]);
                quadDoubles[i] = QuadDouble.of(doubles[i]);
            }
        }
    }

    /**
     * Apply the function to all the arguments.
     *
     * @param x Arguments.
     * @param bh Data sink.
     * @param fun Function.
     */
    private static void apply(double[] x, Blackhole bh, DoubleUnaryOperator fun) {
        for (int i = 0; i < x.length; i++) {
            bh.consume(fun.applyAsDouble(x[i]));
        }
    }

    /**
     * Apply the function to all the arguments.
     *
     * @param <T> Type of the arguments.
     * @param x Arguments.
     * @param bh Data sink.
     * @param fun Function.
     */
    private static <T> void apply(T[] x, Blackhole bh, UnaryOperator<T> fun) {
        for (int i = 0; i < x.length; i++) {
            bh.consume(fun.apply(x[i]));
        }
    }

    // Benchmark methods.
    //
    // The methods are partially documented as the names are self-documenting.
    // CHECKSTYLE: stop JavadocMethod
    // CHECKSTYLE: stop DesignForExtension

    @Benchmark
    public void mathExp(FunctionArguments args, Blackhole bh) {
        apply(args.getDoubles(), bh, Math::exp);
    }

    @Benchmark
    public void fastMathExp(FunctionArguments args, Blackhole bh) {
        apply(args.getDoubles(), bh, FastMath::exp);
    }

    @Benchmark
    public void doubleDoubleExp(FunctionArguments args, Blackhole bh) {
        apply(args.getDoubleDoubles(), bh, DoubleDouble::exp);
    }

    @Benchmark
    public void quadDoubleExp(FunctionArguments args, Blackhole bh) {
        apply(args.getQuadDoubles(), bh, QuadDouble::exp);
    }

    @Benchmark
    public void mathLog(FunctionArguments args, Blackhole bh) {
        apply(args.getDoubles(), bh, x -> Math.log(Math.abs(x)));
    }

    @Benchmark
    public void fastMathLog(FunctionArguments args, Blackhole bh) {
        apply(args.getDoubles(), bh, x -> FastMath.log(Math.abs(x)));
    }

    @Benchmark
    public void doubleDoubleLog(FunctionArguments args, Blackhole bh) {
        apply(args.getDoubleDoubles(), bh, x -> x.abs().log());
    }

    @Benchmark
    public void quadDoubleLog(FunctionArguments args, Blackhole bh) {
        apply(args.getQuadDoubles(), bh, x -> x.abs().log());
    }

    @Benchmark
    public void mathSin(FunctionArguments args, Blackhole bh) {
        apply(args.getDoubles(), bh, Math::sin);
    }

    @Benchmark
    public void fastMathSin(FunctionArguments args, Blackhole bh) {
        apply(args.getDoubles(), bh, FastMath::sin);
    }

    @Benchmark
    public void doubleDoubleSin(FunctionArguments args, Blackhole bh) {
        apply(args.getDoubleDoubles(), bh, DoubleDouble::sin);
    }

    @Benchmark
    public void quadDoubleSin(FunctionArguments args, Blackhole bh) {
        apply(args.getQuadDoubles(), bh, QuadDouble::sin);
    }

    @Benchmark
    public void mathAtan(FunctionArguments args, Blackhole bh) {
        apply(args.getDoubles(), bh, Math::atan);
    }

    @Benchmark
    public void fastMathAtan(FunctionArguments args, Blackhole bh) {
        apply(args.getDoubles(), bh, FastMath::atan);
    }

    @Benchmark
    public void doubleDoubleAtan(FunctionArguments args, Blackhole bh) {
        apply(args.getDoubleDoubles(), bh, DoubleDouble::atan);
    }

    @Benchmark
    public void quadDoubleAtan(FunctionArguments args, Blackhole bh) {
        apply(args.getQuadDoubles(), bh, QuadDouble::atan);
    }

    @Benchmark
    public void doubleDoubleToString(FunctionArguments args, Blackhole bh) {
        final DoubleDouble[] x = args.getDoubleDoubles();
        for (int i = 0; i < x.length; i++) {
            bh.consume(x[i].toString());
        }
    }

    @Benchmark
    public void quadDoubleToString(FunctionArguments args, Blackhole bh) {
        final QuadDouble[] x = args.getQuadDoubles();
        for (int i = 0; i < x.length; i++) {
            bh.consume(x[i].toString());
        }
    }
}
