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
import org.apache.commons.multiprecision.DoubleDouble;
import org.apache.commons.multiprecision.QuadDouble;
import org.apache.commons.rng.UniformRandomProvider;
import org.apache.commons.rng.simple.RandomSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

/**
 * Tests for {@link NumberGenerators}.
 */
public class NumberGeneratorsTest {
    @ParameterizedTest
    @ValueSource(strings = {NumberGenerators.GAUSSIAN, NumberGenerators.LOG_UNIFORM,
                            NumberGenerators.UNIFORM, NumberGenerators.WIDE})
    void testCreateNumbers(String type) {
        final UniformRandomProvider rng = RandomSource.create(RandomSource.XO_RO_SHI_RO_128_PP, 42L);
        final double[] x = NumberGenerators.createDoubles(type, 50, rng);
        Assertions.assertEquals(50, x.length);
        for (final double v : x) {
            Assertions.assertTrue(Double.isFinite(v));
            if (NumberGenerators.LOG_UNIFORM.equals(type)) {
                Assertions.assertTrue(v >= 1 && v < 0x1.0p30);
            } else if (NumberGenerators.UNIFORM.equals(type)) {
                Assertions.assertTrue(v >= -1 && v < 1);
            }
        }

        final DoubleDouble[] dd = NumberGenerators.createDoubleDoubles(type, 50, rng);
        Assertions.assertEquals(50, dd.length);
        for (final DoubleDouble v : dd) {
            Assertions.assertTrue(v.isFinite());
            Assertions.assertTrue(Math.abs(v.lo()) <= Math.ulp(v.hi()));
        }

        final QuadDouble[] qd = NumberGenerators.createQuadDoubles(type, 50, rng);
        Assertions.assertEquals(50, qd.length);
        for (final QuadDouble v : qd) {
            Assertions.assertTrue(v.isFinite());
        }
    }

    @Test
    void testUnknownTypeThrows() {
        final UniformRandomProvider rng = RandomSource.create(RandomSource.XO_RO_SHI_RO_128_PP, 42L);
        Assertions.assertThrows(IllegalStateException.class, () -> NumberGenerators.createDoubles("exotic", 10, rng));
    }

    @Test
    void testToBigDecimal() {
        final QuadDouble x = QuadDouble.of(1.0, 0x1.0p-60, 0x1.0p-120, 0x1.0p-180);
        final BigDecimal expected = new BigDecimal(1.0).add(new BigDecimal(0x1.0p-60))
            .add(new BigDecimal(0x1.0p-120)).add(new BigDecimal(0x1.0p-180));
        Assertions.assertEquals(0, expected.compareTo(ArithmeticPerformance.toBigDecimal(x)));
    }
}
