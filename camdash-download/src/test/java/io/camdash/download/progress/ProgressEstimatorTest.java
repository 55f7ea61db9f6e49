package io.camdash.download.progress;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class ProgressEstimatorTest {

    @Test
    public void testExactPercentIsFloored() {
        assertEquals(0, ProgressEstimator.percentOf(0, 1000));
        assertEquals(0, ProgressEstimator.percentOf(9, 1000));
        assertEquals(33, ProgressEstimator.percentOf(1, 3));
        assertEquals(66, ProgressEstimator.percentOf(2, 3));
        assertEquals(98, ProgressEstimator.percentOf(989, 1000));
    }

    @Test
    public void testExactPercentHoldsBelowCompletion() {
        assertEquals(99, ProgressEstimator.percentOf(999, 1000));
        assertEquals(99, ProgressEstimator.percentOf(1000, 1000));
        assertEquals(99, ProgressEstimator.percentOf(5000, 1000));
    }

    @Test
    public void testHugeTotals() {
        long total = Long.MAX_VALUE / 2;
        assertEquals(50, ProgressEstimator.percentOf(total / 2 + 1, total));
        assertThatThrownBy(() -> ProgressEstimator.percentOf(1, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void testOnChunkNeverDecreases() {
        ProgressEstimator estimator = ProgressEstimator.forTotal(1000);
        assertTrue(estimator.isExact());
        assertEquals(25, estimator.onChunk(250));
        assertEquals(25, estimator.onChunk(100));
        assertEquals(75, estimator.onChunk(750));
        assertEquals(99, estimator.onChunk(1000));
    }

    @Test
    public void testTicksStopAtCap() {
        ProgressEstimator estimator = ProgressEstimator.forTotal(-1);
        assertFalse(estimator.isExact());
        assertEquals(-1, estimator.totalBytes());
        for (int i = 0; i < 17; i++) {
            estimator.tick(5, 90);
        }
        assertEquals(85, estimator.percent());
        assertEquals(90, estimator.tick(5, 90));
        assertEquals(90, estimator.tick(5, 90));
        assertEquals(90, estimator.onChunk(1_000_000));
    }

    @Test
    public void testUnevenStepsClampToCap() {
        ProgressEstimator estimator = ProgressEstimator.forTotal(0);
        assertEquals(40, estimator.tick(40, 90));
        assertEquals(80, estimator.tick(40, 90));
        assertEquals(90, estimator.tick(40, 90));
    }
}
