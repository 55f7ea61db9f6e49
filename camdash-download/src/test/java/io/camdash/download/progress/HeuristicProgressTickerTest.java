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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class HeuristicProgressTickerTest {

    private ScheduledExecutorService scheduler;

    @BeforeEach
    public void setUp() {
        scheduler = Executors.newSingleThreadScheduledExecutor();
    }

    @AfterEach
    public void tearDown() {
        scheduler.shutdownNow();
    }

    @Test
    public void testTicksUpToCap() throws InterruptedException {
        List<Integer> published = new CopyOnWriteArrayList<>();
        ProgressEstimator estimator = ProgressEstimator.forTotal(-1);
        HeuristicProgressTicker ticker =
            new HeuristicProgressTicker(scheduler, estimator, 5, 90, Duration.ofMillis(2), published::add);

        ticker.start();
        long deadline = System.currentTimeMillis() + 5000;
        while (estimator.percent() < 90 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        Thread.sleep(30);
        ticker.stop();

        assertEquals(90, estimator.percent());
        assertThat(published).isSorted().doesNotHaveDuplicates().endsWith(90).hasSize(18);
    }

    @Test
    public void testNothingIsPublishedAfterStop() throws InterruptedException {
        List<Integer> published = new CopyOnWriteArrayList<>();
        ProgressEstimator estimator = ProgressEstimator.forTotal(-1);
        HeuristicProgressTicker ticker =
            new HeuristicProgressTicker(scheduler, estimator, 1, 90, Duration.ofMillis(1), published::add);

        ticker.start();
        Thread.sleep(20);
        ticker.stop();
        int seen = published.size();
        Thread.sleep(30);

        assertTrue(ticker.isStopped());
        assertEquals(seen, published.size());
    }

    @Test
    public void testStopBeforeStart() {
        List<Integer> published = new CopyOnWriteArrayList<>();
        HeuristicProgressTicker ticker = new HeuristicProgressTicker(
            scheduler, ProgressEstimator.forTotal(-1), 5, 90, Duration.ofMillis(1), published::add);
        ticker.stop();
        ticker.start();
        assertTrue(ticker.isStopped());
        assertThat(published).isEmpty();
    }
}
