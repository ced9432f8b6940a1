/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.fidloc.localize;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ConfidenceTest {

    @Test
    public void testAllMassOnOneParticle() {
        final double[] w = new double[100];
        w[42] = 1.0;
        assertEquals(1.0, Confidence.estimate(w), 1e-12);
    }

    @Test
    public void testUniformIsZero() {
        assertEquals(0.0, Confidence.estimate(Weights.uniform(1000)), 1e-9);
    }

    @Test
    public void testApproachesZero() {
        double last = 1.0;
        for(final double peak: new double[] {0.5,0.1,0.01,0.002}) {
            final int n = 1000;
            final double[] w = new double[n];
            w[0] = peak;
            for(int i = 1; i < n; i++)
                w[i] = (1.0 - peak) / (n - 1);
            final double c = Confidence.estimate(w);
            assertTrue(c >= 0.0 && c <= 1.0);
            assertTrue(c < last);
            last = c;
        }
        assertTrue(last < 0.05);
    }

    @Test
    public void testTwoEqualPeaks() {
        // entropy log(2) of log(4), no margin
        assertEquals(0.25, Confidence.estimate(new double[] {0.5,0.5,0.0,0.0}), 1e-12);
    }

    @Test
    public void testSingleParticle() {
        assertEquals(1.0, Confidence.estimate(new double[] {1.0}), 0.0);
    }

    @Test
    public void testPoolingBySharedWindow() {
        final ValidRegion region = new ValidRegion(100, 100, 20, 20);
        final ParticleSet set = new ParticleSet(region, 4);
        // the first three round to the same window
        set.xs[0] = 50.0;
        set.ys[0] = 50.0;
        set.xs[1] = 50.2;
        set.ys[1] = 49.9;
        set.xs[2] = 49.8;
        set.ys[2] = 50.3;
        set.xs[3] = 70.0;
        set.ys[3] = 30.0;

        final double[] pooled = Confidence.poolByWindow(set, new double[] {0.3,0.3,0.3,0.1});
        assertEquals(2, pooled.length);
        assertEquals(0.9, pooled[0], 1e-12);
        assertEquals(0.1, pooled[1], 1e-12);

        final double[] w = {1.0 / 3,1.0 / 3,1.0 / 3,0.0};
        assertEquals(1.0, Confidence.estimate(set, w), 1e-12);
        assertTrue(Confidence.estimate(w) < 0.5);
    }

    @Test
    public void testPooledUniformFloorsAboveZero() {
        final ValidRegion region = new ValidRegion(100, 100, 20, 20);
        final int n = 100;
        final ParticleSet spread = new ParticleSet(region, n);
        final ParticleSet shared = new ParticleSet(region, n);
        for(int i = 0; i < n; i++) {
            // one window each
            spread.xs[i] = 10.0 + (i % 10) * 8.0;
            spread.ys[i] = 10.0 + (i / 10) * 8.0;
            // four windows, 25 particles in each
            shared.xs[i] = (i % 2 == 0) ? 30.0 : 60.0;
            shared.ys[i] = (i % 4 < 2) ? 30.0 : 60.0;
        }
        final double[] uniform = Weights.uniform(n);

        assertEquals(0.0, Confidence.estimate(spread, uniform), 1e-9);
        // entropy log(4) of log(100), no margin
        assertEquals(0.5 * (1.0 - Math.log(4) / Math.log(n)), Confidence.estimate(shared, uniform), 1e-9);
        assertEquals(0.0, Confidence.estimate(uniform), 1e-9);
    }
}
