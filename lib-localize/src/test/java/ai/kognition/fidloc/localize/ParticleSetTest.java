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
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.junit.Test;

public class ParticleSetTest {
    private final ValidRegion region = new ValidRegion(200, 120, 40, 30);

    private static void assertInside(final ParticleSet set) {
        for(int i = 0; i < set.size(); i++)
            assertTrue("particle " + i + " at (" + set.x(i) + ", " + set.y(i) + ")", Synthetic.inside(set.region, set.x(i), set.y(i)));
    }

    @Test
    public void testInitializeWithoutSeeds() {
        final ParticleSet set = ParticleSet.initialize(Collections.emptyList(), 500, 12.0, 0.8, region, new Random(1));
        assertEquals(500, set.size());
        assertInside(set);
    }

    @Test
    public void testInitializeAroundSeeds() {
        // seeds outside the valid region are clipped in first
        final List<Seed> seeds = Arrays.asList(new Seed(0.0, 0.0, 0.9), new Seed(100.0, 60.0, 0.8), new Seed(500.0, 500.0, 0.7));
        final ParticleSet set = ParticleSet.initialize(seeds, 1001, 12.0, 0.8, region, new Random(2));
        assertEquals(1001, set.size());
        assertInside(set);

        // 800 seeded particles over 3 seeds: 267, 267, 266
        int nearSecond = 0;
        for(int i = 267; i < 534; i++)
            if(Math.abs(set.x(i) - 100.0) < 60.0 && Math.abs(set.y(i) - 60.0) < 60.0)
                nearSecond++;
        assertEquals(267, nearSecond);
    }

    @Test
    public void testZeroSeedStd() {
        final ParticleSet set = ParticleSet.initialize(Collections.singletonList(new Seed(77.0, 44.0, 1.0)), 10, 0.0, 1.0, region, new Random(3));
        for(int i = 0; i < set.size(); i++) {
            assertEquals(77.0, set.x(i), 0.0);
            assertEquals(44.0, set.y(i), 0.0);
        }
    }

    @Test
    public void testDiffuseStaysInside() {
        final ParticleSet set = ParticleSet.initialize(Collections.emptyList(), 300, 12.0, 0.8, region, new Random(4));
        final Random rand = new Random(5);
        for(int it = 0; it < 20; it++) {
            set.diffuse(25.0, rand);
            assertInside(set);
        }
    }

    @Test
    public void testResamplePreservesSize() {
        final Random rand = new Random(6);
        for(final int n: new int[] {1,2,17,1000}) {
            ParticleSet set = ParticleSet.initialize(Collections.emptyList(), n, 12.0, 0.8, region, rand);
            for(int it = 0; it < 3; it++) {
                final double[] w = new double[n];
                for(int i = 0; i < n; i++)
                    w[i] = rand.nextDouble();
                set = set.resample(w, rand);
                assertEquals(n, set.size());
                assertInside(set);
            }
        }
    }

    @Test
    public void testResampleFollowsWeights() {
        final ParticleSet set = ParticleSet.initialize(Collections.emptyList(), 50, 12.0, 0.8, region, new Random(7));
        final double[] w = new double[50];
        w[13] = 1.0;
        final ParticleSet out = set.resample(w, new Random(8));
        for(int i = 0; i < out.size(); i++) {
            assertEquals(set.x(13), out.x(i), 0.0);
            assertEquals(set.y(13), out.y(i), 0.0);
        }
        assertThrows(IllegalArgumentException.class, () -> set.resample(new double[3], new Random()));
    }

    @Test
    public void testWeightedMoments() {
        final ParticleSet set = new ParticleSet(region, 2);
        set.xs[0] = 30.0;
        set.ys[0] = 20.0;
        set.xs[1] = 50.0;
        set.ys[1] = 40.0;
        final double[] w = {1.0,3.0};
        final double[] mean = set.weightedMean(w);
        assertEquals(45.0, mean[0], 1e-12);
        assertEquals(35.0, mean[1], 1e-12);

        final double[][] cov = set.weightedCovariance(w, mean, 1e-9);
        // 0.25 * 15^2 + 0.75 * 5^2
        assertEquals(75.0 + 1e-9, cov[0][0], 1e-12);
        assertEquals(75.0, cov[0][1], 1e-12);
        assertEquals(cov[0][1], cov[1][0], 0.0);
        assertEquals(75.0 + 1e-9, cov[1][1], 1e-12);
    }
}
