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

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * <p>
 * Confidence in [0, 1] derived from a weight vector. Half of it comes from how concentrated the weights are
 * ({@code 1 - H / log(N)} with {@code H} the Shannon entropy) and half from the margin between the two largest
 * weights, scaled by {@link #MARGIN_SCALE} and clamped.
 * </p>
 *
 * <p>
 * Particles whose centers round to the same scoring window are indistinguishable to the scorer and always carry
 * equal weight. {@link #poolByWindow(ParticleSet, double[])} sums those weights so a cloud that has collapsed onto
 * one window reads as concentrated. The flip side is that uniform weights only give a confidence near 0 when
 * the particles sit in distinct windows: {@code N} particles sharing {@code k < N} windows can't do better than
 * an entropy of {@code log(k)} against the {@code log(N)} it is divided by.
 * </p>
 */
public final class Confidence {
    public static final double MARGIN_SCALE = 5.0;

    private Confidence() {}

    public static double estimate(final double[] weights) {
        return estimate(weights, weights.length);
    }

    /**
     * @param weights the (not necessarily normalized) weights.
     * @param populationSize the {@code N} the entropy is normalized by.
     */
    public static double estimate(final double[] weights, final int populationSize) {
        if(populationSize <= 1 || weights.length == 0)
            return 1.0;

        final double[] w = Weights.normalize(weights);
        double entropy = 0.0;
        for(final double v: w)
            if(v > 0.0)
                entropy -= v * Math.log(v);
        final double concentration = 1.0 - entropy / Math.log(populationSize);

        final double[] sorted = w.clone();
        Arrays.sort(sorted);
        final double first = sorted[sorted.length - 1];
        final double second = sorted.length > 1 ? sorted[sorted.length - 2] : 0.0;
        final double margin = clamp((first - second) * MARGIN_SCALE);

        return clamp(0.5 * concentration + 0.5 * margin);
    }

    /**
     * Confidence of a scored population, with weights pooled per scoring window and the entropy normalized by the
     * full population size.
     */
    public static double estimate(final ParticleSet particles, final double[] weights) {
        return estimate(poolByWindow(particles, weights), particles.size());
    }

    public static double[] poolByWindow(final ParticleSet particles, final double[] weights) {
        final ValidRegion region = particles.region;
        final Map<Long, Double> pooled = new LinkedHashMap<>();
        for(int i = 0; i < particles.size(); i++) {
            final long key = ((long)region.originX(particles.x(i)) << 32) | (region.originY(particles.y(i)) & 0xffffffffL);
            pooled.merge(key, weights[i], Double::sum);
        }
        return pooled.values().stream().mapToDouble(Double::doubleValue).toArray();
    }

    private static double clamp(final double v) {
        return v < 0.0 ? 0.0 : (v > 1.0 ? 1.0 : v);
    }
}
