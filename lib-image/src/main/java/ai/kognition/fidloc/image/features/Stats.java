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

package ai.kognition.fidloc.image.features;

import java.util.Arrays;

/**
 * Summary statistics over {@code float} samples, accumulated in {@code double}.
 */
public class Stats {

    public static double mean(final float[] v) {
        if(v.length == 0)
            return 0.0;
        double sum = 0.0;
        for(final float f: v)
            sum += f;
        return sum / v.length;
    }

    /**
     * Population (not sample) standard deviation.
     */
    public static double std(final float[] v, final double mean) {
        if(v.length == 0)
            return 0.0;
        double sum2 = 0.0;
        for(final float f: v) {
            final double d = f - mean;
            sum2 += d * d;
        }
        return Math.sqrt(sum2 / v.length);
    }

    /**
     * The {@code q} quantile using linear interpolation between the two closest order statistics.
     */
    public static double quantile(final float[] v, final double q) {
        if(v.length == 0)
            throw new IllegalArgumentException("Can't take the quantile of an empty array");
        if(q < 0.0 || q > 1.0)
            throw new IllegalArgumentException("The quantile must be in [0, 1] but was " + q);
        final float[] sorted = Arrays.copyOf(v, v.length);
        Arrays.sort(sorted);
        return sortedQuantile(sorted, q);
    }

    public static double median(final float[] v) {
        return quantile(v, 0.5);
    }

    static double sortedQuantile(final float[] sorted, final double q) {
        final double pos = q * (sorted.length - 1);
        final int lo = (int)Math.floor(pos);
        final int hi = Math.min(lo + 1, sorted.length - 1);
        final double frac = pos - lo;
        return sorted[lo] + (sorted[hi] - sorted[lo]) * frac;
    }
}
