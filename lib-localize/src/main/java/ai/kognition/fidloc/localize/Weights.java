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

/**
 * Conversion of raw scores into a probability distribution over particles.
 */
public class Weights {
    /**
     * Exponents are clipped to this magnitude before {@link Math#exp(double)}.
     */
    public static final double EXPONENT_LIMIT = 700.0;

    /**
     * <p>
     * Temperature scaled softmax: {@code exp(gain * (s - max(s)))}, normalized, where the max is over the finite scores. Non-finite scores (and
     * non-finite results) get zero probability. If nothing is left with positive probability the uniform
     * distribution is returned instead.
     * </p>
     *
     * @param degenerate if not null, {@code degenerate[0]} is set to whether the uniform fallback was used.
     */
    public static double[] softmax(final double[] scores, final double gain, final boolean[] degenerate) {
        final int n = scores.length;
        final double[] ret = new double[n];
        if(n == 0) {
            if(degenerate != null)
                degenerate[0] = false;
            return ret;
        }

        double max = Double.NEGATIVE_INFINITY;
        for(final double s: scores) {
            if(Double.isFinite(s) && s > max)
                max = s;
        }

        double sum = 0.0;
        if(Double.isFinite(max)) {
            for(int i = 0; i < n; i++) {
                final double s = scores[i];
                if(!Double.isFinite(s))
                    continue;
                double e = gain * (s - max);
                if(Double.isNaN(e))
                    continue;
                e = e < -EXPONENT_LIMIT ? -EXPONENT_LIMIT : (e > EXPONENT_LIMIT ? EXPONENT_LIMIT : e);
                final double z = Math.exp(e);
                if(Double.isFinite(z)) {
                    ret[i] = z;
                    sum += z;
                }
            }
        }

        final boolean fallback = !(sum > 0.0) || !Double.isFinite(sum);
        if(fallback)
            Arrays.fill(ret, 1.0 / n);
        else {
            for(int i = 0; i < n; i++)
                ret[i] /= sum;
        }
        if(degenerate != null)
            degenerate[0] = fallback;
        return ret;
    }

    public static double[] softmax(final double[] scores, final double gain) {
        return softmax(scores, gain, null);
    }

    /**
     * Normalize to a sum of one, treating non-finite and negative entries as zero. Falls back to uniform when
     * nothing positive remains.
     */
    public static double[] normalize(final double[] w) {
        final int n = w.length;
        final double[] ret = new double[n];
        double sum = 0.0;
        for(int i = 0; i < n; i++) {
            final double v = w[i];
            if(Double.isFinite(v) && v > 0.0) {
                ret[i] = v;
                sum += v;
            }
        }
        if(!(sum > 0.0) || !Double.isFinite(sum)) {
            Arrays.fill(ret, n == 0 ? 0.0 : 1.0 / n);
            return ret;
        }
        for(int i = 0; i < n; i++)
            ret[i] /= sum;
        return ret;
    }

    public static double[] uniform(final int n) {
        final double[] ret = new double[n];
        Arrays.fill(ret, 1.0 / n);
        return ret;
    }
}
