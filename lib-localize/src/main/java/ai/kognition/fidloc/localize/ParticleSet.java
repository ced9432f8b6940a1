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

import java.util.List;
import java.util.Random;

/**
 * <p>
 * A population of 2-D window-center hypotheses, in reference image pixel coordinates. Coordinates are
 * always kept inside a {@link ValidRegion} so that every particle's window fits inside the reference image.
 * </p>
 *
 * <p>
 * The set is owned by a single filter run and is mutated in place by {@link #diffuse(double, Random)}.
 * {@link #resample(double[], Random)} returns a replacement.
 * </p>
 */
public final class ParticleSet {
    public final ValidRegion region;
    final double[] xs;
    final double[] ys;

    private ParticleSet(final ValidRegion region, final double[] xs, final double[] ys) {
        this.region = region;
        this.xs = xs;
        this.ys = ys;
    }

    public ParticleSet(final ValidRegion region, final int n) {
        this(region, new double[n], new double[n]);
    }

    /**
     * <p>
     * Initial population: {@code seedFraction} of the particles are drawn from isotropic Gaussians of standard
     * deviation {@code seedStdPx} around the seeds (each seed is first clipped into the valid region); the
     * rest are uniform over the valid region. The seeded share is split as evenly as possible across the seeds
     * (the first {@code remainder} seeds get one extra). Without seeds every particle is uniform.
     * </p>
     *
     * <p>
     * The result always has exactly {@code n} particles, all clipped into the valid region.
     * </p>
     */
    public static ParticleSet initialize(final List<Seed> seeds, final int n, final double seedStdPx, final double seedFraction,
        final ValidRegion region, final Random rand) {
        if(n < 1)
            throw new IllegalArgumentException("A particle set needs at least one particle. Asked for " + n);

        final ParticleSet ret = new ParticleSet(region, n);
        final int numSeeds = seeds.size();
        final int seeded = numSeeds == 0 ? 0 : (int)(seedFraction * n);

        int i = 0;
        if(seeded > 0) {
            final int each = seeded / numSeeds;
            final int remainder = seeded % numSeeds;
            for(int s = 0; s < numSeeds; s++) {
                final Seed seed = seeds.get(s);
                final double cx = region.clipX(seed.x);
                final double cy = region.clipY(seed.y);
                final int count = each + (s < remainder ? 1 : 0);
                for(int k = 0; k < count; k++, i++) {
                    ret.xs[i] = cx + rand.nextGaussian() * seedStdPx;
                    ret.ys[i] = cy + rand.nextGaussian() * seedStdPx;
                }
            }
        }

        for(; i < n; i++) {
            ret.xs[i] = region.minX + rand.nextDouble() * (region.maxX - region.minX);
            ret.ys[i] = region.minY + rand.nextDouble() * (region.maxY - region.minY);
        }

        ret.clip();
        return ret;
    }

    public int size() {
        return xs.length;
    }

    public double x(final int i) {
        return xs[i];
    }

    public double y(final int i) {
        return ys[i];
    }

    /**
     * Add independent zero-mean Gaussian noise of standard deviation {@code step} to every coordinate, then clip.
     */
    public void diffuse(final double step, final Random rand) {
        for(int i = 0; i < xs.length; i++) {
            xs[i] += rand.nextGaussian() * step;
            ys[i] += rand.nextGaussian() * step;
        }
        clip();
    }

    public void clip() {
        for(int i = 0; i < xs.length; i++) {
            xs[i] = region.clipX(xs[i]);
            ys[i] = region.clipY(ys[i]);
        }
    }

    /**
     * Multinomial resampling: draw {@link #size()} particles with replacement, each with probability given by
     * {@code weights} (normalized here; non-finite and negative entries count as zero, and a vector with no
     * positive mass is treated as uniform).
     */
    public ParticleSet resample(final double[] weights, final Random rand) {
        if(weights.length != xs.length)
            throw new IllegalArgumentException("There are " + xs.length + " particles but " + weights.length + " weights");

        final int n = xs.length;
        final double[] w = Weights.normalize(weights);
        final double[] cdf = new double[n];
        double acc = 0.0;
        for(int i = 0; i < n; i++) {
            acc += w[i];
            cdf[i] = acc;
        }

        final ParticleSet ret = new ParticleSet(region, n);
        for(int i = 0; i < n; i++) {
            final int idx = lowerBound(cdf, rand.nextDouble() * acc);
            ret.xs[i] = xs[idx];
            ret.ys[i] = ys[idx];
        }
        return ret;
    }

    /**
     * @return {@code [x, y]} weighted by the (normalized) {@code weights}.
     */
    public double[] weightedMean(final double[] weights) {
        final double[] w = Weights.normalize(weights);
        double mx = 0.0;
        double my = 0.0;
        for(int i = 0; i < xs.length; i++) {
            mx += w[i] * xs[i];
            my += w[i] * ys[i];
        }
        return new double[] {mx,my};
    }

    /**
     * The weighted covariance about {@code mean}, plus {@code regularizer} on the diagonal.
     */
    public double[][] weightedCovariance(final double[] weights, final double[] mean, final double regularizer) {
        final double[] w = Weights.normalize(weights);
        double sxx = 0.0;
        double sxy = 0.0;
        double syy = 0.0;
        for(int i = 0; i < xs.length; i++) {
            final double dx = xs[i] - mean[0];
            final double dy = ys[i] - mean[1];
            sxx += w[i] * dx * dx;
            sxy += w[i] * dx * dy;
            syy += w[i] * dy * dy;
        }
        return new double[][] {{sxx + regularizer,sxy},{sxy,syy + regularizer}};
    }

    // first index whose cdf value is strictly greater than u
    private static int lowerBound(final double[] cdf, final double u) {
        int lo = 0;
        int hi = cdf.length - 1;
        while(lo < hi) {
            final int mid = (lo + hi) >>> 1;
            if(cdf[mid] > u)
                hi = mid;
            else
                lo = mid + 1;
        }
        return lo;
    }
}
