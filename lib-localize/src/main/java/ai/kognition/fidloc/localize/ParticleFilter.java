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

import org.opencv.core.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Structure gated particle filter over window centers.
 * </p>
 *
 * <ol>
 * <li>Seeds are the top correlation peaks ({@link SeedFinder}).</li>
 * <li>The population is initialized around the seeds plus a uniform share ({@link ParticleSet#initialize}).</li>
 * <li>Each of a fixed number of iterations diffuses the particles, scores them ({@link ParticleScorer}), turns
 * the scores into weights with a softmax ({@link Weights#softmax}) and resamples.</li>
 * <li>The estimate is the weighted mean and covariance of the last scored population under the last
 * weights.</li>
 * </ol>
 *
 * <p>
 * There is no early stopping. All randomness comes from the {@link Random} handed to {@link #run(Random)}.
 * </p>
 */
public class ParticleFilter {
    private static final Logger LOGGER = LoggerFactory.getLogger(ParticleFilter.class);

    public static final double COVARIANCE_REGULARIZER = 1.0e-9;

    private final ReferenceContext ctx;
    private final Template tpl;
    private final LocalizerConfig config;
    private final ParticleScorer scorer;

    public ParticleFilter(final ReferenceContext ctx, final Template tpl, final LocalizerConfig config) {
        this.ctx = ctx;
        this.tpl = tpl;
        this.config = config;
        this.scorer = new ParticleScorer(ctx, tpl, config);
    }

    public ParticleScorer scorer() {
        return scorer;
    }

    public Result run(final Random rand) {
        final ValidRegion region = new ValidRegion(ctx.width, ctx.height, tpl.width(), tpl.height());
        final List<Seed> seeds = new SeedFinder(config.seedCount).find(ctx.features.highPass, tpl.highPass);

        ParticleSet parts = ParticleSet.initialize(seeds, config.particleCount, config.seedStdPx, config.seedFraction, region, rand);
        ParticleSet scored = parts;
        double[] weights = Weights.uniform(parts.size());
        int degenerate = 0;
        final boolean[] fellBack = new boolean[1];

        for(int iteration = 0; iteration < config.iterations; iteration++) {
            parts.diffuse(config.stepPx, rand);

            final double[] scores = score(parts);
            weights = Weights.softmax(scores, config.softmaxGain, fellBack);
            if(fellBack[0]) {
                degenerate++;
                LOGGER.warn("Iteration {}: no particle had a usable score. Falling back to uniform weights.", iteration);
            }

            if(LOGGER.isDebugEnabled())
                LOGGER.debug("Iteration {}: best score {}, {} particles rejected by the structure gate", iteration, max(scores), rejected(scores));

            scored = parts;
            parts = parts.resample(weights, rand);
        }

        final double[] mean = scored.weightedMean(weights);
        final double[][] cov = scored.weightedCovariance(weights, mean, COVARIANCE_REGULARIZER);
        return new Result(seeds, scored, weights, parts, new Point(mean[0], mean[1]), cov, degenerate);
    }

    double[] score(final ParticleSet parts) {
        final int n = parts.size();
        final double[] scores = new double[n];
        for(int i = 0; i < n; i++)
            scores[i] = scorer.score(parts.x(i), parts.y(i));
        return scores;
    }

    private static double max(final double[] v) {
        double ret = Double.NEGATIVE_INFINITY;
        for(final double d: v)
            ret = Math.max(ret, d);
        return ret;
    }

    private static int rejected(final double[] v) {
        int ret = 0;
        for(final double d: v)
            if(d == ParticleScorer.REJECTED)
                ret++;
        return ret;
    }

    /**
     * The outcome of one filter run, in reference image pixel coordinates.
     */
    public static final class Result {
        public final List<Seed> seeds;
        /**
         * The population the final weights belong to (the last one that was scored).
         */
        public final ParticleSet particles;
        /**
         * Normalized weights from the last scoring pass.
         */
        public final double[] weights;
        /**
         * The population after the last resample.
         */
        public final ParticleSet resampled;
        public final Point mean;
        public final double[][] covariance;
        /**
         * How many iterations fell back to uniform weights.
         */
        public final int degenerateIterations;

        Result(final List<Seed> seeds, final ParticleSet particles, final double[] weights, final ParticleSet resampled, final Point mean,
            final double[][] covariance, final int degenerateIterations) {
            this.seeds = seeds;
            this.particles = particles;
            this.weights = weights;
            this.resampled = resampled;
            this.mean = mean;
            this.covariance = covariance;
            this.degenerateIterations = degenerateIterations;
        }
    }
}
