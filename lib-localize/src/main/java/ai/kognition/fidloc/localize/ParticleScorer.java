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

import ai.kognition.fidloc.image.features.FeatureMaps;
import ai.kognition.fidloc.image.features.OrientationHistogram;
import ai.kognition.fidloc.image.features.Zncc;

/**
 * <p>
 * Scores how well the template matches the reference window centered at a given position.
 * </p>
 *
 * <p>
 * A window that isn't entirely inside the reference, or whose fraction of structured pixels is below
 * {@link LocalizerConfig#minStructureFraction}, gets {@link #REJECTED} without any further work. Otherwise the
 * score is {@code wHp * zncc(highPass) + wHog * cos(orientationHistograms) + wMag * zncc(magnitude)}, the last
 * term only when its weight is positive.
 * </p>
 *
 * <p>
 * Instances are read-only and can be shared across threads.
 * </p>
 */
public class ParticleScorer {
    /**
     * The score of a window that fails the structure gate. With any reasonable softmax gain this is zero likelihood.
     */
    public static final double REJECTED = -1.0e3;

    private final ReferenceContext ctx;
    private final Template tpl;
    private final LocalizerConfig config;
    private final int tw;
    private final int th;

    public ParticleScorer(final ReferenceContext ctx, final Template tpl, final LocalizerConfig config) {
        this.ctx = ctx;
        this.tpl = tpl;
        this.config = config;
        this.tw = tpl.width();
        this.th = tpl.height();
    }

    /**
     * The full score of the window centered at {@code (cx, cy)}.
     */
    public double score(final double cx, final double cy) {
        return scoreWindow(ValidRegion.windowOrigin(cx, tw), ValidRegion.windowOrigin(cy, th));
    }

    /**
     * The full score of the window whose top-left corner is {@code (x0, y0)}.
     */
    public double scoreWindow(final int x0, final int y0) {
        if(!passesStructureGate(x0, y0))
            return REJECTED;

        final FeatureMaps maps = ctx.features;
        final double sHp = Zncc.score(maps.highPass, x0, y0, tw, th, tpl.highPassNorm);
        final double sHog = OrientationHistogram.similarity(maps.orientationHistogram(x0, y0, tw, th), tpl.histogram);
        final double sMag = (config.weightMagnitude > 0.0 && tpl.magnitudeNorm != null) ? Zncc.score(maps.magnitude, x0, y0, tw, th, tpl.magnitudeNorm)
            : 0.0;
        return config.weightHighPass * sHp + config.weightHistogram * sHog + config.weightMagnitude * sMag;
    }

    /**
     * @return true if the window is inside the reference and has enough structured pixels to be worth scoring.
     */
    public boolean passesStructureGate(final int x0, final int y0) {
        if(!ctx.features.gray.contains(x0, y0, tw, th))
            return false;
        return ctx.structuredFraction(x0, y0, tw, th) >= config.minStructureFraction;
    }

    /**
     * Only the high-pass ZNCC term, without the structure gate. {@link Double#NEGATIVE_INFINITY} when the window
     * isn't inside the reference.
     */
    public double highPassZncc(final double cx, final double cy) {
        final int x0 = ValidRegion.windowOrigin(cx, tw);
        final int y0 = ValidRegion.windowOrigin(cy, th);
        if(!ctx.features.gray.contains(x0, y0, tw, th))
            return Double.NEGATIVE_INFINITY;
        return Zncc.score(ctx.features.highPass, x0, y0, tw, th, tpl.highPassNorm);
    }

    public int templateWidth() {
        return tw;
    }

    public int templateHeight() {
        return th;
    }
}
