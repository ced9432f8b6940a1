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

import org.opencv.core.Point;

/**
 * Dense local search around the particle cloud's mean: every offset on a {@code step} spaced grid within
 * {@code radius} pixels is scored with the high-pass ZNCC term alone, and the best one wins. Candidate
 * centers are clipped into the valid region first.
 */
public class Refiner {
    public static final double INITIAL_BEST = -1.0e9;

    private final ParticleScorer scorer;
    private final ValidRegion region;
    private final int radius;
    private final int step;

    public Refiner(final ParticleScorer scorer, final ValidRegion region, final int radius, final int step) {
        if(step < 1)
            throw new IllegalArgumentException("The refine step must be at least 1 but was " + step);
        this.scorer = scorer;
        this.region = region;
        this.radius = radius;
        this.step = step;
    }

    public Point refine(final Point start) {
        double best = INITIAL_BEST;
        double bx = start.x;
        double by = start.y;
        for(int dy = -radius; dy <= radius; dy += step) {
            for(int dx = -radius; dx <= radius; dx += step) {
                final double xc = region.clipX(start.x + dx);
                final double yc = region.clipY(start.y + dy);
                final double s = scorer.highPassZncc(xc, yc);
                if(s > best) {
                    best = s;
                    bx = xc;
                    by = yc;
                }
            }
        }
        return new Point(bx, by);
    }
}
