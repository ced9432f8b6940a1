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
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <p>
 * Breaks the tie a reference with two-fold rotational symmetry creates between a location and its point
 * reflection through the image center. Both are scored with the full, structure gated
 * {@link ParticleScorer#score(double, double)} and the mirror is chosen only if it scores strictly higher.
 * </p>
 *
 * <p>
 * The symmetry center is assumed to be the geometric center of the reference image.
 * </p>
 */
public class MirrorDisambiguator {
    private static final Logger LOGGER = LoggerFactory.getLogger(MirrorDisambiguator.class);

    private final ParticleScorer scorer;
    private final double centerX;
    private final double centerY;

    public MirrorDisambiguator(final ParticleScorer scorer, final ReferenceContext ctx) {
        this.scorer = scorer;
        this.centerX = ctx.centerX();
        this.centerY = ctx.centerY();
    }

    public Point mirror(final Point p) {
        return new Point(2.0 * centerX - p.x, 2.0 * centerY - p.y);
    }

    public Decision decide(final Point candidate) {
        final Point m = mirror(candidate);
        final double here = scorer.score(candidate.x, candidate.y);
        final double there = scorer.score(m.x, m.y);
        final boolean mirrored = there > here;
        LOGGER.debug("Mirror check: candidate ({}, {}) scores {}, mirror ({}, {}) scores {}. Choosing the {}.", candidate.x, candidate.y, here, m.x,
            m.y, there, mirrored ? "mirror" : "candidate");
        return new Decision(mirrored ? m : candidate, mirrored, here, there);
    }

    public static final class Decision {
        public final Point position;
        public final boolean mirrored;
        public final double candidateScore;
        public final double mirrorScore;

        Decision(final Point position, final boolean mirrored, final double candidateScore, final double mirrorScore) {
            this.position = position;
            this.mirrored = mirrored;
            this.candidateScore = candidateScore;
            this.mirrorScore = mirrorScore;
        }
    }
}
