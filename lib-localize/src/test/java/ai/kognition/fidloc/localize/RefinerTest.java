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

import org.junit.Test;
import org.opencv.core.Point;

import ai.kognition.fidloc.image.FloatRaster;

public class RefinerTest {
    private static final int TILE = 24;

    private final FloatRaster ref = Synthetic.noise(160, 120, 31L);
    private final LocalizerConfig cfg = Synthetic.unitScale(TILE, 120).build();
    private final ReferenceContext ctx = ReferenceContext.build(ref, cfg);

    private Refiner refiner(final int x0, final int y0, final int radius, final int step) {
        final Template tpl = new TemplatePreparer(cfg).prepare(ref.crop(x0, y0, TILE, TILE), ctx);
        return new Refiner(new ParticleScorer(ctx, tpl, cfg), new ValidRegion(ctx.width, ctx.height, TILE, TILE), radius, step);
    }

    @Test
    public void testFindsTheCropWithinRadius() {
        final Point p = refiner(68, 48, 8, 1).refine(new Point(84.0, 57.0));
        assertEquals(80.0, p.x, 0.0);
        assertEquals(60.0, p.y, 0.0);
    }

    @Test
    public void testClipsCandidates() {
        // crop centered on (14, 15), next to the minimum center (12, 12)
        final Point p = refiner(2, 3, 8, 1).refine(new Point(8.0, 9.0));
        assertEquals(14.0, p.x, 0.0);
        assertEquals(15.0, p.y, 0.0);

        final Point far = refiner(2, 3, 2, 1).refine(new Point(-50.0, -50.0));
        assertEquals(12.0, far.x, 0.0);
        assertEquals(12.0, far.y, 0.0);
    }

    @Test
    public void testZeroRadiusClipsOnly() {
        final Point p = refiner(68, 48, 0, 1).refine(new Point(500.0, 61.5));
        assertEquals(148.0, p.x, 0.0);
        assertEquals(61.5, p.y, 0.0);
    }

    @Test
    public void testBadStep() {
        assertThrows(IllegalArgumentException.class, () -> refiner(68, 48, 4, 0));
    }
}
