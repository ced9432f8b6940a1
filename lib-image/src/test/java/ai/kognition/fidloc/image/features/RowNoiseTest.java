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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;

import org.junit.Test;

import ai.kognition.fidloc.image.FloatRaster;
import ai.kognition.fidloc.image.UtilsForTesting;

public class RowNoiseTest {

    @Test
    public void testOutputStretchedToUnitRange() {
        final FloatRaster out = new RowNoise(true, 51).apply(UtilsForTesting.texture(64, 48, 17L));
        float min = Float.POSITIVE_INFINITY;
        float max = Float.NEGATIVE_INFINITY;
        for(final float v: out.data) {
            min = Math.min(min, v);
            max = Math.max(max, v);
        }
        assertEquals(0.0f, min, 1e-6f);
        assertEquals(1.0f, max, 1e-6f);
    }

    @Test
    public void testRowOffsetsRemoved() {
        // every row is the same pattern plus a different constant offset
        final FloatRaster banded = new FloatRaster(9, 4);
        final float[] pattern = {0, 1, 0, 2, 0, 1, 0, 3, 0};
        for(int y = 0; y < 4; y++)
            for(int x = 0; x < 9; x++)
                banded.set(x, y, pattern[x] + 10.0f * y);

        final FloatRaster out = new RowNoise(false, 0).apply(banded);
        for(int y = 1; y < 4; y++)
            for(int x = 0; x < 9; x++)
                assertEquals(out.get(x, 0), out.get(x, y), 1e-6f);
        // median of the pattern is 0 so the minimum sits at the zeros and the max at the 3
        assertEquals(0.0f, out.get(0, 2), 1e-6f);
        assertEquals(1.0f, out.get(7, 2), 1e-6f);
    }

    @Test
    public void testDetrendRemovesLinearRamp() {
        // a linear ramp along the row is removed by a centered moving average away from the ends
        final FloatRaster ramp = new FloatRaster(40, 2);
        for(int y = 0; y < 2; y++)
            for(int x = 0; x < 40; x++)
                ramp.set(x, y, x * 0.5f);
        ramp.set(20, 1, 100.0f);

        final FloatRaster out = new RowNoise(true, 5).apply(ramp);
        assertEquals(out.get(10, 0), out.get(25, 0), 1e-6f);
    }

    @Test
    public void testBadWindow() {
        assertThrows(IllegalArgumentException.class, () -> new RowNoise(true, 0));
    }
}
