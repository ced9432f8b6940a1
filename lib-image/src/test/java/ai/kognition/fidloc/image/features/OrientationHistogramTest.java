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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import ai.kognition.fidloc.image.FloatRaster;
import ai.kognition.fidloc.image.UtilsForTesting;

public class OrientationHistogramTest {

    @Test
    public void testFlatImageGivesZeroHistogram() {
        final OrientationHistogram oh = new OrientationHistogram(16);
        final double[] h = oh.compute(UtilsForTesting.constant(20, 20, 0.3f));
        assertEquals(16, h.length);
        for(final double v: h)
            assertEquals(0.0, v, 0.0);
    }

    @Test
    public void testNormalized() {
        final OrientationHistogram oh = new OrientationHistogram(16);
        final double[] h = oh.compute(UtilsForTesting.texture(40, 30, 11L));
        double sum2 = 0.0;
        for(final double v: h) {
            assertTrue(v >= 0.0);
            sum2 += v * v;
        }
        assertEquals(1.0, sum2, 1e-9);
        assertEquals(1.0, OrientationHistogram.similarity(h, h), 1e-9);
    }

    @Test
    public void testRotationUnsigned() {
        final OrientationHistogram oh = new OrientationHistogram(16);
        final FloatRaster img = UtilsForTesting.texture(50, 40, 5L);
        final FloatRaster rotated = UtilsForTesting.rotate180(img);

        assertArrayEquals(oh.compute(img), oh.compute(rotated), 1e-9);

        // a window and the rotated copy's window at the mirrored location
        final int x0 = 7, y0 = 12, w = 20, h = 15;
        final double[] a = oh.compute(img, x0, y0, w, h);
        final double[] b = oh.compute(rotated, img.width - x0 - w, img.height - y0 - h, w, h);
        assertArrayEquals(a, b, 1e-9);
    }

    @Test
    public void testPolarityIgnored() {
        final OrientationHistogram oh = new OrientationHistogram(8);
        final FloatRaster img = UtilsForTesting.texture(30, 30, 9L);
        final FloatRaster inverted = new FloatRaster(img.width, img.height);
        for(int i = 0; i < img.data.length; i++)
            inverted.data[i] = 1.0f - img.data[i];
        assertArrayEquals(oh.compute(img), oh.compute(inverted), 1e-6);
    }

    @Test
    public void testVerticalEdgeLandsInFirstBin() {
        final FloatRaster img = new FloatRaster(10, 10);
        for(int y = 0; y < 10; y++)
            for(int x = 5; x < 10; x++)
                img.set(x, y, 1.0f);
        final double[] h = new OrientationHistogram(4).compute(img);
        assertEquals(1.0, h[0], 1e-9);
        assertEquals(0.0, h[1], 1e-9);
    }

    @Test
    public void testWindowMatchesCrop() {
        final OrientationHistogram oh = new OrientationHistogram(16);
        final FloatRaster img = UtilsForTesting.texture(60, 60, 13L);
        assertArrayEquals(oh.compute(img.crop(10, 20, 25, 18)), oh.compute(img, 10, 20, 25, 18), 1e-12);
    }

    @Test
    public void testBadBins() {
        assertThrows(IllegalArgumentException.class, () -> new OrientationHistogram(0));
        assertThrows(IllegalArgumentException.class, () -> OrientationHistogram.similarity(new double[2], new double[3]));
    }
}
