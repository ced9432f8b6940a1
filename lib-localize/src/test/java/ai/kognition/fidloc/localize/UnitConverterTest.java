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

import java.util.Random;

import org.junit.Test;
import org.opencv.core.Point;

public class UnitConverterTest {

    @Test
    public void testAxes() {
        final UnitConverter uc = new UnitConverter(100.0, 50.0, 4.0, 0.0);
        final Point p = uc.toPhysical(new Point(140.0, 30.0));
        assertEquals(10.0, p.x, 1e-12);
        // image rows grow downward, physical y grows upward
        assertEquals(5.0, p.y, 1e-12);
    }

    @Test
    public void testRoundTrip() {
        final Random rand = new Random(11);
        for(int i = 0; i < 200; i++) {
            final UnitConverter uc = new UnitConverter(rand.nextGaussian() * 500.0, rand.nextGaussian() * 500.0, 0.01 + rand.nextDouble() * 50.0,
                1.0);
            final Point px = new Point(rand.nextDouble() * 2000.0, rand.nextDouble() * 2000.0);
            final Point back = uc.toPixel(uc.toPhysical(px));
            assertEquals(px.x, back.x, 1e-9);
            assertEquals(px.y, back.y, 1e-9);
        }
    }

    @Test
    public void testCovariance() {
        final UnitConverter uc = new UnitConverter(0.0, 0.0, 2.0, 1.0);
        final double[][] cov = uc.toPhysical(new double[][] {{16.0,4.0},{4.0,8.0}});
        // J = diag(1/2, -1/2) flips the sign of the cross term
        assertEquals(4.0 + 1.0, cov[0][0], 1e-12);
        assertEquals(-1.0, cov[0][1], 1e-12);
        assertEquals(-1.0, cov[1][0], 1e-12);
        assertEquals(2.0 + 1.0, cov[1][1], 1e-12);
    }

    @Test
    public void testRejectsBadScale() {
        assertThrows(IllegalArgumentException.class, () -> new UnitConverter(0.0, 0.0, 0.0, 1.0));
        assertThrows(IllegalArgumentException.class, () -> new UnitConverter(0.0, 0.0, Double.NaN, 1.0));
    }
}
