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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class ValidRegionTest {

    @Test
    public void testBounds() {
        final ValidRegion r = new ValidRegion(100, 80, 21, 10);
        assertEquals(10.5, r.minX, 0.0);
        assertEquals(89.5, r.maxX, 0.0);
        assertEquals(5.0, r.minY, 0.0);
        assertEquals(75.0, r.maxY, 0.0);

        // every center in the region puts the whole window inside the image
        for(double x = r.minX; x <= r.maxX; x += 0.25) {
            assertTrue(r.originX(x) >= 0);
            assertTrue(r.originX(x) + 21 <= 100);
        }
        for(double y = r.minY; y <= r.maxY; y += 0.25) {
            assertTrue(r.originY(y) >= 0);
            assertTrue(r.originY(y) + 10 <= 80);
        }
    }

    @Test
    public void testClip() {
        final ValidRegion r = new ValidRegion(100, 80, 20, 10);
        assertEquals(10.0, r.clipX(-3.0), 0.0);
        assertEquals(90.0, r.clipX(1000.0), 0.0);
        assertEquals(42.5, r.clipX(42.5), 0.0);
        assertEquals(5.0, r.clipY(0.0), 0.0);
        assertTrue(Synthetic.inside(r, r.clipX(-3.0), r.clipY(500.0)));
        assertFalse(Synthetic.inside(r, 9.99, 40.0));
    }

    @Test
    public void testWholeImageWindow() {
        final ValidRegion r = new ValidRegion(30, 20, 30, 20);
        assertEquals(15.0, r.clipX(0.0), 0.0);
        assertEquals(15.0, r.clipX(99.0), 0.0);
        assertEquals(0, r.originX(15.0));
    }

    @Test
    public void testTooLarge() {
        assertThrows(LocalizationException.class, () -> new ValidRegion(30, 20, 31, 20));
        assertThrows(LocalizationException.class, () -> new ValidRegion(30, 20, 10, 21));
    }
}
