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

/**
 * The matched window in reference image pixels, for drawing overlays.
 */
public final class MatchBox {
    public final int x;
    public final int y;
    public final int width;
    public final int height;

    public MatchBox(final int x, final int y, final int width, final int height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public static MatchBox centeredAt(final double cx, final double cy, final int width, final int height) {
        return new MatchBox(ValidRegion.windowOrigin(cx, width), ValidRegion.windowOrigin(cy, height), width, height);
    }

    public double centerX() {
        return x + width / 2.0;
    }

    public double centerY() {
        return y + height / 2.0;
    }

    @Override
    public String toString() {
        return "MatchBox [x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + "]";
    }
}
