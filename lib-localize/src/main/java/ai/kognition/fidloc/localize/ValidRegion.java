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
 * The set of window centers for which a {@code tw X th} window lies entirely inside a {@code W X H} image:
 * {@code [tw/2, W - tw/2] X [th/2, H - th/2]}. Rounding a center from this region to a window origin
 * always yields an in-bounds window.
 */
public final class ValidRegion {
    public final double minX;
    public final double maxX;
    public final double minY;
    public final double maxY;
    public final int windowWidth;
    public final int windowHeight;

    public ValidRegion(final int imageWidth, final int imageHeight, final int windowWidth, final int windowHeight) {
        if(windowWidth > imageWidth || windowHeight > imageHeight)
            throw new LocalizationException("A " + windowWidth + " X " + windowHeight + " template doesn't fit inside the " + imageWidth + " X "
                + imageHeight + " reference image");
        this.windowWidth = windowWidth;
        this.windowHeight = windowHeight;
        this.minX = windowWidth / 2.0;
        this.maxX = imageWidth - windowWidth / 2.0;
        this.minY = windowHeight / 2.0;
        this.maxY = imageHeight - windowHeight / 2.0;
    }

    public double clipX(final double x) {
        return x < minX ? minX : (x > maxX ? maxX : x);
    }

    public double clipY(final double y) {
        return y < minY ? minY : (y > maxY ? maxY : y);
    }

    /**
     * Column of the window's left edge for a window centered at {@code x}.
     */
    public int originX(final double x) {
        return windowOrigin(x, windowWidth);
    }

    /**
     * Row of the window's top edge for a window centered at {@code y}.
     */
    public int originY(final double y) {
        return windowOrigin(y, windowHeight);
    }

    public static int windowOrigin(final double center, final int size) {
        return (int)Math.round(center - size / 2.0);
    }
}
