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

import ai.kognition.fidloc.image.FloatRaster;

/**
 * The derived representations of a grayscale image that window scoring reads from.
 */
public class FeatureMaps {
    public final FloatRaster gray;
    public final FloatRaster highPass;
    public final FloatRaster magnitude;
    private final OrientationHistogram histogram;

    FeatureMaps(final FloatRaster gray, final FloatRaster highPass, final FloatRaster magnitude, final OrientationHistogram histogram) {
        this.gray = gray;
        this.highPass = highPass;
        this.magnitude = magnitude;
        this.histogram = histogram;
    }

    public int width() {
        return gray.width;
    }

    public int height() {
        return gray.height;
    }

    /**
     * The orientation histogram of the given window of the gray image, computed as though the
     * window were an image on its own.
     */
    public double[] orientationHistogram(final int x0, final int y0, final int w, final int h) {
        return histogram.compute(gray, x0, y0, w, h);
    }

    public double[] orientationHistogram() {
        return histogram.compute(gray);
    }
}
