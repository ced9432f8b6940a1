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

import ai.kognition.fidloc.image.FloatRaster;
import ai.kognition.fidloc.image.features.Zncc;

/**
 * The probe tile after preparation, together with the descriptors that every window of the reference is
 * compared against. Built per request by {@link TemplatePreparer}.
 */
public final class Template {
    public final FloatRaster image;
    public final FloatRaster highPass;
    public final float[] highPassNorm;
    public final double[] histogram;
    /**
     * {@code null} when the magnitude term is disabled.
     */
    public final float[] magnitudeNorm;
    /**
     * The factor the raw tile was resized by.
     */
    public final double scale;

    Template(final FloatRaster image, final FloatRaster highPass, final double[] histogram, final FloatRaster magnitude, final double scale) {
        this.image = image;
        this.highPass = highPass;
        this.highPassNorm = Zncc.normalize(highPass);
        this.histogram = histogram;
        this.magnitudeNorm = magnitude == null ? null : Zncc.normalize(magnitude);
        this.scale = scale;
    }

    public int width() {
        return image.width;
    }

    public int height() {
        return image.height;
    }
}
