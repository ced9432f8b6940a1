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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.fidloc.image.FloatRaster;

/**
 * Turns a grayscale image into the {@link FeatureMaps} used for matching: a Gaussian high-pass image,
 * a Sobel gradient magnitude image and a windowed unsigned orientation histogram.
 */
public class FeatureExtractor {
    private static final Logger LOGGER = LoggerFactory.getLogger(FeatureExtractor.class);

    private final HighPassFilter highPass;
    private final OrientationHistogram histogram;

    public FeatureExtractor(final double highPassSigma, final int histogramBins) {
        this.highPass = new HighPassFilter(highPassSigma);
        this.histogram = new OrientationHistogram(histogramBins);
    }

    public FeatureMaps extract(final FloatRaster gray) {
        LOGGER.trace("Extracting features from a {} X {} image (sigma={}, bins={})", gray.width, gray.height, highPass.getSigma(),
            histogram.getBins());
        return new FeatureMaps(gray, highPass.apply(gray), Gradients.magnitude(gray), histogram);
    }
}
