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

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.fidloc.image.FloatRaster;
import ai.kognition.fidloc.image.ImageFile;
import ai.kognition.fidloc.image.features.FeatureExtractor;
import ai.kognition.fidloc.image.features.FeatureMaps;
import ai.kognition.fidloc.image.features.Stats;

/**
 * <p>
 * Everything derived once from the reference image: its feature maps, the mask of "structured" pixels
 * (pixels whose gradient magnitude reaches the configured quantile of the whole image), and the
 * pixels-per-physical-unit calibration.
 * </p>
 *
 * <p>
 * A {@link ReferenceContext} is immutable after construction and can serve any number of tile requests,
 * from any number of threads.
 * </p>
 */
public final class ReferenceContext {
    private static final Logger LOGGER = LoggerFactory.getLogger(ReferenceContext.class);

    public final FeatureMaps features;
    public final int width;
    public final int height;
    public final double pxPerUnit;
    public final double structureThreshold;
    /**
     * Pixel position of the physical origin.
     */
    public final double originX;
    public final double originY;

    // summed area table of the structure mask, (width + 1) X (height + 1)
    private final int[] structureIntegral;

    private ReferenceContext(final FeatureMaps features, final double pxPerUnit, final double structureThreshold, final double originX,
        final double originY) {
        this.features = features;
        this.width = features.width();
        this.height = features.height();
        this.pxPerUnit = pxPerUnit;
        this.structureThreshold = structureThreshold;
        this.originX = originX;
        this.originY = originY;
        this.structureIntegral = integrate(features.magnitude, structureThreshold);
    }

    /**
     * Load the reference image and derive its context.
     *
     * @throws ImageLoadException if the image can't be read.
     */
    public static ReferenceContext load(final String referencePath, final LocalizerConfig config) {
        final FloatRaster gray;
        try {
            gray = ImageFile.readGrayFromFile(referencePath);
        } catch(final IOException ioe) {
            throw new ImageLoadException("Cannot load the reference image \"" + referencePath + "\"", ioe);
        }
        LOGGER.debug("Loaded reference image \"{}\" ({} X {})", referencePath, gray.width, gray.height);
        return build(gray, config);
    }

    public static ReferenceContext build(final FloatRaster gray, final LocalizerConfig config) {
        if(gray.width == 0 || gray.height == 0)
            throw new IllegalArgumentException("The reference image is empty");

        final FeatureMaps maps = new FeatureExtractor(config.highPassSigmaReference, config.histogramBins).extract(gray);
        final double threshold = Stats.quantile(maps.magnitude.data, config.structureQuantile);
        final double pxPerUnit = gray.height / config.effectiveReferenceHeightUnits();
        final double ox = config.hasOrigin() ? config.originX : gray.width / 2.0;
        final double oy = config.hasOrigin() ? config.originY : gray.height / 2.0;

        final ReferenceContext ret = new ReferenceContext(maps, pxPerUnit, threshold, ox, oy);
        LOGGER.debug("Reference context: {} X {}, {} px/unit, structure threshold {}, {} of pixels structured, origin ({}, {})", ret.width,
            ret.height, pxPerUnit, threshold, ret.structuredFraction(0, 0, ret.width, ret.height), ox, oy);
        return ret;
    }

    public double centerX() {
        return width / 2.0;
    }

    public double centerY() {
        return height / 2.0;
    }

    /**
     * Fraction of structured pixels in the {@code w X h} window at {@code (x0, y0)}. The window must be inside the image.
     */
    public double structuredFraction(final int x0, final int y0, final int w, final int h) {
        if(w <= 0 || h <= 0)
            return 0.0;
        final int stride = width + 1;
        final int count = structureIntegral[(y0 + h) * stride + (x0 + w)] - structureIntegral[y0 * stride + (x0 + w)]
            - structureIntegral[(y0 + h) * stride + x0] + structureIntegral[y0 * stride + x0];
        return (double)count / ((double)w * h);
    }

    private static int[] integrate(final FloatRaster magnitude, final double threshold) {
        final int w = magnitude.width;
        final int h = magnitude.height;
        final int stride = w + 1;
        final int[] ret = new int[stride * (h + 1)];
        for(int y = 0; y < h; y++) {
            int rowSum = 0;
            for(int x = 0; x < w; x++) {
                if(magnitude.get(x, y) >= threshold)
                    rowSum++;
                ret[(y + 1) * stride + (x + 1)] = ret[y * stride + (x + 1)] + rowSum;
            }
        }
        return ret;
    }
}
