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

import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.fidloc.image.CvMat;
import ai.kognition.fidloc.image.FloatRaster;
import ai.kognition.fidloc.image.ImageFile;
import ai.kognition.fidloc.image.features.FeatureExtractor;
import ai.kognition.fidloc.image.features.FeatureMaps;
import ai.kognition.fidloc.image.features.RowNoise;

/**
 * <p>
 * Turns a raw probe tile into a {@link Template}: optional row-noise correction, then a bilinear resize so
 * that the tile's pixel size matches the reference image's.
 * </p>
 *
 * <p>
 * The tile is taken to span {@link LocalizerConfig#tileHeightUnits} vertically, so after the resize its height
 * is {@code tileHeightUnits * pxPerUnit} reference pixels. Scale factors within {@value #IDENTITY_TOLERANCE}
 * of one are treated as no resize at all.
 * </p>
 */
public class TemplatePreparer {
    private static final Logger LOGGER = LoggerFactory.getLogger(TemplatePreparer.class);

    public static final double IDENTITY_TOLERANCE = 1.0e-6;

    static {
        CvMat.initOpenCv();
    }

    private final LocalizerConfig config;

    public TemplatePreparer(final LocalizerConfig config) {
        this.config = config;
    }

    /**
     * @throws ImageLoadException if the tile can't be read.
     * @throws TemplateTooSmallException if the rescaled tile is smaller than the configured minimum in either dimension.
     */
    public Template prepare(final String tilePath, final ReferenceContext ctx) {
        final FloatRaster raw;
        try {
            raw = ImageFile.readGrayFromFile(tilePath);
        } catch(final IOException ioe) {
            throw new ImageLoadException("Cannot load the tile \"" + tilePath + "\"", ioe);
        }
        return prepare(raw, ctx);
    }

    /**
     * @throws TemplateTooSmallException if the rescaled tile is smaller than the configured minimum in either dimension.
     */
    public Template prepare(final FloatRaster raw, final ReferenceContext ctx) {
        final double scale = scaleFactor(raw.height, ctx);
        final boolean identity = Math.abs(scale - 1.0) < IDENTITY_TOLERANCE;
        final int tw = identity ? raw.width : (int)Math.round(raw.width * scale);
        final int th = identity ? raw.height : (int)Math.round(raw.height * scale);
        if(tw < config.minTemplateSize || th < config.minTemplateSize)
            throw new TemplateTooSmallException(tw, th, config.minTemplateSize);

        final FloatRaster corrected = config.rowNoiseCorrection ? new RowNoise(config.rowDetrend, config.rowWindow).apply(raw) : raw;
        final FloatRaster tpl = identity ? corrected : resize(corrected, tw, th);

        LOGGER.debug("Template {} X {} -> {} X {} (scale {})", raw.width, raw.height, tw, th, scale);

        final FeatureMaps maps = new FeatureExtractor(config.highPassSigmaTemplate, config.histogramBins).extract(tpl);
        return new Template(tpl, maps.highPass, maps.orientationHistogram(), config.weightMagnitude > 0.0 ? maps.magnitude : null, scale);
    }

    /**
     * The factor that brings a tile {@code rawHeight} pixels tall to the reference image's pixel size.
     */
    public double scaleFactor(final int rawHeight, final ReferenceContext ctx) {
        final double tilePxPerUnit = rawHeight / config.tileHeightUnits;
        return ctx.pxPerUnit / tilePxPerUnit;
    }

    private static FloatRaster resize(final FloatRaster src, final int w, final int h) {
        try(CvMat in = src.toMat();
            CvMat out = new CvMat();) {
            Imgproc.resize(in, out, new Size(w, h), 0.0, 0.0, Imgproc.INTER_LINEAR);
            return FloatRaster.fromMat(out);
        }
    }
}
