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
import java.util.Properties;

import ai.kognition.fidloc.util.PropertiesUtils;

/**
 * <p>
 * Immutable set of parameters for the localizer. Construct one with {@link #builder()} or load it from a
 * properties file with {@link #load(String)}. Every option has a default so an empty properties file (or
 * {@code builder().build()}) is a valid configuration.
 * </p>
 *
 * <p>
 * Properties are read from the {@value #SECTION} section, for example:
 * </p>
 *
 * <pre>
 * localizer.tile-height=50.0
 * localizer.particles=7500
 * localizer.weight.highpass=0.55
 * </pre>
 */
public final class LocalizerConfig {
    public static final String SECTION = "localizer";

    /**
     * Physical height of the tile, in calibration units (micrometers on the instrument).
     */
    public final double tileHeightUnits;
    /**
     * Physical height of the whole reference image. {@code NaN} means the same as {@link #tileHeightUnits}.
     */
    public final double referenceHeightUnits;

    public final int particleCount;
    public final int iterations;
    public final double stepPx;
    public final double softmaxGain;

    public final double structureQuantile;
    public final double minStructureFraction;

    public final double weightHighPass;
    public final double weightHistogram;
    public final double weightMagnitude;
    public final int histogramBins;

    public final int refineRadius;
    public final int refineStep;

    public final boolean rowNoiseCorrection;
    public final boolean rowDetrend;
    public final int rowWindow;

    public final double highPassSigmaTemplate;
    public final double highPassSigmaReference;

    public final int seedCount;
    public final double seedStdPx;
    public final double seedFraction;

    public final int minTemplateSize;

    /**
     * Pixel position of the physical origin on the reference image. {@code NaN} means the image center.
     */
    public final double originX;
    public final double originY;
    /**
     * Added to the diagonal of the physical covariance (units squared).
     */
    public final double measurementNoise;

    private LocalizerConfig(final Builder b) {
        tileHeightUnits = b.tileHeightUnits;
        referenceHeightUnits = b.referenceHeightUnits;
        particleCount = b.particleCount;
        iterations = b.iterations;
        stepPx = b.stepPx;
        softmaxGain = b.softmaxGain;
        structureQuantile = b.structureQuantile;
        minStructureFraction = b.minStructureFraction;
        weightHighPass = b.weightHighPass;
        weightHistogram = b.weightHistogram;
        weightMagnitude = b.weightMagnitude;
        histogramBins = b.histogramBins;
        refineRadius = b.refineRadius;
        refineStep = b.refineStep;
        rowNoiseCorrection = b.rowNoiseCorrection;
        rowDetrend = b.rowDetrend;
        rowWindow = b.rowWindow;
        highPassSigmaTemplate = b.highPassSigmaTemplate;
        highPassSigmaReference = b.highPassSigmaReference;
        seedCount = b.seedCount;
        seedStdPx = b.seedStdPx;
        seedFraction = b.seedFraction;
        minTemplateSize = b.minTemplateSize;
        originX = b.originX;
        originY = b.originY;
        measurementNoise = b.measurementNoise;
    }

    /**
     * The physical height the whole reference image spans.
     */
    public double effectiveReferenceHeightUnits() {
        return Double.isNaN(referenceHeightUnits) ? tileHeightUnits : referenceHeightUnits;
    }

    public boolean hasOrigin() {
        return !Double.isNaN(originX) && !Double.isNaN(originY);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * A builder preloaded with this configuration's values.
     */
    public Builder toBuilder() {
        return new Builder()
            .tileHeightUnits(tileHeightUnits)
            .referenceHeightUnits(referenceHeightUnits)
            .particleCount(particleCount)
            .iterations(iterations)
            .stepPx(stepPx)
            .softmaxGain(softmaxGain)
            .structureQuantile(structureQuantile)
            .minStructureFraction(minStructureFraction)
            .weights(weightHighPass, weightHistogram, weightMagnitude)
            .histogramBins(histogramBins)
            .refine(refineRadius, refineStep)
            .rowNoise(rowNoiseCorrection, rowDetrend, rowWindow)
            .highPassSigmas(highPassSigmaTemplate, highPassSigmaReference)
            .seeds(seedCount, seedStdPx, seedFraction)
            .minTemplateSize(minTemplateSize)
            .origin(originX, originY)
            .measurementNoise(measurementNoise);
    }

    public static LocalizerConfig load(final String fname) throws IOException {
        return fromProperties(PropertiesUtils.loadProps(fname));
    }

    /**
     * Read the {@value #SECTION} section of the given properties. Missing keys take their default.
     *
     * @throws IllegalArgumentException if a value can't be parsed or is out of range.
     */
    public static LocalizerConfig fromProperties(final Properties props) {
        final Properties p = PropertiesUtils.getSection(props, SECTION, true);
        final LocalizerConfig d = builder().build();

        return builder()
            .tileHeightUnits(PropertiesUtils.getDouble(p, "tile-height", d.tileHeightUnits))
            .referenceHeightUnits(PropertiesUtils.getDouble(p, "reference-height", d.referenceHeightUnits))
            .particleCount(PropertiesUtils.getInt(p, "particles", d.particleCount))
            .iterations(PropertiesUtils.getInt(p, "iterations", d.iterations))
            .stepPx(PropertiesUtils.getDouble(p, "step-px", d.stepPx))
            .softmaxGain(PropertiesUtils.getDouble(p, "softmax-gain", d.softmaxGain))
            .structureQuantile(PropertiesUtils.getDouble(p, "structure-quantile", d.structureQuantile))
            .minStructureFraction(PropertiesUtils.getDouble(p, "min-structure-fraction", d.minStructureFraction))
            .weights(PropertiesUtils.getDouble(p, "weight.highpass", d.weightHighPass),
                PropertiesUtils.getDouble(p, "weight.histogram", d.weightHistogram),
                PropertiesUtils.getDouble(p, "weight.magnitude", d.weightMagnitude))
            .histogramBins(PropertiesUtils.getInt(p, "histogram-bins", d.histogramBins))
            .refine(PropertiesUtils.getInt(p, "refine.radius", d.refineRadius), PropertiesUtils.getInt(p, "refine.step", d.refineStep))
            .rowNoise(PropertiesUtils.getBoolean(p, "row-noise.enabled", d.rowNoiseCorrection),
                PropertiesUtils.getBoolean(p, "row-noise.detrend", d.rowDetrend),
                PropertiesUtils.getInt(p, "row-noise.window", d.rowWindow))
            .highPassSigmas(PropertiesUtils.getDouble(p, "highpass.sigma.template", d.highPassSigmaTemplate),
                PropertiesUtils.getDouble(p, "highpass.sigma.reference", d.highPassSigmaReference))
            .seeds(PropertiesUtils.getInt(p, "seed.count", d.seedCount), PropertiesUtils.getDouble(p, "seed.std-px", d.seedStdPx),
                PropertiesUtils.getDouble(p, "seed.fraction", d.seedFraction))
            .minTemplateSize(PropertiesUtils.getInt(p, "min-template-size", d.minTemplateSize))
            .origin(PropertiesUtils.getDouble(p, "origin.x", d.originX), PropertiesUtils.getDouble(p, "origin.y", d.originY))
            .measurementNoise(PropertiesUtils.getDouble(p, "measurement-noise", d.measurementNoise))
            .build();
    }

    @Override
    public String toString() {
        return "LocalizerConfig [tileHeightUnits=" + tileHeightUnits + ", referenceHeightUnits=" + referenceHeightUnits + ", particleCount="
            + particleCount + ", iterations=" + iterations + ", stepPx=" + stepPx + ", softmaxGain=" + softmaxGain + ", structureQuantile="
            + structureQuantile + ", minStructureFraction=" + minStructureFraction + ", weights=(" + weightHighPass + ", " + weightHistogram
            + ", " + weightMagnitude + "), histogramBins=" + histogramBins + ", refine=(" + refineRadius + ", " + refineStep + "), rowNoise=("
            + rowNoiseCorrection + ", " + rowDetrend + ", " + rowWindow + "), highPassSigmas=(" + highPassSigmaTemplate + ", "
            + highPassSigmaReference + "), seeds=(" + seedCount + ", " + seedStdPx + ", " + seedFraction + "), minTemplateSize="
            + minTemplateSize + ", origin=(" + originX + ", " + originY + "), measurementNoise=" + measurementNoise + "]";
    }

    public static class Builder {
        private double tileHeightUnits = 50.0;
        private double referenceHeightUnits = Double.NaN;
        private int particleCount = 7500;
        private int iterations = 25;
        private double stepPx = 1.0;
        private double softmaxGain = 20.0;
        private double structureQuantile = 0.55;
        private double minStructureFraction = 0.25;
        private double weightHighPass = 0.55;
        private double weightHistogram = 0.35;
        private double weightMagnitude = 0.10;
        private int histogramBins = 16;
        private int refineRadius = 8;
        private int refineStep = 1;
        private boolean rowNoiseCorrection = true;
        private boolean rowDetrend = true;
        private int rowWindow = 51;
        private double highPassSigmaTemplate = 2.0;
        private double highPassSigmaReference = 2.0;
        private int seedCount = 10;
        private double seedStdPx = 12.0;
        private double seedFraction = 0.8;
        private int minTemplateSize = 8;
        private double originX = Double.NaN;
        private double originY = Double.NaN;
        private double measurementNoise = 1.0;

        private Builder() {}

        public Builder tileHeightUnits(final double tileHeightUnits) {
            this.tileHeightUnits = tileHeightUnits;
            return this;
        }

        public Builder referenceHeightUnits(final double referenceHeightUnits) {
            this.referenceHeightUnits = referenceHeightUnits;
            return this;
        }

        public Builder particleCount(final int particleCount) {
            this.particleCount = particleCount;
            return this;
        }

        public Builder iterations(final int iterations) {
            this.iterations = iterations;
            return this;
        }

        public Builder stepPx(final double stepPx) {
            this.stepPx = stepPx;
            return this;
        }

        public Builder softmaxGain(final double softmaxGain) {
            this.softmaxGain = softmaxGain;
            return this;
        }

        public Builder structureQuantile(final double structureQuantile) {
            this.structureQuantile = structureQuantile;
            return this;
        }

        public Builder minStructureFraction(final double minStructureFraction) {
            this.minStructureFraction = minStructureFraction;
            return this;
        }

        public Builder weights(final double highPass, final double histogram, final double magnitude) {
            this.weightHighPass = highPass;
            this.weightHistogram = histogram;
            this.weightMagnitude = magnitude;
            return this;
        }

        public Builder histogramBins(final int histogramBins) {
            this.histogramBins = histogramBins;
            return this;
        }

        public Builder refine(final int radius, final int step) {
            this.refineRadius = radius;
            this.refineStep = step;
            return this;
        }

        public Builder rowNoise(final boolean enabled, final boolean detrend, final int window) {
            this.rowNoiseCorrection = enabled;
            this.rowDetrend = detrend;
            this.rowWindow = window;
            return this;
        }

        public Builder highPassSigmas(final double template, final double reference) {
            this.highPassSigmaTemplate = template;
            this.highPassSigmaReference = reference;
            return this;
        }

        public Builder seeds(final int count, final double stdPx, final double fraction) {
            this.seedCount = count;
            this.seedStdPx = stdPx;
            this.seedFraction = fraction;
            return this;
        }

        public Builder minTemplateSize(final int minTemplateSize) {
            this.minTemplateSize = minTemplateSize;
            return this;
        }

        public Builder origin(final double x, final double y) {
            this.originX = x;
            this.originY = y;
            return this;
        }

        public Builder measurementNoise(final double measurementNoise) {
            this.measurementNoise = measurementNoise;
            return this;
        }

        /**
         * @throws IllegalArgumentException if any option is out of range.
         */
        public LocalizerConfig build() {
            positive("tile height", tileHeightUnits);
            if(!Double.isNaN(referenceHeightUnits))
                positive("reference height", referenceHeightUnits);
            atLeast("particle count", particleCount, 1);
            atLeast("iteration count", iterations, 1);
            nonNegative("step", stepPx);
            nonNegative("softmax gain", softmaxGain);
            unitInterval("structure quantile", structureQuantile);
            unitInterval("minimum structure fraction", minStructureFraction);
            nonNegative("high-pass weight", weightHighPass);
            nonNegative("histogram weight", weightHistogram);
            nonNegative("magnitude weight", weightMagnitude);
            atLeast("histogram bin count", histogramBins, 1);
            atLeast("refine radius", refineRadius, 0);
            atLeast("refine step", refineStep, 1);
            atLeast("row noise window", rowWindow, 1);
            nonNegative("template high-pass sigma", highPassSigmaTemplate);
            nonNegative("reference high-pass sigma", highPassSigmaReference);
            atLeast("seed count", seedCount, 0);
            nonNegative("seed standard deviation", seedStdPx);
            unitInterval("seed fraction", seedFraction);
            atLeast("minimum template size", minTemplateSize, 1);
            if(Double.isNaN(originX) != Double.isNaN(originY))
                throw new IllegalArgumentException("Either both or neither of the origin coordinates need to be set. Got (" + originX + ", " + originY
                    + ")");
            if(Double.isInfinite(originX) || Double.isInfinite(originY))
                throw new IllegalArgumentException("The origin must be finite. Got (" + originX + ", " + originY + ")");
            nonNegative("measurement noise", measurementNoise);
            return new LocalizerConfig(this);
        }

        private static void positive(final String name, final double v) {
            if(!(v > 0.0) || Double.isInfinite(v))
                throw new IllegalArgumentException("The " + name + " must be positive and finite but was " + v);
        }

        private static void nonNegative(final String name, final double v) {
            if(!(v >= 0.0) || Double.isInfinite(v))
                throw new IllegalArgumentException("The " + name + " must be non-negative and finite but was " + v);
        }

        private static void unitInterval(final String name, final double v) {
            if(!(v >= 0.0 && v <= 1.0))
                throw new IllegalArgumentException("The " + name + " must be in [0, 1] but was " + v);
        }

        private static void atLeast(final String name, final int v, final int min) {
            if(v < min)
                throw new IllegalArgumentException("The " + name + " must be at least " + min + " but was " + v);
        }
    }
}
