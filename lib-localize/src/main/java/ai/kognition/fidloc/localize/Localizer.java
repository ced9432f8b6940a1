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

import java.io.File;
import java.io.IOException;
import java.util.Random;

import org.apache.commons.io.FilenameUtils;
import org.opencv.core.Point;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.fidloc.image.FloatRaster;
import ai.kognition.fidloc.image.ImageFile;
import ai.kognition.fidloc.util.Timer;

/**
 * <p>
 * Locates tiles on one reference image. A {@link Localizer} holds an immutable {@link ReferenceContext} and
 * {@link LocalizerConfig} and can serve any number of requests. Each request runs:
 * </p>
 *
 * <ol>
 * <li>template preparation ({@link TemplatePreparer})</li>
 * <li>the particle filter ({@link ParticleFilter})</li>
 * <li>local refinement of the particle mean ({@link Refiner})</li>
 * <li>the mirror check ({@link MirrorDisambiguator})</li>
 * <li>confidence ({@link Confidence}) and conversion to physical units ({@link UnitConverter})</li>
 * </ol>
 *
 * <p>
 * The covariance reported is that of the particle cloud. The refined and possibly mirrored position only moves
 * the mean.
 * </p>
 */
public class Localizer {
    private static final Logger LOGGER = LoggerFactory.getLogger(Localizer.class);

    public final ReferenceContext context;
    public final LocalizerConfig config;

    private final TemplatePreparer preparer;
    private final UnitConverter units;

    public Localizer(final ReferenceContext context, final LocalizerConfig config) {
        this.context = context;
        this.config = config;
        this.preparer = new TemplatePreparer(config);
        this.units = UnitConverter.of(context, config);
    }

    /**
     * @throws ImageLoadException if the reference image can't be read.
     */
    public static Localizer load(final String referencePath, final LocalizerConfig config) {
        return new Localizer(ReferenceContext.load(referencePath, config), config);
    }

    public UnitConverter units() {
        return units;
    }

    /**
     * @throws ImageLoadException if the tile can't be read.
     * @throws TemplateTooSmallException if the rescaled tile is too small to match.
     * @throws LocalizationException if the rescaled tile doesn't fit in the reference image.
     */
    public PoseEstimate localize(final LocalizationRequest request) {
        final Timer timer = new Timer().start();
        final Template tpl = preparer.prepare(request.tilePath, context);
        final PoseEstimate ret = localize(tpl, request.random);
        timer.stop();

        LOGGER.info("Localized \"{}\" in {} seconds: {}", request.tilePath, timer, ret);

        if(request.writesDiagnostics())
            writeDiagnostics(request, tpl, ret.matchBox);
        return ret;
    }

    public PoseEstimate localize(final FloatRaster tile, final Random rand) {
        return localize(preparer.prepare(tile, context), rand);
    }

    private PoseEstimate localize(final Template tpl, final Random rand) {
        final ParticleFilter pf = new ParticleFilter(context, tpl, config);
        final ParticleFilter.Result result = pf.run(rand);
        final ValidRegion region = result.particles.region;

        final Point refined = new Refiner(pf.scorer(), region, config.refineRadius, config.refineStep).refine(result.mean);
        final MirrorDisambiguator.Decision decision = new MirrorDisambiguator(pf.scorer(), context).decide(refined);
        final double confidence = Confidence.estimate(result.particles, result.weights);

        final Point phys = units.toPhysical(decision.position);
        final double[][] cov = units.toPhysical(result.covariance);
        final MatchBox box = MatchBox.centeredAt(decision.position.x, decision.position.y, tpl.width(), tpl.height());

        LOGGER.debug("Particle mean ({}, {}) refined to ({}, {}), final ({}, {})", result.mean.x, result.mean.y, refined.x, refined.y,
            decision.position.x, decision.position.y);
        if(result.degenerateIterations > 0)
            LOGGER.warn("{} of {} iterations fell back to uniform weights", result.degenerateIterations, config.iterations);

        return new PoseEstimate(phys.x, phys.y, cov, confidence, decision.position, box, decision.mirrored, result.degenerateIterations);
    }

    private void writeDiagnostics(final LocalizationRequest request, final Template tpl, final MatchBox box) {
        final File dir = new File(request.outputDirectory);
        if(!dir.isDirectory() && !dir.mkdirs())
            throw new LocalizationException("Cannot create the diagnostics directory \"" + dir + "\"");

        final String base = FilenameUtils.getBaseName(request.tilePath);
        final String templateFile = new File(dir, base + "-template.png").getPath();
        final String matchFile = new File(dir, base + "-match.png").getPath();
        try {
            ImageFile.writeImageFile(tpl.image, templateFile);
            ImageFile.writeImageFile(context.features.gray.crop(box.x, box.y, box.width, box.height), matchFile);
        } catch(final IOException ioe) {
            throw new LocalizationException("Failed to write diagnostics for \"" + request.tilePath + "\" to \"" + dir + "\"", ioe);
        }
        LOGGER.debug("Wrote diagnostics {} and {}", templateFile, matchFile);
    }
}
