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

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

import org.opencv.core.Core;
import org.opencv.core.Scalar;
import org.opencv.imgproc.Imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.fidloc.image.CvMat;
import ai.kognition.fidloc.image.FloatRaster;

/**
 * <p>
 * Finds starting points for the particle filter from a normalized cross-correlation map between the
 * reference's high-pass image and the template's high-pass image.
 * </p>
 *
 * <p>
 * The reference is zero padded so the map has one entry per reference pixel, each entry being the
 * correlation of the template centered on that pixel. The {@code k} largest finite entries become seeds.
 * No minimum separation is enforced between them, so neighbouring pixels of one strong peak can take
 * several of the {@code k} slots.
 * </p>
 */
public class SeedFinder {
    private static final Logger LOGGER = LoggerFactory.getLogger(SeedFinder.class);

    static {
        CvMat.initOpenCv();
    }

    private final int k;

    public SeedFinder(final int k) {
        this.k = k;
    }

    public List<Seed> find(final FloatRaster referenceHighPass, final FloatRaster templateHighPass) {
        if(k <= 0)
            return new ArrayList<>();

        final FloatRaster corr = correlationMap(referenceHighPass, templateHighPass);
        final int tw = templateHighPass.width;
        final int th = templateHighPass.height;
        // map index (c, r) is the window whose top-left corner is (c - tw / 2, r - th / 2)
        final double dx = tw / 2.0 - tw / 2;
        final double dy = th / 2.0 - th / 2;

        final PriorityQueue<Integer> best = new PriorityQueue<>(k + 1, Comparator.comparingDouble(i -> corr.data[i]));
        for(int i = 0; i < corr.data.length; i++) {
            final float v = corr.data[i];
            if(!Float.isFinite(v))
                continue;
            if(best.size() < k)
                best.add(i);
            else if(v > corr.data[best.peek()]) {
                best.poll();
                best.add(i);
            }
        }

        final List<Seed> ret = new ArrayList<>(best.size());
        while(!best.isEmpty()) {
            final int i = best.poll();
            ret.add(0, new Seed((i % corr.width) + dx, (i / corr.width) + dy, corr.data[i]));
        }

        if(LOGGER.isDebugEnabled())
            LOGGER.debug("Found {} seeds. Best: {}", ret.size(), ret.isEmpty() ? "none" : ret.get(0));
        return ret;
    }

    /**
     * Zero padded {@code TM_CCOEFF_NORMED} correlation, the same size as the reference.
     */
    public static FloatRaster correlationMap(final FloatRaster referenceHighPass, final FloatRaster templateHighPass) {
        final int tw = templateHighPass.width;
        final int th = templateHighPass.height;
        try(CvMat ref = referenceHighPass.toMat();
            CvMat tpl = templateHighPass.toMat();
            CvMat padded = new CvMat();
            CvMat result = new CvMat();) {
            Core.copyMakeBorder(ref, padded, th / 2, th - 1 - th / 2, tw / 2, tw - 1 - tw / 2, Core.BORDER_CONSTANT, new Scalar(0.0));
            Imgproc.matchTemplate(padded, tpl, result, Imgproc.TM_CCOEFF_NORMED);
            return FloatRaster.fromMat(result);
        }
    }
}
