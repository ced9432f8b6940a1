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

import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;

import ai.kognition.fidloc.image.CvMat;
import ai.kognition.fidloc.image.FloatRaster;

/**
 * <p>
 * A high-pass filter built from a <a href="https://docs.opencv.org/4.7.0/d4/d86/group__imgproc__filter.html#gaabe8c836e97159a9193fb0b11ac52cf1">Gaussian
 * blur</a>: the blurred (low-pass) image is subtracted from the original, leaving the fine detail.
 * </p>
 *
 * <p>
 * The Gaussian kernel is truncated at {@code 4 sigma} (radius {@code (int)(4 sigma + 0.5)}) and the
 * border is extrapolated by reflection ({@code d c b a | a b c d}). A {@code sigma} of zero makes the
 * filter the identity.
 * </p>
 */
public class HighPassFilter {
    public static final double TRUNCATE = 4.0;

    private final double sigma;

    static {
        CvMat.initOpenCv();
    }

    public HighPassFilter(final double sigma) {
        if(sigma < 0.0 || Double.isNaN(sigma))
            throw new IllegalArgumentException("The high-pass sigma can't be negative: " + sigma);
        this.sigma = sigma;
    }

    public double getSigma() {
        return sigma;
    }

    public int kernelRadius() {
        return (int)(TRUNCATE * sigma + 0.5);
    }

    /**
     * @return a new {@code CV_32F} image containing {@code src - blur(src)}. <b>Note: The caller owns the CvMat
     *         returned</b>
     */
    public CvMat apply(final Mat src) {
        if(sigma == 0.0)
            return CvMat.deepCopy(src);

        final int ksize = 2 * kernelRadius() + 1;
        try(CvMat blurred = new CvMat();
            CvMat ret = new CvMat();) {
            Imgproc.GaussianBlur(src, blurred, new Size(ksize, ksize), sigma, sigma, Core.BORDER_REFLECT);
            Core.subtract(src, blurred, ret);
            return ret.returnMe();
        }
    }

    public FloatRaster apply(final FloatRaster src) {
        if(sigma == 0.0)
            return new FloatRaster(src.width, src.height, src.data.clone());

        try(CvMat in = src.toMat();
            CvMat out = apply(in);) {
            return FloatRaster.fromMat(out);
        }
    }
}
