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
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgproc.Imgproc;

import ai.kognition.fidloc.image.CvMat;
import ai.kognition.fidloc.image.FloatRaster;

/**
 * 3x3 Sobel derivatives with a reflected border. The whole-image variant runs through OpenCV. The
 * windowed variant treats the window as if it were the whole image (its border is reflected from
 * inside the window rather than read from the surrounding pixels) which is what the orientation
 * histogram of a reference window needs in order to be comparable with the histogram of a template
 * computed in isolation.
 */
public class Gradients {

    static {
        CvMat.initOpenCv();
    }

    /**
     * @return a new {@code CV_32F} image of {@code hypot(dx, dy)}. <b>Note: The caller owns the CvMat returned</b>
     */
    public static CvMat magnitude(final Mat src) {
        try(CvMat gx = new CvMat();
            CvMat gy = new CvMat();
            CvMat ret = new CvMat();) {
            Imgproc.Sobel(src, gx, CvType.CV_32F, 1, 0, 3, 1.0, 0.0, Core.BORDER_REFLECT);
            Imgproc.Sobel(src, gy, CvType.CV_32F, 0, 1, 3, 1.0, 0.0, Core.BORDER_REFLECT);
            Core.magnitude(gx, gy, ret);
            return ret.returnMe();
        }
    }

    public static FloatRaster magnitude(final FloatRaster src) {
        try(CvMat in = src.toMat();
            CvMat mag = magnitude(in);) {
            return FloatRaster.fromMat(mag);
        }
    }

    /**
     * Visit every pixel of the {@code w X h} window at {@code (x0, y0)} with its horizontal and vertical
     * derivative, computed as if the window were the whole image.
     */
    public static void forEachInWindow(final FloatRaster img, final int x0, final int y0, final int w, final int h, final GradientConsumer consumer) {
        for(int r = 0; r < h; r++) {
            final int up = y0 + (r == 0 ? 0 : r - 1);
            final int mid = y0 + r;
            final int down = y0 + (r == h - 1 ? h - 1 : r + 1);
            for(int c = 0; c < w; c++) {
                final int left = x0 + (c == 0 ? 0 : c - 1);
                final int right = x0 + (c == w - 1 ? w - 1 : c + 1);

                final double gx = (img.get(right, up) + 2.0 * img.get(right, mid) + img.get(right, down))
                    - (img.get(left, up) + 2.0 * img.get(left, mid) + img.get(left, down));
                final double gy = (img.get(left, down) + 2.0 * img.get(x0 + c, down) + img.get(right, down))
                    - (img.get(left, up) + 2.0 * img.get(x0 + c, up) + img.get(right, up));
                consumer.accept(c, r, gx, gy);
            }
        }
    }

    @FunctionalInterface
    public static interface GradientConsumer {
        public void accept(int col, int row, double gx, double gy);
    }
}
