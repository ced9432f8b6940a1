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

package ai.kognition.fidloc.image;

import org.opencv.core.CvType;
import org.opencv.core.Mat;

/**
 * <p>
 * A single channel, row-major, {@code float} pixel buffer living on the Java heap. Window arithmetic
 * (patch statistics, histograms, correlation) is done against one of these so that a scoring loop
 * doesn't cross into native code for every small patch.
 * </p>
 *
 * <p>
 * Pixel {@code (x, y)} is column {@code x}, row {@code y}. Instances are effectively immutable once
 * handed out; the backing array is exposed for speed and must not be written by callers that
 * don't own it.
 * </p>
 */
public class FloatRaster {
    public final int width;
    public final int height;
    public final float[] data;

    public FloatRaster(final int width, final int height) {
        this(width, height, new float[width * height]);
    }

    public FloatRaster(final int width, final int height, final float[] data) {
        if(width < 0 || height < 0)
            throw new IllegalArgumentException("Raster dimensions can't be negative: " + width + " X " + height);
        if(data.length != width * height)
            throw new IllegalArgumentException("Raster data has " + data.length + " elements but " + width + " X " + height + " was expected");
        this.width = width;
        this.height = height;
        this.data = data;
    }

    public float get(final int x, final int y) {
        return data[y * width + x];
    }

    public void set(final int x, final int y, final float v) {
        data[y * width + x] = v;
    }

    public int size() {
        return data.length;
    }

    /**
     * @return true if the {@code w X h} window with its top-left corner at {@code (x0, y0)} lies entirely in the raster.
     */
    public boolean contains(final int x0, final int y0, final int w, final int h) {
        return x0 >= 0 && y0 >= 0 && x0 + w <= width && y0 + h <= height;
    }

    /**
     * Copy out the {@code w X h} window whose top-left corner is at {@code (x0, y0)}.
     */
    public FloatRaster crop(final int x0, final int y0, final int w, final int h) {
        if(!contains(x0, y0, w, h))
            throw new IndexOutOfBoundsException("Window [" + x0 + ", " + y0 + ", " + w + ", " + h + "] isn't inside a " + width + " X " + height + " raster");
        final float[] ret = new float[w * h];
        for(int r = 0; r < h; r++)
            System.arraycopy(data, (y0 + r) * width + x0, ret, r * w, w);
        return new FloatRaster(w, h, ret);
    }

    /**
     * Copy the contents of a single channel {@code Mat} into a new {@link FloatRaster}. Any depth is
     * accepted; non-float data is converted without scaling.
     */
    public static FloatRaster fromMat(final Mat mat) {
        if(mat.channels() != 1)
            throw new IllegalArgumentException("Can only build a " + FloatRaster.class.getSimpleName() + " from a single channel Mat. This one has "
                + mat.channels());

        final FloatRaster ret = new FloatRaster(mat.cols(), mat.rows());
        if(mat.type() == CvType.CV_32FC1 && mat.isContinuous())
            mat.get(0, 0, ret.data);
        else {
            try(CvMat tmp = new CvMat();) {
                mat.convertTo(tmp, CvType.CV_32F);
                tmp.get(0, 0, ret.data);
            }
        }
        return ret;
    }

    /**
     * @return a new {@code CV_32FC1} {@link CvMat} holding a copy of this raster. <b>Note: The caller owns the CvMat
     *         returned</b>
     */
    public CvMat toMat() {
        try(CvMat ret = new CvMat(height, width, CvType.CV_32FC1);) {
            if(data.length > 0)
                ret.put(0, 0, data);
            return ret.returnMe();
        }
    }
}
