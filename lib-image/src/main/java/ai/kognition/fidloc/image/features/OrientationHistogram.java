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

import ai.kognition.fidloc.image.FloatRaster;

/**
 * <p>
 * A magnitude weighted histogram of unsigned gradient orientations. The orientation of a pixel is
 * {@code atan2(|dy|, |dx|)} so the polarity of an edge is discarded: a dark-on-light edge and a
 * light-on-dark edge with the same direction land in the same bin, as do an image and its 180 degree
 * rotation.
 * </p>
 *
 * <p>
 * The bins evenly divide {@code [0, PI]} and the result is L2 normalized. A window without any
 * gradient produces an all-zero histogram.
 * </p>
 */
public class OrientationHistogram {
    private final int bins;
    private final double binWidth;

    public OrientationHistogram(final int bins) {
        if(bins < 1)
            throw new IllegalArgumentException("An orientation histogram needs at least one bin. Asked for " + bins);
        this.bins = bins;
        this.binWidth = Math.PI / bins;
    }

    public int getBins() {
        return bins;
    }

    public double[] compute(final FloatRaster img) {
        return compute(img, 0, 0, img.width, img.height);
    }

    /**
     * Histogram of the {@code w X h} window at {@code (x0, y0)}, computed as if the window were the whole image.
     */
    public double[] compute(final FloatRaster img, final int x0, final int y0, final int w, final int h) {
        final double[] hist = new double[bins];
        Gradients.forEachInWindow(img, x0, y0, w, h, (c, r, gx, gy) -> {
            final double mag = Math.hypot(gx, gy);
            if(mag > 0.0)
                hist[bin(Math.atan2(Math.abs(gy), Math.abs(gx)))] += mag;
        });
        return l2Normalize(hist);
    }

    int bin(final double orientation) {
        final int b = (int)(orientation / binWidth);
        return b >= bins ? bins - 1 : (b < 0 ? 0 : b);
    }

    /**
     * Normalize in place. A zero vector is left as is.
     */
    public static double[] l2Normalize(final double[] v) {
        double sum2 = 0.0;
        for(final double d: v)
            sum2 += d * d;
        if(sum2 > 0.0) {
            final double norm = Math.sqrt(sum2);
            for(int i = 0; i < v.length; i++)
                v[i] /= norm;
        }
        return v;
    }

    /**
     * Cosine similarity of two already normalized histograms.
     */
    public static double similarity(final double[] a, final double[] b) {
        if(a.length != b.length)
            throw new IllegalArgumentException("Histograms have different bin counts: " + a.length + " and " + b.length);
        double dot = 0.0;
        for(int i = 0; i < a.length; i++)
            dot += a[i] * b[i];
        return dot;
    }
}
