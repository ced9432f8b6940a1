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
 * Zero-mean normalized cross-correlation between a window of an image and a template whose
 * z-scored pixels were computed once up front with {@link #normalize(FloatRaster)}.
 */
public class Zncc {
    public static final double EPSILON = 1.0e-6;

    /**
     * z-score every pixel: {@code (v - mean) / (std + EPSILON)}.
     */
    public static float[] normalize(final FloatRaster tpl) {
        final double mean = Stats.mean(tpl.data);
        final double std = Stats.std(tpl.data, mean) + EPSILON;
        final float[] ret = new float[tpl.data.length];
        for(int i = 0; i < ret.length; i++)
            ret[i] = (float)((tpl.data[i] - mean) / std);
        return ret;
    }

    /**
     * ZNCC of the {@code w X h} window at {@code (x0, y0)} against the normalized template (which
     * must hold {@code w * h} values, row-major). Uses two passes over the window and no allocation.
     */
    public static double score(final FloatRaster img, final int x0, final int y0, final int w, final int h, final float[] tplNorm) {
        final int n = w * h;
        if(tplNorm.length != n)
            throw new IllegalArgumentException("The template has " + tplNorm.length + " values but the window has " + n);
        if(n == 0)
            return 0.0;

        final float[] d = img.data;
        final int stride = img.width;

        double sum = 0.0;
        for(int r = 0; r < h; r++) {
            final int off = (y0 + r) * stride + x0;
            for(int c = 0; c < w; c++)
                sum += d[off + c];
        }
        final double mean = sum / n;

        double sum2 = 0.0;
        double cross = 0.0;
        int t = 0;
        for(int r = 0; r < h; r++) {
            final int off = (y0 + r) * stride + x0;
            for(int c = 0; c < w; c++) {
                final double v = d[off + c] - mean;
                sum2 += v * v;
                cross += v * tplNorm[t++];
            }
        }
        final double std = Math.sqrt(sum2 / n) + EPSILON;
        return cross / (std * n);
    }
}
