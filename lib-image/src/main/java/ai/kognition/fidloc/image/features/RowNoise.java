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

import java.util.Arrays;

import ai.kognition.fidloc.image.FloatRaster;

/**
 * <p>
 * Removes the horizontal banding that a line-scanning instrument leaves in its images. Each row
 * has its median subtracted. Optionally each row is then detrended by subtracting a moving average
 * of width {@code window} along the row (the row's ends are extended by repeating the edge pixel).
 * The result is stretched to [0, 1].
 * </p>
 */
public class RowNoise {
    public static final double PTP_EPSILON = 1.0e-9;

    private final boolean detrend;
    private final int window;

    public RowNoise(final boolean detrend, final int window) {
        if(detrend && window < 1)
            throw new IllegalArgumentException("The row detrend window must be at least 1 but was " + window);
        this.detrend = detrend;
        this.window = window;
    }

    public FloatRaster apply(final FloatRaster img) {
        final int w = img.width;
        final int h = img.height;
        final float[] out = new float[img.data.length];
        final float[] row = new float[w];
        final double[] prefix = new double[w + 1];

        for(int y = 0; y < h; y++) {
            System.arraycopy(img.data, y * w, row, 0, w);
            final float[] sorted = Arrays.copyOf(row, w);
            Arrays.sort(sorted);
            final float median = (float)Stats.sortedQuantile(sorted, 0.5);
            for(int x = 0; x < w; x++)
                row[x] -= median;

            if(detrend) {
                prefix[0] = 0.0;
                for(int x = 0; x < w; x++)
                    prefix[x + 1] = prefix[x] + row[x];
                final int left = window / 2;
                final int right = window - 1 - left;
                for(int x = 0; x < w; x++)
                    out[y * w + x] = (float)(row[x] - windowSum(row, prefix, x - left, x + right) / window);
            } else
                System.arraycopy(row, 0, out, y * w, w);
        }

        float min = Float.POSITIVE_INFINITY;
        float max = Float.NEGATIVE_INFINITY;
        for(final float v: out) {
            if(v < min)
                min = v;
            if(v > max)
                max = v;
        }
        final double range = (max - min) + PTP_EPSILON;
        for(int i = 0; i < out.length; i++)
            out[i] = (float)((out[i] - min) / range);

        return new FloatRaster(w, h, out);
    }

    // sum of row[from..to] inclusive where out of range indices repeat the nearest edge pixel
    private static double windowSum(final float[] row, final double[] prefix, final int from, final int to) {
        final int n = row.length;
        double sum = 0.0;
        if(from < 0)
            sum += (double)(-from) * row[0];
        if(to > n - 1)
            sum += (double)(to - (n - 1)) * row[n - 1];
        final int lo = Math.max(from, 0);
        final int hi = Math.min(to, n - 1);
        if(hi >= lo)
            sum += prefix[hi + 1] - prefix[lo];
        return sum;
    }
}
