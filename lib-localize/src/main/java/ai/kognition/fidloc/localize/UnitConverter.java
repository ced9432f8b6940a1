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

import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;

import ai.kognition.fidloc.image.Closer;
import ai.kognition.fidloc.image.CvMat;

/**
 * <p>
 * Maps between reference image pixels (y down) and physical coordinates (y up), given the origin in pixels and
 * the pixels per physical unit.
 * </p>
 *
 * <pre>
 * x_phys = (x_px - origin_x) / pxPerUnit
 * y_phys = -(y_px - origin_y) / pxPerUnit
 * </pre>
 *
 * <p>
 * Covariances transform as {@code J * S * J'} with {@code J = diag(1/pxPerUnit, -1/pxPerUnit)}, after which
 * {@code measurementNoise} is added to the diagonal.
 * </p>
 */
public class UnitConverter {
    public final double originX;
    public final double originY;
    public final double pxPerUnit;
    public final double measurementNoise;

    public UnitConverter(final double originX, final double originY, final double pxPerUnit, final double measurementNoise) {
        if(!(pxPerUnit > 0.0))
            throw new IllegalArgumentException("pixels per unit must be positive but was " + pxPerUnit);
        this.originX = originX;
        this.originY = originY;
        this.pxPerUnit = pxPerUnit;
        this.measurementNoise = measurementNoise;
    }

    public static UnitConverter of(final ReferenceContext ctx, final LocalizerConfig config) {
        return new UnitConverter(ctx.originX, ctx.originY, ctx.pxPerUnit, config.measurementNoise);
    }

    public Point toPhysical(final Point px) {
        return new Point((px.x - originX) / pxPerUnit, -(px.y - originY) / pxPerUnit);
    }

    public Point toPixel(final Point phys) {
        return new Point(phys.x * pxPerUnit + originX, originY - phys.y * pxPerUnit);
    }

    public double[][] toPhysical(final double[][] covPx) {
        try(Closer closer = new Closer();) {
            final CvMat j = closer.add(jacobian());
            final CvMat js = closer.add(j.mm(closer.add(toMat(covPx))));
            final CvMat out = closer.add(js.mm(closer.addMat(j.t())));
            final double[][] ret = fromMat(out);
            ret[0][0] += measurementNoise;
            ret[1][1] += measurementNoise;
            return ret;
        }
    }

    private CvMat jacobian() {
        try(CvMat ret = new CvMat(2, 2, CvType.CV_64FC1);) {
            ret.put(0, 0, 1.0 / pxPerUnit, 0.0, 0.0, -1.0 / pxPerUnit);
            return ret.returnMe();
        }
    }

    private static CvMat toMat(final double[][] m) {
        try(CvMat ret = new CvMat(2, 2, CvType.CV_64FC1);) {
            ret.put(0, 0, m[0][0], m[0][1], m[1][0], m[1][1]);
            return ret.returnMe();
        }
    }

    private static double[][] fromMat(final Mat m) {
        final double[] v = new double[4];
        m.get(0, 0, v);
        return new double[][] {{v[0],v[1]},{v[2],v[3]}};
    }
}
