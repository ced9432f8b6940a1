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

import static org.junit.Assert.assertEquals;

import org.junit.Test;
import org.opencv.core.Point;

public class PoseEstimateTest {

    private static PoseEstimate estimate(final double[][] cov, final Point pixel) {
        return new PoseEstimate(1.0, 2.0, cov, 0.9, pixel, MatchBox.centeredAt(pixel.x, pixel.y, 10, 10), false, 0);
    }

    @Test
    public void testSigmas() {
        final PoseEstimate pose = estimate(new double[][] {{4.0,0.5},{0.5,9.0}}, new Point(20.0, 30.0));
        assertEquals(2.0, pose.sigmaX(), 1e-12);
        assertEquals(3.0, pose.sigmaY(), 1e-12);
    }

    @Test
    public void testInputsAreCopied() {
        final double[][] cov = {{4.0,0.5},{0.5,9.0}};
        final Point pixel = new Point(20.0, 30.0);
        final PoseEstimate pose = estimate(cov, pixel);

        cov[0][0] = 100.0;
        cov[1][0] = 7.0;
        pixel.x = -1.0;

        assertEquals(4.0, pose.covariance()[0][0], 0.0);
        assertEquals(0.5, pose.covariance()[1][0], 0.0);
        assertEquals(2.0, pose.sigmaX(), 1e-12);
        assertEquals(20.0, pose.pixel().x, 0.0);
    }

    @Test
    public void testAccessorsReturnCopies() {
        final PoseEstimate pose = estimate(new double[][] {{4.0,0.5},{0.5,9.0}}, new Point(20.0, 30.0));

        pose.covariance()[1][1] = -5.0;
        pose.pixel().y = 0.0;

        assertEquals(9.0, pose.covariance()[1][1], 0.0);
        assertEquals(3.0, pose.sigmaY(), 1e-12);
        assertEquals(30.0, pose.pixel().y, 0.0);
    }
}
