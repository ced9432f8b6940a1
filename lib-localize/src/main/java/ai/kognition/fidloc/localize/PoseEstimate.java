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

import org.opencv.core.Point;

/**
 * The result of localizing one tile. Positions and covariance are in physical units with y pointing up.
 */
public final class PoseEstimate {
    public final double x;
    public final double y;
    private final double[][] covariance;
    public final double confidence;
    private final Point pixel;
    public final MatchBox matchBox;
    public final boolean mirrored;
    public final int degenerateIterations;

    public PoseEstimate(final double x, final double y, final double[][] covariance, final double confidence, final Point pixel,
        final MatchBox matchBox, final boolean mirrored, final int degenerateIterations) {
        this.x = x;
        this.y = y;
        this.covariance = new double[][] {covariance[0].clone(),covariance[1].clone()};
        this.confidence = confidence;
        this.pixel = pixel.clone();
        this.matchBox = matchBox;
        this.mirrored = mirrored;
        this.degenerateIterations = degenerateIterations;
    }

    public double sigmaX() {
        return Math.sqrt(covariance[0][0]);
    }

    public double sigmaY() {
        return Math.sqrt(covariance[1][1]);
    }

    /**
     * @return a copy of the final position in reference image pixels.
     */
    public Point pixel() {
        return pixel.clone();
    }

    /**
     * @return a copy of the 2 X 2 physical covariance.
     */
    public double[][] covariance() {
        return new double[][] {covariance[0].clone(),covariance[1].clone()};
    }

    @Override
    public String toString() {
        return String.format("PoseEstimate [x=%.4f, y=%.4f, sigmaX=%.4f, sigmaY=%.4f, confidence=%.3f, mirrored=%s, %s]", x, y, sigmaX(), sigmaY(),
            confidence, mirrored, matchBox);
    }
}
