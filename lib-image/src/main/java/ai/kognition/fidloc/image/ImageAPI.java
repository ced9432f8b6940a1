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

import org.opencv.core.Core;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import nu.pattern.OpenCV;

/**
 * Loads the OpenCV native library bundled with the {@code org.openpnp:opencv} artifact.
 * Any class that touches an OpenCV {@code Mat} or one of the {@code Imgproc}/{@code Core}
 * functions should make sure {@link #_init()} has been called first. {@link CvMat#initOpenCv()}
 * is the public way to do that.
 */
public class ImageAPI {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageAPI.class);

    static void _init() {}

    static {
        LOGGER.debug("Loading the native library for opencv");
        try {
            OpenCV.loadLocally();
        } catch(final RuntimeException | UnsatisfiedLinkError e) {
            throw new IllegalStateException("Failed to load the OpenCV native library for this platform", e);
        }
        LOGGER.debug("Loaded opencv version {}", Core.VERSION);
    }
}
