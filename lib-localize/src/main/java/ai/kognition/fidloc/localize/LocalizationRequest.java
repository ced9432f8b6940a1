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

import java.util.Random;

/**
 * Per-call values that don't belong in the {@link LocalizerConfig}: which tile, which random generator, and where
 * (if anywhere) to write diagnostic images.
 */
public final class LocalizationRequest {
    public final String tilePath;
    public final Random random;
    /**
     * {@code null} means no diagnostics are written.
     */
    public final String outputDirectory;

    private LocalizationRequest(final String tilePath, final Random random, final String outputDirectory) {
        this.tilePath = tilePath;
        this.random = random;
        this.outputDirectory = outputDirectory;
    }

    public static LocalizationRequest of(final String tilePath) {
        if(tilePath == null)
            throw new NullPointerException("tilePath");
        return new LocalizationRequest(tilePath, new Random(), null);
    }

    public LocalizationRequest withRandom(final Random random) {
        if(random == null)
            throw new NullPointerException("random");
        return new LocalizationRequest(tilePath, random, outputDirectory);
    }

    public LocalizationRequest withSeed(final long seed) {
        return withRandom(new Random(seed));
    }

    public LocalizationRequest withOutputDirectory(final String outputDirectory) {
        return new LocalizationRequest(tilePath, random, outputDirectory);
    }

    public boolean writesDiagnostics() {
        return outputDirectory != null;
    }
}
