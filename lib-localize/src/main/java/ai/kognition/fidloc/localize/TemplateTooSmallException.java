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

/**
 * The tile, once rescaled to the reference image's pixel size, is too small to match against.
 */
public class TemplateTooSmallException extends LocalizationException {
    private static final long serialVersionUID = 5213409827715620388L;

    public final int width;
    public final int height;
    public final int minimumSize;

    public TemplateTooSmallException(final int width, final int height, final int minimumSize) {
        super("Template too small after scaling: " + width + " X " + height + " (both dimensions need to be at least " + minimumSize + ")");
        this.width = width;
        this.height = height;
        this.minimumSize = minimumSize;
    }
}
