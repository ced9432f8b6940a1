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
 * A candidate window center taken from a peak of the correlation map.
 */
public final class Seed {
    public final double x;
    public final double y;
    public final double correlation;

    public Seed(final double x, final double y, final double correlation) {
        this.x = x;
        this.y = y;
        this.correlation = correlation;
    }

    @Override
    public String toString() {
        return "Seed [x=" + x + ", y=" + y + ", correlation=" + correlation + "]";
    }
}
