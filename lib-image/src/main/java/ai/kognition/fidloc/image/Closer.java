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

import static net.dempsy.util.Functional.uncheck;

import java.util.LinkedList;
import java.util.List;

import org.opencv.core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import net.dempsy.util.QuietCloseable;

/**
 * Manage resources from a single place
 */
public class Closer implements AutoCloseable {
    private static final Logger LOGGER = LoggerFactory.getLogger(Closer.class);

    private final List<AutoCloseable> toClose = new LinkedList<>();

    public <T extends AutoCloseable> T add(final T resource) {
        if(resource != null)
            toClose.add(0, resource);
        return resource;
    }

    public <T extends Mat> T addMat(final T mat) {
        if(mat == null)
            return null;
        if(mat instanceof AutoCloseable)
            add((AutoCloseable)mat);
        else
            toClose.add(0, (QuietCloseable)() -> mat.release());
        return mat;
    }

    /**
     * Close everything in the reverse order it was added. Every resource gets closed even if an earlier one fails.
     * The first failure is then rethrown, unchecked.
     */
    @Override
    public void close() {
        RuntimeException first = null;
        for(final AutoCloseable r: toClose) {
            try {
                uncheck(() -> r.close());
            } catch(final RuntimeException e) {
                LOGGER.debug("Failed to close {}", r, e);
                if(first == null)
                    first = e;
            }
        }
        toClose.clear();
        if(first != null)
            throw first;
    }
}
