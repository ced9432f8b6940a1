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
import org.opencv.core.Mat;

/**
 * <p>
 * An OpenCV <a href="https://docs.opencv.org/4.7.0/d3/d63/classcv_1_1Mat.html">Mat</a> that can be
 * managed with a <em>"try-with-resource"</em>. The image memory behind a {@code Mat} is off-heap
 * so the garbage collector can't see how much of it is in use. Closing the {@link CvMat} releases
 * that memory immediately.
 * </p>
 *
 * <p>
 * Instantiating a {@link CvMat} (or calling {@link #initOpenCv()}) guarantees the native library
 * has been loaded.
 * </p>
 */
public class CvMat extends Mat implements AutoCloseable {
    private boolean skipCloseOnceForReturn = false;
    private boolean deletedAlready = false;

    static {
        ImageAPI._init();
    }

    public static void initOpenCv() {}

    // This is used when there's an input matrix that can't be null but should be ignored.
    public static final Mat nullMat = new CvMat();

    /**
     * Construct's an empty {@link CvMat}.
     */
    public CvMat() {}

    /**
     * Construct a {@link CvMat} and preallocate the image space.
     *
     * @param rows number of rows
     * @param cols number of columns
     * @param type type of the {@link CvMat}. See
     *            <a href="https://docs.opencv.org/4.7.0/javadoc/org/opencv/core/CvType.html">CvType</a>
     */
    public CvMat(final int rows, final int cols, final int type) {
        super(rows, cols, type);
    }

    /**
     * This performs a proper matrix multiplication that returns {@code this * other}.
     *
     * @return a new {@link CvMat} resulting from the operation. <b>Note: The caller owns the CvMat returned</b>
     */
    public CvMat mm(final Mat other) {
        try(CvMat ret = new CvMat();) {
            Core.gemm(this, other, 1.0D, nullMat, 0.0D, ret);
            return ret.returnMe();
        }
    }

    /**
     * Free the resources for this {@link CvMat}. Once the {@link CvMat} is closed, it shouldn't be used and certainly
     * wont contain the image data any longer.
     */
    @Override
    public void close() {
        if(!skipCloseOnceForReturn) {
            if(!deletedAlready) {
                release();
                deletedAlready = true;
            }
        } else
            skipCloseOnceForReturn = false; // next close counts.
    }

    @Override
    public String toString() {
        return "CvMat: (" + getClass().getName() + "@" + Integer.toHexString(hashCode()) + ") " + super.toString();
    }

    /**
     * This call will manage a complete deep copy of the provided {@code Mat}.
     * Changes in one will not be reflected in the other.
     */
    public static CvMat deepCopy(final Mat mat) {
        final CvMat newMat = new CvMat(mat.rows(), mat.cols(), mat.type());
        mat.copyTo(newMat);
        return newMat;
    }

    /**
     * Hand management of a {@code Mat}'s image data over to a new {@link CvMat}. The {@code Mat}
     * passed in <em>SHOULD NOT</em> be used after this call.
     *
     * @return a new {@link CvMat} that now manages the image data of the original. <b>Note: The caller owns the
     *         CvMat returned</b>
     */
    public static CvMat move(final Mat mat) {
        if(mat == null)
            return null;

        final CvMat ret = new CvMat();
        mat.assignTo(ret);
        mat.release();
        return ret;
    }

    /**
     * <p>
     * Return a {@link CvMat} that's being managed by a <em>"try-with-resource"</em> without the
     * resources being freed on the way out:
     * </p>
     *
     * <pre>
     * <code>
     *   try (CvMat matToReturn = new CvMat(); ) {
     *      // do something to fill in the matToReturn
     *
     *      return matToReturn.returnMe();
     *   }
     * </code>
     * </pre>
     */
    public CvMat returnMe() {
        // hacky, yet efficient.
        skipCloseOnceForReturn = true;
        return this;
    }
}
