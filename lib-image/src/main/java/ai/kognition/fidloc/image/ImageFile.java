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

import javax.imageio.ImageIO;

import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.imgcodecs.Imgcodecs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reading grayscale images for localization and writing diagnostic images.
 */
public class ImageFile {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageFile.class);

    /**
     * Luminance weights applied to the red, green and blue channels when converting to grayscale.
     */
    public static final double RED_WEIGHT = 0.2125;
    public static final double GREEN_WEIGHT = 0.7154;
    public static final double BLUE_WEIGHT = 0.0721;

    static {
        CvMat.initOpenCv();
    }

    /**
     * <p>
     * Read an image file as a single channel grayscale {@link FloatRaster} with values in [0, 1].
     * </p>
     *
     * <p>
     * ImageIO is tried first. If none of the ImageIO codecs can decode the file, this falls back to
     * OpenCV's codecs (which use their own grayscale conversion weights).
     * </p>
     *
     * @throws FileNotFoundException if the file doesn't exist.
     * @throws IOException if the file can't be decoded by either ImageIO or OpenCV.
     */
    public static FloatRaster readGrayFromFile(final String filename) throws IOException {
        final File file = new File(filename);
        if(!file.exists())
            throw new FileNotFoundException("The image file \"" + filename + "\" doesn't exist.");

        BufferedImage bi = null;
        try {
            bi = ImageIO.read(file);
        } catch(final IOException ioe) {
            LOGGER.debug("ImageIO failed to read \"{}\". Falling back to OpenCV.", filename, ioe);
        }

        if(bi != null)
            return toGray(bi);

        LOGGER.debug("No ImageIO reader for \"{}\". Using OpenCV.", filename);
        try(CvMat mat = CvMat.move(Imgcodecs.imread(filename, Imgcodecs.IMREAD_GRAYSCALE));) {
            if(mat == null || mat.empty())
                throw new IOException("Failed to decode the image file \"" + filename + "\" using either ImageIO or OpenCV");
            final double scale = mat.depth() == CvType.CV_16U ? 1.0 / 65535.0 : 1.0 / 255.0;
            try(CvMat scaled = new CvMat();) {
                mat.convertTo(scaled, CvType.CV_32F, scale);
                return FloatRaster.fromMat(scaled);
            }
        }
    }

    /**
     * Convert a {@link BufferedImage} to grayscale in [0, 1]. Single band (non-palette) images are
     * scaled by the maximum value their sample size can hold. Color images use the luminance weights.
     */
    public static FloatRaster toGray(final BufferedImage bi) {
        final int w = bi.getWidth();
        final int h = bi.getHeight();
        final FloatRaster ret = new FloatRaster(w, h);
        final Raster raster = bi.getRaster();

        if(raster.getNumBands() == 1 && !(bi.getColorModel() instanceof IndexColorModel)) {
            final int bits = bi.getColorModel().getComponentSize(0);
            final double max = (1L << bits) - 1;
            for(int y = 0; y < h; y++)
                for(int x = 0; x < w; x++)
                    ret.set(x, y, (float)(raster.getSampleDouble(x, y, 0) / max));
        } else {
            for(int y = 0; y < h; y++) {
                for(int x = 0; x < w; x++) {
                    final int rgb = bi.getRGB(x, y);
                    final double r = ((rgb >> 16) & 0xff) / 255.0;
                    final double g = ((rgb >> 8) & 0xff) / 255.0;
                    final double b = (rgb & 0xff) / 255.0;
                    ret.set(x, y, (float)(RED_WEIGHT * r + GREEN_WEIGHT * g + BLUE_WEIGHT * b));
                }
            }
        }
        return ret;
    }

    /**
     * Write a single channel image min-max stretched to 8 bits. The format is taken from the file extension.
     */
    public static void writeImageFile(final Mat mat, final String filename) throws IOException {
        try(CvMat stretched = new CvMat();) {
            Core.normalize(mat, stretched, 0.0, 255.0, Core.NORM_MINMAX, CvType.CV_8U);
            if(!Imgcodecs.imwrite(filename, stretched))
                throw new IOException("Failed to write \"" + filename + "\" using OpenCV");
        }
    }

    public static void writeImageFile(final FloatRaster raster, final String filename) throws IOException {
        try(CvMat mat = raster.toMat();) {
            writeImageFile(mat, filename);
        }
    }
}
