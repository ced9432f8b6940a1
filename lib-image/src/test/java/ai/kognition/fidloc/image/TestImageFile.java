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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import javax.imageio.ImageIO;

import java.awt.image.BufferedImage;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.FileOutputStream;
import java.io.IOException;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class TestImageFile {

    @Rule
    public TemporaryFolder folder = new TemporaryFolder();

    @Test
    public void testReadGray8() throws IOException {
        final BufferedImage bi = new BufferedImage(4, 3, BufferedImage.TYPE_BYTE_GRAY);
        bi.getRaster().setSample(0, 0, 0, 255);
        bi.getRaster().setSample(3, 2, 0, 51);
        final File f = folder.newFile("gray.png");
        ImageIO.write(bi, "png", f);

        final FloatRaster r = ImageFile.readGrayFromFile(f.getAbsolutePath());
        assertEquals(4, r.width);
        assertEquals(3, r.height);
        assertEquals(1.0f, r.get(0, 0), 1e-6f);
        assertEquals(0.2f, r.get(3, 2), 1e-6f);
        assertEquals(0.0f, r.get(1, 1), 1e-6f);
    }

    @Test
    public void testReadRgbUsesLuminance() throws IOException {
        final BufferedImage bi = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        bi.setRGB(0, 0, 0xff0000);
        bi.setRGB(1, 0, 0x00ff00);
        final File f = folder.newFile("rgb.png");
        ImageIO.write(bi, "png", f);

        final FloatRaster r = ImageFile.readGrayFromFile(f.getAbsolutePath());
        assertEquals(ImageFile.RED_WEIGHT, r.get(0, 0), 1e-6);
        assertEquals(ImageFile.GREEN_WEIGHT, r.get(1, 0), 1e-6);
    }

    @Test
    public void testMissingFile() {
        assertThrows(FileNotFoundException.class, () -> ImageFile.readGrayFromFile(new File(folder.getRoot(), "missing.png").getAbsolutePath()));
    }

    @Test
    public void testUndecodableFile() throws IOException {
        final File f = folder.newFile("garbage.png");
        try(FileOutputStream fos = new FileOutputStream(f);) {
            fos.write(new byte[] {1,2,3,4,5,6,7,8,9});
        }
        assertThrows(IOException.class, () -> ImageFile.readGrayFromFile(f.getAbsolutePath()));
    }

    @Test
    public void testWriteThenRead() throws IOException {
        final FloatRaster tex = UtilsForTesting.texture(32, 24, 7L);
        final File f = new File(folder.getRoot(), "tex.png");
        ImageFile.writeImageFile(tex, f.getAbsolutePath());
        assertTrue(f.exists());

        final FloatRaster back = ImageFile.readGrayFromFile(f.getAbsolutePath());
        assertEquals(32, back.width);
        assertEquals(24, back.height);
        // the texture spans [0, 1] so the stretch is the identity up to 8 bit quantization
        for(int i = 0; i < tex.data.length; i++)
            assertEquals(tex.data[i], back.data[i], 1.0 / 255.0 + 1e-6);
    }
}
