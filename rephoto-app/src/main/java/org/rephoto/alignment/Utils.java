/**
 * License: GPL
 *
 * This program is free software; you can redistribute it and/or
 * modify it under the terms of the GNU General Public License 2
 * as published by the Free Software Foundation.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program; if not, write to the Free Software
 * Foundation, Inc., 59 Temple Place - Suite 330, Boston, MA  02111-1307, USA.
 */
package org.rephoto.alignment;

import ij.ImagePlus;
import ij.io.FileInfo;
import ij.io.TiffEncoder;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferInt;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.util.Iterator;

import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.FileImageOutputStream;
import javax.imageio.stream.ImageOutputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Image I/O and pixel buffer helpers.
 */
public class Utils {

    public static final String JPEG_FORMAT = "jpg";
    public static final String PNG_FORMAT = "png";
    public static final String TIFF_FORMAT = "tiff";
    public static final String TIF_FORMAT = "tif";

    public static final float DEFAULT_JPEG_QUALITY = 0.85f;

    private Utils() {
    }

    /**
     * @return the specified image if it already is a {@link BufferedImage#TYPE_INT_ARGB} image,
     *         otherwise an ARGB copy of it.
     */
    public static BufferedImage toArgb(final BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_ARGB) {
            return image;
        }
        final BufferedImage argbImage = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        final Graphics2D g2d = argbImage.createGraphics();
        g2d.drawImage(image, 0, 0, null);
        g2d.dispose();
        return argbImage;
    }

    /**
     * @return the backing pixel array of the specified {@link BufferedImage#TYPE_INT_ARGB} image.
     *
     * @throws IllegalArgumentException
     *   if the image is not a {@link BufferedImage#TYPE_INT_ARGB} image.
     */
    public static int[] getArgbPixels(final BufferedImage argbImage)
            throws IllegalArgumentException {
        if (argbImage.getType() != BufferedImage.TYPE_INT_ARGB) {
            throw new IllegalArgumentException("image type " + argbImage.getType() + " is not TYPE_INT_ARGB");
        }
        return ((DataBufferInt) argbImage.getRaster().getDataBuffer()).getData();
    }

    public static BufferedImage newArgbImage(final int width,
                                             final int height) {
        if ((width < 1) || (height < 1)) {
            throw new IllegalArgumentException("image dimensions " + width + "x" + height + " must be positive");
        }
        return new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
    }

    /**
     * Opens an image file as an ARGB image.
     *
     * @throws IOException
     *   if the file does not exist or cannot be decoded.
     */
    public static BufferedImage openImage(final String path)
            throws IOException {

        final File file = new File(path);
        if (! file.exists()) {
            throw new IOException("image file " + file.getAbsolutePath() + " does not exist");
        }

        BufferedImage image = ImageIO.read(file);
        if (image == null) {
            // fall back to ImageJ for formats ImageIO cannot handle (e.g. most tiffs)
            final ImagePlus imagePlus = new ImagePlus(file.getAbsolutePath());
            if (imagePlus.getProcessor() == null) {
                throw new IOException("failed to decode image file " + file.getAbsolutePath());
            }
            image = imagePlus.getBufferedImage();
        }

        LOG.info("openImage: loaded {}x{} image from {}", image.getWidth(), image.getHeight(), file.getAbsolutePath());

        return toArgb(image);
    }

    /**
     * Saves the specified image to a file.  The format is derived from the file extension,
     * tiff files are written with ImageJ and all others with ImageIO.
     *
     * @throws IOException
     *   if the image cannot be written.
     */
    public static void saveImage(final BufferedImage image,
                                 final String path)
            throws IOException {

        final File file = prepareFileForWrite(path);
        final String absolutePath = file.getAbsolutePath();
        final int extensionStart = absolutePath.lastIndexOf('.');
        if (extensionStart < 0) {
            throw new IOException("cannot derive image format for " + absolutePath + " (missing file extension)");
        }
        final String format = absolutePath.substring(extensionStart + 1).toLowerCase();

        if (TIFF_FORMAT.equals(format) || TIF_FORMAT.equals(format)) {

            final FileInfo fileInfo = new ImagePlus("", image).getFileInfo();
            try (final FileOutputStream outputStream = new FileOutputStream(file)) {
                new TiffEncoder(fileInfo).write(outputStream);
            }

        } else {

            try (final FileImageOutputStream outputStream = new FileImageOutputStream(file)) {
                writeImage(image, format, DEFAULT_JPEG_QUALITY, outputStream);
            }

        }

        LOG.info("saveImage: exit, saved {}", absolutePath);
    }

    /**
     * Writes the specified image using ImageIO.
     */
    public static void writeImage(final BufferedImage image,
                                  final String format,
                                  final float quality,
                                  final ImageOutputStream outputStream)
            throws IOException {

        final Iterator<ImageWriter> writersForFormat = ImageIO.getImageWritersByFormatName(format);

        if ((writersForFormat != null) && writersForFormat.hasNext()) {
            final ImageWriter writer = writersForFormat.next();
            try {
                writer.setOutput(outputStream);

                if (JPEG_FORMAT.equalsIgnoreCase(format) || "jpeg".equalsIgnoreCase(format)) {
                    // jpeg has no alpha, draw into an RGB image so the file is not saved as CMYK
                    final BufferedImage rgbImage = new BufferedImage(image.getWidth(),
                                                                     image.getHeight(),
                                                                     BufferedImage.TYPE_INT_RGB);
                    final Graphics2D g2d = rgbImage.createGraphics();
                    g2d.drawImage(image, 0, 0, null);
                    g2d.dispose();

                    final ImageWriteParam param = writer.getDefaultWriteParam();
                    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
                    param.setCompressionQuality(quality);
                    writer.write(null, new IIOImage(rgbImage, null, null), param);
                } else {
                    writer.write(image);
                }
            } finally {
                writer.dispose();
            }
        } else {
            throw new IOException("no ImageIO writers exist for the '" + format + "' format");
        }
    }

    public static File prepareFileForWrite(final String path)
            throws IOException {
        final File file = new File(path).getAbsoluteFile();
        final File parentDirectory = file.getParentFile();
        if ((parentDirectory != null) && (! parentDirectory.exists())) {
            if (! parentDirectory.mkdirs()) {
                // check for existence again in case another process already created the directory
                if (! parentDirectory.exists()) {
                    throw new IOException("failed to create directory " + parentDirectory.getAbsolutePath());
                }
            }
        }
        return file;
    }

    private static final Logger LOG = LoggerFactory.getLogger(Utils.class);
}
