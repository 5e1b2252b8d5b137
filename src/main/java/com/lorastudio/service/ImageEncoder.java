package com.lorastudio.service;

import net.coobird.thumbnailator.Thumbnails;
import org.springframework.stereotype.Service;

import javax.imageio.ImageIO;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Base64;
import java.util.Locale;

/**
 * Prepares images for vision models using Thumbnailator.
 *
 * Vision servers are most reliable with JPEG input, so every image is decoded
 * and re-encoded as JPEG, optionally downscaled so its longest side fits a
 * configured maximum. Also owns the list of file extensions the project scan
 * treats as images.
 */
@Service
public class ImageEncoder {

    private static final String[] SUPPORTED_EXTENSIONS = { "png", "jpg", "jpeg", "webp", "gif", "bmp" };
    private static final double JPEG_QUALITY = 0.9;

    /**
     * Returns true if the file has a supported image extension.
     */
    public boolean isSupportedImage(Path path) {
        if (path == null || path.getFileName() == null)
            return false;
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        for (String ext : SUPPORTED_EXTENSIONS) {
            if (name.endsWith("." + ext))
                return true;
        }
        return false;
    }

    /**
     * Decodes the image and re-encodes it as JPEG.
     *
     * @param imagePath         source image
     * @param maxImageDimension longest side in pixels; null or non-positive
     *                          keeps the original size
     * @return JPEG bytes
     * @throws IOException if the file cannot be read or is not a decodable
     *                     image
     */
    public byte[] encodeAsJpeg(Path imagePath, Integer maxImageDimension) throws IOException {
        BufferedImage source = ImageIO.read(imagePath.toFile());
        if (source == null) {
            throw new IOException("Unsupported or corrupt image: " + imagePath.getFileName());
        }
        BufferedImage rgb = toRgb(source);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        int longest = Math.max(rgb.getWidth(), rgb.getHeight());
        if (maxImageDimension != null && maxImageDimension > 0 && longest > maxImageDimension) {
            Thumbnails.of(rgb)
                    .size(maxImageDimension, maxImageDimension)
                    .keepAspectRatio(true)
                    .outputFormat("jpg")
                    .outputQuality(JPEG_QUALITY)
                    .toOutputStream(out);
        } else {
            Thumbnails.of(rgb)
                    .scale(1.0)
                    .outputFormat("jpg")
                    .outputQuality(JPEG_QUALITY)
                    .toOutputStream(out);
        }
        return out.toByteArray();
    }

    /**
     * Encodes the image as a {@code data:image/jpeg;base64,...} URL.
     */
    public String toJpegDataUrl(Path imagePath, Integer maxImageDimension) throws IOException {
        byte[] jpeg = encodeAsJpeg(imagePath, maxImageDimension);
        return "data:image/jpeg;base64," + Base64.getEncoder().encodeToString(jpeg);
    }

    /**
     * JPEG has no alpha channel; flatten transparent images onto white.
     */
    private BufferedImage toRgb(BufferedImage source) {
        if (source.getType() == BufferedImage.TYPE_INT_RGB) {
            return source;
        }
        BufferedImage rgb = new BufferedImage(source.getWidth(), source.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, source.getWidth(), source.getHeight());
            g.drawImage(source, 0, 0, null);
        } finally {
            g.dispose();
        }
        return rgb;
    }
}
