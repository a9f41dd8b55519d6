package dev.nuclr.plugin.core.sprite.renderer.cache;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Optional;

/**
 * Blob formats used in the {@link BlobCache}: PNG for images, decimal text
 * for frame counts and four big-endian doubles for bounds.
 * Decoders return empty for malformed blobs.
 */
@Slf4j
public final class CacheBlobs {

    private CacheBlobs() {}

    public static byte[] encodeImage(BufferedImage image) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(1024, image.getWidth() * image.getHeight()))) {
            if (!ImageIO.write(image, "png", out)) {
                throw new IOException("No PNG writer available");
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new IllegalStateException("PNG encoding failed", e);
        }
    }

    /** Decodes into {@code TYPE_INT_ARGB}, the layout render jobs produce. */
    public static Optional<BufferedImage> decodeImage(byte[] data) {
        try {
            BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(data));
            if (decoded == null) return Optional.empty();
            if (decoded.getType() == BufferedImage.TYPE_INT_ARGB) return Optional.of(decoded);
            BufferedImage argb = new BufferedImage(decoded.getWidth(), decoded.getHeight(), BufferedImage.TYPE_INT_ARGB);
            int w = decoded.getWidth();
            int[] row = new int[w];
            for (int y = 0; y < decoded.getHeight(); y++) {
                decoded.getRGB(0, y, w, 1, row, 0, w);
                argb.setRGB(0, y, w, 1, row, 0, w);
            }
            return Optional.of(argb);
        } catch (IOException e) {
            log.warn("Discarding unreadable cached image: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public static byte[] encodeInt(int value) {
        return Integer.toString(value).getBytes(StandardCharsets.US_ASCII);
    }

    public static Optional<Integer> decodeInt(byte[] data) {
        try {
            return Optional.of(Integer.parseInt(new String(data, StandardCharsets.US_ASCII).trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static byte[] encodeRect(Rectangle2D rect) {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream(32);
        try (DataOutputStream out = new DataOutputStream(bytes)) {
            out.writeDouble(rect.getX());
            out.writeDouble(rect.getY());
            out.writeDouble(rect.getWidth());
            out.writeDouble(rect.getHeight());
        } catch (IOException e) {
            throw new IllegalStateException("Cannot happen for in-memory streams", e);
        }
        return bytes.toByteArray();
    }

    public static Optional<Rectangle2D> decodeRect(byte[] data) {
        if (data.length != 32) return Optional.empty();
        try (DataInputStream in = new DataInputStream(new ByteArrayInputStream(data))) {
            return Optional.of(new Rectangle2D.Double(in.readDouble(), in.readDouble(), in.readDouble(), in.readDouble()));
        } catch (IOException e) {
            return Optional.empty();
        }
    }
}
