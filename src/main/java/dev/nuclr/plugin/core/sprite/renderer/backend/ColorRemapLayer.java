package dev.nuclr.plugin.core.sprite.renderer.backend;

import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Compositing layer that substitutes colors on their way into a target image.
 *
 * <p>Drawing goes to a private transparent layer obtained from
 * {@link #createGraphics()}. {@link #composite(BufferedImage)} then replaces
 * each layer pixel whose RGB equals a source color with the mapped color and
 * draws the layer over the target. Partially covered pixels keep their
 * coverage: the mapped alpha is scaled by the pixel's own alpha. Colors absent
 * from the map are written unchanged.
 */
public final class ColorRemapLayer {

    private final BufferedImage layer;
    private final Map<Integer, Integer> rgbMap = new HashMap<>();

    /**
     * @param colors source color to replacement. Sources are matched on RGB
     *               alone, since antialiasing varies the alpha of drawn pixels;
     *               when two sources differ only in alpha, the more opaque one
     *               wins.
     */
    public ColorRemapLayer(int width, int height, Map<Color, Color> colors) {
        this.layer = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        List<Map.Entry<Color, Color>> entries = new ArrayList<>(colors.entrySet());
        entries.sort((a, b) -> Integer.compare(a.getKey().getAlpha(), b.getKey().getAlpha()));
        for (Map.Entry<Color, Color> e : entries) {
            rgbMap.put(e.getKey().getRGB() & 0xFFFFFF, e.getValue().getRGB());
        }
    }

    public Graphics2D createGraphics() {
        return layer.createGraphics();
    }

    /** Remap the layer in place and draw it onto {@code target}, source-over. */
    public void composite(BufferedImage target) {
        int w = layer.getWidth();
        int[] row = new int[w];
        for (int y = 0; y < layer.getHeight(); y++) {
            layer.getRGB(0, y, w, 1, row, 0, w);
            for (int x = 0; x < w; x++) {
                row[x] = remap(row[x]);
            }
            layer.setRGB(0, y, w, 1, row, 0, w);
        }
        Graphics2D g = target.createGraphics();
        try {
            g.setComposite(AlphaComposite.SrcOver);
            g.drawImage(layer, 0, 0, null);
        } finally {
            g.dispose();
        }
    }

    int remap(int argb) {
        int alpha = argb >>> 24;
        if (alpha == 0) return argb;
        Integer mapped = rgbMap.get(argb & 0xFFFFFF);
        if (mapped == null) return argb;
        int mappedAlpha = mapped >>> 24;
        int outAlpha = (alpha * mappedAlpha + 127) / 255;
        return (outAlpha << 24) | (mapped & 0xFFFFFF);
    }
}
