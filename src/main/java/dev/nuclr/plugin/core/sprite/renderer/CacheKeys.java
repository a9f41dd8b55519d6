package dev.nuclr.plugin.core.sprite.renderer;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Cache key construction shared by both cache tiers.
 *
 * <p>Pixmap keys are {@code <width>-<height>-<elementKey>} followed by
 * {@code -<source>-<replacement>} for every custom color, as eight-digit ARGB
 * hex, sorted by source color. Equal requests therefore give equal keys no
 * matter how their color maps were built.
 */
final class CacheKeys {

    static final String FRAME_COUNT_PREFIX = "fc-";
    static final String BOUNDS_PREFIX = "br-";

    private CacheKeys() {}

    static String pixmapKey(int width, int height, String elementKey, Map<Color, Color> customColors) {
        StringBuilder key = new StringBuilder()
                .append(width).append('-').append(height).append('-')
                .append(elementKey);
        List<Map.Entry<Color, Color>> pairs = new ArrayList<>(customColors.entrySet());
        pairs.sort((a, b) -> {
            int bySource = Integer.compareUnsigned(a.getKey().getRGB(), b.getKey().getRGB());
            return bySource != 0 ? bySource : Integer.compareUnsigned(a.getValue().getRGB(), b.getValue().getRGB());
        });
        for (Map.Entry<Color, Color> pair : pairs) {
            key.append('-').append(argbHex(pair.getKey()))
               .append('-').append(argbHex(pair.getValue()));
        }
        return key.toString();
    }

    /** Frame counts depend on the frame naming scheme, so it is part of the key. */
    static String frameCountKey(String spriteKey, int frameBaseIndex, String frameSuffix) {
        return FRAME_COUNT_PREFIX + frameBaseIndex + '-' + frameSuffix + '-' + spriteKey;
    }

    static String boundsKey(String elementKey) {
        return BOUNDS_PREFIX + elementKey;
    }

    private static String argbHex(Color color) {
        return String.format("%08x", color.getRGB());
    }
}
