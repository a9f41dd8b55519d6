package dev.nuclr.plugin.core.sprite.renderer;

import java.awt.Color;
import java.awt.Dimension;
import java.util.Map;
import java.util.Objects;

/**
 * What a consumer wants drawn: one sprite, one frame, one pixel size,
 * optionally recolored.
 *
 * @param spriteKey    sprite identifier without frame suffix
 * @param frame        frame number, or negative for non-animated sprites
 * @param width        target width in pixels
 * @param height       target height in pixels
 * @param customColors source color -> replacement color
 */
public record SpriteRequest(
        String spriteKey,
        int frame,
        int width,
        int height,
        Map<Color, Color> customColors) {

    public SpriteRequest {
        Objects.requireNonNull(spriteKey, "spriteKey");
        customColors = customColors == null ? Map.of() : Map.copyOf(customColors);
    }

    public SpriteRequest(String spriteKey, int frame, Dimension size, Map<Color, Color> customColors) {
        this(spriteKey, frame, size.width, size.height, customColors);
    }

    /** Zero-area requests always produce an empty result. */
    public boolean isEmpty() {
        return width <= 0 || height <= 0;
    }

    /** True if the pixel count does not fit in one image raster. */
    public boolean exceedsRasterLimit() {
        return (long) width * height > Integer.MAX_VALUE;
    }
}
