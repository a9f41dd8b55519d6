package dev.nuclr.plugin.core.sprite.renderer;

import dev.nuclr.plugin.core.sprite.renderer.backend.RasterizerPool;

import java.awt.Color;
import java.awt.image.BufferedImage;
import java.util.Map;

/**
 * One rasterization: one element at one size, optionally recolored.
 *
 * <p>Owned by exactly one party at a time: the renderer creates it, the
 * worker fills in {@link #result}, and the renderer takes it back on
 * completion.
 */
final class RenderJob {

    final RasterizerPool pool;
    final String cacheKey;
    final String elementKey;
    final int width;
    final int height;
    final Map<Color, Color> customColors;
    /** Theme generation the job was created in. */
    final long generation;
    /** True when a caller blocks on this job rather than waiting for delivery. */
    final boolean synchronous;

    BufferedImage result;

    RenderJob(RasterizerPool pool, String cacheKey, String elementKey, SpriteRequest request,
              long generation, boolean synchronous) {
        this.pool = pool;
        this.cacheKey = cacheKey;
        this.elementKey = elementKey;
        this.width = request.width();
        this.height = request.height();
        this.customColors = request.customColors();
        this.generation = generation;
        this.synchronous = synchronous;
    }
}
