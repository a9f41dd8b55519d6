package dev.nuclr.plugin.core.sprite.renderer;

import dev.nuclr.plugin.core.sprite.renderer.backend.ColorRemapLayer;
import dev.nuclr.plugin.core.sprite.renderer.backend.SpriteRasterizer;
import lombok.extern.slf4j.Slf4j;

import java.awt.Graphics2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Executes a {@link RenderJob} on whatever thread runs it and passes the
 * finished job to a completion sink. For background runs the sink posts the
 * job to the renderer's owner thread.
 *
 * <p>The rasterizer is borrowed for the draw call only.
 */
@Slf4j
final class RenderWorker implements Runnable {

    private final RenderJob job;
    private final Consumer<RenderJob> completion;

    RenderWorker(RenderJob job, Consumer<RenderJob> completion) {
        this.job = job;
        this.completion = completion;
    }

    /** Always completes the job; {@link RenderJob#result} stays null if no image could be allocated. */
    @Override
    public void run() {
        try {
            BufferedImage image = new BufferedImage(job.width, job.height, BufferedImage.TYPE_INT_ARGB);
            job.result = image;
            draw(image);
        } catch (RuntimeException e) {
            log.error("Error rendering {}", job.cacheKey, e);
        } finally {
            completion.accept(job);
        }
    }

    private void draw(BufferedImage image) {
        Rectangle2D target = new Rectangle2D.Double(0, 0, job.width, job.height);
        Optional<SpriteRasterizer> borrowed = job.pool.allocate();
        if (borrowed.isEmpty()) {
            log.debug("No rasterizer available for {}", job.cacheKey);
            return;
        }
        SpriteRasterizer rasterizer = borrowed.get();
        if (job.customColors.isEmpty()) {
            Graphics2D g = image.createGraphics();
            try {
                rasterizer.render(g, job.elementKey, target);
            } finally {
                g.dispose();
                job.pool.release(rasterizer);
            }
        } else {
            ColorRemapLayer layer = new ColorRemapLayer(job.width, job.height, job.customColors);
            Graphics2D g = layer.createGraphics();
            try {
                rasterizer.render(g, job.elementKey, target);
            } finally {
                g.dispose();
                job.pool.release(rasterizer);
            }
            layer.composite(image);
        }
        log.debug("Rendered {} with {}", job.cacheKey, rasterizer.name());
    }
}
