package dev.nuclr.plugin.core.sprite.renderer;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.image.BufferedImage;
import java.util.Map;
import java.util.Objects;

/**
 * A long-lived consumer of one sprite. Changing any property requests a new
 * pixmap; the renderer answers through {@link #receivePixmap}, always on its
 * owner thread, and again whenever the theme changes.
 *
 * <p>Clients register themselves on construction. Call {@link #close()} when
 * done; clients that are garbage collected drop out of the renderer anyway.
 */
public abstract class SpriteRendererClient implements AutoCloseable {

    private final SpriteRenderer renderer;

    private String spriteKey;
    private int frame = -1;
    private Dimension renderSize = new Dimension(0, 0);
    private Map<Color, Color> customColors = Map.of();

    private BufferedImage pixmap;

    protected SpriteRendererClient(SpriteRenderer renderer, String spriteKey) {
        this.renderer = Objects.requireNonNull(renderer, "renderer");
        this.spriteKey = Objects.requireNonNull(spriteKey, "spriteKey");
        renderer.registerClient(this);
    }

    /** Called on the renderer's owner thread with the new pixmap, or null for an empty result. */
    protected abstract void receivePixmap(BufferedImage pixmap);

    public SpriteRenderer renderer() {
        return renderer;
    }

    public String spriteKey() {
        return spriteKey;
    }

    public void setSpriteKey(String spriteKey) {
        Objects.requireNonNull(spriteKey, "spriteKey");
        if (!this.spriteKey.equals(spriteKey)) {
            this.spriteKey = spriteKey;
            fetchPixmap();
        }
    }

    public int frame() {
        return frame;
    }

    /** Frame numbers wrap around the sprite's frame count; negative means not animated. */
    public void setFrame(int frame) {
        if (this.frame != frame) {
            this.frame = frame;
            fetchPixmap();
        }
    }

    public Dimension renderSize() {
        return new Dimension(renderSize);
    }

    public void setRenderSize(Dimension size) {
        if (!renderSize.equals(size)) {
            this.renderSize = new Dimension(size);
            fetchPixmap();
        }
    }

    public Map<Color, Color> customColors() {
        return customColors;
    }

    public void setCustomColors(Map<Color, Color> colors) {
        Map<Color, Color> copy = colors == null ? Map.of() : Map.copyOf(colors);
        if (!customColors.equals(copy)) {
            this.customColors = copy;
            fetchPixmap();
        }
    }

    public int frameCount() {
        return renderer.frameCount(spriteKey);
    }

    public boolean isValid() {
        return renderer.spriteExists(spriteKey);
    }

    /** The last pixmap delivered, or null. */
    public BufferedImage pixmap() {
        return pixmap;
    }

    /** Ask the renderer for the pixmap matching the current properties. */
    public void fetchPixmap() {
        renderer.requestPixmap(new SpriteRequest(spriteKey, frame, renderSize, customColors), this);
    }

    final void deliver(BufferedImage pixmap) {
        this.pixmap = pixmap;
        receivePixmap(pixmap);
    }

    @Override
    public void close() {
        renderer.unregisterClient(this);
    }
}
