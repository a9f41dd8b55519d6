package dev.nuclr.plugin.core.sprite.renderer.backend;

import java.awt.Graphics2D;
import java.awt.geom.Rectangle2D;

/**
 * Strategy interface for vector rasterizers bound to one source document.
 * Implementations are not thread-safe; the caller guarantees exclusive use
 * by checking instances out of a {@link RasterizerPool}.
 *
 * <p>An invalid document answers every query as "not found".
 */
public interface SpriteRasterizer extends AutoCloseable {

    /** Human-readable name for logging. */
    String name();

    /** Return true if the source document was parsed successfully. */
    boolean isValid();

    /** Return true if the document contains an element with the given id. */
    boolean elementExists(String elementId);

    /**
     * Bounding box of the element in document user space.
     *
     * @return the bounds, or an empty rectangle if the element does not exist
     */
    Rectangle2D boundsOnElement(String elementId);

    /**
     * Draw the element so that its bounding box fills {@code target}.
     * Does nothing if the element does not exist.
     */
    void render(Graphics2D g, String elementId, Rectangle2D target);

    /** Release all resources held for the document. */
    @Override
    void close();
}
