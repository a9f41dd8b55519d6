package dev.nuclr.plugin.core.sprite.renderer.cache;

import java.awt.image.BufferedImage;
import java.util.HashMap;
import java.util.Map;

/**
 * In-process cache of display-ready sprite images, keyed by pixmap cache key.
 * Unbounded: it sits on top of the size-bounded {@link BlobCache} and is
 * emptied when the theme changes.
 *
 * <p>Confined to the renderer's owner thread.
 */
public final class PixmapCache {

    private final Map<String, BufferedImage> cache = new HashMap<>();

    public BufferedImage get(String key) {
        return cache.get(key);
    }

    public void put(String key, BufferedImage image) {
        cache.put(key, image);
    }

    public int size() {
        return cache.size();
    }

    public void clear() {
        cache.clear();
    }
}
