package dev.nuclr.plugin.core.sprite.renderer;

import dev.nuclr.plugin.core.sprite.renderer.backend.RasterizerPool;
import dev.nuclr.plugin.core.sprite.renderer.backend.SpriteRasterizer;
import dev.nuclr.plugin.core.sprite.renderer.cache.BlobCache;
import dev.nuclr.plugin.core.sprite.renderer.cache.CacheBlobs;
import lombok.extern.slf4j.Slf4j;

import java.awt.geom.Rectangle2D;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Frame counts and element bounds, looked up in memory, then in the disk
 * cache, then in the SVG itself. Also owns the frame naming scheme.
 *
 * <p>Confined to the renderer's owner thread.
 */
@Slf4j
final class SpriteMetadataCache {

    static final String DEFAULT_FRAME_SUFFIX = "_%1";
    static final String FRAME_PLACEHOLDER = "%1";

    private final RasterizerPool pool;

    private final Map<String, Integer> frameCounts = new HashMap<>();
    private final Map<String, Rectangle2D> bounds = new HashMap<>();

    /** Null when the disk cache is disabled or not open. */
    private BlobCache diskCache;
    private int frameBaseIndex;
    private String frameSuffix = DEFAULT_FRAME_SUFFIX;

    SpriteMetadataCache(RasterizerPool pool) {
        this.pool = pool;
    }

    void setDiskCache(BlobCache diskCache) {
        this.diskCache = diskCache;
    }

    int frameBaseIndex() {
        return frameBaseIndex;
    }

    void setFrameBaseIndex(int frameBaseIndex) {
        if (this.frameBaseIndex != frameBaseIndex) {
            this.frameBaseIndex = frameBaseIndex;
            clear();
        }
    }

    String frameSuffix() {
        return frameSuffix;
    }

    /** Patterns without exactly one {@code %1} reset to {@value #DEFAULT_FRAME_SUFFIX}. */
    void setFrameSuffix(String suffix) {
        String valid = isValidSuffix(suffix) ? suffix : DEFAULT_FRAME_SUFFIX;
        if (!frameSuffix.equals(valid)) {
            this.frameSuffix = valid;
            clear();
        }
    }

    static boolean isValidSuffix(String suffix) {
        if (suffix == null) return false;
        int first = suffix.indexOf(FRAME_PLACEHOLDER);
        return first >= 0 && suffix.indexOf(FRAME_PLACEHOLDER, first + 1) < 0;
    }

    void clear() {
        frameCounts.clear();
        bounds.clear();
    }

    /**
     * @return the number of frames, {@link SpriteRenderer#FRAME_COUNT_NOT_ANIMATED}
     *         for a plain sprite, or {@link SpriteRenderer#FRAME_COUNT_MISSING}
     */
    int frameCount(String key) {
        Integer known = frameCounts.get(key);
        if (known != null) return known;

        String cacheKey = CacheKeys.frameCountKey(key, frameBaseIndex, frameSuffix);
        Optional<Integer> cached = Optional.empty();
        if (diskCache != null && pool.hasAvailableInstance()) {
            cached = diskCache.find(cacheKey).flatMap(CacheBlobs::decodeInt);
        }

        int count;
        if (cached.isPresent()) {
            count = cached.get();
        } else {
            count = probeFrameCount(key);
            if (diskCache != null) {
                diskCache.insert(cacheKey, CacheBlobs.encodeInt(count));
            }
        }
        frameCounts.put(key, count);
        return count;
    }

    Rectangle2D boundsOnSprite(String key, int frame) {
        String elementKey = frameKey(key, frame, true);
        Rectangle2D known = bounds.get(elementKey);
        if (known != null) return (Rectangle2D) known.clone();

        String cacheKey = CacheKeys.boundsKey(elementKey);
        Optional<Rectangle2D> cached = Optional.empty();
        if (diskCache != null && pool.hasAvailableInstance()) {
            cached = diskCache.find(cacheKey).flatMap(CacheBlobs::decodeRect);
        }

        Rectangle2D rect;
        if (cached.isPresent()) {
            rect = cached.get();
        } else {
            rect = probeBounds(elementKey);
            if (diskCache != null) {
                diskCache.insert(cacheKey, CacheBlobs.encodeRect(rect));
            }
        }
        bounds.put(elementKey, rect);
        return (Rectangle2D) rect.clone();
    }

    /**
     * Element id of one frame of a sprite.
     *
     * @param normalize wrap {@code frame} into the sprite's frame range, so
     *                  callers can pass an ever-increasing counter
     */
    String frameKey(String key, int frame, boolean normalize) {
        if (frame < 0) return key;
        if (normalize) {
            int count = frameCount(key);
            if (count <= 0) return key;
            frame = Math.floorMod(frame - frameBaseIndex, count) + frameBaseIndex;
        }
        return key + frameSuffix.replace(FRAME_PLACEHOLDER, Integer.toString(frame));
    }

    // ---------------------------------------------------------------- probing

    private int probeFrameCount(String key) {
        Optional<SpriteRasterizer> borrowed = pool.allocate();
        if (borrowed.isEmpty()) return SpriteRenderer.FRAME_COUNT_MISSING;
        SpriteRasterizer rasterizer = borrowed.get();
        try {
            int frame = frameBaseIndex;
            while (rasterizer.elementExists(frameKey(key, frame, false))) {
                ++frame;
            }
            int count = frame - frameBaseIndex;
            if (count == 0 && !rasterizer.elementExists(key)) {
                count = SpriteRenderer.FRAME_COUNT_MISSING;
            }
            log.debug("Frame count of {}: {}", key, count);
            return count;
        } finally {
            pool.release(rasterizer);
        }
    }

    private Rectangle2D probeBounds(String elementKey) {
        Optional<SpriteRasterizer> borrowed = pool.allocate();
        if (borrowed.isEmpty()) return new Rectangle2D.Double();
        SpriteRasterizer rasterizer = borrowed.get();
        try {
            return rasterizer.boundsOnElement(elementKey);
        } finally {
            pool.release(rasterizer);
        }
    }
}
