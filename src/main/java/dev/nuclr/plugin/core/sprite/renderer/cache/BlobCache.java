package dev.nuclr.plugin.core.sprite.renderer.cache;

import java.util.Optional;

/**
 * Persistent, size-bounded key/value store for rendered sprites and sprite
 * metadata. Eviction is the implementation's business.
 *
 * <p>Backend errors must not escape: a failing cache behaves like an empty one.
 */
public interface BlobCache extends AutoCloseable {

    Optional<byte[]> find(String key);

    void insert(String key, byte[] data);

    /** Drop every entry. */
    void clear();

    /** Epoch millis at which the cache was created or last cleared. */
    long timestamp();

    /** Configured capacity in bytes. */
    long capacity();

    @Override
    void close();
}
