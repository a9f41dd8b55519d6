package dev.nuclr.plugin.core.sprite.renderer.backend;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

/**
 * Pool of {@link SpriteRasterizer} instances bound to one SVG source.
 *
 * <p>Rasterizers are not thread-safe, so each one is lent to a single thread at
 * a time. The slot list is the only record of who holds what and is accessed
 * exclusively under {@link #lock}.
 *
 * <p>Instances are created lazily. The first construction decides whether the
 * source is usable; once found invalid, {@link #allocate()} returns empty until
 * the next {@link #setSource}.
 */
@Slf4j
public final class RasterizerPool implements AutoCloseable {

    public enum Validity { UNCHECKED, VALID, INVALID }

    private enum SlotState { FREE, CHECKED_OUT }

    private static final class Slot {
        final SpriteRasterizer rasterizer;
        SlotState state = SlotState.FREE;
        long ownerThreadId;

        Slot(SpriteRasterizer rasterizer) {
            this.rasterizer = rasterizer;
        }
    }

    private final Function<Path, SpriteRasterizer> factory;

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition slotReleased = lock.newCondition();

    // Guarded by lock
    private final List<Slot> slots = new ArrayList<>();
    private Path source;
    private Validity validity = Validity.INVALID;

    public RasterizerPool(Function<Path, SpriteRasterizer> factory) {
        this.factory = factory;
    }

    /** Equivalent to {@code setSource(path, null)}. */
    public void setSource(Path path) {
        setSource(path, null);
    }

    /**
     * Re-point the pool at a new source. Blocks until every instance has been
     * released, then closes them all.
     *
     * @param path      the new SVG source, or null to leave the pool unusable
     * @param validated an already constructed, valid rasterizer for {@code path};
     *                  it becomes the first free instance
     */
    public void setSource(Path path, SpriteRasterizer validated) {
        lock.lock();
        try {
            awaitAllReleased();
            for (Slot slot : slots) {
                slot.rasterizer.close();
            }
            slots.clear();

            source = path;
            if (path == null) {
                validity = Validity.INVALID;
            } else if (validated != null) {
                validity = Validity.VALID;
                slots.add(new Slot(validated));
            } else {
                validity = Validity.UNCHECKED;
            }
            log.debug("Rasterizer pool source set to {} ({})", path, validity);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Check out a rasterizer for the calling thread.
     *
     * @return a rasterizer, or empty if the source is invalid
     */
    public Optional<SpriteRasterizer> allocate() {
        long threadId = Thread.currentThread().getId();
        lock.lock();
        try {
            Slot slot = findFree();
            if (slot == null) {
                if (validity == Validity.INVALID) {
                    return Optional.empty();
                }
                SpriteRasterizer created = factory.apply(source);
                if (!created.isValid()) {
                    log.warn("Source {} is not a valid SVG document; pool disabled", source);
                    validity = Validity.INVALID;
                    created.close();
                    return Optional.empty();
                }
                validity = Validity.VALID;
                slot = new Slot(created);
                slots.add(slot);
                log.debug("Rasterizer pool grew to {} instances", slots.size());
            }
            slot.state = SlotState.CHECKED_OUT;
            slot.ownerThreadId = threadId;
            return Optional.of(slot.rasterizer);
        } finally {
            lock.unlock();
        }
    }

    /** Return a rasterizer obtained from {@link #allocate()}. */
    public void release(SpriteRasterizer rasterizer) {
        lock.lock();
        try {
            for (Slot slot : slots) {
                if (slot.rasterizer == rasterizer) {
                    slot.state = SlotState.FREE;
                    slot.ownerThreadId = 0;
                    slotReleased.signalAll();
                    return;
                }
            }
            log.warn("Released rasterizer {} does not belong to this pool", rasterizer.name());
        } finally {
            lock.unlock();
        }
    }

    /** True if an instance exists that nobody is using right now. */
    public boolean hasAvailableInstance() {
        lock.lock();
        try {
            return findFree() != null;
        } finally {
            lock.unlock();
        }
    }

    public Validity validity() {
        lock.lock();
        try {
            return validity;
        } finally {
            lock.unlock();
        }
    }

    public Path source() {
        lock.lock();
        try {
            return source;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return slots.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void close() {
        setSource(null);
    }

    // ---------------------------------------------------------------- helpers

    /** Must be called with lock held. */
    private Slot findFree() {
        for (Slot slot : slots) {
            if (slot.state == SlotState.FREE) return slot;
        }
        return null;
    }

    /** Must be called with lock held. */
    private void awaitAllReleased() {
        boolean interrupted = false;
        while (slots.stream().anyMatch(s -> s.state == SlotState.CHECKED_OUT)) {
            try {
                slotReleased.await();
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
