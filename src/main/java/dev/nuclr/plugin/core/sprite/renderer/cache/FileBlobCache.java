package dev.nuclr.plugin.core.sprite.renderer.cache;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.FileTime;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * {@link BlobCache} that keeps one file per entry in a directory.
 *
 * <p>File names are SHA-1 digests of the keys. Recency is tracked in memory
 * with an access-ordered map and persisted through file modification times,
 * so the LRU order survives restarts. Total size is kept under
 * {@link #capacity()} by evicting the least recently used files.
 *
 * <p>I/O failures are logged and reported as misses.
 */
@Slf4j
public final class FileBlobCache implements BlobCache {

    private static final String BLOB_SUFFIX = ".blob";
    private static final String TIMESTAMP_FILE = "cache.timestamp";

    private final Path directory;
    private final long capacity;

    /** File name -> size in bytes, eldest first. */
    private final LinkedHashMap<String, Long> index = new LinkedHashMap<>(64, 0.75f, true);
    private long liveBytes;
    private long timestamp;

    private FileBlobCache(Path directory, long capacity) {
        this.directory = directory;
        this.capacity = capacity;
    }

    /**
     * Open (or create) the cache stored in {@code directory}.
     * Never fails: an unusable directory gives a cache that misses every lookup.
     */
    public static FileBlobCache open(Path directory, long capacityBytes) {
        FileBlobCache cache = new FileBlobCache(directory, capacityBytes);
        cache.load();
        return cache;
    }

    @Override
    public synchronized Optional<byte[]> find(String key) {
        String name = fileName(key);
        if (index.get(name) == null) return Optional.empty(); // get() also bumps recency
        Path file = directory.resolve(name);
        try {
            byte[] data = Files.readAllBytes(file);
            Files.setLastModifiedTime(file, FileTime.fromMillis(System.currentTimeMillis()));
            return Optional.of(data);
        } catch (IOException e) {
            log.warn("Could not read cache entry {}: {}", file, e.getMessage());
            forget(name);
            return Optional.empty();
        }
    }

    @Override
    public synchronized void insert(String key, byte[] data) {
        if (data.length > capacity) {
            log.debug("Not caching {}: {} bytes exceeds capacity", key, data.length);
            return;
        }
        String name = fileName(key);
        Path file = directory.resolve(name);
        try {
            Files.createDirectories(directory);
            Path tmp = file.resolveSibling(name + ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                out.write(data);
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.warn("Could not write cache entry {}: {}", file, e.getMessage());
            return;
        }
        Long previous = index.put(name, (long) data.length);
        if (previous != null) liveBytes -= previous;
        liveBytes += data.length;
        trimToCapacity();
    }

    @Override
    public synchronized void clear() {
        for (String name : new ArrayList<>(index.keySet())) {
            delete(name);
        }
        index.clear();
        liveBytes = 0;
        writeTimestamp(System.currentTimeMillis());
        log.info("Cleared sprite cache {}", directory);
    }

    @Override
    public synchronized long timestamp() {
        return timestamp;
    }

    @Override
    public long capacity() {
        return capacity;
    }

    public synchronized long size() {
        return liveBytes;
    }

    @Override
    public void close() {
        // every write is already on disk
    }

    // ---------------------------------------------------------------- helpers

    private void load() {
        try {
            Files.createDirectories(directory);
            List<Path> files = new ArrayList<>();
            try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + BLOB_SUFFIX)) {
                stream.forEach(files::add);
            }
            files.sort((a, b) -> lastModified(a).compareTo(lastModified(b)));
            for (Path file : files) {
                long size = Files.size(file);
                index.put(file.getFileName().toString(), size);
                liveBytes += size;
            }
            Path stamp = directory.resolve(TIMESTAMP_FILE);
            if (Files.exists(stamp)) {
                timestamp = Long.parseLong(Files.readString(stamp, StandardCharsets.US_ASCII).trim());
            } else {
                writeTimestamp(System.currentTimeMillis());
            }
            trimToCapacity();
            log.debug("Opened sprite cache {}: {} entries, {} bytes", directory, index.size(), liveBytes);
        } catch (IOException | NumberFormatException e) {
            log.warn("Could not open sprite cache {}: {}", directory, e.getMessage());
        }
    }

    private void writeTimestamp(long millis) {
        timestamp = millis;
        try {
            Files.createDirectories(directory);
            Files.writeString(directory.resolve(TIMESTAMP_FILE), Long.toString(millis), StandardCharsets.US_ASCII);
        } catch (IOException e) {
            log.warn("Could not write cache timestamp in {}: {}", directory, e.getMessage());
        }
    }

    private void trimToCapacity() {
        Iterator<Map.Entry<String, Long>> it = index.entrySet().iterator();
        while (liveBytes > capacity && it.hasNext()) {
            Map.Entry<String, Long> eldest = it.next();
            liveBytes -= eldest.getValue();
            delete(eldest.getKey());
            it.remove();
        }
    }

    private void forget(String name) {
        Long size = index.remove(name);
        if (size != null) liveBytes -= size;
    }

    private void delete(String name) {
        try {
            Files.deleteIfExists(directory.resolve(name));
        } catch (IOException e) {
            log.warn("Could not delete cache entry {}: {}", name, e.getMessage());
        }
    }

    private static FileTime lastModified(Path file) {
        try {
            return Files.getLastModifiedTime(file);
        } catch (IOException e) {
            return FileTime.fromMillis(0);
        }
    }

    static String fileName(String key) {
        try {
            MessageDigest sha1 = MessageDigest.getInstance("SHA-1");
            byte[] digest = sha1.digest(key.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest) + BLOB_SUFFIX;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-1 not available", e);
        }
    }
}
