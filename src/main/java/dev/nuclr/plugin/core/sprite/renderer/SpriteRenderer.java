package dev.nuclr.plugin.core.sprite.renderer;

import dev.nuclr.plugin.core.sprite.renderer.backend.BatikRasterizer;
import dev.nuclr.plugin.core.sprite.renderer.backend.RasterizerPool;
import dev.nuclr.plugin.core.sprite.renderer.backend.SpriteRasterizer;
import dev.nuclr.plugin.core.sprite.renderer.cache.BlobCache;
import dev.nuclr.plugin.core.sprite.renderer.cache.CacheBlobs;
import dev.nuclr.plugin.core.sprite.renderer.cache.FileBlobCache;
import dev.nuclr.plugin.core.sprite.renderer.cache.PixmapCache;
import lombok.extern.slf4j.Slf4j;

import javax.swing.SwingUtilities;
import java.awt.AlphaComposite;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.GraphicsConfiguration;
import java.awt.GraphicsEnvironment;
import java.awt.Transparency;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.WeakHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Renders sprites from an SVG theme and caches the results.
 *
 * <p>A sprite is an element of the theme's SVG document, optionally one frame
 * of an animation ({@code key_0}, {@code key_1}, ...). Requests are served
 * from an in-process pixmap cache, then from a persistent {@link BlobCache},
 * and only then rendered, either inline or on a pool of render threads.
 *
 * <p>All public methods must be called on the owner thread: the thread that
 * runs the tasks posted to the {@code ownerExecutor} passed at construction
 * (the EDT for {@link #forSwing}). Render threads never touch renderer state;
 * they post finished jobs to that executor.
 *
 * <p>Concurrent asynchronous requests for the same pixmap share one render
 * job; every client waiting for that pixmap receives the result.
 */
@Slf4j
public class SpriteRenderer implements AutoCloseable {

    // ----------------------------------------------------------------- types

    /** Frame count of a sprite that does not exist. */
    public static final int FRAME_COUNT_MISSING = -1;
    /** Frame count of a sprite without animation frames. */
    public static final int FRAME_COUNT_NOT_ANIMATED = 0;

    public enum Strategy {
        /** Keep rendered sprites and metadata in a persistent per-theme cache. */
        USE_DISK_CACHE,
        /** Render asynchronous requests on background threads. */
        USE_RENDERING_THREADS
    }

    // -------------------------------------------------------------- state

    private final String defaultTheme;
    private final Path themesDirectory;
    private final Path cacheDirectory;
    private final long cacheSizeBytes;
    private final int renderThreads;

    private final Executor ownerExecutor;
    private final Function<Path, SpriteRasterizer> rasterizerFactory;

    private final RasterizerPool pool;
    private final SpriteMetadataCache metadata;
    private final PixmapCache pixmapCache = new PixmapCache();

    private final EnumSet<Strategy> strategies = EnumSet.noneOf(Strategy.class);
    /** Client -> cache key it was last served (or is waiting for); "" if none. */
    private final Map<SpriteRendererClient, String> clients = new WeakHashMap<>();
    private final Set<String> pendingRequests = new HashSet<>();
    private final List<Future<?>> inFlight = new ArrayList<>();
    private final List<Consumer<String>> themeListeners = new CopyOnWriteArrayList<>();

    private ExecutorService workers;
    private BlobCache diskCache;
    private String currentTheme;
    private boolean loadingTheme;

    /** Incremented on every theme load so jobs from the old theme are discarded. */
    private long generation;

    // ----------------------------------------------------------- constructor

    public SpriteRenderer(SpriteRendererSettings settings, Executor ownerExecutor) {
        this(settings, ownerExecutor, BatikRasterizer::new);
    }

    public SpriteRenderer(SpriteRendererSettings settings, Executor ownerExecutor,
                          Function<Path, SpriteRasterizer> rasterizerFactory) {
        this.defaultTheme = settings.getTheme();
        this.themesDirectory = settings.getThemesDirectory();
        this.cacheDirectory = settings.getCacheDirectory();
        this.cacheSizeBytes = settings.getCacheSizeBytes();
        this.renderThreads = settings.getRenderThreads();
        this.ownerExecutor = Objects.requireNonNull(ownerExecutor, "ownerExecutor");
        this.rasterizerFactory = rasterizerFactory;

        this.pool = new RasterizerPool(rasterizerFactory);
        this.metadata = new SpriteMetadataCache(pool);
        metadata.setFrameBaseIndex(settings.getFrameBaseIndex());
        metadata.setFrameSuffix(settings.getFrameSuffix());

        if (settings.isUseDiskCache()) strategies.add(Strategy.USE_DISK_CACHE);
        if (settings.isUseRenderingThreads()) strategies.add(Strategy.USE_RENDERING_THREADS);
    }

    /** A renderer owned by the Swing event dispatch thread. */
    public static SpriteRenderer forSwing(SpriteRendererSettings settings) {
        return new SpriteRenderer(settings, SwingUtilities::invokeLater);
    }

    // ------------------------------------------------------ configuration

    public String defaultTheme() {
        return defaultTheme;
    }

    /** The loaded theme, or null if none could be loaded yet. */
    public String theme() {
        return currentTheme;
    }

    /**
     * Switch to another theme. If it cannot be loaded, the default theme is
     * tried instead. Every client is refreshed afterwards.
     */
    public void setTheme(String theme) {
        Objects.requireNonNull(theme, "theme");
        String oldTheme = currentTheme;
        if (theme.equals(oldTheme)) return;

        log.info("Setting theme: {}", theme);
        loadingTheme = true;
        try {
            if (!loadTheme(theme) && !theme.equals(defaultTheme)) {
                log.info("Falling back to default theme: {}", defaultTheme);
                loadTheme(defaultTheme);
            }
        } finally {
            loadingTheme = false;
        }

        notifyAllClients();
        if (!Objects.equals(oldTheme, currentTheme)) {
            for (Consumer<String> listener : themeListeners) {
                listener.accept(currentTheme);
            }
        }
    }

    public void addThemeListener(Consumer<String> listener) {
        themeListeners.add(listener);
    }

    public void removeThemeListener(Consumer<String> listener) {
        themeListeners.remove(listener);
    }

    public Set<Strategy> strategies() {
        return EnumSet.copyOf(strategies);
    }

    public boolean isStrategyEnabled(Strategy strategy) {
        return strategies.contains(strategy);
    }

    /** Toggling {@link Strategy#USE_DISK_CACHE} reloads the current theme. */
    public void setStrategyEnabled(Strategy strategy, boolean enabled) {
        boolean wasEnabled = strategies.contains(strategy);
        if (enabled) {
            strategies.add(strategy);
        } else {
            strategies.remove(strategy);
        }
        if (strategy == Strategy.USE_DISK_CACHE && wasEnabled != enabled) {
            String theme = currentTheme;
            currentTheme = null; // or setTheme() returns immediately
            if (theme != null) {
                setTheme(theme);
            }
        }
    }

    public int frameBaseIndex() {
        return metadata.frameBaseIndex();
    }

    public void setFrameBaseIndex(int frameBaseIndex) {
        metadata.setFrameBaseIndex(frameBaseIndex);
    }

    public String frameSuffix() {
        return metadata.frameSuffix();
    }

    /** The pattern must contain {@code %1} exactly once; anything else resets it to {@code _%1}. */
    public void setFrameSuffix(String suffix) {
        metadata.setFrameSuffix(suffix);
    }

    // ------------------------------------------------------------ metadata

    /**
     * @return the number of animation frames, {@link #FRAME_COUNT_NOT_ANIMATED}
     *         or {@link #FRAME_COUNT_MISSING}
     */
    public int frameCount(String key) {
        if (!ensureTheme()) return FRAME_COUNT_MISSING;
        return metadata.frameCount(key);
    }

    /** Bounds of the sprite in SVG user space; empty if it does not exist. */
    public Rectangle2D boundsOnSprite(String key, int frame) {
        if (!ensureTheme()) return new Rectangle2D.Double();
        return metadata.boundsOnSprite(key, frame);
    }

    public boolean spriteExists(String key) {
        return frameCount(key) >= 0;
    }

    // ------------------------------------------------------------ pixmaps

    public BufferedImage spritePixmap(String key, Dimension size) {
        return spritePixmap(key, size, -1, Map.of());
    }

    /**
     * Render a sprite synchronously, blocking the caller until done.
     *
     * @return the sprite, or null if the size is empty or no theme is available
     */
    public BufferedImage spritePixmap(String key, Dimension size, int frame, Map<Color, Color> customColors) {
        return requestPixmap(new SpriteRequest(key, frame, size, customColors), null);
    }

    /**
     * Serve a request. With a client the request is asynchronous and the
     * result goes to {@link SpriteRendererClient#receivePixmap}; without one it
     * is synchronous and the result is returned.
     */
    BufferedImage requestPixmap(SpriteRequest request, SpriteRendererClient client) {
        if (request.isEmpty()) {
            deliver(null, client);
            return null;
        }
        if (request.exceedsRasterLimit()) {
            log.warn("Refusing to render {} at {}x{}", request.spriteKey(), request.width(), request.height());
            deliver(null, client);
            return null;
        }
        String elementKey = spriteFrameKey(request.spriteKey(), request.frame());
        String cacheKey = CacheKeys.pixmapKey(request.width(), request.height(), elementKey, request.customColors());

        if (client != null) {
            if (!clients.containsKey(client)) {
                log.debug("Ignoring request from unregistered client for {}", cacheKey);
                return null;
            }
            if (cacheKey.equals(clients.get(client))) {
                return null;
            }
            // registered before the pending check so the running job's fan-out finds it
            clients.put(client, cacheKey);
        }

        if (!ensureTheme()) {
            deliver(null, client);
            return null;
        }

        BufferedImage cached = pixmapCache.get(cacheKey);
        if (cached != null) {
            log.debug("Pixmap cache hit: {}", cacheKey);
            deliver(cached, client);
            return cached;
        }

        if (strategies.contains(Strategy.USE_DISK_CACHE) && diskCache != null) {
            BufferedImage fromDisk = diskCache.find(cacheKey)
                    .flatMap(CacheBlobs::decodeImage)
                    .map(SpriteRenderer::toDisplayImage)
                    .orElse(null);
            if (fromDisk != null) {
                log.debug("Disk cache hit: {}", cacheKey);
                pixmapCache.put(cacheKey, fromDisk);
                deliver(fromDisk, client);
                return fromDisk;
            }
        }

        if (client != null && pendingRequests.contains(cacheKey)) {
            log.debug("Joining pending render of {}", cacheKey);
            return null;
        }

        boolean synchronous = client == null;
        boolean inline = synchronous || !strategies.contains(Strategy.USE_RENDERING_THREADS);
        RenderJob job = new RenderJob(pool, cacheKey, elementKey, request, generation, inline);
        if (inline) {
            new RenderWorker(job, this::jobFinished).run();
            return pixmapCache.get(cacheKey);
        }

        pendingRequests.add(cacheKey);
        inFlight.removeIf(Future::isDone);
        inFlight.add(workers().submit(new RenderWorker(job, done -> ownerExecutor.execute(() -> jobFinished(done)))));
        log.debug("Queued render of {}", cacheKey);
        return null;
    }

    /** Runs on the owner thread for every finished job. */
    private void jobFinished(RenderJob job) {
        if (job.generation != generation) {
            log.debug("Dropping {} rendered for a previous theme", job.cacheKey);
            return;
        }
        pendingRequests.remove(job.cacheKey);
        List<SpriteRendererClient> requesters = new ArrayList<>();
        for (Map.Entry<SpriteRendererClient, String> entry : clients.entrySet()) {
            if (job.cacheKey.equals(entry.getValue())) {
                requesters.add(entry.getKey());
            }
        }

        if (job.result == null) {
            for (SpriteRendererClient requester : requesters) {
                requester.deliver(null);
            }
            return;
        }

        if (strategies.contains(Strategy.USE_DISK_CACHE) && diskCache != null) {
            diskCache.insert(job.cacheKey, CacheBlobs.encodeImage(job.result));
            // Nobody is looking at this size (e.g. an intermediate size during a
            // resize), so leave the conversion to whoever asks for it later.
            if (!job.synchronous && requesters.isEmpty()) {
                log.debug("Cached {} without conversion", job.cacheKey);
                return;
            }
        }

        BufferedImage pixmap = toDisplayImage(job.result);
        pixmapCache.put(job.cacheKey, pixmap);
        for (SpriteRendererClient requester : requesters) {
            requester.deliver(pixmap);
        }
    }

    // ------------------------------------------------------------ clients

    void registerClient(SpriteRendererClient client) {
        clients.put(client, "");
    }

    void unregisterClient(SpriteRendererClient client) {
        clients.remove(client);
    }

    int clientCount() {
        return clients.size();
    }

    /** Forget what every client was served and fetch its pixmap again. */
    public void notifyAllClients() {
        List<SpriteRendererClient> snapshot = new ArrayList<>(clients.keySet());
        for (SpriteRendererClient client : snapshot) {
            clients.put(client, "");
        }
        if (currentTheme == null) return;
        for (SpriteRendererClient client : snapshot) {
            if (clients.containsKey(client)) {
                client.fetchPixmap();
            }
        }
    }

    // ------------------------------------------------------------ lifecycle

    /** Wait for running jobs, drop all clients and release the theme. */
    @Override
    public void close() {
        waitForWorkers();
        if (workers != null) {
            workers.shutdown();
            workers = null;
        }
        clients.clear();
        pendingRequests.clear();
        generation++;
        pool.close();
        closeDiskCache();
        pixmapCache.clear();
        metadata.clear();
        currentTheme = null;
    }

    boolean isPending(String cacheKey) {
        return pendingRequests.contains(cacheKey);
    }

    int pixmapCacheSize() {
        return pixmapCache.size();
    }

    BlobCache diskCache() {
        return diskCache;
    }

    // ---------------------------------------------------------------- helpers

    String spriteFrameKey(String key, int frame) {
        if (frame >= 0 && !ensureTheme()) return key;
        return metadata.frameKey(key, frame, true);
    }

    private boolean ensureTheme() {
        if (currentTheme == null && !loadingTheme) {
            setTheme(defaultTheme);
        }
        return currentTheme != null;
    }

    private boolean loadTheme(String theme) {
        Path svg = resolveTheme(theme);
        if (svg == null) {
            log.warn("Theme {} not found in {}", theme, themesDirectory);
            return false;
        }
        SpriteRasterizer probe = rasterizerFactory.apply(svg);
        if (!probe.isValid()) {
            log.warn("Theme {} has an invalid SVG document: {}", theme, svg);
            probe.close();
            return false;
        }

        // no job may use the old source once the pool is re-pointed
        waitForWorkers();
        generation++;
        pendingRequests.clear();
        pool.setSource(svg, probe);
        pixmapCache.clear();
        metadata.clear();

        closeDiskCache();
        if (strategies.contains(Strategy.USE_DISK_CACHE)) {
            openDiskCache(theme, svg);
        }
        currentTheme = theme;
        log.info("Loaded theme {} from {}", theme, svg);
        return true;
    }

    private Path resolveTheme(String theme) {
        try {
            Path direct = Path.of(theme);
            if (theme.endsWith(".svg") && Files.isRegularFile(direct)) {
                return direct;
            }
            Path candidate = themesDirectory.resolve(theme + ".svg");
            return Files.isRegularFile(candidate) ? candidate : null;
        } catch (InvalidPathException e) {
            log.warn("Invalid theme name {}: {}", theme, e.getMessage());
            return null;
        }
    }

    private void openDiskCache(String theme, Path svg) {
        FileBlobCache cache = FileBlobCache.open(cacheDirectory.resolve(cacheName(theme)), cacheSizeBytes);
        try {
            long svgModified = Files.getLastModifiedTime(svg).toMillis();
            if (svgModified > cache.timestamp()) {
                log.info("Theme {} changed since its cache was written; clearing cache", theme);
                cache.clear();
            }
        } catch (IOException e) {
            log.warn("Could not stat {}: {}", svg, e.getMessage());
        }
        diskCache = cache;
        metadata.setDiskCache(cache);
    }

    private void closeDiskCache() {
        metadata.setDiskCache(null);
        if (diskCache != null) {
            diskCache.close();
            diskCache = null;
        }
    }

    private void waitForWorkers() {
        for (Future<?> future : inFlight) {
            try {
                future.get();
            } catch (ExecutionException e) {
                log.warn("Render job failed", e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for render jobs");
                break;
            }
        }
        inFlight.clear();
    }

    private ExecutorService workers() {
        if (workers == null) {
            AtomicInteger counter = new AtomicInteger();
            workers = Executors.newFixedThreadPool(renderThreads, runnable -> {
                Thread thread = new Thread(runnable, "sprite-render-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            });
        }
        return workers;
    }

    private void deliver(BufferedImage pixmap, SpriteRendererClient client) {
        if (client != null) {
            client.deliver(pixmap);
        }
    }

    static String cacheName(String theme) {
        return theme.replaceAll("[^A-Za-z0-9._-]", "_");
    }

    /** Copy into the screen's preferred layout; headless hosts keep the raster as is. */
    private static BufferedImage toDisplayImage(BufferedImage raw) {
        if (GraphicsEnvironment.isHeadless()) return raw;
        GraphicsConfiguration gc = GraphicsEnvironment.getLocalGraphicsEnvironment()
                .getDefaultScreenDevice().getDefaultConfiguration();
        BufferedImage compatible = gc.createCompatibleImage(raw.getWidth(), raw.getHeight(), Transparency.TRANSLUCENT);
        Graphics2D g = compatible.createGraphics();
        try {
            g.setComposite(AlphaComposite.Src);
            g.drawImage(raw, 0, 0, null);
        } finally {
            g.dispose();
        }
        return compatible;
    }
}
