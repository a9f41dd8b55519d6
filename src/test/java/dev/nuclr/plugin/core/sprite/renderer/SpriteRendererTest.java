package dev.nuclr.plugin.core.sprite.renderer;

import dev.nuclr.plugin.core.sprite.renderer.backend.BatikRasterizer;
import dev.nuclr.plugin.core.sprite.renderer.backend.SpriteRasterizer;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics2D;
import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class SpriteRendererTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final int RED = 0xFFFF0000;
    private static final int BLUE = 0xFF0000FF;

    @Rule
    public TemporaryFolder tmp = new TemporaryFolder();

    private Path themes;
    private SpriteRendererSettings settings;
    private OwnerThreadQueue queue;
    private final AtomicInteger renders = new AtomicInteger();
    private final List<SpriteRenderer> renderers = new ArrayList<>();

    @Before
    public void setUp() throws Exception {
        themes = tmp.newFolder("themes").toPath();
        TestSvgs.write(themes, "red.svg", TestSvgs.theme("#ff0000"));
        TestSvgs.write(themes, "blue.svg", TestSvgs.theme("#0000ff"));

        settings = new SpriteRendererSettings(tmp.getRoot().toPath().resolve("settings.properties"));
        settings.setThemesDirectory(themes);
        settings.setCacheDirectory(tmp.getRoot().toPath().resolve("cache"));
        settings.setTheme("red");
        settings.setCacheSizeMiB(1);
        settings.setRenderThreads(4);

        queue = new OwnerThreadQueue();
    }

    @After
    public void tearDown() {
        renderers.forEach(SpriteRenderer::close);
    }

    private SpriteRenderer newRenderer() {
        SpriteRenderer renderer = new SpriteRenderer(settings, queue,
                path -> new CountingRasterizer(new BatikRasterizer(path), renders));
        renderers.add(renderer);
        return renderer;
    }

    private static int center(BufferedImage image) {
        return image.getRGB(image.getWidth() / 2, image.getHeight() / 2);
    }

    private static int[] pixels(BufferedImage image) {
        return image.getRGB(0, 0, image.getWidth(), image.getHeight(), null, 0, image.getWidth());
    }

    // ---------------------------------------------------------------- metadata

    @Test
    public void answersQueriesAboutTheLoadedTheme() {
        SpriteRenderer renderer = newRenderer();

        assertTrue(renderer.spriteExists("ball"));
        assertEquals(4, renderer.frameCount("spin"));
        Rectangle2D bounds = renderer.boundsOnSprite("ball", -1);
        assertEquals(10, bounds.getX(), 0.01);
        assertEquals(20, bounds.getY(), 0.01);
        assertEquals(30, bounds.getWidth(), 0.01);
        assertEquals(40, bounds.getHeight(), 0.01);
        assertEquals("red", renderer.theme());
    }

    @Test
    public void reportsMissingAndNonAnimatedSprites() {
        SpriteRenderer renderer = newRenderer();

        assertEquals(SpriteRenderer.FRAME_COUNT_MISSING, renderer.frameCount("nope"));
        assertFalse(renderer.spriteExists("nope"));
        assertEquals(SpriteRenderer.FRAME_COUNT_NOT_ANIMATED, renderer.frameCount("ball"));
        assertTrue(renderer.spriteExists("ball"));
        assertTrue(renderer.boundsOnSprite("nope", -1).isEmpty());
    }

    @Test
    public void frameNumbersWrapAround() {
        SpriteRenderer renderer = newRenderer();

        assertEquals("spin_0", renderer.spriteFrameKey("spin", 4));
        assertEquals("spin_3", renderer.spriteFrameKey("spin", 7));
        assertEquals("spin", renderer.spriteFrameKey("spin", -1));
        assertEquals(renderer.boundsOnSprite("spin", 0), renderer.boundsOnSprite("spin", 4));
    }

    @Test
    public void frameNumbersWrapAroundFromCustomBase() throws Exception {
        TestSvgs.write(themes, "walk.svg", TestSvgs.walkTheme());
        settings.setTheme("walk");
        settings.setFrameBaseIndex(1);
        settings.setFrameSuffix("-%1");
        SpriteRenderer renderer = newRenderer();

        assertEquals(4, renderer.frameCount("walk"));
        assertEquals("walk-1", renderer.spriteFrameKey("walk", 5));
        assertEquals("walk-4", renderer.spriteFrameKey("walk", 0));

        Dimension size = new Dimension(8, 8);
        assertArrayEquals(pixels(renderer.spritePixmap("walk", size, 1, Map.of())),
                pixels(renderer.spritePixmap("walk", size, 5, Map.of())));
    }

    // ---------------------------------------------------------------- synchronous

    @Test
    public void repeatedRequestsGiveIdenticalPixmaps() {
        SpriteRenderer renderer = newRenderer();

        BufferedImage first = renderer.spritePixmap("ball", new Dimension(32, 32));
        BufferedImage second = renderer.spritePixmap("ball", new Dimension(32, 32));

        assertNotNull(first);
        assertEquals(32, first.getWidth());
        assertEquals(32, first.getHeight());
        assertEquals(RED, center(first));
        assertArrayEquals(pixels(first), pixels(second));
        assertSame(first, second);
        assertEquals(1, renders.get());
    }

    @Test
    public void emptySizeGivesNoPixmap() {
        SpriteRenderer renderer = newRenderer();

        assertNull(renderer.spritePixmap("ball", new Dimension(0, 10)));
        assertEquals(0, renders.get());
    }

    @Test
    public void oversizedRequestGivesNoPixmap() {
        SpriteRenderer renderer = newRenderer();

        assertNull(renderer.spritePixmap("ball", new Dimension(50_000, 50_000)));
        assertEquals(0, renders.get());
    }

    @Test
    public void customColorsAreSubstituted() {
        SpriteRenderer renderer = newRenderer();

        BufferedImage recolored = renderer.spritePixmap("ball", new Dimension(16, 16), -1, Map.of(Color.RED, Color.GREEN));
        BufferedImage plain = renderer.spritePixmap("ball", new Dimension(16, 16));

        assertEquals(0xFF00FF00, center(recolored));
        assertEquals(RED, center(plain));
        assertEquals(2, renders.get());
    }

    @Test
    public void missingThemeFallsBackToDefault() {
        SpriteRenderer renderer = newRenderer();
        renderer.setTheme("absent");
        assertEquals("red", renderer.defaultTheme());
        assertEquals("red", renderer.theme());
    }

    @Test
    public void strategiesFollowSettings() {
        assertEquals(EnumSet.allOf(SpriteRenderer.Strategy.class), newRenderer().strategies());

        settings.setUseRenderingThreads(false);
        SpriteRenderer renderer = newRenderer();
        assertEquals(EnumSet.of(SpriteRenderer.Strategy.USE_DISK_CACHE), renderer.strategies());

        renderer.setStrategyEnabled(SpriteRenderer.Strategy.USE_RENDERING_THREADS, true);
        assertTrue(renderer.isStrategyEnabled(SpriteRenderer.Strategy.USE_RENDERING_THREADS));
    }

    @Test
    public void removedThemeListenersAreNotCalled() {
        SpriteRenderer renderer = newRenderer();
        List<String> announced = new CopyOnWriteArrayList<>();
        Consumer<String> listener = announced::add;
        renderer.addThemeListener(listener);
        renderer.setTheme("blue");
        renderer.removeThemeListener(listener);
        renderer.setTheme("red");

        assertEquals(List.of("blue"), announced);
    }

    @Test
    public void brokenThemeFallsBackToDefault() throws Exception {
        TestSvgs.write(themes, "broken.svg", "<svg><rect");
        SpriteRenderer renderer = newRenderer();
        renderer.setTheme("broken");
        assertEquals("red", renderer.theme());
        assertEquals(RED, center(renderer.spritePixmap("ball", new Dimension(8, 8))));
    }

    @Test
    public void noUsableThemeGivesEmptyResults() {
        settings.setTheme("absent");
        SpriteRenderer renderer = newRenderer();

        assertNull(renderer.spritePixmap("ball", new Dimension(8, 8)));
        assertEquals(SpriteRenderer.FRAME_COUNT_MISSING, renderer.frameCount("ball"));
        assertFalse(renderer.spriteExists("ball"));
        assertTrue(renderer.boundsOnSprite("ball", -1).isEmpty());
        assertNull(renderer.theme());
    }

    @Test
    public void themeCanBeGivenAsSvgPath() {
        SpriteRenderer renderer = newRenderer();
        String path = themes.resolve("blue.svg").toString();
        renderer.setTheme(path);

        assertEquals(path, renderer.theme());
        assertEquals(BLUE, center(renderer.spritePixmap("ball", new Dimension(8, 8))));
    }

    // ---------------------------------------------------------------- asynchronous

    @Test
    public void concurrentRequestsShareOneRenderJob() throws Exception {
        SpriteRenderer renderer = newRenderer();
        renderer.setTheme("red");
        List<RecordingClient> clients = List.of(
                new RecordingClient(renderer, "ball"),
                new RecordingClient(renderer, "ball"),
                new RecordingClient(renderer, "ball"));

        for (RecordingClient client : clients) {
            client.setRenderSize(new Dimension(32, 32));
        }
        assertTrue(renderer.isPending(CacheKeys.pixmapKey(32, 32, "ball", Map.of())));

        assertTrue(queue.processEventsUntil(() -> clients.stream().allMatch(c -> c.pixmap() != null), TIMEOUT));
        assertEquals(1, renders.get());
        for (RecordingClient client : clients) {
            assertEquals(1, client.deliveries.size());
            assertSame(clients.get(0).pixmap(), client.pixmap());
            assertEquals(RED, center(client.pixmap()));
        }
        assertFalse(renderer.isPending(CacheKeys.pixmapKey(32, 32, "ball", Map.of())));
    }

    @Test
    public void oversizedClientRequestIsAnsweredEmpty() throws Exception {
        SpriteRenderer renderer = newRenderer();
        RecordingClient client = new RecordingClient(renderer, "ball");

        client.setRenderSize(new Dimension(50_000, 50_000));
        queue.processEvents();

        assertEquals(1, client.deliveries.size());
        assertNull(client.pixmap());
        assertFalse(renderer.isPending(CacheKeys.pixmapKey(50_000, 50_000, "ball", Map.of())));

        client.setRenderSize(new Dimension(16, 16));
        assertTrue(queue.processEventsUntil(() -> client.pixmap() != null, TIMEOUT));
        assertEquals(RED, center(client.pixmap()));
    }

    @Test
    public void sameRequestFromSameClientIsSuppressed() throws Exception {
        SpriteRenderer renderer = newRenderer();
        RecordingClient client = new RecordingClient(renderer, "ball");
        client.setRenderSize(new Dimension(16, 16));
        assertTrue(queue.processEventsUntil(() -> client.pixmap() != null, TIMEOUT));

        client.fetchPixmap();
        queue.processEvents();

        assertEquals(1, client.deliveries.size());
        assertEquals(1, renders.get());
    }

    @Test
    public void clientsFollowFrameChanges() throws Exception {
        SpriteRenderer renderer = newRenderer();
        RecordingClient client = new RecordingClient(renderer, "spin");
        client.setRenderSize(new Dimension(8, 8));
        client.setFrame(1);
        assertTrue(queue.processEventsUntil(() -> client.pixmap() != null, TIMEOUT));
        assertEquals(0xFF00FF00, center(client.pixmap()));

        // frame 5 is frame 1 again: already served
        client.setFrame(5);
        queue.processEvents();
        assertEquals(4, client.frameCount());
        assertTrue(client.isValid());
    }

    @Test
    public void backgroundResultsNobodyWaitsForAreOnlyCachedOnDisk() throws Exception {
        SpriteRenderer renderer = newRenderer();
        renderer.setTheme("red");
        RecordingClient client = new RecordingClient(renderer, "ball");
        String skippedKey = CacheKeys.pixmapKey(20, 20, "ball", Map.of());
        String shownKey = CacheKeys.pixmapKey(24, 24, "ball", Map.of());

        client.setRenderSize(new Dimension(20, 20));
        client.setRenderSize(new Dimension(24, 24));
        assertTrue(queue.processEventsUntil(
                () -> !renderer.isPending(skippedKey) && !renderer.isPending(shownKey), TIMEOUT));

        assertEquals(24, client.pixmap().getWidth());
        assertEquals(1, client.deliveries.size());
        assertEquals(1, renderer.pixmapCacheSize());
        assertTrue(renderer.diskCache().find(skippedKey).isPresent());

        BufferedImage fromDisk = renderer.spritePixmap("ball", new Dimension(20, 20));
        assertEquals(RED, center(fromDisk));
        assertEquals(2, renders.get());
    }

    @Test
    public void withoutThreadsClientsAreServedInline() {
        settings.setUseRenderingThreads(false);
        SpriteRenderer renderer = newRenderer();
        RecordingClient client = new RecordingClient(renderer, "ball");

        client.setRenderSize(new Dimension(12, 12));

        assertNotNull(client.pixmap());
        assertEquals(1, client.deliveries.size());
        assertEquals(0, queue.pendingCount());
    }

    @Test
    public void closedClientsAreNotServed() throws Exception {
        SpriteRenderer renderer = newRenderer();
        renderer.setTheme("red");
        RecordingClient gone = new RecordingClient(renderer, "ball");
        RecordingClient staying = new RecordingClient(renderer, "ball");

        gone.setRenderSize(new Dimension(16, 16));
        gone.close();
        staying.setRenderSize(new Dimension(16, 16));

        assertTrue(queue.processEventsUntil(() -> staying.pixmap() != null, TIMEOUT));
        assertTrue(gone.deliveries.isEmpty());
        assertEquals(1, renderer.clientCount());
    }

    // ---------------------------------------------------------------- themes

    @Test
    public void themeSwitchRefreshesClients() throws Exception {
        SpriteRenderer renderer = newRenderer();
        List<String> announced = new CopyOnWriteArrayList<>();
        renderer.addThemeListener(announced::add);
        RecordingClient client = new RecordingClient(renderer, "ball");
        client.setRenderSize(new Dimension(16, 16));
        assertTrue(queue.processEventsUntil(() -> client.pixmap() != null, TIMEOUT));
        assertEquals(RED, center(client.pixmap()));

        renderer.setTheme("blue");
        int before = client.deliveries.size();
        assertTrue(queue.processEventsUntil(() -> client.pixmap() != null && center(client.pixmap()) == BLUE, TIMEOUT));

        assertEquals(List.of("red", "blue"), announced);
        for (BufferedImage delivered : client.deliveries.subList(before, client.deliveries.size())) {
            assertEquals(BLUE, center(delivered));
        }
    }

    @Test
    public void jobsFromPreviousThemeAreDropped() throws Exception {
        SpriteRenderer renderer = newRenderer();
        renderer.setTheme("red");
        RecordingClient client = new RecordingClient(renderer, "ball");
        String key = CacheKeys.pixmapKey(16, 16, "ball", Map.of());

        client.setRenderSize(new Dimension(16, 16));
        renderer.setTheme("blue");

        assertTrue(queue.processEventsUntil(() -> client.pixmap() != null && !renderer.isPending(key), TIMEOUT));
        queue.processEvents();
        assertEquals(1, client.deliveries.size());
        assertEquals(BLUE, center(client.pixmap()));
    }

    @Test
    public void togglingDiskCacheReloadsTheme() throws Exception {
        SpriteRenderer renderer = newRenderer();
        List<String> announced = new CopyOnWriteArrayList<>();
        RecordingClient client = new RecordingClient(renderer, "ball");
        client.setRenderSize(new Dimension(16, 16));
        assertTrue(queue.processEventsUntil(() -> client.deliveries.size() == 1, TIMEOUT));
        renderer.addThemeListener(announced::add);

        renderer.setStrategyEnabled(SpriteRenderer.Strategy.USE_DISK_CACHE, false);
        assertNull(renderer.diskCache());
        assertEquals("red", renderer.theme());
        assertTrue(queue.processEventsUntil(() -> client.deliveries.size() == 2, TIMEOUT));

        renderer.setStrategyEnabled(SpriteRenderer.Strategy.USE_DISK_CACHE, true);
        assertNotNull(renderer.diskCache());
        assertTrue(queue.processEventsUntil(() -> client.deliveries.size() == 3, TIMEOUT));

        assertEquals(List.of("red", "red"), announced);
        for (BufferedImage delivered : client.deliveries) {
            assertEquals(RED, center(delivered));
        }
    }

    // ---------------------------------------------------------------- disk cache

    @Test
    public void diskCacheOutlivesRenderer() {
        SpriteRenderer first = newRenderer();
        BufferedImage rendered = first.spritePixmap("ball", new Dimension(32, 32));
        first.close();
        assertEquals(1, renders.get());

        SpriteRenderer second = newRenderer();
        BufferedImage cached = second.spritePixmap("ball", new Dimension(32, 32));

        assertEquals(1, renders.get());
        assertArrayEquals(pixels(rendered), pixels(cached));
    }

    @Test
    public void editedThemeInvalidatesDiskCache() throws Exception {
        SpriteRenderer first = newRenderer();
        first.spritePixmap("ball", new Dimension(32, 32));
        first.close();

        Files.setLastModifiedTime(themes.resolve("red.svg"),
                FileTime.fromMillis(System.currentTimeMillis() + 3_600_000));

        SpriteRenderer second = newRenderer();
        second.spritePixmap("ball", new Dimension(32, 32));
        assertEquals(2, renders.get());
    }

    @Test
    public void frameCountsOnDiskFollowFrameNaming() throws Exception {
        TestSvgs.write(themes, "walk.svg", TestSvgs.walkTheme());
        settings.setTheme("walk");
        SpriteRenderer first = newRenderer();
        assertEquals(SpriteRenderer.FRAME_COUNT_MISSING, first.frameCount("walk"));
        first.close();

        settings.setFrameBaseIndex(1);
        settings.setFrameSuffix("-%1");
        SpriteRenderer second = newRenderer();
        assertEquals(4, second.frameCount("walk"));

        second.setFrameSuffix("_%1");
        assertEquals(SpriteRenderer.FRAME_COUNT_MISSING, second.frameCount("walk"));
    }

    @Test
    public void disabledDiskCacheWritesNothing() throws Exception {
        settings.setUseDiskCache(false);
        SpriteRenderer renderer = newRenderer();
        renderer.spritePixmap("ball", new Dimension(32, 32));

        assertNull(renderer.diskCache());
        assertFalse(Files.exists(tmp.getRoot().toPath().resolve("cache").resolve("red")));
    }

    // ---------------------------------------------------------------- fixtures

    static final class RecordingClient extends SpriteRendererClient {

        final List<BufferedImage> deliveries = new ArrayList<>();

        RecordingClient(SpriteRenderer renderer, String spriteKey) {
            super(renderer, spriteKey);
        }

        @Override
        protected void receivePixmap(BufferedImage pixmap) {
            deliveries.add(pixmap);
        }
    }

    /** Counts draw calls across every instance a renderer creates. */
    static final class CountingRasterizer implements SpriteRasterizer {

        private final SpriteRasterizer delegate;
        private final AtomicInteger renders;

        CountingRasterizer(SpriteRasterizer delegate, AtomicInteger renders) {
            this.delegate = delegate;
            this.renders = renders;
        }

        @Override
        public String name() {
            return delegate.name();
        }

        @Override
        public boolean isValid() {
            return delegate.isValid();
        }

        @Override
        public boolean elementExists(String elementId) {
            return delegate.elementExists(elementId);
        }

        @Override
        public Rectangle2D boundsOnElement(String elementId) {
            return delegate.boundsOnElement(elementId);
        }

        @Override
        public void render(Graphics2D g, String elementId, Rectangle2D target) {
            renders.incrementAndGet();
            delegate.render(g, elementId, target);
        }

        @Override
        public void close() {
            delegate.close();
        }
    }
}
