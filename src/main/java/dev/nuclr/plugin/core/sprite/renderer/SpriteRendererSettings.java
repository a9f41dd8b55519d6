package dev.nuclr.plugin.core.sprite.renderer;

import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Properties;

/**
 * Settings store for the sprite renderer.
 * Persisted to the platform user config directory as a .properties file,
 * or to an explicit file.
 */
@Slf4j
public final class SpriteRendererSettings {

    public static final String KEY_THEME                 = "sprite.renderer.theme";
    public static final String KEY_THEMES_DIRECTORY      = "sprite.renderer.themesDirectory";
    public static final String KEY_CACHE_DIRECTORY       = "sprite.renderer.cacheDirectory";
    public static final String KEY_CACHE_SIZE_MIB        = "sprite.renderer.cacheSizeMiB";
    public static final String KEY_USE_DISK_CACHE        = "sprite.renderer.useDiskCache";
    public static final String KEY_USE_RENDERING_THREADS = "sprite.renderer.useRenderingThreads";
    public static final String KEY_RENDER_THREADS        = "sprite.renderer.renderThreads";
    public static final String KEY_FRAME_BASE_INDEX      = "sprite.renderer.frameBaseIndex";
    public static final String KEY_FRAME_SUFFIX          = "sprite.renderer.frameSuffix";

    private static final String  DEFAULT_THEME          = "default";
    private static final int     DEFAULT_CACHE_SIZE_MIB = 3;
    private static final boolean DEFAULT_USE_DISK_CACHE = true;
    private static final boolean DEFAULT_USE_THREADS    = true;
    private static final int     DEFAULT_FRAME_BASE     = 0;

    private static volatile SpriteRendererSettings instance;

    private final Path file;
    private final Properties props = new Properties();

    /** Settings backed by {@code file}; a missing file means all defaults. */
    public SpriteRendererSettings(Path file) {
        this.file = file;
        load();
    }

    /** Settings in the user config directory. */
    public static SpriteRendererSettings getInstance() {
        if (instance == null) {
            synchronized (SpriteRendererSettings.class) {
                if (instance == null) {
                    instance = new SpriteRendererSettings(configDirectory().resolve("sprite-renderer.properties"));
                }
            }
        }
        return instance;
    }

    // --- Getters ---

    public String getTheme() {
        String theme = props.getProperty(KEY_THEME, DEFAULT_THEME).trim();
        return theme.isEmpty() ? DEFAULT_THEME : theme;
    }

    public Path getThemesDirectory() {
        String dir = props.getProperty(KEY_THEMES_DIRECTORY);
        return dir != null && !dir.isBlank() ? Path.of(dir.trim()) : configDirectory().resolve("themes");
    }

    public Path getCacheDirectory() {
        String dir = props.getProperty(KEY_CACHE_DIRECTORY);
        return dir != null && !dir.isBlank() ? Path.of(dir.trim()) : cacheDirectory().resolve("sprites");
    }

    /** Cache size in MiB; zero or garbage means the default of 3 MiB. */
    public int getCacheSizeMiB() {
        try {
            int raw = Integer.parseInt(props.getProperty(KEY_CACHE_SIZE_MIB, String.valueOf(DEFAULT_CACHE_SIZE_MIB)).trim());
            return raw > 0 ? raw : DEFAULT_CACHE_SIZE_MIB;
        } catch (NumberFormatException e) {
            return DEFAULT_CACHE_SIZE_MIB;
        }
    }

    public long getCacheSizeBytes() {
        return (long) getCacheSizeMiB() << 20;
    }

    public boolean isUseDiskCache() {
        return Boolean.parseBoolean(props.getProperty(KEY_USE_DISK_CACHE, String.valueOf(DEFAULT_USE_DISK_CACHE)).trim());
    }

    public boolean isUseRenderingThreads() {
        return Boolean.parseBoolean(props.getProperty(KEY_USE_RENDERING_THREADS, String.valueOf(DEFAULT_USE_THREADS)).trim());
    }

    public int getRenderThreads() {
        int fallback = Math.max(1, Runtime.getRuntime().availableProcessors());
        try {
            int raw = Integer.parseInt(props.getProperty(KEY_RENDER_THREADS, String.valueOf(fallback)).trim());
            return raw > 0 ? raw : fallback;
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public int getFrameBaseIndex() {
        try {
            return Integer.parseInt(props.getProperty(KEY_FRAME_BASE_INDEX, String.valueOf(DEFAULT_FRAME_BASE)).trim());
        } catch (NumberFormatException e) {
            return DEFAULT_FRAME_BASE;
        }
    }

    public String getFrameSuffix() {
        String suffix = props.getProperty(KEY_FRAME_SUFFIX, SpriteMetadataCache.DEFAULT_FRAME_SUFFIX);
        return SpriteMetadataCache.isValidSuffix(suffix) ? suffix : SpriteMetadataCache.DEFAULT_FRAME_SUFFIX;
    }

    // --- Setters (also persist) ---

    public synchronized void setTheme(String theme) {
        props.setProperty(KEY_THEME, theme);
        save();
    }

    public synchronized void setThemesDirectory(Path dir) {
        props.setProperty(KEY_THEMES_DIRECTORY, dir.toString());
        save();
    }

    public synchronized void setCacheDirectory(Path dir) {
        props.setProperty(KEY_CACHE_DIRECTORY, dir.toString());
        save();
    }

    public synchronized void setCacheSizeMiB(int mib) {
        props.setProperty(KEY_CACHE_SIZE_MIB, String.valueOf(mib));
        save();
    }

    public synchronized void setUseDiskCache(boolean use) {
        props.setProperty(KEY_USE_DISK_CACHE, String.valueOf(use));
        save();
    }

    public synchronized void setUseRenderingThreads(boolean use) {
        props.setProperty(KEY_USE_RENDERING_THREADS, String.valueOf(use));
        save();
    }

    public synchronized void setRenderThreads(int threads) {
        props.setProperty(KEY_RENDER_THREADS, String.valueOf(threads));
        save();
    }

    public synchronized void setFrameBaseIndex(int base) {
        props.setProperty(KEY_FRAME_BASE_INDEX, String.valueOf(base));
        save();
    }

    public synchronized void setFrameSuffix(String suffix) {
        props.setProperty(KEY_FRAME_SUFFIX, suffix);
        save();
    }

    // --- Persistence ---

    private void load() {
        if (!Files.exists(file)) return;
        try (InputStream in = Files.newInputStream(file)) {
            props.load(in);
        } catch (IOException e) {
            log.warn("Could not load sprite renderer settings, using defaults: {}", e.getMessage());
        }
    }

    private void save() {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
            try (OutputStream out = Files.newOutputStream(tmp)) {
                props.store(out, "Nuclr sprite renderer settings");
            }
            try {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            } catch (IOException e) {
                Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            log.warn("Could not save sprite renderer settings: {}", e.getMessage());
        }
    }

    private static Path configDirectory() {
        String os = System.getProperty("os.name", "").toLowerCase();
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            return (appData != null)
                    ? Path.of(appData, "nuclr")
                    : Path.of(System.getProperty("user.home"), "nuclr");
        } else if (os.contains("mac")) {
            return Path.of(System.getProperty("user.home"), "Library", "Application Support", "nuclr");
        }
        String xdg = System.getenv("XDG_CONFIG_HOME");
        return (xdg != null)
                ? Path.of(xdg, "nuclr")
                : Path.of(System.getProperty("user.home"), ".config", "nuclr");
    }

    private static Path cacheDirectory() {
        String os = System.getProperty("os.name", "").toLowerCase();
        if (os.contains("win")) {
            String localAppData = System.getenv("LOCALAPPDATA");
            return (localAppData != null)
                    ? Path.of(localAppData, "nuclr", "cache")
                    : configDirectory().resolve("cache");
        } else if (os.contains("mac")) {
            return Path.of(System.getProperty("user.home"), "Library", "Caches", "nuclr");
        }
        String xdg = System.getenv("XDG_CACHE_HOME");
        return (xdg != null)
                ? Path.of(xdg, "nuclr")
                : Path.of(System.getProperty("user.home"), ".cache", "nuclr");
    }
}
