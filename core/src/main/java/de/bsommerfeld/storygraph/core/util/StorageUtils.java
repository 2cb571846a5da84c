package de.bsommerfeld.storygraph.core.util;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

/**
 * Resolves where StoryGraph keeps its files on each platform. Paths are
 * absolute but not created.
 *
 * <ul>
 * <li><strong>macOS</strong>: {@code ~/Library/Application Support/<app>}</li>
 * <li><strong>Windows</strong>: {@code %APPDATA%\<app>}, else
 * {@code ~/AppData/Roaming/<app>}</li>
 * <li><strong>Linux and others</strong>: {@code $XDG_DATA_HOME/<app>}, else
 * {@code ~/.local/share/<app>}</li>
 * </ul>
 */
public final class StorageUtils {

    public static final String APP_NAME = "storygraph";
    public static final String CONFIG_FILE = "config.toml";

    private StorageUtils() {
    }

    public static Path getAppDataDir() {
        return getAppDataDir(APP_NAME);
    }

    public static Path getAppDataDir(String appName) {
        String os = System.getProperty("os.name", "generic").toLowerCase(Locale.ENGLISH);
        String home = System.getProperty("user.home");

        if (os.contains("mac") || os.contains("darwin")) {
            return Paths.get(home, "Library", "Application Support", appName).toAbsolutePath();
        }
        if (os.contains("win")) {
            String appData = System.getenv("APPDATA");
            Path base = appData != null ? Paths.get(appData) : Paths.get(home, "AppData", "Roaming");
            return base.resolve(appName).toAbsolutePath();
        }
        String xdgData = System.getenv("XDG_DATA_HOME");
        Path base = (xdgData != null && !xdgData.isEmpty())
                ? Paths.get(xdgData)
                : Paths.get(home, ".local", "share");
        return base.resolve(appName).toAbsolutePath();
    }

    /**
     * Default location of {@code config.toml}.
     */
    public static Path getConfigFile() {
        return getAppDataDir().resolve(CONFIG_FILE);
    }
}
