package de.bsommerfeld.storygraph.core.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import de.bsommerfeld.storygraph.core.util.StorageUtils;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Location of the SQLite database file. An empty {@code directory} means the
 * platform app-data directory resolved by {@link StorageUtils}.
 */
public class StorageConfig {

    @JsonProperty("directory")
    private String directory = "";

    @JsonProperty("file-name")
    private String fileName = "storygraph.db";

    public String getDirectory() {
        return directory;
    }

    public void setDirectory(String directory) {
        this.directory = directory;
    }

    public String getFileName() {
        return fileName;
    }

    public void setFileName(String fileName) {
        this.fileName = fileName;
    }

    /**
     * Absolute path of the database file. The parent directory is not
     * created here.
     */
    public Path resolveDatabaseFile() {
        Path dir = (directory == null || directory.isBlank())
                ? StorageUtils.getAppDataDir()
                : Paths.get(directory);
        String name = (fileName == null || fileName.isBlank()) ? "storygraph.db" : fileName;
        return dir.resolve(name).toAbsolutePath();
    }
}
