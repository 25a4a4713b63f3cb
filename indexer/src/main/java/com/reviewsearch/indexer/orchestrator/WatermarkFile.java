package com.reviewsearch.indexer.orchestrator;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.Optional;

/**
 * The file recording when the last index run started, as Unix seconds.
 */
public class WatermarkFile {

    private static final Logger logger = LoggerFactory.getLogger(WatermarkFile.class);

    public static final String FILE_NAME = "timestamp";

    private final Path path;

    public WatermarkFile(Path path) {
        this.path = path;
    }

    public static WatermarkFile in(Path indexDir) {
        return new WatermarkFile(indexDir.resolve(FILE_NAME));
    }

    public Path path() {
        return path;
    }

    /**
     * Reads the watermark. A missing, unreadable or malformed file yields empty.
     */
    public Optional<Instant> read() {
        try {
            String content = Files.readString(path, StandardCharsets.UTF_8).trim();
            return Optional.of(Instant.ofEpochSecond(Long.parseLong(content)));
        } catch (NoSuchFileException e) {
            logger.info("No watermark at {}", path);
        } catch (IOException e) {
            logger.warn("Failed to read watermark at {}: {}", path, e.getMessage());
        } catch (NumberFormatException e) {
            logger.warn("Malformed watermark at {}: {}", path, e.getMessage());
        }
        return Optional.empty();
    }

    /**
     * Overwrites the watermark with the given instant, truncated to whole seconds.
     */
    public void write(Instant timestamp) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, Long.toString(timestamp.getEpochSecond()), StandardCharsets.UTF_8);
        logger.debug("Wrote watermark {} to {}", timestamp.getEpochSecond(), path);
    }
}
