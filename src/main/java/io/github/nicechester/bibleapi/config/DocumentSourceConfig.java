package io.github.nicechester.bibleapi.config;

import com.google.cloud.storage.StorageOptions;
import io.github.nicechester.bibleapi.source.BibleSourceException;
import io.github.nicechester.bibleapi.source.DocumentSource;
import io.github.nicechester.bibleapi.source.FileSystemDocumentSource;
import io.github.nicechester.bibleapi.source.GcsDocumentSource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Random;

/**
 * Configuration for the document source holding translation XML files.
 *
 * Source types:
 * 1. filesystem (default) - a local directory, e.g. mounted into the container
 * 2. gcs - a Google Cloud Storage bucket, credentials from the environment
 *
 * A misconfigured source fails application startup.
 */
@Slf4j
@Configuration
public class DocumentSourceConfig {

    @Value("${bible.source.type:filesystem}")
    private String sourceType;

    @Value("${bible.source.directory:data}")
    private String directory;

    @Value("${bible.source.gcs.bucket:}")
    private String gcsBucket;

    @Value("${bible.source.gcs.prefix:}")
    private String gcsPrefix;

    @Bean
    public DocumentSource documentSource() {
        String type = sourceType.trim().toLowerCase(Locale.ROOT);
        log.info("Initializing '{}' Bible document source", type);

        return switch (type) {
            case "filesystem" -> new FileSystemDocumentSource(Path.of(directory));
            case "gcs" -> new GcsDocumentSource(StorageOptions.getDefaultInstance().getService(),
                gcsBucket, gcsPrefix);
            default -> throw new BibleSourceException("Unknown bible.source.type: " + sourceType);
        };
    }

    /**
     * Randomness for random-verse selection.
     */
    @Bean
    public Random verseRandom() {
        return new Random();
    }
}
