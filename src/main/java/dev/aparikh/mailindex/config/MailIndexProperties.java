package dev.aparikh.mailindex.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Typed configuration for the message index.
 */
@Validated
@ConfigurationProperties(prefix = "mailindex")
public class MailIndexProperties {

    // sender;subject;body;date file loaded at start-up, optional
    private String seedFile;

    private boolean preloadSamples = false;

    @Positive
    private int defaultPageSize = 100;

    @Positive
    private int streamBatchSize = 1000;

    public String getSeedFile() {
        return seedFile;
    }

    public void setSeedFile(String seedFile) {
        this.seedFile = seedFile;
    }

    public boolean isPreloadSamples() {
        return preloadSamples;
    }

    public void setPreloadSamples(boolean preloadSamples) {
        this.preloadSamples = preloadSamples;
    }

    public int getDefaultPageSize() {
        return defaultPageSize;
    }

    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }

    public int getStreamBatchSize() {
        return streamBatchSize;
    }

    public void setStreamBatchSize(int streamBatchSize) {
        this.streamBatchSize = streamBatchSize;
    }
}
