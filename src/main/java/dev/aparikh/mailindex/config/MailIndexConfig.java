package dev.aparikh.mailindex.config;

import dev.aparikh.mailindex.indexing.MessageFileLoader;
import dev.aparikh.mailindex.indexing.MessageIndexEngine;
import dev.aparikh.mailindex.indexing.MessageIngestService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Configuration
class MailIndexConfig {

    private static final Logger log = LoggerFactory.getLogger(MailIndexConfig.class);

    private final MailIndexProperties properties;

    MailIndexConfig(MailIndexProperties properties) {
        this.properties = properties;
    }

    @Bean
    MessageIndexEngine messageIndexEngine() {
        return new MessageIndexEngine();
    }

    @Bean
    MessageFileLoader messageFileLoader() {
        return new MessageFileLoader();
    }

    @Bean
    ApplicationRunner seedMessages(MessageIngestService ingestService) {
        return args -> {
            if (properties.isPreloadSamples()) {
                ingestService.preloadSamples();
            }
            Path seed = seedFilePath();
            if (seed == null) return;
            if (!Files.isReadable(seed)) {
                log.warn("Seed file {} is not readable, starting without it", seed);
                return;
            }
            try {
                ingestService.loadFile(seed);
            } catch (UncheckedIOException e) {
                log.warn("Failed to load seed file {}, continuing with what was read", seed, e);
            }
        };
    }

    Path seedFilePath() {
        String seedFile = properties.getSeedFile();
        if (seedFile == null || seedFile.isBlank()) return null;
        return Path.of(seedFile.trim());
    }
}
