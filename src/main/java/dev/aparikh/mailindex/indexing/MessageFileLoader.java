package dev.aparikh.mailindex.indexing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads {@code sender;subject;body;date} lines into an engine.
 * Missing trailing fields are empty, anything after the fourth field is ignored,
 * and lines with an empty sender are skipped.
 */
public class MessageFileLoader {

    private static final Logger log = LoggerFactory.getLogger(MessageFileLoader.class);

    private static final char SEPARATOR = ';';
    private static final int FIELD_COUNT = 4;

    public record MessageLine(String sender, String subject, String body, String dateKey) {
    }

    public record LoadReport(int ingested, int skipped) {
    }

    public static Optional<MessageLine> parse(String line) {
        if (line == null) return Optional.empty();
        String[] fields = new String[FIELD_COUNT];
        int start = 0;
        for (int i = 0; i < FIELD_COUNT; i++) {
            if (start > line.length()) {
                fields[i] = "";
                continue;
            }
            int end = line.indexOf(SEPARATOR, start);
            if (end < 0) end = line.length();
            fields[i] = line.substring(start, end);
            start = end + 1;
        }
        if (fields[0].isEmpty()) return Optional.empty();
        return Optional.of(new MessageLine(fields[0], fields[1], fields[2], fields[3]));
    }

    // undecodable bytes become U+FFFD, which the tokenizer treats as a separator
    private static CharsetDecoder lenientUtf8() {
        return StandardCharsets.UTF_8.newDecoder()
                .onMalformedInput(CodingErrorAction.REPLACE)
                .onUnmappableCharacter(CodingErrorAction.REPLACE);
    }

    public LoadReport load(Path file, MessageIndexEngine engine) {
        int ingested = 0;
        int skipped = 0;
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(file), lenientUtf8()))) {
            String line;
            while ((line = reader.readLine()) != null) {
                Optional<MessageLine> parsed = parse(line);
                if (parsed.isEmpty()) {
                    skipped++;
                    continue;
                }
                MessageLine m = parsed.get();
                engine.ingest(m.sender(), m.subject(), m.body(), m.dateKey());
                ingested++;
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read messages from " + file, e);
        }
        log.info("Loaded {} messages from {} ({} lines skipped)", ingested, file, skipped);
        return new LoadReport(ingested, skipped);
    }
}
