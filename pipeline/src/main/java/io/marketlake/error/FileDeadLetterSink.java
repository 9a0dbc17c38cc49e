package io.marketlake.error;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Appends one JSON object per failure to a file. {@code describer} turns the failed item into something
 * Jackson can serialize (a map or a record).
 */
public class FileDeadLetterSink<T> implements DeadLetterSink<T> {
    private static final Logger log = LoggerFactory.getLogger(FileDeadLetterSink.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final Path file;
    private final Function<T, Object> describer;

    public FileDeadLetterSink(Path file, Function<T, Object> describer) throws IOException {
        this.file = file;
        this.describer = describer;
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        if (!Files.exists(file)) {
            Files.writeString(file, "", StandardCharsets.UTF_8, StandardOpenOption.CREATE);
        }
    }

    public Path file() { return file; }

    @Override
    public synchronized void acceptFailure(String stage, T item, Throwable cause) {
        Map<String, Object> line = new LinkedHashMap<>();
        line.put("ts", Instant.now().toString());
        line.put("stage", stage);
        line.put("item", item == null ? null : describer.apply(item));
        line.put("error", cause == null ? null : cause.toString());
        try {
            String json = MAPPER.writeValueAsString(line) + System.lineSeparator();
            Files.writeString(file, json, StandardCharsets.UTF_8, StandardOpenOption.APPEND);
        } catch (JsonProcessingException e) {
            log.error("Could not serialize dead letter for stage {}: {}", stage, e.getMessage());
        } catch (IOException e) {
            log.error("Could not append dead letter to {}", file, e);
        }
    }
}
