package fr.lapetina.citationrate.infrastructure.io;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads and writes JSON documents on the file system.
 */
public final class JsonDocumentStore {

    private static final Logger log = LoggerFactory.getLogger(JsonDocumentStore.class);

    private final ObjectMapper objectMapper;

    public JsonDocumentStore() {
        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .setSerializationInclusion(JsonInclude.Include.NON_NULL)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
                .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }

    /**
     * Reads a document of the given type.
     *
     * @throws UncheckedIOException if the file cannot be read or is not valid JSON
     */
    public <T> T read(Path path, Class<T> type) {
        log.info("Reading {} from {}", type.getSimpleName(), path);
        try {
            return objectMapper.readValue(path.toFile(), type);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + path, e);
        }
    }

    /**
     * Writes a document, creating parent directories as needed.
     *
     * @throws UncheckedIOException if the file cannot be written
     */
    public void write(Path path, Object document) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writeValue(path.toFile(), document);
            log.info("Wrote {} to {}", document.getClass().getSimpleName(), path);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write " + path, e);
        }
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
