package org.gc.freegames.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * A whole-document JSON file. Every load reads the full file and every save rewrites it.
 * Read and parse failures yield the empty document; write failures are logged and reported
 * through the return value of {@link #save(Object)}.
 */
@Slf4j
public abstract class JsonDocumentStore<T> {

    private final ObjectMapper objectMapper;
    private final Path file;
    private final TypeReference<? extends T> documentType;

    protected JsonDocumentStore(ObjectMapper objectMapper, Path file, TypeReference<? extends T> documentType) {
        this.objectMapper = objectMapper;
        this.file = file;
        this.documentType = documentType;
    }

    protected abstract T emptyDocument();

    public Path getFile() {
        return file;
    }

    public T load() {
        if (!Files.exists(file)) {
            return emptyDocument();
        }
        try {
            T document = objectMapper.readValue(file.toFile(), documentType);
            return document != null ? document : emptyDocument();
        } catch (IOException e) {
            log.warn("Failed to read {}, using an empty document: {}", file, e.getMessage());
            return emptyDocument();
        }
    }

    public boolean save(T document) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), document);
            return true;
        } catch (IOException e) {
            log.error("Failed to write {}: {}", file, e.getMessage(), e);
            return false;
        }
    }
}
