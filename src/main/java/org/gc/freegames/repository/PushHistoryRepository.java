package org.gc.freegames.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.gc.freegames.properties.FreeGamesProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Job id to the fingerprint of the last evaluated payload.
 */
@Repository
public class PushHistoryRepository extends JsonDocumentStore<Map<String, String>> {

    @Autowired
    public PushHistoryRepository(ObjectMapper objectMapper, FreeGamesProperties properties) {
        this(objectMapper, properties.getStore().resolve(properties.getStore().getPushHistoryFile()));
    }

    public PushHistoryRepository(ObjectMapper objectMapper, Path file) {
        super(objectMapper, file, new TypeReference<LinkedHashMap<String, String>>() {});
    }

    @Override
    protected Map<String, String> emptyDocument() {
        return new LinkedHashMap<>();
    }
}
