package org.gc.freegames.repository;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.gc.freegames.domain.SubscriptionDocument;
import org.gc.freegames.properties.FreeGamesProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

import java.nio.file.Path;

@Repository
public class SubscriptionRepository extends JsonDocumentStore<SubscriptionDocument> {

    @Autowired
    public SubscriptionRepository(ObjectMapper objectMapper, FreeGamesProperties properties) {
        this(objectMapper, properties.getStore().resolve(properties.getStore().getSubscriptionsFile()));
    }

    public SubscriptionRepository(ObjectMapper objectMapper, Path file) {
        super(objectMapper, file, new TypeReference<SubscriptionDocument>() {});
    }

    @Override
    protected SubscriptionDocument emptyDocument() {
        return new SubscriptionDocument();
    }
}
