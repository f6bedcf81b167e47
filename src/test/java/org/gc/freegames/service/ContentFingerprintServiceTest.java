package org.gc.freegames.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.gc.freegames.domain.ContentItem;
import org.gc.freegames.domain.DeliveryPayload;
import org.gc.freegames.repository.PushHistoryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContentFingerprintServiceTest {

    @TempDir
    Path dataDir;

    private PushHistoryRepository historyRepository;
    private ContentFingerprintService fingerprintService;

    @BeforeEach
    void setUp() {
        historyRepository = new PushHistoryRepository(new ObjectMapper(), dataDir.resolve("push_history.json"));
        fingerprintService = new ContentFingerprintService(historyRepository);
    }

    @Test
    void secondEvaluationOfSamePayloadIsSkipped() {
        DeliveryPayload payload = DeliveryPayload.of(ContentItem.text("1 game(s) free right now!"),
                ContentItem.image("https://cdn.example/a.png"));

        assertThat(fingerprintService.shouldDeliver("epic_group_42", payload)).isTrue();
        assertThat(fingerprintService.shouldDeliver("epic_group_42", payload)).isFalse();
        assertThat(historyRepository.load()).containsEntry("epic_group_42", fingerprintService.fingerprint(payload));
    }

    @Test
    void historyIsTrackedPerJob() {
        DeliveryPayload payload = DeliveryPayload.of(ContentItem.text("same"));

        assertThat(fingerprintService.shouldDeliver("epic_group_1", payload)).isTrue();
        assertThat(fingerprintService.shouldDeliver("epic_private_1", payload)).isTrue();
        assertThat(historyRepository.load()).hasSize(2);
    }

    @Test
    void changedContentIsDeliveredAndReplacesStoredFingerprint() {
        DeliveryPayload first = DeliveryPayload.of(ContentItem.text("Game A"));
        DeliveryPayload second = DeliveryPayload.of(ContentItem.text("Game B"));

        fingerprintService.shouldDeliver("job", first);

        assertThat(fingerprintService.shouldDeliver("job", second)).isTrue();
        assertThat(historyRepository.load().get("job")).isEqualTo(fingerprintService.fingerprint(second));
        assertThat(fingerprintService.shouldDeliver("job", first)).isTrue();
    }

    @Test
    void skipDoesNotRewriteHistory() {
        DeliveryPayload payload = DeliveryPayload.of(ContentItem.text("unchanged"));
        fingerprintService.shouldDeliver("job", payload);
        long modified = historyRepository.getFile().toFile().lastModified();
        historyRepository.getFile().toFile().setLastModified(modified - 10_000);

        fingerprintService.shouldDeliver("job", payload);

        assertThat(historyRepository.getFile().toFile().lastModified()).isEqualTo(modified - 10_000);
    }

    @Test
    void fingerprintDependsOnContentNotConstruction() {
        List<ContentItem> items = new ArrayList<>();
        items.add(ContentItem.text("header"));
        items.add(new ContentItem(ContentItem.image("u").getType(), "u"));

        DeliveryPayload built = new DeliveryPayload(items);
        DeliveryPayload literal = DeliveryPayload.of(ContentItem.text("header"), ContentItem.image("u"));
        DeliveryPayload altered = DeliveryPayload.of(ContentItem.text("header"), ContentItem.image("v"));
        DeliveryPayload reordered = DeliveryPayload.of(ContentItem.image("u"), ContentItem.text("header"));

        assertThat(fingerprintService.fingerprint(built)).isEqualTo(fingerprintService.fingerprint(literal));
        assertThat(fingerprintService.fingerprint(altered)).isNotEqualTo(fingerprintService.fingerprint(literal));
        assertThat(fingerprintService.fingerprint(reordered)).isNotEqualTo(fingerprintService.fingerprint(literal));
        assertThat(fingerprintService.fingerprint(literal)).hasSize(64).matches("[0-9a-f]+");
    }

    @Test
    void payloadSerializesOnlyItsItems() {
        DeliveryPayload payload = DeliveryPayload.of(ContentItem.text("header"));

        List<String> fields = new ArrayList<>();
        new ObjectMapper().valueToTree(payload).fieldNames().forEachRemaining(fields::add);

        assertThat(fields).containsExactly("items");
    }
}
