package org.gc.freegames.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import lombok.extern.slf4j.Slf4j;
import org.gc.freegames.domain.DeliveryPayload;
import org.gc.freegames.repository.PushHistoryRepository;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;

/**
 * Detects unchanged content per job by comparing payload fingerprints with the push history.
 */
@Slf4j
@Service
public class ContentFingerprintService {

    private static final String DIGEST_ALGORITHM = "SHA-256";

    private final PushHistoryRepository pushHistoryRepository;
    private final ObjectMapper canonicalMapper;

    public ContentFingerprintService(PushHistoryRepository pushHistoryRepository) {
        this.pushHistoryRepository = pushHistoryRepository;
        this.canonicalMapper = JsonMapper.builder()
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .build();
    }

    /**
     * Hex SHA-256 over the canonical JSON form of the payload.
     */
    public String fingerprint(DeliveryPayload payload) {
        try {
            byte[] canonical = canonicalMapper.writeValueAsString(payload).getBytes(StandardCharsets.UTF_8);
            return HexFormat.of().formatHex(MessageDigest.getInstance(DIGEST_ALGORITHM).digest(canonical));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Payload is not serializable", e);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(DIGEST_ALGORITHM + " is not available", e);
        }
    }

    /**
     * Returns false when the payload matches the last one evaluated for this job. Otherwise
     * records the new fingerprint before returning true, whether or not the send later succeeds.
     */
    public synchronized boolean shouldDeliver(String jobId, DeliveryPayload payload) {
        String current = fingerprint(payload);
        Map<String, String> history = pushHistoryRepository.load();
        if (current.equals(history.get(jobId))) {
            return false;
        }
        history.put(jobId, current);
        pushHistoryRepository.save(history);
        log.debug("Recorded fingerprint {} for job {}", current, jobId);
        return true;
    }
}
