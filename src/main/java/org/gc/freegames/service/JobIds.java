package org.gc.freegames.service;

import org.gc.freegames.domain.Subscriber;
import org.gc.freegames.domain.SubscriberType;
import org.gc.freegames.properties.FreeGamesProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Encodes subscribers into job ids ({@code prefix_token_subject}) and back.
 */
@Component
public class JobIds {

    private static final String SEPARATOR = "_";

    private final String prefix;

    @Autowired
    public JobIds(FreeGamesProperties properties) {
        this(properties.getScheduler().getJobIdPrefix());
    }

    public JobIds(String prefix) {
        this.prefix = prefix;
    }

    public String of(Subscriber subscriber) {
        return prefix + SEPARATOR + subscriber.getType().getToken() + SEPARATOR + subscriber.getSubjectId();
    }

    /**
     * Recovers the subscriber from a job id. The subject is everything after the type token,
     * so subjects containing the separator survive. A leading type token without a prefix
     * ({@code grp_1}) is accepted as well.
     *
     * @throws IllegalArgumentException if no type token can be found or the subject is empty
     */
    public Subscriber parse(String jobId) {
        if (jobId == null) {
            throw new IllegalArgumentException("Job id is null");
        }
        String[] parts = jobId.split(SEPARATOR, 3);
        if (parts.length >= 2) {
            Optional<SubscriberType> leading = SubscriberType.fromToken(parts[0]);
            if (leading.isPresent() && !parts[0].equals(prefix)) {
                return subscriber(jobId, leading.get(), jobId.substring(parts[0].length() + 1));
            }
        }
        if (parts.length < 3) {
            throw new IllegalArgumentException("Invalid job id: " + jobId);
        }
        SubscriberType type = SubscriberType.fromToken(parts[1])
                .orElseThrow(() -> new IllegalArgumentException("Unknown subscriber type in job id: " + jobId));
        return subscriber(jobId, type, parts[2]);
    }

    private static Subscriber subscriber(String jobId, SubscriberType type, String subjectId) {
        if (subjectId.isEmpty()) {
            throw new IllegalArgumentException("Missing subject in job id: " + jobId);
        }
        return new Subscriber(type, subjectId);
    }
}
