package org.gc.freegames.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.gc.freegames.domain.Subscriber;
import org.gc.freegames.domain.SubscriptionDocument;
import org.gc.freegames.domain.SubscriptionResult;
import org.gc.freegames.repository.SubscriptionRepository;
import org.springframework.stereotype.Service;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class SubscriptionService {

    private final SubscriptionRepository subscriptionRepository;

    public SubscriptionDocument listAll() {
        return subscriptionRepository.load();
    }

    public boolean isSubscribed(Subscriber subscriber) {
        return subscriptionRepository.load().contains(subscriber);
    }

    public synchronized SubscriptionResult subscribe(Subscriber subscriber) {
        SubscriptionDocument document = subscriptionRepository.load();
        List<String> subjects = document.subjects(subscriber.getType());
        if (subjects.contains(subscriber.getSubjectId())) {
            log.info("{} is already subscribed", subscriber);
            return SubscriptionResult.ALREADY_SUBSCRIBED;
        }
        subjects.add(subscriber.getSubjectId());
        if (!subscriptionRepository.save(document)) {
            return SubscriptionResult.WRITE_FAILED;
        }
        log.info("Subscribed {}", subscriber);
        return SubscriptionResult.SUBSCRIBED;
    }

    public synchronized SubscriptionResult unsubscribe(Subscriber subscriber) {
        SubscriptionDocument document = subscriptionRepository.load();
        List<String> subjects = document.subjects(subscriber.getType());
        if (!subjects.contains(subscriber.getSubjectId())) {
            log.info("{} was not subscribed", subscriber);
            return SubscriptionResult.NOT_SUBSCRIBED;
        }
        subjects.removeIf(subjectId -> subjectId.equals(subscriber.getSubjectId()));
        if (!subscriptionRepository.save(document)) {
            return SubscriptionResult.WRITE_FAILED;
        }
        log.info("Unsubscribed {}", subscriber);
        return SubscriptionResult.UNSUBSCRIBED;
    }
}
