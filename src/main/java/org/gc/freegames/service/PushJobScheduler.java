package org.gc.freegames.service;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.gc.freegames.domain.DeliveryJob;
import org.gc.freegames.domain.DeliveryOutcome;
import org.gc.freegames.domain.Subscriber;
import org.gc.freegames.properties.FreeGamesProperties;
import org.gc.freegames.repository.JobScheduleRepository;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.stream.Collectors;

/**
 * Owns one periodic time-match checker per delivery job.
 * <p>
 * Every checker ticks at the configured interval, compares the current hour and minute in the
 * reference zone with its job, and on a match hands the job to {@link PushDeliveryService}.
 * A job fires at most once per reference-zone calendar day. Handles are cancelled before they
 * leave the registry.
 */
@Slf4j
@Service
public class PushJobScheduler {

    private final TaskScheduler taskScheduler;
    private final JobScheduleRepository scheduleRepository;
    private final PushDeliveryService deliveryService;
    private final JobIds jobIds;
    private final Clock clock;
    private final ZoneOffset referenceZone;
    private final Duration tickInterval;

    private final Map<String, JobHandle> jobs = new ConcurrentHashMap<>();

    public PushJobScheduler(TaskScheduler taskScheduler,
                            JobScheduleRepository scheduleRepository,
                            PushDeliveryService deliveryService,
                            JobIds jobIds,
                            Clock clock,
                            FreeGamesProperties properties) {
        this.taskScheduler = taskScheduler;
        this.scheduleRepository = scheduleRepository;
        this.deliveryService = deliveryService;
        this.jobIds = jobIds;
        this.clock = clock;
        this.referenceZone = properties.getScheduler().referenceOffset();
        this.tickInterval = properties.getScheduler().getTickInterval();
    }

    /**
     * Schedules (or reschedules) a job and persists its time. An existing checker with the same
     * id is cancelled first, and so is any job stored under another id for the same subscriber.
     */
    public synchronized DeliveryJob addJob(String jobId, int hour, int minute, Subscriber subscriber) {
        DeliveryJob job = new DeliveryJob(jobId, hour, minute, subscriber);
        cancel(jobId);
        liveJobIdsFor(subscriber).forEach(this::cancel);

        Map<String, String> schedule = scheduleRepository.load();
        List<String> superseded = schedule.keySet().stream()
                .filter(id -> !id.equals(jobId) && targets(id, subscriber))
                .collect(Collectors.toList());
        if (!superseded.isEmpty()) {
            log.info("Job {} supersedes {} for {}", jobId, superseded, subscriber);
            superseded.forEach(schedule::remove);
        }
        schedule.put(jobId, job.scheduleValue());
        scheduleRepository.save(schedule);

        start(job);
        log.info("Added push job {} for {} at {}", jobId, subscriber, job.displayTime());
        return job;
    }

    /**
     * Cancels the checker if one is live and always drops the persisted entry.
     */
    public synchronized void removeJob(String jobId) {
        boolean wasActive = cancel(jobId);

        Map<String, String> schedule = scheduleRepository.load();
        if (schedule.remove(jobId) != null) {
            scheduleRepository.save(schedule);
        }
        log.info("Removed push job {}{}", jobId, wasActive ? "" : " (no live timer)");
    }

    /**
     * Starts a checker for every persisted job without rewriting the schedule document.
     * Entries with a malformed id or time are logged and skipped.
     *
     * @return number of jobs restored
     */
    public synchronized int restoreAll() {
        Map<String, String> schedule = scheduleRepository.load();
        int restored = 0;
        for (Map.Entry<String, String> entry : schedule.entrySet()) {
            String jobId = entry.getKey();
            try {
                Subscriber subscriber = jobIds.parse(jobId);
                DeliveryJob job = DeliveryJob.fromScheduleValue(jobId, entry.getValue(), subscriber);
                cancel(jobId);
                List<String> existing = liveJobIdsFor(subscriber);
                if (!existing.isEmpty()) {
                    log.warn("Skipping persisted job {}: {} already has job {}", jobId, subscriber, existing);
                    continue;
                }
                start(job);
                restored++;
            } catch (IllegalArgumentException e) {
                log.warn("Skipping persisted job {} -> {}: {}", jobId, entry.getValue(), e.getMessage());
            }
        }
        if (restored > 0) {
            log.info("Restored {} push job(s)", restored);
        }
        return restored;
    }

    public Optional<DeliveryJob> findJob(String jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(handle -> handle.job);
    }

    public int activeJobCount() {
        return jobs.size();
    }

    @PreDestroy
    public synchronized void shutdown() {
        jobs.values().forEach(JobHandle::cancel);
        log.debug("Cancelled {} push job timer(s)", jobs.size());
        jobs.clear();
    }

    private void start(DeliveryJob job) {
        JobHandle handle = new JobHandle(job);
        jobs.put(job.getId(), handle);
        handle.future = taskScheduler.scheduleAtFixedRate(() -> tick(handle),
                clock.instant().plus(tickInterval), tickInterval);
    }

    private List<String> liveJobIdsFor(Subscriber subscriber) {
        return jobs.values().stream()
                .map(handle -> handle.job)
                .filter(job -> job.getSubscriber().equals(subscriber))
                .map(DeliveryJob::getId)
                .collect(Collectors.toList());
    }

    private boolean targets(String jobId, Subscriber subscriber) {
        try {
            return jobIds.parse(jobId).equals(subscriber);
        } catch (IllegalArgumentException e) {
            return false;
        }
    }

    private boolean cancel(String jobId) {
        JobHandle handle = jobs.get(jobId);
        if (handle == null) {
            return false;
        }
        handle.cancel();
        jobs.remove(jobId, handle);
        return true;
    }

    void tick(JobHandle handle) {
        if (jobs.get(handle.job.getId()) != handle) {
            return;
        }
        ZonedDateTime now = ZonedDateTime.now(clock).withZoneSameInstant(referenceZone);
        if (!handle.job.matches(now.toLocalTime())) {
            return;
        }
        LocalDate today = now.toLocalDate();
        if (today.equals(handle.lastFiredOn)) {
            log.debug("Job {} already fired on {}", handle.job.getId(), today);
            return;
        }
        handle.lastFiredOn = today;

        String jobId = handle.job.getId();
        deliveryService.executeDelivery(jobId, handle.job.getSubscriber())
                .subscribe(outcome -> {
                    if (outcome == DeliveryOutcome.ORPHANED && jobs.get(jobId) == handle) {
                        removeJob(jobId);
                    }
                }, error -> log.error("Push job {} raised an error: {}", jobId, error.getMessage(), error));
    }

    static final class JobHandle {
        private final DeliveryJob job;
        private volatile ScheduledFuture<?> future;
        private volatile LocalDate lastFiredOn;

        private JobHandle(DeliveryJob job) {
            this.job = job;
        }

        private void cancel() {
            ScheduledFuture<?> current = future;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
