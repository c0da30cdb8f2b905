package io.pgvault.core.schedule;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

public final class JobRegistry {
    private final Map<Integer, List<ScheduledJob>> jobsByOwner = new LinkedHashMap<>();

    public synchronized String add(int ownerId, ScheduledJob job) {
        Objects.requireNonNull(job, "job must not be null");
        if (job.ownerId() != ownerId) {
            throw new IllegalArgumentException("job belongs to owner " + job.ownerId() + ", not " + ownerId);
        }
        if (job.id() == null) {
            job.assignId(UUID.randomUUID().toString());
        }
        jobsByOwner.computeIfAbsent(ownerId, ignored -> new ArrayList<>()).add(job);
        return job.id();
    }

    public synchronized List<RegisteredJob> allJobs() {
        List<RegisteredJob> all = new ArrayList<>();
        jobsByOwner.forEach((ownerId, jobs) -> {
            for (ScheduledJob job : jobs) {
                all.add(new RegisteredJob(ownerId, job));
            }
        });
        return List.copyOf(all);
    }

    public synchronized List<ScheduledJob> jobsFor(int ownerId) {
        List<ScheduledJob> jobs = jobsByOwner.get(ownerId);
        return jobs == null ? List.of() : List.copyOf(jobs);
    }

    public synchronized Optional<ScheduledJob> find(String jobId) {
        if (jobId == null) {
            return Optional.empty();
        }
        return jobsByOwner.values().stream()
            .flatMap(List::stream)
            .filter(job -> jobId.equals(job.id()))
            .findFirst();
    }

    public synchronized List<Integer> owners() {
        return List.copyOf(jobsByOwner.keySet());
    }
}
