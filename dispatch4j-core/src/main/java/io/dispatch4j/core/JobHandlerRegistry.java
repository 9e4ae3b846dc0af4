package io.dispatch4j.core;

import io.dispatch4j.JobHandler;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public class JobHandlerRegistry {

    private final Map<JobType, JobHandler<?>> handlersByType;

    public JobHandlerRegistry(List<JobHandler<?>> handlers) {
        Map<JobType, JobHandler<?>> byType = new EnumMap<>(JobType.class);
        for (JobHandler<?> handler : handlers) {
            JobHandler<?> previous = byType.putIfAbsent(handler.type(), handler);
            if (previous != null) {
                throw new IllegalStateException("Duplicate JobHandler for type: " + handler.type());
            }
        }
        this.handlersByType = Collections.unmodifiableMap(byType);
    }

    public Optional<JobHandler<?>> find(JobType type) {
        return Optional.ofNullable(handlersByType.get(type));
    }
}
