package net.layerline.core.service;

import net.layerline.core.model.JobType;
import net.layerline.core.spi.RemoteProcessor;

import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

public final class ProcessorRegistry {
    private final Map<JobType, RemoteProcessor> byType = new EnumMap<>(JobType.class);

    public ProcessorRegistry(Collection<? extends RemoteProcessor> processors) {
        processors.forEach(this::register);
    }

    public synchronized void register(RemoteProcessor processor) {
        var prev = byType.putIfAbsent(processor.type(), processor);
        if (prev != null && prev != processor) {
            throw new IllegalStateException("duplicate processor for " + processor.type());
        }
    }

    public synchronized Optional<RemoteProcessor> find(JobType type) {
        return Optional.ofNullable(byType.get(type));
    }

    public synchronized boolean supports(JobType type) {
        return byType.containsKey(type);
    }
}
