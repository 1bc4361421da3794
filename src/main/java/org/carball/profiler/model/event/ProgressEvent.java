package org.carball.profiler.model.event;

public record ProgressEvent(long processedRecords, long totalRecords) implements ProfileEvent {

    @Override
    public EventType type() {
        return EventType.PROGRESS;
    }
}
