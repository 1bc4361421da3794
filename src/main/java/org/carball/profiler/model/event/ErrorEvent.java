package org.carball.profiler.model.event;

public record ErrorEvent(String message) implements ProfileEvent {

    @Override
    public EventType type() {
        return EventType.ERROR;
    }
}
