package org.carball.profiler.model.event;

/**
 * Messages a profiling run emits: any number of {@link ProgressEvent}s followed by
 * exactly one {@link ResultEvent} or {@link ErrorEvent}.
 */
public interface ProfileEvent {

    EventType type();

    enum EventType {
        PROGRESS,
        RESULT,
        ERROR
    }
}
