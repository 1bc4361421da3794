package org.carball.profiler.model.event;

import org.carball.profiler.model.profile.Profile;

public record ResultEvent(Profile profile) implements ProfileEvent {

    @Override
    public EventType type() {
        return EventType.RESULT;
    }
}
