package org.carball.profiler.runner;

import org.carball.profiler.model.event.ProfileEvent;

/**
 * Receives the events of one profiling run, on the worker thread.
 */
@FunctionalInterface
public interface ProfileEventListener {

    void onEvent(ProfileEvent event);
}
