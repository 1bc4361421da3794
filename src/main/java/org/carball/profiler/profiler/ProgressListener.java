package org.carball.profiler.profiler;

import org.carball.profiler.model.event.ProgressEvent;

@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = progress -> { };

    void onProgress(ProgressEvent progress);
}
