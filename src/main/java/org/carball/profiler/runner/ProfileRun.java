package org.carball.profiler.runner;

import lombok.Getter;
import org.carball.profiler.model.profile.Profile;

import java.util.concurrent.CompletableFuture;

/**
 * Handle of a submitted profiling run.
 */
@Getter
public class ProfileRun {

    private final long runId;
    private final CompletableFuture<Profile> result;

    ProfileRun(long runId, CompletableFuture<Profile> result) {
        this.runId = runId;
        this.result = result;
    }
}
