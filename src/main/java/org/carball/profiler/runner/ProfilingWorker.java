package org.carball.profiler.runner;

import lombok.extern.slf4j.Slf4j;
import org.carball.profiler.config.ProfilerConfig;
import org.carball.profiler.model.ProfileRequest;
import org.carball.profiler.model.event.ErrorEvent;
import org.carball.profiler.model.event.ProfileEvent;
import org.carball.profiler.model.event.ResultEvent;
import org.carball.profiler.model.profile.Profile;
import org.carball.profiler.profiler.ColumnProfiler;
import org.carball.profiler.profiler.ProfilingException;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs profiling passes on a dedicated worker thread and reports progress, result or
 * error as {@link ProfileEvent}s.
 * <p>
 * A pass cannot be interrupted. Submitting a new request supersedes the current run:
 * the superseded run finishes in the background but none of its remaining events are
 * delivered and its future is cancelled.
 */
@Slf4j
public class ProfilingWorker implements AutoCloseable {

    static final String DEFAULT_ERROR_MESSAGE = "Profile computation failed";

    private final ColumnProfiler profiler;
    private final ExecutorService executor;
    private final AtomicLong currentRun = new AtomicLong();

    public ProfilingWorker() {
        this(ProfilerConfig.defaults());
    }

    public ProfilingWorker(ProfilerConfig config) {
        this(new ColumnProfiler(config));
    }

    public ProfilingWorker(ColumnProfiler profiler) {
        this.profiler = profiler;
        this.executor = Executors.newSingleThreadExecutor(runnable -> {
            Thread thread = new Thread(runnable, "profile-worker");
            thread.setDaemon(true);
            return thread;
        });
    }

    public ProfileRun submit(ProfileRequest request, ProfileEventListener listener) {
        long runId = currentRun.incrementAndGet();
        CompletableFuture<Profile> result = new CompletableFuture<>();
        log.debug("Submitting profiling run {}", runId);

        executor.execute(() -> execute(runId, request, listener, result));
        return new ProfileRun(runId, result);
    }

    public ProfileRun submit(ProfileRequest request) {
        return submit(request, event -> { });
    }

    private void execute(long runId, ProfileRequest request, ProfileEventListener listener,
                         CompletableFuture<Profile> result) {
        if (isSuperseded(runId)) {
            log.debug("Skipping superseded run {}", runId);
            result.cancel(false);
            return;
        }

        try {
            Profile profile = profiler.profile(request, progress -> deliver(runId, listener, progress));
            if (deliver(runId, listener, new ResultEvent(profile))) {
                result.complete(profile);
            } else {
                result.cancel(false);
            }
        } catch (Exception e) {
            String message = e.getMessage() != null && !e.getMessage().isBlank()
                    ? e.getMessage() : DEFAULT_ERROR_MESSAGE;
            log.error("Profiling run {} failed: {}", runId, message, e);
            fail(runId, listener, result, message, e instanceof ProfilingException ? e : new ProfilingException(message, e));
        } finally {
            // Errors skip the catch above; the run still has to end
            if (!result.isDone()) {
                log.error("Profiling run {} aborted without a result", runId);
                fail(runId, listener, result, DEFAULT_ERROR_MESSAGE, new ProfilingException(DEFAULT_ERROR_MESSAGE));
            }
        }
    }

    private void fail(long runId, ProfileEventListener listener, CompletableFuture<Profile> result,
                      String message, Throwable cause) {
        if (deliver(runId, listener, new ErrorEvent(message))) {
            result.completeExceptionally(cause);
        } else {
            result.cancel(false);
        }
    }

    private boolean deliver(long runId, ProfileEventListener listener, ProfileEvent event) {
        if (isSuperseded(runId)) {
            return false;
        }
        try {
            listener.onEvent(event);
        } catch (RuntimeException e) {
            log.warn("Listener of run {} failed on {} event", runId, event.type(), e);
        }
        return true;
    }

    private boolean isSuperseded(long runId) {
        return currentRun.get() != runId;
    }

    @Override
    public void close() {
        currentRun.incrementAndGet();
        executor.shutdown();
    }
}
