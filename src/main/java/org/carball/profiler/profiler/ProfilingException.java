package org.carball.profiler.profiler;

/**
 * Aborts a profiling run. Carries the message reported to the caller.
 */
public class ProfilingException extends RuntimeException {

    public ProfilingException(String message) {
        super(message);
    }

    public ProfilingException(String message, Throwable cause) {
        super(message, cause);
    }
}
