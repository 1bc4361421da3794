package org.carball.profiler.output;

public enum OutputFormat {
    JSON,
    MARKDOWN,
    BOTH
}
