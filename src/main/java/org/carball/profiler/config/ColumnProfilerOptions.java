package org.carball.profiler.config;

import lombok.Data;
import org.carball.profiler.output.OutputFormat;

import java.nio.file.Path;

@Data
public class ColumnProfilerOptions {
    private Path recordsFile;
    private Path schemaFile;
    private Path configFile;
    private Integer topK;
    private String outputFile;
    private OutputFormat outputFormat;
    private boolean verbose;
}
