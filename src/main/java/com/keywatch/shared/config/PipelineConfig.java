package com.keywatch.shared.config;

public record PipelineConfig(int workers, long shutdownGraceSeconds, long dedupSweepMinutes) {
    public static PipelineConfig defaults() {
        return new PipelineConfig(4, 10, 60);
    }
}
