package com.keywatch.shared.config;

import java.nio.file.Path;

public record KeyWatchConfig(
    Path source,
    String telegramBotToken,
    long ownerId,
    PipelineConfig pipeline,
    MonitorConfig monitor
) {}
