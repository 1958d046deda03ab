package com.keywatch.gateway;

import com.keywatch.channels.TelegramAdapter;
import com.keywatch.commands.CommandProcessor;
import com.keywatch.dedup.DedupCache;
import com.keywatch.filter.KeywordMatcher;
import com.keywatch.notify.NotificationDispatcher;
import com.keywatch.observability.MonitorStats;
import com.keywatch.pipeline.MonitorPipeline;
import com.keywatch.shared.config.ConfigException;
import com.keywatch.shared.config.ConfigLoader;
import com.keywatch.shared.config.ConfigStore;
import com.keywatch.shared.config.KeyWatchConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

@SpringBootApplication(scanBasePackages = "com.keywatch")
public class KeyWatchApp {

    private static final Logger log = LoggerFactory.getLogger(KeyWatchApp.class);

    public static void main(String[] args) {
        var ctx = SpringApplication.run(KeyWatchApp.class, args);

        var configPath = ConfigLoader.defaultPath();
        KeyWatchConfig config;
        try {
            config = ConfigLoader.load(configPath);
        } catch (ConfigException e) {
            log.error("Cannot start: {}", e.getMessage());
            ctx.close();
            System.exit(1);
            return;
        }
        log.info("Loaded config from {} ({} keywords)", configPath, config.monitor().keywords().size());

        var clock = Clock.systemDefaultZone();
        var store = new ConfigStore(config.monitor(), c -> ConfigLoader.save(configPath, c));
        var stats = new MonitorStats(clock);
        var dedupCache = new DedupCache(clock);

        // Channel
        var telegram = new TelegramAdapter(config.telegramBotToken(), config.ownerId());
        var dispatcher = new NotificationDispatcher(telegram, store, stats, clock);
        var commands = new CommandProcessor(store, dedupCache, dispatcher, stats);

        // Pipeline
        var pipelineConfig = config.pipeline();
        var pipeline = new MonitorPipeline(store, new KeywordMatcher(), dedupCache, dispatcher, commands,
                telegram, stats, MonitorPipeline.workerPool(pipelineConfig.workers()),
                Duration.ofSeconds(pipelineConfig.shutdownGraceSeconds()));

        // Periodic dedup sweep, independent of the size-triggered one
        var scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, "dedup-sweep");
            t.setDaemon(true);
            return t;
        });
        var sweepMinutes = pipelineConfig.dedupSweepMinutes();
        scheduler.scheduleAtFixedRate(() -> {
            try {
                dedupCache.sweep(store.snapshot().duplicates());
            } catch (Exception e) {
                log.error("Dedup sweep failed", e);
            }
        }, sweepMinutes, sweepMinutes, TimeUnit.MINUTES);

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            telegram.stop();
            pipeline.close();
            scheduler.shutdownNow();
            store.close();
            log.info("KeyWatch stopped. {}", stats.snapshot());
        }, "keywatch-shutdown"));

        telegram.start(pipeline);
        log.info("Monitoring {} with {} workers, notifications go to {}",
                telegram.id(), pipelineConfig.workers(), store.snapshot().target().describe());
    }
}
