package com.keywatch.shared.config;

@FunctionalInterface
public interface ConfigPersister {

    ConfigPersister NONE = config -> {};

    void persist(MonitorConfig config);
}
