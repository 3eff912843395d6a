package com.orderbook.common;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

/**
 * Engine configuration loaded from orderbook.yml (or classpath default).
 * All fields have sensible defaults so an engine can start without a file.
 */
public final class BookConfig {

    private static final Logger log = LoggerFactory.getLogger(BookConfig.class);

    // Store
    public int initialOrderCapacity = 1024;

    // Observability
    public int statsIntervalSecs = 5;      // 0 disables the periodic reporter
    public boolean logEvents = true;
    public boolean trackLatency = true;

    // Cancellation
    public String defaultCancelReason = "User cancelled";

    public static BookConfig defaults() {
        return new BookConfig();
    }

    public static BookConfig load(String path) {
        BookConfig cfg = new BookConfig();
        Path file = path != null ? Paths.get(path) : null;
        try (InputStream is = file != null && Files.exists(file)
                ? Files.newInputStream(file)
                : BookConfig.class.getResourceAsStream("/orderbook.yml")) {
            if (is == null) return cfg;
            Map<String, Object> map = new Yaml().load(is);
            if (map == null) return cfg;
            applyMap(cfg, map);
        } catch (Exception e) {
            log.warn("Failed to load config from {}, using defaults: {}", path, e.getMessage());
        }
        return cfg;
    }

    private static void applyMap(BookConfig cfg, Map<String, Object> map) {
        if (map.containsKey("initialOrderCapacity")) cfg.initialOrderCapacity = ((Number) map.get("initialOrderCapacity")).intValue();
        if (map.containsKey("statsIntervalSecs")) cfg.statsIntervalSecs = ((Number) map.get("statsIntervalSecs")).intValue();
        if (map.containsKey("logEvents")) cfg.logEvents = (boolean) map.get("logEvents");
        if (map.containsKey("trackLatency")) cfg.trackLatency = (boolean) map.get("trackLatency");
        if (map.containsKey("defaultCancelReason")) cfg.defaultCancelReason = (String) map.get("defaultCancelReason");
    }

    @Override
    public String toString() {
        return "BookConfig{" +
                "initialOrderCapacity=" + initialOrderCapacity +
                ", statsIntervalSecs=" + statsIntervalSecs +
                ", logEvents=" + logEvents +
                ", trackLatency=" + trackLatency +
                ", defaultCancelReason='" + defaultCancelReason + '\'' +
                '}';
    }
}
