package com.sitedigest.core.util;

import com.sitedigest.core.model.DedupPolicy;
import com.sitedigest.core.model.DigestConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * digest.yml 을 읽어 DigestConfig 로 변환.
 *
 * 예상 YAML 키:
 * maxPages: 15
 * dedupPolicy: STRICT | PRODUCT_REPEATS | NONE
 * fetch:
 *   timeoutMs: 15000
 *   maxAttempts: 3
 *   backoffMs: 500
 * fallback:
 *   enabled: true
 *   concurrency: 4
 *   delayMs: 500
 *   requestTimeoutMs: 20000
 *   maxAttempts: 3
 *   backoffMs: 500
 *   maxRedirects: 5
 *   crawlTimeoutMs: 90000
 * digest:
 *   maxOutputBytes: 7800
 *   maxHeadings: 4
 * server:
 *   port: 8000
 *
 * 모르는 키는 무시, 빠진 키는 기본값 유지.
 */
public final class YamlConfigLoader {

    public static final String DEFAULT_FILE = "digest.yml";

    private YamlConfigLoader() {}

    public static DigestConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException(DEFAULT_FILE + " not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    public static DigestConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        DigestConfig cfg = DigestConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setInt(map, "maxPages", cfg::setMaxPages);
        setEnum(map, "dedupPolicy", DedupPolicy.class, cfg::setDedupPolicy);

        // 2) fetch.*
        Map<?, ?> fetch = getMap(map, "fetch");
        if (fetch != null) {
            var f = cfg.fetch();
            setLong(fetch, "timeoutMs", f::setTimeoutMs);
            setInt(fetch, "maxAttempts", f::setMaxAttempts);
            setLong(fetch, "backoffMs", f::setBackoffMs);
        }

        // 3) fallback.*
        Map<?, ?> fb = getMap(map, "fallback");
        if (fb != null) {
            var f = cfg.fallback();
            setBoolean(fb, "enabled", f::setEnabled);
            setInt(fb, "concurrency", f::setConcurrency);
            setLong(fb, "delayMs", f::setDelayMs);
            setLong(fb, "requestTimeoutMs", f::setRequestTimeoutMs);
            setInt(fb, "maxAttempts", f::setMaxAttempts);
            setLong(fb, "backoffMs", f::setBackoffMs);
            setInt(fb, "maxRedirects", f::setMaxRedirects);
            setLong(fb, "crawlTimeoutMs", f::setCrawlTimeoutMs);
        }

        // 4) digest.*
        Map<?, ?> out = getMap(map, "digest");
        if (out != null) {
            setInt(out, "maxOutputBytes", cfg.output()::setMaxOutputBytes);
            setInt(out, "maxHeadings", cfg.output()::setMaxHeadings);
        }

        // 5) server.port
        Map<?, ?> server = getMap(map, "server");
        if (server != null) {
            setInt(server, "port", cfg::setServerPort);
        }

        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(Integer.parseInt(String.valueOf(v).trim()));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(Long.parseLong(String.valueOf(v).trim()));
    }

    private static <E extends Enum<E>> void setEnum(Map<?, ?> map, String key, Class<E> type, Consumer<E> setter) {
        Object v = map.get(key);
        if (v == null) return;
        String s = String.valueOf(v).trim().replace('-', '_');
        for (E e : type.getEnumConstants()) {
            if (e.name().equalsIgnoreCase(s)) {
                setter.accept(e);
                return;
            }
        }
        throw new IllegalArgumentException("Unknown " + key + ": " + v
                + " (expected one of " + java.util.Arrays.toString(type.getEnumConstants()).toLowerCase(Locale.ROOT) + ")");
    }
}
