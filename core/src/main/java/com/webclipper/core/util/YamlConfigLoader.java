package com.webclipper.core.util;

import com.webclipper.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * crawl.yml 을 읽어 CrawlConfig로 변환.
 *
 * 예상 YAML 키:
 * target: "https://example.com/docs"
 * sameDomainOnly: true
 * requestTimeoutMs: 15000
 * delayBetweenRequestsMs: 1000
 * useFallbackStrategies: true
 * followRedirects: true
 * includeImages: false
 * scope:
 *   maxDepth: 2
 *   maxPages: 50
 *   excludePatterns: ["/login", "re:\\?print=1"]
 *   includePatterns: ["/docs/*"]
 * headers:
 *   Cookie: "consent=1"
 * content:
 *   minContentLength: 100
 * output:
 *   dir: "out"
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig loadDefault() throws IOException {
        return load(Path.of("crawl.yml"));
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("crawl.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return fromStream(in);
        }
    }

    /** 클래스패스 리소스 등에서 직접 읽을 때 */
    public static CrawlConfig fromStream(InputStream in) throws IOException {
        Object root;
        try {
            Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
            root = yaml.load(in);
        } catch (YAMLException e) {
            throw new IOException("invalid crawl.yml: " + e.getMessage(), e);
        }

        CrawlConfig cfg = CrawlConfig.defaults();
        if (!(root instanceof Map<?, ?> map)) {
            // 비어 있으면 target 누락으로 validate에서 걸린다
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setString(map, "target", cfg::setTarget);
        setBoolean(map, "sameDomainOnly", cfg::setSameDomainOnly);
        setLong(map, "requestTimeoutMs", cfg::setRequestTimeoutMs);
        setLong(map, "delayBetweenRequestsMs", cfg::setDelayBetweenRequestsMs);
        setBoolean(map, "useFallbackStrategies", cfg::setUseFallbackStrategies);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);
        setBoolean(map, "includeImages", cfg::setIncludeImages);

        // 2) scope.*
        Map<?, ?> scope = getMap(map, "scope");
        if (scope != null) {
            setInt(scope, "maxDepth", cfg::setMaxDepth);
            setInt(scope, "maxPages", cfg::setMaxPages);
            setStringList(scope, "excludePatterns", cfg::setExcludePatterns);
            setStringList(scope, "includePatterns", cfg::setIncludePatterns);
        }

        // 3) headers: { name: value }
        Map<?, ?> headers = getMap(map, "headers");
        if (headers != null) {
            Map<String, String> h = new LinkedHashMap<>();
            headers.forEach((k, v) -> {
                if (k != null && v != null) h.put(String.valueOf(k), String.valueOf(v));
            });
            cfg.setHeaders(h);
        }

        // 4) content.*
        Map<?, ?> content = getMap(map, "content");
        if (content != null) {
            setInt(content, "minContentLength", cfg::setMinContentLength);
            setBoolean(content, "includeImages", cfg::setIncludeImages);
        }

        // 5) output.dir
        Map<?, ?> output = getMap(map, "output");
        if (output != null) {
            setString(output, "dir", s -> cfg.setOutputDir(Path.of(s)));
        }

        UrlPatterns.validate(cfg.getExcludePatterns());
        UrlPatterns.validate(cfg.getIncludePatterns());
        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setStringList(Map<?, ?> map, String key, Consumer<List<String>> setter) {
        Object v = map.get(key);
        if (v == null) return;
        List<String> out = new ArrayList<>();
        if (v instanceof List<?> list) {
            for (Object o : list) if (o != null && !String.valueOf(o).isBlank()) out.add(String.valueOf(o).trim());
        } else {
            // "a,b,c" 형태 지원
            for (String p : String.valueOf(v).split("\\s*,\\s*")) if (!p.isBlank()) out.add(p.trim());
        }
        setter.accept(out);
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v).trim()));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        setter.accept((v instanceof Number n) ? n.intValue() : parseNumber(key, v).intValue());
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v == null) return;
        setter.accept((v instanceof Number n) ? n.longValue() : parseNumber(key, v));
    }

    private static Long parseNumber(String key, Object v) {
        try {
            return Long.parseLong(String.valueOf(v).trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(key + " must be a number: " + v, e);
        }
    }
}
