package com.webclipper.core.service.export;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.webclipper.core.model.CrawlConfig;
import com.webclipper.core.model.CrawlFailure;
import com.webclipper.core.model.CrawlResult;
import com.webclipper.core.model.PageRecord;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.webclipper.core.service.export.ReportNaming.context;
import static com.webclipper.core.service.export.ReportNaming.jsonPath;
import static com.webclipper.core.service.export.ReportNaming.reportsDir;

/**
 * 크롤 보고서 JSON (v1).
 * 구조: meta / summary / pages / failures / visited. 날짜는 ISO-8601 문자열.
 */
public class JsonCrawlReportExporter implements CrawlReportExporter {

    public static final String REPORT_VERSION = "1";

    private final ObjectMapper om = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    @Override
    public Path export(Path baseDir, CrawlConfig cfg, CrawlResult result) throws IOException {
        Objects.requireNonNull(result, "result");
        var ctx = context(baseDir, result.getStartAddress(), result.getStartedAt());
        Files.createDirectories(reportsDir(ctx));
        Path outFile = jsonPath(ctx);
        om.writerWithDefaultPrettyPrinter().writeValue(outFile.toFile(), toReport(cfg, result));
        return outFile;
    }

    /** 테스트/다른 출력용으로 트리만 만든다 */
    Map<String, Object> toReport(CrawlConfig cfg, CrawlResult result) {
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("meta", meta(cfg, result));
        root.put("summary", summary(result));

        List<Map<String, Object>> pages = new ArrayList<>();
        for (PageRecord p : result.getSuccess()) pages.add(page(p));
        root.put("pages", pages);

        List<Map<String, Object>> failures = new ArrayList<>();
        for (CrawlFailure f : result.getFailed()) failures.add(failure(f));
        root.put("failures", failures);

        root.put("visited", result.getVisitedAddresses());
        return root;
    }

    private static Map<String, Object> meta(CrawlConfig cfg, CrawlResult r) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("reportVersion", REPORT_VERSION);
        m.put("generatedAt", Instant.now());
        m.put("startAddress", r.getStartAddress());
        m.put("startedAt", r.getStartedAt());
        m.put("totalTimeMs", r.getTotalTimeMs());
        m.put("cancelled", r.isCancelled());
        if (cfg != null) {
            Map<String, Object> o = new LinkedHashMap<>();
            o.put("maxDepth", cfg.getMaxDepth());
            o.put("maxPages", cfg.getMaxPages());
            o.put("sameDomainOnly", cfg.isSameDomainOnly());
            o.put("excludePatterns", cfg.getExcludePatterns());
            o.put("includePatterns", cfg.getIncludePatterns());
            o.put("delayBetweenRequestsMs", cfg.getDelayBetweenRequestsMs());
            o.put("requestTimeoutMs", cfg.getRequestTimeoutMs());
            o.put("useFallbackStrategies", cfg.isUseFallbackStrategies());
            o.put("includeImages", cfg.isIncludeImages());
            o.put("minContentLength", cfg.getMinContentLength());
            // 헤더 값(쿠키 등)은 남기지 않는다
            o.put("headerNames", new ArrayList<>(cfg.getHeaders().keySet()));
            m.put("options", o);
        }
        return m;
    }

    private static Map<String, Object> summary(CrawlResult r) {
        Map<String, Object> s = new LinkedHashMap<>();
        s.put("success", r.getSuccess().size());
        s.put("failed", r.getFailed().size());
        s.put("visited", r.getVisitedAddresses().size());
        s.put("totalWords", r.getTotalWords());
        return s;
    }

    private static Map<String, Object> page(PageRecord p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("address", p.getAddress());
        m.put("title", p.getTitle());
        m.put("wordCount", p.getWordCount());
        m.put("author", p.getAuthor());
        m.put("publishedTime", p.getPublishedTime());
        m.put("siteName", p.getSiteName());
        m.put("content", p.getContent());
        return m;
    }

    private static Map<String, Object> failure(CrawlFailure f) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("address", f.getAddress());
        m.put("depth", f.getDepth());
        m.put("error", f.getErrorDescription());
        m.put("attemptedStrategies", f.getAttemptedStrategyNames());
        return m;
    }
}
