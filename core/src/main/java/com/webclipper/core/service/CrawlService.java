package com.webclipper.core.service;

import com.webclipper.core.api.ICrawler;
import com.webclipper.core.crawler.RecursiveCrawler;
import com.webclipper.core.model.CrawlConfig;
import com.webclipper.core.model.CrawlResult;
import com.webclipper.core.service.export.CrawlReportExporter;
import com.webclipper.core.service.export.JsonCrawlReportExporter;
import com.webclipper.core.util.CrawlProgressListener;
import com.webclipper.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 설정 → 크롤 → 보고서 저장을 한 번에 묶는 얇은 서비스.
 *  - 기본 생성자는 RecursiveCrawler + JSON 보고서
 *  - DI 생성자는 테스트/다른 출력 형식용
 */
public final class CrawlService {
    private static final Logger LOG = LoggerFactory.getLogger(CrawlService.class);

    private final CrawlConfig config;
    private final ICrawler crawler;
    private final CrawlReportExporter exporter;

    public CrawlService(CrawlConfig config) {
        this(config, new RecursiveCrawler(config), new JsonCrawlReportExporter());
    }

    public CrawlService(CrawlConfig config, ICrawler crawler, CrawlReportExporter exporter) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.crawler = Objects.requireNonNull(crawler, "crawler");
        this.exporter = Objects.requireNonNull(exporter, "exporter");
    }

    /** crawl.yml 경로에서 바로 */
    public static CrawlService fromYaml(Path yamlPath) throws IOException {
        return new CrawlService(YamlConfigLoader.load(yamlPath));
    }

    public CrawlResult run() {
        return run(CrawlProgressListener.NONE, null);
    }

    public CrawlResult run(CrawlProgressListener listener, AtomicBoolean cancelFlag) {
        return crawler.crawl(config.getTarget(), listener, cancelFlag);
    }

    /** 크롤 후 config.outputDir 아래에 보고서를 쓴다. @return 보고서 경로 */
    public Path runAndExport(CrawlProgressListener listener, AtomicBoolean cancelFlag) throws IOException {
        CrawlResult result = run(listener, cancelFlag);
        Path out = exporter.export(config.getOutputDir(), config, result);
        LOG.info("Report written: {}", out.toAbsolutePath());
        return out;
    }

    public CrawlConfig getConfig() { return config; }
}
