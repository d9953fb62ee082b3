package com.webclipper.core.service.export;

import com.webclipper.core.model.CrawlConfig;
import com.webclipper.core.model.CrawlResult;

import java.io.IOException;
import java.nio.file.Path;

/** 크롤 결과를 파일로 내보내는 책임 */
public interface CrawlReportExporter {
    /**
     * @param baseDir 출력 루트 (null이면 "out")
     * @param cfg     실행에 쓴 설정(meta.options 에 기록)
     * @param result  크롤 결과
     * @return 생성된 파일 경로
     */
    Path export(Path baseDir, CrawlConfig cfg, CrawlResult result) throws IOException;
}
