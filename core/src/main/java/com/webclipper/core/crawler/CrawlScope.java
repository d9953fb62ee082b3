package com.webclipper.core.crawler;

import com.webclipper.core.util.UrlPatterns;
import com.webclipper.core.util.UrlUtils;

import java.util.List;

/**
 * 방문 정책. 평가 순서: 같은 도메인 → 제외 패턴 → 포함 패턴.
 * 거부는 오류가 아니다(성공/실패 어느 쪽에도 기록하지 않음).
 */
public final class CrawlScope {

    public enum Decision { ALLOW, OTHER_DOMAIN, EXCLUDED, NOT_INCLUDED }

    private final String startDomain;
    private final boolean sameDomainOnly;
    private final List<String> excludePatterns;
    private final List<String> includePatterns;

    public CrawlScope(String startAddress, boolean sameDomainOnly,
                      List<String> excludePatterns, List<String> includePatterns) {
        this.startDomain = UrlUtils.domainOf(startAddress);
        this.sameDomainOnly = sameDomainOnly;
        this.excludePatterns = (excludePatterns == null) ? List.of() : List.copyOf(excludePatterns);
        this.includePatterns = (includePatterns == null) ? List.of() : List.copyOf(includePatterns);
        UrlPatterns.validate(this.excludePatterns);
        UrlPatterns.validate(this.includePatterns);
    }

    public Decision evaluate(String address) {
        if (sameDomainOnly) {
            String d = UrlUtils.domainOf(address);
            // 빈 도메인은 범위 판정 불가 → 항상 불일치
            if (d.isEmpty() || !d.equals(startDomain)) return Decision.OTHER_DOMAIN;
        }
        if (UrlPatterns.matchesAny(address, excludePatterns)) return Decision.EXCLUDED;
        if (!includePatterns.isEmpty() && !UrlPatterns.matchesAny(address, includePatterns)) {
            return Decision.NOT_INCLUDED;
        }
        return Decision.ALLOW;
    }

    public boolean allows(String address) {
        return evaluate(address) == Decision.ALLOW;
    }

    public String getStartDomain() { return startDomain; }
}
