package com.webclipper.core.crawler;

import com.webclipper.core.model.ExtractedLink;
import com.webclipper.core.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 기본 jsoup 기반 링크 추출기: a[href] → 절대 주소(jsoup abs:href 와 같은 관대한 해석).
 * 문서 자체의 base(location, &lt;base href&gt;)가 있으면 그것을, 없으면 baseAddress 를 기준으로 삼는다.
 * http(s) 만, 자산 확장자 제외, fragment/query 제거 후 경로 퍼센트 인코딩, 앵커 텍스트 100자 제한.
 */
public class JsoupLinkExtractor implements LinkExtractor {
    static final int MAX_ANCHOR_TEXT = 100;

    @Override
    public List<ExtractedLink> extract(Document doc, String baseAddress) {
        List<ExtractedLink> out = new ArrayList<>();
        if (doc == null) return out;

        Document src = doc;
        String base = rootedBase(baseAddress);
        if (doc.location().isEmpty() && base != null) {
            // 호출자 문서는 그대로 두고 사본에 base 를 준다
            src = doc.clone();
            src.setBaseUri(base);
        }
        Set<String> seen = new LinkedHashSet<>();

        for (Element a : src.select("a[href]")) {
            String href = a.attr("href").trim();
            if (href.isEmpty()) continue;

            String abs = a.attr("abs:href");
            if (abs.isEmpty()) continue;               // 깨진 링크
            if (!seen.add(abs)) continue;              // 페이지 내 중복(절대 주소 원문 기준)
            if (!UrlUtils.isHttpLike(abs)) continue;   // mailto:, javascript: 등

            String clean = UrlUtils.toFetchAddress(abs);
            if (UrlUtils.isAssetAddress(clean)) continue;
            if (UrlUtils.domainOf(clean).isEmpty()) continue;

            String text = a.text().trim();
            if (text.length() > MAX_ANCHOR_TEXT) text = text.substring(0, MAX_ANCHOR_TEXT);
            out.add(ExtractedLink.of(clean, text));
        }
        return out;
    }

    /** 경로 없는 base("https://a.test")에는 "/" 를 붙인다 */
    private static String rootedBase(String baseAddress) {
        if (baseAddress == null || baseAddress.isBlank()) return null;
        String b = baseAddress.trim();
        int schemeEnd = b.indexOf("://");
        if (schemeEnd >= 0 && b.indexOf('/', schemeEnd + 3) < 0
                && b.indexOf('?', schemeEnd + 3) < 0 && b.indexOf('#', schemeEnd + 3) < 0) {
            return b + "/";
        }
        return b;
    }
}
