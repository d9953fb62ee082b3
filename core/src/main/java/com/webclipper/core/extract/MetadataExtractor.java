package com.webclipper.core.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 메타데이터 우선순위
 * - title: og:title → twitter:title → ld+json headline → &lt;title&gt; → 첫 h1 → Untitled
 * - author: meta author → article:author → ld+json author.name → byline 셀렉터
 * - published: article:published_time → ld+json datePublished → time[datetime]
 * - site: og:site_name → application-name → ld+json publisher.name
 * 깨진 ld+json 블록은 건너뛴다.
 */
public final class MetadataExtractor {
    private static final Logger LOG = LoggerFactory.getLogger(MetadataExtractor.class);
    private static final ObjectMapper JSON = new ObjectMapper();

    private static final String[] BYLINE_SELECTORS = {
            "[rel='author']",
            "[itemprop='author']",
            "[class*='byline']"
    };
    private static final int MAX_BYLINE_LEN = 140;

    public PageMetadata extract(Document doc) {
        if (doc == null) return new PageMetadata(null, null, null, null);
        List<JsonNode> ld = ldJsonBlocks(doc);

        String title = firstNonBlank(
                meta(doc, "og:title"),
                meta(doc, "twitter:title"),
                ldString(ld, "headline"),
                doc.title(),
                textOf(doc.selectFirst("h1")));

        String author = firstNonBlank(
                meta(doc, "author"),
                meta(doc, "article:author"),
                ldAuthor(ld),
                byline(doc));

        String published = firstNonBlank(
                meta(doc, "article:published_time"),
                ldString(ld, "datePublished"),
                attrOf(doc.selectFirst("time[datetime]"), "datetime"));

        String site = firstNonBlank(
                meta(doc, "og:site_name"),
                meta(doc, "application-name"),
                ldPublisher(ld));

        return new PageMetadata(title, author, published, site);
    }

    // ---------- meta ----------
    private static String meta(Document doc, String key) {
        return firstNonBlank(
                attrOf(doc.selectFirst("meta[property='" + key + "']"), "content"),
                attrOf(doc.selectFirst("meta[name='" + key + "']"), "content"));
    }

    private static String byline(Document doc) {
        for (String selector : BYLINE_SELECTORS) {
            for (Element el : doc.select(selector)) {
                String t = "meta".equals(el.normalName()) ? el.attr("content") : el.text();
                t = cleanByline(t);
                if (t != null && t.length() <= MAX_BYLINE_LEN) return t;
            }
        }
        return null;
    }

    private static String cleanByline(String s) {
        String t = safe(s);
        if (t == null) return null;
        t = t.replaceFirst("(?i)^by\\s+", "").replaceFirst("(?i)^author:\\s*", "");
        return safe(t);
    }

    // ---------- ld+json ----------
    private static List<JsonNode> ldJsonBlocks(Document doc) {
        List<JsonNode> out = new ArrayList<>();
        for (Element script : doc.select("script[type=application/ld+json]")) {
            String text = safe(script.data());
            if (text == null) continue;
            try {
                collect(JSON.readTree(text), out);
            } catch (JsonProcessingException e) {
                LOG.debug("Skipping malformed ld+json block: {}", e.getOriginalMessage());
            }
        }
        return out;
    }

    /** 배열과 @graph 를 펼쳐 객체 노드만 모은다 */
    private static void collect(JsonNode node, List<JsonNode> out) {
        if (node == null) return;
        if (node.isArray()) {
            node.forEach(n -> collect(n, out));
        } else if (node.isObject()) {
            out.add(node);
            JsonNode graph = node.get("@graph");
            if (graph != null) collect(graph, out);
        }
    }

    private static String ldString(List<JsonNode> nodes, String field) {
        for (JsonNode n : nodes) {
            JsonNode v = n.get(field);
            if (v != null && v.isTextual() && safe(v.asText()) != null) return v.asText().trim();
        }
        return null;
    }

    private static String ldAuthor(List<JsonNode> nodes) {
        for (JsonNode n : nodes) {
            String name = nameOf(n.get("author"));
            if (name != null) return name;
        }
        return null;
    }

    private static String ldPublisher(List<JsonNode> nodes) {
        for (JsonNode n : nodes) {
            String name = nameOf(n.get("publisher"));
            if (name != null) return name;
        }
        return null;
    }

    /** "이름" | {name} | [{name}, ...] */
    private static String nameOf(JsonNode v) {
        if (v == null || v.isNull()) return null;
        if (v.isTextual()) return safe(v.asText());
        if (v.isArray()) {
            for (JsonNode e : v) {
                String s = nameOf(e);
                if (s != null) return s;
            }
            return null;
        }
        if (v.isObject()) {
            JsonNode name = v.get("name");
            return (name != null && name.isTextual()) ? safe(name.asText()) : null;
        }
        return null;
    }

    // ---------- helpers ----------
    private static String textOf(Element el) {
        return el == null ? null : safe(el.text());
    }

    private static String attrOf(Element el, String attr) {
        return el == null ? null : safe(el.attr(attr));
    }

    private static String safe(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }

    private static String firstNonBlank(String... values) {
        for (String v : values) {
            String s = safe(v);
            if (s != null) return s;
        }
        return null;
    }
}
