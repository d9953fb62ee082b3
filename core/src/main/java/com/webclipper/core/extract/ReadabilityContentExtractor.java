package com.webclipper.core.extract;

import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * 리더 모드 휴리스틱 본문 추출기 (기본 구현).
 * <ol>
 *   <li>복제본에서 script/style/nav/footer 등 보일러플레이트 제거</li>
 *   <li>class/id 가 광고·댓글·메뉴처럼 보이는 요소 제거(본문처럼 보이면 유지)</li>
 *   <li>문단 점수(1 + 쉼표 수 + 길이/100, 최대 3)를 부모에 전부, 조부모에 절반 누적</li>
 *   <li>링크 밀도로 감점 후 최고 후보 + 조건 맞는 형제 요소를 본문으로</li>
 * </ol>
 * 후보가 없으면 article → main → body 순으로 폴백.
 */
public class ReadabilityContentExtractor implements ContentExtractor {

    private static final String BOILERPLATE =
            "script, style, noscript, template, iframe, object, embed, svg, canvas, form, button, input, select, textarea,"
            + " nav, header, footer, aside, [role=navigation], [role=banner], [role=contentinfo], [aria-hidden=true]";

    private static final Pattern UNLIKELY = Pattern.compile(
            "(?i)\\b(ad|ads|advert\\w*|banner|breadcrumbs?|combx|comments?|community|cookie\\w*|disqus|gdpr"
            + "|menu|modal|newsletter|outbrain|pager|pagination|popup|promo\\w*|related|share|sharing|sidebar"
            + "|social|sponsor\\w*|subscribe|taboola|toolbar)\\b");
    private static final Pattern POSITIVE = Pattern.compile(
            "(?i)(article|body|content|entry|hentry|main|post|story|text|blog)");
    private static final Pattern NEGATIVE = Pattern.compile(
            "(?i)(hidden|comment|footer|footnote|meta|outbrain|promo|related|share|shoutbox|sidebar|sponsor|widget)");

    private static final int MIN_PARAGRAPH_LEN = 25;

    private final MetadataExtractor metadata;

    public ReadabilityContentExtractor() {
        this(new MetadataExtractor());
    }

    public ReadabilityContentExtractor(MetadataExtractor metadata) {
        this.metadata = Objects.requireNonNull(metadata, "metadata");
    }

    @Override
    public Optional<ExtractedArticle> extract(Document source, String baseAddress) {
        if (source == null) return Optional.empty();
        PageMetadata meta = metadata.extract(source);

        Document doc = source.clone();
        Element body = doc.body();
        if (body == null) return Optional.empty();

        body.select(BOILERPLATE).remove();
        removeUnlikely(body);

        Element content = pickContent(doc, body);
        if (content == null || content.text().isBlank()) return Optional.empty();
        return Optional.of(new ExtractedArticle(content.html(), meta));
    }

    // ---------- 1) 보일러플레이트 ----------
    private static void removeUnlikely(Element body) {
        List<Element> all = new ArrayList<>(body.getAllElements());
        for (Element el : all) {
            if (el == body || el.parent() == null) continue;
            String tag = el.normalName();
            if (tag.equals("article") || tag.equals("main") || tag.equals("a")) continue;
            String sig = el.className() + " " + el.id();
            if (sig.isBlank()) continue;
            if (UNLIKELY.matcher(sig).find() && !POSITIVE.matcher(sig).find()) {
                el.remove();
            }
        }
    }

    // ---------- 2) 점수 ----------
    private static Element pickContent(Document doc, Element body) {
        Map<Element, Double> scores = new LinkedHashMap<>();

        for (Element p : body.select("p, pre, blockquote, td, div")) {
            if (p.normalName().equals("div") && hasBlockChild(p)) continue; // 텍스트만 가진 div 만 문단 취급
            String text = p.text();
            if (text.length() < MIN_PARAGRAPH_LEN) continue;

            double s = 1 + countCommas(text) + Math.min(text.length() / 100, 3);
            Element parent = p.parent();
            if (parent == null) continue;
            scores.merge(parent, s + initialScore(parent, scores), Double::sum);
            Element grand = parent.parent();
            if (grand != null && grand != doc) {
                scores.merge(grand, s / 2 + initialScore(grand, scores), Double::sum);
            }
        }

        Element top = null;
        double topScore = 0;
        for (Map.Entry<Element, Double> e : scores.entrySet()) {
            double adjusted = e.getValue() * (1 - linkDensity(e.getKey()));
            e.setValue(adjusted);
            if (top == null || adjusted > topScore) {
                top = e.getKey();
                topScore = adjusted;
            }
        }

        if (top == null) {
            Element fallback = body.selectFirst("article, main, [role=main]");
            return (fallback != null) ? fallback : body;
        }
        return assemble(top, topScore, scores);
    }

    /** 후보가 처음 등장할 때만 태그/클래스 가중치를 더한다 */
    private static double initialScore(Element el, Map<Element, Double> scores) {
        if (scores.containsKey(el)) return 0;
        double s;
        switch (el.normalName()) {
            case "div": case "article": case "main": s = 5; break;
            case "pre": case "td": case "blockquote": s = 3; break;
            case "address": case "ol": case "ul": case "dl": case "dd": case "dt": case "li": case "form": s = -3; break;
            case "h1": case "h2": case "h3": case "h4": case "h5": case "h6": case "th": s = -5; break;
            default: s = 0;
        }
        String sig = el.className() + " " + el.id();
        if (POSITIVE.matcher(sig).find()) s += 25;
        if (NEGATIVE.matcher(sig).find()) s -= 25;
        return s;
    }

    // ---------- 3) 형제 요소 포함 ----------
    private static Element assemble(Element top, double topScore, Map<Element, Double> scores) {
        Element parent = top.parent();
        if (parent == null || parent.normalName().equals("html")) return top;

        double threshold = Math.max(10, topScore * 0.2);
        Element container = new Element("div");
        for (Element sib : parent.children()) {
            if (sib == top || scores.getOrDefault(sib, 0d) >= threshold || isReadableParagraph(sib)) {
                container.appendChild(sib.clone());
            }
        }
        return container;
    }

    private static boolean isReadableParagraph(Element el) {
        if (!el.normalName().equals("p")) return false;
        String text = el.text();
        double density = linkDensity(el);
        if (text.length() > 80) return density < 0.25;
        return !text.isEmpty() && density == 0 && text.matches("(?s).*\\.( |$).*");
    }

    // ---------- helpers ----------
    private static boolean hasBlockChild(Element el) {
        for (Element c : el.children()) {
            if (c.isBlock()) return true;
        }
        return false;
    }

    private static int countCommas(String text) {
        int n = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (c == ',' || c == '，' || c == '、') n++;
        }
        return n;
    }

    static double linkDensity(Element el) {
        int total = el.text().length();
        if (total == 0) return 0;
        int linked = 0;
        for (Element a : el.select("a")) linked += a.text().length();
        return Math.min(1.0, (double) linked / total);
    }
}
