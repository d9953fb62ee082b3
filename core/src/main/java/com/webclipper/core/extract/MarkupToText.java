package com.webclipper.core.extract;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;

import java.util.regex.Pattern;

/**
 * 본문 HTML → 경량 마크다운 텍스트. 단일 페이지 클리퍼와 재귀 크롤러가 같이 쓴다(순수 함수).
 * <ul>
 *   <li>h1..h6 → {@code #}..{@code ######}, p/br → 줄바꿈, li → {@code "- "} 줄</li>
 *   <li>b/strong → {@code **}, i/em → {@code *}, a → 텍스트만</li>
 *   <li>img → includeImages 면 {@code ![alt](src)}, 아니면 제거</li>
 *   <li>그 밖의 태그는 벗기고(블록 요소는 줄바꿈 하나), 엔티티는 jsoup이 디코드</li>
 * </ul>
 */
public final class MarkupToText {
    private MarkupToText() {}

    public record Options(boolean includeImages) {
        public static final Options DEFAULT = new Options(false);
    }

    private static final Pattern HSPACE = Pattern.compile("[ \\t\\u00A0\\x0B\\f]+");
    private static final Pattern SPACE_AROUND_NL = Pattern.compile(" *\\n *");
    private static final Pattern MANY_NL = Pattern.compile("\\n{3,}");

    public static String markupToText(String html, Options opts) {
        if (html == null || html.isBlank()) return "";
        Options o = (opts == null) ? Options.DEFAULT : opts;

        Document doc = Jsoup.parseBodyFragment(html);
        doc.select("script, style, noscript, template").remove();

        StringBuilder sb = new StringBuilder(html.length() / 2);
        for (Node child : doc.body().childNodes()) {
            render(child, o, sb);
        }
        return tidy(sb.toString());
    }

    public static String markupToText(String html) {
        return markupToText(html, Options.DEFAULT);
    }

    private static void render(Node node, Options o, StringBuilder out) {
        if (node instanceof TextNode t) {
            out.append(t.getWholeText().replace('\r', ' ').replace('\n', ' '));
            return;
        }
        if (!(node instanceof Element el)) return; // 주석 등

        String tag = el.normalName();
        switch (tag) {
            case "h1": case "h2": case "h3": case "h4": case "h5": case "h6": {
                int level = tag.charAt(1) - '0';
                out.append('\n').append("#".repeat(level)).append(' ');
                children(el, o, out);
                out.append('\n');
                return;
            }
            case "p":
                out.append('\n');
                children(el, o, out);
                out.append('\n');
                return;
            case "br":
                out.append('\n');
                return;
            case "li":
                out.append("- ");
                children(el, o, out);
                out.append('\n');
                return;
            case "ul": case "ol":
                out.append('\n');
                children(el, o, out);
                out.append('\n');
                return;
            case "b": case "strong":
                out.append("**");
                children(el, o, out);
                out.append("**");
                return;
            case "i": case "em":
                out.append('*');
                children(el, o, out);
                out.append('*');
                return;
            case "a":
                children(el, o, out);
                return;
            case "img":
                if (o.includeImages()) {
                    String src = el.attr("src").trim();
                    if (!src.isEmpty()) out.append("![").append(el.attr("alt").trim()).append("](").append(src).append(')');
                }
                return;
            case "pre":
                // 줄 구조는 유지(들여쓰기는 tidy 단계에서 사라짐)
                out.append('\n').append(el.wholeText().replace("\r\n", "\n")).append('\n');
                return;
            default:
                boolean block = el.isBlock();
                if (block) out.append('\n');
                children(el, o, out);
                if (block) out.append('\n');
        }
    }

    private static void children(Element el, Options o, StringBuilder out) {
        for (Node c : el.childNodes()) render(c, o, out);
    }

    private static String tidy(String s) {
        String t = HSPACE.matcher(s).replaceAll(" ");
        t = SPACE_AROUND_NL.matcher(t).replaceAll("\n");
        t = MANY_NL.matcher(t).replaceAll("\n\n");
        return t.trim();
    }
}
