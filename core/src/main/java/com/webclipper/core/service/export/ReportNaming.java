package com.webclipper.core.service.export;

import java.net.URI;
import java.nio.file.Path;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;

/** out/reports/&lt;host&gt;/crawl-&lt;slug&gt;-&lt;yyyyMMdd-HHmm&gt;.json 규칙 */
public final class ReportNaming {
    private ReportNaming() {}

    public static final DateTimeFormatter TS_FMT =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmm").withZone(ZoneId.systemDefault());

    public record ReportContext(Path baseDir, String host, String slug, Instant startedAt) {}

    public static ReportContext context(Path baseDir, String startAddress, Instant startedAt) {
        Path out = (baseDir == null) ? Path.of("out") : baseDir;
        return new ReportContext(out, hostOf(startAddress), slugOf(startAddress),
                startedAt == null ? Instant.now() : startedAt);
    }

    public static Path reportsDir(ReportContext ctx) { return ctx.baseDir().resolve("reports").resolve(ctx.host()); }
    public static Path jsonPath(ReportContext ctx) { return reportsDir(ctx).resolve(filePrefix(ctx) + ".json"); }

    public static String filePrefix(ReportContext ctx) {
        return "crawl-" + ctx.slug() + "-" + TS_FMT.format(ctx.startedAt());
    }

    static String hostOf(String address) {
        if (address == null || address.isBlank()) return "unknown-host";
        try {
            String h = URI.create(address.trim()).getHost();
            return (h == null) ? "unknown-host" : h.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._-]", "-");
        } catch (IllegalArgumentException e) {
            return "unknown-host";
        }
    }

    static String slugOf(String address) {
        if (address == null || address.isBlank()) return "no-url";
        String s = address.trim().toLowerCase(Locale.ROOT).replaceFirst("^https?://", "");
        s = s.replaceAll("[^a-z0-9._/-]", "-").replace('/', '-').replaceAll("-{2,}", "-");
        if (s.length() > 60) s = s.substring(0, 60);
        s = s.replaceAll("^-+|-+$", "");
        return s.isEmpty() ? "no-url" : s;
    }
}
