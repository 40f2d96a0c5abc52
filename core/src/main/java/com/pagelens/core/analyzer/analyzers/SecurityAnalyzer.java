package com.pagelens.core.analyzer.analyzers;

import com.pagelens.core.analyzer.AbstractAnalyzer;
import com.pagelens.core.model.AnalyzerConfig;
import com.pagelens.core.model.ParsedDocument;
import com.pagelens.core.model.Severity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 패시브 보안 점검: HTTPS, HSTS, 혼합 콘텐츠, 보안 헤더/CSP, 쿠키 플래그,
 * 안전하지 않은 폼, 인라인 핸들러, 오래된 JS 라이브러리, 노출된 비밀값, reverse tabnabbing.
 * HTTP 페이지에서는 HTTPS(CRITICAL) 외에 HSTS는 INFO로만 보고한다.
 */
public final class SecurityAnalyzer extends AbstractAnalyzer {
    public static final String NAME = "security";

    private static final long DEFAULT_HSTS_MIN_AGE = 15_552_000L; // 180일
    private static final int MAX_EVIDENCE = 5;

    private record JsLibrary(String name, Pattern pattern, String safeVersion) {
        JsLibrary(String name, String safeVersion) {
            this(name, Pattern.compile(name + "[-.]([\\d.]+?)(?:\\.min)?\\.js", Pattern.CASE_INSENSITIVE), safeVersion);
        }
    }

    /** 알려진 취약점이 없는 최소 버전 */
    private static final List<JsLibrary> JS_LIBRARIES = List.of(
            new JsLibrary("angular", "1.8.0"),
            new JsLibrary("bootstrap", "4.3.1"),
            new JsLibrary("jquery", "3.5.0"),
            new JsLibrary("lodash", "4.17.21"),
            new JsLibrary("moment", "2.29.2"),
            new JsLibrary("vue", "2.6.14")
    );

    private static final List<Pattern> SECRET_PATTERNS = List.of(
            Pattern.compile("AKIA[0-9A-Z]{16}"),
            Pattern.compile("-----BEGIN (?:RSA |EC |OPENSSH )?PRIVATE KEY-----"),
            Pattern.compile("(?i)(?:api|secret|access)[_-]?(?:key|token)[\"']?\\s*[=:]\\s*[\"'][\\w\\-]{16,}[\"']"),
            Pattern.compile("(?i)(?:password|passwd|pwd)[\"']?\\s*[=:]\\s*[\"'][^\"'\\s]{6,}[\"']")
    );

    private final boolean checkHttps;
    private final boolean checkMixedContent;
    private final boolean checkHeaders;
    private final boolean checkCookies;
    private final boolean checkForms;
    private final boolean checkXss;
    private final boolean checkLibraries;
    private final boolean checkSecrets;
    private final boolean checkTabnabbing;
    private final long hstsMinMaxAge;

    public SecurityAnalyzer(AnalyzerConfig config) {
        super(NAME, config);
        this.checkHttps = config.getBoolean("check_https", true);
        this.checkMixedContent = config.getBoolean("check_mixed_content", true);
        this.checkHeaders = config.getBoolean("check_headers", true);
        this.checkCookies = config.getBoolean("check_cookies", true);
        this.checkForms = config.getBoolean("check_forms", true);
        this.checkXss = config.getBoolean("check_xss", true);
        this.checkLibraries = config.getBoolean("check_outdated_libraries", true);
        this.checkSecrets = config.getBoolean("check_sensitive_data", true);
        this.checkTabnabbing = config.getBoolean("check_tabnabbing", true);
        this.hstsMinMaxAge = config.getInt("hsts_min_max_age", (int) DEFAULT_HSTS_MIN_AGE);
        if (hstsMinMaxAge < 0) throw new IllegalArgumentException("hsts_min_max_age must be >= 0");
    }

    @Override
    protected void inspect(ParsedDocument doc, Findings out) {
        boolean https = doc.isHttps();
        String url = String.valueOf(doc.getUrl());

        if (checkHttps && !https) {
            out.add("HTTPS", Severity.CRITICAL, "Page is not served over HTTPS", url,
                    "Serve the site over HTTPS and redirect all HTTP traffic to it.");
        }
        if (checkHeaders) {
            hsts(doc, https, out);
            headers(doc, out);
        }
        if (checkMixedContent && https) mixedContent(doc, out);
        if (checkCookies) cookies(doc, https, out);
        if (checkForms) forms(doc, https, out);
        if (checkXss) inlineHandlers(doc, out);
        if (checkLibraries) libraries(doc, out);
        if (checkSecrets) secrets(doc, out);
        if (checkTabnabbing) tabnabbing(doc, out);
    }

    /** long 범위를 넘는 max-age는 상한으로 본다. */
    static long maxAge(String digits) {
        String d = digits.replaceFirst("^0+(?=\\d)", "");
        return d.length() > 18 ? Long.MAX_VALUE : Long.parseLong(d);
    }

    private void hsts(ParsedDocument doc, boolean https, Findings out) {
        String hsts = doc.header("Strict-Transport-Security");
        if (isBlank(hsts)) {
            out.add("HSTS", https ? Severity.MEDIUM : Severity.INFO,
                    "Strict-Transport-Security header is missing",
                    "Send Strict-Transport-Security: max-age=31536000; includeSubDomains over HTTPS.");
            return;
        }
        Matcher m = Pattern.compile("max-age\\s*=\\s*\"?(\\d+)").matcher(hsts.toLowerCase(Locale.ROOT));
        long age = m.find() ? maxAge(m.group(1)) : 0L;
        if (https && age < hstsMinMaxAge) {
            out.add("HSTS", Severity.LOW, "HSTS max-age is too short (" + age + "s)",
                    "Raise HSTS max-age to at least " + hstsMinMaxAge + " seconds.");
        }
    }

    private static void headers(ParsedDocument doc, Findings out) {
        String csp = doc.header("Content-Security-Policy");
        if (isBlank(csp)) csp = doc.metaHttpEquiv("Content-Security-Policy");
        if (isBlank(csp)) {
            out.add("SECURITY_HEADERS", Severity.MEDIUM, "Content-Security-Policy is missing",
                    "Define a Content-Security-Policy that restricts script and object sources.");
        } else if (isWeakCsp(csp)) {
            out.add("CSP", Severity.MEDIUM, "Content-Security-Policy is weak or permissive: " + elide(csp, 120),
                    "Remove wildcard sources and 'unsafe-inline'/'unsafe-eval' from script-src/default-src.");
        }
        boolean frameAncestors = csp != null && csp.toLowerCase(Locale.ROOT).contains("frame-ancestors");
        if (isBlank(doc.header("X-Frame-Options")) && !frameAncestors) {
            out.add("SECURITY_HEADERS", Severity.LOW, "X-Frame-Options is missing (clickjacking protection)",
                    "Send X-Frame-Options: DENY or a CSP frame-ancestors directive.");
        }
        String xcto = doc.header("X-Content-Type-Options");
        if (isBlank(xcto) || !xcto.trim().equalsIgnoreCase("nosniff")) {
            out.add("SECURITY_HEADERS", Severity.LOW, "X-Content-Type-Options: nosniff is missing",
                    "Send X-Content-Type-Options: nosniff.");
        }
        if (isBlank(doc.header("Referrer-Policy"))) {
            out.add("SECURITY_HEADERS", Severity.INFO, "Referrer-Policy is missing",
                    "Send Referrer-Policy: strict-origin-when-cross-origin.");
        }
        if (isBlank(doc.header("Permissions-Policy"))) {
            out.add("SECURITY_HEADERS", Severity.INFO, "Permissions-Policy is missing",
                    "Send a Permissions-Policy that disables unused browser features.");
        }
    }

    static boolean isWeakCsp(String csp) {
        String lc = csp.toLowerCase(Locale.ROOT);
        for (String directive : lc.split(";")) {
            String d = directive.trim();
            if (!(d.startsWith("default-src") || d.startsWith("script-src"))) continue;
            if (d.matches(".*\\s\\*(\\s.*|$)") || d.contains("'unsafe-inline'") || d.contains("'unsafe-eval'")
                    || d.contains(" data:") || d.contains(" http:")) {
                return true;
            }
        }
        return false;
    }

    private static void mixedContent(ParsedDocument doc, Findings out) {
        List<String> active = new ArrayList<>();
        List<String> passive = new ArrayList<>();
        for (ParsedDocument.Script s : doc.getScripts()) if (isHttp(s.src())) active.add(s.src());
        for (ParsedDocument.Stylesheet s : doc.getStylesheets()) if (isHttp(s.href())) active.add(s.href());
        for (String f : doc.getIframes()) if (isHttp(f)) active.add(f);
        for (ParsedDocument.Image i : doc.getImages()) if (isHttp(i.src())) passive.add(i.src());

        if (!active.isEmpty()) {
            out.add("MIXED_CONTENT", Severity.HIGH,
                    active.size() + " script/style/frame resource(s) loaded over HTTP on an HTTPS page",
                    String.join(", ", active.subList(0, Math.min(MAX_EVIDENCE, active.size()))),
                    "Load every subresource over HTTPS.");
        }
        if (!passive.isEmpty()) {
            out.add("MIXED_CONTENT", Severity.MEDIUM,
                    passive.size() + " image(s) loaded over HTTP on an HTTPS page",
                    String.join(", ", passive.subList(0, Math.min(MAX_EVIDENCE, passive.size()))),
                    "Serve images over HTTPS or use protocol-relative HTTPS URLs.");
        }
    }

    private static void cookies(ParsedDocument doc, boolean https, Findings out) {
        for (String sc : doc.headers("Set-Cookie")) {
            String name = cookieName(sc);
            String lc = sc.toLowerCase(Locale.ROOT);
            if (!lc.contains("httponly")) {
                out.add("COOKIES", Severity.LOW, "Cookie without HttpOnly: " + name, name,
                        "Mark session cookies HttpOnly.");
            }
            if (https && !lc.contains("secure")) {
                out.add("COOKIES", Severity.MEDIUM, "Cookie without Secure on HTTPS: " + name, name,
                        "Mark cookies Secure so they are never sent over HTTP.");
            }
            if (!lc.contains("samesite")) {
                out.add("COOKIES", Severity.INFO, "Cookie without SameSite: " + name, name,
                        "Set SameSite=Lax or Strict.");
            }
        }
    }

    private static void forms(ParsedDocument doc, boolean https, Findings out) {
        for (ParsedDocument.Form f : doc.getForms()) {
            boolean password = f.fields().stream().anyMatch(x -> "password".equals(x.type()));
            if (https && isHttp(f.action())) {
                out.add("FORMS", Severity.HIGH, "Form on HTTPS page submits over HTTP", f.action(),
                        "Point form actions at HTTPS endpoints.");
            } else if (!https && password) {
                out.add("FORMS", Severity.HIGH, "Password field on a page served over HTTP", f.action(),
                        "Serve login forms only over HTTPS.");
            }
        }
    }

    private static void inlineHandlers(ParsedDocument doc, Findings out) {
        int handlers = 0;
        String first = null;
        for (ParsedDocument.Element e : doc.getElements()) {
            for (String k : e.attributes().keySet()) {
                if (k.startsWith("on") && k.length() > 2) {
                    handlers++;
                    if (first == null) first = "<" + e.tag() + " " + k + ">";
                }
            }
        }
        if (handlers > 0) {
            out.add("XSS", Severity.LOW, handlers + " inline event handler attribute(s)", first,
                    "Move event handlers into external scripts so a strict CSP can be applied.");
        }
        long jsUrls = doc.getLinks().stream()
                .filter(l -> l.rawHref() != null && l.rawHref().trim().toLowerCase(Locale.ROOT).startsWith("javascript:"))
                .count();
        if (jsUrls > 0) {
            out.add("XSS", Severity.LOW, jsUrls + " javascript: URL(s) in links",
                    "Replace javascript: links with buttons and script listeners.");
        }
    }

    private static void libraries(ParsedDocument doc, Findings out) {
        for (ParsedDocument.Script s : doc.getScripts()) {
            if (!s.isExternal()) continue;
            for (JsLibrary lib : JS_LIBRARIES) {
                Matcher m = lib.pattern().matcher(s.src());
                if (!m.find()) continue;
                String version = m.group(1).replaceAll("\\.$", "");
                if (compareVersions(version, lib.safeVersion()) < 0) {
                    out.add("OUTDATED_LIBRARY", Severity.MEDIUM,
                            lib.name() + " " + version + " has known vulnerabilities", s.src(),
                            "Upgrade " + lib.name() + " to " + lib.safeVersion() + " or later.");
                }
            }
        }
    }

    private static void secrets(ParsedDocument doc, Findings out) {
        String html = doc.getHtml();
        for (Pattern p : SECRET_PATTERNS) {
            Matcher m = p.matcher(html);
            if (m.find()) {
                String hit = m.group();
                out.add("SENSITIVE_DATA", Severity.HIGH, "Possible credential exposed in page source",
                        elide(hit, 8) + "[redacted]",
                        "Remove secrets from client-side code and rotate the exposed credential.");
            }
        }
    }

    private static void tabnabbing(ParsedDocument doc, Findings out) {
        int count = 0;
        String first = null;
        for (ParsedDocument.Link l : doc.getLinks()) {
            if (!l.targetBlank() || l.internal()) continue;
            String rel = (l.rel() == null) ? "" : l.rel().toLowerCase(Locale.ROOT);
            if (!rel.contains("noopener") && !rel.contains("noreferrer")) {
                count++;
                if (first == null) first = l.href();
            }
        }
        if (count > 0) {
            out.add("TABNABBING", Severity.LOW, count + " external target=_blank link(s) without rel=noopener", first,
                    "Add rel=\"noopener noreferrer\" to external links that open new tabs.");
        }
    }

    static int compareVersions(String a, String b) {
        String[] pa = a.split("\\.");
        String[] pb = b.split("\\.");
        for (int i = 0; i < Math.max(pa.length, pb.length); i++) {
            int x = (i < pa.length) ? toInt(pa[i]) : 0;
            int y = (i < pb.length) ? toInt(pb[i]) : 0;
            if (x != y) return Integer.compare(x, y);
        }
        return 0;
    }

    private static int toInt(String s) {
        try {
            return Integer.parseInt(s);
        } catch (NumberFormatException e) {
            return 0;
        }
    }

    private static boolean isHttp(String u) {
        return u != null && u.trim().toLowerCase(Locale.ROOT).startsWith("http://");
    }

    private static String cookieName(String setCookie) {
        int i = setCookie.indexOf('=');
        if (i <= 0) return setCookie.split(";", 2)[0].trim();
        return setCookie.substring(0, i).trim();
    }
}
