package com.siteauditor.core.crawler;

import com.siteauditor.core.http.NetworkException;
import org.jsoup.HttpStatusException;
import org.jsoup.Jsoup;
import org.jsoup.UnsupportedMimeTypeException;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;

/** 기본 JSoup 기반 링크 추출기: a[href] → abs:href 수집 */
public class JsoupLinkExtractor implements LinkExtractor {
    private final int timeoutMs;
    private final boolean followRedirects;
    private final String userAgent;

    public JsoupLinkExtractor(long timeoutMs, boolean followRedirects, String userAgent) {
        // jsoup timeout은 int 필요 → 안전 캐스팅
        long clamped = Math.max(0, Math.min(Integer.MAX_VALUE, timeoutMs));
        this.timeoutMs = (int) clamped;
        this.followRedirects = followRedirects;
        this.userAgent = userAgent;
    }

    @Override
    public List<URI> extract(URI base) throws IOException {
        Document doc;
        try {
            doc = Jsoup.connect(base.toString())
                    .userAgent(userAgent)
                    .timeout(timeoutMs)
                    .followRedirects(followRedirects)
                    .get();
        } catch (HttpStatusException e) {
            throw new IOException("HTTP " + e.getStatusCode(), e);
        } catch (UnsupportedMimeTypeException e) {
            throw new IOException("not HTML (" + e.getMimeType() + ")", e);
        } catch (IOException e) {
            throw new NetworkException(base, "unreachable", e);
        }
        return links(doc);
    }

    /** 파싱된 문서에서 http(s) 링크만 문서 순서대로 */
    static List<URI> links(Document doc) {
        List<URI> out = new ArrayList<>();
        for (Element a : doc.select("a[href]")) {
            String abs = a.attr("abs:href");
            if (abs.isBlank()) continue;
            try {
                URI u = new URI(abs.trim());
                String s = u.getScheme();
                if (s == null) continue;
                if (!s.equalsIgnoreCase("http") && !s.equalsIgnoreCase("https")) continue;
                out.add(u);
            } catch (URISyntaxException malformed) {
                // 잘못된 href는 링크로 취급하지 않음
                continue;
            }
        }
        return out;
    }
}
