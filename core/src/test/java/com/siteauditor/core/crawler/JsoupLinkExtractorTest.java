package com.siteauditor.core.crawler;

import com.siteauditor.core.http.NetworkException;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class JsoupLinkExtractorTest {

    static HttpServer s;
    static String base;

    @BeforeAll
    static void up() throws Exception {
        s = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        base = "http://127.0.0.1:" + s.getAddress().getPort();
        s.createContext("/", ex -> respond(ex, 200, "text/html; charset=utf-8", """
                <html><body>
                  <a href="/about">About</a>
                  <a href="https://other.test/x">Other</a>
                  <a href="mailto:a@b.test">Mail</a>
                  <a href="javascript:void(0)">JS</a>
                  <a href="docs/intro#part">Docs</a>
                </body></html>
                """));
        s.createContext("/missing", ex -> respond(ex, 404, "text/html", "<p>nope</p>"));
        s.createContext("/data", ex -> respond(ex, 200, "application/json", "{}"));
        s.start();
    }

    @AfterAll
    static void down() { s.stop(0); }

    static void respond(HttpExchange ex, int code, String type, String body) throws IOException {
        byte[] b = body.getBytes(StandardCharsets.UTF_8);
        ex.getResponseHeaders().add("Content-Type", type);
        ex.sendResponseHeaders(code, b.length);
        try (OutputStream os = ex.getResponseBody()) { os.write(b); }
    }

    private static JsoupLinkExtractor extractor() {
        return new JsoupLinkExtractor(5_000, true, "SiteAuditor-Test");
    }

    @Test
    void extracts_absolute_http_links_in_document_order() throws Exception {
        List<URI> links = extractor().extract(URI.create(base + "/"));
        assertThat(links).containsExactly(
                URI.create(base + "/about"),
                URI.create("https://other.test/x"),
                URI.create(base + "/docs/intro#part"));
    }

    @Test
    void http_error_and_non_html_are_plain_io_errors() {
        assertThatThrownBy(() -> extractor().extract(URI.create(base + "/missing")))
                .isInstanceOf(IOException.class)
                .isNotInstanceOf(NetworkException.class)
                .hasMessage("HTTP 404");
        assertThatThrownBy(() -> extractor().extract(URI.create(base + "/data")))
                .isInstanceOf(IOException.class)
                .isNotInstanceOf(NetworkException.class);
    }

    @Test
    void refused_connection_is_network_error() throws Exception {
        int closedPort;
        try (ServerSocket ss = new ServerSocket(0)) { closedPort = ss.getLocalPort(); }
        assertThatThrownBy(() -> extractor().extract(URI.create("http://127.0.0.1:" + closedPort + "/")))
                .isInstanceOf(NetworkException.class);
    }
}
