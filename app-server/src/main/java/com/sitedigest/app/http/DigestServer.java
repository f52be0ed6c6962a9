package com.sitedigest.app.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sitedigest.core.api.SiteDigester;
import com.sitedigest.core.crawler.SiteUnreachableException;
import com.sitedigest.core.model.DigestResult;
import com.sitedigest.core.model.InvalidTargetException;
import com.sitedigest.core.util.StructuredLog;
import com.sitedigest.core.util.NamedThreadFactory;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * 얇은 HTTP 엔드포인트.
 *  - GET  /        → 200 {"status":"ok"}
 *  - POST /digest  {"url": "..."} (또는 그 객체를 JSON 문자열로 한 번 더 감싼 본문)
 *                  → 200 {domain, categories, hasPricing, hasBlog, hasCareers, pageCount, content}
 * 실패는 상태 코드로 구분: 400 입력 오류, 502 사이트 접근 불가, 500 그 외. 본문은 {"detail": ...}.
 */
public final class DigestServer implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(DigestServer.class);
    private static final StructuredLog SLOG = StructuredLog.get(DigestServer.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final SiteDigester digester;
    private final HttpServer server;
    private final ExecutorService executor;

    public DigestServer(SiteDigester digester, int port, int workers) throws IOException {
        this.digester = Objects.requireNonNull(digester, "digester");
        this.server = HttpServer.create(new InetSocketAddress(port), 0);
        this.executor = Executors.newFixedThreadPool(Math.max(1, workers), new NamedThreadFactory("http-worker"));
        this.server.createContext("/", this::handle);
        this.server.setExecutor(executor);
    }

    public DigestServer start() {
        server.start();
        LOG.info("Digest server listening on port {}", port());
        return this;
    }

    public int port() { return server.getAddress().getPort(); }

    @Override public void close() {
        server.stop(0);
        executor.shutdownNow();
    }

    // ---------- routing ----------

    void handle(HttpExchange ex) throws IOException {
        try {
            String path = ex.getRequestURI().getPath();
            String method = ex.getRequestMethod().toUpperCase(Locale.ROOT);
            if ("/".equals(path)) {
                if (!"GET".equals(method)) { methodNotAllowed(ex, "GET"); return; }
                json(ex, 200, MAPPER.createObjectNode().put("status", "ok"));
            } else if ("/digest".equals(path)) {
                if (!"POST".equals(method)) { methodNotAllowed(ex, "POST"); return; }
                digest(ex);
            } else {
                json(ex, 404, detail("Not found"));
            }
        } finally {
            ex.close();
        }
    }

    private void digest(HttpExchange ex) throws IOException {
        String url;
        try {
            url = parseUrl(ex.getRequestBody());
        } catch (BadRequest e) {
            json(ex, 400, detail(e.getMessage()));
            return;
        }

        try {
            DigestResult r = digester.digest(url);
            json(ex, 200, toJson(r));
        } catch (InvalidTargetException e) {
            json(ex, 400, detail(e.getMessage()));
        } catch (SiteUnreachableException e) {
            LOG.warn("Site unreachable: {}", e.getDomain());
            ObjectNode body = MAPPER.createObjectNode();
            body.put("domain", e.getDomain());
            body.put("detail", e.getMessage());
            json(ex, 502, body);
        } catch (RuntimeException e) {
            LOG.error("Digest failed for {}", url, e);
            SLOG.error("request-failed", e, "url", url);
            json(ex, 500, detail("Internal error: " + e.getClass().getSimpleName()));
        }
    }

    /** 본문 → url. 객체 또는 객체를 담은 JSON 문자열 모두 허용 */
    static String parseUrl(InputStream in) throws IOException {
        JsonNode node;
        try {
            node = MAPPER.readTree(in);
            if (node != null && node.isTextual()) {
                node = MAPPER.readTree(node.asText());
            }
        } catch (JsonProcessingException e) {
            throw new BadRequest("Invalid JSON body");
        }
        if (node == null || !node.isObject()) {
            throw new BadRequest("Request body must be a JSON object");
        }
        JsonNode url = node.get("url");
        if (url == null || !url.isTextual() || url.asText().isBlank()) {
            throw new BadRequest("Missing 'url' field");
        }
        return url.asText().strip();
    }

    static ObjectNode toJson(DigestResult r) {
        ObjectNode n = MAPPER.createObjectNode();
        n.put("domain", r.domain());
        var arr = n.putArray("categories");
        r.categories().forEach(arr::add);
        n.put("hasPricing", r.hasPricing());
        n.put("hasBlog", r.hasBlog());
        n.put("hasCareers", r.hasCareers());
        n.put("pageCount", r.pageCount());
        n.put("content", r.content());
        return n;
    }

    private static ObjectNode detail(String message) {
        return MAPPER.createObjectNode().put("detail", message);
    }

    private static void methodNotAllowed(HttpExchange ex, String allow) throws IOException {
        ex.getResponseHeaders().set("Allow", allow);
        json(ex, 405, detail("Method not allowed"));
    }

    private static void json(HttpExchange ex, int code, JsonNode body) throws IOException {
        byte[] b = MAPPER.writeValueAsBytes(body);
        ex.getResponseHeaders().set("Content-Type", "application/json; charset=utf-8");
        ex.sendResponseHeaders(code, b.length);
        try (OutputStream os = ex.getResponseBody()) { os.write(b); }
    }

    /** 400 으로 매핑되는 입력 오류 */
    static final class BadRequest extends IOException {
        BadRequest(String message) { super(message); }
    }
}
