package com.sitedigest.app.http;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitedigest.core.api.SiteDigester;
import com.sitedigest.core.crawler.SiteUnreachableException;
import com.sitedigest.core.model.CrawlTarget;
import com.sitedigest.core.model.DigestResult;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.assertj.core.api.Assertions.assertThat;

class DigestServerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final List<String> received = new CopyOnWriteArrayList<>();
    private DigestServer server;
    private HttpClient client;

    /** url 에 따라 결과/예외를 돌려주는 가짜 다이제스터 */
    private final SiteDigester stub = raw -> {
        received.add(raw);
        if (raw.contains("down.test")) throw new SiteUnreachableException("down.test", "Could not fetch any page");
        if (raw.contains("bug.test")) throw new IllegalStateException("boom");
        CrawlTarget t = CrawlTarget.parse(raw);
        return new DigestResult(t.domain(), List.of("home", "pricing"), true, false, false, 2,
                "=== SITE DIGEST: " + t.domain() + " ===");
    };

    @BeforeEach
    void setUp() throws Exception {
        server = new DigestServer(stub, 0, 2).start();
        client = HttpClient.newHttpClient();
    }

    @AfterEach
    void tearDown() {
        server.close();
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + path))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + server.port() + path)).GET().build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> r) throws Exception {
        return MAPPER.readTree(r.body());
    }

    @Test
    void health_check() throws Exception {
        HttpResponse<String> r = get("/");
        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(json(r).get("status").asText()).isEqualTo("ok");
    }

    @Test
    void digest_returns_result_fields() throws Exception {
        HttpResponse<String> r = post("/digest", "{\"url\":\"acme.test\"}");

        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(r.headers().firstValue("Content-Type").orElse("")).startsWith("application/json");
        JsonNode n = json(r);
        assertThat(n.get("domain").asText()).isEqualTo("acme.test");
        assertThat(n.get("categories")).hasSize(2);
        assertThat(n.get("categories").get(1).asText()).isEqualTo("pricing");
        assertThat(n.get("hasPricing").asBoolean()).isTrue();
        assertThat(n.get("hasBlog").asBoolean()).isFalse();
        assertThat(n.get("pageCount").asInt()).isEqualTo(2);
        assertThat(n.get("content").asText()).startsWith("=== SITE DIGEST: acme.test ===");
    }

    @Test
    void double_encoded_body_is_accepted() throws Exception {
        String inner = "{\"url\":\"https://acme.test\"}";
        HttpResponse<String> r = post("/digest", MAPPER.writeValueAsString(inner));

        assertThat(r.statusCode()).isEqualTo(200);
        assertThat(received).containsExactly("https://acme.test");
    }

    @Test
    void bad_input_is_400() throws Exception {
        assertThat(detail(post("/digest", "{nope"), 400)).isEqualTo("Invalid JSON body");
        assertThat(detail(post("/digest", "[1,2]"), 400)).isEqualTo("Request body must be a JSON object");
        assertThat(detail(post("/digest", "{\"link\":\"acme.test\"}"), 400)).isEqualTo("Missing 'url' field");
        assertThat(detail(post("/digest", "{\"url\":\"   \"}"), 400)).isEqualTo("Missing 'url' field");
        assertThat(detail(post("/digest", "{\"url\":\"http://exa mple.test\"}"), 400)).contains("Not a valid URL");
        assertThat(received).hasSize(1);
    }

    @Test
    void unreachable_site_is_502_with_domain() throws Exception {
        HttpResponse<String> r = post("/digest", "{\"url\":\"down.test\"}");

        assertThat(r.statusCode()).isEqualTo(502);
        assertThat(json(r).get("domain").asText()).isEqualTo("down.test");
        assertThat(json(r).get("detail").asText()).contains("Could not fetch");
    }

    @Test
    void unexpected_failure_is_500() throws Exception {
        assertThat(detail(post("/digest", "{\"url\":\"bug.test\"}"), 500)).contains("IllegalStateException");
    }

    @Test
    void unknown_path_and_wrong_method() throws Exception {
        assertThat(get("/nope").statusCode()).isEqualTo(404);

        HttpResponse<String> r = get("/digest");
        assertThat(r.statusCode()).isEqualTo(405);
        assertThat(r.headers().firstValue("Allow")).contains("POST");
        assertThat(post("/", "{}").statusCode()).isEqualTo(405);
    }

    private static String detail(HttpResponse<String> r, int expectedStatus) throws Exception {
        assertThat(r.statusCode()).isEqualTo(expectedStatus);
        return json(r).get("detail").asText();
    }
}
