package com.sitedigest.core.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sitedigest.core.model.StructuredData;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * JSON-LD + Open Graph 메타데이터 추출. 노이즈 제거 전에 호출해야 한다.
 * 깨진 JSON-LD 블록은 그 블록만 무시(DEBUG 로그).
 */
public final class StructuredDataExtractor {

    private static final Logger LOG = LoggerFactory.getLogger(StructuredDataExtractor.class);
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public StructuredData extract(Document doc) {
        if (doc == null) return StructuredData.EMPTY;

        String description = null, name = null, type = null;
        for (Element script : doc.select("script[type=application/ld+json]")) {
            JsonNode node = parse(script.data());
            if (node == null) continue;
            if (node.isArray()) {
                node = node.size() > 0 ? node.get(0) : null;
            }
            if (node == null || !node.isObject()) continue;

            // 뒤 블록이 앞 블록 값을 덮어씀
            String d = text(node.get("description"));
            if (d != null) description = d;
            String n = text(node.get("name"));
            if (n != null) name = n;
            String t = type(node.get("@type"));
            if (t != null) type = t;
        }

        return new StructuredData(
                description,
                name,
                type,
                og(doc, "og:description"),
                og(doc, "og:title"),
                og(doc, "og:site_name"));
    }

    private static JsonNode parse(String json) {
        if (json == null || json.isBlank()) return null;
        try {
            return MAPPER.readTree(json.strip());
        } catch (JsonProcessingException e) {
            LOG.debug("Ignoring malformed JSON-LD block: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static String text(JsonNode v) {
        if (v == null || !v.isTextual()) return null;
        String s = TextNormalizer.normalize(v.asText());
        return s.isEmpty() ? null : s;
    }

    private static String type(JsonNode v) {
        if (v == null) return null;
        if (v.isTextual()) return text(v);
        if (v.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode e : v) {
                String s = text(e);
                if (s != null) parts.add(s);
            }
            return parts.isEmpty() ? null : String.join(",", parts);
        }
        return null;
    }

    private static String og(Document doc, String property) {
        for (Element meta : doc.select("meta[content]")) {
            if (property.equalsIgnoreCase(meta.attr("property")) || property.equalsIgnoreCase(meta.attr("name"))) {
                String s = TextNormalizer.normalize(meta.attr("content"));
                if (!s.isEmpty()) return s;
            }
        }
        return null;
    }
}
