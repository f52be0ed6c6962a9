package com.sitedigest.app;

import com.sitedigest.app.http.DigestServer;
import com.sitedigest.app.logging.LogSetup;
import com.sitedigest.core.model.DigestConfig;
import com.sitedigest.core.service.DigestService;
import com.sitedigest.core.util.YamlConfigLoader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 부트스트랩: 로그 초기화 → 설정 로드 → 서버 시작.
 * 설정 우선순위: -Dsd.config=경로 → ./digest.yml → 클래스패스 digest.yml(기본값)
 */
public final class SiteDigestApp {

    private static final Logger LOG = LoggerFactory.getLogger(SiteDigestApp.class);

    private SiteDigestApp() {}

    public static void main(String[] args) throws Exception {
        LogSetup.init();
        DigestConfig cfg = loadConfig();

        DigestServer server = new DigestServer(new DigestService(cfg), cfg.getServerPort(),
                Math.max(2, Runtime.getRuntime().availableProcessors())).start();
        Runtime.getRuntime().addShutdownHook(new Thread(server::close, "shutdown"));
        LOG.info("SiteDigest ready: port={}, maxPages={}, dedupPolicy={}, maxOutputBytes={}",
                server.port(), cfg.getMaxPages(), cfg.getDedupPolicy(), cfg.output().getMaxOutputBytes());
    }

    static DigestConfig loadConfig() throws IOException {
        String explicit = System.getProperty("sd.config");
        if (explicit != null && !explicit.isBlank()) {
            LOG.info("Loading config from {}", explicit);
            return YamlConfigLoader.load(Path.of(explicit.trim()));
        }
        Path local = Path.of(YamlConfigLoader.DEFAULT_FILE);
        if (Files.exists(local)) {
            LOG.info("Loading config from {}", local.toAbsolutePath());
            return YamlConfigLoader.load(local);
        }
        try (InputStream in = SiteDigestApp.class.getResourceAsStream("/" + YamlConfigLoader.DEFAULT_FILE)) {
            if (in != null) return YamlConfigLoader.load(in);
        }
        LOG.info("No {} found; using defaults", YamlConfigLoader.DEFAULT_FILE);
        return DigestConfig.defaults();
    }
}
