package fun.fengwk.searxng.core.facade.impl;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import fun.fengwk.searxng.core.CoreTestApplication;
import fun.fengwk.searxng.core.facade.SearchFacade;
import fun.fengwk.searxng.core.facade.model.SearchRequest;
import fun.fengwk.searxng.core.facade.model.SearchSummary;
import fun.fengwk.searxng.core.mcp.SearchMcp;
import fun.fengwk.searxng.core.search.SearxngPayloads;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the whole search chain inside the application context against a local SearXNG stand-in.
 *
 * @author fengwk
 */
@Slf4j
@SpringBootTest(classes = CoreTestApplication.class)
public class SearchFacadeContextTest {

    private static final HttpServer SERVER = startServer();
    private static final Queue<String> REQUESTED_PAGES = new ConcurrentLinkedQueue<>();

    @Autowired
    private SearchFacade searchFacade;

    @Autowired
    private SearchMcp searchMcp;

    @DynamicPropertySource
    static void searxngProperties(DynamicPropertyRegistry registry) {
        registry.add("searxng.client.base-url",
            () -> "http://127.0.0.1:" + SERVER.getAddress().getPort());
        registry.add("searxng.client.timeout-ms", () -> 2000);
    }

    @AfterAll
    static void stopServer() {
        SERVER.stop(0);
    }

    @BeforeEach
    void clearRequests() {
        REQUESTED_PAGES.clear();
    }

    @Test
    public void testSearchCollectsUntilPagesRunDry() {
        SearchRequest request = new SearchRequest();
        request.setQuery("rust");
        request.setLimit(10);

        SearchSummary summary = searchFacade.search(request);
        log.info("search status: {}, error: {}", summary.getStatusCode(), summary.getError());

        assertThat(summary.getStatusCode()).isEqualTo(200);
        assertThat(summary.getError()).isNull();
        assertThat(summary.getResults()).extracting("title")
            .containsExactly("legacy-1", "legacy-2", "main-3", "legacy-4", "main-5");
        assertThat(summary.getResults()).extracting("shape")
            .containsExactly("legacy", "legacy", "main", "legacy", "main");
        assertThat(REQUESTED_PAGES).containsExactly("1", "2", "3", "3", "3");
    }

    @Test
    public void testSearchToolRendersText() {
        String text = searchMcp.search("rust", 2, null, null, null);
        log.info("search tool result:\n{}", text);

        assertThat(text)
            .contains("1. legacy-1")
            .contains("URL: https://example.com/legacy/2")
            .doesNotContain("main-3");
        assertThat(REQUESTED_PAGES).containsExactly("1");
    }

    private static HttpServer startServer() {
        try {
            HttpServer server = HttpServer.create(new InetSocketAddress(InetAddress.getLoopbackAddress(), 0), 0);
            server.createContext("/search", SearchFacadeContextTest::handle);
            server.start();
            return server;
        } catch (IOException ex) {
            throw new IllegalStateException("failed to start stub server", ex);
        }
    }

    private static void handle(HttpExchange exchange) throws IOException {
        String body;
        try (InputStream in = exchange.getRequestBody()) {
            body = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
        String pageno = "1";
        for (String pair : body.split("&")) {
            String[] kv = pair.split("=", 2);
            if (kv.length == 2 && "pageno".equals(kv[0])) {
                pageno = URLDecoder.decode(kv[1], StandardCharsets.UTF_8);
            }
        }
        REQUESTED_PAGES.add(pageno);

        String json = switch (pageno) {
            case "1" -> SearxngPayloads.response("rust", 120, List.of(
                SearxngPayloads.legacyResult(1), SearxngPayloads.legacyResult(2), SearxngPayloads.mainResult(3)));
            case "2" -> SearxngPayloads.response("rust", 120, List.of(
                SearxngPayloads.legacyResult(4), SearxngPayloads.mainResult(5)));
            default -> SearxngPayloads.response("rust", 120, List.of());
        };
        byte[] bytes = json.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().add("Content-Type", "application/json");
        exchange.sendResponseHeaders(200, bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

}
