package fun.fengwk.searxng.core.client;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.net.http.HttpResponse.BodyHandlers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.StringJoiner;

/**
 * SearXNG HTTP client.
 *
 * <p>The {@link HttpClient} is shared by every search and owns the connection pool.
 *
 * @author fengwk
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class SearxngClient {

    private static final String SEARCH_PATH = "/search";

    private final SearxngProperties properties;
    private final HttpClient httpClient;

    /**
     * Send the form fields to the search endpoint.
     *
     * <p>Never throws for transport problems, they are reported through {@link SearxngClientResponse#getError()}.
     */
    public SearxngClientResponse search(Map<String, String> params) {
        // Build request parameters with default format.
        Map<String, String> form = new LinkedHashMap<>();
        if (params != null) {
            form.putAll(params);
        }
        form.putIfAbsent("format", properties.getFormat());

        String method = properties.getMethod();
        boolean useGet = "GET".equalsIgnoreCase(method);
        String formBody = buildFormBody(form);

        URI uri = buildSearchUri(useGet ? formBody : null);
        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(uri)
            .timeout(Duration.ofMillis(properties.getTimeoutMs()))
            .header("Accept", "application/json")
            .header("User-Agent", properties.getUserAgent());

        if (useGet) {
            builder.GET();
        } else {
            builder.header("Content-Type", "application/x-www-form-urlencoded")
                .POST(BodyPublishers.ofString(formBody, StandardCharsets.UTF_8));
        }

        HttpRequest request = builder.build();
        log.debug("searxng request, method={}, uri={}, pageno={}", request.method(), uri, form.get("pageno"));
        try {
            HttpResponse<String> response = httpClient.send(request, BodyHandlers.ofString(StandardCharsets.UTF_8));
            return SearxngClientResponse.builder()
                .statusCode(response.statusCode())
                .headers(response.headers().map())
                .body(response.body())
                .build();
        } catch (IOException ex) {
            return SearxngClientResponse.builder()
                .error(ex)
                .build();
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            return SearxngClientResponse.builder()
                .error(ex)
                .build();
        }
    }

    private URI buildSearchUri(String queryString) {
        String baseUrl = StringUtils.hasText(properties.getBaseUrl())
            ? properties.getBaseUrl().trim()
            : "";
        while (baseUrl.endsWith("/")) {
            baseUrl = baseUrl.substring(0, baseUrl.length() - 1);
        }

        if (!StringUtils.hasText(queryString)) {
            return URI.create(baseUrl + SEARCH_PATH);
        }
        return URI.create(baseUrl + SEARCH_PATH + "?" + queryString);
    }

    private String buildFormBody(Map<String, String> form) {
        StringJoiner joiner = new StringJoiner("&");
        for (Map.Entry<String, String> entry : form.entrySet()) {
            if (entry.getKey() == null || entry.getValue() == null) {
                continue;
            }
            String key = URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8);
            String value = URLEncoder.encode(entry.getValue(), StandardCharsets.UTF_8);
            joiner.add(key + "=" + value);
        }
        return joiner.toString();
    }

}
