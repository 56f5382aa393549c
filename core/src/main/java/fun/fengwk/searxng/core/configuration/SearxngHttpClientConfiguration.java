package fun.fengwk.searxng.core.configuration;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Creates the HttpClient shared by all searches.
 *
 * @author fengwk
 */
@Slf4j
@Configuration
public class SearxngHttpClientConfiguration {

    @Bean
    public HttpClient searxngHttpClient(HttpClientProperties properties) {
        HttpClient.Builder builder = HttpClient.newBuilder()
            .connectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
            .followRedirects(HttpClient.Redirect.NORMAL);
        InetSocketAddress proxyAddress = properties.resolveProxyAddress();
        if (proxyAddress != null) {
            builder.proxy(ProxySelector.of(proxyAddress));
            log.info("http proxy configured: {}", properties.getProxy());
        }
        return builder.build();
    }

}
