package fun.fengwk.searxng.core.configuration;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.net.InetSocketAddress;
import java.net.URI;
import java.net.URISyntaxException;

/**
 * Configuration of the shared HttpClient.
 *
 * @author fengwk
 */
@Data
@Component
@ConfigurationProperties(prefix = "searxng.http")
public class HttpClientProperties {

    /**
     * Connect timeout in milliseconds.
     */
    private int connectTimeoutMs = 5000;

    /**
     * HTTP proxy in URL form, e.g. http://host:port or host:port.
     */
    private String proxy;

    /**
     * Resolve the proxy address, null when no proxy is configured.
     */
    public InetSocketAddress resolveProxyAddress() {
        if (!StringUtils.hasText(proxy)) {
            return null;
        }
        String proxyStr = proxy.trim();
        String uriStr = proxyStr.contains("://") ? proxyStr : "http://" + proxyStr;
        try {
            URI uri = new URI(uriStr);
            String scheme = uri.getScheme();
            if (scheme != null && scheme.toLowerCase().startsWith("socks")) {
                throw new IllegalArgumentException("socks proxy is not supported: " + proxyStr);
            }
            String host = uri.getHost();
            int port = uri.getPort();
            if (host == null) {
                String[] parts = proxyStr.split(":");
                host = parts[0];
                port = parts.length > 1 ? Integer.parseInt(parts[1]) : 80;
            }
            if (port == -1) {
                port = 80;
            }
            return InetSocketAddress.createUnresolved(host, port);
        } catch (URISyntaxException | NumberFormatException ex) {
            throw new IllegalArgumentException("invalid proxy: " + proxyStr, ex);
        }
    }

}
