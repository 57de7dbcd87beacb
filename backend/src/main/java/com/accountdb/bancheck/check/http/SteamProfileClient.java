package com.accountdb.bancheck.check.http;

import com.accountdb.bancheck.check.model.HttpFetchResult;
import com.accountdb.bancheck.check.proxy.ProxyEndpoint;
import com.accountdb.bancheck.config.BanCheckProperties;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.ProxySelector;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Base64;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.concurrent.ExecutorService;

@Service
public class SteamProfileClient implements ProfileFetcher {
    static final String TUNNEL_DISABLED_SCHEMES = "jdk.http.auth.tunneling.disabledSchemes";

    private final BanCheckProperties properties;
    private final ExecutorService httpExecutor;
    private final HttpClient directClient;
    // guarded by itself; entries live while at least one running task holds a lease
    private final Map<ProxyEndpoint, LeasedClient> proxyClients = new HashMap<>();

    public SteamProfileClient(
        BanCheckProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.httpExecutor = httpExecutor;
        this.directClient = baseBuilder().build();
    }

    @Override
    public HttpFetchResult fetchProfile(String steamId, ProxyEndpoint proxy) {
        Instant startedAt = Instant.now();
        String url = profileUrl(steamId);
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, "invalid_url", "Profile URL missing host or malformed");
        }

        HttpClient client = clientFor(proxy);
        HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .header("User-Agent", properties.getUserAgent())
            .header("Accept", "text/html,application/xhtml+xml;q=0.9,*/*;q=0.8")
            .header("Accept-Language", "en-US,en;q=0.9")
            .GET();
        if (proxy != null && proxy.hasCredentials()) {
            // Sent on the CONNECT for https targets; the JDK keeps it off the tunnelled request.
            builder.header("Proxy-Authorization", basicCredentials(proxy));
        }
        HttpRequest request = builder.build();
        try {
            HttpResponse<String> response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
            return new HttpFetchResult(
                url,
                response.statusCode(),
                response.body(),
                response.headers().firstValue("Retry-After").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, "timeout", describe(e));
        } catch (IOException e) {
            return errorResult(url, startedAt, "io_error", describe(e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, "interrupted", describe(e));
        } catch (Exception e) {
            return errorResult(url, startedAt, "http_error", describe(e));
        }
    }

    @Override
    public void retainProxies(Collection<ProxyEndpoint> proxies) {
        if (proxies == null) {
            return;
        }
        synchronized (proxyClients) {
            for (ProxyEndpoint proxy : new LinkedHashSet<>(proxies)) {
                proxyClients.computeIfAbsent(proxy, p -> new LeasedClient(buildProxyClient(p))).leases++;
            }
        }
    }

    @Override
    public void releaseProxies(Collection<ProxyEndpoint> proxies) {
        if (proxies == null) {
            return;
        }
        synchronized (proxyClients) {
            for (ProxyEndpoint proxy : new LinkedHashSet<>(proxies)) {
                LeasedClient leased = proxyClients.get(proxy);
                if (leased != null && --leased.leases <= 0) {
                    proxyClients.remove(proxy);
                }
            }
        }
    }

    int cachedProxyClients() {
        synchronized (proxyClients) {
            return proxyClients.size();
        }
    }

    /**
     * Lets Basic proxy credentials reach the CONNECT request of https targets. Must run before the first
     * {@link HttpClient} of the JVM is built; an explicit setting of the property wins.
     */
    public static void allowBasicProxyTunnelAuth() {
        if (System.getProperty(TUNNEL_DISABLED_SCHEMES) == null) {
            System.setProperty(TUNNEL_DISABLED_SCHEMES, "");
        }
    }

    static String basicCredentials(ProxyEndpoint proxy) {
        String password = proxy.password() == null ? "" : proxy.password();
        String token = proxy.username() + ":" + password;
        return "Basic " + Base64.getEncoder().encodeToString(token.getBytes(StandardCharsets.UTF_8));
    }

    String profileUrl(String steamId) {
        String segment = URLEncoder.encode(steamId == null ? "" : steamId.trim(), StandardCharsets.UTF_8)
            .replace("+", "%20");
        return properties.getProfileBaseUrl() + "/" + segment;
    }

    private HttpClient clientFor(ProxyEndpoint proxy) {
        if (proxy == null) {
            return directClient;
        }
        synchronized (proxyClients) {
            LeasedClient leased = proxyClients.get(proxy);
            if (leased != null) {
                return leased.client;
            }
        }
        return buildProxyClient(proxy);
    }

    private HttpClient buildProxyClient(ProxyEndpoint proxy) {
        return baseBuilder()
            .proxy(ProxySelector.of(new InetSocketAddress(proxy.host(), proxy.port())))
            .build();
    }

    private HttpClient.Builder baseBuilder() {
        return HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor);
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private String describe(Exception e) {
        String message = e.getMessage();
        String type = e.getClass().getSimpleName();
        return message == null || message.isBlank() ? type : type + ": " + message;
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        try {
            return new URI(input.trim());
        } catch (URISyntaxException e) {
            return null;
        }
    }

    private static final class LeasedClient {
        private final HttpClient client;
        private int leases;

        private LeasedClient(HttpClient client) {
            this.client = client;
        }
    }
}
