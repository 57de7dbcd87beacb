package com.accountdb.bancheck.check.http;

import com.accountdb.bancheck.check.model.HttpFetchResult;
import com.accountdb.bancheck.check.proxy.ProxyEndpoint;
import com.accountdb.bancheck.check.util.FailureReasonClassifier;
import com.accountdb.bancheck.config.BanCheckProperties;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class SteamProfileClientTest {
    private MockWebServer server;
    private ExecutorService executor;

    @AfterEach
    void tearDown() throws Exception {
        if (server != null) {
            server.shutdown();
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    @Test
    void fetchesProfilePageWithBrowserHeaders() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<div class=\"profile_header_centered_persona\"></div>"));
        server.start();

        SteamProfileClient client = client(server.url("/profiles/").toString());
        HttpFetchResult result = client.fetchProfile("76561198000000001", null);

        assertThat(result.isSuccessful()).isTrue();
        assertThat(result.body()).contains("profile_header_centered_persona");
        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/profiles/76561198000000001");
        assertThat(request.getHeader("User-Agent")).startsWith("Mozilla/5.0");
        assertThat(request.getHeader("Accept-Language")).startsWith("en-US");
    }

    @Test
    void rateLimitCarriesRetryAfter() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(429).setHeader("Retry-After", "7").setBody("slow down"));
        server.start();

        HttpFetchResult result = client(server.url("/profiles").toString()).fetchProfile("76561198000000002", null);

        assertThat(result.isRateLimited()).isTrue();
        assertThat(result.retryAfter()).isEqualTo("7");
        assertThat(FailureReasonClassifier.classify(result)).isEqualTo(FailureReasonClassifier.HTTP_429_RATE_LIMIT);
    }

    @Test
    void routesThroughConfiguredProxy() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<div class=\"profile_private_info\"></div>"));
        server.start();

        SteamProfileClient client = client("http://steamcommunity.invalid/profiles");
        ProxyEndpoint proxy = new ProxyEndpoint("http", server.getHostName(), server.getPort(), null, null);
        HttpFetchResult result = client.fetchProfile("76561198000000003", proxy);

        assertThat(result.statusCode()).isEqualTo(200);
        RecordedRequest request = server.takeRequest();
        assertThat(request.getRequestLine()).contains("http://steamcommunity.invalid/profiles/76561198000000003");
    }

    @Test
    void httpsThroughCredentialedProxySendsCredentialsOnConnect() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(403));
        server.start();

        SteamProfileClient client = client("https://steamcommunity.invalid/profiles");
        ProxyEndpoint proxy = new ProxyEndpoint("http", server.getHostName(), server.getPort(), "checker", "s3cret");
        HttpFetchResult result = client.fetchProfile("76561198000000005", proxy);

        assertThat(result.isSuccessful()).isFalse();
        RecordedRequest connect = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(connect).isNotNull();
        assertThat(connect.getRequestLine()).startsWith("CONNECT steamcommunity.invalid:443");
        String expected = "Basic " + Base64.getEncoder().encodeToString("checker:s3cret".getBytes(StandardCharsets.UTF_8));
        assertThat(connect.getHeader("Proxy-Authorization")).isEqualTo(expected);
    }

    @Test
    void plainHttpThroughCredentialedProxySendsCredentials() throws Exception {
        server = new MockWebServer();
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<div class=\"profile_private_info\"></div>"));
        server.start();

        SteamProfileClient client = client("http://steamcommunity.invalid/profiles");
        ProxyEndpoint proxy = new ProxyEndpoint("http", server.getHostName(), server.getPort(), "checker", null);
        client.fetchProfile("76561198000000006", proxy);

        RecordedRequest request = server.takeRequest(5, TimeUnit.SECONDS);
        assertThat(request.getHeader("Proxy-Authorization")).isEqualTo(SteamProfileClient.basicCredentials(proxy));
    }

    @Test
    void proxyClientsAreDroppedWhenTheLastTaskReleasesThem() {
        SteamProfileClient client = client("http://steamcommunity.invalid/profiles");
        ProxyEndpoint first = new ProxyEndpoint("http", "10.0.0.1", 8080, null, null);
        ProxyEndpoint second = new ProxyEndpoint("http", "10.0.0.2", 8080, null, null);

        client.retainProxies(List.of(first, second));
        client.retainProxies(List.of(first));
        assertThat(client.cachedProxyClients()).isEqualTo(2);

        client.releaseProxies(List.of(first, second));
        assertThat(client.cachedProxyClients()).isEqualTo(1);

        client.releaseProxies(List.of(first));
        assertThat(client.cachedProxyClients()).isZero();
    }

    @Test
    void connectionFailureIsReportedNotThrown() throws Exception {
        server = new MockWebServer();
        server.start();
        String baseUrl = server.url("/profiles").toString();
        server.shutdown();
        server = null;

        HttpFetchResult result = client(baseUrl).fetchProfile("76561198000000004", null);

        assertThat(result.errorCode()).isEqualTo("io_error");
        assertThat(FailureReasonClassifier.isRetryable(FailureReasonClassifier.classify(result))).isTrue();
    }

    private SteamProfileClient client(String baseUrl) {
        BanCheckProperties properties = new BanCheckProperties();
        properties.setProfileBaseUrl(baseUrl);
        properties.setRequestTimeoutSeconds(5);
        executor = Executors.newFixedThreadPool(2);
        return new SteamProfileClient(properties, executor);
    }
}
