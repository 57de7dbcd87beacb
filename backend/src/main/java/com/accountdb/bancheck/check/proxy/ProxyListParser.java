package com.accountdb.bancheck.check.proxy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

public final class ProxyListParser {
    private static final Logger log = LoggerFactory.getLogger(ProxyListParser.class);

    private ProxyListParser() {}

    public record ParsedProxyList(List<ProxyEndpoint> proxies, int rejected) {
        public boolean isEmpty() {
            return proxies.isEmpty();
        }
    }

    public static ParsedProxyList parse(String text) {
        return parse(text == null ? List.of() : List.of(text));
    }

    public static ParsedProxyList parse(List<String> entries) {
        Set<ProxyEndpoint> proxies = new LinkedHashSet<>();
        int rejected = 0;
        if (entries != null) {
            for (String entry : entries) {
                if (entry == null) {
                    continue;
                }
                for (String line : entry.split("\\R")) {
                    String candidate = line.replace("\uFEFF", "").trim();
                    if (candidate.isEmpty() || candidate.startsWith("#")) {
                        continue;
                    }
                    ProxyEndpoint endpoint = parseLine(candidate);
                    if (endpoint == null) {
                        rejected++;
                        log.warn("Skipping malformed proxy entry '{}'", redact(candidate));
                    } else {
                        proxies.add(endpoint);
                    }
                }
            }
        }
        return new ParsedProxyList(new ArrayList<>(proxies), rejected);
    }

    static ProxyEndpoint parseLine(String line) {
        String value = line;
        if (!value.contains("://")) {
            value = "http://" + value;
        }
        URI uri;
        try {
            uri = new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
        String scheme = uri.getScheme() == null ? null : uri.getScheme().toLowerCase(Locale.ROOT);
        if (!"http".equals(scheme) && !"https".equals(scheme)) {
            return null;
        }
        String host = uri.getHost();
        int port = uri.getPort();
        if (host == null || host.isBlank() || port <= 0 || port > 65535) {
            return null;
        }
        String path = uri.getRawPath();
        if (path != null && !path.isEmpty() && !"/".equals(path)) {
            return null;
        }
        String username = null;
        String password = null;
        String userInfo = uri.getRawUserInfo();
        if (userInfo != null && !userInfo.isEmpty()) {
            int separator = userInfo.indexOf(':');
            if (separator < 0) {
                username = decode(userInfo);
            } else {
                username = decode(userInfo.substring(0, separator));
                password = decode(userInfo.substring(separator + 1));
            }
        }
        return new ProxyEndpoint(scheme, host.toLowerCase(Locale.ROOT), port, username, password);
    }

    private static String decode(String value) {
        return URLDecoder.decode(value, StandardCharsets.UTF_8);
    }

    private static String redact(String entry) {
        int at = entry.lastIndexOf('@');
        return at < 0 ? entry : "***" + entry.substring(at);
    }
}
