package com.admissioncontrol.endpoint;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Maps API URLs to canonical endpoint keys so that every operation on the
 * same resource type shares one rate-limit bucket.
 *
 * <pre>
 * https://api.close.com/api/v1/lead/lead_123/          -> /api/v1/lead/
 * https://api.close.com/api/v1/lead/lead_456/activity/ -> /api/v1/lead/
 * https://api.close.com/api/v1/data/search/?limit=10   -> /api/v1/data/search/
 * </pre>
 *
 * Path segments keep their original case. Anything that is not a URL of
 * the configured API is rejected with {@link InvalidEndpointUrlException}.
 */
public class EndpointKeyExtractor {

    private final String apiHost;
    private final String supportedVersion;
    private final List<String> resourceIdPrefixes;
    private final List<String> compoundRoots;

    public EndpointKeyExtractor(EndpointLimitConfig config) {
        this.apiHost = config.getApiHost().toLowerCase(Locale.ROOT);
        this.supportedVersion = config.getSupportedVersion();
        this.resourceIdPrefixes = List.copyOf(config.getResourceIdPrefixes());
        this.compoundRoots = config.getCompoundRoots().stream()
                .map(root -> root.toLowerCase(Locale.ROOT))
                .toList();
    }

    public String extract(String url) {
        if (url == null || url.isBlank()) {
            throw new InvalidEndpointUrlException("Invalid URL: URL cannot be empty");
        }

        URI uri;
        try {
            uri = new URI(url.trim());
        } catch (URISyntaxException e) {
            throw new InvalidEndpointUrlException("Invalid URL format: " + e.getMessage(), e);
        }

        String scheme = uri.getScheme();
        if (scheme == null || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
            throw new InvalidEndpointUrlException("Invalid URL format: URL must use http or https");
        }
        if (uri.getHost() == null || !uri.getHost().toLowerCase(Locale.ROOT).equals(apiHost)) {
            throw new InvalidEndpointUrlException("Not an API URL: URL must be for " + apiHost);
        }

        String path = uri.getPath();
        if (path == null || path.isEmpty() || path.equals("/")) {
            throw new InvalidEndpointUrlException("Not an API endpoint: missing API path");
        }
        if (!path.toLowerCase(Locale.ROOT).startsWith("/api/")) {
            throw new InvalidEndpointUrlException("Not an API endpoint: path must start with /api/");
        }

        String[] segments = Arrays.stream(path.split("/"))
                .filter(segment -> !segment.isEmpty())
                .toArray(String[]::new);
        if (segments.length < 3) {
            throw new InvalidEndpointUrlException("Not an API endpoint: invalid path structure");
        }
        if (!segments[1].equalsIgnoreCase(supportedVersion)) {
            throw new InvalidEndpointUrlException("Unsupported API version: only " + supportedVersion + " is supported");
        }

        String root = "/" + segments[0] + "/" + segments[1] + "/" + segments[2] + "/";
        if (segments.length >= 4) {
            if (isResourceId(segments[3])) {
                return root;
            }
            if (compoundRoots.contains(segments[2].toLowerCase(Locale.ROOT))) {
                return root + segments[3] + "/";
            }
        }
        return root;
    }

    private boolean isResourceId(String segment) {
        return resourceIdPrefixes.stream().anyMatch(segment::startsWith);
    }
}
