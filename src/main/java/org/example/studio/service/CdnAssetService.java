package org.example.studio.service;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class CdnAssetService {

    private final String cdnBaseUrl;
    private final String cdnPrefix;

    public CdnAssetService(
            @Value("${assets.cdn-base-url:}") String cdnBaseUrl,
            @Value("${assets.cdn-prefix:assets}") String cdnPrefix) {
        this.cdnBaseUrl = cdnBaseUrl;
        this.cdnPrefix = cdnPrefix;
    }

    public boolean isEnabled() {
        return cdnBaseUrl != null && !cdnBaseUrl.isBlank();
    }

    public Optional<String> buildAssetUrl(String assetKey) {
        if (!isEnabled() || assetKey == null || assetKey.isBlank()) {
            return Optional.empty();
        }
        String prefix = trimSlashes(cdnPrefix);
        String key = trimSlashes(assetKey);
        String base = urlBase();
        return Optional.of(prefix.isBlank() ? base + "/" + key : base + "/" + prefix + "/" + key);
    }

    /**
     * Inverse of {@link #buildAssetUrl}: the asset key behind a CDN URL, if it is one of ours.
     */
    public Optional<String> extractAssetKey(String url) {
        if (!isEnabled() || url == null) {
            return Optional.empty();
        }
        String prefix = trimSlashes(cdnPrefix);
        String root = prefix.isBlank() ? urlBase() + "/" : urlBase() + "/" + prefix + "/";
        if (!url.startsWith(root) || url.length() == root.length()) {
            return Optional.empty();
        }
        return Optional.of(url.substring(root.length()));
    }

    private String urlBase() {
        String base = cdnBaseUrl.trim();
        return base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    private static String trimSlashes(String value) {
        String trimmed = value == null ? "" : value.trim();
        if (trimmed.startsWith("/")) {
            trimmed = trimmed.substring(1);
        }
        if (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return trimmed;
    }
}
