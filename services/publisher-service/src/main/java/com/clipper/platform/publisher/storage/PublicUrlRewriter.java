package com.clipper.platform.publisher.storage;

import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponents;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Rewrites a presigned URL issued for the internal storage host onto the public base URL. Scheme,
 * host and port come from the public base, the path is the public base path followed by the
 * internal path, and the signed query string is kept untouched.
 */
public final class PublicUrlRewriter {

    private PublicUrlRewriter() {
    }

    public static String rewrite(String internalUrl, String publicBaseUrl) {
        if (!StringUtils.hasText(publicBaseUrl)) {
            return internalUrl;
        }
        UriComponents internal = UriComponentsBuilder.fromUriString(internalUrl).build(true);
        UriComponents base = UriComponentsBuilder.fromUriString(publicBaseUrl.trim()).build(true);

        String prefix = StringUtils.trimTrailingCharacter(base.getPath() == null ? "" : base.getPath(), '/');
        String path = internal.getPath() == null ? "" : internal.getPath();

        return UriComponentsBuilder.fromUriString(internalUrl)
                .scheme(base.getScheme())
                .host(base.getHost())
                .port(base.getPort())
                .replacePath(prefix + path)
                .build(true)
                .toUriString();
    }
}
