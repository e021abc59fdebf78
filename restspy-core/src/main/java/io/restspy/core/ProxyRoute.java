package io.restspy.core;

import java.net.URI;
import java.util.Objects;
import java.util.UUID;

/**
 * Forwards every request whose path matches {@link #pattern()} to {@link #redirectUrl()}.
 */
public final class ProxyRoute extends Matchable {

    private final URI redirectUrl;

    public ProxyRoute(String pattern, URI redirectUrl) {
        this(UUID.randomUUID().toString(), pattern, redirectUrl);
    }

    public ProxyRoute(String id, String pattern, URI redirectUrl) {
        super(id, pattern);
        this.redirectUrl = Objects.requireNonNull(redirectUrl, "redirectUrl");
    }

    public URI redirectUrl() {
        return redirectUrl;
    }
}
