/*
 * Copyright (c) 2025 Visitrack
 * Licensed under the Apache License, Version 2.0
 */
package com.visitrack.intake.api.model;

import com.visitrack.intake.util.AddressLiterals;

import java.net.InetAddress;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Everything the intake pipeline knows about one inbound request.
 *
 * <p>Built by the host from its own request object. Instances are immutable and
 * may be shared across threads; the pipeline never mutates them.
 *
 * <h2>Usage Example</h2>
 * <pre>{@code
 * RequestContext context = RequestContext.builder()
 *     .method("GET")
 *     .path("/pricing")
 *     .header("User-Agent", userAgent)
 *     .header("CF-IPCountry", "DE")
 *     .remoteAddress("203.0.113.7")
 *     .requestFrequency(12)
 *     .build();
 * }</pre>
 */
public final class RequestContext {

    private final String method;
    private final String path;
    private final RequestHeaders headers;
    private final InetAddress remoteAddress;
    private final Double requestFrequency;
    private final String scheme;

    private RequestContext(Builder builder) {
        this.method = builder.method;
        this.path = builder.path;
        this.headers = builder.headers != null ? builder.headers : builder.headerBuilder.build();
        this.remoteAddress = builder.remoteAddress;
        this.requestFrequency = builder.requestFrequency;
        this.scheme = builder.scheme;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Upper-cased HTTP method, {@code GET} when the host supplied none.
     */
    public String method() {
        return method;
    }

    public String path() {
        return path;
    }

    public RequestHeaders headers() {
        return headers;
    }

    public Optional<InetAddress> remoteAddress() {
        return Optional.ofNullable(remoteAddress);
    }

    /**
     * Requests per minute from this client, as counted by the host.
     */
    public OptionalDouble requestFrequency() {
        return requestFrequency == null ? OptionalDouble.empty() : OptionalDouble.of(requestFrequency);
    }

    public Optional<String> scheme() {
        return Optional.ofNullable(scheme);
    }

    public String userAgent() {
        return headers.value("user-agent");
    }

    @Override
    public String toString() {
        return "RequestContext{" + method + " " + path + ", headers=" + headers.size() + "}";
    }

    public static final class Builder {
        private String method = "GET";
        private String path = "/";
        private RequestHeaders headers;
        private final RequestHeaders.Builder headerBuilder = RequestHeaders.builder();
        private InetAddress remoteAddress;
        private Double requestFrequency;
        private String scheme;

        private Builder() {
        }

        public Builder method(String method) {
            if (method != null && !method.isBlank()) {
                this.method = method.trim().toUpperCase(Locale.ROOT);
            }
            return this;
        }

        public Builder path(String path) {
            if (path != null && !path.isEmpty()) {
                this.path = path;
            }
            return this;
        }

        /**
         * Replaces any headers added through {@link #header(String, String)}.
         */
        public Builder headers(RequestHeaders headers) {
            this.headers = headers;
            return this;
        }

        public Builder header(String name, String value) {
            headerBuilder.add(name, value);
            return this;
        }

        public Builder remoteAddress(InetAddress remoteAddress) {
            this.remoteAddress = remoteAddress;
            return this;
        }

        /**
         * Parses an IP literal; anything else leaves the address absent.
         */
        public Builder remoteAddress(String literal) {
            this.remoteAddress = AddressLiterals.parse(literal).orElse(null);
            return this;
        }

        public Builder requestFrequency(double requestsPerMinute) {
            this.requestFrequency = Double.isFinite(requestsPerMinute) ? requestsPerMinute : null;
            return this;
        }

        public Builder scheme(String scheme) {
            this.scheme = scheme == null || scheme.isBlank() ? null : scheme.trim().toLowerCase(Locale.ROOT);
            return this;
        }

        public RequestContext build() {
            return new RequestContext(this);
        }
    }
}
