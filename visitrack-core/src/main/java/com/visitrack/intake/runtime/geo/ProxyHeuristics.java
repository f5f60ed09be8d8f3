package com.visitrack.intake.runtime.geo;

import com.visitrack.intake.api.model.ProxyType;
import com.visitrack.intake.api.model.RequestHeaders;

import java.util.List;

/**
 * Header-only VPN and proxy hints. Indicative, not authoritative.
 */
final class ProxyHeuristics {

    static final List<String> PROXY_HEADERS = List.of("x-vpn-service", "x-proxy-service", "via", "forwarded");

    private ProxyHeuristics() {
    }

    static boolean looksProxied(RequestHeaders headers) {
        for (String header : PROXY_HEADERS) {
            if (headers.contains(header)) {
                return true;
            }
        }
        String forwardedFor = headers.value("x-forwarded-for");
        return forwardedFor != null && forwardedFor.indexOf(',') >= 0;
    }

    /**
     * Most specific edge layer first; an ALB sets both forwarding headers,
     * nginx typically only {@code x-real-ip}.
     */
    static ProxyType detectProxyType(RequestHeaders headers) {
        if (headers.contains("cf-ray") || headers.contains("cf-connecting-ip")) {
            return ProxyType.CLOUDFLARE;
        }
        if (headers.contains("cloudfront-viewer-country")) {
            return ProxyType.AWS_CLOUDFRONT;
        }
        boolean forwardedFor = headers.contains("x-forwarded-for");
        if (forwardedFor && headers.contains("x-forwarded-proto")) {
            return ProxyType.AWS_ALB;
        }
        if (headers.contains("x-real-ip")) {
            return ProxyType.NGINX;
        }
        return forwardedFor ? ProxyType.GENERIC_PROXY : ProxyType.DIRECT;
    }
}
