package com.visitrack.intake.api.model;

/**
 * Edge or proxy layer a request most likely passed through, inferred from the
 * headers it added.
 */
public enum ProxyType {
    CLOUDFLARE,
    AWS_CLOUDFRONT,
    AWS_ALB,
    NGINX,
    GENERIC_PROXY,
    DIRECT
}
