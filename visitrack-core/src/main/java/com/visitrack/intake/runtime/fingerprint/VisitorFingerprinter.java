package com.visitrack.intake.runtime.fingerprint;

import com.google.common.base.Joiner;
import com.google.common.hash.Hashing;
import com.visitrack.intake.api.IVisitorFingerprinter;
import com.visitrack.intake.api.model.RequestContext;
import com.visitrack.intake.api.model.RequestHeaders;
import com.visitrack.intake.api.model.VisitorIdentity;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Cookie-free visitor identity from stable request characteristics.
 *
 * <p>Components, in order: normalized user agent, accept-language,
 * accept-encoding and platform family; outside privacy mode also the
 * connection scheme and viewport hint. Absent components are skipped. The
 * joined components are hashed with SHA-256 and the first 16 hex characters
 * form the identity.
 */
public class VisitorFingerprinter implements IVisitorFingerprinter {

    static final int MAX_USER_AGENT_LENGTH = 200;
    static final int HASH_HEX_LENGTH = 16;

    // 120.0.6099.109 -> 120.x
    private static final Pattern VERSION_RUN = Pattern.compile("(\\d+)(?:\\.\\d+)+");
    private static final Joiner JOINER = Joiner.on('|').skipNulls();

    @Override
    public VisitorIdentity fingerprint(RequestContext context, boolean privacyMode) {
        RequestHeaders headers = context.headers();
        String userAgent = context.userAgent();

        List<String> components = new ArrayList<>(6);
        components.add(normalizeUserAgent(userAgent));
        components.add(headers.value("accept-language"));
        components.add(headers.value("accept-encoding"));
        components.add(PlatformFamily.detect(userAgent).label());
        if (!privacyMode) {
            String scheme = headers.value("x-forwarded-proto");
            components.add(scheme != null ? scheme : context.scheme().orElse(null));
            String viewport = headers.value("sec-ch-viewport-width");
            components.add(viewport != null ? viewport : headers.value("viewport-width"));
        }

        String hex = Hashing.sha256()
                .hashString(JOINER.join(components), StandardCharsets.UTF_8)
                .toString();
        return new VisitorIdentity(VisitorIdentity.PREFIX + hex.substring(0, HASH_HEX_LENGTH));
    }

    static String normalizeUserAgent(String userAgent) {
        if (userAgent == null || userAgent.isEmpty()) {
            return null;
        }
        String normalized = VERSION_RUN.matcher(userAgent).replaceAll("$1.x");
        return normalized.length() > MAX_USER_AGENT_LENGTH
                ? normalized.substring(0, MAX_USER_AGENT_LENGTH)
                : normalized;
    }
}
