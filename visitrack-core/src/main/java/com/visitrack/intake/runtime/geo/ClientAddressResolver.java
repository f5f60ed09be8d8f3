package com.visitrack.intake.runtime.geo;

import com.visitrack.intake.api.model.RequestHeaders;
import com.visitrack.intake.util.AddressLiterals;
import com.visitrack.intake.util.CidrMatcher;

import java.net.InetAddress;
import java.util.List;
import java.util.Optional;

/**
 * Determines the originating client address from forwarding headers and the
 * connection's remote address.
 *
 * <p>With trusted proxies configured, forwarding headers are honoured only when
 * the connection comes from one of them.
 */
public final class ClientAddressResolver {

    static final List<String> FORWARDING_HEADERS = List.of(
            "cf-connecting-ip", "true-client-ip", "x-real-ip", "x-forwarded-for", "x-client-ip");

    private final CidrMatcher trustedProxies;

    public ClientAddressResolver(CidrMatcher trustedProxies) {
        this.trustedProxies = trustedProxies;
    }

    public Optional<InetAddress> resolve(RequestHeaders headers, InetAddress remoteAddress) {
        if (trustsForwarding(remoteAddress)) {
            for (String header : FORWARDING_HEADERS) {
                Optional<InetAddress> forwarded = AddressLiterals.parse(firstHop(headers.value(header)));
                if (forwarded.isPresent()) {
                    return forwarded;
                }
            }
        }
        return Optional.ofNullable(remoteAddress);
    }

    /**
     * Whether a provider-supplied address header may be believed for this connection.
     */
    public boolean trustsForwarding(InetAddress remoteAddress) {
        return trustedProxies.isEmpty() || trustedProxies.matches(remoteAddress);
    }

    static String firstHop(String value) {
        if (value == null) {
            return null;
        }
        int comma = value.indexOf(',');
        return comma >= 0 ? value.substring(0, comma) : value;
    }
}
