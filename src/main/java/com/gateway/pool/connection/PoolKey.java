package com.gateway.pool.connection;

import java.util.Objects;

/**
 * Identifies a group of interchangeable pooled connections.
 * Built from the gateway id and every connection parameter that affects the handshake,
 * so two requests share pooled connections only when their effective configuration is identical.
 * An absent token is its own key component and never matches a present one.
 *
 * @param gatewayId            logical gateway identifier
 * @param url                  gateway endpoint
 * @param token                bearer token, or {@code null} when none is used
 * @param disableDevicePairing whether device pairing is skipped
 * @param allowInsecureTls     whether TLS certificate verification is relaxed
 */
public record PoolKey(
        String gatewayId,
        String url,
        String token,
        boolean disableDevicePairing,
        boolean allowInsecureTls
) {

    public PoolKey {
        Objects.requireNonNull(gatewayId, "gatewayId");
        Objects.requireNonNull(url, "url");
    }

    public static PoolKey of(String gatewayId, ConnectConfig config) {
        return new PoolKey(
                gatewayId,
                config.getUrl(),
                config.getToken().orElse(null),
                config.isDisableDevicePairing(),
                config.isAllowInsecureTls()
        );
    }

    @Override
    public String toString() {
        return "PoolKey{" +
                "gatewayId='" + gatewayId + '\'' +
                ", url='" + url + '\'' +
                ", token=" + (token == null ? "<none>" : "****") +
                ", disableDevicePairing=" + disableDevicePairing +
                ", allowInsecureTls=" + allowInsecureTls +
                '}';
    }
}
