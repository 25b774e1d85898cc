package com.gateway.pool.connection;

import java.util.Objects;
import java.util.Optional;

/**
 * Parameters used to open a gateway connection.
 * Every field affects the handshake and is therefore part of the {@link PoolKey}.
 */
public final class ConnectConfig {

    private final String url;
    private final String token;
    private final boolean disableDevicePairing;
    private final boolean allowInsecureTls;

    private ConnectConfig(Builder builder) {
        this.url = builder.url;
        this.token = builder.token;
        this.disableDevicePairing = builder.disableDevicePairing;
        this.allowInsecureTls = builder.allowInsecureTls;
    }

    public String getUrl() { return url; }
    public Optional<String> getToken() { return Optional.ofNullable(token); }
    public boolean isDisableDevicePairing() { return disableDevicePairing; }
    public boolean isAllowInsecureTls() { return allowInsecureTls; }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns a builder pre-populated with this configuration.
     */
    public Builder toBuilder() {
        return new Builder()
                .url(url)
                .token(token)
                .disableDevicePairing(disableDevicePairing)
                .allowInsecureTls(allowInsecureTls);
    }

    public static class Builder {
        private String url;
        private String token;
        private boolean disableDevicePairing = false;
        private boolean allowInsecureTls = false;

        public Builder url(String url) {
            this.url = url;
            return this;
        }

        /**
         * Sets the bearer token. {@code null} means no token.
         */
        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder disableDevicePairing(boolean disableDevicePairing) {
            this.disableDevicePairing = disableDevicePairing;
            return this;
        }

        public Builder allowInsecureTls(boolean allowInsecureTls) {
            this.allowInsecureTls = allowInsecureTls;
            return this;
        }

        public ConnectConfig build() {
            if (url == null || url.isBlank()) {
                throw new IllegalArgumentException("url must not be blank");
            }
            return new ConnectConfig(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ConnectConfig)) return false;
        ConnectConfig that = (ConnectConfig) o;
        return disableDevicePairing == that.disableDevicePairing
                && allowInsecureTls == that.allowInsecureTls
                && url.equals(that.url)
                && Objects.equals(token, that.token);
    }

    @Override
    public int hashCode() {
        return Objects.hash(url, token, disableDevicePairing, allowInsecureTls);
    }

    @Override
    public String toString() {
        return "ConnectConfig{" +
                "url='" + url + '\'' +
                ", token=" + (token == null ? "<none>" : "****") +
                ", disableDevicePairing=" + disableDevicePairing +
                ", allowInsecureTls=" + allowInsecureTls +
                '}';
    }
}
