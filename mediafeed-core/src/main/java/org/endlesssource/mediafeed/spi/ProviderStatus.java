package org.endlesssource.mediafeed.spi;

import java.util.Objects;

/**
 * Whether a provider can build engines right now, and why not if it cannot.
 */
public record ProviderStatus(String providerId, boolean available, String reason) {
    public ProviderStatus {
        Objects.requireNonNull(providerId, "providerId must not be null");
        reason = reason == null ? "" : reason;
    }

    public static ProviderStatus ready(String providerId) {
        return new ProviderStatus(providerId, true, "");
    }

    public static ProviderStatus unavailable(String providerId, String reason) {
        return new ProviderStatus(providerId, false, reason);
    }
}
