package org.endlesssource.mediafeed;

import org.endlesssource.mediafeed.spi.MediaEngineProvider;
import org.endlesssource.mediafeed.spi.ProviderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

public final class MediaEngineFactory {
    private static final Logger logger = LoggerFactory.getLogger(MediaEngineFactory.class);

    private MediaEngineFactory() {}

    /**
     * Pick the first runtime-available engine provider on the classpath
     * @return Provider used to build media engines
     * @throws UnsupportedOperationException if no provider is present or none is available
     */
    public static MediaEngineProvider createProvider() {
        List<MediaEngineProvider> candidates = loadProviders().stream()
                .sorted(Comparator.comparing(MediaEngineProvider::providerId))
                .toList();

        if (candidates.isEmpty()) {
            throw new UnsupportedOperationException("No media engine provider module found on the classpath");
        }

        List<String> reasons = new ArrayList<>();
        for (MediaEngineProvider provider : candidates) {
            logger.debug("Checking engine provider {}", provider.providerId());
            ProviderStatus status = provider.status();
            if (status.available()) {
                logger.info("Using media engine provider {}", provider.providerId());
                return provider;
            }
            reasons.add(provider.providerId() + ": " + status.reason());
        }

        throw new UnsupportedOperationException("No media engine provider is runtime-available: "
                + String.join("; ", reasons));
    }

    /**
     * Look up a provider by id
     * @param providerId Provider id, e.g. precache
     * @return The provider if it is on the classpath
     */
    public static Optional<MediaEngineProvider> findProvider(String providerId) {
        return loadProviders().stream()
                .filter(provider -> provider.providerId().equalsIgnoreCase(providerId))
                .findFirst();
    }

    /**
     * Check if at least one engine provider can be used right now
     */
    public static boolean isEngineAvailable() {
        return getCurrentStatus().available();
    }

    /**
     * Get providers registered on the current classpath.
     */
    public static List<String> getInstalledProviders() {
        return loadProviders().stream()
                .map(MediaEngineProvider::providerId)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Get providers that are runtime-available right now.
     */
    public static List<String> getAvailableProviders() {
        return loadProviders().stream()
                .map(MediaEngineProvider::status)
                .filter(ProviderStatus::available)
                .map(ProviderStatus::providerId)
                .distinct()
                .sorted()
                .collect(Collectors.toList());
    }

    /**
     * Get the status of the provider {@link #createProvider()} would pick, or why none can be picked.
     */
    public static ProviderStatus getCurrentStatus() {
        List<MediaEngineProvider> providers = loadProviders().stream()
                .sorted(Comparator.comparing(MediaEngineProvider::providerId))
                .toList();
        if (providers.isEmpty()) {
            return ProviderStatus.unavailable("none", "No media engine provider module on classpath");
        }
        List<ProviderStatus> statuses = providers.stream()
                .map(MediaEngineProvider::status)
                .toList();
        Optional<ProviderStatus> available = statuses.stream()
                .filter(ProviderStatus::available)
                .findFirst();
        if (available.isPresent()) {
            return available.get();
        }
        String reasons = statuses.stream()
                .map(status -> status.providerId() + ": " + status.reason())
                .collect(Collectors.joining("; "));
        return ProviderStatus.unavailable(statuses.get(0).providerId(), reasons);
    }

    private static List<MediaEngineProvider> loadProviders() {
        ServiceLoader<MediaEngineProvider> loader = ServiceLoader.load(MediaEngineProvider.class);
        List<MediaEngineProvider> providers = new ArrayList<>();
        loader.iterator().forEachRemaining(providers::add);
        if (logger.isDebugEnabled()) {
            logger.debug("Discovered media engine providers: {}",
                    providers.stream().map(MediaEngineProvider::providerId).collect(Collectors.joining(", ")));
        }
        return providers;
    }
}
