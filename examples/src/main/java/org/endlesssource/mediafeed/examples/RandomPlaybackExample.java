package org.endlesssource.mediafeed.examples;

import org.endlesssource.mediafeed.MediaEngineFactory;
import org.endlesssource.mediafeed.api.EngineEvent;
import org.endlesssource.mediafeed.api.MediaFeedOptions;
import org.endlesssource.mediafeed.pipeline.AcquisitionPipeline;
import org.endlesssource.mediafeed.pipeline.ReadyMedia;
import org.endlesssource.mediafeed.pipeline.RootSet;
import org.endlesssource.mediafeed.pool.EngineWorkerPool;
import org.endlesssource.mediafeed.spi.ProviderStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Arrays;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Plays random files from the directories given on the command line, one every few seconds.
 */
public final class RandomPlaybackExample {
    private static final Logger logger = LoggerFactory.getLogger(RandomPlaybackExample.class);
    private static final Duration DWELL = Duration.ofSeconds(3);

    public static void main(String[] args) {
        if (args.length == 0) {
            logger.warn("Usage: RandomPlaybackExample <directory>...");
            return;
        }
        ProviderStatus status = MediaEngineFactory.getCurrentStatus();
        if (!status.available()) {
            logger.warn("No media engine available: {}", status.reason());
            return;
        }

        RootSet roots = new RootSet(Arrays.stream(args).map(Path::of).collect(Collectors.toList()));
        MediaFeedOptions options = MediaFeedOptions.defaults();
        EngineWorkerPool pool = new EngineWorkerPool(MediaEngineFactory.createProvider(), options.getWorkerCount());

        try (AcquisitionPipeline pipeline = new AcquisitionPipeline(options, roots, pool)) {
            pipeline.start();
            logger.info("Random playback running on {}. Press Ctrl+C to stop.", roots.enabledRoots());

            while (true) {
                Optional<ReadyMedia> next = pipeline.nextReady(Duration.ofSeconds(10));
                if (next.isEmpty()) {
                    logger.info("Nothing ready yet ({})", pipeline.status());
                    continue;
                }
                try (ReadyMedia media = next.get()) {
                    media.play().get(5, TimeUnit.SECONDS);
                    logger.info("Playing {} {} [{}]", media.kind(), media.path(), pipeline.status());
                    Thread.sleep(DWELL.toMillis());
                    media.engine().events().drain().stream()
                            .filter(EngineEvent.Error.class::isInstance)
                            .forEach(event -> logger.warn("Engine reported {}", event));
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        } catch (Exception e) {
            logger.error("Random playback example failed", e);
        }
    }

    private RandomPlaybackExample() {
    }
}
