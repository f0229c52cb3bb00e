package org.endlesssource.mediafeed.precache;

import org.endlesssource.mediafeed.api.EngineBusListener;
import org.endlesssource.mediafeed.api.EngineException;
import org.endlesssource.mediafeed.api.EngineState;
import org.endlesssource.mediafeed.api.MediaEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Headless engine that "prerolls" a file by reading its head into the OS page cache, so a real
 * player opening the file afterwards starts without touching the disk.
 * <p>
 * State changes are reported synchronously from {@link #setState(EngineState)}, on the calling
 * thread. The prefetch step reports as element {@value #PREFETCH_ELEMENT} before the pipeline-level
 * transition to PAUSED.
 */
final class PrecacheMediaEngine implements MediaEngine {
    private static final Logger logger = LoggerFactory.getLogger(PrecacheMediaEngine.class);
    static final int DEFAULT_PREFETCH_BYTES = 8 * 1024 * 1024;
    static final String PREFETCH_ELEMENT = "prefetch";
    private static final int CHUNK_SIZE = 1024 * 1024;

    private final Path path;
    private final int prefetchBytes;
    private final List<EngineBusListener> listeners = new CopyOnWriteArrayList<>();
    private EngineState state = EngineState.NULL;
    private boolean prefetched;
    private long prefetchedBytes;
    private Duration position = Duration.ZERO;
    private double rate = 1.0d;
    private int width;
    private int height;
    private boolean closed;

    PrecacheMediaEngine(Path path, int prefetchBytes) throws EngineException {
        this.path = Objects.requireNonNull(path, "path must not be null");
        this.prefetchBytes = prefetchBytes;
        if (!Files.isRegularFile(path)) {
            throw new EngineException("Not a regular file: " + path);
        }
        if (!Files.isReadable(path)) {
            throw new EngineException("File is not readable: " + path);
        }
        this.state = EngineState.READY;
    }

    @Override
    public Path getPath() {
        return path;
    }

    @Override
    public EngineState currentState() {
        return state;
    }

    @Override
    public void setState(EngineState target) throws EngineException {
        Objects.requireNonNull(target, "target must not be null");
        if (closed) {
            throw new EngineException("Engine for " + path + " is closed");
        }
        if (target == state) {
            return;
        }
        switch (target) {
            case NULL -> transition(EngineState.NULL);
            // stopping playback keeps the cached head
            case READY -> transition(EngineState.READY);
            case PAUSED -> {
                if (state == EngineState.NULL) {
                    transition(EngineState.READY);
                }
                if (!prefetched && !prefetch()) {
                    return;
                }
                transition(EngineState.PAUSED);
            }
            case PLAYING -> {
                if (state != EngineState.PAUSED) {
                    setState(EngineState.PAUSED);
                    if (state != EngineState.PAUSED) {
                        throw new EngineException("Engine for " + path + " could not preroll");
                    }
                }
                transition(EngineState.PLAYING);
                if (prefetchedBytes == 0L) {
                    listeners.forEach(l -> l.onEndOfStream(this));
                }
            }
        }
    }

    /**
     * Read up to {@code prefetchBytes} from the start of the file
     * @return false if reading failed; the error has been posted to listeners
     */
    private boolean prefetch() {
        EngineState from = state;
        listeners.forEach(l -> l.onStateChanged(this, false, from, EngineState.PAUSED));
        byte[] buffer = new byte[CHUNK_SIZE];
        long total = 0L;
        try (InputStream in = Files.newInputStream(path)) {
            while (total < prefetchBytes) {
                int read = in.read(buffer, 0, (int) Math.min(buffer.length, prefetchBytes - total));
                if (read < 0) {
                    break;
                }
                total += read;
            }
        } catch (IOException e) {
            logger.debug("Prefetch of {} failed: {}", path, e.getMessage());
            String message = "Failed to read " + path + ": " + e.getMessage();
            listeners.forEach(l -> l.onError(this, message));
            return false;
        }
        prefetched = true;
        prefetchedBytes = total;
        listeners.forEach(l -> l.onElementMessage(this, PREFETCH_ELEMENT, "prefetch-done"));
        logger.trace("Prefetched {} bytes of {}", total, path);
        return true;
    }

    private void transition(EngineState to) {
        EngineState from = state;
        state = to;
        listeners.forEach(l -> l.onStateChanged(this, true, from, to));
    }

    @Override
    public void seek(Duration position, OptionalDouble rate) throws EngineException {
        Objects.requireNonNull(position, "position must not be null");
        Objects.requireNonNull(rate, "rate must not be null");
        if (state != EngineState.PAUSED && state != EngineState.PLAYING) {
            throw new EngineException("Cannot seek " + path + " in state " + state);
        }
        if (rate.isPresent() && !(rate.getAsDouble() > 0.0d)) {
            throw new EngineException("Playback rate must be positive: " + rate.getAsDouble());
        }
        this.position = position.isNegative() ? Duration.ZERO : position;
        if (rate.isPresent()) {
            this.rate = rate.getAsDouble();
        }
    }

    @Override
    public void resize(int width, int height) {
        this.width = width;
        this.height = height;
    }

    Duration position() {
        return position;
    }

    double rate() {
        return rate;
    }

    long prefetchedBytes() {
        return prefetchedBytes;
    }

    int width() {
        return width;
    }

    int height() {
        return height;
    }

    @Override
    public void addBusListener(EngineBusListener listener) {
        listeners.add(Objects.requireNonNull(listener, "listener must not be null"));
    }

    @Override
    public void removeBusListener(EngineBusListener listener) {
        listeners.remove(listener);
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        if (state != EngineState.NULL) {
            logger.debug("Closing engine for {} in state {}", path, state);
        }
        closed = true;
        state = EngineState.NULL;
        listeners.clear();
    }

    @Override
    public String toString() {
        return "PrecacheMediaEngine{" + path + ", " + state + '}';
    }
}
