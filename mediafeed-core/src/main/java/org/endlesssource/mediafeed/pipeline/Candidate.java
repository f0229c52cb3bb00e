package org.endlesssource.mediafeed.pipeline;

import org.endlesssource.mediafeed.api.MediaKind;

import java.nio.file.Path;

/**
 * A sampled path that passed deduplication and is travelling through the pipeline.
 */
record Candidate(Path path, MediaKind kind) {
}
