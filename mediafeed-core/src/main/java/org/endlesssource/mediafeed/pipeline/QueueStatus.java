package org.endlesssource.mediafeed.pipeline;

/**
 * Point-in-time view of the pipeline, suitable for a status line.
 *
 * @param readyCount       items waiting in the Ready queue
 * @param readyCapacity    maximum Ready queue length
 * @param prerollCount     items currently being prerolled
 * @param pendingCount     items sampled but not yet picked up by preroll
 * @param videoCount       outstanding video items, including ones held by the consumer
 * @param imageCount       outstanding image items
 * @param audioCount       outstanding audio items
 * @param outstandingPaths paths currently held by the deduplication cache
 */
public record QueueStatus(int readyCount,
                          int readyCapacity,
                          int prerollCount,
                          int pendingCount,
                          int videoCount,
                          int imageCount,
                          int audioCount,
                          int outstandingPaths) {

    public int outstandingCount() {
        return videoCount + imageCount + audioCount;
    }

    @Override
    public String toString() {
        return String.format("ready %d/%d, preroll %d, pending %d (video %d, image %d, audio %d)",
                readyCount, readyCapacity, prerollCount, pendingCount, videoCount, imageCount, audioCount);
    }
}
