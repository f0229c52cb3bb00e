package org.endlesssource.mediafeed.sampler;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * One candidate chosen uniformly among {@link #count()} leaves examined so far.
 * <p>
 * {@link #combine(ScanResult)} keeps this side's candidate with probability
 * {@code count / (count + other.count)}. The rule is associative and commutative in
 * distribution, so any grouping of partial scans selects uniformly over the union.
 */
public final class ScanResult {
    private static final ScanResult EMPTY = new ScanResult(null, 0L);

    private final Path selected;
    private final long count;

    private ScanResult(Path selected, long count) {
        this.selected = selected;
        this.count = count;
    }

    public static ScanResult empty() {
        return EMPTY;
    }

    public static ScanResult of(Path leaf) {
        return new ScanResult(Objects.requireNonNull(leaf, "leaf must not be null"), 1L);
    }

    public Optional<Path> selected() {
        return Optional.ofNullable(selected);
    }

    public long count() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0L;
    }

    public ScanResult combine(ScanResult other) {
        return combine(other, ThreadLocalRandom.current());
    }

    public ScanResult combine(ScanResult other, Random random) {
        Objects.requireNonNull(other, "other must not be null");
        long total = saturatingAdd(count, other.count);
        if (total == 0L) {
            return EMPTY;
        }
        if (count == 0L) {
            return other;
        }
        if (other.count == 0L) {
            return this;
        }
        if (random.nextLong(total) < count) {
            return new ScanResult(selected, total);
        }
        return new ScanResult(other.selected, total);
    }

    private static long saturatingAdd(long a, long b) {
        long sum = a + b;
        return sum < 0L ? Long.MAX_VALUE : sum;
    }

    @Override
    public String toString() {
        return "ScanResult{selected=" + selected + ", count=" + count + '}';
    }
}
