package com.ttennebkram.heightmap.processing;

import java.util.function.IntConsumer;
import java.util.stream.IntStream;

/**
 * Runs a per-row body over every row of a grid, either in order on the calling thread
 * or spread over the common ForkJoin pool.
 *
 * Row bodies must only write their own row of the output, which makes the parallel
 * result identical to the sequential one.
 */
public final class RowScheduler {

    /** Below this many rows the fork/join overhead outweighs the work */
    public static final int DEFAULT_PARALLEL_THRESHOLD = 32;

    private static final RowScheduler SEQUENTIAL = new RowScheduler(false, Integer.MAX_VALUE);

    private final boolean parallel;
    private final int parallelThreshold;

    private RowScheduler(boolean parallel, int parallelThreshold) {
        this.parallel = parallel;
        this.parallelThreshold = parallelThreshold;
    }

    public static RowScheduler sequential() {
        return SEQUENTIAL;
    }

    public static RowScheduler parallel() {
        return new RowScheduler(true, DEFAULT_PARALLEL_THRESHOLD);
    }

    /**
     * Parallel scheduler that only forks once a grid has at least {@code threshold} rows.
     */
    public static RowScheduler parallel(int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Parallel threshold must be >= 1, got " + threshold);
        }
        return new RowScheduler(true, threshold);
    }

    public boolean isParallel() {
        return parallel;
    }

    /**
     * Invoke {@code rowBody} once for every row in [0, rowCount).
     * Returns after all rows are done; a failure in any row is rethrown here.
     */
    public void forEachRow(int rowCount, IntConsumer rowBody) {
        if (parallel && rowCount >= parallelThreshold) {
            IntStream.range(0, rowCount).parallel().forEach(rowBody);
        } else {
            for (int row = 0; row < rowCount; row++) {
                rowBody.accept(row);
            }
        }
    }

    @Override
    public String toString() {
        return parallel ? "RowScheduler[parallel, threshold=" + parallelThreshold + "]" : "RowScheduler[sequential]";
    }
}
