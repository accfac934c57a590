package com.ttennebkram.heightmap.stages;

import com.ttennebkram.heightmap.error.DegenerateInputException;
import com.ttennebkram.heightmap.grid.IntensityGrid;
import com.ttennebkram.heightmap.processing.RowScheduler;

/**
 * Abstract base class for stages.
 * Provides metadata from {@link StageInfo} and the row scheduler used for per-row work.
 */
public abstract class StageBase<R> implements Stage<R> {

    /** Scheduler the stage spreads its rows over */
    protected final RowScheduler scheduler;

    private final StageInfo info;

    protected StageBase(RowScheduler scheduler) {
        this.scheduler = scheduler == null ? RowScheduler.sequential() : scheduler;
        this.info = getClass().getAnnotation(StageInfo.class);
        if (info == null) {
            throw new IllegalStateException(getClass().getName() + " is missing @StageInfo");
        }
    }

    @Override
    public String getNodeType() {
        return info.nodeType();
    }

    @Override
    public String getDisplayName() {
        return info.displayName().isEmpty() ? info.nodeType() : info.displayName();
    }

    @Override
    public String getCategory() {
        return info.category();
    }

    @Override
    public String getDescription() {
        return info.description();
    }

    /**
     * Standard null check for input validation.
     * Call at the start of process().
     */
    protected static IntensityGrid requireInput(IntensityGrid input) {
        if (input == null) {
            throw new DegenerateInputException("Input grid is null");
        }
        return input;
    }

    @Override
    public String toString() {
        return getDisplayName();
    }
}
