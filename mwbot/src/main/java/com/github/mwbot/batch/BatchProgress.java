package com.github.mwbot.batch;

/**
 * Snapshot taken right after an item settles.
 */
public record BatchProgress(int successes, int failures, int total) {
    public int finished() {
        return successes + failures;
    }

    public int percentageFinished() {
        return total == 0 ? 100 : (int) Math.round(finished() * 100.0 / total);
    }

    public int percentageSuccesses() {
        return finished() == 0 ? 0 : (int) Math.round(successes * 100.0 / finished());
    }

    public String toStatusText() {
        return String.format("Finished %d/%d (%d%%) tasks, of which %d (%d%%) were successful, and %d failed.",
            finished(), total, percentageFinished(), successes, percentageSuccesses(), failures);
    }
}
