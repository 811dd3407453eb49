package com.github.mwbot.batch;

public record BatchResult(int successes, int failures) {
    public int total() {
        return successes + failures;
    }
}
