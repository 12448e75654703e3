package com.groundtruth.extractor;

import java.util.List;

public record BatchResult(List<DatabaseOutcome> outcomes) {

    public BatchResult {
        outcomes = List.copyOf(outcomes);
    }

    public long successes() {
        return outcomes.stream().filter(DatabaseOutcome::succeeded).count();
    }

    public long failures() {
        return outcomes.size() - successes();
    }
}
