package com.workpipe.engine;

import java.time.Instant;

public class PipelineEvent {
    public final Outcome outcome;
    public final Stage stage;
    public final String label;
    public final String key;
    public final String reason;
    public final Instant at;

    public PipelineEvent(Outcome outcome, Stage stage, String label, String reason) {
        this.outcome = outcome;
        this.stage = stage;
        this.label = label;
        this.key = WorkItem.normalize(label);
        this.reason = reason;
        this.at = Instant.now();
    }

    @Override
    public String toString() {
        return outcome + " " + label + " @" + stage + (reason == null ? "" : " (" + reason + ")");
    }
}
