package com.workpipe.engine;

/** Receives item outcomes. Called concurrently from every stage thread. */
@FunctionalInterface
public interface PipelineListener {
    void onEvent(PipelineEvent event);

    PipelineListener NONE = e -> { };

    default PipelineListener andThen(PipelineListener next) {
        return e -> {
            onEvent(e);
            next.onEvent(e);
        };
    }
}
