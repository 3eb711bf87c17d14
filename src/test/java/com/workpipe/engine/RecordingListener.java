package com.workpipe.engine;

import java.util.List;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.stream.Collectors;

class RecordingListener implements PipelineListener {
    final ConcurrentLinkedQueue<PipelineEvent> events = new ConcurrentLinkedQueue<>();

    @Override
    public void onEvent(PipelineEvent event) {
        events.add(event);
    }

    List<String> labels(Outcome outcome) {
        return events.stream()
                .filter(e -> e.outcome == outcome)
                .map(e -> e.label)
                .collect(Collectors.toList());
    }

    List<PipelineEvent> of(Outcome outcome) {
        return events.stream().filter(e -> e.outcome == outcome).collect(Collectors.toList());
    }
}
