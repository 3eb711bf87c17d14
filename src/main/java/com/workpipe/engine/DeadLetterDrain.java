package com.workpipe.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Hands every dead-letter item to the sink until the queue is closed and drained. */
public class DeadLetterDrain implements Runnable {
    private static final Logger log = LoggerFactory.getLogger(DeadLetterDrain.class);

    private final QueueSource<WorkItem> dead;
    private final DeadLetterSink sink;
    private final PipelineListener listener;

    public DeadLetterDrain(QueueSource<WorkItem> dead, DeadLetterSink sink, PipelineListener listener) {
        this.dead = dead;
        this.sink = sink;
        this.listener = listener;
    }

    @Override
    public void run() {
        int drained = 0;
        try {
            WorkItem item;
            while ((item = dead.take()) != null) {
                try {
                    sink.accept(item.label);
                } catch (RuntimeException e) {
                    log.error("Dead-letter sink failed on {}", item, e);
                }
                listener.onEvent(new PipelineEvent(Outcome.DEAD, Stage.DEAD_LETTER, item.label, null));
                dead.markDone();
                drained++;
            }
            log.info("Dead-letter drain finished, {} items", drained);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Dead-letter drain interrupted after {} items", drained);
        }
    }
}
