package com.workpipe.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Terminal consumer of items that ran out of retries. Must not throw. */
@FunctionalInterface
public interface DeadLetterSink {
    void accept(String label);

    static DeadLetterSink logging() {
        Logger log = LoggerFactory.getLogger(DeadLetterSink.class);
        return label -> log.warn("Dead letter: {} moved to failed items log", label);
    }
}
