package com.workpipe.engine;

public enum Stage {
    PRODUCER, ROUTER, WORKER, DEAD_LETTER
}
