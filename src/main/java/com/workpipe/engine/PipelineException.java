package com.workpipe.engine;

/** A pipeline stage failed for a reason other than the expected item outcomes. */
public class PipelineException extends RuntimeException {
    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
