package com.argument.mapping.argweave.exception;

/**
 * Unexpected failure inside a pipeline stage. The pipeline catches it and keeps
 * the graph the stage received.
 */
public class GraphPipelineException extends RuntimeException {

    private final String stage;

    public GraphPipelineException(String stage, Throwable cause) {
        super("Stage '" + stage + "' failed: " + cause.getMessage(), cause);
        this.stage = stage;
    }

    public String getStage() {
        return stage;
    }
}
