package com.geico.poc.policyjobs.routine;

/**
 * Receives the output a called routine produces.
 */
@FunctionalInterface
public interface ResultSink {

    ResultSink DISCARD = result -> { };

    void accept(Object result);

    /**
     * A sink that drops all output.
     */
    static ResultSink discard() {
        return DISCARD;
    }
}
