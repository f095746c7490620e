package com.spreadsheet.formula.worker;

/**
 * Receives every message a worker emits, in emission order, on the worker thread.
 */
@FunctionalInterface
public interface MessageSink {

    void send(EngineMessage message);
}
