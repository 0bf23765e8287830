package com.tamma.orchestrator.engine.lifecycle;

/**
 * External request layer (RPC, HTTP) through which submissions and worker calls arrive.
 * Opened during startup, closed once the drain is over.
 */
public interface Transport {

    String name();

    void open();

    void close();
}
