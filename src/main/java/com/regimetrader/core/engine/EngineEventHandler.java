package com.regimetrader.core.engine;

/** Consumer side of the {@link EngineEventLoop}. Always invoked from the loop's single thread. */
public interface EngineEventHandler {

    void handle(EngineEvent event);
}
