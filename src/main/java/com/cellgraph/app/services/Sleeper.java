package com.cellgraph.app.services;

/**
 * The one blocking call the engine makes: SLEEP(n) waits here while the sheet's write lock is held.
 */
@FunctionalInterface
public interface Sleeper {

    void sleep(double seconds) throws InterruptedException;
}
