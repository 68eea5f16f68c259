package com.swipesentinel.core;

/** Blocking pause used by the loop, recovery and validation. Replaced in tests. */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
