package com.example.demo.deckgen.dispatch;

import java.time.Duration;

/**
 * Pauses the calling thread. Swapped for a virtual clock in tests.
 */
public interface Sleeper {

    void sleep(Duration duration);
}
