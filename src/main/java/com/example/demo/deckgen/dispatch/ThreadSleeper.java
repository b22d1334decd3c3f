package com.example.demo.deckgen.dispatch;

import com.example.demo.deckgen.exception.DeckGenerationException;

import java.time.Duration;

public class ThreadSleeper implements Sleeper {

    @Override
    public void sleep(Duration duration) {
        if (duration.isZero() || duration.isNegative()) {
            return;
        }
        try {
            Thread.sleep(duration.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DeckGenerationException("INTERRUPTED", "Interrupted while pacing remote calls", e);
        }
    }
}
