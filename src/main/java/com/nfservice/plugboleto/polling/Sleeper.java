package com.nfservice.plugboleto.polling;

import java.time.Duration;

/** Suspends the calling thread between polling attempts. Swapped in tests. */
@FunctionalInterface
public interface Sleeper {

  void sleep(Duration duration) throws InterruptedException;
}
