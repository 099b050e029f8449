package com.nfservice.plugboleto.polling;

import java.time.Duration;

public class ThreadSleeper implements Sleeper {

  @Override
  public void sleep(Duration duration) throws InterruptedException {
    if (!duration.isZero() && !duration.isNegative()) {
      Thread.sleep(duration.toMillis());
    }
  }
}
