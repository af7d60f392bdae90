package com.codeheadsystems.aegis.dropwizard.lifecycle;

import com.codeheadsystems.aegis.ratelimit.ExpiredWindowSweeper;
import io.dropwizard.lifecycle.Managed;

/**
 * Ties the rate-limit window sweeper to the Dropwizard lifecycle.
 */
public class ManagedSweeper implements Managed {

  private final ExpiredWindowSweeper sweeper;

  public ManagedSweeper(ExpiredWindowSweeper sweeper) {
    this.sweeper = sweeper;
  }

  @Override
  public void start() {
    sweeper.start();
  }

  @Override
  public void stop() {
    sweeper.shutdown();
  }
}
