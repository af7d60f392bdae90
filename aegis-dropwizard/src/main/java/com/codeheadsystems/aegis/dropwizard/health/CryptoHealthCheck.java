package com.codeheadsystems.aegis.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.aegis.crypto.CryptoCore;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Health check that round-trips a sample value through each configured {@link CryptoCore}.
 */
public class CryptoHealthCheck extends HealthCheck {

  private static final byte[] SAMPLE = "aegis-health-sample".getBytes(StandardCharsets.UTF_8);

  private final CryptoCore[] cores;

  public CryptoHealthCheck(CryptoCore... cores) {
    this.cores = cores.clone();
  }

  @Override
  protected Result check() {
    for (CryptoCore core : cores) {
      try {
        if (!Arrays.equals(SAMPLE, core.decrypt(core.encrypt(SAMPLE)))) {
          return Result.unhealthy("%s returned a different plaintext", core);
        }
      } catch (RuntimeException e) {
        return Result.unhealthy("%s round trip failed: %s", core, e.getClass().getSimpleName());
      }
    }
    return Result.healthy("%d crypto core(s) round-tripped", cores.length);
  }
}
