package com.codeheadsystems.aegis.springboot.health;

import com.codeheadsystems.aegis.crypto.CryptoCore;
import com.codeheadsystems.aegis.springboot.config.CryptoPlanes;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

@Component
public class CryptoHealthIndicator implements HealthIndicator {

  private static final byte[] SAMPLE = "aegis-health-sample".getBytes(StandardCharsets.UTF_8);

  private final CryptoPlanes planes;

  public CryptoHealthIndicator(CryptoPlanes planes) {
    this.planes = planes;
  }

  @Override
  public Health health() {
    Health.Builder builder = Health.up();
    for (Map.Entry<String, CryptoCore> entry : Map.of("secret", planes.secret(), "data", planes.data()).entrySet()) {
      String plane = entry.getKey();
      CryptoCore core = entry.getValue();
      try {
        if (!Arrays.equals(SAMPLE, core.decrypt(core.encrypt(SAMPLE)))) {
          return Health.down().withDetail("reason", plane + " plane returned a different plaintext").build();
        }
      } catch (RuntimeException e) {
        return Health.down().withDetail("reason", plane + " plane round trip failed")
            .withDetail("error", e.getClass().getSimpleName())
            .build();
      }
      builder.withDetail(plane, "ok");
    }
    return builder.build();
  }
}
