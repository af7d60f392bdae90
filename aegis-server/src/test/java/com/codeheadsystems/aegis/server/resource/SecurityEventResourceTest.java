package com.codeheadsystems.aegis.server.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.aegis.event.SecurityAction;
import com.codeheadsystems.aegis.event.SecurityEvent;
import com.codeheadsystems.aegis.event.SecurityStats;
import com.codeheadsystems.aegis.server.manager.TwoFactorManager;
import com.codeheadsystems.aegis.server.store.AdminSession;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class SecurityEventResourceTest {

  private static final String BEARER = "Bearer " + "a".repeat(64);

  @Mock private TwoFactorManager manager;
  private SecurityEventResource resource;

  @BeforeEach
  void setUp() {
    resource = new SecurityEventResource(manager);
  }

  @Test
  void events_requiresSessionThenDelegates() {
    SecurityEvent event = new SecurityEvent("admin-1", "10.0.0.1", "JUnit", SecurityAction.VERIFY, true, Instant.EPOCH);
    when(manager.requireSession(BEARER)).thenReturn(new AdminSession("admin-1", Instant.EPOCH, Instant.MAX));
    when(manager.events("admin-1", 50)).thenReturn(List.of(event));

    assertThat(resource.events(BEARER, "admin-1", 50)).containsExactly(event);
  }

  @Test
  void events_withoutSessionIsRejected() {
    when(manager.requireSession(null)).thenThrow(new SecurityException("Missing bearer token"));

    assertThatThrownBy(() -> resource.events(null, "admin-1", 50)).isInstanceOf(SecurityException.class);
    verify(manager, never()).events("admin-1", 50);
  }

  @Test
  void stats_delegates() {
    SecurityStats stats = new SecurityStats(
        new SecurityStats.Recent(0, 0, 0, 0.0, 0, 0), new SecurityStats.AllTime(0, null));
    when(manager.requireSession(BEARER)).thenReturn(new AdminSession("admin-1", Instant.EPOCH, Instant.MAX));
    when(manager.stats()).thenReturn(stats);

    assertThat(resource.stats(BEARER)).isSameAs(stats);
  }
}
