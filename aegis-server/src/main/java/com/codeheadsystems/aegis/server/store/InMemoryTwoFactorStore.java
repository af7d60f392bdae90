package com.codeheadsystems.aegis.server.store;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Non-persistent {@link TwoFactorStore} backed by a {@link ConcurrentHashMap}.
 * All enrolments are lost on restart. Suitable for development and testing only.
 */
public class InMemoryTwoFactorStore implements TwoFactorStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryTwoFactorStore.class);

  private final ConcurrentHashMap<String, TwoFactorRecord> records = new ConcurrentHashMap<>();

  @Override
  public void store(TwoFactorRecord record) {
    records.put(record.adminId(), record);
    log.debug("Stored two-factor record enabled={}", record.enabled());
  }

  @Override
  public boolean replace(TwoFactorRecord expected, TwoFactorRecord updated) {
    boolean swapped = records.replace(expected.adminId(), expected, updated);
    log.debug("Replaced two-factor record swapped={}", swapped);
    return swapped;
  }

  @Override
  public Optional<TwoFactorRecord> load(String adminId) {
    return Optional.ofNullable(records.get(adminId));
  }

  @Override
  public void delete(String adminId) {
    records.remove(adminId);
  }
}
