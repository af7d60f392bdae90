package com.codeheadsystems.aegis.field;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.util.List;

/**
 * Result of {@link FieldEncryptionService#decryptRecordFields(ObjectNode)}.
 *
 * @param record       the record with every field that could be decrypted restored
 * @param failedFields names of fields left in encrypted form because decryption failed
 */
public record RecordDecryption(ObjectNode record, List<String> failedFields) {

  public boolean complete() {
    return failedFields.isEmpty();
  }
}
