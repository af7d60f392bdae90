package com.codeheadsystems.aegis.field;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.Instant;

/**
 * Descriptive data about an uploaded file. Stored encrypted alongside the file content.
 *
 * @param originalName the name the file was uploaded with
 * @param mimeType     declared MIME type
 * @param size         plaintext size in bytes
 * @param uploadedAt   upload time
 * @param checksum     SHA-256 hex of the plaintext, set by {@link FieldEncryptionService#encryptFile}
 * @param encrypted    true once the file has been encrypted
 */
public record FileMetadata(
    @JsonProperty("originalName") String originalName,
    @JsonProperty("mimeType") String mimeType,
    @JsonProperty("size") long size,
    @JsonProperty("uploadedAt") Instant uploadedAt,
    @JsonProperty("checksum") String checksum,
    @JsonProperty("isEncrypted") boolean encrypted) {

  /**
   * Metadata for a file that has not been encrypted yet.
   */
  public static FileMetadata of(String originalName, String mimeType, long size, Instant uploadedAt) {
    return new FileMetadata(originalName, mimeType, size, uploadedAt, null, false);
  }

  public FileMetadata sealed(String checksum) {
    return new FileMetadata(originalName, mimeType, size, uploadedAt, checksum, true);
  }
}
