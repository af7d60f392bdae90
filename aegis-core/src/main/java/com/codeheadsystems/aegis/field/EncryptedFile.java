package com.codeheadsystems.aegis.field;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An encrypted file as handed to storage.
 *
 * @param encryptedContent  envelope of the file bytes
 * @param encryptedMetadata envelope of the {@link FileMetadata} JSON, including the checksum
 * @param checksum          SHA-256 hex of the plaintext
 */
public record EncryptedFile(
    @JsonProperty("encryptedContent") String encryptedContent,
    @JsonProperty("encryptedMetadata") String encryptedMetadata,
    @JsonProperty("checksum") String checksum) {
}
