package com.codeheadsystems.aegis.field;

/**
 * A decrypted and integrity-checked file.
 *
 * @param content  the file bytes
 * @param metadata the decrypted metadata
 */
public record DecryptedFile(byte[] content, FileMetadata metadata) {
}
