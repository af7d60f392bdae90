package com.codeheadsystems.aegis.field;

import com.codeheadsystems.aegis.crypto.CryptoCore;
import com.codeheadsystems.aegis.crypto.EncryptedEnvelope;
import com.codeheadsystems.aegis.exceptions.CryptoFailureException;
import com.codeheadsystems.aegis.exceptions.CryptoFailureException.Reason;
import com.codeheadsystems.aegis.exceptions.ValidationException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import org.bouncycastle.crypto.digests.SHA256Digest;
import org.bouncycastle.util.Arrays;
import org.bouncycastle.util.encoders.Hex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Encrypts application values, record fields and uploaded files with the data-plane
 * {@link CryptoCore}.
 * <p>
 * Values are serialized to JSON before encryption so any JSON type round-trips. Files are
 * encrypted with a separate associated-data label from values, so a file envelope cannot be
 * passed off as a value envelope or the reverse.
 */
public class FieldEncryptionService {

  public static final String ENCRYPTED_SUFFIX = "_encrypted";
  public static final String FLAG_SUFFIX = "_is_encrypted";

  static final byte[] VALUE_CONTEXT = "aegis-data".getBytes(StandardCharsets.UTF_8);
  static final byte[] FILE_CONTEXT = "aegis-file".getBytes(StandardCharsets.UTF_8);

  private static final Logger log = LoggerFactory.getLogger(FieldEncryptionService.class);

  private final CryptoCore cryptoCore;
  private final ObjectMapper objectMapper;

  public FieldEncryptionService(CryptoCore cryptoCore, ObjectMapper objectMapper) {
    this.cryptoCore = cryptoCore;
    this.objectMapper = objectMapper;
    log.info("FieldEncryptionService({})", cryptoCore);
  }

  // ─── Values ───────────────────────────────────────────────────────────────

  /**
   * Serializes {@code value} to JSON and encrypts it.
   *
   * @return the encoded envelope
   */
  public String encryptValue(Object value) {
    byte[] json;
    try {
      json = objectMapper.writeValueAsBytes(value);
    } catch (JsonProcessingException e) {
      throw new ValidationException("Value cannot be serialized");
    }
    return cryptoCore.encrypt(json, VALUE_CONTEXT).encode();
  }

  /**
   * Decrypts an envelope produced by {@link #encryptValue(Object)}.
   *
   * @throws CryptoFailureException with reason {@link Reason#CORRUPT_PAYLOAD} if the envelope
   *                                authenticates but its plaintext is not JSON
   */
  public JsonNode decryptValue(String envelope) {
    byte[] json = cryptoCore.decrypt(EncryptedEnvelope.decode(envelope), VALUE_CONTEXT);
    try {
      return objectMapper.readTree(json);
    } catch (IOException e) {
      throw new CryptoFailureException(Reason.CORRUPT_PAYLOAD, "Decrypted value is not JSON", e);
    }
  }

  public <T> T decryptValue(String envelope, Class<T> type) {
    JsonNode node = decryptValue(envelope);
    try {
      return objectMapper.treeToValue(node, type);
    } catch (JsonProcessingException e) {
      throw new CryptoFailureException(Reason.CORRUPT_PAYLOAD,
          "Decrypted value is not a " + type.getSimpleName(), e);
    }
  }

  // ─── Files ────────────────────────────────────────────────────────────────

  /**
   * Encrypts a file and its metadata. The SHA-256 checksum of the plaintext is embedded in the
   * encrypted metadata so {@link #decryptFile} can detect substitution of the content envelope.
   */
  public EncryptedFile encryptFile(byte[] content, FileMetadata metadata) {
    if (content == null || metadata == null) {
      throw new ValidationException("File content and metadata are required");
    }
    String checksum = sha256Hex(content);
    FileMetadata sealed = metadata.sealed(checksum);
    String encryptedMetadata = encryptValue(sealed);
    String encryptedContent = cryptoCore.encrypt(content, FILE_CONTEXT).encode();
    log.debug("encryptFile(size={})", content.length);
    return new EncryptedFile(encryptedContent, encryptedMetadata, checksum);
  }

  /**
   * Decrypts metadata then content, and checks the content against the stored checksum.
   *
   * @throws CryptoFailureException with reason {@link Reason#INTEGRITY_FAILED} if both envelopes
   *                                authenticate but the checksum does not match
   */
  public DecryptedFile decryptFile(String encryptedContent, String encryptedMetadata) {
    FileMetadata metadata = decryptValue(encryptedMetadata, FileMetadata.class);
    byte[] content = cryptoCore.decrypt(EncryptedEnvelope.decode(encryptedContent), FILE_CONTEXT);
    String actual = sha256Hex(content);
    if (metadata.checksum() == null || !Arrays.constantTimeAreEqual(
        actual.getBytes(StandardCharsets.US_ASCII),
        metadata.checksum().getBytes(StandardCharsets.US_ASCII))) {
      throw new CryptoFailureException(Reason.INTEGRITY_FAILED, "File checksum mismatch");
    }
    return new DecryptedFile(content, metadata);
  }

  static String sha256Hex(byte[] content) {
    SHA256Digest digest = new SHA256Digest();
    digest.update(content, 0, content.length);
    byte[] out = new byte[digest.getDigestSize()];
    digest.doFinal(out, 0);
    return Hex.toHexString(out);
  }

  // ─── Records ──────────────────────────────────────────────────────────────

  /**
   * Returns a copy of {@code record} where each named field that is present and not null is
   * replaced by {@code <name>_encrypted} and {@code <name>_is_encrypted: true}.
   */
  public ObjectNode encryptRecordFields(ObjectNode record, Collection<String> fieldNames) {
    ObjectNode copy = record.deepCopy();
    for (String field : fieldNames) {
      JsonNode value = copy.get(field);
      if (value == null || value.isNull()) {
        continue;
      }
      copy.put(field + ENCRYPTED_SUFFIX, encryptValue(value));
      copy.put(field + FLAG_SUFFIX, true);
      copy.remove(field);
    }
    return copy;
  }

  /**
   * Returns a copy of {@code record} with every flagged field decrypted. A field that fails to
   * decrypt keeps its encrypted form and is listed in {@link RecordDecryption#failedFields()}.
   */
  public RecordDecryption decryptRecordFields(ObjectNode record) {
    ObjectNode copy = record.deepCopy();
    List<String> flagged = new ArrayList<>();
    for (Iterator<String> names = record.fieldNames(); names.hasNext(); ) {
      String name = names.next();
      if (name.endsWith(FLAG_SUFFIX) && record.get(name).asBoolean(false)) {
        flagged.add(name.substring(0, name.length() - FLAG_SUFFIX.length()));
      }
    }
    List<String> failed = new ArrayList<>();
    for (String field : flagged) {
      JsonNode encrypted = copy.get(field + ENCRYPTED_SUFFIX);
      if (encrypted == null || !encrypted.isTextual()) {
        failed.add(field);
        continue;
      }
      try {
        copy.set(field, decryptValue(encrypted.asText()));
        copy.remove(field + ENCRYPTED_SUFFIX);
        copy.remove(field + FLAG_SUFFIX);
      } catch (CryptoFailureException e) {
        log.warn("Field {} left encrypted: reason={} detail={}", field, e.reason(), e.detail());
        failed.add(field);
      }
    }
    return new RecordDecryption(copy, List.copyOf(failed));
  }
}
