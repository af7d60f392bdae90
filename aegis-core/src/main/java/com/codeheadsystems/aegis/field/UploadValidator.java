package com.codeheadsystems.aegis.field;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Checks an upload before it is encrypted and stored: size, declared MIME type, name length and
 * executable or script extensions.
 */
public class UploadValidator {

  public static final long DEFAULT_MAX_BYTES = 10L * 1024 * 1024;
  public static final int MAX_NAME_LENGTH = 255;

  private static final Set<String> IMAGE_TYPES = Set.of(
      "image/jpeg", "image/jpg", "image/png", "image/webp", "image/gif");
  private static final Set<String> DOCUMENT_TYPES = Set.of(
      "application/pdf",
      "application/msword",
      "application/vnd.openxmlformats-officedocument.wordprocessingml.document",
      "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet",
      "text/plain");
  private static final List<String> SUSPICIOUS_EXTENSIONS = List.of(
      ".exe", ".bat", ".cmd", ".scr", ".pif", ".com", ".jar", ".vbs", ".js",
      ".php", ".asp", ".jsp", ".pl", ".py", ".rb", ".sh", ".ps1");

  private final long maxBytes;

  public UploadValidator(long maxBytes) {
    this.maxBytes = maxBytes;
  }

  public UploadValidator() {
    this(DEFAULT_MAX_BYTES);
  }

  public UploadValidation validate(String fileName, String mimeType, long size) {
    List<String> errors = new ArrayList<>();
    List<String> actions = new ArrayList<>();
    String name = fileName == null ? "" : fileName;

    if (size > maxBytes) {
      errors.add("File \"" + name + "\" exceeds maximum size limit of " + (maxBytes / 1024 / 1024) + "MB");
      actions.add("Please compress the file or choose a smaller file");
    }
    String category = category(mimeType);
    if (category.equals("other")) {
      errors.add("File type \"" + mimeType + "\" is not allowed for \"" + name + "\"");
      actions.add("Please choose files with these formats: JPG, PNG, WebP, PDF, DOC, DOCX");
    }
    if (name.isEmpty()) {
      errors.add("File name is required");
      actions.add("Please give the file a name");
    } else if (name.length() > MAX_NAME_LENGTH) {
      errors.add("File name is too long (max " + MAX_NAME_LENGTH + " characters)");
      actions.add("Please rename the file with a shorter name");
    }
    String lower = name.toLowerCase(Locale.ROOT);
    if (SUSPICIOUS_EXTENSIONS.stream().anyMatch(lower::endsWith)) {
      errors.add("File \"" + name + "\" contains suspicious extension");
      actions.add("Please ensure the file is a valid document or image");
    }
    return new UploadValidation(errors.isEmpty(), category, List.copyOf(errors), List.copyOf(actions));
  }

  public UploadValidation validate(FileMetadata metadata) {
    return validate(metadata.originalName(), metadata.mimeType(), metadata.size());
  }

  private static String category(String mimeType) {
    if (mimeType == null) {
      return "other";
    }
    String type = mimeType.toLowerCase(Locale.ROOT);
    if (IMAGE_TYPES.contains(type)) {
      return "image";
    }
    if (DOCUMENT_TYPES.contains(type)) {
      return "document";
    }
    return "other";
  }
}
