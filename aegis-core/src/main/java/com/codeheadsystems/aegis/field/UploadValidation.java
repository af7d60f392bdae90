package com.codeheadsystems.aegis.field;

import java.util.List;

/**
 * Outcome of {@link UploadValidator#validate}.
 *
 * @param valid            true when no errors were found
 * @param category         {@code image}, {@code document} or {@code other}
 * @param errors           problems that block the upload
 * @param suggestedActions what the uploader can do about them
 */
public record UploadValidation(boolean valid, String category, List<String> errors,
                               List<String> suggestedActions) {
}
