package com.ontheform.features.submission.application.export;

import java.io.InputStream;
import java.util.function.Supplier;

/**
 * A rendered export ready for download.
 */
public record ExportFile(
        String filename,
        String contentType,
        Supplier<InputStream> contentSupplier,
        long contentLength
) {
    public ExportFile {
        if (filename == null || filename.isBlank()) {
            throw new IllegalArgumentException("Filename cannot be null or blank");
        }
        if (contentType == null || contentType.isBlank()) {
            throw new IllegalArgumentException("Content type cannot be null or blank");
        }
        if (contentSupplier == null) {
            throw new IllegalArgumentException("Content supplier cannot be null");
        }
    }
}
