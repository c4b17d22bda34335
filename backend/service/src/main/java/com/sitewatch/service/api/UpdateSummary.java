package com.sitewatch.service.api;

import com.sitewatch.core.model.Update;
import com.sitewatch.core.util.PreviewExtractor;

import java.time.Instant;

/**
 * An update as listed by the API: the stored content is replaced by its preview.
 */
public record UpdateSummary(long id, long siteId, Instant timestamp, String contentHash, String contentPreview) {
    public static UpdateSummary of(Update update, int previewLength) {
        return new UpdateSummary(
                update.id(),
                update.siteId(),
                update.timestamp(),
                update.contentHash(),
                PreviewExtractor.preview(update.content(), previewLength)
        );
    }
}
