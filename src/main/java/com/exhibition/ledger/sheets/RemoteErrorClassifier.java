package com.exhibition.ledger.sheets;

import java.util.Locale;

/**
 * Maps a failed response to a {@link SyncErrorKind}.
 *
 * <ul>
 *   <li>429, or a body mentioning {@code RESOURCE_EXHAUSTED} or a quota: quota exceeded</li>
 *   <li>403: permission denied</li>
 *   <li>a body mentioning the workbook cell limit: capacity exceeded</li>
 *   <li>anything else: unknown</li>
 * </ul>
 */
public final class RemoteErrorClassifier {

    private RemoteErrorClassifier() {
        // Utility class
    }

    public static SyncErrorKind classify(int statusCode, String body) {
        String text = body != null ? body.toLowerCase(Locale.ROOT) : "";
        if (statusCode == 429 || text.contains("resource_exhausted") || text.contains("quota")) {
            return SyncErrorKind.REMOTE_QUOTA_EXCEEDED;
        }
        if (statusCode == 403) {
            return SyncErrorKind.REMOTE_PERMISSION_DENIED;
        }
        if (mentionsCellLimit(text)) {
            return SyncErrorKind.REMOTE_CAPACITY_EXCEEDED;
        }
        return SyncErrorKind.REMOTE_UNKNOWN_ERROR;
    }

    private static boolean mentionsCellLimit(String text) {
        // "...would increase the number of cells in the workbook above the limit of 10000000 cells."
        return text.contains("limit") && text.contains("cells");
    }
}
