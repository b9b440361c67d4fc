package com.spformatter.core;

import com.spformatter.api.error.FormattingException;

/**
 * Receives the result of the latest preview request. Called on the preview thread.
 */
public interface PreviewListener {

    void onFormatted(long requestId, String formatted);

    void onFailed(long requestId, FormattingException error);
}
