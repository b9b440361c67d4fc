package com.spformatter.core;

import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

import com.spformatter.api.error.FormattingException;
import com.spformatter.config.FormattingOptions;
import com.spformatter.plugins.sourcepawn.SourcePawnFormatter;
import com.spformatter.util.LoggerUtil;

/**
 * Formats editor contents off the caller's thread as they change.
 *
 * <p>Each {@link #submit(String)} supersedes every earlier request: a request still waiting
 * out the debounce delay is cancelled, and a request already formatting finishes but its
 * result is dropped. Only the newest request reaches the {@link PreviewListener}.
 */
public class FormatPreviewService implements AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(FormatPreviewService.class);
    private static final long SHUTDOWN_TIMEOUT_SEC = 5;

    private final SourcePawnFormatter formatter;
    private final PreviewListener listener;
    private final long debounceMillis;
    private final ScheduledExecutorService executor;
    private final AtomicLong generation = new AtomicLong(0);
    private final Object scheduleLock = new Object();
    private ScheduledFuture<?> pending;
    private volatile boolean closed = false;

    public FormatPreviewService(FormattingOptions options, long debounceMillis, PreviewListener listener) {
        this.formatter = new SourcePawnFormatter(options);
        this.listener = listener;
        this.debounceMillis = debounceMillis;
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "sp-format-preview");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Schedules a format of {@code source} and returns its request id.
     *
     * @throws IllegalStateException after {@link #close()}
     */
    public long submit(String source) {
        if (closed) {
            throw new IllegalStateException("Preview service has been closed");
        }
        synchronized (scheduleLock) {
            long requestId = generation.incrementAndGet();
            if (pending != null) {
                pending.cancel(false);
            }
            pending = executor.schedule(() -> _run(requestId, source), debounceMillis, TimeUnit.MILLISECONDS);
            return requestId;
        }
    }

    public long getLatestRequestId() {
        return generation.get();
    }

    private void _run(long requestId, String source) {
        if (!_isLatest(requestId)) {
            return;
        }
        try {
            String formatted = formatter.format(source);
            if (_isLatest(requestId)) {
                listener.onFormatted(requestId, formatted);
            } else {
                logger.finer(() -> "Dropped superseded preview " + requestId);
            }
        } catch (FormattingException e) {
            if (_isLatest(requestId)) {
                listener.onFailed(requestId, e);
            }
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Preview formatting failed", e);
            if (_isLatest(requestId)) {
                listener.onFailed(requestId, new FormattingException(String.valueOf(e.getMessage()), List.of()));
            }
        }
    }

    private boolean _isLatest(long requestId) {
        return !closed && generation.get() == requestId;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        executor.shutdownNow();
        try {
            if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SEC, TimeUnit.SECONDS)) {
                logger.warning("Preview thread did not stop in time");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        formatter.close();
    }
}
