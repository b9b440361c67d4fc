package com.spformatter.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

import com.spformatter.api.error.FormattingException;
import com.spformatter.config.FormattingOptions;

class FormatPreviewServiceTest {

    private static final class RecordingListener implements PreviewListener {
        final List<Long> formattedIds = new CopyOnWriteArrayList<>();
        final List<String> formatted = new CopyOnWriteArrayList<>();
        final List<Long> failedIds = new CopyOnWriteArrayList<>();
        final CountDownLatch done = new CountDownLatch(1);

        @Override
        public void onFormatted(long requestId, String text) {
            formattedIds.add(requestId);
            formatted.add(text);
            done.countDown();
        }

        @Override
        public void onFailed(long requestId, FormattingException error) {
            failedIds.add(requestId);
            done.countDown();
        }
    }

    @Test
    void testOnlyLatestRequestIsDelivered() throws InterruptedException {
        RecordingListener listener = new RecordingListener();
        try (FormatPreviewService service = new FormatPreviewService(FormattingOptions.defaults(), 300, listener)) {
            service.submit("x+=5;");
            service.submit("a+c");
            long last = service.submit("a+b");

            assertThat(listener.done.await(10, TimeUnit.SECONDS)).isTrue();
            // give a superseded request time to show up if it was wrongly delivered
            Thread.sleep(400);

            assertThat(service.getLatestRequestId()).isEqualTo(last);
            assertThat(listener.formattedIds).containsExactly(last);
            assertThat(listener.formatted).containsExactly("a + b");
            assertThat(listener.failedIds).isEmpty();
        }
    }

    @Test
    void testFailureIsReported() throws InterruptedException {
        RecordingListener listener = new RecordingListener();
        try (FormatPreviewService service = new FormatPreviewService(FormattingOptions.defaults(), 10, listener)) {
            long id = service.submit("}}}");

            assertThat(listener.done.await(10, TimeUnit.SECONDS)).isTrue();
            assertThat(listener.failedIds).containsExactly(id);
            assertThat(listener.formattedIds).isEmpty();
        }
    }

    @Test
    void testSubmitAfterClose() {
        FormatPreviewService service = new FormatPreviewService(FormattingOptions.defaults(), 10,
                new RecordingListener());
        service.close();

        assertThatThrownBy(() -> service.submit("a+b"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessage("Preview service has been closed");
    }
}
