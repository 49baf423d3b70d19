package com.withretries.core.notify;

import com.withretries.core.spi.RetryListener;
import com.withretries.model.ctx.RetryEvent;
import com.withretries.model.enums.RetryEventType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class RetryEventPublisherTest {

    @Mock
    private RetryListener failing;

    @Mock
    private RetryListener healthy;

    private static RetryEvent event(RetryEventType type) {
        return RetryEvent.builder()
                .type(type)
                .callId(7)
                .attempt(1)
                .maxAttempts(3)
                .error(new RuntimeException("boom"))
                .delay(Duration.ofMillis(20))
                .build();
    }

    @Test
    @DisplayName("A failing listener does not stop delivery to the others")
    void failingListenerIsIsolated() {
        RetryEvent e = event(RetryEventType.RETRY_SCHEDULED);
        when(failing.supports(e)).thenReturn(true);
        when(failing.name()).thenReturn("failing");
        doThrow(new IllegalStateException("listener down")).when(failing).onEvent(e);
        when(healthy.supports(e)).thenReturn(true);

        RetryEventPublisher publisher = new RetryEventPublisher(List.of(failing, healthy));

        assertThatCode(() -> publisher.fire(e)).doesNotThrowAnyException();
        verify(healthy).onEvent(e);
    }

    @Test
    @DisplayName("Listeners that do not support an event are skipped")
    void unsupportedEventIsSkipped() {
        RetryEvent e = event(RetryEventType.SUCCEEDED);
        when(healthy.supports(e)).thenReturn(false);

        new RetryEventPublisher(List.of(healthy)).fire(e);

        verify(healthy, never()).onEvent(any());
    }

    @Test
    @DisplayName("Logging listener handles every event type")
    void loggingListenerHandlesAllTypes() {
        LoggingRetryListener logging = new LoggingRetryListener();

        for (RetryEventType type : RetryEventType.values()) {
            assertThatCode(() -> logging.onEvent(event(type))).doesNotThrowAnyException();
        }
        assertThatCode(() -> logging.onEvent(RetryEvent.builder().type(RetryEventType.EXHAUSTED).build()))
                .doesNotThrowAnyException();
    }

    @Test
    @DisplayName("A null listener list publishes to nobody")
    void nullListenerList() {
        RetryEventPublisher publisher = new RetryEventPublisher(null);

        assertThatCode(() -> publisher.fire(event(RetryEventType.CANCELLED))).doesNotThrowAnyException();
    }
}
