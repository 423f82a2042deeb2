package com.conversionlog.sdk.dispatch;

import com.conversionlog.sdk.model.ConversionAction;
import com.conversionlog.sdk.validation.ConversionEventValidator;
import com.conversionlog.sdk.validation.ConversionInput;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RecordingEventSinkTest {

    private RecordingEventSink sink;

    @BeforeEach
    void setUp() {
        sink = new RecordingEventSink();
    }

    @Test
    void recordsAcceptedEvents() {
        assertThat(sink.push(purchase("B1")).isDone()).isTrue();
        assertThat(sink.push(purchase("B2")).isCompletedExceptionally()).isFalse();

        sink.assertEventCount(2);
        sink.assertEventSent("purchase", "B2");
        assertThat(sink.getEventsForBooking("B1")).hasSize(1);
    }

    @Test
    void failNextRejectsThenRecovers() {
        sink.failNext(2, "blocked");

        CompletableFuture<Void> first = sink.push(purchase("B1"));
        sink.push(purchase("B1"));
        sink.push(purchase("B1"));

        assertThat(first).isCompletedExceptionally();
        assertThat(sink.getPushCount()).isEqualTo(3);
        sink.assertEventCount(1);
    }

    @Test
    void assertionsReportMismatches() {
        sink.push(purchase("B1"));

        assertThatThrownBy(() -> sink.assertEventCount(2)).isInstanceOf(AssertionError.class);
        assertThatThrownBy(() -> sink.assertEventSent("purchase", "B9"))
                .isInstanceOf(AssertionError.class)
                .hasMessageContaining("B9");
    }

    @Test
    void resetClearsState() {
        sink.failNext(1, null).setAvailable(false);
        sink.push(purchase("B1"));

        sink.reset();

        assertThat(sink.isAvailable()).isTrue();
        assertThat(sink.getPushCount()).isZero();
        assertThat(sink.getEvents()).isEmpty();
    }

    private static SinkEvent purchase(String bookingId) {
        ConversionInput input = ConversionInput.builder()
                .transactionId(bookingId)
                .bookingId(bookingId)
                .value(9000)
                .currency("JPY")
                .build();
        return SinkEvent.of(new ConversionEventValidator().validate(ConversionAction.PURCHASE, input)
                .getEventOrThrow(), "AW-1/purchaseLbl");
    }
}
