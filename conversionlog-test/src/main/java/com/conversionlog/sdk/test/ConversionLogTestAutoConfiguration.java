package com.conversionlog.sdk.test;

import com.conversionlog.sdk.autoconfigure.ConversionLogAutoConfiguration;
import com.conversionlog.sdk.backup.BookingStore;
import com.conversionlog.sdk.backup.InMemoryBookingStore;
import com.conversionlog.sdk.client.FakePlatformTransport;
import com.conversionlog.sdk.client.StaticTokenProvider;
import com.conversionlog.sdk.client.TokenProvider;
import com.conversionlog.sdk.client.transport.ConversionTransport;
import com.conversionlog.sdk.dispatch.RecordingEventSink;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Profile;

/**
 * Replaces every outbound seam with an in-memory double when the {@code test} profile is active.
 * Host beans of the same type win.
 */
@AutoConfiguration(before = ConversionLogAutoConfiguration.class)
@Profile("test")
@ConditionalOnClass(RecordingEventSink.class)
public class ConversionLogTestAutoConfiguration {

    static final String TEST_TOKEN = "test-access-token";

    @Bean(name = ConversionLogAutoConfiguration.PRIMARY_SINK_BEAN)
    @ConditionalOnMissingBean(name = ConversionLogAutoConfiguration.PRIMARY_SINK_BEAN)
    public RecordingEventSink recordingEventSink() {
        return new RecordingEventSink();
    }

    @Bean
    @ConditionalOnMissingBean(BookingStore.class)
    public InMemoryBookingStore inMemoryBookingStore() {
        return new InMemoryBookingStore();
    }

    @Bean
    @ConditionalOnMissingBean(ConversionTransport.class)
    public FakePlatformTransport fakePlatformTransport() {
        return new FakePlatformTransport();
    }

    @Bean
    @ConditionalOnMissingBean(TokenProvider.class)
    public TokenProvider testTokenProvider() {
        return new StaticTokenProvider(TEST_TOKEN);
    }
}
