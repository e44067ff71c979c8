package com.linlay.agentruntime.llm;

import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

class FailoverReasonTest {

    @Test
    void shouldClassifyByMessageAndExceptionName() {
        assertThat(FailoverReason.classify(new RuntimeException("HTTP 429 from upstream"))).isEqualTo(FailoverReason.RATE_LIMIT);
        assertThat(FailoverReason.classify(new RuntimeException("Invalid API key provided"))).isEqualTo(FailoverReason.AUTH);
        assertThat(FailoverReason.classify(new RuntimeException("Payment Required"))).isEqualTo(FailoverReason.BILLING);
        assertThat(FailoverReason.classify(new TimeoutException())).isEqualTo(FailoverReason.TIMEOUT);
        assertThat(FailoverReason.classify(new RuntimeException("400 malformed tool schema"))).isEqualTo(FailoverReason.FORMAT);
        assertThat(FailoverReason.classify(new RuntimeException("socket closed"))).isEqualTo(FailoverReason.UNKNOWN);
        assertThat(FailoverReason.classify(null)).isEqualTo(FailoverReason.UNKNOWN);
    }

    @Test
    void rateLimitShouldWinOverLaterReasons() {
        assertThat(FailoverReason.classify(new RuntimeException("rate limit hit, request timed out"))).isEqualTo(FailoverReason.RATE_LIMIT);
    }

    @Test
    void statusCodesShouldOnlyMatchAsWholeNumbers() {
        assertThat(FailoverReason.classify(new RuntimeException("prompt used 14290 tokens"))).isEqualTo(FailoverReason.UNKNOWN);
        assertThat(FailoverReason.classify(new RuntimeException("request id 84011 failed"))).isEqualTo(FailoverReason.UNKNOWN);
        assertThat(FailoverReason.classify(new RuntimeException("status=401"))).isEqualTo(FailoverReason.AUTH);
        assertThat(FailoverReason.classify(new RuntimeException("(429)"))).isEqualTo(FailoverReason.RATE_LIMIT);
    }

    @Test
    void contextOverflowShouldBeRecognizedFromTheMessage() {
        assertThat(FailoverReason.isContextOverflow("This model's maximum context length is 8192 tokens")).isTrue();
        assertThat(FailoverReason.isContextOverflow("error code: context_length_exceeded")).isTrue();
        assertThat(FailoverReason.isContextOverflow("Prompt is too long")).isTrue();
        assertThat(FailoverReason.isContextOverflow("429 Too Many Requests")).isFalse();
        assertThat(FailoverReason.isContextOverflow(null)).isFalse();
    }

    @Test
    void statusCodeShouldBeReadFromMessageWhenNoHttpExceptionIsPresent() {
        assertThat(FallbackClient.extractStatusCode(new RuntimeException("wrapped", new RuntimeException("got 503 back"))))
                .isEqualTo(503);
        assertThat(FallbackClient.extractStatusCode(new RuntimeException("no code here"))).isNull();
    }
}
