package me.golemcore.orchestrator.domain.system;

import dev.langchain4j.exception.AuthenticationException;
import dev.langchain4j.exception.ContentFilteredException;
import dev.langchain4j.exception.HttpException;
import dev.langchain4j.exception.InternalServerException;
import dev.langchain4j.exception.InvalidRequestException;
import dev.langchain4j.exception.ModelNotFoundException;
import dev.langchain4j.exception.RateLimitException;
import dev.langchain4j.exception.TimeoutException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.net.SocketTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ProviderErrorClassifierTest {

    @Test
    void shouldClassifyRateLimitFromCauseChain() {
        Throwable throwable = new CompletionException(
                new RuntimeException("wrapper", new RateLimitException("too many requests")));

        assertEquals(ProviderErrorClassifier.RATE_LIMIT, ProviderErrorClassifier.classify(throwable));
        assertTrue(ProviderErrorClassifier.isRateLimit(throwable));
    }

    @ParameterizedTest
    @CsvSource({
            "429, provider.rate_limit",
            "401, provider.authentication",
            "403, provider.authentication",
            "408, provider.request.timeout",
            "504, provider.request.timeout",
            "503, provider.internal_server",
            "404, provider.invalid_request",
            "302, provider.http_error"
    })
    void shouldClassifyHttpStatuses(int statusCode, String expectedCode) {
        assertEquals(expectedCode, ProviderErrorClassifier.classify(new HttpException(statusCode, "status")));
    }

    @Test
    void shouldClassifySpecificLangchainExceptions() {
        assertEquals(ProviderErrorClassifier.AUTHENTICATION,
                ProviderErrorClassifier.classify(new AuthenticationException("auth")));
        assertEquals(ProviderErrorClassifier.CONTENT_FILTERED,
                ProviderErrorClassifier.classify(new ContentFilteredException("filtered")));
        assertEquals(ProviderErrorClassifier.INTERNAL_SERVER,
                ProviderErrorClassifier.classify(new InternalServerException("internal")));
        assertEquals(ProviderErrorClassifier.INVALID_REQUEST,
                ProviderErrorClassifier.classify(new InvalidRequestException("invalid")));
        assertEquals(ProviderErrorClassifier.MODEL_NOT_FOUND,
                ProviderErrorClassifier.classify(new ModelNotFoundException("missing")));
        assertEquals(ProviderErrorClassifier.REQUEST_TIMEOUT,
                ProviderErrorClassifier.classify(new TimeoutException("slow")));
    }

    @Test
    void shouldClassifyJdkAbortAndTimeout() {
        assertEquals(ProviderErrorClassifier.REQUEST_ABORTED,
                ProviderErrorClassifier.classify(new CancellationException("cancelled")));
        assertEquals(ProviderErrorClassifier.REQUEST_ABORTED,
                ProviderErrorClassifier.classify(new RuntimeException(new InterruptedException("stop"))));
        assertEquals(ProviderErrorClassifier.REQUEST_TIMEOUT,
                ProviderErrorClassifier.classify(new SocketTimeoutException("socket")));
    }

    @Test
    void shouldFallBackToMessageHints() {
        assertEquals(ProviderErrorClassifier.RATE_LIMIT,
                ProviderErrorClassifier.classify(new RuntimeException("HTTP 429 Too Many Requests")));
        assertEquals(ProviderErrorClassifier.REQUEST_TIMEOUT,
                ProviderErrorClassifier.classify(new RuntimeException("Read timed out")));
    }

    @Test
    void shouldReturnUnknownWithoutSignals() {
        assertEquals(ProviderErrorClassifier.UNKNOWN,
                ProviderErrorClassifier.classify(new CompletionException(new RuntimeException("generic"))));
        assertEquals(ProviderErrorClassifier.UNKNOWN, ProviderErrorClassifier.classify(null));
    }

    @Test
    void shouldTreatRateLimitTimeoutAndServerErrorsAsTransient() {
        assertTrue(ProviderErrorClassifier.isTransientCode(ProviderErrorClassifier.RATE_LIMIT));
        assertTrue(ProviderErrorClassifier.isTransientCode(ProviderErrorClassifier.REQUEST_TIMEOUT));
        assertTrue(ProviderErrorClassifier.isTransientCode(ProviderErrorClassifier.INTERNAL_SERVER));
        assertFalse(ProviderErrorClassifier.isTransientCode(ProviderErrorClassifier.AUTHENTICATION));
    }
}
