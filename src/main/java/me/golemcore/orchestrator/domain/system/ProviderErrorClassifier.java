package me.golemcore.orchestrator.domain.system;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeoutException;

/**
 * Classifies provider failures into stable machine-readable reason codes.
 */
public final class ProviderErrorClassifier {

    public static final String REQUEST_ABORTED = "provider.request.aborted";
    public static final String REQUEST_TIMEOUT = "provider.request.timeout";
    public static final String EMPTY_RESPONSE = "provider.empty_response";
    public static final String UNAVAILABLE = "provider.unavailable";
    public static final String RATE_LIMIT = "provider.rate_limit";
    public static final String AUTHENTICATION = "provider.authentication";
    public static final String INVALID_REQUEST = "provider.invalid_request";
    public static final String MODEL_NOT_FOUND = "provider.model_not_found";
    public static final String CONTENT_FILTERED = "provider.content_filtered";
    public static final String INTERNAL_SERVER = "provider.internal_server";
    public static final String HTTP_ERROR = "provider.http_error";
    public static final String UNKNOWN = "provider.error.unknown";

    private static final String LANGCHAIN4J_EXCEPTIONS_PREFIX = "dev.langchain4j.exception.";

    private ProviderErrorClassifier() {
    }

    /**
     * Classify a failure by walking its cause chain.
     */
    public static String classify(Throwable throwable) {
        if (throwable == null) {
            return UNKNOWN;
        }

        Set<Throwable> visited = new HashSet<>();
        Throwable current = throwable;
        while (current != null && !visited.contains(current)) {
            visited.add(current);

            String byType = classifyKnownThrowable(current);
            if (!UNKNOWN.equals(byType)) {
                return byType;
            }

            String byMessage = classifyFromMessage(current.getMessage());
            if (!UNKNOWN.equals(byMessage)) {
                return byMessage;
            }

            current = current.getCause();
        }
        return UNKNOWN;
    }

    public static boolean isRateLimit(Throwable throwable) {
        return RATE_LIMIT.equals(classify(throwable));
    }

    public static boolean isTransientCode(String code) {
        return RATE_LIMIT.equals(code)
                || REQUEST_TIMEOUT.equals(code)
                || INTERNAL_SERVER.equals(code);
    }

    private static String classifyKnownThrowable(Throwable throwable) {
        if (throwable instanceof CancellationException || throwable instanceof InterruptedException) {
            return REQUEST_ABORTED;
        }
        if (throwable instanceof SocketTimeoutException
                || throwable instanceof HttpTimeoutException
                || throwable instanceof TimeoutException) {
            return REQUEST_TIMEOUT;
        }

        String className = throwable.getClass().getName();
        if (!className.startsWith(LANGCHAIN4J_EXCEPTIONS_PREFIX)) {
            return UNKNOWN;
        }
        String simpleName = className.substring(LANGCHAIN4J_EXCEPTIONS_PREFIX.length());
        return switch (simpleName) {
        case "RateLimitException" -> RATE_LIMIT;
        case "TimeoutException" -> REQUEST_TIMEOUT;
        case "AuthenticationException" -> AUTHENTICATION;
        case "InvalidRequestException" -> INVALID_REQUEST;
        case "ModelNotFoundException" -> MODEL_NOT_FOUND;
        case "ContentFilteredException" -> CONTENT_FILTERED;
        case "InternalServerException" -> INTERNAL_SERVER;
        case "HttpException" -> classifyHttpExceptionByStatus(throwable);
        default -> UNKNOWN;
        };
    }

    private static String classifyHttpExceptionByStatus(Throwable throwable) {
        Integer statusCode = readHttpStatusCode(throwable);
        if (statusCode == null) {
            return HTTP_ERROR;
        }
        if (statusCode == 429) {
            return RATE_LIMIT;
        }
        if (statusCode == 401 || statusCode == 403) {
            return AUTHENTICATION;
        }
        if (statusCode == 408 || statusCode == 504) {
            return REQUEST_TIMEOUT;
        }
        if (statusCode >= 500) {
            return INTERNAL_SERVER;
        }
        if (statusCode >= 400) {
            return INVALID_REQUEST;
        }
        return HTTP_ERROR;
    }

    private static Integer readHttpStatusCode(Throwable throwable) {
        try {
            Method method = throwable.getClass().getMethod("statusCode");
            Object result = method.invoke(throwable);
            if (result instanceof Integer) {
                return (Integer) result;
            }
        } catch (NoSuchMethodException | IllegalAccessException | InvocationTargetException ignored) {
            return null;
        }
        return null;
    }

    private static String classifyFromMessage(String message) {
        if (message == null || message.isBlank()) {
            return UNKNOWN;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        if (normalized.contains("429") || normalized.contains("rate_limit") || normalized.contains("rate limit")) {
            return RATE_LIMIT;
        }
        if (normalized.contains("timed out") || normalized.contains("timeout")) {
            return REQUEST_TIMEOUT;
        }
        return UNKNOWN;
    }
}
