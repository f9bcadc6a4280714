package com.hivemind.core.llm;

import org.springframework.web.client.RestClientResponseException;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A failed provider call, classified so the router can decide between cooling the
 * model down, retrying, or moving on.
 */
public class ProviderException extends RuntimeException {

    public enum Kind {
        RATE_LIMITED("rate_limited"),
        AUTH("auth"),
        NOT_FOUND("not_found"),
        INVALID_REQUEST("invalid_request"),
        SERVER("server"),
        OTHER("other");

        private final String tag;

        Kind(String tag) {
            this.tag = tag;
        }

        /** Metric tag value. */
        public String tag() {
            return tag;
        }
    }

    // "400 - {body}" as rendered by the HTTP client, optionally prefixed with "HTTP"
    private static final Pattern LEADING_STATUS = Pattern.compile("^(?:HTTP\\s+)?([45]\\d{2})\\b", Pattern.MULTILINE);
    private static final Pattern RATE_LIMIT_CODE = Pattern.compile("\\b429\\b");
    private static final Pattern AUTH_CODE = Pattern.compile("\\b40[13]\\b");
    private static final Pattern NOT_FOUND_CODE = Pattern.compile("\\b404\\b");
    private static final Pattern BAD_REQUEST_CODE = Pattern.compile("\\b400\\b");
    private static final Pattern SERVER_CODE = Pattern.compile("\\b50[0234]\\b");

    private final Kind kind;

    public ProviderException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ProviderException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * Wraps an arbitrary failure, classifying it by HTTP status when one is available
     * and by well-known markers in the message otherwise.
     */
    public static ProviderException from(Throwable error) {
        if (error instanceof ProviderException pe) {
            return pe;
        }
        return new ProviderException(classify(error), String.valueOf(error.getMessage()), error);
    }

    public static Kind classify(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof RestClientResponseException http) {
                return fromStatus(http.getStatusCode().value());
            }
        }
        return fromMessage(describe(error));
    }

    static Kind fromStatus(int status) {
        if (status == 429) {
            return Kind.RATE_LIMITED;
        }
        if (status == 401 || status == 403) {
            return Kind.AUTH;
        }
        if (status == 404) {
            return Kind.NOT_FOUND;
        }
        if (status == 400 || status == 422) {
            return Kind.INVALID_REQUEST;
        }
        if (status >= 500) {
            return Kind.SERVER;
        }
        return Kind.OTHER;
    }

    static Kind fromMessage(String text) {
        Matcher status = LEADING_STATUS.matcher(text);
        if (status.find()) {
            return fromStatus(Integer.parseInt(status.group(1)));
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (RATE_LIMIT_CODE.matcher(text).find() || text.contains("RESOURCE_EXHAUSTED")
                || lower.contains("rate_limit") || lower.contains("rate limit")) {
            return Kind.RATE_LIMITED;
        }
        if (AUTH_CODE.matcher(text).find() || text.contains("PERMISSION_DENIED")
                || text.contains("UNAUTHENTICATED")) {
            return Kind.AUTH;
        }
        if (NOT_FOUND_CODE.matcher(text).find() || text.contains("NOT_FOUND")) {
            return Kind.NOT_FOUND;
        }
        if (BAD_REQUEST_CODE.matcher(text).find() || text.contains("INVALID_ARGUMENT")) {
            return Kind.INVALID_REQUEST;
        }
        if (SERVER_CODE.matcher(text).find() || text.contains("UNAVAILABLE")) {
            return Kind.SERVER;
        }
        return Kind.OTHER;
    }

    private static String describe(Throwable error) {
        StringBuilder text = new StringBuilder();
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t.getMessage() != null) {
                text.append(t.getMessage()).append('\n');
            }
        }
        return text.toString();
    }
}
