package com.ctfportal.sdk.errors;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of classifying a failure: the kind, a message that is safe to show to
 * a user, and whether the user should be notified at all.
 */
public final class ClassifiedError {

    private final ErrorKind kind;
    private final String message;
    private final boolean silent;
    private final int statusCode;
    private final List<String> messages;

    public ClassifiedError(ErrorKind kind, String message, boolean silent, int statusCode, List<String> messages) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.message = Objects.requireNonNull(message, "message must not be null");
        this.silent = silent;
        this.statusCode = statusCode;
        this.messages = messages != null && !messages.isEmpty() ? List.copyOf(messages) : List.of(message);
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * The single message to show.
     */
    public String getMessage() {
        return message;
    }

    public boolean isSilent() {
        return silent;
    }

    /**
     * HTTP status of the response, or 0 if none was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    /**
     * Every safe message extracted from the response, shortest first.
     */
    public List<String> getMessages() {
        return messages;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ClassifiedError that = (ClassifiedError) o;
        return silent == that.silent
                && statusCode == that.statusCode
                && kind == that.kind
                && message.equals(that.message)
                && messages.equals(that.messages);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, message, silent, statusCode, messages);
    }

    @Override
    public String toString() {
        return "ClassifiedError{" +
                "kind=" + kind +
                ", statusCode=" + statusCode +
                ", message='" + message + '\'' +
                ", silent=" + silent +
                '}';
    }
}
