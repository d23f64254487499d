package com.ctfportal.sdk.errors;

import com.ctfportal.sdk.http.ApiResponse;
import com.ctfportal.sdk.http.RequestDescriptor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.stream.Collectors;

/**
 * Turns a raw failure into a {@link ClassifiedError}.
 *
 * <p>The message is taken from the response body when the body holds short,
 * human-readable text; anything that looks like backend internals (stack traces,
 * exception names, SQL, HTML error pages) is dropped in favour of a generic
 * message for the status. Classification has no side effects and the same input
 * always gives the same result.</p>
 */
public class ErrorClassifier {

    public static final String DEFAULT_SILENT_HEADER = "X-Silent-Error";

    static final String MSG_CANCELLED = "Request cancelled.";
    static final String MSG_NETWORK = "Couldn't reach the server. Check your connection and try again.";
    static final String MSG_TIMEOUT = "The request timed out. Please try again.";
    static final String MSG_BAD_REQUEST = "Your request couldn't be processed. Please check and try again.";
    static final String MSG_SESSION_EXPIRED = "Your session has expired. Please log in again.";
    static final String MSG_FORBIDDEN = "You don't have permission to do that.";
    static final String MSG_NOT_FOUND = "Service endpoint not found. Please contact support.";
    static final String MSG_TOO_LARGE = "Request is too large. Please shorten it.";
    static final String MSG_RATE_LIMITED = "Too many requests. Please wait a moment and try again.";
    static final String MSG_SERVER_ERROR = "Server error. Please try again in a bit.";
    static final String MSG_UNKNOWN = "Something went wrong. Please try again.";

    private static final int MAX_TEXT_LENGTH = 300;
    private static final int MAX_ENTRY_LENGTH = 260;
    private static final String ELLIPSIS = "…";

    private static final List<String> DIRECT_FIELDS =
            List.of("detail", "error", "message", "msg", "reason", "description");
    private static final String NON_FIELD_ERRORS = "non_field_errors";
    private static final Set<String> RESERVED_FIELDS =
            Set.of("detail", "error", "message", "msg", "reason", "description", NON_FIELD_ERRORS);

    private static final List<String> LEAK_MARKERS = List.of(
            "traceback", "stack trace", "exception", "django", "sql", "typeerror", "valueerror");

    private final ObjectReader treeReader;
    private final String silentHeader;

    public ErrorClassifier(ObjectMapper objectMapper) {
        this(objectMapper, DEFAULT_SILENT_HEADER);
    }

    public ErrorClassifier(ObjectMapper objectMapper, String silentHeader) {
        // "404 page not found" is text, not the number 404
        this.treeReader = objectMapper.reader().with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
        this.silentHeader = silentHeader;
    }

    public ClassifiedError classify(RawFailure failure) {
        RequestDescriptor request = failure.getRequest();

        if (!failure.hasResponse()) {
            ErrorKind kind = kindOf(failure.getError());
            switch (kind) {
                case CANCELLED:
                    return new ClassifiedError(kind, MSG_CANCELLED, true, 0, null);
                case TIMEOUT:
                    return new ClassifiedError(kind, MSG_TIMEOUT, isSilent(request), 0, null);
                default:
                    return new ClassifiedError(kind, MSG_NETWORK, isSilent(request), 0, null);
            }
        }

        ApiResponse response = failure.getResponse();
        int status = response.getStatusCode();
        List<String> candidates = extractMessages(response.getBody());
        String message = candidates.isEmpty() ? fallbackMessage(status) : candidates.get(0);
        return new ClassifiedError(ErrorKind.fromStatus(status), message, isSilent(request), status, candidates);
    }

    /**
     * The error surfaced when the session could not be renewed.
     */
    public ClassifiedError sessionExpired(RequestDescriptor request, int statusCode) {
        return new ClassifiedError(ErrorKind.UNAUTHORIZED, MSG_SESSION_EXPIRED, isSilent(request), statusCode, null);
    }

    /**
     * Whether the request opted out of notifications, by flag or by header
     * ({@code 1} or {@code true}).
     */
    public boolean isSilent(RequestDescriptor request) {
        if (request == null) {
            return false;
        }
        if (request.isSilent()) {
            return true;
        }
        String value = request.header(silentHeader);
        return value != null && ("1".equals(value.trim()) || "true".equalsIgnoreCase(value.trim()));
    }

    public static String fallbackMessage(int status) {
        if (status <= 0) return MSG_NETWORK;
        if (status == 400) return MSG_BAD_REQUEST;
        if (status == 401) return MSG_SESSION_EXPIRED;
        if (status == 403) return MSG_FORBIDDEN;
        if (status == 404) return MSG_NOT_FOUND;
        if (status == 408) return MSG_TIMEOUT;
        if (status == 413) return MSG_TOO_LARGE;
        if (status == 429) return MSG_RATE_LIMITED;
        if (status >= 500) return MSG_SERVER_ERROR;
        return MSG_UNKNOWN;
    }

    static ErrorKind kindOf(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof CancellationException || current instanceof InterruptedException) {
                return ErrorKind.CANCELLED;
            }
            if (current instanceof SocketTimeoutException) {
                return ErrorKind.TIMEOUT;
            }
            if (current instanceof InterruptedIOException) {
                String msg = current.getMessage();
                return msg != null && msg.toLowerCase(Locale.ROOT).contains("timeout")
                        ? ErrorKind.TIMEOUT
                        : ErrorKind.CANCELLED;
            }
            // OkHttp reports Call.cancel() this way
            if (current instanceof IOException && "Canceled".equalsIgnoreCase(current.getMessage())) {
                return ErrorKind.CANCELLED;
            }
            if (current.getCause() == current) {
                break;
            }
            current = current.getCause();
        }
        return ErrorKind.NETWORK;
    }

    /**
     * Safe candidate messages from a response body, shortest first.
     */
    List<String> extractMessages(String body) {
        if (body == null || body.trim().isEmpty()) {
            return List.of();
        }

        JsonNode tree = parseTree(body);
        List<String> raw = new ArrayList<>();
        if (tree == null || tree.isMissingNode() || tree.isTextual()) {
            String text = tree != null && tree.isTextual() ? tree.asText().trim() : body.trim();
            if (!text.isEmpty() && !looksLikeHtml(text)) {
                raw.add(truncate(text, MAX_TEXT_LENGTH));
            }
        } else {
            flatten(tree, "", raw);
            raw = raw.stream()
                    .map(String::trim)
                    .filter(s -> !s.isEmpty())
                    .map(s -> truncate(s, MAX_ENTRY_LENGTH))
                    .collect(Collectors.toList());
        }

        return raw.stream()
                .filter(s -> !looksInternal(s))
                .sorted(Comparator.comparingInt(String::length))
                .collect(Collectors.toList());
    }

    private JsonNode parseTree(String body) {
        try {
            return treeReader.readTree(body);
        } catch (JsonProcessingException e) {
            // Not JSON, the caller falls back to the raw text
            return null;
        }
    }

    private void flatten(JsonNode node, String path, List<String> out) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return;
        }

        if (node.isTextual()) {
            String msg = node.asText().trim();
            if (!msg.isEmpty()) {
                out.add(prefixed(path, msg));
            }
            return;
        }

        if (node.isArray()) {
            for (JsonNode item : node) {
                flatten(item, path, out);
            }
            return;
        }

        if (node.isObject()) {
            for (String field : DIRECT_FIELDS) {
                JsonNode direct = node.get(field);
                if (direct != null && !direct.isNull()) {
                    flatten(direct, path, out);
                    break;
                }
            }

            JsonNode nonFieldErrors = node.get(NON_FIELD_ERRORS);
            if (nonFieldErrors != null && !nonFieldErrors.isNull()) {
                flatten(nonFieldErrors, path.isEmpty() ? "error" : path, out);
            }

            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                if (RESERVED_FIELDS.contains(field.getKey())) {
                    continue;
                }
                String nextPath = path.isEmpty() ? field.getKey() : path + "." + field.getKey();
                flatten(field.getValue(), nextPath, out);
            }
            return;
        }

        // numbers, booleans
        out.add(prefixed(path, node.asText()));
    }

    private static String prefixed(String path, String msg) {
        return path.isEmpty() ? msg : path + ": " + msg;
    }

    private static String truncate(String s, int max) {
        return s.length() > max ? s.substring(0, max) + ELLIPSIS : s;
    }

    static boolean looksLikeHtml(String s) {
        String t = s.trim().toLowerCase(Locale.ROOT);
        return t.startsWith("<!doctype") || t.startsWith("<html") || t.contains("<body");
    }

    static boolean looksInternal(String s) {
        if (looksLikeHtml(s)) {
            return true;
        }
        String lower = s.toLowerCase(Locale.ROOT);
        for (String marker : LEAK_MARKERS) {
            if (lower.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
