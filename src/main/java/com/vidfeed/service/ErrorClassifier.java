package com.vidfeed.service;

import com.vidfeed.exception.WarmupFailureException;
import com.vidfeed.model.FailureKind;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;

import java.io.IOException;
import java.net.SocketTimeoutException;
import java.util.Locale;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps whatever a decoder backend threw onto the warm-up failure taxonomy.
 */
public class ErrorClassifier {

    // Status code leading the message, or following "status", "status code" or an HTTP version
    private static final Pattern HTTP_STATUS = Pattern.compile(
            "(?:^|\\bstatus(?:\\s+code)?\\s*[:=]?\\s*|\\bHTTP/\\d(?:\\.\\d)?\\s+)([45]\\d{2})\\b",
            Pattern.CASE_INSENSITIVE);

    public WarmupFailureException classify(Throwable error) {
        Throwable cause = unwrap(error);

        if (cause instanceof WarmupFailureException) {
            return (WarmupFailureException) cause;
        }
        if (cause instanceof CancellationException) {
            return new WarmupFailureException(FailureKind.CANCELLED, "CANCELLED", "Warm-up cancelled", cause);
        }
        if (cause instanceof RejectedExecutionException) {
            return WarmupFailureException.capacityExhausted("BACKEND_BUSY", "Warm-up executor has no free worker", cause);
        }
        if (cause instanceof HttpStatusCodeException) {
            return classifyHttpStatus(((HttpStatusCodeException) cause).getStatusCode().value(), cause);
        }

        String message = String.valueOf(cause.getMessage());
        String text = message.toLowerCase(Locale.ROOT);
        if (cause instanceof TimeoutException || cause instanceof SocketTimeoutException
                || text.contains("timeout") || text.contains("timed out")) {
            return WarmupFailureException.sourceUnavailable("TIMEOUT", "Network timeout during video loading", cause);
        }
        Matcher status = HTTP_STATUS.matcher(message);
        if (status.find()) {
            return classifyHttpStatus(Integer.parseInt(status.group(1)), cause);
        }
        if (text.contains("not found")) {
            return classifyHttpStatus(404, cause);
        }
        if (text.contains("forbidden")) {
            return classifyHttpStatus(403, cause);
        }
        if (text.contains("internal server error")) {
            return classifyHttpStatus(500, cause);
        }
        if (cause instanceof ResourceAccessException || cause instanceof IOException || text.contains("network")) {
            return WarmupFailureException.sourceUnavailable("NETWORK", "Network connectivity error", cause);
        }
        if (text.contains("format") || text.contains("codec")) {
            return WarmupFailureException.decodeFailure("FORMAT_ERROR", "Unsupported video format or codec", cause);
        }
        if (text.contains("media") || text.contains("decoder")) {
            return WarmupFailureException.decodeFailure("MEDIA_ERROR", "Media playback error", cause);
        }
        return WarmupFailureException.sourceUnavailable("UNKNOWN", "Unknown error during video loading", cause);
    }

    private WarmupFailureException classifyHttpStatus(int status, Throwable cause) {
        if (status == 404) {
            return WarmupFailureException.sourceUnavailable("NOT_FOUND", "Video not found (404)", cause);
        }
        if (status == 403) {
            return WarmupFailureException.sourceUnavailable("FORBIDDEN", "Access denied to video (403)", cause);
        }
        if (status >= 500) {
            return WarmupFailureException.sourceUnavailable("SERVER_ERROR",
                    "Server error while loading video (" + status + ")", cause);
        }
        return WarmupFailureException.sourceUnavailable("NETWORK", "Unexpected HTTP status " + status, cause);
    }

    private Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
