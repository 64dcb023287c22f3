package fr.lapetina.inference.gateway.batching;

import fr.lapetina.inference.gateway.domain.model.ErrorType;

import java.io.IOException;
import java.net.http.HttpConnectTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;

/**
 * Failure of a runner call, carrying the {@link ErrorType} the callers see.
 */
public final class BatchExecutionException extends RuntimeException {

    private final ErrorType errorType;

    public BatchExecutionException(ErrorType errorType, String message) {
        super(message);
        this.errorType = errorType;
    }

    public BatchExecutionException(ErrorType errorType, String message, Throwable cause) {
        super(message, cause);
        this.errorType = errorType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    /**
     * Maps an execution failure to the error kind reported to callers.
     *
     * <ul>
     *   <li>{@link BatchExecutionException}: its own type</li>
     *   <li>connect timeouts: {@link ErrorType#RUNNER_LOST}</li>
     *   <li>other timeouts: {@link ErrorType#EXECUTION_FAILED}</li>
     *   <li>other {@link IOException}s (connection refused or reset): {@link ErrorType#RUNNER_LOST}</li>
     *   <li>cancellation: {@link ErrorType#CANCELLED}</li>
     *   <li>anything else: {@link ErrorType#EXECUTION_FAILED}</li>
     * </ul>
     */
    public static ErrorType classify(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof BatchExecutionException bee) {
            return bee.getErrorType();
        }
        if (cause instanceof HttpConnectTimeoutException) {
            return ErrorType.RUNNER_LOST;
        }
        if (cause instanceof TimeoutException || cause instanceof HttpTimeoutException) {
            return ErrorType.EXECUTION_FAILED;
        }
        if (cause instanceof IOException) {
            return ErrorType.RUNNER_LOST;
        }
        if (cause instanceof CancellationException) {
            return ErrorType.CANCELLED;
        }
        return ErrorType.EXECUTION_FAILED;
    }

    /**
     * Message for the caller, from the innermost meaningful cause.
     */
    public static String describe(Throwable error) {
        Throwable cause = unwrap(error);
        if (cause instanceof TimeoutException) {
            return "Execution timed out";
        }
        String message = cause.getMessage();
        return message != null ? message : cause.getClass().getSimpleName();
    }

    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
