package com.example.annotation.common.util;

import com.example.annotation.common.exception.ConflictException;
import com.mongodb.MongoException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.lang.NonNull;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Retry conditions for store operations.
 *
 * <p>Only the transaction protocol is retried: a write conflict between two
 * transactions touching the same session aborts one of them with the
 * {@code TransientTransactionError} label, and the driver contract is to rerun
 * the whole transaction. Domain failures are never retried here.
 */
public final class RetryUtils {

    private static final String TRANSIENT_TRANSACTION_ERROR = MongoException.TRANSIENT_TRANSACTION_ERROR_LABEL;

    private RetryUtils() {}

    /**
     * Determines if an exception is a transient transaction failure.
     *
     * @param throwable the exception to check
     * @return true if rerunning the transaction may succeed
     */
    public static boolean isTransientTransactionError(@NonNull Throwable throwable) {
        Throwable current = throwable;
        while (current != null) {
            if (current instanceof MongoException mongo && mongo.hasErrorLabel(TRANSIENT_TRANSACTION_ERROR)) {
                return true;
            }
            if (current instanceof TransientDataAccessException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    /**
     * Returns a predicate for use with Retry.filter().
     *
     * @return a predicate that returns true for transient transaction errors
     */
    @NonNull
    public static Predicate<Throwable> transientTransactionPredicate() {
        return RetryUtils::isTransientTransactionError;
    }

    /**
     * Reruns a transaction aborted by a transient error, then gives up with a
     * {@link ConflictException} carrying {@code conflictMessage}.
     */
    @NonNull
    public static Retry transientTransactionRetry(int attempts, @NonNull Duration backoff,
                                                  @NonNull String conflictMessage) {
        return Retry.backoff(attempts, backoff)
                .filter(transientTransactionPredicate())
                .onRetryExhaustedThrow((spec, signal) -> new ConflictException(conflictMessage, signal.failure()));
    }
}
