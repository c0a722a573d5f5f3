package txengine.exceptions;

import java.time.Duration;

/**
 * An operation ran past its configured timeout.
 *
 * <p>Raised only when {@code txengine.operation.timeout.enforced=true}. The
 * engine handles it like any other execution error and rolls the
 * transaction back. Unchecked, so operation code can raise it from inside
 * its own callbacks without widening their signatures.
 */
public class OperationTimeoutException extends RuntimeException {

    private final String operation;
    private final Duration timeout;

    public OperationTimeoutException(String operation, Duration timeout) {
        this(operation, timeout, null);
    }

    public OperationTimeoutException(String operation, Duration timeout, Throwable cause) {
        super("Operation '" + operation + "' exceeded its timeout of " + timeout.toMillis() + " ms", cause);
        this.operation = operation;
        this.timeout = timeout;
    }

    public String getOperation() {
        return operation;
    }

    public Duration getTimeout() {
        return timeout;
    }
}
