package work.lcod.flow.runtime;

/**
 * A connector reported a failure. The message is the connector's own.
 */
final class ServiceCallException extends RuntimeException {
    ServiceCallException(String message, Throwable cause) {
        super(message, cause);
    }
}
