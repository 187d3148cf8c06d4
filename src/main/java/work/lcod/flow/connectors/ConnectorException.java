package work.lcod.flow.connectors;

/**
 * A remote service answered with an error or could not be reached.
 */
public final class ConnectorException extends RuntimeException {
    public ConnectorException(String message) {
        super(message);
    }

    public ConnectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
