package dk.cloudcreate.estatemanagement.eventstore;

/**
 * Thrown when the {@link EventStore} cannot be reached (e.g. the database connection failed).<br>
 * The {@link EventStore} never retries - retry and backoff are the responsibility of the caller
 */
public class EventStoreUnavailableException extends EventStoreException {
    public EventStoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
