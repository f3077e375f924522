package dk.cloudcreate.estatemanagement.aggregates;

/**
 * Signals a programming error in relation to an {@link Aggregate}, e.g. an event from another aggregate family
 * or with another aggregate id being applied to an aggregate
 */
public class AggregateException extends RuntimeException {
    public AggregateException(String message) {
        super(message);
    }

    public AggregateException(String message, Throwable cause) {
        super(message, cause);
    }
}
