package dk.cloudcreate.estatemanagement.aggregates;

/**
 * Thrown by aggregate command methods and domain services when a business rule rejects a command.<br>
 * When this exception is thrown no events have been applied to the aggregate.<br>
 * It's a business rule violation and not an {@link AggregateException}, which signals a fault in the aggregate infrastructure
 */
public class DomainValidationException extends RuntimeException {
    public DomainValidationException(String message) {
        super(message);
    }
}
