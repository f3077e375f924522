package dk.cloudcreate.estatemanagement.aggregates;

/**
 * An immutable event describing a single state change of an {@link Aggregate}
 *
 * @param <ID> the aggregate id type
 */
public interface DomainEvent<ID> {
    /**
     * The id of the aggregate the event belongs to
     */
    ID aggregateId();
}
