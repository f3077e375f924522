package dk.cloudcreate.estatemanagement.aggregates;

/**
 * Creates an empty aggregate instance, which the {@link AggregateRepository} rehydrates from the aggregate's persisted events.<br>
 * Typically a constructor reference, e.g. <code>EstateAggregate::new</code>
 *
 * @param <ID>             the aggregate id type
 * @param <AGGREGATE_TYPE> the aggregate type
 */
@FunctionalInterface
public interface AggregateInstanceFactory<ID, AGGREGATE_TYPE extends Aggregate<ID, AGGREGATE_TYPE>> {
    AGGREGATE_TYPE create(ID aggregateId);
}
