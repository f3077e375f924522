package dk.cloudcreate.estatemanagement.aggregates;

import dk.cloudcreate.estatemanagement.eventstore.eventstream.AggregateEventStream;
import dk.cloudcreate.estatemanagement.eventstore.types.EventOrder;

/**
 * Common interface that all concrete {@link Aggregate}'s must implement. Most concrete implementations choose to extend the {@link AggregateRoot} class.
 *
 * @param <ID>             the aggregate id (or stream-id) type
 * @param <AGGREGATE_TYPE> the aggregate self type
 * @see AggregateRoot
 */
public interface Aggregate<ID, AGGREGATE_TYPE extends Aggregate<ID, AGGREGATE_TYPE>> {
    /**
     * The id of the aggregate (aka. the stream-id)
     */
    ID aggregateId();

    /**
     * Has the aggregate been initialized using previously persisted events (aka. historic events) using the {@link #rehydrate(AggregateEventStream)} method
     */
    boolean hasBeenRehydrated();

    /**
     * Effectively performs a leftFold over all the previously persisted events related to this aggregate instance
     *
     * @param persistedEvents the previous persisted events related to this aggregate instance, aka. the aggregates history
     * @return the same aggregate instance (self)
     */
    AGGREGATE_TYPE rehydrate(AggregateEventStream<ID> persistedEvents);

    /**
     * Get the eventOrder of the last event that has been persisted for this aggregate instance, i.e. the last event applied during
     * {@link #rehydrate(AggregateEventStream)} or the last event persisted since
     *
     * @return the event order of the last persisted event or {@link EventOrder#NO_EVENTS_PERSISTED} in case no
     * events have been persisted for the aggregate
     */
    EventOrder eventOrderOfLastRehydratedEvent();
}
