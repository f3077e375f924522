package dk.cloudcreate.estatemanagement.eventstore;

import dk.cloudcreate.estatemanagement.eventstore.eventstream.*;
import dk.cloudcreate.estatemanagement.eventstore.persistence.*;
import dk.cloudcreate.estatemanagement.eventstore.types.EventOrder;

import java.util.*;

/**
 * The {@link EventStore} stores the events of each aggregate instance as an ordered {@link AggregateEventStream}.<br>
 * Appending uses optimistic concurrency: the caller provides the {@link EventOrder} of the last event it has seen
 * and the append is rejected with an {@link OptimisticAppendToStreamException} if the stream has advanced since.<br>
 * Every {@link AggregateType} must be registered using {@link #addAggregateTypeConfiguration(AggregateTypeConfiguration)}
 * before events of that type can be appended or fetched.
 *
 * @see dk.cloudcreate.estatemanagement.eventstore.inmemory.InMemoryEventStore
 * @see dk.cloudcreate.estatemanagement.eventstore.postgresql.PostgresqlEventStore
 */
public interface EventStore {
    /**
     * Register the configuration for an {@link AggregateType}. Registering an already registered {@link AggregateType} is a no-op
     *
     * @param aggregateTypeConfiguration the configuration
     * @return this event store instance
     */
    EventStore addAggregateTypeConfiguration(AggregateTypeConfiguration aggregateTypeConfiguration);

    /**
     * Find the configuration registered for an {@link AggregateType}
     */
    Optional<AggregateTypeConfiguration> findAggregateTypeConfiguration(AggregateType aggregateType);

    /**
     * Atomically append the <code>events</code> to the stream of the aggregate instance. Either all events are appended or none are.<br>
     * The events receive consecutive {@link EventOrder}'s starting at <code>expectedLastEventOrder + 1</code>
     *
     * @param aggregateType          the aggregate type
     * @param aggregateId            the id of the aggregate instance
     * @param expectedLastEventOrder the {@link EventOrder} of the last event the caller knows of, or {@link EventOrder#NO_EVENTS_PERSISTED}
     *                               when the caller expects the stream to be empty
     * @param events                 the events to append (may be empty, in which case nothing is appended)
     * @param <ID>                   the aggregate id type
     * @return an {@link AggregateEventStream} containing only the newly appended events
     * @throws OptimisticAppendToStreamException in case the stream's last {@link EventOrder} isn't the <code>expectedLastEventOrder</code>
     * @throws EventStoreUnavailableException    in case the underlying storage couldn't be reached
     * @throws AppendToStreamException           in case of any other failure to append the events
     */
    <ID> AggregateEventStream<ID> appendToStream(AggregateType aggregateType,
                                                 ID aggregateId,
                                                 EventOrder expectedLastEventOrder,
                                                 List<?> events);

    /**
     * Fetch all events of the aggregate instance's stream in ascending {@link EventOrder}
     *
     * @param aggregateType the aggregate type
     * @param aggregateId   the id of the aggregate instance
     * @param <ID>          the aggregate id type
     * @return the {@link AggregateEventStream} or {@link Optional#empty()} if no events have been appended to the stream
     */
    <ID> Optional<AggregateEventStream<ID>> fetchStream(AggregateType aggregateType,
                                                        ID aggregateId);

    /**
     * Load the last event appended to the aggregate instance's stream
     *
     * @param aggregateType the aggregate type
     * @param aggregateId   the id of the aggregate instance
     * @param <ID>          the aggregate id type
     * @return the last {@link PersistedEvent} or {@link Optional#empty()} if no events have been appended to the stream
     */
    <ID> Optional<PersistedEvent> loadLastPersistedEventRelatedTo(AggregateType aggregateType,
                                                                  ID aggregateId);
}
