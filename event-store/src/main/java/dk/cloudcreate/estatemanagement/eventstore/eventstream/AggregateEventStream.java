package dk.cloudcreate.estatemanagement.eventstore.eventstream;

import dk.cloudcreate.estatemanagement.eventstore.types.EventOrder;

import java.util.List;
import java.util.stream.Stream;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The ordered events belonging to a single aggregate instance (the stream identified by the {@link #aggregateType()}
 * and the {@link #aggregateId()})
 *
 * @param <AGGREGATE_ID> the aggregate id type
 */
public class AggregateEventStream<AGGREGATE_ID> {
    private final AggregateType        aggregateType;
    private final AGGREGATE_ID         aggregateId;
    private final List<PersistedEvent> events;

    private AggregateEventStream(AggregateType aggregateType, AGGREGATE_ID aggregateId, List<PersistedEvent> events) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.events = List.copyOf(requireNonNull(events, "No events provided"));
    }

    public static <AGGREGATE_ID> AggregateEventStream<AGGREGATE_ID> of(AggregateType aggregateType,
                                                                       AGGREGATE_ID aggregateId,
                                                                       List<PersistedEvent> events) {
        return new AggregateEventStream<>(aggregateType, aggregateId, events);
    }

    public AggregateType aggregateType() {
        return aggregateType;
    }

    public AGGREGATE_ID aggregateId() {
        return aggregateId;
    }

    /**
     * @return the events in ascending {@link EventOrder}
     */
    public List<PersistedEvent> eventList() {
        return events;
    }

    public Stream<PersistedEvent> events() {
        return events.stream();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }

    /**
     * @return the {@link EventOrder} of the last event in this stream or {@link EventOrder#NO_EVENTS_PERSISTED} if the stream is empty
     */
    public EventOrder lastEventOrder() {
        if (events.isEmpty()) {
            return EventOrder.NO_EVENTS_PERSISTED;
        }
        return events.get(events.size() - 1).eventOrder();
    }

    @Override
    public String toString() {
        return "AggregateEventStream{" +
                "aggregateType=" + aggregateType +
                ", aggregateId=" + aggregateId +
                ", numberOfEvents=" + events.size() +
                ", lastEventOrder=" + lastEventOrder() +
                '}';
    }
}
