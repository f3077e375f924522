package dk.cloudcreate.estatemanagement.eventstore.eventstream;

import dk.cloudcreate.estatemanagement.eventstore.serializer.json.EventJSON;
import dk.cloudcreate.estatemanagement.eventstore.types.*;

import java.time.OffsetDateTime;
import java.util.Objects;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * An event that has been appended to an {@link AggregateEventStream}
 */
public final class PersistedEvent {
    private final EventId          eventId;
    private final AggregateType    aggregateType;
    private final Object           aggregateId;
    private final EventJSON        event;
    private final EventOrder       eventOrder;
    private final GlobalEventOrder globalEventOrder;
    private final OffsetDateTime   timestamp;

    private PersistedEvent(EventId eventId,
                           AggregateType aggregateType,
                           Object aggregateId,
                           EventJSON event,
                           EventOrder eventOrder,
                           GlobalEventOrder globalEventOrder,
                           OffsetDateTime timestamp) {
        this.eventId = requireNonNull(eventId, "No eventId provided");
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.aggregateId = requireNonNull(aggregateId, "No aggregateId provided");
        this.event = requireNonNull(event, "No event provided");
        this.eventOrder = requireNonNull(eventOrder, "No eventOrder provided");
        this.globalEventOrder = requireNonNull(globalEventOrder, "No globalEventOrder provided");
        this.timestamp = requireNonNull(timestamp, "No timestamp provided");
    }

    public static PersistedEvent from(EventId eventId,
                                      AggregateType aggregateType,
                                      Object aggregateId,
                                      EventJSON event,
                                      EventOrder eventOrder,
                                      GlobalEventOrder globalEventOrder,
                                      OffsetDateTime timestamp) {
        return new PersistedEvent(eventId,
                                  aggregateType,
                                  aggregateId,
                                  event,
                                  eventOrder,
                                  globalEventOrder,
                                  timestamp);
    }

    /**
     * Unique id of this Event
     */
    public EventId eventId() {
        return eventId;
    }

    /**
     * Contains the name of the Event-Stream this aggregate event belongs to
     */
    public AggregateType aggregateType() {
        return aggregateType;
    }

    /**
     * Contains the aggregate identifier that an event is related to.<br>
     * This is also known as the Stream-Id
     */
    public Object aggregateId() {
        return aggregateId;
    }

    /**
     * Contains the serialized event together with its {@link EventType}
     */
    public EventJSON event() {
        return event;
    }

    /**
     * Contains the order of the event relative to the aggregate instance (the {@link #aggregateId()}) it relates to<br>
     * The first event appended to an aggregate stream has {@link EventOrder#FIRST_EVENT_ORDER}
     */
    public EventOrder eventOrder() {
        return eventOrder;
    }

    /**
     * Contains the global order of the event across all streams with the same {@link #aggregateType()}
     */
    public GlobalEventOrder globalEventOrder() {
        return globalEventOrder;
    }

    /**
     * The timestamp (UTC) for when the event was persisted
     */
    public OffsetDateTime timestamp() {
        return timestamp;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PersistedEvent)) return false;
        PersistedEvent that = (PersistedEvent) o;
        return eventId.equals(that.eventId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(eventId);
    }

    @Override
    public String toString() {
        return "PersistedEvent{" +
                "eventId=" + eventId +
                ", aggregateType=" + aggregateType +
                ", aggregateId=" + aggregateId +
                ", eventType=" + event.getEventType() +
                ", eventOrder=" + eventOrder +
                ", globalEventOrder=" + globalEventOrder +
                ", timestamp=" + timestamp +
                '}';
    }
}
