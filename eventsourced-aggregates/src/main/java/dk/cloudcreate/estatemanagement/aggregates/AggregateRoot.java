package dk.cloudcreate.estatemanagement.aggregates;

import dk.cloudcreate.estatemanagement.eventstore.EventStore;
import dk.cloudcreate.estatemanagement.eventstore.eventstream.*;
import dk.cloudcreate.estatemanagement.eventstore.types.EventOrder;
import dk.cloudcreate.essentials.shared.types.GenericType;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * A mutable event sourced {@link Aggregate} design<br>
 * All state changes are expressed as events of the aggregate's event family (the <code>EVENT</code> type parameter).
 * A command method validates its preconditions and then calls {@link #apply(DomainEvent)}, which changes the aggregate state,
 * using {@link #applyEventToTheAggregate(DomainEvent)}, and records the event as an uncommitted change.<br>
 * When the aggregate is loaded, {@link #rehydrate(AggregateEventStream)} replays the persisted events through the same
 * {@link #applyEventToTheAggregate(DomainEvent)} method, which makes the replay deterministic.
 * <p>
 * The concrete aggregate must extend {@link AggregateRoot} directly, since the event family is resolved from the type arguments
 * of the super class.
 *
 * @param <ID>             the aggregate id type
 * @param <EVENT_TYPE>     the aggregate's event family (typically a sealed interface)
 * @param <AGGREGATE_TYPE> the aggregate self type (i.e. your concrete aggregate type)
 */
public abstract class AggregateRoot<ID, EVENT_TYPE extends DomainEvent<ID>, AGGREGATE_TYPE extends AggregateRoot<ID, EVENT_TYPE, AGGREGATE_TYPE>> implements Aggregate<ID, AGGREGATE_TYPE> {
    private final ID               aggregateId;
    private final Class<?>         eventType;
    private final List<EVENT_TYPE> uncommittedChanges;
    private       EventOrder       eventOrderOfLastAppliedEvent;
    private       EventOrder       eventOrderOfLastRehydratedEvent;
    private       boolean          hasBeenRehydrated;
    private       boolean          isRehydrating;

    protected AggregateRoot(ID aggregateId) {
        this.aggregateId = requireNonNull(aggregateId, "You must supply an aggregateId");
        this.eventType = GenericType.resolveGenericTypeOnSuperClass(getClass(), 1);
        this.uncommittedChanges = new ArrayList<>();
        this.eventOrderOfLastAppliedEvent = EventOrder.NO_EVENTS_PERSISTED;
        this.eventOrderOfLastRehydratedEvent = EventOrder.NO_EVENTS_PERSISTED;
    }

    @SuppressWarnings("unchecked")
    @Override
    public AGGREGATE_TYPE rehydrate(AggregateEventStream<ID> persistedEvents) {
        requireNonNull(persistedEvents, "You must provide a persistedEvents stream");
        if (!Objects.equals(persistedEvents.aggregateId(), aggregateId)) {
            throw new AggregateException(msg("Cannot rehydrate Aggregate '{}' with aggregateId '{}' using the event stream of aggregateId '{}'",
                                             this.getClass().getSimpleName(),
                                             aggregateId,
                                             persistedEvents.aggregateId()));
        }
        isRehydrating = true;
        try {
            persistedEvents.events().forEach(persistedEvent -> {
                var expectedEventOrder = eventOrderOfLastAppliedEvent.increaseAndGet();
                if (!persistedEvent.eventOrder().equals(expectedEventOrder)) {
                    throw new AggregateException(msg("Aggregate '{}' with aggregateId '{}' expected a persisted event with eventOrder {} but received eventOrder {}",
                                                     this.getClass().getSimpleName(),
                                                     aggregateId,
                                                     expectedEventOrder,
                                                     persistedEvent.eventOrder()));
                }
                applyEventToTheAggregate(requireEventFamilyAndAggregateId(persistedEvent.event().deserialize()));
                eventOrderOfLastAppliedEvent = persistedEvent.eventOrder();
            });
        } finally {
            isRehydrating = false;
        }
        eventOrderOfLastRehydratedEvent = eventOrderOfLastAppliedEvent;
        hasBeenRehydrated = true;
        return (AGGREGATE_TYPE) this;
    }

    /**
     * Apply a new, not yet persisted, event to this aggregate instance.<br>
     * The event is applied to the aggregate state using {@link #applyEventToTheAggregate(DomainEvent)} and added to the {@link #getUncommittedChanges()}
     *
     * @param event the event to apply
     * @throws AggregateException in case the event's {@link DomainEvent#aggregateId()} doesn't match this aggregate's id
     */
    protected void apply(EVENT_TYPE event) {
        requireNonNull(event, "You must supply an event");
        requireEventFamilyAndAggregateId(event);
        applyEventToTheAggregate(event);
        eventOrderOfLastAppliedEvent = eventOrderOfLastAppliedEvent.increaseAndGet();
        uncommittedChanges.add(event);
    }

    /**
     * Apply the event to the aggregate instance to reflect the event as a state change to the aggregate.<br>
     * This method is used both for new events and when rehydrating the aggregate, so it must not perform any validation
     * or have side effects outside the aggregate
     *
     * @param event the event to apply to the aggregate
     * @see #isRehydrating()
     */
    protected abstract void applyEventToTheAggregate(EVENT_TYPE event);

    @SuppressWarnings("unchecked")
    private EVENT_TYPE requireEventFamilyAndAggregateId(Object event) {
        if (!eventType.isInstance(event)) {
            throw new AggregateException(msg("Cannot apply Event '{}' to Aggregate '{}' since it isn't of type '{}'",
                                             event.getClass().getName(),
                                             this.getClass().getSimpleName(),
                                             eventType.getName()));
        }
        var typedEvent       = (EVENT_TYPE) event;
        var eventAggregateId = typedEvent.aggregateId();
        if (!Objects.equals(eventAggregateId, aggregateId)) {
            throw new AggregateException(msg("Aggregate Id's do not match! Cannot apply Event '{}' with aggregateId '{}' to Aggregate '{}' with aggregateId '{}'",
                                             event.getClass().getSimpleName(),
                                             eventAggregateId,
                                             this.getClass().getSimpleName(),
                                             aggregateId));
        }
        return typedEvent;
    }

    @Override
    public ID aggregateId() {
        return aggregateId;
    }

    @Override
    public boolean hasBeenRehydrated() {
        return hasBeenRehydrated;
    }

    /**
     * Is the event being supplied to {@link #applyEventToTheAggregate(DomainEvent)} a historic event
     */
    protected final boolean isRehydrating() {
        return isRehydrating;
    }

    /**
     * Get the {@link EventOrder} of the last event that was applied to the {@link AggregateRoot}
     * (either using {@link #rehydrate(AggregateEventStream)} or using {@link #apply(DomainEvent)})
     *
     * @return the event order of the last applied event or {@link EventOrder#NO_EVENTS_PERSISTED} in case no
     * events have ever been applied to the aggregate
     */
    public EventOrder eventOrderOfLastAppliedEvent() {
        return eventOrderOfLastAppliedEvent;
    }

    @Override
    public EventOrder eventOrderOfLastRehydratedEvent() {
        return eventOrderOfLastRehydratedEvent;
    }

    /**
     * The events that have been applied to this aggregate instance but not yet persisted to
     * the underlying {@link EventStore}, in the order they were applied
     */
    public List<EVENT_TYPE> getUncommittedChanges() {
        return List.copyOf(uncommittedChanges);
    }

    /**
     * Resets the {@link #getUncommittedChanges()} - effectively marking them as having been persisted
     * and committed to the underlying {@link EventStore}
     */
    public void markChangesAsCommitted() {
        eventOrderOfLastRehydratedEvent = eventOrderOfLastRehydratedEvent.advanceBy(uncommittedChanges.size());
        uncommittedChanges.clear();
    }
}
