package dk.cloudcreate.estatemanagement.eventstore.inmemory;

import dk.cloudcreate.estatemanagement.eventstore.*;
import dk.cloudcreate.estatemanagement.eventstore.eventstream.*;
import dk.cloudcreate.estatemanagement.eventstore.persistence.*;
import dk.cloudcreate.estatemanagement.eventstore.serializer.json.EventJSON;
import dk.cloudcreate.estatemanagement.eventstore.types.*;
import org.slf4j.*;

import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * {@link EventStore} that keeps all event streams in memory.<br>
 * Events are still serialized to JSON using the {@link AggregateTypeConfiguration#jsonSerializer}, so fetched events are
 * never the same instances as the appended ones.<br>
 * Each append to a stream is performed atomically, so concurrent appends to the same stream with the same expected
 * {@link EventOrder} result in exactly one success.
 */
public class InMemoryEventStore implements EventStore {
    private static final Logger log = LoggerFactory.getLogger(InMemoryEventStore.class);

    private final ConcurrentMap<AggregateType, AggregateTypeConfiguration> aggregateTypeConfigurations = new ConcurrentHashMap<>();
    /**
     * Key: the stream key<br>
     * Value: the immutable list of events in the stream
     */
    private final ConcurrentMap<StreamKey, List<PersistedEvent>>           streams                     = new ConcurrentHashMap<>();
    private final ConcurrentMap<AggregateType, AtomicLong>                 globalEventOrders           = new ConcurrentHashMap<>();
    private final Clock                                                    clock;

    public InMemoryEventStore() {
        this(Clock.systemUTC());
    }

    public InMemoryEventStore(Clock clock) {
        this.clock = requireNonNull(clock, "No clock provided");
    }

    @Override
    public InMemoryEventStore addAggregateTypeConfiguration(AggregateTypeConfiguration aggregateTypeConfiguration) {
        requireNonNull(aggregateTypeConfiguration, "No aggregateTypeConfiguration provided");
        if (aggregateTypeConfigurations.putIfAbsent(aggregateTypeConfiguration.aggregateType, aggregateTypeConfiguration) == null) {
            log.info("[{}] Added AggregateType configuration", aggregateTypeConfiguration.aggregateType);
        }
        return this;
    }

    @Override
    public Optional<AggregateTypeConfiguration> findAggregateTypeConfiguration(AggregateType aggregateType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        return Optional.ofNullable(aggregateTypeConfigurations.get(aggregateType));
    }

    @Override
    public <ID> AggregateEventStream<ID> appendToStream(AggregateType aggregateType,
                                                        ID aggregateId,
                                                        EventOrder expectedLastEventOrder,
                                                        List<?> events) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        requireNonNull(expectedLastEventOrder, "No expectedLastEventOrder provided");
        requireNonNull(events, "No events provided");

        var configuration = getAggregateTypeConfiguration(aggregateType);
        if (events.isEmpty()) {
            return AggregateEventStream.of(aggregateType, aggregateId, List.of());
        }

        List<EventJSON> serializedEvents = events.stream()
                                                 .map(configuration.jsonSerializer::serializeEvent)
                                                 .collect(Collectors.toList());
        var streamKey      = new StreamKey(aggregateType, configuration.aggregateIdSerializer.serialize(aggregateId));
        var appendedEvents = new ArrayList<PersistedEvent>(serializedEvents.size());
        streams.compute(streamKey, (key, existingEvents) -> {
            var currentEvents = existingEvents != null ? existingEvents : List.<PersistedEvent>of();
            var actualLastEventOrder = currentEvents.isEmpty() ?
                                       EventOrder.NO_EVENTS_PERSISTED :
                                       currentEvents.get(currentEvents.size() - 1).eventOrder();
            if (!actualLastEventOrder.equals(expectedLastEventOrder)) {
                throw new OptimisticAppendToStreamException(aggregateType,
                                                            aggregateId,
                                                            expectedLastEventOrder,
                                                            actualLastEventOrder);
            }

            var timestamp        = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
            var globalEventOrder = globalEventOrders.computeIfAbsent(aggregateType, type -> new AtomicLong());
            var eventOrder       = expectedLastEventOrder;
            for (var serializedEvent : serializedEvents) {
                eventOrder = eventOrder.increaseAndGet();
                appendedEvents.add(PersistedEvent.from(EventId.random(),
                                                       aggregateType,
                                                       aggregateId,
                                                       serializedEvent,
                                                       eventOrder,
                                                       GlobalEventOrder.of(globalEventOrder.incrementAndGet()),
                                                       timestamp));
            }
            var updatedEvents = new ArrayList<PersistedEvent>(currentEvents.size() + appendedEvents.size());
            updatedEvents.addAll(currentEvents);
            updatedEvents.addAll(appendedEvents);
            return Collections.unmodifiableList(updatedEvents);
        });

        log.debug("[{}] Appended {} event(s) to stream related to aggregate with id '{}' after eventOrder {}",
                  aggregateType,
                  appendedEvents.size(),
                  aggregateId,
                  expectedLastEventOrder);
        return AggregateEventStream.of(aggregateType, aggregateId, appendedEvents);
    }

    @Override
    public <ID> Optional<AggregateEventStream<ID>> fetchStream(AggregateType aggregateType, ID aggregateId) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");
        var configuration = getAggregateTypeConfiguration(aggregateType);

        var events = streams.get(new StreamKey(aggregateType, configuration.aggregateIdSerializer.serialize(aggregateId)));
        if (events == null || events.isEmpty()) {
            return Optional.empty();
        }
        // Hand out fresh EventJSON instances so the deserialized events aren't shared between readers
        var copies = events.stream()
                           .map(persistedEvent -> PersistedEvent.from(persistedEvent.eventId(),
                                                                      persistedEvent.aggregateType(),
                                                                      persistedEvent.aggregateId(),
                                                                      new EventJSON(configuration.jsonSerializer,
                                                                                    persistedEvent.event().getEventType(),
                                                                                    persistedEvent.event().getJson()),
                                                                      persistedEvent.eventOrder(),
                                                                      persistedEvent.globalEventOrder(),
                                                                      persistedEvent.timestamp()))
                           .collect(Collectors.toList());
        return Optional.of(AggregateEventStream.of(aggregateType, aggregateId, copies));
    }

    @Override
    public <ID> Optional<PersistedEvent> loadLastPersistedEventRelatedTo(AggregateType aggregateType, ID aggregateId) {
        return fetchStream(aggregateType, aggregateId).map(stream -> stream.eventList().get(stream.eventList().size() - 1));
    }

    private AggregateTypeConfiguration getAggregateTypeConfiguration(AggregateType aggregateType) {
        var configuration = aggregateTypeConfigurations.get(aggregateType);
        if (configuration == null) {
            throw new EventStoreException(msg("AggregateType '{}' hasn't been configured. Please add it to the event store using addAggregateTypeConfiguration(config)", aggregateType));
        }
        return configuration;
    }

    private static final class StreamKey {
        private final AggregateType aggregateType;
        private final String        serializedAggregateId;

        private StreamKey(AggregateType aggregateType, String serializedAggregateId) {
            this.aggregateType = aggregateType;
            this.serializedAggregateId = serializedAggregateId;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof StreamKey)) return false;
            StreamKey that = (StreamKey) o;
            return aggregateType.equals(that.aggregateType) && serializedAggregateId.equals(that.serializedAggregateId);
        }

        @Override
        public int hashCode() {
            return Objects.hash(aggregateType, serializedAggregateId);
        }
    }
}
