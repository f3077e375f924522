package dk.cloudcreate.estatemanagement.aggregates;

import dk.cloudcreate.estatemanagement.eventstore.*;
import dk.cloudcreate.estatemanagement.eventstore.eventstream.AggregateType;
import dk.cloudcreate.estatemanagement.eventstore.persistence.*;
import org.slf4j.*;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Opinionated {@link Aggregate} Repository that's built to persist and load a specific {@link AggregateRoot} type in combination
 * with an {@link EventStore} and an {@link AggregateInstanceFactory}.<br>
 * You can use the {@link #from(EventStore, AggregateTypeConfiguration, AggregateInstanceFactory, Class)} to create a new {@link AggregateRepository}
 * instance that supports the most common repository method.<br>
 * Alternatively you can extend from the {@link DefaultAggregateRepository} and add your own special methods
 *
 * @param <ID>                  the aggregate id type (aka stream-id)
 * @param <EVENT_TYPE>          the aggregate's event family
 * @param <AGGREGATE_IMPL_TYPE> the aggregate implementation type
 * @see DefaultAggregateRepository
 */
public interface AggregateRepository<ID, EVENT_TYPE extends DomainEvent<ID>, AGGREGATE_IMPL_TYPE extends AggregateRoot<ID, EVENT_TYPE, AGGREGATE_IMPL_TYPE>> {
    /**
     * Create an {@link AggregateRepository} instance that supports loading and persisting the given Aggregate type.<br>
     * The <code>aggregateTypeConfiguration</code> is registered with the <code>eventStore</code>
     *
     * @param <ID>                        the aggregate ID type
     * @param <EVENT_TYPE>                the aggregate's event family
     * @param <AGGREGATE_IMPL_TYPE>       the concrete aggregate type (MUST be a subtype of {@link AggregateRoot})
     * @param eventStore                  the {@link EventStore} instance to use
     * @param aggregateTypeConfiguration  the configuration for the event stream that will contain all the events related to the aggregate type
     * @param aggregateInstanceFactory    the factory responsible for instantiating your {@link AggregateRoot}'s when loading them from the {@link EventStore}
     * @param aggregateImplementationType the concrete aggregate type (MUST be a subtype of {@link AggregateRoot})
     * @return a repository instance that can be used load and persist aggregates of type <code>aggregateImplementationType</code>
     */
    static <ID, EVENT_TYPE extends DomainEvent<ID>, AGGREGATE_IMPL_TYPE extends AggregateRoot<ID, EVENT_TYPE, AGGREGATE_IMPL_TYPE>> AggregateRepository<ID, EVENT_TYPE, AGGREGATE_IMPL_TYPE> from(EventStore eventStore,
                                                                                                                                                                                               AggregateTypeConfiguration aggregateTypeConfiguration,
                                                                                                                                                                                               AggregateInstanceFactory<ID, AGGREGATE_IMPL_TYPE> aggregateInstanceFactory,
                                                                                                                                                                                               Class<AGGREGATE_IMPL_TYPE> aggregateImplementationType) {
        return new DefaultAggregateRepository<>(eventStore,
                                                aggregateTypeConfiguration,
                                                aggregateInstanceFactory,
                                                aggregateImplementationType);
    }

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * Try to load an {@link AggregateRoot} instance with the specified <code>aggregateId</code> from the underlying {@link EventStore}
     *
     * @param aggregateId the id of the aggregate we want to load
     * @return an {@link Optional} with the matching {@link AggregateRoot} instance if it exists, otherwise it will return an {@link Optional#empty()}
     */
    Optional<AGGREGATE_IMPL_TYPE> tryLoad(ID aggregateId);

    /**
     * Load an {@link AggregateRoot} instance with the specified <code>aggregateId</code> from the underlying {@link EventStore}
     *
     * @param aggregateId the id of the aggregate we want to load
     * @return the matching {@link AggregateRoot} instance
     * @throws AggregateNotFoundException in case a matching {@link AggregateRoot} doesn't exist in the {@link EventStore}
     */
    default AGGREGATE_IMPL_TYPE load(ID aggregateId) {
        return tryLoad(aggregateId).orElseThrow(() -> new AggregateNotFoundException(aggregateId, aggregateRootImplementationType(), aggregateType()));
    }

    /**
     * Append the {@link AggregateRoot#getUncommittedChanges()} to the aggregate's event stream, using the
     * {@link AggregateRoot#eventOrderOfLastRehydratedEvent()} as the expected last event order.<br>
     * On success the changes are marked as committed. If the aggregate has no uncommitted changes nothing happens.
     *
     * @param aggregate the aggregate instance to persist to the underlying {@link EventStore}
     * @throws OptimisticAppendToStreamException in case another writer appended events to the aggregate's stream since the aggregate was loaded
     */
    void persist(AGGREGATE_IMPL_TYPE aggregate);

    /**
     * The type of {@link AggregateRoot} implementation this repository handles
     */
    Class<AGGREGATE_IMPL_TYPE> aggregateRootImplementationType();

    /**
     * The type of {@link AggregateType} this repository is using to persist Events
     */
    AggregateType aggregateType();

    // -------------------------------------------------------------------------------------------------------------------------------------------------

    /**
     * Default {@link AggregateRepository} implementation. You can extend this class directly if you need to expand the supported method or
     * use {@link AggregateRepository#from(EventStore, AggregateTypeConfiguration, AggregateInstanceFactory, Class)} to create a default instance
     *
     * @param <ID>             the aggregate ID type
     * @param <EVENT_TYPE>     the aggregate's event family
     * @param <AGGREGATE_TYPE> the concrete aggregate type (MUST be a subtype of {@link AggregateRoot})
     */
    class DefaultAggregateRepository<ID, EVENT_TYPE extends DomainEvent<ID>, AGGREGATE_TYPE extends AggregateRoot<ID, EVENT_TYPE, AGGREGATE_TYPE>> implements AggregateRepository<ID, EVENT_TYPE, AGGREGATE_TYPE> {
        private static final Logger log = LoggerFactory.getLogger(AggregateRepository.class);

        private final EventStore                                   eventStore;
        private final AggregateTypeConfiguration                   aggregateTypeConfiguration;
        private final AggregateInstanceFactory<ID, AGGREGATE_TYPE> aggregateInstanceFactory;
        private final Class<AGGREGATE_TYPE>                        aggregateImplementationType;

        /**
         * Create an {@link AggregateRepository}<br>
         *
         * @param eventStore                  the {@link EventStore} instance to use
         * @param aggregateTypeConfiguration  the configuration for the event stream that will contain all the events related to the aggregate type
         * @param aggregateInstanceFactory    the factory responsible for instantiating your {@link AggregateRoot}'s when loading them from the {@link EventStore}
         * @param aggregateImplementationType the concrete aggregate type (MUST be a subtype of {@link AggregateRoot})
         */
        protected DefaultAggregateRepository(EventStore eventStore,
                                             AggregateTypeConfiguration aggregateTypeConfiguration,
                                             AggregateInstanceFactory<ID, AGGREGATE_TYPE> aggregateInstanceFactory,
                                             Class<AGGREGATE_TYPE> aggregateImplementationType) {
            this.eventStore = requireNonNull(eventStore, "You must supply an EventStore instance");
            this.aggregateTypeConfiguration = requireNonNull(aggregateTypeConfiguration, "You must supply an aggregateTypeConfiguration");
            this.aggregateInstanceFactory = requireNonNull(aggregateInstanceFactory, "You must supply an AggregateInstanceFactory instance");
            this.aggregateImplementationType = requireNonNull(aggregateImplementationType, "You must supply an aggregateImplementationType");
            eventStore.addAggregateTypeConfiguration(aggregateTypeConfiguration);
        }

        /**
         * The {@link EventStore} that's being used for support
         */
        protected EventStore eventStore() {
            return eventStore;
        }

        @Override
        public Optional<AGGREGATE_TYPE> tryLoad(ID aggregateId) {
            requireNonNull(aggregateId, "You must supply an aggregateId");
            log.trace("Trying to load {} with id '{}'", aggregateImplementationType.getSimpleName(), aggregateId);
            var potentialPersistedEventStream = eventStore.fetchStream(aggregateTypeConfiguration.aggregateType, aggregateId);
            if (potentialPersistedEventStream.isEmpty()) {
                log.trace("Didn't find a {} with id '{}'", aggregateImplementationType.getSimpleName(), aggregateId);
                return Optional.empty();
            }
            var persistedEventsStream = potentialPersistedEventStream.get();
            log.trace("Found {} with id '{}' and lastEventOrder {}", aggregateImplementationType.getSimpleName(), aggregateId, persistedEventsStream.lastEventOrder());
            return Optional.of(aggregateInstanceFactory.create(aggregateId)
                                                       .rehydrate(persistedEventsStream));
        }

        @Override
        public void persist(AGGREGATE_TYPE aggregate) {
            requireNonNull(aggregate, "You must supply an aggregate");
            var eventsToPersist = aggregate.getUncommittedChanges();
            if (eventsToPersist.isEmpty()) {
                log.trace("No changes detected for '{}' with id '{}'", aggregateImplementationType.getSimpleName(), aggregate.aggregateId());
                return;
            }
            if (log.isTraceEnabled()) {
                log.trace("Persisting {} event(s) related to '{}' with id '{}': {}",
                          eventsToPersist.size(),
                          aggregateImplementationType.getSimpleName(),
                          aggregate.aggregateId(),
                          eventsToPersist.stream()
                                         .map(event -> event.getClass().getSimpleName())
                                         .reduce((s, s2) -> s + ", " + s2)
                                         .orElse(""));
            } else {
                log.debug("Persisting {} event(s) related to '{}' with id '{}'",
                          eventsToPersist.size(),
                          aggregateImplementationType.getSimpleName(),
                          aggregate.aggregateId());
            }
            eventStore.appendToStream(aggregateTypeConfiguration.aggregateType,
                                      aggregate.aggregateId(),
                                      aggregate.eventOrderOfLastRehydratedEvent(),
                                      eventsToPersist);
            aggregate.markChangesAsCommitted();
        }

        @Override
        public Class<AGGREGATE_TYPE> aggregateRootImplementationType() {
            return aggregateImplementationType;
        }

        @Override
        public AggregateType aggregateType() {
            return aggregateTypeConfiguration.aggregateType;
        }

        @Override
        public String toString() {
            return "AggregateRepository{" +
                    "aggregateType=" + aggregateTypeConfiguration.aggregateType +
                    ", aggregateImplementationType=" + aggregateImplementationType.getName() +
                    '}';
        }
    }
}
