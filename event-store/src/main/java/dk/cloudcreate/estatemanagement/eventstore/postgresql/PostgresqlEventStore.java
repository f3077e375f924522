package dk.cloudcreate.estatemanagement.eventstore.postgresql;

import dk.cloudcreate.estatemanagement.eventstore.*;
import dk.cloudcreate.estatemanagement.eventstore.eventstream.*;
import dk.cloudcreate.estatemanagement.eventstore.persistence.*;
import dk.cloudcreate.estatemanagement.eventstore.serializer.json.EventJSON;
import dk.cloudcreate.estatemanagement.eventstore.types.*;
import org.jdbi.v3.core.*;
import org.jdbi.v3.core.statement.*;
import org.slf4j.*;

import java.sql.SQLException;
import java.time.*;
import java.util.*;
import java.util.concurrent.*;
import java.util.function.Supplier;
import java.util.stream.Collectors;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.NamedArgumentBinding.arg;
import static dk.cloudcreate.essentials.shared.MessageFormatter.*;

/**
 * Postgresql based {@link EventStore} that stores the events of each {@link AggregateType} in a separate table.<br>
 * The individual {@link AggregateEventStream}'s in a table are separated by the aggregate id column, and the table
 * has a unique constraint on (aggregate id, event order), which guarantees that two concurrent appends to the same stream
 * can never both succeed.<br>
 * Each table uses a <code>global_order</code> identity column, which tracks the order in which events were appended
 * across all streams of the same {@link AggregateType} (see {@link GlobalEventOrder}).<br>
 * The event stream table is created, if it doesn't already exist, when the {@link AggregateTypeConfiguration} is added.
 */
public class PostgresqlEventStore implements EventStore {
    private static final Logger log                         = LoggerFactory.getLogger(PostgresqlEventStore.class);
    private static final String UNIQUE_VIOLATION_SQL_STATE  = "23505";
    private static final String CONNECTION_ERROR_SQL_STATES = "08";

    private final Jdbi                                                     jdbi;
    private final EventStreamTableColumnNames                              columnNames;
    private final Clock                                                    clock;
    /**
     * Set on each {@link Handle} the event store opens, the {@link SqlLogger} of the {@link Jdbi} instance itself is left untouched
     */
    private final EventStoreSqlLogger                                      sqlLogger                   = new EventStoreSqlLogger();
    private final ConcurrentMap<AggregateType, AggregateTypeConfiguration> aggregateTypeConfigurations = new ConcurrentHashMap<>();
    /**
     * Key: {@link AggregateType}<br>
     * Value: The insert SQL for the event stream table the event stream is persisted to
     */
    private final ConcurrentMap<AggregateType, String>                     insertSql                   = new ConcurrentHashMap<>();

    public PostgresqlEventStore(Jdbi jdbi) {
        this(jdbi, Clock.systemUTC());
    }

    public PostgresqlEventStore(Jdbi jdbi, Clock clock) {
        this.jdbi = requireNonNull(jdbi, "No jdbi instance provided");
        this.clock = requireNonNull(clock, "No clock provided");
        this.columnNames = EventStreamTableColumnNames.defaultColumnNames();
    }

    @Override
    public PostgresqlEventStore addAggregateTypeConfiguration(AggregateTypeConfiguration aggregateTypeConfiguration) {
        requireNonNull(aggregateTypeConfiguration, "No aggregateTypeConfiguration provided");
        if (!aggregateTypeConfigurations.containsKey(aggregateTypeConfiguration.aggregateType)) {
            initializeEventStorageFor(aggregateTypeConfiguration);
            aggregateTypeConfigurations.putIfAbsent(aggregateTypeConfiguration.aggregateType, aggregateTypeConfiguration);
        }
        return this;
    }

    @Override
    public Optional<AggregateTypeConfiguration> findAggregateTypeConfiguration(AggregateType aggregateType) {
        requireNonNull(aggregateType, "No aggregateType provided");
        return Optional.ofNullable(aggregateTypeConfigurations.get(aggregateType));
    }

    private AggregateTypeConfiguration getAggregateTypeConfiguration(AggregateType aggregateType) {
        var config = aggregateTypeConfigurations.get(aggregateType);
        if (config == null) {
            throw new EventStoreException(msg("AggregateType '{}' hasn't been configured. Please add it to the event store using addAggregateTypeConfiguration(config)", aggregateType));
        }
        return config;
    }

    private void initializeEventStorageFor(AggregateTypeConfiguration configuration) {
        log.info("[{}] Initializing EventStream storage using table '{}'", configuration.aggregateType, configuration.eventStreamTableName);
        useStorage(configuration.aggregateType, () -> jdbi.useTransaction(handle -> {
            handle.setSqlLogger(sqlLogger);
            Optional<String> eventTable = handle.select("SELECT to_regclass(?)", configuration.eventStreamTableName)
                                                .mapTo(String.class)
                                                .findOne();
            if (eventTable.isEmpty()) {
                createEventStreamTable(handle, configuration);
            } else {
                log.debug("[{}] Event-stream table '{}' already exists", configuration.aggregateType, configuration.eventStreamTableName);
            }
        }));
    }

    private void createEventStreamTable(Handle handle, AggregateTypeConfiguration configuration) {
        Update update = handle.createUpdate(bind("CREATE TABLE IF NOT EXISTS {:tableName} (\n" +
                                                         "            {:globalOrderColumn} bigint GENERATED BY DEFAULT AS IDENTITY PRIMARY KEY,\n" +
                                                         "            {:aggregateIdColumn} text NOT NULL,\n" +
                                                         "            {:eventOrderColumn} bigint NOT NULL,\n" +
                                                         "            {:eventIdColumn} text NOT NULL,\n" +
                                                         "            {:eventTypeColumn} text NOT NULL,\n" +
                                                         "            {:timestampColumn} TIMESTAMP WITH TIME ZONE NOT NULL,\n" +
                                                         "            {:eventPayloadColumn} jsonb NOT NULL,\n" +
                                                         "          UNIQUE ({:aggregateIdColumn}, {:eventOrderColumn}),\n" +
                                                         "          UNIQUE ({:eventIdColumn})\n" +
                                                         "        )",
                                                 arg("tableName", configuration.eventStreamTableName),
                                                 arg("globalOrderColumn", columnNames.globalOrderColumn),
                                                 arg("aggregateIdColumn", columnNames.aggregateIdColumn),
                                                 arg("eventOrderColumn", columnNames.eventOrderColumn),
                                                 arg("eventIdColumn", columnNames.eventIdColumn),
                                                 arg("eventTypeColumn", columnNames.eventTypeColumn),
                                                 arg("timestampColumn", columnNames.timestampColumn),
                                                 arg("eventPayloadColumn", columnNames.eventPayloadColumn)
                                                )
                                           );
        log.info("[{}] Creating event-stream table '{}'", configuration.aggregateType, configuration.eventStreamTableName);
        update.execute();
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
        var serializedAggregateId = configuration.aggregateIdSerializer.serialize(aggregateId);
        try {
            var persistedEvents = jdbi.inTransaction(handle -> {
                handle.setSqlLogger(sqlLogger);
                var actualLastEventOrder = handle.createQuery(bind("SELECT max({:eventOrderColumn}) FROM {:tableName} WHERE {:aggregateIdColumn} = :aggregateId",
                                                                   arg("tableName", configuration.eventStreamTableName),
                                                                   arg("eventOrderColumn", columnNames.eventOrderColumn),
                                                                   arg("aggregateIdColumn", columnNames.aggregateIdColumn)))
                                                 .bind("aggregateId", serializedAggregateId)
                                                 .mapTo(Long.class)
                                                 .findOne()
                                                 .map(EventOrder::of)
                                                 .orElse(EventOrder.NO_EVENTS_PERSISTED);
                if (!actualLastEventOrder.equals(expectedLastEventOrder)) {
                    throw new OptimisticAppendToStreamException(aggregateType,
                                                                aggregateId,
                                                                expectedLastEventOrder,
                                                                actualLastEventOrder);
                }

                var timestamp   = OffsetDateTime.now(clock).withOffsetSameInstant(ZoneOffset.UTC);
                var batch       = handle.prepareBatch(getInsertSql(configuration));
                var eventIds    = new ArrayList<EventId>(serializedEvents.size());
                var eventOrders = new ArrayList<EventOrder>(serializedEvents.size());
                var eventOrder  = expectedLastEventOrder;
                for (var serializedEvent : serializedEvents) {
                    eventOrder = eventOrder.increaseAndGet();
                    var eventId = EventId.random();
                    batch.bind("aggregateId", serializedAggregateId)
                         .bind("eventOrder", eventOrder.longValue())
                         .bind("eventId", eventId.toString())
                         .bind("eventType", serializedEvent.getEventType().toString())
                         .bind("timestamp", timestamp)
                         .bind("eventPayload", serializedEvent.getJson())
                         .add();
                    eventIds.add(eventId);
                    eventOrders.add(eventOrder);
                }

                var eventGlobalOrders = batch.executeAndReturnGeneratedKeys(columnNames.globalOrderColumn)
                                             .reduceRows(new ArrayList<Long>(),
                                                         (listOfGlobalOrders, row) -> {
                                                             listOfGlobalOrders.add(row.getColumn(columnNames.globalOrderColumn, Long.class));
                                                             return listOfGlobalOrders;
                                                         });
                var appendedEvents = new ArrayList<PersistedEvent>(serializedEvents.size());
                for (int index = 0; index < serializedEvents.size(); index++) {
                    appendedEvents.add(PersistedEvent.from(eventIds.get(index),
                                                           aggregateType,
                                                           aggregateId,
                                                           serializedEvents.get(index),
                                                           eventOrders.get(index),
                                                           GlobalEventOrder.of(eventGlobalOrders.get(index)),
                                                           timestamp));
                }
                return appendedEvents;
            });
            log.debug("[{}] Appended {} event(s) to stream related to aggregate with id '{}' after eventOrder {}",
                      aggregateType,
                      persistedEvents.size(),
                      aggregateId,
                      expectedLastEventOrder);
            return AggregateEventStream.of(aggregateType, aggregateId, persistedEvents);
        } catch (JdbiException e) {
            if (isConnectionFailure(e)) {
                throw new EventStoreUnavailableException(msg("[{}] Failed to Append {} Events to Stream related to aggregate with id '{}' - the event store is unavailable",
                                                             aggregateType,
                                                             events.size(),
                                                             aggregateId), e);
            }
            if (hasSqlState(e, UNIQUE_VIOLATION_SQL_STATE)) {
                throw new OptimisticAppendToStreamException(aggregateType,
                                                            aggregateId,
                                                            expectedLastEventOrder,
                                                            e);
            }
            throw new AppendToStreamException(msg("[{}] Failed to Append {} Events to Stream related to aggregate with id '{}'",
                                                  aggregateType,
                                                  events.size(),
                                                  aggregateId), e);
        }
    }

    @Override
    public <ID> Optional<AggregateEventStream<ID>> fetchStream(AggregateType aggregateType, ID aggregateId) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");

        var configuration = getAggregateTypeConfiguration(aggregateType);
        var events = usingStorage(aggregateType, () -> jdbi.withHandle(handle -> handle.setSqlLogger(sqlLogger).createQuery(bind("SELECT * FROM {:tableName} WHERE \n" +
                                                                                                                 "   {:aggregateIdColumn} = :aggregateId \n" +
                                                                                                                 "   ORDER BY {:eventOrderColumn} ASC",
                                                                                                         arg("tableName", configuration.eventStreamTableName),
                                                                                                         arg("aggregateIdColumn", columnNames.aggregateIdColumn),
                                                                                                         arg("eventOrderColumn", columnNames.eventOrderColumn)))
                                                                                       .bind("aggregateId", configuration.aggregateIdSerializer.serialize(aggregateId))
                                                                                       .setFetchSize(configuration.queryFetchSize)
                                                                                       .map(new PersistedEventRowMapper(configuration, columnNames))
                                                                                       .list()));
        log.trace("[{}] Fetched {} event(s) related to aggregate with id '{}'", aggregateType, events.size(), aggregateId);
        if (events.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(AggregateEventStream.of(aggregateType, aggregateId, events));
    }

    @Override
    public <ID> Optional<PersistedEvent> loadLastPersistedEventRelatedTo(AggregateType aggregateType, ID aggregateId) {
        requireNonNull(aggregateType, "No aggregateType provided");
        requireNonNull(aggregateId, "No aggregateId provided");

        var configuration = getAggregateTypeConfiguration(aggregateType);
        var lastPersistedEvent = usingStorage(aggregateType, () -> jdbi.withHandle(handle -> handle.setSqlLogger(sqlLogger).createQuery(bind("SELECT * FROM {:tableName} WHERE \n" +
                                                                                                                             "   {:aggregateIdColumn} = :aggregateId \n" +
                                                                                                                             "   ORDER BY {:eventOrderColumn} DESC LIMIT 1",
                                                                                                                     arg("tableName", configuration.eventStreamTableName),
                                                                                                                     arg("aggregateIdColumn", columnNames.aggregateIdColumn),
                                                                                                                     arg("eventOrderColumn", columnNames.eventOrderColumn)))
                                                                                                   .bind("aggregateId", configuration.aggregateIdSerializer.serialize(aggregateId))
                                                                                                   .setFetchSize(1)
                                                                                                   .map(new PersistedEventRowMapper(configuration, columnNames))
                                                                                                   .findOne()));
        log.debug("[{}] Found Last-Persisted-Event for Aggregate with id '{}': {}", aggregateType, aggregateId, lastPersistedEvent);
        return lastPersistedEvent;
    }

    private String getInsertSql(AggregateTypeConfiguration config) {
        return insertSql.computeIfAbsent(config.aggregateType, aggregateType ->
                bind("INSERT INTO {:tableName} (\n" +
                             "        {:aggregateIdColumn},\n" +
                             "        {:eventOrderColumn},\n" +
                             "        {:eventIdColumn},\n" +
                             "        {:eventTypeColumn},\n" +
                             "        {:timestampColumn},\n" +
                             "        {:eventPayloadColumn}\n" +
                             "     ) VALUES (\n" +
                             "        :aggregateId,\n" +
                             "        :eventOrder,\n" +
                             "        :eventId,\n" +
                             "        :eventType,\n" +
                             "        :timestamp,\n" +
                             "        :eventPayload::jsonb\n" +
                             "     ) RETURNING {:globalOrder}",
                     arg("tableName", config.eventStreamTableName),
                     arg("aggregateIdColumn", columnNames.aggregateIdColumn),
                     arg("eventOrderColumn", columnNames.eventOrderColumn),
                     arg("eventIdColumn", columnNames.eventIdColumn),
                     arg("eventTypeColumn", columnNames.eventTypeColumn),
                     arg("timestampColumn", columnNames.timestampColumn),
                     arg("eventPayloadColumn", columnNames.eventPayloadColumn),
                     arg("globalOrder", columnNames.globalOrderColumn)));
    }

    /**
     * Translate connection failures into {@link EventStoreUnavailableException}
     */
    private <R> R usingStorage(AggregateType aggregateType, Supplier<R> storageAccess) {
        try {
            return storageAccess.get();
        } catch (JdbiException e) {
            if (isConnectionFailure(e)) {
                throw new EventStoreUnavailableException(msg("[{}] The event store is unavailable", aggregateType), e);
            }
            throw new EventStoreException(msg("[{}] Event store operation failed", aggregateType), e);
        }
    }

    private void useStorage(AggregateType aggregateType, Runnable storageAccess) {
        usingStorage(aggregateType, () -> {
            storageAccess.run();
            return null;
        });
    }

    private static boolean isConnectionFailure(JdbiException e) {
        if (e instanceof ConnectionException) {
            return true;
        }
        var sqlState = findSqlState(e);
        return sqlState.isPresent() && sqlState.get().startsWith(CONNECTION_ERROR_SQL_STATES);
    }

    private static boolean hasSqlState(Throwable e, String sqlState) {
        return findSqlState(e).map(sqlState::equals).orElse(false);
    }

    private static Optional<String> findSqlState(Throwable e) {
        var cause = e;
        while (cause != null) {
            if (cause instanceof SQLException && ((SQLException) cause).getSQLState() != null) {
                return Optional.of(((SQLException) cause).getSQLState());
            }
            cause = cause.getCause();
        }
        return Optional.empty();
    }
}
