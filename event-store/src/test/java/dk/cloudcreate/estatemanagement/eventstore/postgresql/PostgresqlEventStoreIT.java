package dk.cloudcreate.estatemanagement.eventstore.postgresql;

import dk.cloudcreate.estatemanagement.eventstore.EventStoreUnavailableException;
import dk.cloudcreate.estatemanagement.eventstore.eventstream.AggregateType;
import dk.cloudcreate.estatemanagement.eventstore.persistence.*;
import dk.cloudcreate.estatemanagement.eventstore.serializer.json.JacksonJSONSerializer;
import dk.cloudcreate.estatemanagement.eventstore.test_data.*;
import dk.cloudcreate.estatemanagement.eventstore.types.*;
import org.jdbi.v3.core.Jdbi;
import org.jdbi.v3.core.statement.*;
import org.junit.jupiter.api.*;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.*;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.*;
import java.util.concurrent.*;

import static org.assertj.core.api.Assertions.*;

@Testcontainers
class PostgresqlEventStoreIT {
    private static final AggregateType ORDERS = AggregateType.of("Orders");

    @Container
    private final PostgreSQLContainer<?> postgreSQLContainer = new PostgreSQLContainer<>("postgres:latest")
            .withDatabaseName("event-store")
            .withUsername("test-user")
            .withPassword("secret-password");

    private Jdbi                       jdbi;
    private PostgresqlEventStore       eventStore;
    private AggregateTypeConfiguration ordersConfiguration;

    @BeforeEach
    void setup() {
        jdbi = Jdbi.create(postgreSQLContainer.getJdbcUrl(),
                           postgreSQLContainer.getUsername(),
                           postgreSQLContainer.getPassword());
        ordersConfiguration = AggregateTypeConfiguration.standardConfigurationUsingJackson(ORDERS,
                                                                                           JacksonJSONSerializer.createDefaultObjectMapper(),
                                                                                           AggregateIdSerializer.of(OrderId::of));
        eventStore = new PostgresqlEventStore(jdbi);
        eventStore.addAggregateTypeConfiguration(ordersConfiguration);
    }

    @Test
    void the_event_stream_table_is_created_when_the_aggregate_type_is_registered() {
        var table = jdbi.withHandle(handle -> handle.select("SELECT to_regclass(?)", "orders_events")
                                                    .mapTo(String.class)
                                                    .findOne());
        assertThat(table).contains("orders_events");
    }

    @Test
    void the_event_store_leaves_the_sql_logger_of_the_shared_jdbi_instance_untouched() {
        // Given
        var executedStatements = new ArrayList<String>();
        SqlLogger applicationSqlLogger = new SqlLogger() {
            @Override
            public void logAfterExecution(StatementContext context) {
                executedStatements.add(context.getRenderedSql());
            }
        };
        jdbi.setSqlLogger(applicationSqlLogger);

        // When
        var sharedEventStore = new PostgresqlEventStore(jdbi);
        sharedEventStore.addAggregateTypeConfiguration(ordersConfiguration);
        var orderId = OrderId.random();
        sharedEventStore.appendToStream(ORDERS, orderId, EventOrder.NO_EVENTS_PERSISTED, List.of(new OrderEvent.OrderAccepted(orderId)));
        jdbi.useHandle(handle -> handle.execute("SELECT 1"));

        // Then
        assertThat(jdbi.getConfig(SqlStatements.class).getSqlLogger()).isSameAs(applicationSqlLogger);
        assertThat(executedStatements).containsExactly("SELECT 1");
    }

    @Test
    void appended_events_are_persisted_and_fetched_in_event_order() {
        // Given
        var orderId = OrderId.random();
        var events = List.of(new OrderEvent.OrderAdded(orderId, "Customer", OffsetDateTime.parse("2023-03-01T09:00:00Z")),
                             new OrderEvent.ProductAddedToOrder(orderId, ProductId.random(), 2, new BigDecimal("100.25")),
                             new OrderEvent.OrderAccepted(orderId));

        // When
        var appended = eventStore.appendToStream(ORDERS, orderId, EventOrder.NO_EVENTS_PERSISTED, events);

        // Then
        assertThat(appended.eventList()).hasSize(3);
        assertThat(appended.lastEventOrder()).isEqualTo(EventOrder.of(2));
        assertThat(appended.eventList().get(0).globalEventOrder()).isEqualTo(GlobalEventOrder.FIRST_GLOBAL_EVENT_ORDER);

        var fetched = eventStore.fetchStream(ORDERS, orderId);
        assertThat(fetched).isPresent();
        assertThat(fetched.get().eventList()).hasSize(3);
        for (int index = 0; index < events.size(); index++) {
            var persistedEvent = fetched.get().eventList().get(index);
            assertThat(persistedEvent.eventOrder()).isEqualTo(EventOrder.of(index));
            assertThat(persistedEvent.aggregateId()).isEqualTo(orderId);
            assertThat(persistedEvent.eventId()).isEqualTo(appended.eventList().get(index).eventId());
            assertThat((Object) persistedEvent.event().deserialize()).isEqualTo(events.get(index));
        }

        var lastEvent = eventStore.loadLastPersistedEventRelatedTo(ORDERS, orderId);
        assertThat(lastEvent).isPresent();
        assertThat(lastEvent.get().eventOrder()).isEqualTo(EventOrder.of(2));
    }

    @Test
    void fetching_an_unknown_stream_returns_empty() {
        assertThat(eventStore.fetchStream(ORDERS, OrderId.random())).isEmpty();
    }

    @Test
    void appending_with_a_stale_expected_event_order_is_rejected() {
        // Given
        var orderId = OrderId.random();
        eventStore.appendToStream(ORDERS, orderId, EventOrder.NO_EVENTS_PERSISTED, List.of(new OrderEvent.OrderAccepted(orderId)));

        // Then
        assertThatThrownBy(() -> eventStore.appendToStream(ORDERS, orderId, EventOrder.NO_EVENTS_PERSISTED, List.of(new OrderEvent.OrderAccepted(orderId))))
                .isInstanceOf(OptimisticAppendToStreamException.class);
        assertThat(eventStore.fetchStream(ORDERS, orderId).get().eventList()).hasSize(1);
    }

    @Test
    void only_one_of_two_concurrent_appends_with_the_same_expected_event_order_succeeds() throws Exception {
        // Given
        var orderId = OrderId.random();
        eventStore.appendToStream(ORDERS, orderId, EventOrder.NO_EVENTS_PERSISTED, List.of(new OrderEvent.OrderAccepted(orderId)));
        var startSignal = new CountDownLatch(1);
        var executor    = Executors.newFixedThreadPool(2);
        try {
            Callable<Boolean> append = () -> {
                startSignal.await();
                try {
                    eventStore.appendToStream(ORDERS,
                                              orderId,
                                              EventOrder.FIRST_EVENT_ORDER,
                                              List.of(new OrderEvent.OrderAccepted(orderId), new OrderEvent.OrderAccepted(orderId)));
                    return true;
                } catch (OptimisticAppendToStreamException e) {
                    return false;
                }
            };
            var result1 = executor.submit(append);
            var result2 = executor.submit(append);

            // When
            startSignal.countDown();

            // Then
            assertThat(List.of(result1.get(30, TimeUnit.SECONDS), result2.get(30, TimeUnit.SECONDS))).containsExactlyInAnyOrder(true, false);
            var stream = eventStore.fetchStream(ORDERS, orderId).get();
            assertThat(stream.eventList()).hasSize(3);
            assertThat(stream.lastEventOrder()).isEqualTo(EventOrder.of(2));
        } finally {
            executor.shutdownNow();
        }
    }

    @Test
    void a_new_event_store_instance_sees_previously_appended_events() {
        // Given
        var orderId = OrderId.random();
        eventStore.appendToStream(ORDERS, orderId, EventOrder.NO_EVENTS_PERSISTED, List.of(new OrderEvent.OrderAccepted(orderId)));

        // When
        var otherEventStore = new PostgresqlEventStore(jdbi).addAggregateTypeConfiguration(ordersConfiguration);

        // Then
        assertThat(otherEventStore.fetchStream(ORDERS, orderId).get().lastEventOrder()).isEqualTo(EventOrder.FIRST_EVENT_ORDER);
    }

    @Test
    void an_unreachable_database_results_in_EventStoreUnavailableException() {
        // Given
        var orderId = OrderId.random();
        postgreSQLContainer.stop();

        // Then
        assertThatThrownBy(() -> eventStore.appendToStream(ORDERS, orderId, EventOrder.NO_EVENTS_PERSISTED, List.of(new OrderEvent.OrderAccepted(orderId))))
                .isInstanceOf(EventStoreUnavailableException.class);
        assertThatThrownBy(() -> eventStore.fetchStream(ORDERS, orderId))
                .isInstanceOf(EventStoreUnavailableException.class);
    }
}
