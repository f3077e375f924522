package dk.cloudcreate.estatemanagement.eventstore.types;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class EventOrderTest {
    @Test
    void the_first_event_follows_an_empty_stream() {
        assertThat(EventOrder.NO_EVENTS_PERSISTED.increaseAndGet()).isEqualTo(EventOrder.FIRST_EVENT_ORDER);
    }

    @Test
    void advanceBy_moves_the_event_order_by_the_number_of_events() {
        assertThat(EventOrder.NO_EVENTS_PERSISTED.advanceBy(3)).isEqualTo(EventOrder.of(2));
        assertThat(EventOrder.of(5).advanceBy(0)).isEqualTo(EventOrder.of(5));
    }
}
