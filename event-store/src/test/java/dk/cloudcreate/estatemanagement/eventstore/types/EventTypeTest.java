package dk.cloudcreate.estatemanagement.eventstore.types;

import dk.cloudcreate.estatemanagement.eventstore.EventStoreException;
import dk.cloudcreate.estatemanagement.eventstore.test_data.OrderEvent;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class EventTypeTest {
    @Test
    void test_creating_a_EventType_instance_from_a_String_value() {
        // Given
        var fqcn = OrderEvent.OrderAdded.class.getName();
        // When
        var eventJavaType = EventType.of(fqcn);
        // Then
        assertThat(eventJavaType.toString()).isEqualTo(EventType.FQCN_PREFIX + fqcn);
        assertThat(eventJavaType.getJavaTypeName()).isEqualTo(fqcn);
        assertThat((Object) eventJavaType.toJavaClass()).isEqualTo(OrderEvent.OrderAdded.class);
    }

    @Test
    void test_creating_a_EventType_instance_from_a_Class_value() {
        // Given
        var type = OrderEvent.ProductAddedToOrder.class;
        var fqcn = type.getName();
        // When
        var eventJavaType = EventType.of(type);
        // Then
        assertThat(eventJavaType.toString()).isEqualTo(EventType.FQCN_PREFIX + fqcn);
        assertThat(eventJavaType.getJavaTypeName()).isEqualTo(fqcn);
        assertThat((Object) eventJavaType.toJavaClass()).isEqualTo(type);
    }

    @Test
    void test_creating_a_EventType_instance_from_a_serialized_String_value_that_starts_with_fqcn_prefix() {
        // Given
        var fqcn          = OrderEvent.OrderAdded.class.getName();
        var eventJavaType = EventType.of(fqcn);
        // When
        var eventJavaTypeFromSerializedValue = EventType.of(eventJavaType.toString());
        // Then
        assertThat(eventJavaTypeFromSerializedValue.toString()).isEqualTo(EventType.FQCN_PREFIX + fqcn);
        assertThat(eventJavaTypeFromSerializedValue.getJavaTypeName()).isEqualTo(fqcn);
        assertThat(eventJavaTypeFromSerializedValue).isEqualTo(eventJavaType);
    }

    @Test
    void test_two_different_EventTypes_are_not_equal() {
        // Given
        var eventJavaType = EventType.of(OrderEvent.OrderAdded.class);
        // When
        var otherEventJavaType = EventType.of(OrderEvent.OrderAccepted.class);
        // Then
        assertThat(eventJavaType.getJavaTypeName()).isNotEqualTo(otherEventJavaType.getJavaTypeName());
        assertThat(eventJavaType).isNotEqualTo(otherEventJavaType);
    }

    @Test
    void test_isSerializedEventType() {
        // Given
        var fqcn          = OrderEvent.OrderAdded.class.getName();
        var eventJavaType = EventType.of(fqcn);
        // Then
        assertThat(EventType.isSerializedEventType(eventJavaType.toString())).isTrue();
        assertThat(EventType.isSerializedEventType(fqcn)).isFalse();
    }

    @Test
    void test_resolving_an_unknown_java_type_fails() {
        // Given
        var eventJavaType = EventType.of("dk.cloudcreate.estatemanagement.DoesNotExist");
        // Then
        assertThatThrownBy(eventJavaType::toJavaClass).isInstanceOf(EventStoreException.class);
    }
}
