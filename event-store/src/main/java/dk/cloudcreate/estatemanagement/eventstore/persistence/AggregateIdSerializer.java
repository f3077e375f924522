package dk.cloudcreate.estatemanagement.eventstore.persistence;

import java.util.function.Function;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Converts an aggregate id to and from the String form stored alongside each event
 */
public interface AggregateIdSerializer {
    String serialize(Object aggregateId);

    Object deserialize(String serializedAggregateId);

    /**
     * Create an {@link AggregateIdSerializer} that serializes using {@link Object#toString()} and
     * deserializes using the <code>deserializer</code> (e.g. a <code>of(String)</code> factory method of a single value id type)
     *
     * @param deserializer the function that converts the serialized id back into the aggregate id type
     * @param <ID>         the aggregate id type
     */
    static <ID> AggregateIdSerializer of(Function<String, ID> deserializer) {
        requireNonNull(deserializer, "No deserializer provided");
        return new AggregateIdSerializer() {
            @Override
            public String serialize(Object aggregateId) {
                return requireNonNull(aggregateId, "No aggregateId provided").toString();
            }

            @Override
            public Object deserialize(String serializedAggregateId) {
                return deserializer.apply(requireNonNull(serializedAggregateId, "No serializedAggregateId provided"));
            }
        };
    }
}
