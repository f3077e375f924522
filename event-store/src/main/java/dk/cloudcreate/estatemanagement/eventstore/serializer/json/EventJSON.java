package dk.cloudcreate.estatemanagement.eventstore.serializer.json;

import dk.cloudcreate.estatemanagement.eventstore.types.EventType;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The serialized JSON form of an event together with its {@link EventType}.<br>
 * The JSON is deserialized lazily into the Java event type when {@link #deserialize()} is called
 */
public class EventJSON {
    private final transient JSONSerializer jsonSerializer;
    private final           EventType      eventType;
    private final           String         json;
    private transient       Object         jsonDeserialized;

    public EventJSON(JSONSerializer jsonSerializer, EventType eventType, String json) {
        this.jsonSerializer = requireNonNull(jsonSerializer, "No JSON serializer provided");
        this.eventType = requireNonNull(eventType, "No eventType provided");
        this.json = requireNonNull(json, "No json provided");
    }

    public EventJSON(JSONSerializer jsonSerializer, Object jsonDeserialized, EventType eventType, String json) {
        this(jsonSerializer, eventType, json);
        this.jsonDeserialized = requireNonNull(jsonDeserialized, "No jsonDeserialized provided");
    }

    public EventType getEventType() {
        return eventType;
    }

    public String getJson() {
        return json;
    }

    /**
     * Get the already deserialized event (if the {@link EventJSON} was created from a Java event or
     * {@link #deserialize()} has been called)
     */
    public Optional<Object> getJsonDeserialized() {
        return Optional.ofNullable(jsonDeserialized);
    }

    /**
     * Deserialize the {@link #getJson()} into the Java type specified by {@link #getEventType()}
     *
     * @param <T> the Java event type
     * @return the deserialized event
     */
    @SuppressWarnings("unchecked")
    public <T> T deserialize() {
        if (jsonDeserialized == null) {
            jsonDeserialized = jsonSerializer.deserialize(json, eventType.<T>toJavaClass());
        }
        return (T) jsonDeserialized;
    }

    @Override
    public String toString() {
        return "EventJSON{" +
                "eventType=" + eventType +
                ", json='" + json + '\'' +
                '}';
    }
}
