package dk.cloudcreate.estatemanagement.eventstore.serializer.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.*;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dk.cloudcreate.estatemanagement.eventstore.types.EventType;
import dk.cloudcreate.essentials.types.jackson.EssentialTypesJacksonModule;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Jackson based {@link JSONSerializer}
 *
 * @see #createDefaultObjectMapper()
 */
public class JacksonJSONSerializer implements JSONSerializer {
    private final ObjectMapper objectMapper;

    public JacksonJSONSerializer(ObjectMapper objectMapper) {
        this.objectMapper = requireNonNull(objectMapper, "No object mapper instance provided");
    }

    /**
     * Create an {@link ObjectMapper} that supports Java records, <code>java.time</code> types, {@link java.util.Optional}
     * and the essentials single value types (such as {@link dk.cloudcreate.essentials.types.CharSequenceType} based identifiers).<br>
     * Dates are written as ISO-8601 strings and their offset is preserved when read back.
     */
    public static ObjectMapper createDefaultObjectMapper() {
        return JsonMapper.builder()
                         .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                         .disable(DeserializationFeature.ADJUST_DATES_TO_CONTEXT_TIME_ZONE)
                         .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                         .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS)
                         .addModule(new Jdk8Module())
                         .addModule(new JavaTimeModule())
                         .addModule(new EssentialTypesJacksonModule())
                         .build();
    }

    @Override
    public <T> T deserialize(String json, String javaType) {
        requireNonNull(javaType, "No javaType provided");
        return deserialize(json, EventType.of(javaType).<T>toJavaClass());
    }

    @Override
    public <T> T deserialize(String json, Class<T> javaType) {
        requireNonNull(json, "No json provided");
        requireNonNull(javaType, "No javaType provided");
        try {
            return objectMapper.readValue(json, javaType);
        } catch (JsonProcessingException e) {
            throw new JSONDeserializationException(msg("Failed to deserialize JSON to {}", javaType.getName()), e);
        }
    }

    @Override
    public EventJSON serializeEvent(Object objectToSerialize) {
        requireNonNull(objectToSerialize, "No objectToSerialize provided");
        try {
            return new EventJSON(this,
                                 objectToSerialize,
                                 EventType.of(objectToSerialize.getClass()),
                                 objectMapper.writeValueAsString(objectToSerialize));
        } catch (JsonProcessingException e) {
            throw new JSONSerializationException(msg("Failed to serialize {} to JSON", objectToSerialize.getClass().getName()), e);
        }
    }
}
