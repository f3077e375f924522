package dk.cloudcreate.estatemanagement.eventstore.types;

import dk.cloudcreate.estatemanagement.eventstore.EventStoreException;
import dk.cloudcreate.essentials.types.CharSequenceType;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * The type tag stored together with a persisted event.<br>
 * The tag is the Fully Qualified Class Name of the Java event type prefixed with {@link #FQCN_PREFIX},
 * which allows the stored JSON payload to be deserialized back into the original event type
 */
public class EventType extends CharSequenceType<EventType> {
    public static final String FQCN_PREFIX = "FQCN:";

    public EventType(CharSequence value) {
        super(ensureFqcnPrefix(value));
    }

    public static EventType of(CharSequence javaTypeNameOrSerializedEventType) {
        return new EventType(javaTypeNameOrSerializedEventType);
    }

    public static EventType of(Class<?> javaType) {
        requireNonNull(javaType, "No javaType provided");
        return new EventType(javaType.getName());
    }

    /**
     * Is the value a serialized {@link EventType}, i.e. does it start with {@link #FQCN_PREFIX}
     */
    public static boolean isSerializedEventType(CharSequence value) {
        return value != null && value.toString().startsWith(FQCN_PREFIX);
    }

    /**
     * @return the Fully Qualified Class Name of the Java event type (without the {@link #FQCN_PREFIX})
     */
    public String getJavaTypeName() {
        return toString().substring(FQCN_PREFIX.length());
    }

    /**
     * Resolve the Java event type
     *
     * @throws EventStoreException in case the Java type cannot be loaded
     */
    @SuppressWarnings("unchecked")
    public <T> Class<T> toJavaClass() {
        try {
            return (Class<T>) Class.forName(getJavaTypeName());
        } catch (ClassNotFoundException e) {
            throw new EventStoreException(msg("Failed to resolve Java type '{}' for EventType '{}'", getJavaTypeName(), this), e);
        }
    }

    private static CharSequence ensureFqcnPrefix(CharSequence value) {
        requireNonNull(value, "No value provided");
        return isSerializedEventType(value) ? value : FQCN_PREFIX + value;
    }
}
