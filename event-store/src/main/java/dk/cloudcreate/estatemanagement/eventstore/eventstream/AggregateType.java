package dk.cloudcreate.estatemanagement.eventstore.eventstream;

import dk.cloudcreate.estatemanagement.eventstore.EventStore;
import dk.cloudcreate.essentials.types.CharSequenceType;

/**
 * Provides an aggregate type category that an {@link AggregateEventStream} belongs to<br>
 * The {@link AggregateType} groups the {@link AggregateEventStream}'s of the same type of aggregate,
 * e.g. all event streams of Estate aggregates share the {@link AggregateType} named <b>Estates</b>.<br>
 * <b>Note: The aggregate type is only a name and shouldn't be confused with the Fully Qualified Class Name of an Aggregate implementation class.</b><br>
 * Each {@link AggregateType} must be registered with the {@link EventStore} before events can be appended or fetched.
 */
public class AggregateType extends CharSequenceType<AggregateType> {
    public AggregateType(CharSequence value) {
        super(value);
    }

    public static AggregateType of(CharSequence value) {
        return new AggregateType(value);
    }
}
