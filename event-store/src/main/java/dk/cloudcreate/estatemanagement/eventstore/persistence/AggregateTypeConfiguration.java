package dk.cloudcreate.estatemanagement.eventstore.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import dk.cloudcreate.estatemanagement.eventstore.eventstream.*;
import dk.cloudcreate.estatemanagement.eventstore.serializer.json.*;

import java.util.regex.Pattern;

import static dk.cloudcreate.essentials.shared.FailFast.*;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Configuration of how the {@link AggregateEventStream}'s of a given {@link AggregateType} are stored
 */
public class AggregateTypeConfiguration {
    private static final Pattern VALID_TABLE_NAME = Pattern.compile("[a-z_][a-z0-9_]*");
    public static final  int     DEFAULT_QUERY_FETCH_SIZE = 100;

    /**
     * The type of Aggregate this event stream configuration relates to
     */
    public final AggregateType         aggregateType;
    /**
     * The name of the table that will contain all events related to the given {@link #aggregateType}
     */
    public final String                eventStreamTableName;
    /**
     * The SQL fetch size for queries
     */
    public final int                   queryFetchSize;
    /**
     * The {@link JSONSerializer} used to serialize and deserialize events
     */
    public final JSONSerializer        jsonSerializer;
    /**
     * The serializer for the Aggregate Id
     */
    public final AggregateIdSerializer aggregateIdSerializer;

    public AggregateTypeConfiguration(AggregateType aggregateType,
                                      String eventStreamTableName,
                                      int queryFetchSize,
                                      JSONSerializer jsonSerializer,
                                      AggregateIdSerializer aggregateIdSerializer) {
        this.aggregateType = requireNonNull(aggregateType, "No aggregateType provided");
        this.eventStreamTableName = requireNonNull(eventStreamTableName, "No eventStreamTableName provided").toLowerCase();
        requireTrue(VALID_TABLE_NAME.matcher(this.eventStreamTableName).matches(),
                    msg("[{}] Invalid eventStreamTableName '{}'", aggregateType, eventStreamTableName));
        requireTrue(queryFetchSize > 0, "queryFetchSize must be > 0");
        this.queryFetchSize = queryFetchSize;
        this.jsonSerializer = requireNonNull(jsonSerializer, "No jsonSerializer provided");
        this.aggregateIdSerializer = requireNonNull(aggregateIdSerializer, "No aggregateIdSerializer provided");
    }

    /**
     * Create a configuration that stores events as JSON using Jackson, in a table named <code>{aggregateType}_events</code> (lower case)
     *
     * @param aggregateType         the aggregate type
     * @param objectMapper          the Jackson {@link ObjectMapper} (see {@link JacksonJSONSerializer#createDefaultObjectMapper()})
     * @param aggregateIdSerializer the aggregate id serializer
     */
    public static AggregateTypeConfiguration standardConfigurationUsingJackson(AggregateType aggregateType,
                                                                               ObjectMapper objectMapper,
                                                                               AggregateIdSerializer aggregateIdSerializer) {
        requireNonNull(aggregateType, "No aggregateType provided");
        return new AggregateTypeConfiguration(aggregateType,
                                              aggregateType + "_events",
                                              DEFAULT_QUERY_FETCH_SIZE,
                                              new JacksonJSONSerializer(objectMapper),
                                              aggregateIdSerializer);
    }

    @Override
    public String toString() {
        return "AggregateTypeConfiguration{" +
                "aggregateType=" + aggregateType +
                ", eventStreamTableName='" + eventStreamTableName + '\'' +
                ", queryFetchSize=" + queryFetchSize +
                '}';
    }
}
