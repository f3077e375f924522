package dk.cloudcreate.estatemanagement.eventstore.postgresql;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * The column names of an event stream table
 */
public class EventStreamTableColumnNames {
    public final String globalOrderColumn;
    public final String aggregateIdColumn;
    public final String eventOrderColumn;
    public final String eventIdColumn;
    public final String eventTypeColumn;
    public final String timestampColumn;
    public final String eventPayloadColumn;

    public EventStreamTableColumnNames(String globalOrderColumn,
                                       String aggregateIdColumn,
                                       String eventOrderColumn,
                                       String eventIdColumn,
                                       String eventTypeColumn,
                                       String timestampColumn,
                                       String eventPayloadColumn) {
        this.globalOrderColumn = requireNonNull(globalOrderColumn, "No globalOrderColumn provided");
        this.aggregateIdColumn = requireNonNull(aggregateIdColumn, "No aggregateIdColumn provided");
        this.eventOrderColumn = requireNonNull(eventOrderColumn, "No eventOrderColumn provided");
        this.eventIdColumn = requireNonNull(eventIdColumn, "No eventIdColumn provided");
        this.eventTypeColumn = requireNonNull(eventTypeColumn, "No eventTypeColumn provided");
        this.timestampColumn = requireNonNull(timestampColumn, "No timestampColumn provided");
        this.eventPayloadColumn = requireNonNull(eventPayloadColumn, "No eventPayloadColumn provided");
    }

    public static EventStreamTableColumnNames defaultColumnNames() {
        return new EventStreamTableColumnNames("global_order",
                                               "aggregate_id",
                                               "event_order",
                                               "event_id",
                                               "event_type",
                                               "timestamp",
                                               "event_payload");
    }
}
