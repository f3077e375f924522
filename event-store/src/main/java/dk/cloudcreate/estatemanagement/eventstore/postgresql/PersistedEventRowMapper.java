package dk.cloudcreate.estatemanagement.eventstore.postgresql;

import dk.cloudcreate.estatemanagement.eventstore.eventstream.PersistedEvent;
import dk.cloudcreate.estatemanagement.eventstore.persistence.AggregateTypeConfiguration;
import dk.cloudcreate.estatemanagement.eventstore.serializer.json.EventJSON;
import dk.cloudcreate.estatemanagement.eventstore.types.*;
import org.jdbi.v3.core.mapper.RowMapper;
import org.jdbi.v3.core.statement.StatementContext;

import java.sql.*;
import java.time.OffsetDateTime;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;
import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

class PersistedEventRowMapper implements RowMapper<PersistedEvent> {
    private final AggregateTypeConfiguration  config;
    private final EventStreamTableColumnNames columnNames;

    PersistedEventRowMapper(AggregateTypeConfiguration configuration, EventStreamTableColumnNames columnNames) {
        this.config = requireNonNull(configuration, "No configuration provided");
        this.columnNames = requireNonNull(columnNames, "No columnNames provided");
    }

    @Override
    public PersistedEvent map(ResultSet rs, StatementContext ctx) throws SQLException {
        return PersistedEvent.from(EventId.of(rs.getString(columnNames.eventIdColumn)),
                                   config.aggregateType,
                                   config.aggregateIdSerializer.deserialize(rs.getString(columnNames.aggregateIdColumn)),
                                   resolveEventJSON(rs),
                                   EventOrder.of(rs.getLong(columnNames.eventOrderColumn)),
                                   GlobalEventOrder.of(rs.getLong(columnNames.globalOrderColumn)),
                                   rs.getObject(columnNames.timestampColumn, OffsetDateTime.class));
    }

    private EventJSON resolveEventJSON(ResultSet resultSet) throws SQLException {
        var jsonPayload    = resultSet.getString(columnNames.eventPayloadColumn);
        var eventTypeValue = resultSet.getString(columnNames.eventTypeColumn);

        if (eventTypeValue == null || eventTypeValue.isBlank()) {
            throw new IllegalStateException(msg("[{}] Row: {} - Column '{}' column was empty or blank",
                                                config.aggregateType,
                                                resultSet.getRow(),
                                                columnNames.eventTypeColumn));
        }
        return new EventJSON(config.jsonSerializer,
                             EventType.of(eventTypeValue),
                             jsonPayload);
    }
}
