package dk.cloudcreate.estatemanagement.eventstore.persistence;

import dk.cloudcreate.estatemanagement.eventstore.eventstream.AggregateType;
import dk.cloudcreate.estatemanagement.eventstore.types.EventOrder;

import java.util.Optional;

import static dk.cloudcreate.essentials.shared.MessageFormatter.msg;

/**
 * Thrown when events are appended to an aggregate event stream with an expected last {@link EventOrder}
 * that no longer matches the stream, i.e. another writer appended events to the stream first.<br>
 * The caller can reload the aggregate and retry the command.
 */
@SuppressWarnings("OptionalUsedAsFieldOrParameterType")
public class OptimisticAppendToStreamException extends AppendToStreamException {
    public final AggregateType        aggregateType;
    public final Object               aggregateId;
    public final EventOrder           expectedLastEventOrder;
    /**
     * Empty if the conflict was detected by the underlying storage (e.g. a unique constraint) and the actual event order wasn't read
     */
    public final Optional<EventOrder> actualLastEventOrder;

    public OptimisticAppendToStreamException(AggregateType aggregateType,
                                             Object aggregateId,
                                             EventOrder expectedLastEventOrder,
                                             EventOrder actualLastEventOrder) {
        super(msg("[{}] Optimistic Concurrency Exception appending to the stream related to aggregate with id '{}'. Expected last eventOrder {} but the stream's last eventOrder is {}",
                  aggregateType,
                  aggregateId,
                  expectedLastEventOrder,
                  actualLastEventOrder));
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.expectedLastEventOrder = expectedLastEventOrder;
        this.actualLastEventOrder = Optional.of(actualLastEventOrder);
    }

    public OptimisticAppendToStreamException(AggregateType aggregateType,
                                             Object aggregateId,
                                             EventOrder expectedLastEventOrder,
                                             RuntimeException cause) {
        super(msg("[{}] Optimistic Concurrency Exception appending to the stream related to aggregate with id '{}'. Events after eventOrder {} were appended concurrently",
                  aggregateType,
                  aggregateId,
                  expectedLastEventOrder),
              cause);
        this.aggregateType = aggregateType;
        this.aggregateId = aggregateId;
        this.expectedLastEventOrder = expectedLastEventOrder;
        this.actualLastEventOrder = Optional.empty();
    }
}
