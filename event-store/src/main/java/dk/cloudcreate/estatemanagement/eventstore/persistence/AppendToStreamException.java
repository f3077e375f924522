package dk.cloudcreate.estatemanagement.eventstore.persistence;

import dk.cloudcreate.estatemanagement.eventstore.EventStoreException;

public class AppendToStreamException extends EventStoreException {
    public AppendToStreamException(String msg) {
        super(msg);
    }

    public AppendToStreamException(String msg, RuntimeException cause) {
        super(msg, cause);
    }
}
