package dk.cloudcreate.estatemanagement.eventstore.serializer.json;

import dk.cloudcreate.estatemanagement.eventstore.EventStoreException;

public class JSONDeserializationException extends EventStoreException {
    public JSONDeserializationException(String message) {
        super(message);
    }

    public JSONDeserializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
