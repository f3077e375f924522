package dk.cloudcreate.estatemanagement.eventstore.serializer.json;

import dk.cloudcreate.estatemanagement.eventstore.EventStoreException;

public class JSONSerializationException extends EventStoreException {
    public JSONSerializationException(String msg, Exception cause) {
        super(msg, cause);
    }
}
