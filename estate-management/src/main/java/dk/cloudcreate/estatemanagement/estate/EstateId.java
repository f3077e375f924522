package dk.cloudcreate.estatemanagement.estate;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

public class EstateId extends CharSequenceType<EstateId> {
    public EstateId(CharSequence value) {
        super(value);
    }

    public static EstateId random() {
        return new EstateId(UUID.randomUUID().toString());
    }

    public static EstateId of(CharSequence id) {
        return new EstateId(id);
    }
}
