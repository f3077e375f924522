package dk.cloudcreate.estatemanagement.merchant;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

public class DeviceId extends CharSequenceType<DeviceId> {
    public DeviceId(CharSequence value) {
        super(value);
    }

    public static DeviceId random() {
        return new DeviceId(UUID.randomUUID().toString());
    }

    public static DeviceId of(CharSequence id) {
        return new DeviceId(id);
    }
}
