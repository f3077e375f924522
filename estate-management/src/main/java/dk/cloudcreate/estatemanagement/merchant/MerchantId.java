package dk.cloudcreate.estatemanagement.merchant;

import dk.cloudcreate.essentials.types.CharSequenceType;

import java.util.UUID;

public class MerchantId extends CharSequenceType<MerchantId> {
    public MerchantId(CharSequence value) {
        super(value);
    }

    public static MerchantId random() {
        return new MerchantId(UUID.randomUUID().toString());
    }

    public static MerchantId of(CharSequence id) {
        return new MerchantId(id);
    }
}
