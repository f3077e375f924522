package dk.cloudcreate.estatemanagement.security;

import dk.cloudcreate.essentials.types.CharSequenceType;

/**
 * Id of a user registered with the security (identity) service
 */
public class SecurityUserId extends CharSequenceType<SecurityUserId> {
    public SecurityUserId(CharSequence value) {
        super(value);
    }

    public static SecurityUserId of(CharSequence value) {
        return new SecurityUserId(value);
    }
}
