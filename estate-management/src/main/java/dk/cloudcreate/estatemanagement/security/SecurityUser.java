package dk.cloudcreate.estatemanagement.security;

/**
 * A security user attached to an estate or a merchant
 *
 * @param securityUserId the id assigned by the security service
 * @param emailAddress   the email address the user was created with
 */
public record SecurityUser(SecurityUserId securityUserId, String emailAddress) {
}
