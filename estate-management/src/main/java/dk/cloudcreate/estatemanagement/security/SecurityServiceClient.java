package dk.cloudcreate.estatemanagement.security;

/**
 * Client for the external security service, which owns user credentials
 */
public interface SecurityServiceClient {
    /**
     * Create a new user
     *
     * @param request the user details, roles and claims
     * @return the id of the newly created user
     */
    SecurityUserId createUser(CreateUserRequest request);
}
