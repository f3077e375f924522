package dk.cloudcreate.estatemanagement.security;

import java.util.*;

import static dk.cloudcreate.essentials.shared.FailFast.requireNonNull;

/**
 * Request to create a new user in the security service
 *
 * @param emailAddress the user's email address (also used as user name)
 * @param password     the initial password
 * @param givenName    the user's given name
 * @param familyName   the user's family name
 * @param roles        the roles granted to the user
 * @param claims       the claims added to the user's tokens
 */
public record CreateUserRequest(String emailAddress,
                                String password,
                                String givenName,
                                String familyName,
                                List<String> roles,
                                Map<String, String> claims) {
    public CreateUserRequest {
        requireNonNull(emailAddress, "No emailAddress provided");
        requireNonNull(password, "No password provided");
        roles = List.copyOf(requireNonNull(roles, "No roles provided"));
        claims = Map.copyOf(requireNonNull(claims, "No claims provided"));
    }
}
