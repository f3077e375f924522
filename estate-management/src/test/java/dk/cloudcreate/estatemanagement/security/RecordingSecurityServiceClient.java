package dk.cloudcreate.estatemanagement.security;

import java.util.*;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link SecurityServiceClient} that records every request and returns a new random {@link SecurityUserId}
 */
public class RecordingSecurityServiceClient implements SecurityServiceClient {
    public final List<CreateUserRequest> createUserRequests = new CopyOnWriteArrayList<>();

    @Override
    public SecurityUserId createUser(CreateUserRequest request) {
        createUserRequests.add(request);
        return SecurityUserId.of(UUID.randomUUID().toString());
    }
}
