package com.tandem.core.security;

import com.tandem.core.model.Actor;

import java.util.Optional;

/**
 * Maps a request credential to the actor it identifies.
 */
public interface ActorResolver {

    /**
     * @param authorizationHeader raw {@code Authorization} header value, may be null
     * @return the actor, or empty when the credential is missing or invalid
     */
    Optional<Actor> resolve(String authorizationHeader);
}
