package com.example.burn.platform;

import java.util.Optional;

/**
 * Maps a connection id, as stored on a session, to the live client for that connection.
 */
public interface PlatformClientResolver {

    Optional<MessagingPlatformClient> resolve(String connectionId);
}
