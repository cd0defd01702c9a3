package com.example.burn.platform;

import com.example.burn.config.BurnProperties;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Builds one client per configured connection (burn.platform.connections). In local mode a
 * single "local" connection is registered when none is configured.
 */
@Component
@Slf4j
public class ConfiguredPlatformClientResolver implements PlatformClientResolver {

    static final String DEFAULT_LOCAL_CONNECTION = "local";

    private final Map<String, MessagingPlatformClient> clients = new LinkedHashMap<>();

    public ConfiguredPlatformClientResolver(BurnProperties properties, RestClient.Builder restClientBuilder) {
        BurnProperties.Platform platform = properties.getPlatform();
        List<BurnProperties.Connection> connections = platform.getConnections();

        if (connections.isEmpty() && platform.getMode() == BurnProperties.Platform.Mode.LOCAL) {
            register(new LocalMessagingPlatformClient(DEFAULT_LOCAL_CONNECTION));
        }
        for (BurnProperties.Connection connection : connections) {
            switch (platform.getMode()) {
                case LOCAL -> register(new LocalMessagingPlatformClient(connection.getId()));
                case ONEBOT -> register(new OneBotHttpPlatformClient(connection, restClientBuilder.clone()));
                default -> throw new IllegalStateException("Unsupported platform mode " + platform.getMode());
            }
        }
        log.info("Registered {} platform connection(s) in {} mode: {}",
                clients.size(), platform.getMode(), clients.keySet());
    }

    private void register(MessagingPlatformClient client) {
        if (clients.putIfAbsent(client.connectionId(), client) != null) {
            throw new IllegalStateException("Duplicate platform connection id " + client.connectionId());
        }
    }

    @Override
    public Optional<MessagingPlatformClient> resolve(String connectionId) {
        if (connectionId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(clients.get(connectionId));
    }
}
