package com.example.burn.config;

import com.example.burn.access.DynamoTables;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import software.amazon.awssdk.services.dynamodb.DynamoDbClient;

/**
 * Creates missing tables before the application reports ready, so session recovery can read
 * them. Meant for LocalStack; real environments provision tables out of band.
 * To enable, set server.aws.create-tables=true in application.yml.
 */
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(value = "server.aws.create-tables", havingValue = "true")
public class DynamoTableInitializer implements ApplicationRunner {

    private final DynamoDbClient dynamo;

    @Override
    public void run(ApplicationArguments args) {
        DynamoTables.createIfMissing(dynamo);
    }
}
