package com.eduhub.data.schema;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

@Component
@ConditionalOnProperty(name = "eduhub.schema.initialize-on-startup", havingValue = "true", matchIfMissing = true)
@Slf4j
public class SchemaInitializer implements ApplicationRunner {
    private final SchemaManager schemaManager;

    public SchemaInitializer(SchemaManager schemaManager) {
        this.schemaManager = schemaManager;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("Initializing collections and indexes");
        schemaManager.setupAll();
        schemaManager.createIndexes();
    }
}
