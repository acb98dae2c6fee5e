package com.eduhub.data.config;

import com.mongodb.ConnectionString;
import com.mongodb.MongoClientSettings;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.data.mongodb.core.MongoTemplate;

@Configuration
@EnableConfigurationProperties(EduHubMongoProperties.class)
@Slf4j
public class MongoConfig {

    @Bean(destroyMethod = "close")
    public MongoClient mongoClient(EduHubMongoProperties properties) {
        log.info("Connecting to MongoDB at {}:{}", properties.host(), properties.port());
        MongoClientSettings settings = MongoClientSettings.builder()
                .applyConnectionString(new ConnectionString(properties.connectionString()))
                .build();
        return MongoClients.create(settings);
    }

    @Bean
    public MongoTemplate mongoTemplate(MongoClient mongoClient, EduHubMongoProperties properties) {
        return new MongoTemplate(mongoClient, properties.database());
    }
}
