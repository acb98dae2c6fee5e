package com.eduhub.data.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties(prefix = "eduhub.mongo")
public record EduHubMongoProperties(@DefaultValue("localhost") String host,
                                    @DefaultValue("27017") int port,
                                    @DefaultValue("eduhub_db") String database) {

    public String connectionString() {
        return "mongodb://" + host + ":" + port + "/";
    }
}
