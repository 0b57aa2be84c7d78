package com.p14n.pgtopics.data;

import java.time.Duration;

public record ConfigData(String dbHost,
        int dbPort,
        String dbUser,
        String dbPassword,
        String dbName,
        Duration backlogPeriod,
        Duration maintenancePeriod,
        Duration stuckThreshold) implements PubSubConfig {

    public ConfigData(String dbHost,
                      int dbPort,
                      String dbUser,
                      String dbPassword,
                      String dbName) {
        this(dbHost, dbPort, dbUser, dbPassword, dbName, Duration.ofSeconds(5), Duration.ofMinutes(1),
                Duration.ofMinutes(5));
    }
}
