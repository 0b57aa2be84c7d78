package com.p14n.pgtopics.app;

import com.p14n.pgtopics.PubSub;
import com.p14n.pgtopics.data.ConfigData;
import com.p14n.pgtopics.data.TopicConfig;
import com.p14n.pgtopics.db.DatabaseSetup;
import com.p14n.pgtopics.topic.PostgresTopic;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.instrumentation.jdbc.datasource.JdbcTelemetry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.sql.DataSource;

/**
 * Publishes a {@link UserCreated} event every second and logs each one
 * received. Run several copies against the same database to see events
 * shared between them.
 */
public class App {

    private static final Logger logger = LoggerFactory.getLogger(App.class);

    private static String envVal(String name, String defaultValue) {
        var e = System.getenv(name);
        if (e != null && !e.isBlank()) {
            return e.trim();
        }
        return defaultValue;
    }

    public static void main(String[] args) throws Exception {
        var cfg = new ConfigData(
                envVal("APP_DB_HOST", "localhost"),
                Integer.parseInt(envVal("APP_DB_PORT", "5432")),
                envVal("APP_DB_USER", "postgres"),
                envVal("APP_DB_PASSWORD", "postgres"),
                envVal("APP_DB_NAME", "postgres"));

        new DatabaseSetup(cfg).setupAll();

        OpenTelemetry ot = Opentelemetry.create("pgtopics");
        DataSource ds = JdbcTelemetry.create(ot).wrap(DatabaseSetup.createPool(cfg));

        var running = new AtomicBoolean(true);
        try (var pubsub = new PubSub(ds, cfg, ot)) {
            Runtime.getRuntime().addShutdownHook(new Thread(() -> running.set(false)));
            pubsub.start();

            PostgresTopic<UserCreated> users = pubsub.topic(UserCreated.class,
                    TopicConfig.defaults()
                            .withRetries(3)
                            .withBackoff(Duration.ofSeconds(1), Duration.ofSeconds(10), 2.0)
                            .withDeadLetters(true));

            users.subscribe(event -> logger.atInfo().log("Received {} from {}",
                    event.payload().name(), event.source()));

            publishContinuously(users, running);
        }
    }

    private static void publishContinuously(PostgresTopic<UserCreated> users, AtomicBoolean running)
            throws InterruptedException {
        int n = 0;
        while (running.get()) {
            var id = UUID.randomUUID().toString();
            users.publish(new UserCreated(id, "user-" + n++));
            Thread.sleep(1000);
        }
    }
}
