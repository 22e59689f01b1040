package org.mendoza.consultation.sync;

import io.smallrye.mutiny.Uni;
import io.vertx.mutiny.core.Vertx;
import io.vertx.mutiny.pgclient.PgPool;
import io.vertx.pgclient.PgConnectOptions;
import io.vertx.pgclient.pubsub.PgSubscriber;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import org.mendoza.consultation.store.CallStore;

import java.time.Duration;
import java.util.Optional;

/**
 * Change-feed over PostgreSQL LISTEN/NOTIFY. Row triggers on the call, participant and appointment
 * tables publish one JSON document per change on a single channel.
 */
@ApplicationScoped
public class PgChangeFeed implements ChangeFeed {

    private static final Logger LOG = Logger.getLogger(PgChangeFeed.class);

    private static final String URL_PREFIX = "vertx-reactive:";

    private final Vertx vertx;
    private final PgPool client;
    private final CallStore store;
    private final String channel;
    private final Duration reconnectDelay;
    private final String url;
    private final Optional<String> username;
    private final Optional<String> password;

    // PostgreSQL subscriber for LISTEN/NOTIFY
    private volatile PgSubscriber subscriber;
    private volatile ChangeFeedListener listener;
    private volatile boolean connected;
    private volatile boolean stopping;

    @Inject
    public PgChangeFeed(Vertx vertx,
                        PgPool client,
                        CallStore store,
                        @ConfigProperty(name = "consultation.sync.channel", defaultValue = "consultation_changes") String channel,
                        @ConfigProperty(name = "consultation.sync.reconnect-delay", defaultValue = "PT2S") Duration reconnectDelay,
                        @ConfigProperty(name = "quarkus.datasource.reactive.url", defaultValue = "postgresql://localhost:5432/mendoza_clinic") String url,
                        @ConfigProperty(name = "quarkus.datasource.username") Optional<String> username,
                        @ConfigProperty(name = "quarkus.datasource.password") Optional<String> password) {
        this.vertx = vertx;
        this.client = client;
        this.store = store;
        this.channel = channel;
        this.reconnectDelay = reconnectDelay;
        this.url = url;
        this.username = username;
        this.password = password;
    }

    @Override
    public Uni<Void> start(ChangeFeedListener listener) {
        this.listener = listener;
        this.stopping = false;
        return store.initialize()
            .chain(this::ensureTriggersExist)
            .onItem().invoke(this::connect);
    }

    private Uni<Void> ensureTriggersExist() {
        String sql = String.format("""
            CREATE OR REPLACE FUNCTION notify_consultation_changes()
            RETURNS trigger AS $$
            DECLARE
                changed RECORD;
                payload_row JSON;
            BEGIN
                IF (TG_OP = 'DELETE') THEN
                    changed := OLD;
                ELSE
                    changed := NEW;
                END IF;
                -- appointment rows are wide; only id and status are consumed
                IF (TG_TABLE_NAME = 'appointments') THEN
                    payload_row := json_build_object('id', changed.id, 'status', changed.status);
                ELSE
                    payload_row := row_to_json(changed);
                END IF;
                PERFORM pg_notify('%1$s', json_build_object('table', TG_TABLE_NAME, 'operation', TG_OP, 'row', payload_row)::text);
                RETURN changed;
            END;
            $$ LANGUAGE plpgsql;

            DO $$
            BEGIN
                IF to_regclass('video_calls') IS NOT NULL THEN
                    DROP TRIGGER IF EXISTS video_calls_notify ON video_calls;
                    CREATE TRIGGER video_calls_notify
                        AFTER INSERT OR UPDATE OR DELETE ON video_calls
                        FOR EACH ROW EXECUTE FUNCTION notify_consultation_changes();
                END IF;

                IF to_regclass('video_call_participants') IS NOT NULL THEN
                    DROP TRIGGER IF EXISTS video_call_participants_notify ON video_call_participants;
                    CREATE TRIGGER video_call_participants_notify
                        AFTER INSERT OR UPDATE OR DELETE ON video_call_participants
                        FOR EACH ROW EXECUTE FUNCTION notify_consultation_changes();
                END IF;

                IF to_regclass('appointments') IS NOT NULL THEN
                    DROP TRIGGER IF EXISTS appointments_consultation_notify ON appointments;
                    CREATE TRIGGER appointments_consultation_notify
                        AFTER UPDATE OF status OR DELETE ON appointments
                        FOR EACH ROW EXECUTE FUNCTION notify_consultation_changes();
                END IF;
            END;
            $$;
            """, channel);

        return client.query(sql).execute()
            .onItem().invoke(rows -> LOG.info("✅ Change-feed triggers verified/created"))
            .onFailure().invoke(failure ->
                LOG.error("❌ Failed to create change-feed triggers: " + failure.getMessage(), failure))
            .replaceWithVoid();
    }

    private void connect() {
        LOG.infof("🔊 Subscribing to PostgreSQL channel %s...", channel);

        PgSubscriber created = PgSubscriber.subscriber(vertx.getDelegate(), connectOptions());
        // retry forever until stopped; the policy also covers the very first connect
        created.reconnectPolicy(retries -> stopping ? -1L : reconnectDelay.toMillis());

        created.channel(channel)
            .subscribeHandler(v -> {
                connected = true;
                LOG.infof("✅ Listening on %s", channel);
                listener.onConnected();
            })
            .endHandler(v -> markDisconnected())
            .handler(payload -> {
                LOG.debugf("📢 Change detected: %s", payload);
                listener.onPayload(payload);
            });

        created.closeHandler(v -> {
            markDisconnected();
            LOG.info("🔌 Closed PostgreSQL LISTEN/NOTIFY connection");
        });

        subscriber = created;
        created.connect(ar -> {
            if (ar.failed()) {
                LOG.error("❌ Failed to setup LISTEN/NOTIFY: " + ar.cause().getMessage(), ar.cause());
            }
        });
    }

    private void markDisconnected() {
        if (connected) {
            connected = false;
            LOG.warnf("Lost LISTEN connection on %s", channel);
            listener.onDisconnected();
        }
    }

    PgConnectOptions connectOptions() {
        String uri = url.startsWith(URL_PREFIX) ? url.substring(URL_PREFIX.length()) : url;
        PgConnectOptions options = PgConnectOptions.fromUri(uri);
        username.ifPresent(options::setUser);
        password.ifPresent(options::setPassword);
        return options;
    }

    @Override
    public void stop() {
        stopping = true;
        PgSubscriber current = subscriber;
        if (current != null) {
            current.close();
            subscriber = null;
        }
        connected = false;
    }

    @Override
    public boolean isConnected() {
        return connected;
    }
}
