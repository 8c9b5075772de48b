package com.quillkv.gateway;

import com.quillkv.audit.EventLog;
import com.quillkv.audit.JdbcEventLog;
import com.quillkv.audit.LoggingEventLog;
import com.quillkv.auth.CredentialManager;
import com.quillkv.auth.SessionTokenService;
import com.quillkv.observability.DoctorCommand;
import com.quillkv.observability.MetricsConfig;
import com.quillkv.posts.FallbackContentFormatter;
import com.quillkv.posts.PostService;
import com.quillkv.shared.config.QuillKvConfig;
import com.quillkv.store.InMemoryKvStore;
import com.quillkv.store.KvStore;
import com.quillkv.store.PostgresKvStore;
import com.quillkv.store.SchemaCapabilities;
import com.quillkv.store.StoreContext;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

@Configuration
public class AppConfiguration {

    // Pool starts on first getConnection(), so the in-memory backend never dials the database.
    @Bean(destroyMethod = "close")
    public HikariDataSource dataSource(QuillKvConfig config) {
        var db = config.database();
        var ds = new HikariDataSource();
        ds.setPoolName("quillkv");
        ds.setJdbcUrl(db.get("url"));
        ds.setUsername(db.get("username"));
        ds.setPassword(db.get("password"));
        ds.setMaximumPoolSize(config.storage().poolSize());
        ds.setConnectionInitSql("SET search_path TO " + db.get("schema") + ", public");
        return ds;
    }

    @Bean
    public StoreContext storeContext(QuillKvConfig config, DataSource dataSource) {
        var storage = config.storage();
        if (storage.inMemory()) {
            return new StoreContext(dataSource, SchemaCapabilities.none(), storage.ownerId(), 0);
        }
        return StoreContext.create(dataSource, storage.ownerId(), storage.queryTimeoutSeconds());
    }

    @Bean
    public KvStore kvStore(QuillKvConfig config, StoreContext context) {
        return config.storage().inMemory() ? new InMemoryKvStore() : new PostgresKvStore(context);
    }

    @Bean
    public EventLog eventLog(QuillKvConfig config, StoreContext context) {
        return config.storage().inMemory() ? new LoggingEventLog() : new JdbcEventLog(context);
    }

    @Bean
    public CredentialManager credentialManager(KvStore store) {
        return new CredentialManager(store);
    }

    @Bean
    public SessionTokenService sessionTokenService(KvStore store) {
        return new SessionTokenService(store);
    }

    @Bean
    public PostService postService(KvStore store, EventLog events) {
        return new PostService(store, new FallbackContentFormatter(), events);
    }

    @Bean
    public MetricsConfig metricsConfig() {
        return new MetricsConfig();
    }

    @Bean
    public DoctorCommand doctorCommand(QuillKvConfig config, StoreContext context, KvStore store) {
        var dataSource = config.storage().inMemory() ? null : context.dataSource();
        return new DoctorCommand(dataSource, context.capabilities(), store);
    }
}
