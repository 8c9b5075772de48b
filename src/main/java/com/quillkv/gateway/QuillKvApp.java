package com.quillkv.gateway;

import com.quillkv.audit.EventLog;
import com.quillkv.auth.CredentialManager;
import com.quillkv.shared.config.ConfigLoader;
import com.quillkv.shared.config.QuillKvConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.Map;

@SpringBootApplication(scanBasePackages = "com.quillkv")
public class QuillKvApp {

    private static final Logger log = LoggerFactory.getLogger(QuillKvApp.class);

    public static void main(String[] args) {
        var config = ConfigLoader.load();

        var app = new SpringApplication(QuillKvApp.class);
        app.setDefaultProperties(Map.of("server.port", config.serverPort()));
        app.addInitializers(ctx -> ctx.getBeanFactory().registerSingleton("quillKvConfig", config));
        var ctx = app.run(args);

        seedAdmin(config, ctx.getBean(CredentialManager.class), ctx.getBean(EventLog.class));
        log.info("quillkv listening on :{} (storage={})", config.serverPort(), config.storage().backend());
    }

    /** Startup must survive a failed seed; the failure is logged and audited instead. */
    static void seedAdmin(QuillKvConfig config, CredentialManager credentials, EventLog events) {
        var auth = config.auth();
        if (!auth.seedable()) {
            log.warn("Admin credentials not configured. Set QUILLKV_ADMIN_EMAIL and QUILLKV_ADMIN_PASSWORD");
            return;
        }
        try {
            if (credentials.ensurePrincipal(auth.adminEmail(), auth.adminPassword())) {
                log.info("Seeded admin credential for {}", auth.adminEmail());
            }
        } catch (RuntimeException e) {
            log.error("Failed to seed admin credential", e);
            events.log("admin_seed_failed", Map.of("message", String.valueOf(e.getMessage())));
        }
    }
}
