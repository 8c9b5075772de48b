package com.quillkv.audit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/** Audit sink for the in-memory backend: events go to the application log only. */
public class LoggingEventLog implements EventLog {

    private static final Logger log = LoggerFactory.getLogger("quillkv.audit");

    @Override
    public void log(String event, Map<String, ?> details) {
        log.info("audit event={} details={}", event, details == null ? Map.of() : details);
    }
}
