package com.wayfinder.core.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Selects the session store backend from {@code wayfinder.session.store}.
 */
@Configuration
public class SessionConfig {

    private static final Logger log = LoggerFactory.getLogger(SessionConfig.class);

    @Bean
    public SessionStore sessionStore(SessionProperties properties, Clock clock) {
        if (properties.isFileStore()) {
            return new FileSessionStore(Path.of(properties.getStoreDirectory()), clock);
        }
        log.info("Using in-memory session store");
        return new InMemorySessionStore(clock);
    }
}
