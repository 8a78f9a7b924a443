package com.wayfinder.core.events;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

@Configuration
public class EventsConfig {

    /** Events waiting for delivery beyond this are dropped rather than blocking the emitter. */
    static final int DISPATCH_QUEUE_CAPACITY = 10_000;

    /** One thread keeps events in emission order. */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService thoughtEventDispatcher() {
        return new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
                new LinkedBlockingQueue<>(DISPATCH_QUEUE_CAPACITY), r -> {
                    Thread t = new Thread(r, "thought-events");
                    t.setDaemon(true);
                    return t;
                });
    }

    @Bean
    public ThoughtEventBus thoughtEventBus(ExecutorService thoughtEventDispatcher) {
        return new ThoughtEventBus(thoughtEventDispatcher);
    }
}
