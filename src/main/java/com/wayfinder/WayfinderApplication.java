package com.wayfinder;

import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication
public class WayfinderApplication {

    public static void main(String[] args) {
        // No web surface: the supervisor is driven programmatically by whatever embeds this context.
        new SpringApplicationBuilder(WayfinderApplication.class)
                .properties(
                        "spring.main.web-application-type=none",
                        "spring.main.banner-mode=off"
                )
                .run(args);
    }
}
