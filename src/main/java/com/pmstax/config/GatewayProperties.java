package com.pmstax.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/** Binds {@code pmstax.gateway.*}: which persistence gateway to use and how to reach it. */
@Getter
@Setter
@ConfigurationProperties(prefix = "pmstax.gateway")
public class GatewayProperties {

    /** {@code rest} talks to the taxation API, {@code in-memory} keeps records in process. */
    private Mode mode = Mode.IN_MEMORY;

    /** Base URL of the taxation API, without the {@code /taxation} suffix. */
    private String baseUrl = "http://localhost:8000";

    private Duration connectTimeout = Duration.ofSeconds(5);

    private Duration readTimeout = Duration.ofSeconds(30);

    public enum Mode {
        REST,
        IN_MEMORY
    }
}
