package com.example.annotation.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@Data
@ConfigurationProperties(prefix = "annotation")
public class AnnotationProperties {

    private Identity identity = new Identity();
    private Profiles profiles = new Profiles();
    private Store store = new Store();
    private Dashboard dashboard = new Dashboard();

    @Data
    public static class Identity {
        private String callerIdHeader = "X-Caller-Id";          // Set by the upstream identity provider
        private String correlationIdHeader = "X-Correlation-Id";
        private List<String> publicPaths = List.of("/actuator/health", "/actuator/info");
    }

    @Data
    public static class Profiles {
        // Identities allowed to self-provision an admin profile
        private List<String> bootstrapAdmins = List.of();
    }

    @Data
    public static class Store {
        private int transientRetryAttempts = 3;
        private long transientRetryBackoffMillis = 25;
    }

    @Data
    public static class Dashboard {
        private int summaryPreviewLength = 120;
    }
}
