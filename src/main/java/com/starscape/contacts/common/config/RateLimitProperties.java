package com.starscape.contacts.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Fixed-window request limits. Binds to app.rate-limit.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.rate-limit")
public class RateLimitProperties {

    private Limit contactCreate = new Limit();

    public Limit getContactCreate() {
        return contactCreate;
    }

    public void setContactCreate(Limit contactCreate) {
        this.contactCreate = contactCreate;
    }

    public static class Limit {

        private boolean enabled = true;
        private int maxRequests = 1;
        private Duration window = Duration.ofSeconds(10);

        public Limit() {
        }

        public Limit(boolean enabled, int maxRequests, Duration window) {
            this.enabled = enabled;
            this.maxRequests = maxRequests;
            this.window = window;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getMaxRequests() {
            return maxRequests;
        }

        public void setMaxRequests(int maxRequests) {
            this.maxRequests = maxRequests;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }
    }
}
