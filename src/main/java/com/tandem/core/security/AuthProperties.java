package com.tandem.core.security;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "tandem.auth")
public class AuthProperties {

    private boolean enabled = true;

    /** Actor used for every request when authentication is disabled (local development). */
    private long devUserId = 1;
    private String devUserName = "developer";

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getDevUserId() {
        return devUserId;
    }

    public void setDevUserId(long devUserId) {
        this.devUserId = devUserId;
    }

    public String getDevUserName() {
        return devUserName;
    }

    public void setDevUserName(String devUserName) {
        this.devUserName = devUserName;
    }
}
