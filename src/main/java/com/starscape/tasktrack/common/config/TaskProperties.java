package com.starscape.tasktrack.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for task listing.
 * Binds to app.tasks.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.tasks")
public class TaskProperties {
    
    private int defaultPageSize = 10;
    private int maxPageSize = 100;
    
    public int getDefaultPageSize() {
        return defaultPageSize;
    }
    
    public void setDefaultPageSize(int defaultPageSize) {
        this.defaultPageSize = defaultPageSize;
    }
    
    public int getMaxPageSize() {
        return maxPageSize;
    }
    
    public void setMaxPageSize(int maxPageSize) {
        this.maxPageSize = maxPageSize;
    }
    
    /**
     * Resolve the effective page size for a list request.
     * @param requested The limit supplied by the caller, or null when omitted
     * @return the requested limit capped at maxPageSize, or defaultPageSize when omitted
     */
    public int resolvePageSize(Integer requested) {
        if (requested == null) {
            return defaultPageSize;
        }
        return Math.min(requested, maxPageSize);
    }
}
