package com.starscape.contacts.common.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties for contact handling.
 * Binds to app.contacts.* properties from application.yml
 */
@ConfigurationProperties(prefix = "app.contacts")
public class ContactsProperties {
    
    private List<String> autoFavoriteNames = new ArrayList<>();
    
    public List<String> getAutoFavoriteNames() {
        return autoFavoriteNames;
    }
    
    public void setAutoFavoriteNames(List<String> autoFavoriteNames) {
        this.autoFavoriteNames = autoFavoriteNames;
    }
    
    /**
     * Check if a contact with this first name is marked favorite on creation.
     * Performs case-insensitive comparison on trimmed names.
     * @param firstName The contact's first name
     * @return true if the name is in the auto-favorite list
     */
    public boolean isAutoFavorite(String firstName) {
        if (firstName == null || autoFavoriteNames == null || autoFavoriteNames.isEmpty()) {
            return false;
        }
        String normalized = firstName.trim();
        return autoFavoriteNames.stream()
                .map(String::trim)
                .anyMatch(name -> name.equalsIgnoreCase(normalized));
    }
}
