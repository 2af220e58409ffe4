package com.starscape.contacts.features.auth.domain.events;

import com.starscape.contacts.common.domain.DomainEvent;
import java.time.Instant;

public record AvatarChanged(
    String userId,
    String previousAvatar,
    String avatar,
    Instant occurredOn
) implements DomainEvent {
    
    @Override
    public String getEventType() {
        return "AvatarChanged";
    }
    
    @Override
    public String getAggregateId() {
        return userId;
    }
    
    @Override
    public Instant getOccurredOn() {
        return occurredOn;
    }
}
