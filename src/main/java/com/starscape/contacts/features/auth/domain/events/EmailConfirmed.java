package com.starscape.contacts.features.auth.domain.events;

import com.starscape.contacts.common.domain.DomainEvent;
import java.time.Instant;

public record EmailConfirmed(
    String userId,
    Instant occurredOn
) implements DomainEvent {
    
    @Override
    public String getEventType() {
        return "EmailConfirmed";
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
