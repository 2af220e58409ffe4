package com.starscape.contacts.features.auth.domain.events;

import com.starscape.contacts.common.domain.DomainEvent;
import java.time.Instant;

public record EmailVerificationRequested(
    String userId,
    String email,
    String username,
    Instant occurredOn
) implements DomainEvent {
    
    @Override
    public String getEventType() {
        return "EmailVerificationRequested";
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
