package com.starscape.contacts.features.contacts.app;

import com.starscape.contacts.common.config.ContactsProperties;
import com.starscape.contacts.common.config.RateLimitProperties;
import com.starscape.contacts.common.exception.ConflictException;
import com.starscape.contacts.common.ratelimit.RedisRateLimiter;
import com.starscape.contacts.features.contacts.api.dto.ContactRequest;
import com.starscape.contacts.features.contacts.api.dto.ContactResponse;
import com.starscape.contacts.features.contacts.domain.Contact;
import com.starscape.contacts.features.contacts.domain.ContactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Handler for adding a contact to the caller's address book.
 * Throttled per user; first names on the configured family list are stored as favorites.
 */
@Service
public class CreateContactHandler {
    
    private static final Logger log = LoggerFactory.getLogger(CreateContactHandler.class);
    
    static final String RATE_LIMIT_BUCKET = "contact-create";
    
    private final ContactRepository contactRepository;
    private final ContactsProperties contactsProperties;
    private final RateLimitProperties rateLimitProperties;
    private final RedisRateLimiter rateLimiter;
    
    public CreateContactHandler(
            ContactRepository contactRepository,
            ContactsProperties contactsProperties,
            RateLimitProperties rateLimitProperties,
            RedisRateLimiter rateLimiter) {
        this.contactRepository = contactRepository;
        this.contactsProperties = contactsProperties;
        this.rateLimitProperties = rateLimitProperties;
        this.rateLimiter = rateLimiter;
    }
    
    @Transactional
    public ContactResponse handle(String userId, ContactRequest request) {
        rateLimiter.acquire(RATE_LIMIT_BUCKET, userId, rateLimitProperties.getContactCreate());
        
        if (contactRepository.existsByOwnerIdAndEmailIgnoreCase(userId, request.email())) {
            throw new ConflictException("Contact with this email already exists");
        }
        
        String contactId = "contact_" + UUID.randomUUID().toString().replace("-", "");
        Contact contact = new Contact(contactId, userId, request.toDetails());
        if (contactsProperties.isAutoFavorite(contact.getFirstName())) {
            contact.markFavorite();
        }
        
        contactRepository.save(contact);
        log.debug("Created contact {} for user {}", contactId, userId);
        
        return ContactResponse.of(contact);
    }
}
