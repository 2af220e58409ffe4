package com.starscape.contacts.features.contacts.app;

import com.starscape.contacts.common.web.OffsetLimitRequest;
import com.starscape.contacts.features.contacts.api.dto.ContactResponse;
import com.starscape.contacts.features.contacts.domain.Contact;
import com.starscape.contacts.features.contacts.infra.ContactQueryRepository;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

import static com.starscape.contacts.features.contacts.infra.ContactSpecifications.matchesAny;
import static com.starscape.contacts.features.contacts.infra.ContactSpecifications.ownedBy;

/**
 * Handler for listing and searching the caller's contacts.
 * Filters match case-insensitive substrings and are OR-combined.
 */
@Service
public class ListContactsHandler {
    
    static final Sort ORDER = Sort.by("lastName", "firstName", "contactId");
    
    private final ContactQueryRepository queryRepository;
    
    public ListContactsHandler(ContactQueryRepository queryRepository) {
        this.queryRepository = queryRepository;
    }
    
    @Transactional(readOnly = true)
    public List<ContactResponse> handle(
            String userId,
            String firstName,
            String lastName,
            String email,
            int offset,
            int limit) {
        
        Specification<Contact> specification = Specification
                .where(ownedBy(userId))
                .and(matchesAny(firstName, lastName, email));
        
        return queryRepository.findAll(specification, OffsetLimitRequest.of(offset, limit, ORDER))
                .map(ContactResponse::of)
                .getContent();
    }
}
