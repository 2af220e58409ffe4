package com.starscape.contacts.features.contacts.app;

import com.starscape.contacts.common.exception.NotFoundException;
import com.starscape.contacts.features.contacts.api.dto.ContactResponse;
import com.starscape.contacts.features.contacts.domain.ContactRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class GetContactHandler {
    
    private final ContactRepository contactRepository;
    
    public GetContactHandler(ContactRepository contactRepository) {
        this.contactRepository = contactRepository;
    }
    
    @Transactional(readOnly = true)
    public ContactResponse handle(String userId, String contactId) {
        return contactRepository.findByContactIdAndOwnerId(contactId, userId)
                .map(ContactResponse::of)
                .orElseThrow(() -> new NotFoundException("Not Found"));
    }
}
