package com.starscape.contacts.features.contacts.app;

import com.starscape.contacts.common.exception.ConflictException;
import com.starscape.contacts.common.exception.NotFoundException;
import com.starscape.contacts.features.contacts.api.dto.ContactRequest;
import com.starscape.contacts.features.contacts.api.dto.ContactResponse;
import com.starscape.contacts.features.contacts.domain.Contact;
import com.starscape.contacts.features.contacts.domain.ContactRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handler for replacing a contact's fields. Contacts of other users are reported as missing.
 */
@Service
public class UpdateContactHandler {
    
    private final ContactRepository contactRepository;
    
    public UpdateContactHandler(ContactRepository contactRepository) {
        this.contactRepository = contactRepository;
    }
    
    @Transactional
    public ContactResponse handle(String userId, String contactId, ContactRequest request) {
        Contact contact = contactRepository.findByContactIdAndOwnerId(contactId, userId)
                .orElseThrow(() -> new NotFoundException("Not Found"));
        
        if (contactRepository.existsByOwnerIdAndEmailIgnoreCaseAndContactIdNot(userId, request.email(), contactId)) {
            throw new ConflictException("Contact with this email already exists");
        }
        
        contact.update(request.toDetails());
        contactRepository.save(contact);
        
        return ContactResponse.of(contact);
    }
}
