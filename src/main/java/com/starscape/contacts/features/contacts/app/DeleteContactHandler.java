package com.starscape.contacts.features.contacts.app;

import com.starscape.contacts.common.exception.NotFoundException;
import com.starscape.contacts.features.contacts.domain.Contact;
import com.starscape.contacts.features.contacts.domain.ContactRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class DeleteContactHandler {
    
    private static final Logger log = LoggerFactory.getLogger(DeleteContactHandler.class);
    
    private final ContactRepository contactRepository;
    
    public DeleteContactHandler(ContactRepository contactRepository) {
        this.contactRepository = contactRepository;
    }
    
    @Transactional
    public void handle(String userId, String contactId) {
        Contact contact = contactRepository.findByContactIdAndOwnerId(contactId, userId)
                .orElseThrow(() -> new NotFoundException("Not Found"));
        
        contactRepository.delete(contact);
        log.debug("Deleted contact {} of user {}", contactId, userId);
    }
}
