package com.starscape.contacts.features.contacts.domain;

import java.util.Optional;

public interface ContactRepository {
    Contact save(Contact contact);
    Optional<Contact> findByContactIdAndOwnerId(String contactId, String ownerId);
    boolean existsByOwnerIdAndEmailIgnoreCase(String ownerId, String email);
    boolean existsByOwnerIdAndEmailIgnoreCaseAndContactIdNot(String ownerId, String email, String contactId);
    void delete(Contact contact);
}
