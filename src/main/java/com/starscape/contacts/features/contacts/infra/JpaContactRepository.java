package com.starscape.contacts.features.contacts.infra;

import com.starscape.contacts.features.contacts.domain.Contact;
import com.starscape.contacts.features.contacts.domain.ContactRepository;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface JpaContactRepository extends JpaRepository<Contact, String>, ContactRepository {
}
