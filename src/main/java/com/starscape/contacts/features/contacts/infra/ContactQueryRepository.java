package com.starscape.contacts.features.contacts.infra;

import com.starscape.contacts.features.contacts.domain.Contact;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Read-side queries for contact search and birthday lookups.
 */
@Repository
public interface ContactQueryRepository extends JpaRepository<Contact, String>, JpaSpecificationExecutor<Contact> {
    
    /**
     * Find the owner's contacts whose birthday falls on one of the given calendar days.
     * @param monthDays days encoded as {@code month * 100 + day}, e.g. 1231 for December 31
     */
    @Query("SELECT c FROM Contact c WHERE c.ownerId = :ownerId " +
           "AND (EXTRACT(MONTH FROM c.birthday) * 100 + EXTRACT(DAY FROM c.birthday)) IN :monthDays")
    List<Contact> findByOwnerIdAndBirthdayIn(
        @Param("ownerId") String ownerId,
        @Param("monthDays") Collection<Integer> monthDays);
}
