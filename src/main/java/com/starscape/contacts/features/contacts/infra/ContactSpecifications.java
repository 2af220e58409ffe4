package com.starscape.contacts.features.contacts.infra;

import com.starscape.contacts.features.contacts.domain.Contact;
import jakarta.persistence.criteria.Predicate;
import org.springframework.data.jpa.domain.Specification;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Query fragments for contact search.
 */
public final class ContactSpecifications {
    
    private ContactSpecifications() {
    }
    
    public static Specification<Contact> ownedBy(String ownerId) {
        return (root, query, cb) -> cb.equal(root.get("ownerId"), ownerId);
    }
    
    /**
     * Case-insensitive substring match on any of the given fields. Blank filters are ignored;
     * with no filter at all every contact matches.
     */
    public static Specification<Contact> matchesAny(String firstName, String lastName, String email) {
        return (root, query, cb) -> {
            List<Predicate> predicates = new ArrayList<>();
            addContains(predicates, cb, root.get("firstName"), firstName);
            addContains(predicates, cb, root.get("lastName"), lastName);
            addContains(predicates, cb, root.get("email"), email);
            return predicates.isEmpty() ? cb.conjunction() : cb.or(predicates.toArray(new Predicate[0]));
        };
    }
    
    private static void addContains(
            List<Predicate> predicates,
            jakarta.persistence.criteria.CriteriaBuilder cb,
            jakarta.persistence.criteria.Path<String> field,
            String value) {
        if (value == null || value.isBlank()) {
            return;
        }
        String pattern = "%" + escapeLike(value.trim().toLowerCase(Locale.ROOT)) + "%";
        predicates.add(cb.like(cb.lower(field), pattern, '\\'));
    }
    
    static String escapeLike(String value) {
        return value.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }
}
