package com.starscape.contacts.features.contacts.api.dto;

import com.starscape.contacts.features.contacts.domain.Contact;

import java.time.Instant;
import java.time.LocalDate;

public record ContactResponse(
    String id,
    String firstName,
    String lastName,
    String email,
    String phone,
    LocalDate birthday,
    String description,
    boolean favorites,
    Instant createdAt,
    Instant updatedAt
) {
    public static ContactResponse of(Contact contact) {
        return new ContactResponse(
            contact.getContactId(),
            contact.getFirstName(),
            contact.getLastName(),
            contact.getEmail(),
            contact.getPhone(),
            contact.getBirthday(),
            contact.getDescription(),
            contact.isFavorites(),
            contact.getCreatedAt(),
            contact.getUpdatedAt()
        );
    }
}
