package com.starscape.contacts.features.contacts.domain;

import java.time.LocalDate;

/**
 * The user-editable fields of a {@link Contact}.
 */
public record ContactDetails(
    String firstName,
    String lastName,
    String email,
    String phone,
    LocalDate birthday,
    String description,
    boolean favorites
) {}
