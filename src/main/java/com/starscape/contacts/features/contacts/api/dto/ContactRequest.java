package com.starscape.contacts.features.contacts.api.dto;

import com.starscape.contacts.features.contacts.domain.ContactDetails;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;

import java.time.LocalDate;

public record ContactRequest(
    @NotBlank(message = "First name is required")
    @Size(max = 50, message = "First name must be 50 characters or less")
    String firstName,
    
    @NotBlank(message = "Last name is required")
    @Size(max = 50, message = "Last name must be 50 characters or less")
    String lastName,
    
    @NotBlank(message = "Email is required")
    @Email(message = "Email must be valid")
    @Size(max = 150, message = "Email must be 150 characters or less")
    String email,
    
    @NotBlank(message = "Phone is required")
    @Pattern(
        regexp = "^\\+?\\d{1,4}?[-.\\s]?\\(?\\d{1,3}?\\)?[-.\\s]?\\d{1,4}[-.\\s]?\\d{1,4}[-.\\s]?\\d{1,9}$",
        message = "Phone must be a valid phone number")
    String phone,
    
    @NotNull(message = "Birthday is required")
    LocalDate birthday,
    
    @Size(max = 150, message = "Description must be 150 characters or less")
    String description,
    
    Boolean favorites
) {
    public ContactDetails toDetails() {
        return new ContactDetails(
            firstName,
            lastName,
            email,
            phone,
            birthday,
            description,
            Boolean.TRUE.equals(favorites)
        );
    }
}
