package com.starscape.contacts.features.contacts.api;

import com.starscape.contacts.common.security.UserPrincipal;
import com.starscape.contacts.features.contacts.api.dto.ContactRequest;
import com.starscape.contacts.features.contacts.api.dto.ContactResponse;
import com.starscape.contacts.features.contacts.app.CreateContactHandler;
import com.starscape.contacts.features.contacts.app.DeleteContactHandler;
import com.starscape.contacts.features.contacts.app.GetContactHandler;
import com.starscape.contacts.features.contacts.app.ListContactsHandler;
import com.starscape.contacts.features.contacts.app.UpcomingBirthdaysHandler;
import com.starscape.contacts.features.contacts.app.UpdateContactHandler;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * CRUD, search and birthday lookups over the caller's contacts.
 */
@RestController
@RequestMapping("/api/contacts")
public class ContactController {
    
    private final CreateContactHandler createContactHandler;
    private final GetContactHandler getContactHandler;
    private final UpdateContactHandler updateContactHandler;
    private final DeleteContactHandler deleteContactHandler;
    private final ListContactsHandler listContactsHandler;
    private final UpcomingBirthdaysHandler upcomingBirthdaysHandler;
    
    public ContactController(
            CreateContactHandler createContactHandler,
            GetContactHandler getContactHandler,
            UpdateContactHandler updateContactHandler,
            DeleteContactHandler deleteContactHandler,
            ListContactsHandler listContactsHandler,
            UpcomingBirthdaysHandler upcomingBirthdaysHandler) {
        this.createContactHandler = createContactHandler;
        this.getContactHandler = getContactHandler;
        this.updateContactHandler = updateContactHandler;
        this.deleteContactHandler = deleteContactHandler;
        this.listContactsHandler = listContactsHandler;
        this.upcomingBirthdaysHandler = upcomingBirthdaysHandler;
    }
    
    @GetMapping
    public ResponseEntity<List<ContactResponse>> listContacts(
            @RequestParam(name = "first_name", required = false) @Size(min = 3, max = 50) String firstName,
            @RequestParam(name = "last_name", required = false) @Size(min = 3, max = 50) String lastName,
            @RequestParam(required = false) @Size(min = 3, max = 50) String email,
            @RequestParam(defaultValue = "10") @Min(1) @Max(500) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        List<ContactResponse> response = listContactsHandler.handle(
            principal.getUserId(), firstName, lastName, email, offset, limit);
        return ResponseEntity.ok(response);
    }
    
    @GetMapping("/upcoming_birthdays")
    public ResponseEntity<List<ContactResponse>> upcomingBirthdays(
            @RequestParam(defaultValue = "10") @Min(1) @Max(500) int limit,
            @RequestParam(defaultValue = "0") @Min(0) int offset,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        return ResponseEntity.ok(upcomingBirthdaysHandler.handle(principal.getUserId(), offset, limit));
    }
    
    @GetMapping("/{contactId}")
    public ResponseEntity<ContactResponse> getContact(
            @PathVariable String contactId,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        return ResponseEntity.ok(getContactHandler.handle(principal.getUserId(), contactId));
    }
    
    @PostMapping
    public ResponseEntity<ContactResponse> createContact(
            @Valid @RequestBody ContactRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        ContactResponse response = createContactHandler.handle(principal.getUserId(), request);
        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }
    
    @PutMapping("/{contactId}")
    public ResponseEntity<ContactResponse> updateContact(
            @PathVariable String contactId,
            @Valid @RequestBody ContactRequest request,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        return ResponseEntity.ok(updateContactHandler.handle(principal.getUserId(), contactId, request));
    }
    
    @DeleteMapping("/{contactId}")
    public ResponseEntity<Void> deleteContact(
            @PathVariable String contactId,
            @AuthenticationPrincipal UserPrincipal principal) {
        
        deleteContactHandler.handle(principal.getUserId(), contactId);
        return ResponseEntity.noContent().build();
    }
}
