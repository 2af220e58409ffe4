package com.starscape.contacts.features.contacts.domain;

import com.starscape.contacts.common.domain.AggregateRoot;
import com.starscape.contacts.features.auth.domain.User;
import jakarta.persistence.*;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

@Entity
@Table(
    name = "contacts",
    uniqueConstraints = @UniqueConstraint(name = "uk_contacts_owner_email", columnNames = {"owner_id", "email"}),
    indexes = @Index(name = "idx_contacts_owner", columnList = "owner_id")
)
public class Contact extends AggregateRoot<String> {
    
    @Id
    @Column(name = "contact_id")
    private String contactId;
    
    @Column(name = "owner_id", nullable = false)
    private String ownerId;
    
    // Mapped only for the foreign key; ownerId is the writable side
    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "owner_id", insertable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private User owner;
    
    @Column(name = "first_name", nullable = false, length = 50)
    private String firstName;
    
    @Column(name = "last_name", nullable = false, length = 50)
    private String lastName;
    
    @Column(nullable = false, length = 150)
    private String email;
    
    @Column(nullable = false, length = 32)
    private String phone;
    
    @Column(nullable = false)
    private LocalDate birthday;
    
    @Column(length = 150)
    private String description;
    
    @Column(nullable = false)
    private boolean favorites;
    
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;
    
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
    
    protected Contact() {
        // JPA constructor
    }
    
    public Contact(String contactId, String ownerId, ContactDetails details) {
        super(contactId);
        this.contactId = Objects.requireNonNull(contactId);
        this.ownerId = Objects.requireNonNull(ownerId);
        apply(details);
        this.createdAt = Instant.now();
        this.updatedAt = this.createdAt;
    }
    
    @Override
    public String getId() {
        return contactId;
    }
    
    public String getContactId() {
        return contactId;
    }
    
    public String getOwnerId() {
        return ownerId;
    }
    
    public String getFirstName() {
        return firstName;
    }
    
    public String getLastName() {
        return lastName;
    }
    
    public String getEmail() {
        return email;
    }
    
    public String getPhone() {
        return phone;
    }
    
    public LocalDate getBirthday() {
        return birthday;
    }
    
    public String getDescription() {
        return description;
    }
    
    public boolean isFavorites() {
        return favorites;
    }
    
    public Instant getCreatedAt() {
        return createdAt;
    }
    
    public Instant getUpdatedAt() {
        return updatedAt;
    }
    
    /**
     * Replace every editable field.
     */
    public void update(ContactDetails details) {
        apply(details);
        this.updatedAt = Instant.now();
    }
    
    public void markFavorite() {
        this.favorites = true;
    }
    
    private void apply(ContactDetails details) {
        this.firstName = Objects.requireNonNull(details.firstName());
        this.lastName = Objects.requireNonNull(details.lastName());
        this.email = Objects.requireNonNull(details.email());
        this.phone = Objects.requireNonNull(details.phone());
        this.birthday = Objects.requireNonNull(details.birthday());
        this.description = details.description();
        this.favorites = details.favorites();
    }
    
    @PreUpdate
    protected void onUpdate() {
        this.updatedAt = Instant.now();
    }
}
