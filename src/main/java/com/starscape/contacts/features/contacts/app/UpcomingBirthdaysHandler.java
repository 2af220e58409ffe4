package com.starscape.contacts.features.contacts.app;

import com.starscape.contacts.features.contacts.api.dto.ContactResponse;
import com.starscape.contacts.features.contacts.domain.Contact;
import com.starscape.contacts.features.contacts.infra.ContactQueryRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;

/**
 * Handler for contacts whose birthday comes up within the next week, today included,
 * soonest first.
 */
@Service
public class UpcomingBirthdaysHandler {
    
    static final int WINDOW_DAYS = 7;
    
    private final ContactQueryRepository queryRepository;
    private final Clock clock;
    
    public UpcomingBirthdaysHandler(ContactQueryRepository queryRepository, Clock clock) {
        this.queryRepository = queryRepository;
        this.clock = clock;
    }
    
    @Transactional(readOnly = true)
    public List<ContactResponse> handle(String userId, int offset, int limit) {
        BirthdayWindow window = BirthdayWindow.starting(LocalDate.now(clock), WINDOW_DAYS);
        
        Comparator<Contact> soonestFirst = Comparator
                .comparing((Contact c) -> window.nextOccurrence(c.getBirthday()))
                .thenComparing(Contact::getLastName)
                .thenComparing(Contact::getFirstName)
                .thenComparing(Contact::getContactId);
        
        return queryRepository.findByOwnerIdAndBirthdayIn(userId, window.monthDays()).stream()
                .filter(contact -> window.contains(contact.getBirthday()))
                .sorted(soonestFirst)
                .skip(offset)
                .limit(limit)
                .map(ContactResponse::of)
                .toList();
    }
}
