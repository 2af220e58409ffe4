package com.starscape.contacts.features.contacts.app;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class BirthdayWindowTest {
    
    @Test
    void coversStartThroughEndInclusive() {
        BirthdayWindow window = BirthdayWindow.starting(LocalDate.of(2024, 6, 10), 7);
        
        assertEquals(Set.of(610, 611, 612, 613, 614, 615, 616, 617), window.monthDays());
        assertTrue(window.contains(LocalDate.of(1980, 6, 10)));
        assertTrue(window.contains(LocalDate.of(1980, 6, 17)));
        assertFalse(window.contains(LocalDate.of(1980, 6, 9)));
        assertFalse(window.contains(LocalDate.of(1980, 6, 18)));
    }
    
    @Test
    void wrapsAroundNewYear() {
        BirthdayWindow window = BirthdayWindow.starting(LocalDate.of(2023, 12, 29), 7);
        
        assertTrue(window.monthDays().containsAll(Set.of(1229, 1231, 101, 105)));
        assertEquals(LocalDate.of(2024, 1, 3), window.nextOccurrence(LocalDate.of(1999, 1, 3)));
        assertEquals(LocalDate.of(2023, 12, 30), window.nextOccurrence(LocalDate.of(1999, 12, 30)));
    }
    
    @Test
    void leapDayBirthdayFallsOnFebruary28InCommonYears() {
        BirthdayWindow window = BirthdayWindow.starting(LocalDate.of(2023, 2, 25), 7);
        LocalDate leapling = LocalDate.of(2000, 2, 29);
        
        assertTrue(window.monthDays().contains(229));
        assertEquals(LocalDate.of(2023, 2, 28), window.nextOccurrence(leapling));
        assertTrue(window.contains(leapling));
    }
    
    @Test
    void leapDayBirthdayKeepsFebruary29InLeapYears() {
        BirthdayWindow window = BirthdayWindow.starting(LocalDate.of(2024, 2, 25), 7);
        
        assertEquals(LocalDate.of(2024, 2, 29), window.nextOccurrence(LocalDate.of(2000, 2, 29)));
    }
    
    @Test
    void leapDayBirthdayOutsideWindowAfterFebruary28() {
        BirthdayWindow window = BirthdayWindow.starting(LocalDate.of(2023, 3, 1), 7);
        
        assertFalse(window.monthDays().contains(229));
        assertFalse(window.contains(LocalDate.of(2000, 2, 29)));
    }
    
    @Test
    void rejectsNegativeLength() {
        assertThrows(IllegalArgumentException.class, () -> BirthdayWindow.starting(LocalDate.now(), -1));
    }
}
