package edu.brandeis.cosi103a.bracket.core;

import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class CompetitorTest {

    @Test
    void idFromName_lowercasesAndReplacesPunctuation() {
        assertEquals("mary-jane-o-neil", Competitor.idFromName("Mary Jane O'Neil"));
        assertEquals("team-42", Competitor.idFromName("Team 42"));
    }

    @Test
    void idFromName_ignoresDefaultLocale() {
        Locale previous = Locale.getDefault();
        try {
            Locale.setDefault(Locale.forLanguageTag("tr-TR"));
            assertEquals("ivan", Competitor.idFromName("IVAN"));
        } finally {
            Locale.setDefault(previous);
        }
    }

    @Test
    void byeIdsAreReserved() {
        Competitor bye = Competitor.bye(3);

        assertEquals("bye-3", bye.id());
        assertEquals(Competitor.BYE_NAME, bye.name());
        assertTrue(bye.bye());
        assertTrue(Competitor.isReservedId(bye.id()));
        assertFalse(Competitor.isReservedId("abbey"));
        assertFalse(Competitor.isReservedId(null));
    }
}
