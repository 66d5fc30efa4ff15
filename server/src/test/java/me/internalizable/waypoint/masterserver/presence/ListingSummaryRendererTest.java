package me.internalizable.waypoint.masterserver.presence;

import me.internalizable.waypoint.masterserver.registry.EndpointKey;
import me.internalizable.waypoint.masterserver.registry.Listing;
import me.internalizable.waypoint.masterserver.registry.TestListings;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ListingSummaryRendererTest {

    @Test
    void emptyListSaysNoServers() {
        assertEquals("No servers online\n", ListingSummaryRenderer.render(List.of()));
    }

    @Test
    void rendersHeaderAndLines() {
        Listing locked = new Listing(new EndpointKey("1.2.3.4", 1), "Locked", "", "mp_box", "arena", 3, 8, "pw",
                List.of(), List.of(), "v1", 0, "de", false, null);

        String summary = ListingSummaryRenderer.render(List.of(locked));

        assertEquals("Servers: 1 | Players: 3\n\n• 🇩🇪 🔒 Locked — 3/8 — arena — mp_box", summary);
    }

    @Test
    void blankFieldsUseDefaults() {
        Listing bare = new Listing(new EndpointKey("1.2.3.4", 1), "", "", "", "", 0, 4, "",
                List.of(), List.of(), "v1", 0, "Europe", false, null);

        String summary = ListingSummaryRenderer.render(List.of(bare));

        assertTrue(summary.endsWith("• Unnamed — 0/4 — unknown — "));
    }

    @Test
    void longListsAreCappedWithRemainder() {
        List<Listing> listings = new ArrayList<>();
        for (int i = 0; i < 35; i++) {
            listings.add(TestListings.listing("1.2.3.4", i + 1));
        }

        String summary = ListingSummaryRenderer.render(listings);
        String[] lines = summary.split("\n");

        assertEquals(2 + ListingSummaryRenderer.MAX_LINES + 1, lines.length);
        assertEquals("… and 5 more", lines[lines.length - 1]);
    }

    @Test
    void outputIsTruncated() {
        List<Listing> listings = new ArrayList<>();
        for (int i = 0; i < 30; i++) {
            listings.add(TestListings.listing("1.2.3.4", i + 1, "n".repeat(200), 0, false));
        }

        String summary = ListingSummaryRenderer.render(listings);

        assertTrue(summary.length() <= ListingSummaryRenderer.MAX_LENGTH);
        assertTrue(summary.length() >= ListingSummaryRenderer.MAX_LENGTH - 1);
        assertFalse(Character.isHighSurrogate(summary.charAt(summary.length() - 1)));
    }

    @Test
    void flagNeedsTwoLatinLetters() {
        assertEquals("🇺🇸", ListingSummaryRenderer.toFlag("us"));
        assertEquals("", ListingSummaryRenderer.toFlag("USA"));
        assertEquals("", ListingSummaryRenderer.toFlag("1A"));
    }
}
