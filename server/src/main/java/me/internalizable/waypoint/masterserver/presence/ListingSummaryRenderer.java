package me.internalizable.waypoint.masterserver.presence;

import me.internalizable.waypoint.masterserver.registry.Listing;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.StringJoiner;

/**
 * Renders the public listings as a short text block.
 *
 * <pre>
 * Servers: 2 | Players: 17
 *
 * • 🇩🇪 🔒 My Server — 12/32 — survival — mp_rr_canyonlands
 * • Other — 5/16 — arena — mp_lobby
 * </pre>
 */
public final class ListingSummaryRenderer {

    public static final int MAX_LINES = 30;
    public static final int MAX_LENGTH = 4096;

    private static final String LOCK = "🔒";
    private static final int REGIONAL_INDICATOR_OFFSET = 0x1F1E6 - 'A';

    private ListingSummaryRenderer() {
    }

    /**
     * Render the given listings in order.
     *
     * @param listings listings to render
     * @return summary, at most {@link #MAX_LENGTH} characters
     */
    @Nonnull
    public static String render(@Nonnull List<Listing> listings) {
        Objects.requireNonNull(listings, "listings");

        int totalPlayers = 0;
        for (Listing listing : listings) {
            totalPlayers += listing.playerCount();
        }

        List<String> lines = new ArrayList<>();
        lines.add(listings.isEmpty()
                ? "No servers online"
                : "Servers: " + listings.size() + " | Players: " + totalPlayers);
        lines.add("");

        for (int i = 0; i < Math.min(MAX_LINES, listings.size()); i++) {
            lines.add(renderLine(listings.get(i)));
        }
        if (listings.size() > MAX_LINES) {
            lines.add("… and " + (listings.size() - MAX_LINES) + " more");
        }

        String summary = String.join("\n", lines);
        if (summary.length() <= MAX_LENGTH) {
            return summary;
        }
        // never split a surrogate pair
        int end = Character.isHighSurrogate(summary.charAt(MAX_LENGTH - 1)) ? MAX_LENGTH - 1 : MAX_LENGTH;
        return summary.substring(0, end);
    }

    private static String renderLine(Listing listing) {
        StringJoiner label = new StringJoiner(" ");
        String flag = toFlag(listing.region());
        if (!flag.isEmpty()) {
            label.add(flag);
        }
        if (listing.hasPassword()) {
            label.add(LOCK);
        }
        label.add(listing.name().isEmpty() ? "Unnamed" : listing.name());

        String playlist = listing.playlist().isEmpty() ? "unknown" : listing.playlist();
        return "• " + label + " — " + listing.playerCount() + "/" + listing.maxPlayers()
                + " — " + playlist + " — " + listing.map();
    }

    /**
     * Convert a two-letter region code to a flag emoji.
     *
     * @param region region code
     * @return flag, or an empty string if the code is not two latin letters
     */
    @Nonnull
    public static String toFlag(@Nonnull String region) {
        if (region.length() != 2) {
            return "";
        }
        String upper = region.toUpperCase();
        char first = upper.charAt(0);
        char second = upper.charAt(1);
        if (first < 'A' || first > 'Z' || second < 'A' || second > 'Z') {
            return "";
        }
        return new StringBuilder()
                .appendCodePoint(first + REGIONAL_INDICATOR_OFFSET)
                .appendCodePoint(second + REGIONAL_INDICATOR_OFFSET)
                .toString();
    }
}
