package me.internalizable.waypoint.api.masterserver;

import javax.annotation.Nonnull;
import java.util.Objects;

/**
 * A mod enabled on a game server.
 *
 * @param id mod identifier
 * @param name display name
 * @param author mod author
 * @param version mod version
 * @param thunderstoreId Thunderstore package identifier
 * @param description short description
 */
public record ModInfo(
        @Nonnull String id,
        @Nonnull String name,
        @Nonnull String author,
        @Nonnull String version,
        @Nonnull String thunderstoreId,
        @Nonnull String description
) {

    public ModInfo {
        id = trim(id);
        name = trim(name);
        author = trim(author);
        version = trim(version);
        thunderstoreId = trim(thunderstoreId);
        description = trim(description);
    }

    /**
     * Check if the mod carries both an id and a name.
     *
     * @return true if usable in a listing
     */
    public boolean isValid() {
        return !id.isEmpty() && !name.isEmpty();
    }

    private static String trim(String value) {
        return Objects.requireNonNullElse(value, "").trim();
    }
}
