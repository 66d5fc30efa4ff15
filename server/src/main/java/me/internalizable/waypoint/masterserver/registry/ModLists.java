package me.internalizable.waypoint.masterserver.registry;

import me.internalizable.waypoint.api.masterserver.ModInfo;

import javax.annotation.Nonnull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Normalisation of the mod lists carried by a listing.
 */
public final class ModLists {

    private ModLists() {
    }

    /**
     * Trim, drop empty ids and deduplicate, keeping first-seen order.
     *
     * @param requiredMods submitted mod ids
     * @return normalised ids
     */
    @Nonnull
    public static List<String> normalizeRequired(@Nonnull Collection<String> requiredMods) {
        Set<String> ids = new LinkedHashSet<>();
        for (String mod : requiredMods) {
            if (mod == null) {
                continue;
            }
            String trimmed = mod.trim();
            if (!trimmed.isEmpty()) {
                ids.add(trimmed);
            }
        }
        return new ArrayList<>(ids);
    }

    /**
     * Drop mods without an id or a name.
     *
     * @param enabledMods submitted mods
     * @return usable mods
     */
    @Nonnull
    public static List<ModInfo> normalizeEnabled(@Nonnull Collection<ModInfo> enabledMods) {
        List<ModInfo> mods = new ArrayList<>();
        for (ModInfo mod : enabledMods) {
            if (mod != null && mod.isValid()) {
                mods.add(mod);
            }
        }
        return mods;
    }

    /**
     * Fill in required mods from the enabled mods when only the latter were sent.
     *
     * @param requiredMods normalised required ids
     * @param enabledMods normalised enabled mods
     * @return required ids to store
     */
    @Nonnull
    public static List<String> resolveRequired(@Nonnull List<String> requiredMods, @Nonnull List<ModInfo> enabledMods) {
        if (!requiredMods.isEmpty() || enabledMods.isEmpty()) {
            return requiredMods;
        }
        List<String> ids = new ArrayList<>();
        for (ModInfo mod : enabledMods) {
            ids.add(mod.id());
        }
        return normalizeRequired(ids);
    }
}
