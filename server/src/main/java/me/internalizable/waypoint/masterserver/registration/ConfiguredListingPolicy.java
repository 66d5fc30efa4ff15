package me.internalizable.waypoint.masterserver.registration;

import me.internalizable.waypoint.masterserver.config.MasterServerConfig;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Listing policy backed by the {@code policy} section of the configuration.
 *
 * <p>An empty supported-version list accepts every version.</p>
 */
public class ConfiguredListingPolicy implements ListingPolicy {

    private final Set<String> supportedVersions;
    private final Set<String> realTypeVersions;
    private final Set<String> checksumEnforcedVersions;
    private final Map<String, Set<Long>> acceptedChecksums = new HashMap<>();
    private final String updateUrl;

    public ConfiguredListingPolicy(@Nonnull MasterServerConfig.PolicyConfig config) {
        Objects.requireNonNull(config, "config");
        this.supportedVersions = copy(config.getSupportedVersions());
        this.realTypeVersions = copy(config.getRealTypeVersions());
        this.checksumEnforcedVersions = copy(config.getChecksumEnforcedVersions());
        this.updateUrl = Objects.requireNonNullElse(config.getUpdateUrl(), "");

        if (config.getAcceptedChecksums() != null) {
            config.getAcceptedChecksums().forEach((version, checksums) -> {
                Set<Long> values = new HashSet<>();
                if (checksums != null) {
                    // YAML yields Integer for small values
                    for (Object checksum : checksums) {
                        if (checksum instanceof Number number) {
                            values.add(number.longValue());
                        }
                    }
                }
                if (version != null) {
                    acceptedChecksums.put(version, values);
                }
            });
        }
    }

    private static Set<String> copy(@Nullable List<String> values) {
        if (values == null) {
            return Set.of();
        }
        // blank YAML list items load as null
        return values.stream()
                .filter(Objects::nonNull)
                .collect(Collectors.toUnmodifiableSet());
    }

    @Override
    public boolean isVersionSupported(@Nonnull String version) {
        return supportedVersions.isEmpty() || supportedVersions.contains(version);
    }

    @Override
    public boolean isChecksumEnforced(@Nonnull String version) {
        return checksumEnforcedVersions.contains(version);
    }

    @Override
    public boolean isChecksumAccepted(@Nonnull String version, long checksum) {
        return acceptedChecksums.getOrDefault(version, Set.of()).contains(checksum);
    }

    @Override
    @Nonnull
    public String getUpdateUrl() {
        return updateUrl;
    }

    @Override
    public boolean usesRealTypes(@Nullable String version) {
        return version != null && realTypeVersions.contains(version);
    }
}
