package org.mibig.core.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.mibig.core.error.LegacyFormatException;

import java.util.List;

/**
 * One release block of a v3 changelog.
 *
 * <p>The three lists run in parallel but were edited by hand for years, so their lengths do not
 * always agree. {@code updated_at} only exists on later releases.
 *
 * @param comments change comments
 * @param contributors contributor ids
 * @param version MIBiG release, dotted numbers or {@code "next"}
 * @param updatedAt ISO timestamps, optional
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyChange(
    @JsonProperty("comments") List<String> comments,
    @JsonProperty("contributors") List<String> contributors,
    @JsonProperty("version") String version,
    @JsonProperty("updated_at") List<String> updatedAt
) {
    public static final String NEXT = "next";

    public LegacyChange {
        comments = comments == null ? List.of() : List.copyOf(comments);
        contributors = contributors == null ? List.of() : List.copyOf(contributors);
        updatedAt = updatedAt == null ? null : List.copyOf(updatedAt);
        if (version == null) {
            throw new LegacyFormatException("Changelog entry without a version");
        }
        if (!NEXT.equals(version) && !version.matches("\\d+(\\.\\d+)*")) {
            throw new LegacyFormatException("Invalid changelog version '" + version + "'");
        }
    }

    public boolean isNext() {
        return NEXT.equals(version);
    }

    public boolean hasTimestamps() {
        return updatedAt != null && !updatedAt.isEmpty();
    }
}
