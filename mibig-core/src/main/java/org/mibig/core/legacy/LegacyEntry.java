package org.mibig.core.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.mibig.core.error.LegacyFormatException;

import java.util.List;

/**
 * Root of a MIBiG v3 document.
 *
 * <p><b>Example JSON:</b>
 * <pre>{@code
 * {
 *   "cluster": { "mibig_accession": "BGC0000001", "biosyn_class": ["Polyketide"], ... },
 *   "changelog": [
 *     { "version": "1.0", "comments": ["Submitted"], "contributors": ["AAAAAAAAAAAAAAAAAAAAAAAA"] }
 *   ],
 *   "comments": "optional free text"
 * }
 * }</pre>
 *
 * @param cluster the cluster description
 * @param changelog change history, oldest first
 * @param comments optional entry comment
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyEntry(
    @JsonProperty("cluster") LegacyCluster cluster,
    @JsonProperty("changelog") List<LegacyChange> changelog,
    @JsonProperty("comments") String comments
) {
    public LegacyEntry {
        if (cluster == null) {
            throw new LegacyFormatException("Missing 'cluster'");
        }
        if (changelog == null) {
            throw new LegacyFormatException("Missing 'changelog'");
        }
        changelog = List.copyOf(changelog);
    }
}
