package org.mibig.core.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Non-canonical behaviour of an NRPS or PKS module.
 *
 * @param evidence evidence methods
 * @param iterated whether the module is used more than once
 * @param nonElongating whether the module does not extend the chain
 * @param skipped whether the module is skipped
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyNonCanonical(
    @JsonProperty("evidence") List<String> evidence,
    @JsonProperty("iterated") Boolean iterated,
    @JsonProperty("non_elongating") Boolean nonElongating,
    @JsonProperty("skipped") Boolean skipped
) {
    public LegacyNonCanonical {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }
}
