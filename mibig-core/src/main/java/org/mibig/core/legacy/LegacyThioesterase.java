package org.mibig.core.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param gene gene id
 * @param thioesteraseType {@code Type I}, {@code Type II} or {@code Unknown}
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyThioesterase(
    @JsonProperty("gene") String gene,
    @JsonProperty("thioesterase_type") String thioesteraseType
) {
    public static final String UNKNOWN = "Unknown";
}
