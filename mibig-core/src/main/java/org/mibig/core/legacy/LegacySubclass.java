package org.mibig.core.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Class sub-object that only carries a subclass ({@code alkaloid}, {@code other}).
 *
 * @param subclass free-text subclass, optional
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacySubclass(@JsonProperty("subclass") String subclass) {}
