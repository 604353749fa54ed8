package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.Evidence;
import org.mibig.core.model.common.SubstrateEvidence;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Type-specific payload of a {@link Domain}.
 *
 * <p>Every payload exposes the same capability surface (references, evidence, substrates),
 * returning empty lists where a domain kind has no such data. Payloads encode to a flat JSON
 * object that is merged into the enclosing domain object.
 */
public interface DomainInfo extends Validatable {

    /**
     * @return citations owned directly by the payload
     */
    List<Citation> references();

    default List<SubstrateEvidence> evidence() {
        return List.of();
    }

    default List<? extends Substrate> substrates() {
        return List.of();
    }

    /**
     * @return own citations plus those of the evidence, deduplicated and sorted
     */
    default List<Citation> allReferences() {
        Set<Citation> all = new TreeSet<>(references());
        all.addAll(Evidence.referencesOf(evidence()));
        return List.copyOf(all);
    }

    ObjectNode toJson();

    // ==================== Shared rules ====================

    /**
     * Checks an optional subtype against a closed vocabulary.
     */
    static List<ValidationErrorInfo> checkSubtype(String kind, String subtype, Set<String> validSubtypes) {
        if (subtype != null && !subtype.isEmpty() && !validSubtypes.contains(subtype)) {
            return List.of(new ValidationErrorInfo(kind + ".subtype", "Invalid subtype '" + subtype + "'"));
        }
        return List.of();
    }

    /**
     * Substrates must be backed by evidence above the questionable tier.
     */
    static List<ValidationErrorInfo> checkSubstrateEvidence(String kind, List<?> substrates,
                                                            List<SubstrateEvidence> evidence,
                                                            ValidationContext context) {
        if (!substrates.isEmpty() && evidence.isEmpty() && !context.isRelaxed()) {
            return List.of(new ValidationErrorInfo(kind + ".evidence", "Substrates require evidence"));
        }
        return List.of();
    }
}
