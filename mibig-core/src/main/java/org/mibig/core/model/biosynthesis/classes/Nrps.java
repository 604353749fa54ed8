package org.mibig.core.model.biosynthesis.classes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.domain.Domain;
import org.mibig.core.model.domain.DomainType;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Non-ribosomal peptide synthetase payload.
 *
 * @param subclass one of {@link #VALID_SUBCLASSES}
 * @param releaseTypes release mechanisms
 * @param thioesterases thioesterase domains
 */
public record Nrps(String subclass, List<ReleaseType> releaseTypes, List<Domain> thioesterases) implements ClassInfo {

    public static final Set<String> VALID_SUBCLASSES = Set.of(
        "Type I", "Type II", "Type III", "Type IV", "Type V", "Type VI");

    public Nrps {
        releaseTypes = releaseTypes == null ? List.of() : List.copyOf(releaseTypes);
        thioesterases = thioesterases == null ? List.of() : List.copyOf(thioesterases);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (subclass == null || !VALID_SUBCLASSES.contains(subclass)) {
            errors.add(new ValidationErrorInfo("NRPS.subclass", "Invalid subclass '" + subclass + "'"));
        }
        errors.addAll(Validatable.validateAll(releaseTypes, context));
        for (Domain thioesterase : thioesterases) {
            if (thioesterase.type() != DomainType.THIOESTERASE) {
                errors.add(new ValidationErrorInfo("NRPS.thioesterases",
                    "Expected a thioesterase domain, not " + thioesterase.type().value()));
            }
        }
        errors.addAll(Validatable.validateAll(thioesterases, context));
        return errors;
    }

    @Override
    public List<Citation> references() {
        List<Citation> references = new ArrayList<>();
        releaseTypes.forEach(releaseType -> references.addAll(releaseType.references()));
        thioesterases.forEach(thioesterase -> references.addAll(thioesterase.references()));
        return references;
    }

    public static Nrps fromJson(JsonNode node) {
        return new Nrps(
            JsonFields.text(node, "subclass", "NRPS"),
            JsonFields.list(node, "release_types", "NRPS", ReleaseType::fromJson),
            JsonFields.list(node, "thioesterases", "NRPS", Domain::fromJson));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("subclass", subclass);
        JsonFields.putListIfNotEmpty(node, "release_types", releaseTypes, ReleaseType::toJson);
        JsonFields.putListIfNotEmpty(node, "thioesterases", thioesterases, Domain::toJson);
        return node;
    }
}
