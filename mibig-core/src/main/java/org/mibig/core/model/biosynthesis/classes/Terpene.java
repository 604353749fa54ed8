package org.mibig.core.model.biosynthesis.classes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Terpene payload.
 *
 * @param subclass one of {@link #VALID_SUBCLASSES}
 * @param prenyltransferases prenyltransferase genes
 * @param synthases terpene synthase genes
 * @param precursor one of {@link #VALID_PRECURSORS}, may be null
 */
public record Terpene(
    String subclass,
    List<GeneId> prenyltransferases,
    List<GeneId> synthases,
    String precursor
) implements ClassInfo {

    public static final Set<String> VALID_SUBCLASSES = Set.of(
        "Diterpene", "Hemiterpene", "Monoterpene", "Sesquiterpene", "Triterpene");

    public static final Set<String> VALID_PRECURSORS = Set.of("DMAPP", "FPP", "GGPP", "GPP", "IPP");

    public Terpene {
        prenyltransferases = prenyltransferases == null ? List.of() : List.copyOf(prenyltransferases);
        synthases = synthases == null ? List.of() : List.copyOf(synthases);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (subclass == null || !VALID_SUBCLASSES.contains(subclass)) {
            errors.add(new ValidationErrorInfo("Terpene.subclass", "Invalid subclass '" + subclass + "'"));
        }
        errors.addAll(Validatable.validateAll(prenyltransferases, context));
        errors.addAll(Validatable.validateAll(synthases, context));
        if (precursor != null && !VALID_PRECURSORS.contains(precursor)) {
            errors.add(new ValidationErrorInfo("Terpene.precursor", "Invalid precursor '" + precursor + "'"));
        }
        return errors;
    }

    public static Terpene fromJson(JsonNode node) {
        return new Terpene(
            JsonFields.text(node, "subclass", "Terpene"),
            JsonFields.list(node, "prenyltransferases", "Terpene", GeneId::fromJson),
            JsonFields.list(node, "synthases", "Terpene", GeneId::fromJson),
            JsonFields.optionalText(node, "precursor", "Terpene"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("subclass", subclass);
        JsonFields.putListIfNotEmpty(node, "prenyltransferases", prenyltransferases, GeneId::toJson);
        JsonFields.putListIfNotEmpty(node, "synthases", synthases, GeneId::toJson);
        JsonFields.putIfPresent(node, "precursor", precursor);
        return node;
    }
}
