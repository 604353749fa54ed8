package org.mibig.core.model.biosynthesis.classes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.common.Monomer;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Polyketide synthase payload.
 *
 * @param subclass one of {@link #VALID_SUBCLASSES}
 * @param cyclases cyclase genes
 * @param starterUnit starter unit, may be null
 * @param ketideLength number of ketide units, may be null
 * @param iterative whether the synthase is iterative, may be null
 */
public record Pks(
    String subclass,
    List<GeneId> cyclases,
    Monomer starterUnit,
    Integer ketideLength,
    Boolean iterative
) implements ClassInfo {

    public static final Set<String> VALID_SUBCLASSES = Set.of(
        "Type I",
        "Type II aromatic",
        "Type II highly reducing",
        "Type II arylpolyene",
        "Type III"
    );

    public Pks {
        cyclases = cyclases == null ? List.of() : List.copyOf(cyclases);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (subclass == null || !VALID_SUBCLASSES.contains(subclass)) {
            errors.add(new ValidationErrorInfo("PKS.subclass", "Invalid subclass '" + subclass + "'"));
        }
        errors.addAll(Validatable.validateAll(cyclases, context));
        if (starterUnit != null) {
            errors.addAll(starterUnit.validate(context));
        }
        if (ketideLength != null && ketideLength < 1) {
            errors.add(new ValidationErrorInfo("PKS.ketide_length", "Invalid ketide length " + ketideLength));
        }
        return errors;
    }

    @Override
    public List<Citation> references() {
        return starterUnit == null ? List.of() : starterUnit.references();
    }

    public static Pks fromJson(JsonNode node) {
        return new Pks(
            JsonFields.text(node, "subclass", "PKS"),
            JsonFields.list(node, "cyclases", "PKS", GeneId::fromJson),
            JsonFields.has(node, "starter_unit") ? Monomer.fromJson(node.get("starter_unit")) : null,
            JsonFields.optionalInteger(node, "ketide_length", "PKS"),
            JsonFields.optionalBool(node, "iterative", "PKS"));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("subclass", subclass);
        JsonFields.putList(node, "cyclases", cyclases, GeneId::toJson);
        if (starterUnit != null) {
            node.set("starter_unit", starterUnit.toJson());
        }
        JsonFields.putIfPresent(node, "ketide_length", ketideLength);
        JsonFields.putIfPresent(node, "iterative", iterative);
        return node;
    }
}
