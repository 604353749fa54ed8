package org.mibig.core.model.biosynthesis.classes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.GTEvidence;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.common.Smiles;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A glycosyltransferase and the sugar it transfers.
 *
 * @param gene glycosyltransferase gene
 * @param evidence supporting evidence
 * @param specificity transferred sugar, may be null
 */
public record Glycosyltransferase(GeneId gene, List<GTEvidence> evidence, Smiles specificity) implements Validatable {

    /**
     * Specificity of migrated glycosyltransferases. Legacy records only name the sugar, so the
     * structure stays a visible marker until curated.
     */
    public static final Smiles UNMIGRATED_SPECIFICITY = new Smiles("[To][Do]");

    public Glycosyltransferase {
        Objects.requireNonNull(gene, "gene must not be null");
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    public boolean hasUnmigratedSpecificity() {
        return UNMIGRATED_SPECIFICITY.equals(specificity);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>(gene.validate(context));
        errors.addAll(Validatable.validateAll(evidence, context));
        if (specificity != null) {
            errors.addAll(specificity.validate(context));
        }
        if (hasUnmigratedSpecificity() && !context.isRelaxed()) {
            errors.add(new ValidationErrorInfo("Glycosyltransferase.specificity",
                "Specificity was not migrated from v3 and must be curated"));
        }
        return errors;
    }

    public static Glycosyltransferase fromJson(JsonNode node) {
        JsonFields.object(node, "Glycosyltransferase");
        return new Glycosyltransferase(
            GeneId.fromJson(JsonFields.required(node, "gene", "Glycosyltransferase")),
            JsonFields.list(node, "evidence", "Glycosyltransferase", GTEvidence::fromJson),
            JsonFields.has(node, "specificity") ? Smiles.fromJson(node.get("specificity")) : null);
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.set("gene", gene.toJson());
        JsonFields.putList(node, "evidence", evidence, GTEvidence::toJson);
        if (specificity != null) {
            node.set("specificity", specificity.toJson());
        }
        return node;
    }
}
