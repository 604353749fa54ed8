package org.mibig.core.model.gene;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Location;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Genomic position of an added gene.
 *
 * @param exons exon intervals, at least one
 * @param strand {@code 1} or {@code -1}
 */
public record GeneLocation(List<Location> exons, int strand) implements Validatable {

    public GeneLocation {
        exons = exons == null ? List.of() : List.copyOf(exons);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (exons.isEmpty()) {
            errors.add(new ValidationErrorInfo("GeneLocation.exons", "At least one exon must be provided"));
        }
        errors.addAll(Validatable.validateAll(exons, context));
        if (strand != 1 && strand != -1) {
            errors.add(new ValidationErrorInfo("GeneLocation.strand", "Strand must be either -1 or 1"));
        }
        return errors;
    }

    public static GeneLocation fromJson(JsonNode node) {
        JsonFields.object(node, "GeneLocation");
        return new GeneLocation(
            JsonFields.requiredList(node, "exons", "GeneLocation", Location::fromJson),
            JsonFields.integer(node, "strand", "GeneLocation"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putList(node, "exons", exons, Location::toJson);
        node.put("strand", strand);
        return node;
    }
}
