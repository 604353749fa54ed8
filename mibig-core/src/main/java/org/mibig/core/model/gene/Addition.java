package org.mibig.core.model.gene;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.NovelGeneId;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * A gene missing from the reference record.
 *
 * @param id new gene id
 * @param location genomic position
 * @param translation protein sequence, required above the questionable tier
 */
public record Addition(NovelGeneId id, GeneLocation location, String translation) implements Validatable {

    private static final Pattern AMINO_ACIDS = Pattern.compile("^[ACDEFGHIKLMNPQRSTVWY]+$");

    public Addition {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(location, "location must not be null");
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>(id.validate(context));
        errors.addAll(location.validate(context));
        if (translation == null || translation.isEmpty()) {
            if (!context.isRelaxed()) {
                errors.add(new ValidationErrorInfo("Genes.Addition.translation", "Translation must be provided"));
            }
        } else if (!AMINO_ACIDS.matcher(translation).matches()) {
            errors.add(new ValidationErrorInfo("Genes.Addition.translation", "Invalid amino acid in translation"));
        }
        return errors;
    }

    public static Addition fromJson(JsonNode node) {
        JsonFields.object(node, "Addition");
        return new Addition(
            NovelGeneId.fromJson(JsonFields.required(node, "id", "Addition")),
            GeneLocation.fromJson(JsonFields.required(node, "location", "Addition")),
            JsonFields.optionalText(node, "translation", "Addition"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.set("id", id.toJson());
        node.set("location", location.toJson());
        JsonFields.putIfPresent(node, "translation", translation);
        return node;
    }
}
