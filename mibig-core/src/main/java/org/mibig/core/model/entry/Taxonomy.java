package org.mibig.core.model.entry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.sequence.SequenceRecord;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Producing organism.
 *
 * @param name organism name
 * @param ncbiTaxId NCBI taxonomy id
 */
public record Taxonomy(String name, int ncbiTaxId) implements Validatable {

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add(new ValidationErrorInfo("Taxonomy.name", "Missing organism name"));
        }
        Optional<SequenceRecord> record = context.sequenceRecord();
        if (record.isPresent()) {
            record.get().organism()
                .filter(organism -> !organism.equals(name))
                .ifPresent(organism -> errors.add(new ValidationErrorInfo("Taxonomy.name",
                    "Name mismatch: " + name + " != " + organism)));
            record.get().ncbiTaxId()
                .filter(taxId -> taxId != ncbiTaxId)
                .ifPresent(taxId -> errors.add(new ValidationErrorInfo("Taxonomy.ncbi_tax_id",
                    "NCBI Tax ID mismatch: " + ncbiTaxId + " != " + taxId)));
        }
        return errors;
    }

    public static Taxonomy fromJson(JsonNode node) {
        JsonFields.object(node, "Taxonomy");
        return new Taxonomy(
            JsonFields.text(node, "name", "Taxonomy"),
            JsonFields.integer(node, "ncbiTaxId", "Taxonomy"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("name", name);
        node.put("ncbiTaxId", ncbiTaxId);
        return node;
    }
}
