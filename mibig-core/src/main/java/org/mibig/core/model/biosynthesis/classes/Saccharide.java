package org.mibig.core.model.biosynthesis.classes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.Evidence;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Saccharide payload.
 *
 * @param subclass free-text subclass, may be null
 * @param glycosyltransferases glycosyltransferases
 * @param subclusters subclusters
 */
public record Saccharide(
    String subclass,
    List<Glycosyltransferase> glycosyltransferases,
    List<Subcluster> subclusters
) implements ClassInfo {

    public Saccharide {
        glycosyltransferases = glycosyltransferases == null ? List.of() : List.copyOf(glycosyltransferases);
        subclusters = subclusters == null ? List.of() : List.copyOf(subclusters);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>(Validatable.validateAll(subclusters, context));
        errors.addAll(Validatable.validateAll(glycosyltransferases, context));
        return errors;
    }

    @Override
    public List<Citation> references() {
        List<Citation> references = new ArrayList<>();
        subclusters.forEach(subcluster -> references.addAll(subcluster.references()));
        glycosyltransferases.forEach(gt -> references.addAll(Evidence.referencesOf(gt.evidence())));
        return references.stream().distinct().sorted().toList();
    }

    public static Saccharide fromJson(JsonNode node) {
        return new Saccharide(
            JsonFields.optionalText(node, "subclass", "Saccharide"),
            JsonFields.requiredList(node, "glycosyltransferases", "Saccharide", Glycosyltransferase::fromJson),
            JsonFields.list(node, "subclusters", "Saccharide", Subcluster::fromJson));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putIfPresent(node, "subclass", subclass);
        JsonFields.putList(node, "glycosyltransferases", glycosyltransferases, Glycosyltransferase::toJson);
        JsonFields.putListIfNotEmpty(node, "subclusters", subclusters, Subcluster::toJson);
        return node;
    }
}
