package org.mibig.core.model.compound;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Monomer;
import org.mibig.core.model.common.Smiles;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * A compound produced by the cluster.
 *
 * @param name compound name, restricted to {@link Monomer#VALID_NAME}
 * @param evidence structure elucidation evidence, required above the questionable tier
 * @param classes chemical classes
 * @param bioactivities biological activities
 * @param structure structure, may be null
 * @param synonyms alternative names
 * @param databases database cross-references, {@code databaseIds} on the wire
 * @param moieties named moieties
 * @param cyclic whether the compound is cyclic, may be null
 * @param mass monoisotopic mass, positive, may be null
 * @param formula molecular formula, may be null
 */
public record Compound(
    String name,
    List<CompoundEvidence> evidence,
    List<CompoundClass> classes,
    List<Bioactivity> bioactivities,
    Smiles structure,
    List<String> synonyms,
    List<CompoundRef> databases,
    List<String> moieties,
    Boolean cyclic,
    Double mass,
    Formula formula
) implements Validatable {

    public Compound {
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
        classes = classes == null ? List.of() : List.copyOf(classes);
        bioactivities = bioactivities == null ? List.of() : List.copyOf(bioactivities);
        synonyms = synonyms == null ? List.of() : List.copyOf(synonyms);
        databases = databases == null ? List.of() : List.copyOf(databases);
        moieties = moieties == null ? List.of() : List.copyOf(moieties);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (name == null || !Monomer.VALID_NAME.matcher(name).matches()) {
            errors.add(new ValidationErrorInfo("Compound.name", "Invalid name '" + name + "'"));
        }
        if (!context.isRelaxed() && evidence.isEmpty()) {
            errors.add(new ValidationErrorInfo("Compound.evidence", "Missing evidence"));
        }
        errors.addAll(Validatable.validateAll(evidence, context));
        errors.addAll(Validatable.validateAll(classes, context));
        errors.addAll(Validatable.validateAll(bioactivities, context));
        if (structure != null) {
            errors.addAll(structure.validate(context));
        }
        for (String synonym : synonyms) {
            if (!Monomer.VALID_NAME.matcher(synonym).matches()) {
                errors.add(new ValidationErrorInfo("Compound.synonyms", "Invalid synonym '" + synonym + "'"));
            }
        }
        errors.addAll(Validatable.validateAll(databases, context));
        for (String moiety : moieties) {
            if (!Monomer.VALID_NAME.matcher(moiety).matches()) {
                errors.add(new ValidationErrorInfo("Compound.moieties", "Invalid moiety '" + moiety + "'"));
            }
        }
        if (mass != null && mass <= 0) {
            errors.add(new ValidationErrorInfo("Compound.mass", "Invalid mass " + mass));
        }
        if (formula != null) {
            errors.addAll(formula.validate(context));
        }
        return errors;
    }

    public static Compound fromJson(JsonNode node) {
        JsonFields.object(node, "Compound");
        return new Compound(
            JsonFields.text(node, "name", "Compound"),
            JsonFields.list(node, "evidence", "Compound", CompoundEvidence::fromJson),
            JsonFields.list(node, "classes", "Compound", CompoundClass::fromJson),
            JsonFields.list(node, "bioactivities", "Compound", Bioactivity::fromJson),
            JsonFields.has(node, "structure") ? Smiles.fromJson(node.get("structure")) : null,
            JsonFields.textList(node, "synonyms", "Compound"),
            JsonFields.list(node, "databaseIds", "Compound", CompoundRef::fromJson),
            JsonFields.textList(node, "moieties", "Compound"),
            JsonFields.optionalBool(node, "cyclic", "Compound"),
            JsonFields.optionalDouble(node, "mass", "Compound"),
            JsonFields.has(node, "formula") ? Formula.fromJson(node.get("formula")) : null);
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("name", name);
        JsonFields.putList(node, "evidence", evidence, CompoundEvidence::toJson);
        JsonFields.putListIfNotEmpty(node, "classes", classes, CompoundClass::toJson);
        JsonFields.putListIfNotEmpty(node, "bioactivities", bioactivities, Bioactivity::toJson);
        if (structure != null) {
            node.set("structure", structure.toJson());
        }
        JsonFields.putTextListIfNotEmpty(node, "synonyms", synonyms);
        JsonFields.putListIfNotEmpty(node, "databaseIds", databases, CompoundRef::toJson);
        JsonFields.putTextListIfNotEmpty(node, "moieties", moieties);
        JsonFields.putIfPresent(node, "cyclic", cyclic);
        JsonFields.putIfPresent(node, "mass", mass);
        if (formula != null) {
            node.set("formula", formula.toJson());
        }
        return node;
    }
}
