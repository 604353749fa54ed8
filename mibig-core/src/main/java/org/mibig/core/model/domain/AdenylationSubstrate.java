package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Smiles;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Amino acid activated by an adenylation domain.
 *
 * <p>A proteinogenic substrate without an explicit structure gets the structure of the matching
 * standard amino acid.
 *
 * @param name substrate name
 * @param proteinogenic whether the substrate is one of the 20 standard amino acids
 * @param structure structure, filled in for known proteinogenic names
 */
public record AdenylationSubstrate(String name, boolean proteinogenic, Smiles structure)
    implements Substrate, Validatable {

    /** SMILES of the 20 standard amino acids, keyed by lowercase name. */
    public static final Map<String, String> PROTEINOGENIC_SUBSTRATES = Map.ofEntries(
        Map.entry("alanine", "NC(C)C(=O)O"),
        Map.entry("arginine", "NC(CCCNC(N)=N)C(=O)O"),
        Map.entry("asparagine", "NC(CC(=O)N)C(=O)O"),
        Map.entry("aspartic acid", "NC(CC(=O)O)C(=O)O"),
        Map.entry("cysteine", "NC(CS)C(=O)O"),
        Map.entry("glutamine", "NC(CCC(=O)N)C(=O)O"),
        Map.entry("glutamic acid", "NC(CCC(=O)O)C(=O)O"),
        Map.entry("glycine", "NCC(=O)O"),
        Map.entry("histidine", "NC(CC1=CNC=N1)C(=O)O"),
        Map.entry("isoleucine", "NC(C(C)CC)C(=O)O"),
        Map.entry("leucine", "NC(CC(C)C)C(=O)O"),
        Map.entry("lysine", "NC(CCCCN)C(=O)O"),
        Map.entry("methionine", "NC(CCSC)C(=O)O"),
        Map.entry("phenylalanine", "NC(Cc1ccccc1)C(=O)O"),
        Map.entry("proline", "N1C(CCC1)C(=O)O"),
        Map.entry("serine", "NC(CO)C(=O)O"),
        Map.entry("threonine", "NC(C(O)C)C(=O)O"),
        Map.entry("tryptophan", "NC(CC1=CNc2c1cccc2)C(=O)O"),
        Map.entry("tyrosine", "NC(Cc1ccc(O)cc1)C(=O)O"),
        Map.entry("valine", "NC(C(C)C)C(=O)O")
    );

    public AdenylationSubstrate {
        if (proteinogenic && structure == null && name != null) {
            String known = PROTEINOGENIC_SUBSTRATES.get(name.toLowerCase(Locale.ROOT));
            if (known != null) {
                structure = new Smiles(known);
            }
        }
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add(new ValidationErrorInfo("AdenylationSubstrate.name", "Missing name"));
        } else if (proteinogenic && !PROTEINOGENIC_SUBSTRATES.containsKey(name.toLowerCase(Locale.ROOT))) {
            errors.add(new ValidationErrorInfo("AdenylationSubstrate.name",
                "'" + name + "' is not a proteinogenic amino acid"));
        }
        if (structure != null) {
            errors.addAll(structure.validate(context));
        }
        return errors;
    }

    public static AdenylationSubstrate fromJson(JsonNode node) {
        JsonFields.object(node, "AdenylationSubstrate");
        return new AdenylationSubstrate(
            JsonFields.text(node, "name", "AdenylationSubstrate"),
            JsonFields.bool(node, "proteinogenic", "AdenylationSubstrate"),
            JsonFields.has(node, "structure") ? Smiles.fromJson(node.get("structure")) : null);
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("name", name);
        node.put("proteinogenic", proteinogenic);
        if (structure != null) {
            node.set("structure", structure.toJson());
        }
        return node;
    }
}
