package org.mibig.core.model.compound;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chemical class of a compound, named by its second-level term.
 *
 * @param value subclass name, e.g. {@code "Lipopeptide"}
 */
public record CompoundClass(String value) implements Validatable {

    /** Top-level classes and their subclasses. */
    public static final Map<String, List<String>> TAXONOMY = taxonomy();

    private static Map<String, List<String>> taxonomy() {
        Map<String, List<String>> classes = new LinkedHashMap<>();
        classes.put("Alkaloid", List.of(
            "Amination reaction-derived", "Anthranilic acid-derived", "Arginine-derived",
            "Guanidine-derived", "Histidine-derived", "Lysine-derived", "Nicotinic acid-derived",
            "Ornithine-derived", "Peptide alkaloid", "Proline-derived", "Purine alkaloid",
            "Serine-derived", "Steroidal alkaloid", "Tetramate alkaloid", "Terpenoid-alkaloid",
            "Tryptophan-derived", "Tyrosine-derived"));
        classes.put("Shikimic acid-derived", List.of(
            "Aromatic amino acid/simple benzoic acid", "Aromatic polyketide", "Phenylpropanoid",
            "Terpenoid quinone"));
        classes.put("Acetate-derived", List.of(
            "Alkylresorcinol/phloroglucinol polyketide", "Chromane polyketide", "Cyclic polyketide",
            "Fatty acid", "Fatty acid derivate", "Linear polyketide", "Macrocyclic polyketide",
            "Naphthalene polyketide", "Polycyclic polyketide", "Polyether polyketide",
            "Xanthone polyketide"));
        classes.put("Isoprene-derived", List.of(
            "Atypical terpenoid", "Diterpenoid", "Hemiterpenoid", "Higher terpenoid", "Iridoid",
            "Meroterpenoid", "Monoterpenoid", "Sesquiterpenoid", "Steroid"));
        classes.put("Peptide", List.of(
            "Beta-lactam", "Depsipeptide", "Diketopiperazine", "Glycopeptide", "Glycopeptidolipid",
            "Linear", "Lipopeptide", "Macrocyclic"));
        classes.put("Carbohydrates", List.of(
            "Monosaccharide", "Oligosaccharide", "Polysaccharide", "Nucleoside", "Aminoglycoside",
            "Liposaccharide", "Glucosinolate"));
        classes.put("Glycolysis-derived", List.of("Butenolide", "Butyrolactone", "Tetronic acid"));
        classes.put("Other", List.of("Lactone", "Ectoine", "Furan", "Phosphonate"));
        return Map.copyOf(classes);
    }

    /**
     * @return top-level class of this subclass, empty when unknown
     */
    public Optional<String> parent() {
        return TAXONOMY.entrySet().stream()
            .filter(entry -> entry.getValue().contains(value))
            .map(Map.Entry::getKey)
            .findFirst();
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        if (parent().isEmpty()) {
            return List.of(new ValidationErrorInfo("Compound.classes", "Invalid compound class '" + value + "'"));
        }
        return List.of();
    }

    public static CompoundClass fromJson(JsonNode node) {
        return new CompoundClass(JsonFields.asText(node, "CompoundClass"));
    }

    public JsonNode toJson() {
        return JsonFields.textNode(value);
    }
}
