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
 * Ribosomal peptide payload.
 *
 * @param subclass {@code RiPP} or {@code unmodified}
 * @param precursors precursor peptides
 * @param rippType one of {@link #VALID_RIPP_TYPES} for RiPPs, may be null
 * @param details free text, required for RiPP type "other"
 * @param peptidases peptidase genes
 */
public record Ribosomal(
    String subclass,
    List<Precursor> precursors,
    String rippType,
    String details,
    List<GeneId> peptidases
) implements ClassInfo {

    public static final String RIPP = "RiPP";
    public static final String UNMODIFIED = "unmodified";

    public static final Set<String> VALID_SUBCLASSES = Set.of(RIPP, UNMODIFIED);

    public static final Set<String> VALID_RIPP_TYPES = Set.of(
        "Atropopeptide", "Biarylitide", "Bottromycin", "Borosin", "Crocagin", "Cyanobactin",
        "Cyptide", "Dikaritin", "Epipeptide", "Glycocin", "Guanidinotide",
        "Head-to-tail cyclized peptide", "Lanthipeptide", "LAP", "Lasso peptide", "Linaridin",
        "Methanobactin", "Microcin", "Microviridin", "Mycofactocin", "Pearlin", "Proteusin",
        "Ranthipeptide", "Rotapeptide", "Ryptide", "Sactipeptide", "Spliceotide", "Streptide",
        "Sulfatyrotide", "Thioamidide", "Thiopeptide", "other"
    );

    public Ribosomal {
        precursors = precursors == null ? List.of() : List.copyOf(precursors);
        peptidases = peptidases == null ? List.of() : List.copyOf(peptidases);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (subclass == null || !VALID_SUBCLASSES.contains(subclass)) {
            errors.add(new ValidationErrorInfo("Ribosomal.subclass", "Subclass must be one of RiPP, unmodified"));
        }
        if (RIPP.equals(subclass)) {
            if (rippType == null || !VALID_RIPP_TYPES.contains(rippType)) {
                errors.add(new ValidationErrorInfo("Ribosomal.ripp_type", "Invalid RiPP type '" + rippType + "'"));
            }
            if ("other".equals(rippType) && (details == null || details.isBlank())) {
                errors.add(new ValidationErrorInfo("Ribosomal.details",
                    "Details must be provided for 'other' RiPP types"));
            }
        }
        errors.addAll(Validatable.validateAll(precursors, context));
        errors.addAll(Validatable.validateAll(peptidases, context));
        return errors;
    }

    public static Ribosomal fromJson(JsonNode node) {
        return new Ribosomal(
            JsonFields.text(node, "subclass", "Ribosomal"),
            JsonFields.requiredList(node, "precursors", "Ribosomal", Precursor::fromJson),
            JsonFields.optionalText(node, "ripp_type", "Ribosomal"),
            JsonFields.optionalText(node, "details", "Ribosomal"),
            JsonFields.list(node, "peptidases", "Ribosomal", GeneId::fromJson));
    }

    @Override
    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("subclass", subclass);
        JsonFields.putList(node, "precursors", precursors, Precursor::toJson);
        JsonFields.putIfPresent(node, "ripp_type", rippType);
        JsonFields.putIfPresent(node, "details", details);
        JsonFields.putListIfNotEmpty(node, "peptidases", peptidases, GeneId::toJson);
        return node;
    }
}
