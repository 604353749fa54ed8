package org.mibig.core.model.entry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.error.ValidationException;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.biosynthesis.Biosynthesis;
import org.mibig.core.model.changelog.ChangeLog;
import org.mibig.core.model.compound.Compound;
import org.mibig.core.model.gene.Genes;
import org.mibig.core.sequence.SequenceRecord;
import org.mibig.core.validation.QualityLevel;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Aggregate root: one curated biosynthetic gene cluster.
 *
 * <p><b>Decoding:</b></p>
 * <pre>{@code
 * MibigEntry entry = MibigEntry.decode(MibigJson.readTree(path));
 * }</pre>
 * validates against the tier stored in the document itself. Use {@link #fromJson(JsonNode)}
 * plus {@link ValidationContext#check(Validatable)} to validate against another tier.
 *
 * @param accession {@code BGC} followed by seven digits
 * @param version entry version, at least 1
 * @param changelog release history
 * @param quality curation tier
 * @param status publication status
 * @param completeness locus coverage
 * @param loci cluster loci, at least one
 * @param biosynthesis biosynthetic classification
 * @param compounds produced compounds
 * @param taxonomy producing organism
 * @param genes gene corrections and annotations, may be null
 * @param retirementReasons why the entry was retired
 * @param seeAlso related accessions
 * @param comment free text, may be null
 */
public record MibigEntry(
    String accession,
    int version,
    ChangeLog changelog,
    QualityLevel quality,
    StatusLevel status,
    CompletenessLevel completeness,
    List<Locus> loci,
    Biosynthesis biosynthesis,
    List<Compound> compounds,
    Taxonomy taxonomy,
    Genes genes,
    List<String> retirementReasons,
    List<String> seeAlso,
    String comment
) implements Validatable {

    public static final Pattern ACCESSION = Pattern.compile("^BGC\\d{7}$");

    public MibigEntry {
        Objects.requireNonNull(changelog, "changelog must not be null");
        Objects.requireNonNull(quality, "quality must not be null");
        Objects.requireNonNull(status, "status must not be null");
        Objects.requireNonNull(completeness, "completeness must not be null");
        Objects.requireNonNull(biosynthesis, "biosynthesis must not be null");
        Objects.requireNonNull(taxonomy, "taxonomy must not be null");
        loci = loci == null ? List.of() : List.copyOf(loci);
        compounds = compounds == null ? List.of() : List.copyOf(compounds);
        retirementReasons = retirementReasons == null ? List.of() : List.copyOf(retirementReasons);
        seeAlso = seeAlso == null ? List.of() : List.copyOf(seeAlso);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (accession == null || !ACCESSION.matcher(accession).matches()) {
            errors.add(new ValidationErrorInfo("MibigEntry.accession", "Invalid accession: " + accession));
        }
        if (version < 1) {
            errors.add(new ValidationErrorInfo("MibigEntry.version", "Invalid version: " + version));
        } else if (version != changelog.releases().size() + 1) {
            errors.add(new ValidationErrorInfo("MibigEntry.version", "Version " + version
                + " does not follow the changelog's " + changelog.releases().size() + " release(s)"));
        }
        if (status == StatusLevel.RETIRED && retirementReasons.isEmpty()) {
            errors.add(new ValidationErrorInfo("MibigEntry.retirement_reasons",
                "Retirement reasons must be provided for retired entries"));
        }
        if (loci.isEmpty()) {
            errors.add(new ValidationErrorInfo("MibigEntry.loci", "At least one locus is required"));
        }
        errors.addAll(changelog.validate(context));
        errors.addAll(Validatable.validateAll(loci, context));
        errors.addAll(biosynthesis.validate(context));
        errors.addAll(Validatable.validateAll(compounds, context));
        errors.addAll(taxonomy.validate(context));
        if (genes != null) {
            errors.addAll(genes.validate(context));
        }
        return errors;
    }

    /**
     * Context matching this entry's own tier.
     *
     * @param record reference record, may be null
     * @return validation context
     */
    public ValidationContext context(SequenceRecord record) {
        return new ValidationContext(quality, record);
    }

    /**
     * Decodes and validates an entry at its own quality tier.
     *
     * @param node entry document
     * @return validated entry
     * @throws ValidationException on structural or semantic violations
     */
    public static MibigEntry decode(JsonNode node) {
        return decode(node, null);
    }

    public static MibigEntry decode(JsonNode node, SequenceRecord record) {
        MibigEntry entry = fromJson(node);
        return entry.context(record).check(entry);
    }

    public static MibigEntry fromJson(JsonNode node) {
        JsonFields.object(node, "MibigEntry");
        return new MibigEntry(
            JsonFields.text(node, "accession", "MibigEntry"),
            JsonFields.integer(node, "version", "MibigEntry"),
            ChangeLog.fromJson(JsonFields.required(node, "changelog", "MibigEntry")),
            QualityLevel.fromValue(JsonFields.text(node, "quality", "MibigEntry")),
            StatusLevel.fromValue(JsonFields.text(node, "status", "MibigEntry")),
            CompletenessLevel.fromValue(JsonFields.text(node, "completeness", "MibigEntry")),
            JsonFields.requiredList(node, "loci", "MibigEntry", Locus::fromJson),
            Biosynthesis.fromJson(JsonFields.required(node, "biosynthesis", "MibigEntry")),
            JsonFields.requiredList(node, "compounds", "MibigEntry", Compound::fromJson),
            Taxonomy.fromJson(JsonFields.required(node, "taxonomy", "MibigEntry")),
            JsonFields.has(node, "genes") ? Genes.fromJson(node.get("genes")) : null,
            JsonFields.textList(node, "retirement_reasons", "MibigEntry"),
            JsonFields.textList(node, "see_also", "MibigEntry"),
            JsonFields.optionalText(node, "comment", "MibigEntry"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("accession", accession);
        node.put("version", version);
        node.set("changelog", changelog.toJson());
        node.put("quality", quality.value());
        node.put("status", status.value());
        node.put("completeness", completeness.value());
        JsonFields.putList(node, "loci", loci, Locus::toJson);
        node.set("biosynthesis", biosynthesis.toJson());
        JsonFields.putList(node, "compounds", compounds, Compound::toJson);
        node.set("taxonomy", taxonomy.toJson());
        if (genes != null) {
            node.set("genes", genes.toJson());
        }
        JsonFields.putTextListIfNotEmpty(node, "retirement_reasons", retirementReasons);
        JsonFields.putTextListIfNotEmpty(node, "see_also", seeAlso);
        JsonFields.putIfPresent(node, "comment", comment);
        return node;
    }
}
