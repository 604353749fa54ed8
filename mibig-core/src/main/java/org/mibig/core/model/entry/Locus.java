package org.mibig.core.model.entry;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Location;
import org.mibig.core.model.common.LocusEvidence;
import org.mibig.core.sequence.SequenceRecord;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A region of a sequence record holding (part of) the cluster.
 *
 * <p>With a sequence record bound to the context, the accession must equal the record id and
 * the location must lie within the record. Without one, only the accession's shape is checked.
 *
 * @param accession sequence accession, e.g. {@code JN635613.1}
 * @param location nucleotide interval
 * @param evidence how the locus boundaries were determined
 */
public record Locus(String accession, Location location, List<LocusEvidence> evidence) implements Validatable {

    /** Prefix of placeholder accessions for loci without a public sequence. */
    public static final String PLACEHOLDER_PREFIX = "MIBIG.";

    public Locus {
        Objects.requireNonNull(location, "location must not be null");
        evidence = evidence == null ? List.of() : List.copyOf(evidence);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        Optional<SequenceRecord> record = context.sequenceRecord();
        if (accession == null || accession.isBlank()) {
            errors.add(new ValidationErrorInfo("Locus.accession", "Missing accession"));
        } else if (record.isPresent()) {
            if (!record.get().id().equals(accession)) {
                errors.add(new ValidationErrorInfo("Locus.accession",
                    "Accession mismatch: " + accession + " != " + record.get().id()));
            }
        } else if (countDots(accession) > 1 && !accession.startsWith(PLACEHOLDER_PREFIX)) {
            errors.add(new ValidationErrorInfo("Locus.accession", "Invalid accession " + accession));
        }

        errors.addAll(location.validate(context));
        if (record.isPresent() && location.end() > record.get().seqLength()) {
            errors.add(new ValidationErrorInfo("Locus.location",
                "End " + location.end() + " exceeds record length " + record.get().seqLength()));
        }
        errors.addAll(Validatable.validateAll(evidence, context));
        return errors;
    }

    private static long countDots(String text) {
        return text.chars().filter(c -> c == '.').count();
    }

    public static Locus fromJson(JsonNode node) {
        JsonFields.object(node, "Locus");
        return new Locus(
            JsonFields.text(node, "accession", "Locus"),
            Location.fromJson(JsonFields.required(node, "location", "Locus")),
            JsonFields.list(node, "evidence", "Locus", LocusEvidence::fromJson));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("accession", accession);
        node.set("location", location.toJson());
        JsonFields.putList(node, "evidence", evidence, LocusEvidence::toJson);
        return node;
    }
}
