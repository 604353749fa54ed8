package org.mibig.core.model.biosynthesis.classes;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.common.Location;
import org.mibig.core.sequence.CodingSequence;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Precursor peptide of a RiPP.
 *
 * @param gene precursor gene
 * @param coreSequence core peptide sequence
 * @param leaderCleavageLocation leader cleavage site, may be null
 * @param followerCleavageLocation follower cleavage site, may be null
 * @param crosslinks residue crosslinks
 * @param recognitionMotif recognition motif, may be null
 */
public record Precursor(
    GeneId gene,
    String coreSequence,
    Location leaderCleavageLocation,
    Location followerCleavageLocation,
    List<Crosslink> crosslinks,
    String recognitionMotif
) implements Validatable {

    public Precursor {
        Objects.requireNonNull(gene, "gene must not be null");
        crosslinks = crosslinks == null ? List.of() : List.copyOf(crosslinks);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>(gene.validate(context));
        if (coreSequence == null || coreSequence.isBlank()) {
            errors.add(new ValidationErrorInfo("Precursor.core_sequence", "Missing core sequence"));
        }
        CodingSequence cds = context.cds(gene.value()).orElse(null);
        if (leaderCleavageLocation != null) {
            errors.addAll(leaderCleavageLocation.validate(context, cds));
        }
        if (followerCleavageLocation != null) {
            errors.addAll(followerCleavageLocation.validate(context, cds));
        }
        crosslinks.forEach(crosslink -> errors.addAll(crosslink.validate(cds)));
        return errors;
    }

    public static Precursor fromJson(JsonNode node) {
        JsonFields.object(node, "Precursor");
        return new Precursor(
            GeneId.fromJson(JsonFields.required(node, "gene", "Precursor")),
            JsonFields.text(node, "core_sequence", "Precursor"),
            JsonFields.has(node, "leader_cleavage_location")
                ? Location.fromJson(node.get("leader_cleavage_location")) : null,
            JsonFields.has(node, "follower_cleavage_location")
                ? Location.fromJson(node.get("follower_cleavage_location")) : null,
            JsonFields.list(node, "crosslinks", "Precursor", Crosslink::fromJson),
            JsonFields.optionalText(node, "recognition_motif", "Precursor"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.set("gene", gene.toJson());
        node.put("core_sequence", coreSequence);
        JsonFields.putListIfNotEmpty(node, "crosslinks", crosslinks, Crosslink::toJson);
        if (leaderCleavageLocation != null) {
            node.set("leader_cleavage_location", leaderCleavageLocation.toJson());
        }
        if (followerCleavageLocation != null) {
            node.set("follower_cleavage_location", followerCleavageLocation.toJson());
        }
        JsonFields.putIfPresent(node, "recognition_motif", recognitionMotif);
        return node;
    }
}
