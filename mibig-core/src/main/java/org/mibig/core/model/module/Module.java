package org.mibig.core.model.module;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.Evidence;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.common.Monomer;
import org.mibig.core.model.domain.Domain;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An assembly-line module, possibly spanning several genes.
 *
 * <p>Wire form flattens the payload next to the common fields:
 * <pre>{@code
 * {"type": "nrps-type1", "name": "M1", "genes": ["tycA"], "active": true,
 *  "a_domain": {...}, "carriers": [...]}
 * }</pre>
 *
 * @param type module architecture, fixes the payload type
 * @param name module name, unique within a cluster
 * @param genes genes the module spans, in order
 * @param active whether the module is active
 * @param extraInfo architecture-specific payload
 * @param integratedMonomers monomers incorporated by this module
 * @param nonCanonicalActivity deviation from colinearity, may be null
 * @param comment free text, may be null
 */
public record Module(
    ModuleType type,
    String name,
    List<GeneId> genes,
    boolean active,
    ModuleInfo extraInfo,
    List<Monomer> integratedMonomers,
    NonCanonicalActivity nonCanonicalActivity,
    String comment
) implements Validatable {

    public Module {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(extraInfo, "extraInfo must not be null");
        genes = genes == null ? List.of() : List.copyOf(genes);
        integratedMonomers = integratedMonomers == null ? List.of() : List.copyOf(integratedMonomers);
    }

    public Module(ModuleType type, String name, List<GeneId> genes, boolean active, ModuleInfo extraInfo) {
        this(type, name, genes, active, extraInfo, List.of(), null, null);
    }

    /**
     * Returns a copy spanning one more gene.
     *
     * @param gene gene appended to the span
     * @return new module
     */
    public Module withGene(GeneId gene) {
        List<GeneId> extended = new ArrayList<>(genes);
        extended.add(gene);
        return new Module(type, name, extended, active, extraInfo, integratedMonomers, nonCanonicalActivity, comment);
    }

    public List<Domain> domains() {
        return extraInfo.allDomains();
    }

    /**
     * Collects every citation of the module's domains, monomers and annotations.
     */
    public List<Citation> references() {
        List<Citation> references = new ArrayList<>();
        extraInfo.allDomains().forEach(domain -> references.addAll(domain.references()));
        integratedMonomers.forEach(monomer -> references.addAll(monomer.references()));
        if (nonCanonicalActivity != null) {
            references.addAll(Evidence.referencesOf(nonCanonicalActivity.evidence()));
        }
        return references.stream().distinct().sorted().toList();
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (name == null || name.isBlank()) {
            errors.add(new ValidationErrorInfo("Module.name", "Missing module name"));
        }
        if (genes.isEmpty()) {
            errors.add(new ValidationErrorInfo("Module.genes", "Modules require at least one gene"));
        }
        if (!type.payloadType().isInstance(extraInfo)) {
            errors.add(new ValidationErrorInfo("Module.extra_info",
                "Payload " + extraInfo.getClass().getSimpleName() + " does not match module type " + type.value()));
        }
        errors.addAll(extraInfo.validate(context));
        errors.addAll(Validatable.validateAll(integratedMonomers, context));
        errors.addAll(Validatable.validateAll(genes, context));
        if (nonCanonicalActivity != null) {
            errors.addAll(nonCanonicalActivity.validate(context));
        }
        return errors;
    }

    public static Module fromJson(JsonNode node) {
        JsonFields.object(node, "Module");
        ModuleType type = ModuleType.fromValue(JsonFields.text(node, "type", "Module"));
        NonCanonicalActivity nca = JsonFields.has(node, "non_canonical_activity")
            ? NonCanonicalActivity.fromJson(node.get("non_canonical_activity"))
            : null;
        return new Module(
            type,
            JsonFields.text(node, "name", "Module"),
            JsonFields.requiredList(node, "genes", "Module", GeneId::fromJson),
            JsonFields.bool(node, "active", "Module"),
            type.readPayload(node),
            JsonFields.list(node, "integrated_monomers", "Module", Monomer::fromJson),
            nca,
            JsonFields.optionalText(node, "comment", "Module"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.put("type", type.value());
        node.put("name", name);
        JsonFields.putList(node, "genes", genes, GeneId::toJson);
        node.put("active", active);
        JsonFields.merge(node, extraInfo.toJson());
        JsonFields.putListIfNotEmpty(node, "integrated_monomers", integratedMonomers, Monomer::toJson);
        if (nonCanonicalActivity != null) {
            node.set("non_canonical_activity", nonCanonicalActivity.toJson());
        }
        JsonFields.putIfPresent(node, "comment", comment);
        return node;
    }
}
