package org.mibig.core.model.biosynthesis;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.biosynthesis.classes.BiosynthesisClass;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.module.Module;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

/**
 * Biosynthetic classification of a gene cluster.
 *
 * <p>{@link #genesReferenced()} and {@link #references()} are computed on every call from the
 * current components.
 *
 * @param classes biosynthetic classes, at least one
 * @param modules assembly-line modules
 * @param operons co-transcribed gene sets
 * @param paths biosynthetic routes
 */
public record Biosynthesis(
    List<BiosynthesisClass> classes,
    List<Module> modules,
    List<Operon> operons,
    List<Path> paths
) implements Validatable {

    public Biosynthesis {
        classes = classes == null ? List.of() : List.copyOf(classes);
        modules = modules == null ? List.of() : List.copyOf(modules);
        operons = operons == null ? List.of() : List.copyOf(operons);
        paths = paths == null ? List.of() : List.copyOf(paths);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (classes.isEmpty()) {
            errors.add(new ValidationErrorInfo("Biosynthesis.classes", "At least one class is required"));
        }
        errors.addAll(Validatable.validateAll(classes, context));
        errors.addAll(Validatable.validateAll(modules, context));
        errors.addAll(Validatable.validateAll(operons, context));
        errors.addAll(Validatable.validateAll(paths, context));
        return errors;
    }

    /**
     * Genes touched by modules and operons.
     *
     * @return sorted, deduplicated gene ids
     */
    public List<GeneId> genesReferenced() {
        return Stream.concat(
                modules.stream().flatMap(module -> module.genes().stream()),
                operons.stream().flatMap(operon -> operon.genes().stream()))
            .distinct()
            .sorted()
            .toList();
    }

    /**
     * Citations across classes, operons, modules and paths.
     *
     * @return sorted, deduplicated citations
     */
    public List<Citation> references() {
        List<Citation> references = new ArrayList<>();
        classes.forEach(biosynthesisClass -> references.addAll(biosynthesisClass.references()));
        operons.forEach(operon -> references.addAll(operon.references()));
        modules.forEach(module -> references.addAll(module.references()));
        paths.forEach(path -> references.addAll(path.references()));
        return references.stream().distinct().sorted().toList();
    }

    public static Biosynthesis fromJson(JsonNode node) {
        JsonFields.object(node, "Biosynthesis");
        return new Biosynthesis(
            JsonFields.requiredList(node, "classes", "Biosynthesis", BiosynthesisClass::fromJson),
            JsonFields.list(node, "modules", "Biosynthesis", Module::fromJson),
            JsonFields.list(node, "operons", "Biosynthesis", Operon::fromJson),
            JsonFields.list(node, "paths", "Biosynthesis", Path::fromJson));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putList(node, "classes", classes, BiosynthesisClass::toJson);
        JsonFields.putListIfNotEmpty(node, "modules", modules, Module::toJson);
        JsonFields.putListIfNotEmpty(node, "operons", operons, Operon::toJson);
        JsonFields.putListIfNotEmpty(node, "paths", paths, Path::toJson);
        return node;
    }
}
