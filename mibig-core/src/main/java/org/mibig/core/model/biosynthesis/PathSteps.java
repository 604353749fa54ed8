package org.mibig.core.model.biosynthesis;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.error.ValidationException;
import org.mibig.core.json.JsonFields;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Parsed form of a path's step string.
 *
 * <p>Grammar: {@code >} separates ordered stages, {@code ,} separates unordered items of one
 * stage and an item in square brackets names a module instead of a gene:
 * <pre>{@code
 * "[M1] > tycD, tycE > [M3]"
 * }</pre>
 * The arrow ({@code ->}) and slash ({@code /}) separators of the older grammar are rejected.
 *
 * @param stages ordered stages, each a non-empty list of items
 */
public record PathSteps(List<List<String>> stages) {

    private static final String STAGE_SEPARATOR = ">";
    private static final String ITEM_SEPARATOR = ",";

    public PathSteps {
        stages = stages == null ? List.of() : stages.stream().map(List::copyOf).toList();
    }

    /**
     * Parses a step string.
     *
     * @param text step string
     * @return parsed stages
     * @throws ValidationException for empty items or separators of the older grammar
     */
    public static PathSteps parse(String text) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (text.contains("->")) {
            errors.add(new ValidationErrorInfo("Path.steps", "Unsupported stage separator '->' in '" + text + "'"));
        }
        if (text.contains("/")) {
            errors.add(new ValidationErrorInfo("Path.steps", "Unsupported item separator '/' in '" + text + "'"));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        List<List<String>> stages = new ArrayList<>();
        for (String stage : text.split(STAGE_SEPARATOR, -1)) {
            List<String> items = Arrays.stream(stage.split(ITEM_SEPARATOR, -1)).map(String::strip).toList();
            if (items.stream().anyMatch(String::isEmpty)) {
                throw ValidationException.of("Path.steps", "Empty step in '" + text + "'");
            }
            stages.add(items);
        }
        return new PathSteps(stages);
    }

    public static PathSteps fromJson(JsonNode node) {
        return parse(JsonFields.asText(node, "Path.steps"));
    }

    public String format() {
        return stages.stream()
            .map(items -> String.join(", ", items))
            .collect(Collectors.joining(" > "));
    }

    /**
     * @return names of the modules referenced in square brackets, in step order
     */
    public List<String> moduleReferences() {
        return stages.stream()
            .flatMap(List::stream)
            .filter(PathSteps::isModuleReference)
            .map(item -> item.substring(1, item.length() - 1))
            .toList();
    }

    static boolean isModuleReference(String item) {
        return item.length() > 2 && item.startsWith("[") && item.endsWith("]");
    }

    @Override
    public String toString() {
        return format();
    }
}
