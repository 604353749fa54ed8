package org.mibig.core.model.changelog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered audit trail of the releases an entry has been part of.
 *
 * @param releases releases, oldest first
 */
public record ChangeLog(List<Release> releases) implements Validatable {

    public ChangeLog {
        releases = releases == null ? List.of() : List.copyOf(releases);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        releases.forEach(release -> errors.addAll(release.validate(context)));
        return errors;
    }

    public static ChangeLog fromJson(JsonNode node) {
        JsonFields.object(node, "ChangeLog");
        return new ChangeLog(JsonFields.requiredList(node, "releases", "ChangeLog", Release::fromJson));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putList(node, "releases", releases, Release::toJson);
        return node;
    }
}
