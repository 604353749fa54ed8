package org.mibig.core.model.changelog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.ReleaseVersion;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A data release and the entries it contains.
 *
 * @param version release version
 * @param date release date, absent only for the {@code next} release
 * @param entries changes made in this release
 */
public record Release(ReleaseVersion version, LocalDate date, List<ReleaseEntry> entries) implements Validatable {

    public Release {
        Objects.requireNonNull(version, "version must not be null");
        entries = entries == null ? List.of() : List.copyOf(entries);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>(version.validate(context));
        if (date == null && !version.isNext()) {
            errors.add(new ValidationErrorInfo("Release.date", "Release " + version + " must have a date"));
        }
        if (entries.isEmpty()) {
            errors.add(new ValidationErrorInfo("Release.entries", "Release " + version + " has no entries"));
        }
        entries.forEach(entry -> errors.addAll(entry.validate(context)));
        return errors;
    }

    public static Release fromJson(JsonNode node) {
        JsonFields.object(node, "Release");
        return new Release(
            ReleaseVersion.fromJson(JsonFields.required(node, "version", "Release")),
            JsonFields.optionalDate(node, "date", "Release"),
            JsonFields.requiredList(node, "entries", "Release", ReleaseEntry::fromJson));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        node.set("version", version.toJson());
        if (date != null) {
            node.put("date", date.toString());
        }
        JsonFields.putList(node, "entries", entries, ReleaseEntry::toJson);
        return node;
    }
}
