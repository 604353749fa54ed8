package org.mibig.core.model.changelog;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.common.SubmitterID;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * One line of a release: who changed what, and who reviewed it.
 *
 * @param contributors authors of the change, never empty
 * @param reviewers reviewers of the change, required above the questionable tier
 * @param date day the change was made
 * @param comment description of the change
 */
public record ReleaseEntry(
    List<SubmitterID> contributors,
    List<SubmitterID> reviewers,
    LocalDate date,
    String comment
) implements Validatable {

    public ReleaseEntry {
        contributors = contributors == null ? List.of() : List.copyOf(contributors);
        reviewers = reviewers == null ? List.of() : List.copyOf(reviewers);
    }

    @Override
    public List<ValidationErrorInfo> validate(ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (contributors.isEmpty()) {
            errors.add(new ValidationErrorInfo("ReleaseEntry.contributors", "At least one contributor is required"));
        }
        if (reviewers.isEmpty() && !context.isRelaxed()) {
            errors.add(new ValidationErrorInfo("ReleaseEntry.reviewers", "At least one reviewer is required"));
        }
        contributors.forEach(id -> errors.addAll(id.validate(context)));
        reviewers.forEach(id -> errors.addAll(id.validate(context)));
        if (date == null) {
            errors.add(new ValidationErrorInfo("ReleaseEntry.date", "Missing date"));
        }
        if (comment == null || comment.isBlank()) {
            errors.add(new ValidationErrorInfo("ReleaseEntry.comment", "Missing comment"));
        }
        return errors;
    }

    public static ReleaseEntry fromJson(JsonNode node) {
        JsonFields.object(node, "ReleaseEntry");
        return new ReleaseEntry(
            JsonFields.requiredList(node, "contributors", "ReleaseEntry", SubmitterID::fromJson),
            JsonFields.list(node, "reviewers", "ReleaseEntry", SubmitterID::fromJson),
            JsonFields.date(node, "date", "ReleaseEntry"),
            JsonFields.text(node, "comment", "ReleaseEntry"));
    }

    public ObjectNode toJson() {
        ObjectNode node = JsonFields.newObject();
        JsonFields.putList(node, "contributors", contributors, SubmitterID::toJson);
        JsonFields.putList(node, "reviewers", reviewers, SubmitterID::toJson);
        node.put("date", date.toString());
        node.put("comment", comment);
        return node;
    }
}
