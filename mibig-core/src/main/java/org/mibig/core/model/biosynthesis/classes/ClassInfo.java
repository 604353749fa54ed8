package org.mibig.core.model.biosynthesis.classes;

import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.model.common.Citation;
import org.mibig.core.validation.Validatable;

import java.util.List;

/**
 * Class-specific payload of a {@link BiosynthesisClass}.
 */
public interface ClassInfo extends Validatable {

    ObjectNode toJson();

    default List<Citation> references() {
        return List.of();
    }
}
