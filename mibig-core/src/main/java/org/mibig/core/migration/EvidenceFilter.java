package org.mibig.core.migration;

import org.mibig.core.model.common.Citation;

import java.util.ArrayList;
import java.util.List;
import java.util.function.BiFunction;

/**
 * Converts legacy evidence method lists.
 *
 * <p>Sequence-based predictions are not evidence in the current schema and are dropped
 * wherever an evidence list is migrated.
 */
public final class EvidenceFilter {

    public static final String SEQUENCE_BASED_PREDICTION = "Sequence-based prediction";

    private EvidenceFilter() {
        // Utility class
    }

    public static boolean isEvidence(String method) {
        return method != null && !SEQUENCE_BASED_PREDICTION.equals(method);
    }

    /**
     * Builds one evidence record per accepted method, each carrying no references.
     *
     * @param methods legacy method names
     * @param factory evidence constructor, e.g. {@code OperonEvidence::new}
     */
    public static <E> List<E> convert(List<String> methods, BiFunction<String, List<Citation>, E> factory) {
        return convert(methods, List.of(), factory);
    }

    public static <E> List<E> convert(
        List<String> methods,
        List<Citation> references,
        BiFunction<String, List<Citation>, E> factory
    ) {
        List<E> evidence = new ArrayList<>();
        if (methods == null) {
            return evidence;
        }
        for (String method : methods) {
            if (isEvidence(method)) {
                evidence.add(factory.apply(method, references));
            }
        }
        return evidence;
    }
}
