package org.mibig.core.model.module;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.json.JsonFields;
import org.mibig.core.model.domain.Domain;
import org.mibig.core.model.domain.DomainType;
import org.mibig.core.validation.Validatable;
import org.mibig.core.validation.ValidationContext;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Architecture-specific payload of a {@link Module}.
 *
 * <p>Domains fall into three buckets: core domains fixed by the architecture, optional carrier
 * domains and optional modification (tailoring) domains. A module needs at least one domain
 * across the three.
 */
public interface ModuleInfo extends Validatable {

    /**
     * @return mandatory, architecture-specific domains that are set
     */
    List<Domain> coreDomains();

    List<Domain> carriers();

    List<Domain> modificationDomains();

    default List<Domain> allDomains() {
        List<Domain> all = new ArrayList<>(coreDomains());
        all.addAll(carriers());
        all.addAll(modificationDomains());
        return all;
    }

    ObjectNode toJson();

    // ==================== Shared rules ====================

    /**
     * Validates every domain and requires at least one.
     */
    static List<ValidationErrorInfo> checkDomains(String kind, ModuleInfo info, ValidationContext context) {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        List<Domain> domains = info.allDomains();
        if (domains.isEmpty()) {
            errors.add(new ValidationErrorInfo(kind, "Modules require at least one domain"));
        }
        errors.addAll(Validatable.validateAll(domains, context));
        return errors;
    }

    /**
     * Checks a core domain slot.
     *
     * @param field wire name of the slot
     * @param domain domain in the slot, may be null
     * @param required whether the slot must be filled
     * @param allowed accepted domain types
     * @return violations
     */
    static List<ValidationErrorInfo> checkSlot(String field, Domain domain, boolean required, DomainType... allowed) {
        if (domain == null) {
            return required
                ? List.of(new ValidationErrorInfo(field, "Missing required " + field))
                : List.of();
        }
        if (!Arrays.asList(allowed).contains(domain.type())) {
            String names = Arrays.stream(allowed).map(DomainType::value).collect(Collectors.joining(" or "));
            return List.of(new ValidationErrorInfo(field,
                field + " must be a " + names + " domain, not " + domain.type().value()));
        }
        return List.of();
    }

    static List<Domain> present(Domain... domains) {
        return Arrays.stream(domains).filter(Objects::nonNull).toList();
    }

    static Domain readSlot(JsonNode node, String field, String path) {
        return JsonFields.has(node, field) ? Domain.fromJson(node.get(field)) : null;
    }

    static List<Domain> readCarriers(JsonNode node, String path) {
        return JsonFields.list(node, "carriers", path, Domain::fromJson);
    }

    static List<Domain> readModificationDomains(JsonNode node, String path) {
        return JsonFields.list(node, "modification_domains", path, Domain::fromJson);
    }

    static void writeSlot(ObjectNode node, String field, Domain domain) {
        if (domain != null) {
            node.set(field, domain.toJson());
        }
    }

    static void writeOptionalDomains(ObjectNode node, List<Domain> carriers, List<Domain> modificationDomains) {
        JsonFields.putListIfNotEmpty(node, "carriers", carriers, Domain::toJson);
        JsonFields.putListIfNotEmpty(node, "modification_domains", modificationDomains, Domain::toJson);
    }

    static List<Domain> copy(List<Domain> domains) {
        return domains == null ? List.of() : List.copyOf(domains);
    }
}
