package org.mibig.core.model.domain;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.core.error.ValidationException;

import java.util.Arrays;
import java.util.function.Function;

/**
 * Closed catalog of catalytic domain kinds.
 *
 * <p>Each tag fixes the payload type of a {@link Domain} and the decoder used for it.
 * {@link #AMP_BINDING} is a legacy synonym of {@link #ADENYLATION} and shares its payload.
 */
public enum DomainType {
    /** Acyltransferase (AT). */
    ACYLTRANSFERASE("acyltransferase", Acyltransferase.class, Acyltransferase::fromJson),

    /** Adenylation (A). */
    ADENYLATION("adenylation", Adenylation.class, Adenylation::fromJson),

    /** Legacy name of the adenylation domain. */
    AMP_BINDING("amp-binding", Adenylation.class, Adenylation::fromJson),

    /** Aminotransferase (AMT). */
    AMINOTRANSFERASE("aminotransferase", Aminotransferase.class, Aminotransferase::fromJson),

    /** Michael branching (B). */
    BRANCHING("branching", Branching.class, Branching::fromJson),

    /** Acyl or peptidyl carrier protein (ACP/PCP). */
    CARRIER("carrier", Carrier.class, Carrier::fromJson),

    /** Condensation (C). */
    CONDENSATION("condensation", Condensation.class, Condensation::fromJson),

    /** Cyclase (Cy). */
    CYCLASE("cyclase", Cyclase.class, Cyclase::fromJson),

    /** Dehydratase (DH). */
    DEHYDRATASE("dehydratase", Dehydratase.class, Dehydratase::fromJson),

    /** Enoylreductase (ER). */
    ENOYLREDUCTASE("enoylreductase", Enoylreductase.class, Enoylreductase::fromJson),

    /** Epimerase (E). */
    EPIMERASE("epimerase", Epimerase.class, Epimerase::fromJson),

    /** Hydroxylase. */
    HYDROXYLASE("hydroxylase", Hydroxylase.class, Hydroxylase::fromJson),

    /** Ketoreductase (KR). */
    KETOREDUCTASE("ketoreductase", Ketoreductase.class, Ketoreductase::fromJson),

    /** Ketosynthase (KS). */
    KETOSYNTHASE("ketosynthase", Ketosynthase.class, Ketosynthase::fromJson),

    /** Ligase, e.g. CoA-ligase. */
    LIGASE("ligase", Ligase.class, Ligase::fromJson),

    /** Methyltransferase (MT). */
    METHYLTRANSFERASE("methyltransferase", Methyltransferase.class, Methyltransferase::fromJson),

    /** Any domain outside the catalog, named by its subtype. */
    OTHER("other", OtherDomain.class, OtherDomain::fromJson),

    /** Oxidase (Ox). */
    OXIDASE("oxidase", Oxidase.class, Oxidase::fromJson),

    /** Product template (PT). */
    PRODUCT_TEMPLATE("product_template", ProductTemplate.class, ProductTemplate::fromJson),

    /** Thioesterase (TE). */
    THIOESTERASE("thioesterase", Thioesterase.class, Thioesterase::fromJson),

    /** Thioreductase (R). */
    THIOREDUCTASE("thioreductase", Thioreductase.class, Thioreductase::fromJson);

    private final String value;
    private final Class<? extends DomainInfo> payloadType;
    private final Function<JsonNode, DomainInfo> reader;

    DomainType(String value, Class<? extends DomainInfo> payloadType, Function<JsonNode, DomainInfo> reader) {
        this.value = value;
        this.payloadType = payloadType;
        this.reader = reader;
    }

    public String value() {
        return value;
    }

    public Class<? extends DomainInfo> payloadType() {
        return payloadType;
    }

    /**
     * Decodes the payload fields of a domain object of this type.
     *
     * @param node domain object
     * @return payload, not yet validated
     */
    public DomainInfo readPayload(JsonNode node) {
        return reader.apply(node);
    }

    /**
     * Looks up a tag by wire value.
     *
     * @param value wire value, e.g. {@code "ketoreductase"}
     * @return matching tag
     * @throws ValidationException for unknown tags
     */
    public static DomainType fromValue(String value) {
        return Arrays.stream(values())
            .filter(type -> type.value.equals(value))
            .findFirst()
            .orElseThrow(() -> ValidationException.of("Domain.type", "Unknown domain type '" + value + "'"));
    }
}
