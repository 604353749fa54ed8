package org.mibig.core.model.module;

import com.fasterxml.jackson.databind.JsonNode;
import org.mibig.core.error.ValidationException;

import java.util.Arrays;
import java.util.function.Function;

/**
 * Closed catalog of module architectures.
 *
 * <p>{@link #NRPS_TYPE6} carries the same payload as {@link #NRPS_TYPE1}.
 */
public enum ModuleType {
    CAL("cal", Cal.class, Cal::fromJson),
    NRPS_TYPE1("nrps-type1", NrpsTypeI.class, NrpsTypeI::fromJson),
    NRPS_TYPE6("nrps-type6", NrpsTypeI.class, NrpsTypeI::fromJson),
    OTHER("other", OtherModule.class, OtherModule::fromJson),
    PKS_ITERATIVE("pks-iterative", PksIterative.class, PksIterative::fromJson),
    PKS_MODULAR("pks-modular", PksModular.class, PksModular::fromJson),
    PKS_MODULAR_STARTER("pks-modular-starter", PksModularStarter.class, PksModularStarter::fromJson),
    PKS_TRANS_AT("pks-trans-at", PksTransAt.class, PksTransAt::fromJson),
    PKS_TRANS_AT_STARTER("pks-trans-at-starter", PksTransAtStarter.class, PksTransAtStarter::fromJson);

    private final String value;
    private final Class<? extends ModuleInfo> payloadType;
    private final Function<JsonNode, ModuleInfo> reader;

    ModuleType(String value, Class<? extends ModuleInfo> payloadType, Function<JsonNode, ModuleInfo> reader) {
        this.value = value;
        this.payloadType = payloadType;
        this.reader = reader;
    }

    public String value() {
        return value;
    }

    public Class<? extends ModuleInfo> payloadType() {
        return payloadType;
    }

    public ModuleInfo readPayload(JsonNode node) {
        return reader.apply(node);
    }

    /**
     * Looks up a tag by wire value.
     *
     * @throws ValidationException for unknown tags
     */
    public static ModuleType fromValue(String value) {
        return Arrays.stream(values())
            .filter(type -> type.value.equals(value))
            .findFirst()
            .orElseThrow(() -> ValidationException.of("Module.type", "Unknown module type '" + value + "'"));
    }
}
