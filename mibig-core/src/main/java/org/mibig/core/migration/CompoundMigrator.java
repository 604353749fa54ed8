package org.mibig.core.migration;

import org.mibig.core.legacy.LegacyCompound;
import org.mibig.core.model.common.Smiles;
import org.mibig.core.model.compound.Compound;
import org.mibig.core.model.compound.CompoundRef;
import org.mibig.core.model.compound.Formula;

import java.util.List;

/**
 * Migrates compounds: name, structure, database cross references, mass and formula.
 */
public class CompoundMigrator {

    public List<Compound> migrate(List<LegacyCompound> compounds) {
        return compounds.stream().map(CompoundMigrator::compound).toList();
    }

    static Compound compound(LegacyCompound legacy) {
        Smiles structure = isBlank(legacy.structure()) ? null : new Smiles(legacy.structure());
        Formula formula = isBlank(legacy.molecularFormula()) ? null : new Formula(legacy.molecularFormula());
        List<CompoundRef> databases = legacy.databaseIds().stream().map(CompoundRef::parse).toList();
        return new Compound(
            legacy.name(),
            List.of(),
            List.of(),
            List.of(),
            structure,
            List.of(),
            databases,
            List.of(),
            null,
            legacy.molecularMass(),
            formula);
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
