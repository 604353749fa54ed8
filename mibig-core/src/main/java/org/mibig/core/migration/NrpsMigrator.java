package org.mibig.core.migration;

import org.mibig.core.error.MigrationException;
import org.mibig.core.legacy.LegacyNrp;
import org.mibig.core.legacy.LegacyThioesterase;
import org.mibig.core.model.biosynthesis.classes.Nrps;
import org.mibig.core.model.biosynthesis.classes.ReleaseType;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.common.SubstrateEvidence;
import org.mibig.core.model.domain.Activity;
import org.mibig.core.model.domain.Adenylation;
import org.mibig.core.model.domain.AdenylationSubstrate;
import org.mibig.core.model.domain.Carrier;
import org.mibig.core.model.domain.Condensation;
import org.mibig.core.model.domain.Domain;
import org.mibig.core.model.domain.DomainType;
import org.mibig.core.model.domain.Epimerase;
import org.mibig.core.model.domain.Hydroxylase;
import org.mibig.core.model.domain.Ligase;
import org.mibig.core.model.domain.Methyltransferase;
import org.mibig.core.model.domain.Oxidase;
import org.mibig.core.model.domain.Thioesterase;
import org.mibig.core.model.module.Module;
import org.mibig.core.model.module.ModuleType;
import org.mibig.core.model.module.NrpsTypeI;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

import static org.mibig.core.migration.LegacyConversions.domain;

/**
 * Migrates the {@code nrp} sub-object into an NRPS class payload and type I NRPS modules.
 *
 * <p>A module may span two coding sequences. Modules are tracked by name across genes, and a
 * repeated name adds the current gene to the module built earlier. Modules without a name get
 * {@code Unk01}, {@code Unk02}, ... in order of appearance.
 *
 * <p>A module without substrate specificity cannot be expressed in the current schema and is
 * skipped with a warning.
 */
public class NrpsMigrator {

    private static final Logger log = LoggerFactory.getLogger(NrpsMigrator.class);

    /** v3 NRPS clusters are nearly always type I. */
    public static final String DEFAULT_SUBCLASS = "Type I";

    private static final Set<String> IGNORED_RELEASE_TYPES = Set.of("Unknown", "Other");

    private static final String UNKNOWN = "Unknown";

    public ClassMigration migrate(LegacyNrp nrp) {
        if (nrp == null) {
            return ClassMigration.of(new Nrps(DEFAULT_SUBCLASS, List.of(), List.of()));
        }

        List<ReleaseType> releaseTypes = nrp.releaseTypes().stream()
            .filter(name -> !IGNORED_RELEASE_TYPES.contains(name))
            .map(name -> new ReleaseType(name, null, List.of()))
            .toList();

        List<Domain> thioesterases = new ArrayList<>();
        for (LegacyThioesterase legacy : nrp.thioesterases()) {
            String subtype = UNKNOWN.equals(legacy.thioesteraseType()) ? null : legacy.thioesteraseType();
            thioesterases.add(domain(DomainType.THIOESTERASE, new GeneId(legacy.gene()), new Thioesterase(subtype)));
        }

        Map<String, Module> modulesByName = new LinkedHashMap<>();
        AtomicInteger unnamed = new AtomicInteger(1);
        for (LegacyNrp.NrpsGene gene : nrp.nrpsGenes()) {
            migrateGene(gene, modulesByName, unnamed);
        }
        log.debug("Migrated {} NRPS modules", modulesByName.size());

        return new ClassMigration(
            new Nrps(DEFAULT_SUBCLASS, releaseTypes, thioesterases),
            new ArrayList<>(modulesByName.values()));
    }

    private void migrateGene(LegacyNrp.NrpsGene gene, Map<String, Module> modulesByName, AtomicInteger unnamed) {
        GeneId geneId = new GeneId(gene.geneId());
        for (LegacyNrp.NrpsModule legacy : gene.modules()) {
            String name = legacy.moduleNumber();
            if (name == null || name.isEmpty()) {
                name = String.format("Unk%02d", unnamed.getAndIncrement());
            }

            Module existing = modulesByName.get(name);
            if (existing != null) {
                log.debug("NRPS module {} continues on gene {}", name, geneId);
                modulesByName.put(name, existing.withGene(geneId));
                continue;
            }

            if (legacy.specificity() == null) {
                log.warn("Skipping NRPS module {} on gene {}: no substrate specificity", name, geneId);
                continue;
            }

            modulesByName.put(name, migrateModule(legacy, name, geneId));
        }
    }

    Module migrateModule(LegacyNrp.NrpsModule legacy, String name, GeneId gene) {
        LegacyNrp.Specificity specificity = legacy.specificity();

        List<Domain> modificationDomains = new ArrayList<>();
        if (specificity.isEpimerized()) {
            modificationDomains.add(domain(DomainType.EPIMERASE, gene, new Epimerase(Activity.ACTIVE, List.of())));
        }

        List<Domain> carriers = new ArrayList<>();
        for (String modification : legacy.modificationDomains()) {
            switch (modification) {
                case "Epimerization", "Unknown" -> {
                    // epimerization comes from the specificity flag, unknown carries nothing
                }
                case "Phosphopantetheinyl transferase", "Beta-branching" -> carriers.add(domain(
                    DomainType.CARRIER, gene, Carrier.of("PCP", "Beta-branching".equals(modification))));
                case "Hydroxylation", "beta-hydroxylation" -> modificationDomains.add(
                    domain(DomainType.HYDROXYLASE, gene, new Hydroxylase(List.of())));
                case "CoA-ligase" -> modificationDomains.add(
                    domain(DomainType.LIGASE, gene, new Ligase(List.of(), List.of())));
                case "Oxidation" -> modificationDomains.add(
                    domain(DomainType.OXIDASE, gene, new Oxidase(List.of())));
                default -> {
                    if ("Methylation".equals(modification) || modification.endsWith("-methylation")) {
                        modificationDomains.add(domain(DomainType.METHYLTRANSFERASE, gene, methylation(modification)));
                    } else {
                        throw new MigrationException("Unsupported NRPS modification domain '" + modification + "'");
                    }
                }
            }
        }

        Domain condensation = null;
        if (legacy.condensationType() != null) {
            String subtype = UNKNOWN.equals(legacy.condensationType()) ? null : legacy.condensationType();
            condensation = domain(DomainType.CONDENSATION, gene, Condensation.of(subtype));
        }

        List<AdenylationSubstrate> substrates = new ArrayList<>();
        specificity.proteinogenic().forEach(substrate ->
            substrates.add(LegacyConversions.adenylationSubstrate(substrate, true, null)));
        specificity.nonProteinogenic().forEach(substrate ->
            substrates.add(LegacyConversions.adenylationSubstrate(substrate, false, null)));

        List<SubstrateEvidence> evidence = EvidenceFilter.convert(specificity.evidence(), SubstrateEvidence::new);
        if (evidence.size() == 1 && !specificity.publications().isEmpty()) {
            evidence = List.of(new SubstrateEvidence(
                evidence.get(0).method(), LegacyConversions.citations(specificity.publications())));
        }

        Domain adenylation = domain(DomainType.ADENYLATION, gene,
            new Adenylation(substrates, evidence, List.of(), Activity.UNSPECIFIED));

        return new Module(
            ModuleType.NRPS_TYPE1,
            name,
            List.of(gene),
            legacy.isActive(),
            new NrpsTypeI(adenylation, condensation, carriers, modificationDomains),
            List.of(),
            LegacyConversions.nonCanonical(legacy.nonCanonical()),
            legacy.comments());
    }

    /**
     * {@code Methylation} has no subtype, {@code N-methylation} becomes subtype {@code N}. A prefix
     * outside C/N/O becomes subtype {@code other} keeping the legacy text as details.
     */
    static Methyltransferase methylation(String modification) {
        if (!modification.endsWith("-methylation")) {
            return new Methyltransferase(null, null);
        }
        String prefix = modification.substring(0, modification.indexOf('-'));
        if (Methyltransferase.VALID_SUBTYPES.contains(prefix) && !Methyltransferase.OTHER.equals(prefix)) {
            return new Methyltransferase(prefix, null);
        }
        return new Methyltransferase(Methyltransferase.OTHER, modification);
    }
}
