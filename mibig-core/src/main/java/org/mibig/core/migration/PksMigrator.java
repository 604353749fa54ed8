package org.mibig.core.migration;

import org.mibig.core.error.MigrationException;
import org.mibig.core.legacy.LegacyPolyketide;
import org.mibig.core.model.biosynthesis.classes.Pks;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.common.SubstrateEvidence;
import org.mibig.core.model.domain.ATSubstrate;
import org.mibig.core.model.domain.Activity;
import org.mibig.core.model.domain.Acyltransferase;
import org.mibig.core.model.domain.Branching;
import org.mibig.core.model.domain.Carrier;
import org.mibig.core.model.domain.Dehydratase;
import org.mibig.core.model.domain.Domain;
import org.mibig.core.model.domain.DomainInfo;
import org.mibig.core.model.domain.DomainType;
import org.mibig.core.model.domain.Enoylreductase;
import org.mibig.core.model.domain.Epimerase;
import org.mibig.core.model.domain.Hydroxylase;
import org.mibig.core.model.domain.Ketoreductase;
import org.mibig.core.model.domain.Ketosynthase;
import org.mibig.core.model.domain.Ligase;
import org.mibig.core.model.domain.Methyltransferase;
import org.mibig.core.model.domain.OtherDomain;
import org.mibig.core.model.domain.Oxidase;
import org.mibig.core.model.domain.ProductTemplate;
import org.mibig.core.model.domain.Thioesterase;
import org.mibig.core.model.domain.Thioreductase;
import org.mibig.core.model.module.Module;
import org.mibig.core.model.module.ModuleInfo;
import org.mibig.core.model.module.ModuleType;
import org.mibig.core.model.module.PksModular;
import org.mibig.core.model.module.PksModularStarter;
import org.mibig.core.model.module.PksTransAt;
import org.mibig.core.model.module.PksTransAtStarter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import static org.mibig.core.migration.LegacyConversions.domain;

/**
 * Migrates the {@code polyketide} sub-object into a PKS class payload and PKS modules.
 *
 * <p>v3 lists every domain of a module by free-text name. The presence of an acyltransferase
 * and a ketosynthase selects the module shape:
 * <pre>
 *   AT + KS  pks-modular
 *   AT only  pks-modular-starter
 *   KS only  pks-trans-at
 *   neither  pks-trans-at-starter
 * </pre>
 * Every other domain name maps to a fixed domain type; an unknown name fails the migration.
 */
public class PksMigrator {

    private static final Logger log = LoggerFactory.getLogger(PksMigrator.class);

    public static final String UNKNOWN_SUBCLASS = "Unknown";

    private static final String ACYLTRANSFERASE = "Acyltransferase";
    private static final String KETOSYNTHASE = "Ketosynthase";
    private static final String BETA_BRANCHING = "Beta-branching";

    private static final Set<String> CARRIER_NAMES = Set.of(
        "Thiolation (ACP/PCP)", "ACP transacylase", "Phosphopantetheinyl transferase", BETA_BRANCHING);

    public ClassMigration migrate(LegacyPolyketide polyketide) {
        if (polyketide == null) {
            return ClassMigration.of(new Pks(UNKNOWN_SUBCLASS, List.of(), null, null, null));
        }

        String subclass = UNKNOWN_SUBCLASS;
        for (String candidate : polyketide.subclasses()) {
            if (isTyped(candidate)) {
                subclass = candidate;
                break;
            }
        }

        List<Module> modules = new ArrayList<>();
        int unnamed = 1;
        for (LegacyPolyketide.Synthase synthase : polyketide.synthases()) {
            for (String candidate : synthase.subclasses()) {
                if (isTyped(candidate)) {
                    subclass = candidate;
                    break;
                }
            }
            subclass = normalizeSubclass(subclass);
            for (LegacyPolyketide.PksModule legacy : synthase.modules()) {
                String name = legacy.moduleNumber();
                if (name == null || name.isEmpty()) {
                    name = String.format("Unk%02d", unnamed++);
                }
                modules.add(migrateModule(legacy, name));
            }
        }
        log.debug("Migrated {} PKS modules, subclass {}", modules.size(), subclass);

        Pks pks = new Pks(
            normalizeSubclass(subclass),
            LegacyConversions.geneIds(polyketide.cyclases()),
            null,
            polyketide.ketideLength(),
            null);
        return new ClassMigration(pks, modules);
    }

    private static boolean isTyped(String subclass) {
        return subclass.toLowerCase(Locale.ROOT).contains("type");
    }

    private static String normalizeSubclass(String subclass) {
        return "Modular type I".equals(subclass) ? "Type I" : subclass;
    }

    Module migrateModule(LegacyPolyketide.PksModule legacy, String name) {
        if (legacy.genes().isEmpty()) {
            throw new MigrationException("PKS module '" + name + "' lists no genes");
        }
        List<GeneId> genes = LegacyConversions.geneIds(legacy.genes());
        GeneId gene = genes.get(0);

        Domain atDomain = null;
        if (legacy.domains().contains(ACYLTRANSFERASE)) {
            atDomain = domain(DomainType.ACYLTRANSFERASE, gene, acyltransferase(legacy));
        }

        Domain ksDomain = null;
        if (legacy.domains().contains(KETOSYNTHASE)) {
            ksDomain = domain(DomainType.KETOSYNTHASE, gene, new Ketosynthase(Activity.UNSPECIFIED, List.of()));
        }

        List<Domain> carriers = new ArrayList<>();
        for (String domainName : legacy.domains()) {
            if (CARRIER_NAMES.contains(domainName)) {
                carriers.add(domain(DomainType.CARRIER, gene, Carrier.of("ACP", BETA_BRANCHING.equals(domainName))));
            }
        }

        List<String> remaining = new ArrayList<>(legacy.domains());
        remaining.addAll(legacy.modificationDomains());
        List<Domain> modificationDomains = new ArrayList<>();
        for (String domainName : remaining) {
            String trimmed = domainName.strip();
            if (ACYLTRANSFERASE.equals(trimmed) || KETOSYNTHASE.equals(trimmed) || CARRIER_NAMES.contains(trimmed)) {
                continue;
            }
            modificationDomains.add(modificationDomain(trimmed, gene, legacy.krStereochem()));
        }

        ModuleType type;
        ModuleInfo info;
        if (atDomain != null && ksDomain != null) {
            type = ModuleType.PKS_MODULAR;
            info = new PksModular(atDomain, ksDomain, carriers, modificationDomains);
        } else if (atDomain != null) {
            type = ModuleType.PKS_MODULAR_STARTER;
            info = new PksModularStarter(atDomain, carriers, modificationDomains);
        } else if (ksDomain != null) {
            type = ModuleType.PKS_TRANS_AT;
            info = new PksTransAt(ksDomain, carriers, modificationDomains);
        } else {
            type = ModuleType.PKS_TRANS_AT_STARTER;
            info = new PksTransAtStarter(carriers, modificationDomains);
        }

        return new Module(
            type,
            name,
            genes,
            true,
            info,
            List.of(),
            LegacyConversions.nonCanonical(legacy.nonCanonical()),
            legacy.comments());
    }

    private static Acyltransferase acyltransferase(LegacyPolyketide.PksModule legacy) {
        List<ATSubstrate> substrates = new ArrayList<>();
        for (String specificity : legacy.atSpecificities()) {
            String name = specificity;
            if (!name.isEmpty() && Character.isUpperCase(name.charAt(0))) {
                name = Character.toLowerCase(name.charAt(0)) + name.substring(1);
            }
            if (ATSubstrate.VALID_NAMES.contains(name)) {
                substrates.add(new ATSubstrate(name, null, null));
            } else {
                substrates.add(new ATSubstrate(ATSubstrate.OTHER, name, null));
            }
        }
        List<SubstrateEvidence> evidence = legacy.evidence() == null
            ? List.of()
            : EvidenceFilter.convert(List.of(legacy.evidence()), SubstrateEvidence::new);
        return new Acyltransferase(null, substrates, evidence, Activity.UNSPECIFIED);
    }

    static Domain modificationDomain(String name, GeneId gene, String krStereochem) {
        DomainInfo info;
        DomainType type;
        switch (name) {
            case "Ketoreductase" -> {
                type = DomainType.KETOREDUCTASE;
                info = ketoreductase(krStereochem);
            }
            case "Dehydratase" -> {
                type = DomainType.DEHYDRATASE;
                info = new Dehydratase(Activity.UNSPECIFIED, List.of());
            }
            case "Enoylreductase" -> {
                type = DomainType.ENOYLREDUCTASE;
                info = new Enoylreductase(Activity.UNSPECIFIED, List.of());
            }
            case "Thioesterase" -> {
                type = DomainType.THIOESTERASE;
                info = new Thioesterase(null);
            }
            case "Thiol reductase" -> {
                type = DomainType.THIOREDUCTASE;
                info = new Thioreductase(Activity.UNSPECIFIED);
            }
            case "Methylation", "Methyltransferase", "MT" -> {
                type = DomainType.METHYLTRANSFERASE;
                info = new Methyltransferase(null, null);
            }
            case "Product Template domain" -> {
                type = DomainType.PRODUCT_TEMPLATE;
                info = new ProductTemplate(Activity.UNSPECIFIED);
            }
            case "CoA-ligase" -> {
                type = DomainType.LIGASE;
                info = new Ligase(List.of(), List.of());
            }
            case "Michael branching", "B" -> {
                type = DomainType.BRANCHING;
                info = new Branching(List.of());
            }
            case "Epimerization" -> {
                type = DomainType.EPIMERASE;
                info = new Epimerase(Activity.UNSPECIFIED, List.of());
            }
            case "Oxidase", "Oxidation", "OXY" -> {
                type = DomainType.OXIDASE;
                info = new Oxidase(List.of());
            }
            case "Hydroxylation" -> {
                type = DomainType.HYDROXYLASE;
                info = new Hydroxylase(List.of());
            }
            case "Sulfotransferase", "Pyran synthase", "GNAT", "FkbH" -> {
                type = DomainType.OTHER;
                info = OtherDomain.named(name);
            }
            case "Enoyl-CoA dehydratase", "Crotonase / Enoyl-CoA dehydratase" -> {
                type = DomainType.OTHER;
                info = OtherDomain.named("Enoyl-CoA dehydratase");
            }
            case "AFSA" -> {
                type = DomainType.OTHER;
                info = OtherDomain.named("A-factor synthase A");
            }
            default -> throw new MigrationException("Unknown PKS domain type '" + name + "'");
        }
        return domain(type, gene, info);
    }

    /**
     * {@code L-OH} is an A-type and {@code D-OH} a B-type ketoreductase; {@code Inactive} marks
     * the domain inactive.
     */
    static Ketoreductase ketoreductase(String krStereochem) {
        if (krStereochem == null) {
            return new Ketoreductase(Activity.UNSPECIFIED, null, List.of());
        }
        return switch (krStereochem) {
            case "L-OH" -> new Ketoreductase(Activity.UNSPECIFIED, "A", List.of());
            case "D-OH" -> new Ketoreductase(Activity.UNSPECIFIED, "B", List.of());
            case "Inactive" -> new Ketoreductase(Activity.INACTIVE, null, List.of());
            default -> new Ketoreductase(Activity.UNSPECIFIED, null, List.of());
        };
    }
}
