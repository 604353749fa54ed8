package org.mibig.core.migration;

import org.mibig.core.error.MigrationException;
import org.mibig.core.legacy.LegacyGenes;
import org.mibig.core.model.biosynthesis.Operon;
import org.mibig.core.model.common.Citation;
import org.mibig.core.model.common.FunctionEvidence;
import org.mibig.core.model.common.GeneId;
import org.mibig.core.model.common.Location;
import org.mibig.core.model.common.NovelGeneId;
import org.mibig.core.model.common.OperonEvidence;
import org.mibig.core.model.common.SubstrateEvidence;
import org.mibig.core.model.domain.Activity;
import org.mibig.core.model.domain.Adenylation;
import org.mibig.core.model.domain.AdenylationSubstrate;
import org.mibig.core.model.domain.Domain;
import org.mibig.core.model.domain.DomainType;
import org.mibig.core.model.gene.Addition;
import org.mibig.core.model.gene.Annotation;
import org.mibig.core.model.gene.GeneFunction;
import org.mibig.core.model.gene.GeneLocation;
import org.mibig.core.model.gene.Genes;
import org.mibig.core.model.gene.MutationPhenotype;
import org.mibig.core.model.gene.TailoringFunction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Migrates the {@code genes} section: extra genes, annotations and operons.
 *
 * <p>Operons belong to the biosynthesis section in the current schema and are returned
 * separately by {@link #migrateOperons(LegacyGenes)}.
 */
public class GeneMigrator {

    private static final Logger log = LoggerFactory.getLogger(GeneMigrator.class);

    public static final String NO_DETAILS = "converted from v3 without extra details";

    /**
     * @return migrated genes, or null when the cluster has no gene section
     */
    public Genes migrate(LegacyGenes genes) {
        if (genes == null) {
            return null;
        }

        List<Addition> additions = new ArrayList<>();
        for (LegacyGenes.ExtraGene extra : genes.extraGenes()) {
            additions.add(addition(extra));
        }

        List<Annotation> annotations = new ArrayList<>();
        for (LegacyGenes.Annotation annotation : genes.annotations()) {
            annotations.add(annotation(annotation));
        }

        log.debug("Migrated {} gene additions and {} annotations", additions.size(), annotations.size());
        return new Genes(additions, List.of(), annotations);
    }

    public List<Operon> migrateOperons(LegacyGenes genes) {
        if (genes == null) {
            return List.of();
        }
        return genes.operons().stream()
            .map(operon -> new Operon(
                LegacyConversions.geneIds(operon.genes()),
                EvidenceFilter.convert(operon.evidence(), OperonEvidence::new)))
            .toList();
    }

    private static Addition addition(LegacyGenes.ExtraGene extra) {
        if (extra.location() == null) {
            throw new MigrationException("Extra gene '" + extra.id() + "' has no location");
        }
        List<Location> exons = extra.location().exons().stream()
            .map(exon -> new Location(exon.start(), exon.end()))
            .toList();
        return new Addition(
            new NovelGeneId(extra.id()),
            new GeneLocation(exons, extra.location().strand()),
            extra.translation());
    }

    /**
     * A name like {@code abcA/orf12} becomes name {@code abcA} with alias {@code orf12}.
     */
    static Annotation annotation(LegacyGenes.Annotation legacy) {
        GeneId id = new GeneId(legacy.id());

        NovelGeneId name = null;
        List<NovelGeneId> aliases = List.of();
        if (legacy.name() != null && !legacy.name().isEmpty()) {
            String[] parts = legacy.name().split("/");
            name = new NovelGeneId(parts[0]);
            aliases = Arrays.stream(parts, 1, parts.length).map(NovelGeneId::new).toList();
        }

        List<Citation> references = LegacyConversions.citations(legacy.publications());

        List<GeneFunction> functions = new ArrayList<>();
        for (LegacyGenes.GeneFunction function : legacy.functions()) {
            functions.add(geneFunction(function));
        }

        List<TailoringFunction> tailoring = new ArrayList<>();
        for (String text : legacy.tailoring()) {
            if (TailoringFunction.VALID_FUNCTIONS.contains(text)) {
                tailoring.add(new TailoringFunction(text, references, null, null));
            } else {
                tailoring.add(new TailoringFunction(TailoringFunction.OTHER, references, null, text));
            }
        }

        List<Domain> domains = new ArrayList<>();
        for (LegacyGenes.Domain domain : legacy.domains()) {
            domains.add(domain(id, domain));
        }

        MutationPhenotype phenotype = legacy.mutationPhenotype() == null
            ? null
            : new MutationPhenotype(legacy.mutationPhenotype(), null, references);

        return new Annotation(id, name, aliases, legacy.product(), functions, tailoring, domains, phenotype,
            legacy.comments());
    }

    private static GeneFunction geneFunction(LegacyGenes.GeneFunction legacy) {
        List<FunctionEvidence> evidence = EvidenceFilter.convert(legacy.evidence(), FunctionEvidence::new);
        String category = legacy.category();
        if (GeneFunction.OTHER.equals(category)) {
            return new GeneFunction(GeneFunction.OTHER, NO_DETAILS, evidence, null);
        }
        if (GeneFunction.VALID_FUNCTIONS.contains(category)) {
            return new GeneFunction(category, null, evidence, null);
        }
        return new GeneFunction(GeneFunction.OTHER, category, evidence, null);
    }

    /**
     * Only adenylation domains were ever annotated on genes in v3.
     */
    private static Domain domain(GeneId gene, LegacyGenes.Domain legacy) {
        String name = legacy.name() == null ? "" : legacy.name().toLowerCase(Locale.ROOT);
        DomainType type;
        if (DomainType.ADENYLATION.value().equals(name)) {
            type = DomainType.ADENYLATION;
        } else if (DomainType.AMP_BINDING.value().equals(name)) {
            type = DomainType.AMP_BINDING;
        } else {
            throw new MigrationException("Domain conversion for '" + legacy.name() + "' is not supported");
        }

        List<AdenylationSubstrate> substrates = new ArrayList<>();
        List<SubstrateEvidence> evidence = new ArrayList<>();
        for (LegacyGenes.DomainSubstrate substrate : legacy.substrates()) {
            substrates.add(LegacyConversions.adenylationSubstrate(
                substrate.name(), LegacyConversions.isProteinogenic(substrate.name()), substrate.structure()));
            evidence.addAll(EvidenceFilter.convert(
                substrate.evidence(), LegacyConversions.citations(substrate.publications()), SubstrateEvidence::new));
        }

        Location location = legacy.location() == null
            ? Location.UNKNOWN
            : new Location(legacy.location().begin(), legacy.location().end());
        return new Domain(type, gene, location, new Adenylation(substrates, evidence, List.of(), Activity.UNSPECIFIED));
    }
}
