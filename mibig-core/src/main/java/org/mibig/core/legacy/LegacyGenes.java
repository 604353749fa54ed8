package org.mibig.core.legacy;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Gene-level information of a v3 cluster: annotations of existing genes, genes missing from the
 * nucleotide record, and operons.
 *
 * @param annotations gene annotations
 * @param extraGenes genes to add
 * @param operons operons
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LegacyGenes(
    @JsonProperty("annotations") List<Annotation> annotations,
    @JsonProperty("extra_genes") List<ExtraGene> extraGenes,
    @JsonProperty("operons") List<Operon> operons
) {
    public LegacyGenes {
        annotations = annotations == null ? List.of() : List.copyOf(annotations);
        extraGenes = extraGenes == null ? List.of() : List.copyOf(extraGenes);
        operons = operons == null ? List.of() : List.copyOf(operons);
    }

    /**
     * Annotation of one gene.
     *
     * <p>{@code name} may hold several names separated by {@code /}.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Annotation(
        @JsonProperty("id") String id,
        @JsonProperty("comments") String comments,
        @JsonProperty("functions") List<GeneFunction> functions,
        @JsonProperty("mut_pheno") String mutationPhenotype,
        @JsonProperty("name") String name,
        @JsonProperty("product") String product,
        @JsonProperty("publications") List<String> publications,
        @JsonProperty("tailoring") List<String> tailoring,
        @JsonProperty("domains") List<Domain> domains
    ) {
        public Annotation {
            functions = functions == null ? List.of() : List.copyOf(functions);
            publications = publications == null ? List.of() : List.copyOf(publications);
            tailoring = tailoring == null ? List.of() : List.copyOf(tailoring);
            domains = domains == null ? List.of() : List.copyOf(domains);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record GeneFunction(
        @JsonProperty("category") String category,
        @JsonProperty("evidence") List<String> evidence
    ) {
        public GeneFunction {
            evidence = evidence == null ? List.of() : List.copyOf(evidence);
        }
    }

    /**
     * Domain annotated on a gene. Only adenylation domains occur in practice.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Domain(
        @JsonProperty("name") String name,
        @JsonProperty("location") DomainLocation location,
        @JsonProperty("substrates") List<DomainSubstrate> substrates
    ) {
        public Domain {
            substrates = substrates == null ? List.of() : List.copyOf(substrates);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DomainLocation(
        @JsonProperty("begin") int begin,
        @JsonProperty("end") int end
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record DomainSubstrate(
        @JsonProperty("name") String name,
        @JsonProperty("structure") String structure,
        @JsonProperty("evidence") List<String> evidence,
        @JsonProperty("publications") List<String> publications
    ) {
        public DomainSubstrate {
            evidence = evidence == null ? List.of() : List.copyOf(evidence);
            publications = publications == null ? List.of() : List.copyOf(publications);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record ExtraGene(
        @JsonProperty("id") String id,
        @JsonProperty("location") Location location,
        @JsonProperty("translation") String translation
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Location(
        @JsonProperty("exons") List<Exon> exons,
        @JsonProperty("strand") int strand
    ) {
        public Location {
            exons = exons == null ? List.of() : List.copyOf(exons);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Exon(
        @JsonProperty("start") int start,
        @JsonProperty("end") int end
    ) {}

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Operon(
        @JsonProperty("genes") List<String> genes,
        @JsonProperty("evidence") List<String> evidence
    ) {
        public Operon {
            genes = genes == null ? List.of() : List.copyOf(genes);
            evidence = evidence == null ? List.of() : List.copyOf(evidence);
        }
    }
}
