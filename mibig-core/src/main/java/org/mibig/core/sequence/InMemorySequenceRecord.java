package org.mibig.core.sequence;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link SequenceRecord} backed by an in-memory CDS index.
 *
 * <p>Lookups try the locus tag first, then the gene name, then the protein id.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * SequenceRecord record = InMemorySequenceRecord.builder("NC_003888.3", 8667507)
 *     .organism("Streptomyces coelicolor A3(2)", 100226)
 *     .cds("SCO5087", "actI-ORF1", null, 421)
 *     .build();
 * }</pre>
 */
public final class InMemorySequenceRecord implements SequenceRecord {

    private final String id;
    private final int seqLength;
    private final String organism;
    private final Integer ncbiTaxId;
    private final List<Entry> entries;
    private final Map<String, CodingSequence> byLocusTag = new HashMap<>();
    private final Map<String, CodingSequence> byGene = new HashMap<>();
    private final Map<String, CodingSequence> byProteinId = new HashMap<>();

    private InMemorySequenceRecord(String id, int seqLength, String organism, Integer ncbiTaxId, List<Entry> entries) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.seqLength = seqLength;
        this.organism = organism;
        this.ncbiTaxId = ncbiTaxId;
        this.entries = List.copyOf(entries);
        for (Entry entry : this.entries) {
            index(byLocusTag, entry.locusTag(), entry);
            index(byGene, entry.gene(), entry);
            index(byProteinId, entry.proteinId(), entry);
        }
    }

    public static Builder builder(String id, int seqLength) {
        return new Builder(id, seqLength);
    }

    private static void index(Map<String, CodingSequence> map, String key, Entry entry) {
        if (key != null) {
            map.putIfAbsent(key, entry);
        }
    }

    @Override
    public String id() {
        return id;
    }

    @Override
    public Optional<CodingSequence> getCds(String name) {
        if (name == null) {
            return Optional.empty();
        }
        CodingSequence cds = byLocusTag.get(name);
        if (cds == null) {
            cds = byGene.get(name);
        }
        if (cds == null) {
            cds = byProteinId.get(name);
        }
        return Optional.ofNullable(cds);
    }

    @Override
    public int seqLength() {
        return seqLength;
    }

    @Override
    public Optional<String> organism() {
        return Optional.ofNullable(organism);
    }

    @Override
    public Optional<Integer> ncbiTaxId() {
        return Optional.ofNullable(ncbiTaxId);
    }

    private record Entry(String locusTag, String gene, String proteinId, int translationLength)
        implements CodingSequence {
    }

    /**
     * Builder for {@link InMemorySequenceRecord}.
     */
    public static final class Builder {
        private final String id;
        private final int seqLength;
        private String organism;
        private Integer ncbiTaxId;
        private final List<Entry> entries = new ArrayList<>();

        private Builder(String id, int seqLength) {
            this.id = id;
            this.seqLength = seqLength;
        }

        public Builder organism(String name, Integer taxId) {
            this.organism = name;
            this.ncbiTaxId = taxId;
            return this;
        }

        /**
         * Adds a coding sequence. At least one of the identifiers must be given.
         */
        public Builder cds(String locusTag, String gene, String proteinId, int translationLength) {
            if (locusTag == null && gene == null && proteinId == null) {
                throw new IllegalArgumentException("A CDS needs a locus tag, gene name or protein id");
            }
            entries.add(new Entry(locusTag, gene, proteinId, translationLength));
            return this;
        }

        public InMemorySequenceRecord build() {
            return new InMemorySequenceRecord(id, seqLength, organism, ncbiTaxId, entries);
        }
    }
}
