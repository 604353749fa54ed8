package org.mibig.core.sequence;

import java.util.Optional;

/**
 * Read-only view of a reference sequence record used for validation cross-checks.
 *
 * <p>Loading records from genomic file formats is left to callers; the core only consumes this
 * lookup surface and tolerates its absence.
 */
public interface SequenceRecord {

    /**
     * @return accession (with version) of the record
     */
    String id();

    /**
     * Finds a coding sequence by locus tag, gene name or protein id.
     *
     * @param name identifier to look up
     * @return the CDS, or empty when unknown
     */
    Optional<CodingSequence> getCds(String name);

    /**
     * @return nucleotide length of the record
     */
    int seqLength();

    Optional<String> organism();

    Optional<Integer> ncbiTaxId();
}
