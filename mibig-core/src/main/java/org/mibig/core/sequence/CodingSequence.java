package org.mibig.core.sequence;

/**
 * A coding sequence of a reference record.
 */
public interface CodingSequence {

    /**
     * @return number of amino acids in the translation
     */
    int translationLength();
}
