package org.mibig.core.model.domain;

import org.mibig.core.model.common.Smiles;

/**
 * A molecule a domain acts on.
 */
public interface Substrate {

    String name();

    /**
     * @return structure of the substrate, or null when unknown
     */
    Smiles structure();
}
