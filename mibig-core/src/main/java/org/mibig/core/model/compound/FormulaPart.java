package org.mibig.core.model.compound;

import org.mibig.core.error.ValidationErrorInfo;

import java.util.ArrayList;
import java.util.List;

/**
 * One element of a molecular formula.
 *
 * @param atom element symbol
 * @param count number of atoms, at least 1
 */
public record FormulaPart(String atom, int count) {

    public List<ValidationErrorInfo> validate() {
        List<ValidationErrorInfo> errors = new ArrayList<>();
        if (atom == null || !atom.matches("^[A-Za-z]+$")) {
            errors.add(new ValidationErrorInfo("Compound.formula", "Invalid atom '" + atom + "'"));
        }
        if (count <= 0) {
            errors.add(new ValidationErrorInfo("Compound.formula", "Invalid count " + count));
        }
        return errors;
    }
}
