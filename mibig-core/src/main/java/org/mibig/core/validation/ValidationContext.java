package org.mibig.core.validation;

import org.mibig.core.error.ValidationErrorInfo;
import org.mibig.core.error.ValidationException;
import org.mibig.core.sequence.CodingSequence;
import org.mibig.core.sequence.SequenceRecord;

import java.util.List;
import java.util.Optional;

/**
 * Immutable context threaded through every validation call.
 *
 * <p>Both components are optional. Without a quality tier, full (non-relaxed) validation
 * applies. Without a sequence record, all record cross-checks are skipped.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * ValidationContext context = ValidationContext.of(QualityLevel.QUESTIONABLE);
 * Acyltransferase at = context.check(new Acyltransferase(...));
 * }</pre>
 *
 * @param quality quality tier of the owning entry, may be null
 * @param record reference sequence record, may be null
 */
public record ValidationContext(QualityLevel quality, SequenceRecord record) {

    private static final ValidationContext FULL = new ValidationContext(null, null);

    /**
     * Context applying full validation without record cross-checks.
     *
     * @return shared full-validation context
     */
    public static ValidationContext full() {
        return FULL;
    }

    public static ValidationContext of(QualityLevel quality) {
        return new ValidationContext(quality, null);
    }

    /**
     * Returns a copy of this context bound to another sequence record.
     *
     * @param sequenceRecord record to cross-check against
     * @return new context
     */
    public ValidationContext withRecord(SequenceRecord sequenceRecord) {
        return new ValidationContext(quality, sequenceRecord);
    }

    /**
     * Whether tier-gated requirements are relaxed.
     *
     * @return true at the questionable tier
     */
    public boolean isRelaxed() {
        return quality == QualityLevel.QUESTIONABLE;
    }

    public Optional<SequenceRecord> sequenceRecord() {
        return Optional.ofNullable(record);
    }

    /**
     * Looks up a coding sequence in the bound record.
     *
     * @param name locus tag, gene name or protein id
     * @return the CDS, or empty when no record is bound or the name is unknown
     */
    public Optional<CodingSequence> cds(String name) {
        if (record == null) {
            return Optional.empty();
        }
        return record.getCds(name);
    }

    /**
     * Validates an entity and returns it unchanged when valid.
     *
     * @param entity entity to validate
     * @param <T> entity type
     * @return the same entity
     * @throws ValidationException carrying every violation of the entity's subtree
     */
    public <T extends Validatable> T check(T entity) {
        List<ValidationErrorInfo> errors = entity.validate(this);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return entity;
    }
}
