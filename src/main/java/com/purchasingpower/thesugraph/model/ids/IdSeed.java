package com.purchasingpower.thesugraph.model.ids;

import com.google.common.base.Preconditions;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;

/**
 * Disambiguator appended to a mediator id. Numeric seeds are incremented on collision;
 * label seeds (e.g. {@code "unspecified"}) get an extra {@code _1}, {@code _2}, ... suffix.
 */
@EqualsAndHashCode
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class IdSeed {

    private final Integer number;
    private final String label;

    public static IdSeed numeric(int number) {
        return new IdSeed(number, null);
    }

    public static IdSeed label(String label) {
        Preconditions.checkArgument(label != null && !label.isBlank(), "Seed label cannot be blank");
        if (label.chars().allMatch(Character::isDigit)) {
            return numeric(Integer.parseInt(label));
        }
        return new IdSeed(null, label);
    }

    /**
     * Candidate suffix for the {@code attempt}-th try, starting at zero.
     */
    public String suffix(int attempt) {
        if (number != null) {
            return String.valueOf(number + attempt);
        }
        return attempt == 0 ? label : label + "_" + attempt;
    }

    @Override
    public String toString() {
        return number != null ? number.toString() : label;
    }
}
