package com.entity.linking.similarity;

/**
 * Scoring curve constants for contact matching.
 *
 * @param phoneMinPrefixDigits      shared leading digits needed before a phone scores as a partial match
 * @param phonePartialCeiling       upper bound of the partial phone score, reached as the shared prefix covers the number
 * @param phoneNationalScore        score for a national-format number equal to an international one (0400... vs 61400...)
 * @param emailDomainScore          score for a different mailbox at the same domain
 * @param nameExactScore            score for a case-insensitive equal name
 * @param nameAllTokensScore        score when every query token appears in the candidate name
 * @param nameSubstringScore        score when one name contains the other
 * @param namePartialTokenScore     score scaled by the share of query tokens found in the candidate name
 * @param strongSignalThreshold     per-signal score a signal needs to count towards the multi-signal bonus
 * @param multiSignalBonus          bonus added per additional strong signal, capped at 1.0
 */
public record MatchScoring(
        int phoneMinPrefixDigits,
        double phonePartialCeiling,
        double phoneNationalScore,
        double emailDomainScore,
        double nameExactScore,
        double nameAllTokensScore,
        double nameSubstringScore,
        double namePartialTokenScore,
        double strongSignalThreshold,
        double multiSignalBonus
) {
    public MatchScoring {
        if (phoneMinPrefixDigits <= 0) {
            throw new IllegalArgumentException("phoneMinPrefixDigits must be positive");
        }
        requireScore(phonePartialCeiling, "phonePartialCeiling");
        requireScore(phoneNationalScore, "phoneNationalScore");
        requireScore(emailDomainScore, "emailDomainScore");
        requireScore(nameExactScore, "nameExactScore");
        requireScore(nameAllTokensScore, "nameAllTokensScore");
        requireScore(nameSubstringScore, "nameSubstringScore");
        requireScore(namePartialTokenScore, "namePartialTokenScore");
        requireScore(strongSignalThreshold, "strongSignalThreshold");
        requireScore(multiSignalBonus, "multiSignalBonus");
        if (phonePartialCeiling >= 1.0 || emailDomainScore >= 1.0) {
            throw new IllegalArgumentException("Partial scores must stay below an exact match");
        }
    }

    public static MatchScoring defaults() {
        return new MatchScoring(9, 0.85, 0.95, 0.4, 0.8, 0.7, 0.6, 0.4, 0.5, 0.1);
    }

    /**
     * Copy with a different email domain score.
     */
    public MatchScoring withEmailDomainScore(double score) {
        return new MatchScoring(phoneMinPrefixDigits, phonePartialCeiling, phoneNationalScore, score,
                nameExactScore, nameAllTokensScore, nameSubstringScore, namePartialTokenScore,
                strongSignalThreshold, multiSignalBonus);
    }

    /**
     * Copy with a different minimum shared phone prefix.
     */
    public MatchScoring withPhoneMinPrefixDigits(int digits) {
        return new MatchScoring(digits, phonePartialCeiling, phoneNationalScore, emailDomainScore,
                nameExactScore, nameAllTokensScore, nameSubstringScore, namePartialTokenScore,
                strongSignalThreshold, multiSignalBonus);
    }

    private static void requireScore(double value, String name) {
        if (value < 0.0 || value > 1.0) {
            throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
        }
    }
}
