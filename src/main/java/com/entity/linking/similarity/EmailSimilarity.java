package com.entity.linking.similarity;

/**
 * E-mail similarity: exact address (case-insensitive) scores 1.0,
 * another mailbox at the same domain scores the configured domain score.
 */
public class EmailSimilarity implements SignalSimilarity {

    private final MatchScoring scoring;

    public EmailSimilarity() {
        this(MatchScoring.defaults());
    }

    public EmailSimilarity(MatchScoring scoring) {
        this.scoring = scoring;
    }

    @Override
    public double compute(String query, String candidate) {
        String a = EndpointNormalizer.normalizeEmail(query);
        String b = EndpointNormalizer.normalizeEmail(candidate);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        String domainA = EndpointNormalizer.emailDomain(a);
        if (!domainA.isEmpty() && domainA.equals(EndpointNormalizer.emailDomain(b))) {
            return scoring.emailDomainScore();
        }
        return 0.0;
    }

    @Override
    public String getName() {
        return "Email";
    }
}
