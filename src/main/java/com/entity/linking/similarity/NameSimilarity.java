package com.entity.linking.similarity;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Name containment similarity. Asymmetric: the query is matched against the candidate's display name.
 * A name alone never reaches the exact tier, so it can suggest a contact but not identify one.
 */
public class NameSimilarity implements SignalSimilarity {

    private final MatchScoring scoring;

    public NameSimilarity() {
        this(MatchScoring.defaults());
    }

    public NameSimilarity(MatchScoring scoring) {
        this.scoring = scoring;
    }

    @Override
    public double compute(String query, String candidate) {
        String q = EndpointNormalizer.normalizeName(query);
        String c = EndpointNormalizer.normalizeName(candidate);
        if (q.isEmpty() || c.isEmpty()) {
            return 0.0;
        }
        if (q.equals(c)) {
            return scoring.nameExactScore();
        }

        List<String> queryTokens = EndpointNormalizer.nameTokens(q);
        Set<String> candidateTokens = new HashSet<>(EndpointNormalizer.nameTokens(c));
        long shared = queryTokens.stream().filter(candidateTokens::contains).count();

        if (shared == queryTokens.size()) {
            return scoring.nameAllTokensScore();
        }
        if (c.contains(q) || q.contains(c)) {
            return scoring.nameSubstringScore();
        }
        if (shared > 0) {
            return scoring.namePartialTokenScore() * shared / queryTokens.size();
        }
        return 0.0;
    }

    @Override
    public String getName() {
        return "Name";
    }
}
