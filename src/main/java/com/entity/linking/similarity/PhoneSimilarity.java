package com.entity.linking.similarity;

/**
 * Phone number similarity on normalized digits.
 *
 * <ul>
 *   <li>identical digits: 1.0</li>
 *   <li>a trunk-prefixed national number equal to the tail of an international one: national score</li>
 *   <li>a shared leading run of at least the configured digits: partial ceiling scaled by
 *       shared length over the longer number</li>
 *   <li>otherwise 0.0</li>
 * </ul>
 */
public class PhoneSimilarity implements SignalSimilarity {

    private final MatchScoring scoring;

    public PhoneSimilarity() {
        this(MatchScoring.defaults());
    }

    public PhoneSimilarity(MatchScoring scoring) {
        this.scoring = scoring;
    }

    @Override
    public double compute(String query, String candidate) {
        String a = EndpointNormalizer.normalizePhone(query);
        String b = EndpointNormalizer.normalizePhone(candidate);
        if (a.isEmpty() || b.isEmpty()) {
            return 0.0;
        }
        if (a.equals(b)) {
            return 1.0;
        }
        if (isNationalForm(a, b) || isNationalForm(b, a)) {
            return scoring.phoneNationalScore();
        }

        int shared = sharedPrefixLength(a, b);
        if (shared < scoring.phoneMinPrefixDigits()) {
            return 0.0;
        }
        return scoring.phonePartialCeiling() * shared / Math.max(a.length(), b.length());
    }

    @Override
    public String getName() {
        return "Phone";
    }

    /**
     * Digits needed for a prefix search that can surface partial matches of the given number.
     */
    public String searchPrefix(String phone) {
        String digits = EndpointNormalizer.normalizePhone(phone);
        return digits.length() <= scoring.phoneMinPrefixDigits()
                ? digits
                : digits.substring(0, scoring.phoneMinPrefixDigits());
    }

    static int sharedPrefixLength(String a, String b) {
        int max = Math.min(a.length(), b.length());
        int i = 0;
        while (i < max && a.charAt(i) == b.charAt(i)) {
            i++;
        }
        return i;
    }

    private boolean isNationalForm(String national, String international) {
        if (!national.startsWith("0") || national.startsWith("00")) {
            return false;
        }
        String subscriber = national.substring(1);
        return subscriber.length() >= scoring.phoneMinPrefixDigits()
                && international.length() > subscriber.length()
                && international.endsWith(subscriber);
    }
}
