package com.entity.linking.api;

import com.entity.linking.similarity.MatchScoring;

import java.time.Duration;
import java.util.Objects;

/**
 * Options for contact matching and auto-linking.
 * Configures thresholds, result bounds, timeouts and the scoring curve.
 */
public class LinkingOptions {

    private static final int DEFAULT_MATCH_LIMIT = 10;
    private static final int DEFAULT_MAX_MATCH_LIMIT = 50;
    private static final int DEFAULT_CANDIDATE_POOL_SIZE = 50;
    private static final double DEFAULT_SENDER_MATCH_THRESHOLD = 0.9;
    private static final double DEFAULT_CONTENT_SIMILARITY_THRESHOLD = 0.75;
    private static final int DEFAULT_CONTENT_SEARCH_LIMIT = 10;
    private static final int DEFAULT_SENDER_CONTACT_LIMIT = 5;
    private static final int DEFAULT_MAX_SEARCH_QUERY_LENGTH = 500;
    private static final int DEFAULT_LINK_QUERY_LIMIT = 200;
    private static final Duration DEFAULT_CALL_TIMEOUT = Duration.ofSeconds(5);

    private final int defaultMatchLimit;
    private final int maxMatchLimit;
    private final int candidatePoolSize;
    private final double senderMatchThreshold;
    private final double contentSimilarityThreshold;
    private final int contentSearchLimit;
    private final int senderContactLimit;
    private final int maxSearchQueryLength;
    private final int linkQueryLimit;
    private final Duration callTimeout;
    private final MatchScoring matchScoring;

    private LinkingOptions(Builder builder) {
        this.defaultMatchLimit = builder.defaultMatchLimit;
        this.maxMatchLimit = builder.maxMatchLimit;
        this.candidatePoolSize = builder.candidatePoolSize;
        this.senderMatchThreshold = builder.senderMatchThreshold;
        this.contentSimilarityThreshold = builder.contentSimilarityThreshold;
        this.contentSearchLimit = builder.contentSearchLimit;
        this.senderContactLimit = builder.senderContactLimit;
        this.maxSearchQueryLength = builder.maxSearchQueryLength;
        this.linkQueryLimit = builder.linkQueryLimit;
        this.callTimeout = builder.callTimeout;
        this.matchScoring = builder.matchScoring;
    }

    public int getDefaultMatchLimit() {
        return defaultMatchLimit;
    }

    public int getMaxMatchLimit() {
        return maxMatchLimit;
    }

    /**
     * Contacts fetched per signal before scoring and ranking.
     */
    public int getCandidatePoolSize() {
        return candidatePoolSize;
    }

    /**
     * Minimum confidence for a sender match to identify a known contact.
     */
    public double getSenderMatchThreshold() {
        return senderMatchThreshold;
    }

    public double getContentSimilarityThreshold() {
        return contentSimilarityThreshold;
    }

    public int getContentSearchLimit() {
        return contentSearchLimit;
    }

    public int getSenderContactLimit() {
        return senderContactLimit;
    }

    public int getMaxSearchQueryLength() {
        return maxSearchQueryLength;
    }

    public int getLinkQueryLimit() {
        return linkQueryLimit;
    }

    /**
     * Timeout applied to each outbound call.
     */
    public Duration getCallTimeout() {
        return callTimeout;
    }

    public MatchScoring getMatchScoring() {
        return matchScoring;
    }

    /**
     * Creates default options.
     */
    public static LinkingOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private int defaultMatchLimit = DEFAULT_MATCH_LIMIT;
        private int maxMatchLimit = DEFAULT_MAX_MATCH_LIMIT;
        private int candidatePoolSize = DEFAULT_CANDIDATE_POOL_SIZE;
        private double senderMatchThreshold = DEFAULT_SENDER_MATCH_THRESHOLD;
        private double contentSimilarityThreshold = DEFAULT_CONTENT_SIMILARITY_THRESHOLD;
        private int contentSearchLimit = DEFAULT_CONTENT_SEARCH_LIMIT;
        private int senderContactLimit = DEFAULT_SENDER_CONTACT_LIMIT;
        private int maxSearchQueryLength = DEFAULT_MAX_SEARCH_QUERY_LENGTH;
        private int linkQueryLimit = DEFAULT_LINK_QUERY_LIMIT;
        private Duration callTimeout = DEFAULT_CALL_TIMEOUT;
        private MatchScoring matchScoring = MatchScoring.defaults();

        public Builder defaultMatchLimit(int defaultMatchLimit) {
            this.defaultMatchLimit = requirePositive(defaultMatchLimit, "defaultMatchLimit");
            return this;
        }

        public Builder maxMatchLimit(int maxMatchLimit) {
            this.maxMatchLimit = requirePositive(maxMatchLimit, "maxMatchLimit");
            return this;
        }

        public Builder candidatePoolSize(int candidatePoolSize) {
            this.candidatePoolSize = requirePositive(candidatePoolSize, "candidatePoolSize");
            return this;
        }

        public Builder senderMatchThreshold(double senderMatchThreshold) {
            validateThreshold(senderMatchThreshold, "senderMatchThreshold");
            this.senderMatchThreshold = senderMatchThreshold;
            return this;
        }

        public Builder contentSimilarityThreshold(double contentSimilarityThreshold) {
            validateThreshold(contentSimilarityThreshold, "contentSimilarityThreshold");
            this.contentSimilarityThreshold = contentSimilarityThreshold;
            return this;
        }

        public Builder contentSearchLimit(int contentSearchLimit) {
            this.contentSearchLimit = requirePositive(contentSearchLimit, "contentSearchLimit");
            return this;
        }

        public Builder senderContactLimit(int senderContactLimit) {
            this.senderContactLimit = requirePositive(senderContactLimit, "senderContactLimit");
            return this;
        }

        public Builder maxSearchQueryLength(int maxSearchQueryLength) {
            this.maxSearchQueryLength = requirePositive(maxSearchQueryLength, "maxSearchQueryLength");
            return this;
        }

        public Builder linkQueryLimit(int linkQueryLimit) {
            this.linkQueryLimit = requirePositive(linkQueryLimit, "linkQueryLimit");
            return this;
        }

        public Builder callTimeout(Duration callTimeout) {
            Objects.requireNonNull(callTimeout, "callTimeout");
            if (callTimeout.isNegative() || callTimeout.isZero()) {
                throw new IllegalArgumentException("callTimeout must be positive");
            }
            this.callTimeout = callTimeout;
            return this;
        }

        public Builder matchScoring(MatchScoring matchScoring) {
            this.matchScoring = Objects.requireNonNull(matchScoring, "matchScoring");
            return this;
        }

        public LinkingOptions build() {
            if (defaultMatchLimit > maxMatchLimit) {
                throw new IllegalArgumentException("defaultMatchLimit must be <= maxMatchLimit");
            }
            return new LinkingOptions(this);
        }

        private static int requirePositive(int value, String name) {
            if (value <= 0) {
                throw new IllegalArgumentException(name + " must be positive");
            }
            return value;
        }

        private static void validateThreshold(double value, String name) {
            if (value < 0.0 || value > 1.0) {
                throw new IllegalArgumentException(name + " must be between 0.0 and 1.0");
            }
        }
    }

    @Override
    public String toString() {
        return "LinkingOptions{" +
                "defaultMatchLimit=" + defaultMatchLimit +
                ", maxMatchLimit=" + maxMatchLimit +
                ", candidatePoolSize=" + candidatePoolSize +
                ", senderMatchThreshold=" + senderMatchThreshold +
                ", contentSimilarityThreshold=" + contentSimilarityThreshold +
                ", contentSearchLimit=" + contentSearchLimit +
                ", callTimeout=" + callTimeout +
                '}';
    }
}
