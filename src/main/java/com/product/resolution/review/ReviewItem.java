package com.product.resolution.review;

import com.product.resolution.core.model.NormalizedCandidate;
import com.product.resolution.decision.ConfidenceTier;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A candidate waiting for a human to confirm or refute its proposed parent product.
 * Status fields change only through the owning {@link ReviewQueue}.
 */
public class ReviewItem {

    private final String id;
    private final NormalizedCandidate candidate;
    private final String proposedParentKey;
    private final String proposedParentName;
    private final double score;
    private final ConfidenceTier tier;
    private final String sourceSystem;
    private final Instant submittedAt;
    private volatile ReviewStatus status;
    private volatile Instant reviewedAt;
    private volatile String reviewer;
    private volatile String notes;

    private ReviewItem(Builder builder) {
        this.id = builder.id != null ? builder.id : UUID.randomUUID().toString();
        this.candidate = Objects.requireNonNull(builder.candidate, "candidate is required");
        this.proposedParentKey = Objects.requireNonNull(builder.proposedParentKey, "proposedParentKey is required");
        this.proposedParentName = builder.proposedParentName;
        this.score = builder.score;
        this.tier = Objects.requireNonNull(builder.tier, "tier is required");
        this.sourceSystem = builder.sourceSystem;
        this.submittedAt = builder.submittedAt != null ? builder.submittedAt : Instant.now();
        this.status = ReviewStatus.PENDING;
    }

    public String getId() {
        return id;
    }

    public NormalizedCandidate getCandidate() {
        return candidate;
    }

    public String getCandidateKey() {
        return candidate.productKey();
    }

    public String getProposedParentKey() {
        return proposedParentKey;
    }

    public String getProposedParentName() {
        return proposedParentName;
    }

    public double getScore() {
        return score;
    }

    public ConfidenceTier getTier() {
        return tier;
    }

    public String getSourceSystem() {
        return sourceSystem;
    }

    public Instant getSubmittedAt() {
        return submittedAt;
    }

    public ReviewStatus getStatus() {
        return status;
    }

    public Instant getReviewedAt() {
        return reviewedAt;
    }

    public String getReviewer() {
        return reviewer;
    }

    public String getNotes() {
        return notes;
    }

    public boolean isPending() {
        return status == ReviewStatus.PENDING;
    }

    synchronized void resolve(ReviewStatus outcome, String reviewer, String notes) {
        if (!isPending()) {
            throw new IllegalStateException("Review item is not pending: " + id);
        }
        this.status = outcome;
        this.reviewedAt = Instant.now();
        this.reviewer = reviewer;
        this.notes = notes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ReviewItem that = (ReviewItem) o;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "ReviewItem{" +
                "id='" + id + '\'' +
                ", candidateKey='" + candidate.productKey() + '\'' +
                ", proposedParentKey='" + proposedParentKey + '\'' +
                ", score=" + score +
                ", tier=" + tier +
                ", status=" + status +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id;
        private NormalizedCandidate candidate;
        private String proposedParentKey;
        private String proposedParentName;
        private double score;
        private ConfidenceTier tier;
        private String sourceSystem;
        private Instant submittedAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder candidate(NormalizedCandidate candidate) {
            this.candidate = candidate;
            return this;
        }

        public Builder proposedParentKey(String proposedParentKey) {
            this.proposedParentKey = proposedParentKey;
            return this;
        }

        public Builder proposedParentName(String proposedParentName) {
            this.proposedParentName = proposedParentName;
            return this;
        }

        public Builder score(double score) {
            this.score = score;
            return this;
        }

        public Builder tier(ConfidenceTier tier) {
            this.tier = tier;
            return this;
        }

        public Builder sourceSystem(String sourceSystem) {
            this.sourceSystem = sourceSystem;
            return this;
        }

        public Builder submittedAt(Instant submittedAt) {
            this.submittedAt = submittedAt;
            return this;
        }

        public ReviewItem build() {
            return new ReviewItem(this);
        }
    }
}
