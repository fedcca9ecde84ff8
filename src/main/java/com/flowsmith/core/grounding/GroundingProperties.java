package com.flowsmith.core.grounding;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "flowsmith.grounding")
public class GroundingProperties {

    private double minConfidence = 0.7;
    private boolean failFast = false;
    private double requireConfirmationThreshold = 0.85;
    private int maxCandidates = 3;
    private double fuzzyMinSimilarity = 0.7;
    private double descriptionMinScore = 0.5;
    private double patternMinMatchRate = 0.8;
    private int sampleSize = 10;

    public double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public boolean isFailFast() {
        return failFast;
    }

    public void setFailFast(boolean failFast) {
        this.failFast = failFast;
    }

    public double getRequireConfirmationThreshold() {
        return requireConfirmationThreshold;
    }

    public void setRequireConfirmationThreshold(double requireConfirmationThreshold) {
        this.requireConfirmationThreshold = requireConfirmationThreshold;
    }

    public int getMaxCandidates() {
        return maxCandidates;
    }

    public void setMaxCandidates(int maxCandidates) {
        this.maxCandidates = maxCandidates;
    }

    public double getFuzzyMinSimilarity() {
        return fuzzyMinSimilarity;
    }

    public void setFuzzyMinSimilarity(double fuzzyMinSimilarity) {
        this.fuzzyMinSimilarity = fuzzyMinSimilarity;
    }

    public double getDescriptionMinScore() {
        return descriptionMinScore;
    }

    public void setDescriptionMinScore(double descriptionMinScore) {
        this.descriptionMinScore = descriptionMinScore;
    }

    public double getPatternMinMatchRate() {
        return patternMinMatchRate;
    }

    public void setPatternMinMatchRate(double patternMinMatchRate) {
        this.patternMinMatchRate = patternMinMatchRate;
    }

    public int getSampleSize() {
        return sampleSize;
    }

    public void setSampleSize(int sampleSize) {
        this.sampleSize = sampleSize;
    }

    public GroundingConfig toConfig() {
        return new GroundingConfig(minConfidence, failFast, requireConfirmationThreshold, maxCandidates,
                fuzzyMinSimilarity, descriptionMinScore, patternMinMatchRate, sampleSize);
    }
}
