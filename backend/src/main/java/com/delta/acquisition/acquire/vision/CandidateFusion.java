package com.delta.acquisition.acquire.vision;

import com.delta.acquisition.acquire.model.ActionableElement;
import com.delta.acquisition.acquire.model.CandidateField;
import com.delta.acquisition.acquire.model.JobListingCandidate;
import com.delta.acquisition.acquire.util.TextSimilarity;
import com.delta.acquisition.config.AcquisitionProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Merges local and remote candidates. Two candidates refer to the same listing when their title and company
 * are similar enough; each field of a merged candidate comes from whichever side was more confident, with
 * ties going to the local side. Unmatched candidates from either side are kept.
 */
@Component
public class CandidateFusion {
    private final double matchThreshold;

    @Autowired
    public CandidateFusion(AcquisitionProperties properties) {
        this(properties.getVision().getMatchThreshold());
    }

    public CandidateFusion(double matchThreshold) {
        this.matchThreshold = matchThreshold;
    }

    public record Fused(List<JobListingCandidate> candidates, double confidence, ActionableElement actionableElement) {
    }

    public Fused fuse(ProviderResult local, ProviderResult remote) {
        List<JobListingCandidate> remaining = new ArrayList<>(remote.candidates());
        List<JobListingCandidate> merged = new ArrayList<>();
        for (JobListingCandidate candidate : local.candidates()) {
            int match = bestMatch(candidate, remaining);
            if (match < 0) {
                merged.add(candidate);
            } else {
                merged.add(merge(candidate, remaining.remove(match)));
            }
        }
        merged.addAll(remaining);
        double confidence = VisionResponseParser.meanConfidence(
            merged,
            Math.max(local.confidence(), remote.confidence())
        );
        return new Fused(merged, confidence, strongerAction(local.actionableElement(), remote.actionableElement()));
    }

    private int bestMatch(JobListingCandidate candidate, List<JobListingCandidate> pool) {
        String key = matchKey(candidate);
        int best = -1;
        double bestScore = matchThreshold;
        for (int i = 0; i < pool.size(); i++) {
            double score = TextSimilarity.similarity(key, matchKey(pool.get(i)));
            if (score > bestScore || (best < 0 && score >= bestScore)) {
                best = i;
                bestScore = score;
            }
        }
        return best;
    }

    private static String matchKey(JobListingCandidate candidate) {
        String title = candidate.title() == null ? "" : candidate.title();
        String company = candidate.company() == null ? "" : candidate.company();
        return title + " " + company;
    }

    private static JobListingCandidate merge(JobListingCandidate local, JobListingCandidate remote) {
        Map<CandidateField, Double> confidence = new EnumMap<>(CandidateField.class);
        boolean[] useLocal = new boolean[CandidateField.values().length];
        for (CandidateField field : CandidateField.values()) {
            double localScore = local.confidenceOf(field);
            double remoteScore = remote.confidenceOf(field);
            boolean pickLocal = local.valueOf(field) != null && (remote.valueOf(field) == null || localScore >= remoteScore);
            useLocal[field.ordinal()] = pickLocal;
            Double score = (pickLocal ? local : remote).fieldConfidence().get(field);
            if (score != null) {
                confidence.put(field, score);
            }
        }
        return new JobListingCandidate(
            useLocal[CandidateField.TITLE.ordinal()] ? local.title() : remote.title(),
            useLocal[CandidateField.COMPANY.ordinal()] ? local.company() : remote.company(),
            useLocal[CandidateField.LOCATION.ordinal()] ? local.location() : remote.location(),
            useLocal[CandidateField.SALARY.ordinal()] ? local.salary() : remote.salary(),
            local.boundingBox() != null ? local.boundingBox() : remote.boundingBox(),
            confidence
        );
    }

    private static ActionableElement strongerAction(ActionableElement local, ActionableElement remote) {
        if (local == null) {
            return remote;
        }
        if (remote == null) {
            return local;
        }
        return remote.confidence() > local.confidence() ? remote : local;
    }
}
