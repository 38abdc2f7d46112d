package com.openonboarding.onboarding.domain.model;

import com.openonboarding.onboarding.domain.image.IssueSeverity;
import com.openonboarding.onboarding.domain.image.QualityIssue;
import lombok.Builder;

import java.util.List;

/**
 * An uploaded image as stored in the draft. Score and issues are captured by the analyzer at upload time.
 */
@Builder(toBuilder = true)
public record ImageRecord(
        String id,
        ImageCategory category,
        String url,
        Integer qualityScore,
        ImageDimensions dimensions,
        List<QualityIssue> issues,
        List<String> tags
) {
    public ImageRecord {
        issues = issues == null ? List.of() : List.copyOf(issues);
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public boolean passedAnalysis() {
        return issues.stream().noneMatch(issue -> issue.severity() == IssueSeverity.HIGH);
    }
}
