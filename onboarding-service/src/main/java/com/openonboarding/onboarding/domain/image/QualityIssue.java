package com.openonboarding.onboarding.domain.image;

public record QualityIssue(IssueType type, IssueSeverity severity, String description, String suggestedFix) {
}
