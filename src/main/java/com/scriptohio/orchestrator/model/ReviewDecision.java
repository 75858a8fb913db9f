package com.scriptohio.orchestrator.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReviewDecision {
    private String reviewerId;
    private ReviewVerdict verdict;
    private String comment;

    public static ReviewDecision of(String reviewerId, ReviewVerdict verdict, String comment) {
        return new ReviewDecision(reviewerId, verdict, comment);
    }
}
