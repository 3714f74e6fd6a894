package com.db.ecd.assessment.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubmitAssessmentRequest {
    /** Falls back to the configured default assessor when absent. */
    private String assessedBy;
}
