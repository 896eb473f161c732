package com.evaluate.interviewprep.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Parameters for spinning up a follow-on session. Role and level are optional for a fresh new round. */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ContinuationOptions {
    private ContinuationType type;
    private String roleId;
    private String level;
    private String drillCategory;
}
