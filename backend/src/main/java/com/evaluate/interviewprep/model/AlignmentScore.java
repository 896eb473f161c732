package com.evaluate.interviewprep.model;

import lombok.AllArgsConstructor;
import lombok.Value;

/** Percentages in [0, 100]. */
@Value
@AllArgsConstructor
public class AlignmentScore {
    int overall;
    int technical;
    int experience;
    int cultural;

    public static AlignmentScore zero() {
        return new AlignmentScore(0, 0, 0, 0);
    }
}
