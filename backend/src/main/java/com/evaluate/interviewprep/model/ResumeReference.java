package com.evaluate.interviewprep.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Points a question back at the part of the resume it was built from. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResumeReference {
    private String section;
    private String content;
    private String relevance;
}
