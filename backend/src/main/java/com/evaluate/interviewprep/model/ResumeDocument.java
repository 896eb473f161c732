package com.evaluate.interviewprep.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ResumeDocument {
    private String content;
    private String format = "text";
    private String filename;
}
