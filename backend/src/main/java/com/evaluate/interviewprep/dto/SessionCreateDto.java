package com.evaluate.interviewprep.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SessionCreateDto {
    private String role;
    private String level;
    private String interactionMode = "text";
}
