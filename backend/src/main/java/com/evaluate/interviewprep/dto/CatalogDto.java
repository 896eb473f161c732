package com.evaluate.interviewprep.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/** Role and level choices offered when creating a session. */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CatalogDto {
    private List<String> roles;
    private List<String> levels;
    private List<String> interactionModes;
}
