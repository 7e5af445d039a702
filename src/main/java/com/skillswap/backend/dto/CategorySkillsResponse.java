package com.skillswap.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategorySkillsResponse {
    private String category;

    /**
     * Skill names, alphabetical
     */
    private List<String> skills;
}
