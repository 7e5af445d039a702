package com.skillswap.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of adding or removing a skill
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SkillMutationResponse {
    private String skill;

    /**
     * Number of skills assigned to the user after the change
     */
    private Integer rowCount;
}
