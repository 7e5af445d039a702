package com.skillswap.backend.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A user's relationship to one skill (row of users_skills)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SkillAssignment {
    private Long userId;

    private Long skillId;

    /**
     * Skill name, joined from skills
     */
    private String skillName;

    /**
     * Exactly one of learning / teaching is true
     */
    private Boolean learning;

    private Boolean teaching;

    /**
     * Priority pointers, shared by all rows of the same user
     */
    private Long learnPrioritySkillId;

    private Long teachPrioritySkillId;
}
