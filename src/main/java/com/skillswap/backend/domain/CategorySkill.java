package com.skillswap.backend.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One entry of the category to skill taxonomy.
 * A skill listed under several categories yields one entry per category.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CategorySkill {
    private Long categoryId;
    private String categoryName;
    private Long skillId;
    private String skillName;
}
