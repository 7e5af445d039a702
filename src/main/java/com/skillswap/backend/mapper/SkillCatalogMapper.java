package com.skillswap.backend.mapper;

import com.skillswap.backend.domain.CategorySkill;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * MyBatis mapper for the read-only category/skill taxonomy
 */
@Mapper
public interface SkillCatalogMapper {
    /**
     * All category/skill pairs ordered by category name, then skill name
     */
    List<CategorySkill> findTaxonomy();

    /**
     * Resolve a skill name to its id, null when unknown
     */
    Long findSkillIdByName(@Param("name") String name);
}
