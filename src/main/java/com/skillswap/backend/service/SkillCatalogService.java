package com.skillswap.backend.service;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.skillswap.backend.domain.CategorySkill;
import com.skillswap.backend.domain.SkillAssignment;
import com.skillswap.backend.dto.CategorySkillsResponse;
import com.skillswap.backend.exception.NotFoundResultException;
import com.skillswap.backend.exception.SkillNotFoundException;
import com.skillswap.backend.mapper.SkillAssignmentMapper;
import com.skillswap.backend.mapper.SkillCatalogMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

/**
 * Read-only category/skill taxonomy.
 * The taxonomy is loaded once and kept in a local Caffeine cache.
 */
@Service
@Slf4j
public class SkillCatalogService {

    private static final String TAXONOMY_KEY = "taxonomy";

    @Autowired
    private SkillCatalogMapper catalogMapper;

    @Autowired
    private SkillAssignmentMapper assignmentMapper;

    @Autowired
    private UserService userService;

    @Value("${cache.catalog.ttl.minutes:60}")
    private long ttlMinutes;

    private Cache<String, List<CategorySkill>> taxonomyCache;

    @PostConstruct
    public void initializeCache() {
        taxonomyCache = Caffeine.newBuilder()
                .maximumSize(1)
                .expireAfterWrite(ttlMinutes, TimeUnit.MINUTES)
                .build();
    }

    /**
     * Full taxonomy ordered by category name, then skill name
     */
    public List<CategorySkill> getTaxonomy() {
        return taxonomyCache.get(TAXONOMY_KEY, key -> {
            List<CategorySkill> taxonomy = List.copyOf(catalogMapper.findTaxonomy());
            log.debug("Loaded skill taxonomy: {} entries", taxonomy.size());
            return taxonomy;
        });
    }

    /**
     * Resolve a skill name to its id
     * @throws SkillNotFoundException when the catalog has no such skill
     */
    public Long requireSkillId(String skillName) {
        Long skillId = catalogMapper.findSkillIdByName(skillName);
        if (skillId == null) {
            throw new SkillNotFoundException("Skill not found: " + skillName);
        }
        return skillId;
    }

    /**
     * Skills the user has not picked in any role, grouped by category.
     * Categories are alphabetical, as are the skills inside each; categories
     * left with no skill are omitted.
     *
     * @throws NotFoundResultException when no category has an unselected skill
     */
    public List<CategorySkillsResponse> getUnselectedSkills(String username) {
        Long userId = userService.requireUserId(username);
        Set<Long> selected = assignmentMapper.findByUserId(userId).stream()
                .map(SkillAssignment::getSkillId)
                .collect(Collectors.toSet());

        Map<String, List<String>> byCategory = new LinkedHashMap<>();
        for (CategorySkill entry : getTaxonomy()) {
            if (!selected.contains(entry.getSkillId())) {
                byCategory.computeIfAbsent(entry.getCategoryName(), k -> new ArrayList<>())
                        .add(entry.getSkillName());
            }
        }

        if (byCategory.isEmpty()) {
            throw new NotFoundResultException("No data");
        }

        return byCategory.entrySet().stream()
                .map(e -> new CategorySkillsResponse(e.getKey(), e.getValue()))
                .collect(Collectors.toList());
    }
}
