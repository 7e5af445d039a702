package com.skillswap.backend.service;

import com.skillswap.backend.BaseIntegrationTest;
import com.skillswap.backend.domain.CategorySkill;
import com.skillswap.backend.dto.CategorySkillsResponse;
import com.skillswap.backend.exception.NotFoundResultException;
import com.skillswap.backend.exception.UserNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Skill Catalog Service Tests")
class SkillCatalogServiceTest extends BaseIntegrationTest {

    @Autowired
    private SkillCatalogService catalogService;

    @Autowired
    private DataSource dataSource;

    @BeforeEach
    void setUp() {
        registerUser("alice");
    }

    @Test
    @DisplayName("Taxonomy lists every category-skill pair")
    void testTaxonomy() {
        List<CategorySkill> taxonomy = catalogService.getTaxonomy();

        assertThat(taxonomy).hasSize(17);
        assertThat(taxonomy).filteredOn(e -> e.getSkillName().equals("Photography"))
            .extracting(CategorySkill::getCategoryName)
            .containsExactly("Arts & Crafts", "Technology");
    }

    @Test
    @DisplayName("A new user sees every category, alphabetically")
    void testUnselectedForNewUser() {
        List<CategorySkillsResponse> unselected = catalogService.getUnselectedSkills("alice");

        assertThat(unselected).extracting(CategorySkillsResponse::getCategory)
            .containsExactly("Arts & Crafts", "Languages", "Music", "Sports & Fitness", "Technology");
        assertThat(unselected.get(0).getSkills())
            .containsExactly("Drawing", "Painting", "Photography", "Pottery");
    }

    @Test
    @DisplayName("Assigned skills are excluded in every category they belong to")
    void testAssignedSkillsExcluded() {
        skillAssignmentService.addSkill("alice", "Painting", true);
        skillAssignmentService.addSkill("alice", "Photography", false);

        List<CategorySkillsResponse> unselected = catalogService.getUnselectedSkills("alice");

        assertThat(unselected).flatExtracting(CategorySkillsResponse::getSkills)
            .doesNotContain("Painting", "Photography")
            .contains("Drawing", "Java");
    }

    @Test
    @DisplayName("Categories with no remaining skill are omitted")
    void testEmptyCategoryOmitted() {
        skillAssignmentService.addSkill("alice", "Spanish", true);
        skillAssignmentService.addSkill("alice", "French", true);
        skillAssignmentService.addSkill("alice", "Japanese", false);

        assertThat(catalogService.getUnselectedSkills("alice"))
            .extracting(CategorySkillsResponse::getCategory)
            .doesNotContain("Languages");
    }

    @Test
    @DisplayName("No data when every skill has been picked")
    void testAllSkillsAssigned() {
        catalogService.getTaxonomy().stream()
            .map(CategorySkill::getSkillName)
            .distinct()
            .forEach(skill -> skillAssignmentService.addSkill("alice", skill, true));

        assertThatThrownBy(() -> catalogService.getUnselectedSkills("alice"))
            .isInstanceOf(NotFoundResultException.class)
            .hasMessage("No data");
    }

    @Test
    @DisplayName("Unknown user is not found")
    void testUnknownUser() {
        assertThatThrownBy(() -> catalogService.getUnselectedSkills("ghost"))
            .isInstanceOf(UserNotFoundException.class);
    }

    @Test
    @DisplayName("Seed script can run again on an initialised database")
    void testSeedScriptRerunnable() {
        new ResourceDatabasePopulator(new ClassPathResource("db/data.sql"))
            .execute(dataSource);

        JdbcTemplate jdbc = new JdbcTemplate(dataSource);
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM skills", Integer.class)).isEqualTo(16);
        assertThat(jdbc.queryForObject("SELECT COUNT(*) FROM categories_skills", Integer.class)).isEqualTo(17);
    }
}
