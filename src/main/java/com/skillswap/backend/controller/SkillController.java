package com.skillswap.backend.controller;

import com.skillswap.backend.dto.AddSkillRequest;
import com.skillswap.backend.dto.ApiResponse;
import com.skillswap.backend.dto.CategorySkillsResponse;
import com.skillswap.backend.dto.PrioritySkillRequest;
import com.skillswap.backend.dto.SkillMutationResponse;
import com.skillswap.backend.exception.BusinessException;
import com.skillswap.backend.service.SkillAssignmentService;
import com.skillswap.backend.service.SkillCatalogService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Skill catalog lookups and a user's skill assignments
 */
@Slf4j
@RestController
@RequestMapping("/api")
@Validated
@Tag(name = "Skills", description = "APIs for skill lists and priority skills")
public class SkillController {

    @Autowired
    private SkillCatalogService catalogService;

    @Autowired
    private SkillAssignmentService assignmentService;

    @GetMapping("/unselected-skills")
    @Operation(summary = "Unselected skills", description = "Skills the user has not picked, grouped by category")
    public ApiResponse<List<CategorySkillsResponse>> getUnselectedSkills(@RequestParam @NotBlank String username) {
        return ApiResponse.success(catalogService.getUnselectedSkills(username));
    }

    @PostMapping("/add-skill")
    @Operation(summary = "Add skill", description = "Add a skill to the learn or teach list")
    public ApiResponse<SkillMutationResponse> addSkill(@Valid @RequestBody AddSkillRequest request) {
        int rowCount = assignmentService.addSkill(request.getUsername(), request.getSkill(), request.getToLearn());
        return ApiResponse.success("'" + request.getSkill() + "' has been added to your list",
                new SkillMutationResponse(request.getSkill(), rowCount));
    }

    @DeleteMapping("/remove-skill")
    @Operation(summary = "Remove skill", description = "Remove a skill whatever its role")
    public ApiResponse<SkillMutationResponse> removeSkill(@RequestParam @NotBlank String username,
                                                          @RequestParam @NotBlank String skill) {
        int rowCount = assignmentService.removeSkill(username, skill);
        return ApiResponse.success("Deletion successful", new SkillMutationResponse(skill, rowCount));
    }

    @PutMapping("/update-priority-skill")
    @Operation(summary = "Set priority skill")
    public ApiResponse<Void> updatePrioritySkill(@Valid @RequestBody PrioritySkillRequest request) {
        if (!StringUtils.hasText(request.getSkill())) {
            throw new BusinessException("Skill is required");
        }
        assignmentService.setPriority(request.getUser(), request.getSkill(), request.getIsToLearn());
        return ApiResponse.success("Successfully updated", null);
    }

    @DeleteMapping("/unprioritize-skill")
    @Operation(summary = "Clear priority skill")
    public ApiResponse<Void> unprioritizeSkill(@Valid @RequestBody PrioritySkillRequest request) {
        assignmentService.clearPriority(request.getUser(), request.getIsToLearn());
        String subject = StringUtils.hasText(request.getSkill()) ? request.getSkill() : "Priority skill";
        return ApiResponse.success(subject + " unprioritized", null);
    }
}
