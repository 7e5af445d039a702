package com.skillswap.backend.controller;

import com.skillswap.backend.dto.ApiResponse;
import com.skillswap.backend.dto.EditProfileRequest;
import com.skillswap.backend.dto.EditProfileResponse;
import com.skillswap.backend.dto.ProfileResponse;
import com.skillswap.backend.security.AuthenticatedUser;
import com.skillswap.backend.service.ProfileService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

/**
 * Profile read view and profile edits
 */
@Slf4j
@RestController
@RequestMapping("/api")
@Validated
@Tag(name = "Profiles", description = "APIs for user profiles")
public class ProfileController {

    @Autowired
    private ProfileService profileService;

    @GetMapping("/profile")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Get profile", description = "Aggregated profile of the selected user")
    public ApiResponse<ProfileResponse> getProfile(AuthenticatedUser principal,
                                                   @RequestParam @NotBlank String selectedUser) {
        log.debug("Profile requested: viewer={}, selectedUser={}", principal.username(), selectedUser);
        return ApiResponse.success(profileService.getProfile(selectedUser));
    }

    @PostMapping("/edit-profile")
    @Operation(summary = "Edit profile", description = "Update username, description, picture and one social link")
    public ApiResponse<EditProfileResponse> editProfile(@Valid @ModelAttribute EditProfileRequest request,
                                                        @RequestParam(value = "imgFile", required = false) MultipartFile imgFile) {
        log.info("Editing profile: username={}", request.getCurrentUsername());
        return ApiResponse.success("Profile updated", profileService.editProfile(request, imgFile));
    }
}
