package com.skillswap.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Aggregated profile: user record, skill lists, priorities and social links
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileResponse {
    /**
     * Registration month, formatted like "2024,JAN"
     */
    private String createdAt;

    private String username;
    private String email;
    private String profilePicture;
    private String phoneNumber;
    private String description;

    /**
     * Never empty: holds a single placeholder sentence when the user has no such skill
     */
    private List<String> skillsToLearn;

    private List<String> skillsToTeach;

    private String learnPrioritySkill;
    private String teachPrioritySkill;

    private List<SocialLinkResponse> socials;
}
