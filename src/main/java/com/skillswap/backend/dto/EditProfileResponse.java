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
public class EditProfileResponse {
    /**
     * Public URL of the current profile picture
     */
    private String img;

    private List<SocialLinkResponse> newSocials;

    private String newUsername;
}
