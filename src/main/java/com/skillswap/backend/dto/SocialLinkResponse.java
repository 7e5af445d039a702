package com.skillswap.backend.dto;

import com.skillswap.backend.domain.SocialLink;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SocialLinkResponse {
    private String platform;
    private String url;

    public static SocialLinkResponse fromSocialLink(SocialLink link) {
        return new SocialLinkResponse(link.getPlatform(), link.getUrl());
    }
}
