package com.skillswap.backend.domain;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Link to one of a user's social platforms, at most one per platform
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SocialLink {
    private Long userId;
    private String platform;
    private String url;
}
