package com.skillswap.backend.mapper;

import com.skillswap.backend.domain.SocialLink;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * MyBatis mapper for social_links
 */
@Mapper
public interface SocialLinkMapper {
    /**
     * All links of a user ordered by platform
     */
    List<SocialLink> findByUserId(@Param("userId") Long userId);

    /**
     * Update the url of an existing platform link
     * @return affected rows
     */
    int updateUrl(@Param("userId") Long userId,
                  @Param("platform") String platform,
                  @Param("url") String url);

    /**
     * Insert a new platform link
     * @return affected rows
     */
    int insert(SocialLink link);
}
