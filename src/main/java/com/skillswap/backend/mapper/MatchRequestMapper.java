package com.skillswap.backend.mapper;

import com.skillswap.backend.domain.MatchRequest;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * MyBatis mapper for match_requests
 */
@Mapper
public interface MatchRequestMapper {
    /**
     * Insert a pending request. Throws DuplicateKeyException for an existing (sender, receiver) pair.
     * @return affected rows
     */
    int insert(MatchRequest request);

    /**
     * Distinct usernames the user has sent requests to, alphabetical
     */
    List<String> findSentUsernames(@Param("userId") Long userId);

    /**
     * Distinct usernames the user has received requests from, alphabetical
     */
    List<String> findReceivedUsernames(@Param("userId") Long userId);

    /**
     * Delete every request the user sent
     * @return affected rows
     */
    int deleteBySenderId(@Param("senderId") Long senderId);
}
