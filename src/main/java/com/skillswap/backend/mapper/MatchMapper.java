package com.skillswap.backend.mapper;

import com.skillswap.backend.domain.Match;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * MyBatis mapper for matches. Rows are canonical: userId &lt; matchId.
 */
@Mapper
public interface MatchMapper {
    /**
     * Insert a canonical match row
     * @return affected rows
     */
    int insert(Match match);

    /**
     * Delete the canonical row of a pair
     * @return affected rows
     */
    int deletePair(@Param("userId") Long userId, @Param("matchId") Long matchId);

    /**
     * Count rows for a canonical pair (0 or 1)
     */
    int countPair(@Param("userId") Long userId, @Param("matchId") Long matchId);

    /**
     * Usernames matched with the user, alphabetical
     */
    List<String> findMatchedUsernames(@Param("userId") Long userId);
}
