package com.skillswap.backend.mapper;

import com.skillswap.backend.domain.User;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

/**
 * MyBatis mapper for User operations
 */
@Mapper
public interface UserMapper {
    /**
     * Insert a new user, populating the generated id
     * @return affected rows
     */
    int insert(User user);

    /**
     * Find user by username
     */
    User findByUsername(@Param("username") String username);

    /**
     * Find user by email
     */
    User findByEmail(@Param("email") String email);

    /**
     * Resolve a username to its id, null when unknown
     */
    Long findIdByUsername(@Param("username") String username);

    /**
     * Update only the non-null profile columns. Callers must pass at least one value.
     * @return affected rows
     */
    int updateProfile(@Param("userId") Long userId,
                      @Param("username") String username,
                      @Param("description") String description,
                      @Param("profilePicture") String profilePicture);
}
