package com.skillswap.backend.mapper;

import com.skillswap.backend.domain.SkillAssignment;
import org.apache.ibatis.annotations.Mapper;
import org.apache.ibatis.annotations.Param;

import java.util.List;

/**
 * MyBatis mapper for users_skills
 */
@Mapper
public interface SkillAssignmentMapper {
    /**
     * Insert an assignment. Throws DuplicateKeyException when (user, skill) exists.
     * @return affected rows
     */
    int insert(SkillAssignment assignment);

    /**
     * Delete the assignment of a skill regardless of its role
     * @return affected rows
     */
    int delete(@Param("userId") Long userId, @Param("skillId") Long skillId);

    /**
     * Find one assignment, null when absent
     */
    SkillAssignment findOne(@Param("userId") Long userId, @Param("skillId") Long skillId);

    /**
     * All assignments of a user with skill names, ordered by skill name
     */
    List<SkillAssignment> findByUserId(@Param("userId") Long userId);

    /**
     * Number of skills assigned to a user
     */
    int countByUserId(@Param("userId") Long userId);

    /**
     * Point the learn or teach priority of every row of the user at a skill
     * @return affected rows
     */
    int updatePriority(@Param("userId") Long userId,
                       @Param("skillId") Long skillId,
                       @Param("toLearn") boolean toLearn);

    /**
     * Null the learn or teach priority on every row of the user
     * @return affected rows
     */
    int clearPriority(@Param("userId") Long userId, @Param("toLearn") boolean toLearn);

    /**
     * Null any priority of the user that points at the given skill
     * @return affected rows
     */
    int clearPriorityReferences(@Param("userId") Long userId, @Param("skillId") Long skillId);
}
