package com.skillswap.backend.service;

import com.skillswap.backend.domain.SkillAssignment;
import com.skillswap.backend.enums.SkillRole;
import com.skillswap.backend.exception.NoOpMutationException;
import com.skillswap.backend.exception.SkillAlreadyAssignedException;
import com.skillswap.backend.exception.SkillNotFoundException;
import com.skillswap.backend.mapper.SkillAssignmentMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Skill assignment ledger: which skills a user learns or teaches, and the
 * priority skill of each role.
 *
 * <p>Priority pointers are stored on every assignment row of the user and are
 * kept identical across those rows. A pointer always names a skill the user
 * holds in the matching role.
 */
@Service
@Slf4j
public class SkillAssignmentService {

    @Autowired
    private SkillAssignmentMapper assignmentMapper;

    @Autowired
    private SkillCatalogService catalogService;

    @Autowired
    private UserService userService;

    /**
     * Assign a skill in one role.
     *
     * @return the user's assignment count after the insert
     * @throws SkillAlreadyAssignedException when the user already holds the skill in either role
     */
    @Transactional
    public int addSkill(String username, String skillName, boolean toLearn) {
        Long userId = userService.requireUserId(username);
        Long skillId = catalogService.requireSkillId(skillName);
        SkillRole role = SkillRole.of(toLearn);

        // New rows inherit the user's current priority pointers
        List<SkillAssignment> existing = assignmentMapper.findByUserId(userId);
        SkillAssignment template = existing.isEmpty() ? null : existing.get(0);

        SkillAssignment assignment = SkillAssignment.builder()
                .userId(userId)
                .skillId(skillId)
                .learning(role.isLearning())
                .teaching(!role.isLearning())
                .learnPrioritySkillId(template == null ? null : template.getLearnPrioritySkillId())
                .teachPrioritySkillId(template == null ? null : template.getTeachPrioritySkillId())
                .build();

        int inserted;
        try {
            inserted = assignmentMapper.insert(assignment);
        } catch (DuplicateKeyException e) {
            throw new SkillAlreadyAssignedException("'" + skillName + "' is already on your list");
        }
        if (inserted == 0) {
            throw new NoOpMutationException("'" + skillName + "' was not added");
        }

        log.info("Skill added: username={}, skill={}, role={}", username, skillName, role);
        return assignmentMapper.countByUserId(userId);
    }

    /**
     * Remove a skill whatever its role. A priority pointing at it is cleared.
     *
     * @return the user's assignment count after the delete
     * @throws NoOpMutationException when the user does not hold the skill
     */
    @Transactional
    public int removeSkill(String username, String skillName) {
        Long userId = userService.requireUserId(username);
        Long skillId = catalogService.requireSkillId(skillName);

        int deleted = assignmentMapper.delete(userId, skillId);
        if (deleted == 0) {
            throw new NoOpMutationException("'" + skillName + "' is not on your list");
        }

        int cleared = assignmentMapper.clearPriorityReferences(userId, skillId);
        log.info("Skill removed: username={}, skill={}, priorityRowsCleared={}", username, skillName, cleared);
        return assignmentMapper.countByUserId(userId);
    }

    /**
     * Make a skill the learn or teach priority of the user.
     *
     * @throws SkillNotFoundException when the user does not hold the skill in that role
     */
    @Transactional
    public void setPriority(String username, String skillName, boolean toLearn) {
        Long userId = userService.requireUserId(username);
        Long skillId = catalogService.requireSkillId(skillName);
        SkillRole role = SkillRole.of(toLearn);

        SkillAssignment assignment = assignmentMapper.findOne(userId, skillId);
        if (assignment == null || !Boolean.valueOf(role.isLearning()).equals(assignment.getLearning())) {
            throw new SkillNotFoundException(
                    "'" + skillName + "' is not on your skills to " + role.getLabel() + " list");
        }

        int updated = assignmentMapper.updatePriority(userId, skillId, toLearn);
        log.info("Priority set: username={}, skill={}, role={}, rows={}", username, skillName, role, updated);
    }

    /**
     * Clear the learn or teach priority of the user. Assignment rows are otherwise unchanged.
     */
    @Transactional
    public void clearPriority(String username, boolean toLearn) {
        Long userId = userService.requireUserId(username);
        int updated = assignmentMapper.clearPriority(userId, toLearn);
        log.info("Priority cleared: username={}, role={}, rows={}", username, SkillRole.of(toLearn), updated);
    }

    /**
     * All assignments of a user, ordered by skill name
     */
    public List<SkillAssignment> getAssignments(Long userId) {
        return assignmentMapper.findByUserId(userId);
    }
}
