package com.skillswap.backend.service;

import com.skillswap.backend.BaseIntegrationTest;
import com.skillswap.backend.domain.SkillAssignment;
import com.skillswap.backend.exception.NoOpMutationException;
import com.skillswap.backend.exception.SkillAlreadyAssignedException;
import com.skillswap.backend.exception.SkillNotFoundException;
import com.skillswap.backend.exception.UserNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Skill Assignment Service Tests")
class SkillAssignmentServiceTest extends BaseIntegrationTest {

    private Long aliceId;

    @BeforeEach
    void setUp() {
        aliceId = registerUser("alice").getId();
    }

    @Test
    @DisplayName("Adding a skill increases the assignment count by one")
    void testAddSkill() {
        int count = skillAssignmentService.addSkill("alice", "Painting", true);

        assertThat(count).isEqualTo(1);
        List<SkillAssignment> assignments = skillAssignmentService.getAssignments(aliceId);
        assertThat(assignments).hasSize(1);
        assertThat(assignments.get(0).getSkillName()).isEqualTo("Painting");
        assertThat(assignments.get(0).getLearning()).isTrue();
        assertThat(assignments.get(0).getTeaching()).isFalse();
    }

    @Test
    @DisplayName("A skill held in one role cannot be added again in either role")
    void testAddSkillTwice() {
        skillAssignmentService.addSkill("alice", "Painting", true);

        assertThatThrownBy(() -> skillAssignmentService.addSkill("alice", "Painting", false))
            .isInstanceOf(SkillAlreadyAssignedException.class)
            .hasMessageContaining("Painting");
        assertThat(assignmentCount("alice")).isEqualTo(1);
    }

    @Test
    @DisplayName("Unknown skill or user is reported as not found")
    void testAddSkillUnknown() {
        assertThatThrownBy(() -> skillAssignmentService.addSkill("alice", "Basket Weaving", true))
            .isInstanceOf(SkillNotFoundException.class);
        assertThatThrownBy(() -> skillAssignmentService.addSkill("nobody", "Painting", true))
            .isInstanceOf(UserNotFoundException.class);
    }

    @Test
    @DisplayName("Removing a skill restores the previous count")
    void testRemoveSkill() {
        skillAssignmentService.addSkill("alice", "Guitar", false);
        int before = assignmentCount("alice");
        skillAssignmentService.addSkill("alice", "Painting", true);

        int after = skillAssignmentService.removeSkill("alice", "Painting");

        assertThat(after).isEqualTo(before);
        assertThat(skillAssignmentService.getAssignments(aliceId))
            .extracting(SkillAssignment::getSkillName)
            .containsExactly("Guitar");
    }

    @Test
    @DisplayName("Removing a skill the user does not hold is a no-op conflict")
    void testRemoveAbsentSkill() {
        assertThatThrownBy(() -> skillAssignmentService.removeSkill("alice", "Painting"))
            .isInstanceOf(NoOpMutationException.class);
    }

    @Test
    @DisplayName("Setting and clearing a priority keeps the assignment rows")
    void testSetAndClearPriority() {
        skillAssignmentService.addSkill("alice", "Painting", true);
        skillAssignmentService.addSkill("alice", "Spanish", true);
        skillAssignmentService.addSkill("alice", "Guitar", false);

        skillAssignmentService.setPriority("alice", "Spanish", true);
        skillAssignmentService.setPriority("alice", "Guitar", false);

        List<SkillAssignment> assignments = skillAssignmentService.getAssignments(aliceId);
        assertThat(assignments).hasSize(3)
            .allSatisfy(a -> {
                assertThat(a.getLearnPrioritySkillId()).isEqualTo(5L);
                assertThat(a.getTeachPrioritySkillId()).isEqualTo(8L);
            });

        skillAssignmentService.clearPriority("alice", true);

        assignments = skillAssignmentService.getAssignments(aliceId);
        assertThat(assignments).hasSize(3)
            .allSatisfy(a -> {
                assertThat(a.getLearnPrioritySkillId()).isNull();
                assertThat(a.getTeachPrioritySkillId()).isEqualTo(8L);
            });
    }

    @Test
    @DisplayName("A skill added after a priority was set inherits the priority")
    void testNewRowInheritsPriority() {
        skillAssignmentService.addSkill("alice", "Painting", true);
        skillAssignmentService.setPriority("alice", "Painting", true);

        skillAssignmentService.addSkill("alice", "Piano", false);

        assertThat(skillAssignmentService.getAssignments(aliceId))
            .allSatisfy(a -> assertThat(a.getLearnPrioritySkillId()).isEqualTo(1L));
    }

    @Test
    @DisplayName("Priority requires the skill in the matching role")
    void testSetPriorityWrongRole() {
        skillAssignmentService.addSkill("alice", "Painting", false);

        assertThatThrownBy(() -> skillAssignmentService.setPriority("alice", "Painting", true))
            .isInstanceOf(SkillNotFoundException.class)
            .hasMessage("'Painting' is not on your skills to learn list");
        assertThatThrownBy(() -> skillAssignmentService.setPriority("alice", "Guitar", false))
            .isInstanceOf(SkillNotFoundException.class);
    }

    @Test
    @DisplayName("Removing the priority skill clears the pointer on the remaining rows")
    void testRemovePrioritySkill() {
        skillAssignmentService.addSkill("alice", "Painting", true);
        skillAssignmentService.addSkill("alice", "Java", true);
        skillAssignmentService.setPriority("alice", "Painting", true);

        skillAssignmentService.removeSkill("alice", "Painting");

        assertThat(skillAssignmentService.getAssignments(aliceId))
            .singleElement()
            .satisfies(a -> assertThat(a.getLearnPrioritySkillId()).isNull());
    }
}
