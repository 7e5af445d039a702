package com.skillswap.backend.enums;

/**
 * Role a user holds for an assigned skill. A user holds each skill in exactly one role.
 */
public enum SkillRole {
    /**
     * User wants to learn the skill
     */
    LEARN("learn"),

    /**
     * User offers to teach the skill
     */
    TEACH("teach");

    private final String label;

    SkillRole(String label) {
        this.label = label;
    }

    public static SkillRole of(boolean toLearn) {
        return toLearn ? LEARN : TEACH;
    }

    public boolean isLearning() {
        return this == LEARN;
    }

    public String getLabel() {
        return label;
    }
}
