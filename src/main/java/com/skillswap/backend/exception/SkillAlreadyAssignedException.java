package com.skillswap.backend.exception;

/**
 * The user already holds the skill in some role
 */
public class SkillAlreadyAssignedException extends BusinessException {
    public SkillAlreadyAssignedException(String message) {
        super(message);
    }
}
