package com.skillswap.backend.exception;

/**
 * Skill name does not exist in the catalog, or is not assigned where required
 */
public class SkillNotFoundException extends BusinessException {
    public SkillNotFoundException(String message) {
        super(message);
    }
}
