package com.skillswap.backend;

import com.skillswap.backend.domain.User;
import com.skillswap.backend.mapper.MatchMapper;
import com.skillswap.backend.mapper.SkillAssignmentMapper;
import com.skillswap.backend.service.AuthService;
import com.skillswap.backend.service.MatchService;
import com.skillswap.backend.service.SkillAssignmentService;
import com.skillswap.backend.service.UserService;
import com.skillswap.backend.testutil.RegisterRequestBuilder;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

/**
 * Base class for integration tests against the in-memory database.
 * Each test runs in a transaction that is rolled back afterwards; the
 * skill taxonomy comes from db/data.sql.
 */
@SpringBootTest
@ActiveProfiles("test")
@Transactional
public abstract class BaseIntegrationTest {

    @Autowired
    protected AuthService authService;

    @Autowired
    protected UserService userService;

    @Autowired
    protected SkillAssignmentService skillAssignmentService;

    @Autowired
    protected MatchService matchService;

    @Autowired
    protected SkillAssignmentMapper skillAssignmentMapper;

    @Autowired
    protected MatchMapper matchMapper;

    // ============= TEST DATA BUILDERS =============

    /**
     * Register a user with default email and password
     */
    protected User registerUser(String username) {
        return authService.register(RegisterRequestBuilder.user(username).build());
    }

    /**
     * Number of users_skills rows of the user
     */
    protected int assignmentCount(String username) {
        return skillAssignmentMapper.countByUserId(userService.requireUserId(username));
    }
}
