package com.skillswap.backend.service;

import com.skillswap.backend.domain.User;
import com.skillswap.backend.exception.UserNotFoundException;
import com.skillswap.backend.mapper.UserMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

/**
 * User directory: creation and lookup of user records
 */
@Service
@Slf4j
public class UserService {

    @Autowired
    private UserMapper userMapper;

    /**
     * Insert a user. The unique constraints on username and email are
     * authoritative; a violation surfaces as DuplicateKeyException.
     */
    public User createUser(String username, String email, String passwordHash) {
        User user = User.builder()
                .username(username)
                .email(email)
                .passwordHash(passwordHash)
                .build();
        userMapper.insert(user);
        log.info("User created: userId={}, username={}", user.getId(), user.getUsername());
        return user;
    }

    /**
     * Get user by username, null when unknown
     */
    public User findByUsername(String username) {
        return userMapper.findByUsername(username);
    }

    /**
     * Get user by username
     * @throws UserNotFoundException when unknown
     */
    public User getUserByUsername(String username) {
        User user = userMapper.findByUsername(username);
        if (user == null) {
            throw new UserNotFoundException("User not found: " + username);
        }
        return user;
    }

    /**
     * Resolve a username to its id
     * @throws UserNotFoundException when unknown
     */
    public Long requireUserId(String username) {
        Long userId = userMapper.findIdByUsername(username);
        if (userId == null) {
            throw new UserNotFoundException("User not found: " + username);
        }
        return userId;
    }

    public boolean usernameTaken(String username) {
        return userMapper.findIdByUsername(username) != null;
    }

    /**
     * True when the username resolves to a user other than the given one
     */
    public boolean usernameTakenByOther(String username, Long userId) {
        Long ownerId = userMapper.findIdByUsername(username);
        return ownerId != null && !ownerId.equals(userId);
    }

    public boolean emailTaken(String email) {
        return userMapper.findByEmail(email) != null;
    }

    /**
     * Update the supplied profile columns; null means unchanged
     * @return affected rows
     */
    public int updateProfile(Long userId, String username, String description, String profilePicture) {
        if (username == null && description == null && profilePicture == null) {
            return 0;
        }
        int updated = userMapper.updateProfile(userId, username, description, profilePicture);
        log.info("User profile updated: userId={}, usernameChanged={}, descriptionChanged={}, pictureChanged={}",
                 userId, username != null, description != null, profilePicture != null);
        return updated;
    }
}
