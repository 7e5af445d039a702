package com.skillswap.backend.service;

import com.skillswap.backend.domain.MatchRequest;
import com.skillswap.backend.dto.MatchRequestsResponse;
import com.skillswap.backend.exception.DuplicateMatchRequestException;
import com.skillswap.backend.exception.InvalidMatchRequestException;
import com.skillswap.backend.mapper.MatchRequestMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Directional, pending match requests
 */
@Service
@Slf4j
public class MatchRequestService {

    @Autowired
    private MatchRequestMapper requestMapper;

    @Autowired
    private UserService userService;

    /**
     * Record a pending request from sender to receiver
     *
     * @throws InvalidMatchRequestException when sender and receiver are the same user
     * @throws DuplicateMatchRequestException when the same request is already pending
     */
    @Transactional
    public void sendRequest(String sender, String receiver) {
        Long senderId = userService.requireUserId(sender);
        Long receiverId = userService.requireUserId(receiver);
        // Ids, not names: username lookups may be case-insensitive
        if (senderId.equals(receiverId)) {
            throw new InvalidMatchRequestException("Cannot send a match request to yourself");
        }

        try {
            requestMapper.insert(MatchRequest.builder()
                    .senderId(senderId)
                    .receiverId(receiverId)
                    .build());
        } catch (DuplicateKeyException e) {
            throw new DuplicateMatchRequestException("A request to " + receiver + " is already pending");
        }
        log.info("Match request sent: sender={}, receiver={}", sender, receiver);
    }

    /**
     * Counterpart usernames of the user's sent and received requests
     */
    public MatchRequestsResponse listRequests(String username) {
        Long userId = userService.requireUserId(username);
        return MatchRequestsResponse.builder()
                .sentRequests(requestMapper.findSentUsernames(userId))
                .receivedRequests(requestMapper.findReceivedUsernames(userId))
                .build();
    }

    /**
     * Withdraw every request the user sent. Received requests are untouched.
     *
     * @return number of requests removed
     */
    @Transactional
    public int cancelAllSent(String username) {
        Long userId = userService.requireUserId(username);
        int removed = requestMapper.deleteBySenderId(userId);
        log.info("Sent match requests removed: username={}, count={}", username, removed);
        return removed;
    }
}
