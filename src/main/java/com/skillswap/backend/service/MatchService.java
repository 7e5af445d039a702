package com.skillswap.backend.service;

import com.skillswap.backend.domain.Match;
import com.skillswap.backend.exception.InvalidMatchRequestException;
import com.skillswap.backend.mapper.MatchMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Confirmed matches. The relation is symmetric and stored as one canonical
 * row per unordered pair, so a single delete removes it in both directions.
 */
@Service
@Slf4j
public class MatchService {

    @Autowired
    private MatchMapper matchMapper;

    @Autowired
    private UserService userService;

    /**
     * Record a match between two users; recording an existing match changes nothing.
     *
     * @return true when a new row was written
     */
    @Transactional
    public boolean recordMatch(String first, String second) {
        Long firstId = userService.requireUserId(first);
        Long secondId = userService.requireUserId(second);
        if (firstId.equals(secondId)) {
            throw new InvalidMatchRequestException("A user cannot match with themselves");
        }
        Match match = Match.canonical(firstId, secondId);
        try {
            matchMapper.insert(match);
        } catch (DuplicateKeyException e) {
            log.debug("Match already recorded: {} / {}", first, second);
            return false;
        }
        log.info("Match recorded: {} / {}", first, second);
        return true;
    }

    /**
     * Remove the match between two users. Idempotent: an absent match removes nothing.
     *
     * @return rows removed, 0 or 1
     */
    @Transactional
    public int unmatch(String username, String selectedUser) {
        Match pair = Match.canonical(userService.requireUserId(username), userService.requireUserId(selectedUser));
        int removed = matchMapper.deletePair(pair.getUserId(), pair.getMatchId());
        log.info("Unmatched: {} / {}, removed={}", username, selectedUser, removed);
        return removed;
    }

    /**
     * Usernames matched with the user, alphabetical
     */
    public List<String> listMatches(String username) {
        return matchMapper.findMatchedUsernames(userService.requireUserId(username));
    }

    public boolean areMatched(String first, String second) {
        Match pair = Match.canonical(userService.requireUserId(first), userService.requireUserId(second));
        return matchMapper.countPair(pair.getUserId(), pair.getMatchId()) > 0;
    }
}
