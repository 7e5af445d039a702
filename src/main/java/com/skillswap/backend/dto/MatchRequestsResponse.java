package com.skillswap.backend.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MatchRequestsResponse {
    /**
     * Usernames the user has sent requests to
     */
    private List<String> sentRequests;

    /**
     * Usernames the user has received requests from
     */
    private List<String> receivedRequests;
}
