package com.skillswap.backend.controller;

import com.skillswap.backend.dto.ApiResponse;
import com.skillswap.backend.dto.MatchRequestsResponse;
import com.skillswap.backend.dto.RemovedCountResponse;
import com.skillswap.backend.dto.SendMatchRequestRequest;
import com.skillswap.backend.dto.UnmatchRequest;
import com.skillswap.backend.security.AuthenticatedUser;
import com.skillswap.backend.service.MatchRequestService;
import com.skillswap.backend.service.MatchService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Match requests and confirmed matches
 */
@Slf4j
@RestController
@RequestMapping("/api")
@Validated
@Tag(name = "Matches", description = "APIs for match requests and matches")
public class MatchController {

    @Autowired
    private MatchRequestService requestService;

    @Autowired
    private MatchService matchService;

    @GetMapping("/fetch-requests")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "List requests", description = "Usernames of sent and received match requests")
    public ApiResponse<MatchRequestsResponse> fetchRequests(AuthenticatedUser principal,
                                                            @RequestParam(required = false) String user) {
        return ApiResponse.success(requestService.listRequests(principal.actingAs(user)));
    }

    @PostMapping("/send-request")
    @ResponseStatus(HttpStatus.CREATED)
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Send request", description = "Send a match request from the authenticated user")
    public ApiResponse<Void> sendRequest(AuthenticatedUser principal,
                                         @Valid @RequestBody SendMatchRequestRequest request) {
        requestService.sendRequest(principal.username(), request.getReceiver());
        return ApiResponse.created("Request sent to " + request.getReceiver(), null);
    }

    @DeleteMapping("/remove-all-match-requests")
    @Operation(summary = "Cancel sent requests", description = "Remove every request the user has sent")
    public ApiResponse<RemovedCountResponse> removeAllMatchRequests(@RequestParam @NotBlank String username) {
        int removed = requestService.cancelAllSent(username);
        return ApiResponse.success("Removed all sent requests", new RemovedCountResponse(removed));
    }

    @GetMapping("/matches")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "List matches", description = "Usernames matched with the authenticated user")
    public ApiResponse<List<String>> listMatches(AuthenticatedUser principal) {
        return ApiResponse.success(matchService.listMatches(principal.username()));
    }

    @PostMapping("/unmatch")
    @SecurityRequirement(name = "bearerAuth")
    @Operation(summary = "Unmatch", description = "Remove the match between the authenticated and selected user")
    public ApiResponse<RemovedCountResponse> unmatch(AuthenticatedUser principal,
                                                     @Valid @RequestBody UnmatchRequest request) {
        String acting = principal.actingAs(request.getUser());
        int removed = matchService.unmatch(acting, request.getSelectedUser());
        return ApiResponse.success(removed > 0 ? "Deleted" : "Already absent", new RemovedCountResponse(removed));
    }
}
