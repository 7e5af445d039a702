package com.skillswap.backend.service;

import com.skillswap.backend.domain.SkillAssignment;
import com.skillswap.backend.domain.SocialLink;
import com.skillswap.backend.domain.User;
import com.skillswap.backend.dto.EditProfileRequest;
import com.skillswap.backend.dto.EditProfileResponse;
import com.skillswap.backend.dto.ProfileResponse;
import com.skillswap.backend.dto.SocialLinkResponse;
import com.skillswap.backend.exception.DuplicateFieldException;
import com.skillswap.backend.mapper.SocialLinkMapper;
import com.skillswap.backend.service.storage.ProfilePictureStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;
import java.util.stream.Collectors;

/**
 * Profile aggregator: composes the user record, skill lists and social links,
 * and applies profile edits.
 */
@Service
@Slf4j
public class ProfileService {

    public static final String NO_SKILLS_PLACEHOLDER = "No skills to display";

    private static final DateTimeFormatter MEMBER_SINCE = DateTimeFormatter.ofPattern("yyyy,MMM", Locale.ENGLISH);

    @Autowired
    private UserService userService;

    @Autowired
    private SkillAssignmentService skillAssignmentService;

    @Autowired
    private SocialLinkMapper socialLinkMapper;

    @Autowired
    private ProfilePictureStore pictureStore;

    /**
     * Aggregated profile of a user
     */
    public ProfileResponse getProfile(String selectedUser) {
        User user = userService.getUserByUsername(selectedUser);
        List<SkillAssignment> assignments = skillAssignmentService.getAssignments(user.getId());

        Map<Long, String> skillNames = assignments.stream()
                .collect(Collectors.toMap(SkillAssignment::getSkillId, SkillAssignment::getSkillName));
        SkillAssignment anyRow = assignments.isEmpty() ? null : assignments.get(0);

        return ProfileResponse.builder()
                .createdAt(user.getCreatedAt() == null ? null
                        : MEMBER_SINCE.format(user.getCreatedAt()).toUpperCase(Locale.ENGLISH))
                .username(user.getUsername())
                .email(user.getEmail())
                .profilePicture(user.getProfilePicture())
                .phoneNumber(user.getPhoneNumber())
                .description(user.getDescription())
                .skillsToLearn(skillNames(assignments, a -> Boolean.TRUE.equals(a.getLearning())))
                .skillsToTeach(skillNames(assignments, a -> Boolean.TRUE.equals(a.getTeaching())))
                .learnPrioritySkill(priorityName(anyRow, SkillAssignment::getLearnPrioritySkillId, skillNames))
                .teachPrioritySkill(priorityName(anyRow, SkillAssignment::getTeachPrioritySkillId, skillNames))
                .socials(socials(user.getId()))
                .build();
    }

    /**
     * Apply a profile edit. Only supplied fields change; blank fields are ignored.
     *
     * @throws DuplicateFieldException when the new username belongs to another user
     */
    @Transactional
    public EditProfileResponse editProfile(EditProfileRequest request, MultipartFile image) {
        User user = userService.getUserByUsername(request.getCurrentUsername());

        String newUsername = textOrNull(request.getNewUsername());
        if (newUsername != null && newUsername.equals(user.getUsername())) {
            newUsername = null;
        }
        if (newUsername != null && userService.usernameTakenByOther(newUsername, user.getId())) {
            throw usernameTaken(newUsername);
        }

        String newPicture = null;
        if (image != null && !image.isEmpty()) {
            newPicture = pictureStore.store(image);
        }

        try {
            userService.updateProfile(user.getId(), newUsername, textOrNull(request.getNewDescription()), newPicture);
        } catch (DuplicateKeyException e) {
            throw usernameTaken(newUsername);
        }

        String platform = textOrNull(request.getPlatform());
        if (platform != null) {
            upsertSocialLink(user.getId(), platform, textOrNull(request.getLinkToPlatform()));
        }

        return EditProfileResponse.builder()
                .img(pictureStore.publicUrl(newPicture != null ? newPicture
                        : Objects.requireNonNullElse(user.getProfilePicture(), "")))
                .newSocials(socials(user.getId()))
                .newUsername(newUsername != null ? newUsername : user.getUsername())
                .build();
    }

    private void upsertSocialLink(Long userId, String platform, String url) {
        int updated = socialLinkMapper.updateUrl(userId, platform, url);
        if (updated == 0) {
            socialLinkMapper.insert(SocialLink.builder()
                    .userId(userId)
                    .platform(platform)
                    .url(url)
                    .build());
            log.info("Social link added: userId={}, platform={}", userId, platform);
        } else {
            log.info("Social link updated: userId={}, platform={}", userId, platform);
        }
    }

    private List<SocialLinkResponse> socials(Long userId) {
        return socialLinkMapper.findByUserId(userId).stream()
                .map(SocialLinkResponse::fromSocialLink)
                .collect(Collectors.toList());
    }

    private static List<String> skillNames(List<SkillAssignment> assignments, Predicate<SkillAssignment> filter) {
        List<String> names = assignments.stream()
                .filter(filter)
                .map(SkillAssignment::getSkillName)
                .distinct()
                .collect(Collectors.toList());
        return names.isEmpty() ? List.of(NO_SKILLS_PLACEHOLDER) : names;
    }

    private static String priorityName(SkillAssignment row,
                                       Function<SkillAssignment, Long> pointer,
                                       Map<Long, String> skillNames) {
        if (row == null || pointer.apply(row) == null) {
            return null;
        }
        return skillNames.get(pointer.apply(row));
    }

    private static DuplicateFieldException usernameTaken(String username) {
        return new DuplicateFieldException("Username of: " + username + " already exists",
                Map.of("username", AuthService.USERNAME_EXISTS));
    }

    private static String textOrNull(String value) {
        return StringUtils.hasText(value) ? value.trim() : null;
    }
}
