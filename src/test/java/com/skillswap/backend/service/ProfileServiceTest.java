package com.skillswap.backend.service;

import com.skillswap.backend.BaseIntegrationTest;
import com.skillswap.backend.dto.EditProfileRequest;
import com.skillswap.backend.dto.EditProfileResponse;
import com.skillswap.backend.dto.ProfileResponse;
import com.skillswap.backend.dto.SocialLinkResponse;
import com.skillswap.backend.exception.DuplicateFieldException;
import com.skillswap.backend.exception.UserNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Profile Service Tests")
class ProfileServiceTest extends BaseIntegrationTest {

    @Autowired
    private ProfileService profileService;

    @Value("${app.profile-picture.directory}")
    private String pictureDirectory;

    @BeforeEach
    void setUp() {
        registerUser("alice");
        registerUser("bob");
    }

    @Test
    @DisplayName("A user without skills gets placeholder lists and no priorities")
    void testEmptyProfile() {
        ProfileResponse profile = profileService.getProfile("alice");

        assertThat(profile.getUsername()).isEqualTo("alice");
        assertThat(profile.getEmail()).isEqualTo("alice@example.com");
        assertThat(profile.getSkillsToLearn()).containsExactly(ProfileService.NO_SKILLS_PLACEHOLDER);
        assertThat(profile.getSkillsToTeach()).containsExactly(ProfileService.NO_SKILLS_PLACEHOLDER);
        assertThat(profile.getLearnPrioritySkill()).isNull();
        assertThat(profile.getTeachPrioritySkill()).isNull();
        assertThat(profile.getSocials()).isEmpty();
        assertThat(profile.getCreatedAt()).matches("\\d{4},[A-Z]{3}");
    }

    @Test
    @DisplayName("Profile lists skills per role and names the priorities")
    void testProfileWithSkills() {
        skillAssignmentService.addSkill("alice", "Spanish", true);
        skillAssignmentService.addSkill("alice", "Painting", true);
        skillAssignmentService.addSkill("alice", "Guitar", false);
        skillAssignmentService.setPriority("alice", "Spanish", true);

        ProfileResponse profile = profileService.getProfile("alice");

        assertThat(profile.getSkillsToLearn()).containsExactly("Painting", "Spanish");
        assertThat(profile.getSkillsToTeach()).containsExactly("Guitar");
        assertThat(profile.getLearnPrioritySkill()).isEqualTo("Spanish");
        assertThat(profile.getTeachPrioritySkill()).isNull();
    }

    @Test
    @DisplayName("Unknown user is not found")
    void testUnknownProfile() {
        assertThatThrownBy(() -> profileService.getProfile("ghost"))
            .isInstanceOf(UserNotFoundException.class);
    }

    @Test
    @DisplayName("Editing a social link twice updates it in place")
    void testSocialLinkUpsert() {
        profileService.editProfile(EditProfileRequest.builder()
                .currentUsername("alice")
                .platform("github")
                .linkToPlatform("https://github.com/alice")
                .build(), null);

        EditProfileResponse response = profileService.editProfile(EditProfileRequest.builder()
                .currentUsername("alice")
                .platform("github")
                .linkToPlatform("https://github.com/alice-new")
                .build(), null);

        assertThat(response.getNewSocials())
            .containsExactly(new SocialLinkResponse("github", "https://github.com/alice-new"));
        assertThat(profileService.getProfile("alice").getSocials()).hasSize(1);
    }

    @Test
    @DisplayName("Renaming to a taken username is a conflict and changes nothing")
    void testRenameConflict() {
        assertThatThrownBy(() -> profileService.editProfile(EditProfileRequest.builder()
                .currentUsername("alice")
                .newUsername("bob")
                .build(), null))
            .isInstanceOf(DuplicateFieldException.class)
            .hasMessage("Username of: bob already exists")
            .satisfies(e -> assertThat(((DuplicateFieldException) e).getFieldErrors())
                    .containsEntry("username", "Username already exists"));

        assertThat(userService.usernameTaken("alice")).isTrue();
    }

    @Test
    @DisplayName("Rename and description edit apply together; the skills follow the user")
    void testRenameAndDescription() {
        skillAssignmentService.addSkill("alice", "Painting", true);

        EditProfileResponse response = profileService.editProfile(EditProfileRequest.builder()
                .currentUsername("alice")
                .newUsername("alicia")
                .newDescription("I paint")
                .build(), null);

        assertThat(response.getNewUsername()).isEqualTo("alicia");
        ProfileResponse profile = profileService.getProfile("alicia");
        assertThat(profile.getDescription()).isEqualTo("I paint");
        assertThat(profile.getSkillsToLearn()).containsExactly("Painting");
        assertThat(userService.findByUsername("alice")).isNull();
    }

    @Test
    @DisplayName("SQL-looking text is stored literally")
    void testDescriptionStoredLiterally() {
        String description = "x'; DROP TABLE users; --";

        profileService.editProfile(EditProfileRequest.builder()
                .currentUsername("alice")
                .newDescription(description)
                .build(), null);

        assertThat(profileService.getProfile("alice").getDescription()).isEqualTo(description);
        assertThat(userService.usernameTaken("bob")).isTrue();
    }

    @Test
    @DisplayName("Uploaded picture is written to the asset directory and returned as a URL")
    void testPictureUpload() throws Exception {
        MockMultipartFile image = new MockMultipartFile(
                "imgFile", "me.png", "image/png", new byte[]{1, 2, 3});

        EditProfileResponse response = profileService.editProfile(EditProfileRequest.builder()
                .currentUsername("alice")
                .build(), image);

        String stored = profileService.getProfile("alice").getProfilePicture();
        assertThat(stored).endsWith("me.png");
        assertThat(response.getImg()).isEqualTo("http://localhost:4000/" + stored);

        Path file = Paths.get(pictureDirectory).resolve(stored);
        assertThat(Files.readAllBytes(file)).containsExactly(new byte[]{1, 2, 3});
        Files.deleteIfExists(file);
    }
}
