package com.skillswap.backend.service.storage;

import com.skillswap.backend.exception.ProfilePictureStorageException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Stores pictures in a local directory served as static assets.
 * Filenames are prefixed with the upload time in milliseconds.
 */
@Slf4j
@Component
public class LocalProfilePictureStore implements ProfilePictureStore {

    private final Path directory;
    private final String publicBaseUrl;

    public LocalProfilePictureStore(@Value("${app.profile-picture.directory:assets}") String directory,
                                    @Value("${app.profile-picture.public-base-url:http://localhost:4000/}") String publicBaseUrl) {
        this.directory = Paths.get(directory).toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl.endsWith("/") ? publicBaseUrl : publicBaseUrl + "/";
    }

    @Override
    public String store(MultipartFile file) {
        String original = StringUtils.getFilename(StringUtils.cleanPath(
                file.getOriginalFilename() == null ? "image" : file.getOriginalFilename()));
        String safeName = (original == null || original.isBlank() ? "image" : original)
                .replaceAll("[^A-Za-z0-9._-]", "_");
        String filename = System.currentTimeMillis() + safeName;

        try {
            Files.createDirectories(directory);
            Path target = directory.resolve(filename).normalize();
            if (!target.startsWith(directory)) {
                throw new ProfilePictureStorageException("Invalid target path: " + filename, null);
            }
            file.transferTo(target);
        } catch (IOException e) {
            throw new ProfilePictureStorageException("Could not write " + filename, e);
        }

        log.info("Profile picture stored: {} ({} bytes)", filename, file.getSize());
        return filename;
    }

    @Override
    public String publicUrl(String filename) {
        return publicBaseUrl + (filename == null ? "" : filename);
    }
}
