package com.skillswap.backend.service.storage;

import org.springframework.web.multipart.MultipartFile;

/**
 * Storage for uploaded profile pictures
 */
public interface ProfilePictureStore {

    /**
     * Persist an uploaded image under a new unique name
     *
     * @return the stored filename, as recorded on the user row
     */
    String store(MultipartFile file);

    /**
     * Public URL clients use to fetch a stored picture
     */
    String publicUrl(String filename);
}
