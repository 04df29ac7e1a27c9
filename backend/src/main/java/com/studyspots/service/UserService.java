package com.studyspots.service;

import com.studyspots.config.StudySpotsProperties;
import com.studyspots.dto.UserUpdateRequest;
import com.studyspots.exception.InvalidInputException;
import com.studyspots.exception.ResourceNotFoundException;
import com.studyspots.exception.StorageException;
import com.studyspots.exception.UnauthorizedException;
import com.studyspots.model.User;
import com.studyspots.repository.EntityPager;
import com.studyspots.repository.UserRepository;
import com.studyspots.service.storage.BlobStorageService;
import com.studyspots.service.storage.ImageUploadService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.time.LocalDateTime;
import java.util.List;
import java.util.regex.Pattern;

@Service
@RequiredArgsConstructor
@Slf4j
public class UserService {

    private static final String DUPLICATE_NAME = "User with this name already exists";

    private final UserRepository userRepository;
    private final EntityPager entityPager;
    private final ImageUploadService imageUploadService;
    private final BlobStorageService blobStorageService;
    private final StudySpotsProperties properties;

    public User getUser(String id) {
        return userRepository.findById(id)
            .orElseThrow(() -> new ResourceNotFoundException("User not found"));
    }

    public List<User> listUsers(Integer skip, Integer limit) {
        int offset = skip != null ? skip : 0;
        int max = limit != null ? limit : properties.getPagination().getDefaultLimit();
        return entityPager.list(User.class, offset, max);
    }

    public List<User> searchUsers(String query) {
        if (query == null || query.isBlank()) {
            throw new InvalidInputException("Search query cannot be empty");
        }
        return userRepository.searchByName(Pattern.quote(query.trim()));
    }

    public User createUser(User user) {
        if (userRepository.existsByName(user.getName())) {
            throw new InvalidInputException(DUPLICATE_NAME);
        }

        LocalDateTime now = LocalDateTime.now();
        user.setId(null);
        user.setProfilePicture(null);
        user.setCreatedAt(now);
        user.setUpdatedAt(now);
        if (user.getCafesVisited() == null) {
            user.setCafesVisited(0);
        }
        if (user.getAverageRating() == null) {
            user.setAverageRating(0.0);
        }

        try {
            User saved = userRepository.save(user);
            log.info("Created user: {} (ID: {})", saved.getName(), saved.getId());
            return saved;
        } catch (DuplicateKeyException e) {
            throw new InvalidInputException(DUPLICATE_NAME);
        }
    }

    public User updateUser(String id, UserUpdateRequest request) {
        User existing = getUser(id);

        if (request.getName() != null) {
            if (userRepository.existsByNameAndIdNot(request.getName(), id)) {
                throw new InvalidInputException(DUPLICATE_NAME);
            }
            existing.setName(request.getName());
        }
        if (request.getCafesVisited() != null) {
            existing.setCafesVisited(request.getCafesVisited());
        }
        if (request.getAverageRating() != null) {
            existing.setAverageRating(request.getAverageRating());
        }
        if (request.getPassword() != null) {
            existing.setPassword(request.getPassword());
        }
        existing.setUpdatedAt(LocalDateTime.now());

        try {
            User saved = userRepository.save(existing);
            log.info("Updated user: {}", id);
            return saved;
        } catch (DuplicateKeyException e) {
            throw new InvalidInputException(DUPLICATE_NAME);
        }
    }

    public void deleteUser(String id) {
        User user = getUser(id);
        removePictureQuietly(user.getProfilePicture());
        userRepository.deleteById(id);
        log.info("Deleted user: {}", id);
    }

    public User updateProfilePicture(String id, MultipartFile file) {
        User user = getUser(id);

        String url = imageUploadService.uploadImage(ImageUploadService.PROFILE_PICTURES_FOLDER, file);
        String previous = user.getProfilePicture();

        user.setProfilePicture(url);
        user.setUpdatedAt(LocalDateTime.now());
        User saved = userRepository.save(user);

        removePictureQuietly(previous);
        log.info("Updated profile picture for user {}", id);
        return saved;
    }

    /**
     * Plain-text comparison. Passwords are stored verbatim; this is an
     * accepted risk of the current design, not an oversight.
     */
    public User authenticate(String name, String password) {
        return userRepository.findByName(name)
            .filter(user -> user.getPassword() != null && user.getPassword().equals(password))
            .orElseThrow(() -> {
                log.warn("Invalid login attempt for user: {}", name);
                return new UnauthorizedException("Invalid username or password");
            });
    }

    // A missing or undeletable picture never blocks the user operation
    private void removePictureQuietly(String pictureUrl) {
        if (pictureUrl == null) {
            return;
        }
        try {
            if (!blobStorageService.delete(pictureUrl)) {
                log.warn("Profile picture {} was not found in storage", pictureUrl);
            }
        } catch (StorageException e) {
            log.warn("Failed to delete profile picture {}: {}", pictureUrl, e.getMessage());
        }
    }
}
