package com.studyspots.service.storage;

import com.studyspots.config.StudySpotsProperties;
import com.studyspots.exception.InvalidInputException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.mock.web.MockMultipartFile;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalBlobStorageServiceTest {

    private static final String BASE_URL = "http://localhost:8000/static";

    @TempDir
    Path tempDir;

    private Path root;
    private LocalBlobStorageService storage;

    @BeforeEach
    void setUp() {
        root = tempDir.resolve("uploads");
        StudySpotsProperties properties = new StudySpotsProperties();
        properties.getStorage().setRoot(root.toString());
        properties.getStorage().setPublicBaseUrl(BASE_URL + "/");
        storage = new LocalBlobStorageService(properties);
    }

    @Test
    void storeWritesFileAndReturnsPublicUrl() throws Exception {
        byte[] content = {10, 20, 30};

        String url = storage.store("photos", new MockMultipartFile("file", "Desk.PNG", "image/png", content));

        assertThat(url).startsWith(BASE_URL + "/photos/").endsWith(".png");
        Path written = root.resolve("photos").resolve(url.substring(url.lastIndexOf('/') + 1));
        assertThat(Files.readAllBytes(written)).isEqualTo(content);
    }

    @Test
    void deleteRemovesStoredFileOnce() {
        String url = storage.store("photos", new MockMultipartFile("file", "a.jpg", "image/jpeg", new byte[] {1}));

        assertThat(storage.delete(url)).isTrue();
        assertThat(storage.delete(url)).isFalse();
    }

    @Test
    void describeReportsStoredFileMetadata() {
        String url = storage.store("photos", new MockMultipartFile("file", "a.jpg", "image/jpeg", new byte[] {1, 2, 3, 4}));

        assertThat(storage.describe(url)).hasValueSatisfying(info -> {
            assertThat(info.getSize()).isEqualTo(4);
            assertThat(info.getContentType()).isEqualTo("image/jpeg");
            assertThat(info.getLastModified()).isNotNull();
        });
    }

    @Test
    void describeIsEmptyForMissingOrForeignFiles() {
        assertThat(storage.describe(BASE_URL + "/photos/missing.png")).isEmpty();
        assertThat(storage.describe("https://cdn.example.com/photos/a.jpg")).isEmpty();
        assertThat(storage.describe(BASE_URL + "/photos")).isEmpty();
    }

    @Test
    void deleteIgnoresForeignUrls() {
        assertThat(storage.delete("https://cdn.example.com/photos/a.jpg")).isFalse();
    }

    @Test
    void deleteRefusesPathsOutsideRoot() throws Exception {
        Path secret = Files.writeString(tempDir.resolve("secret.txt"), "keep");

        assertThat(storage.delete(BASE_URL + "/../secret.txt")).isFalse();
        assertThat(secret).exists();
    }

    @Test
    void storeRefusesFolderOutsideRoot() {
        MockMultipartFile file = new MockMultipartFile("file", "a.png", "image/png", new byte[] {1});

        assertThatThrownBy(() -> storage.store("../elsewhere", file))
            .isInstanceOf(InvalidInputException.class);
    }
}
