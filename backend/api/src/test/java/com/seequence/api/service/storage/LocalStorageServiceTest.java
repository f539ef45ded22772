package com.seequence.api.service.storage;

import com.seequence.api.config.SeequenceProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocalStorageServiceTest {

    @TempDir
    Path tempDir;

    private LocalStorageService storage;

    @BeforeEach
    void setUp() {
        SeequenceProperties properties = new SeequenceProperties();
        properties.getNarration().setOutputDir(tempDir.resolve("audio").toString());
        properties.getImage().setOutputDir(tempDir.resolve("images").toString());
        storage = new LocalStorageService(properties);
        storage.init();
    }

    @Test
    void uploadWritesFileAndReturnsPublicUrl() throws Exception {
        String url = storage.upload(StorageArea.AUDIO, "scene_1.mp3", new byte[]{1, 2, 3});

        assertThat(url).isEqualTo("/static/audio/scene_1.mp3");
        Path written = storage.resolve(StorageArea.AUDIO, "scene_1.mp3");
        assertThat(Files.readAllBytes(written)).containsExactly(1, 2, 3);
        assertThat(written.getParent()).isEqualTo(tempDir.resolve("audio").toAbsolutePath().normalize());
    }

    @Test
    void noTemporaryFileRemainsAfterUpload() throws Exception {
        storage.upload(StorageArea.IMAGE, "img.png", new byte[]{9});

        try (Stream<Path> files = Files.list(storage.directory(StorageArea.IMAGE))) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("img.png");
        }
    }

    @Test
    void traversalNamesAreRejected() {
        assertThatThrownBy(() -> storage.resolve(StorageArea.AUDIO, "../etc/passwd"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> storage.resolve(StorageArea.AUDIO, "a/b.mp3"))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
