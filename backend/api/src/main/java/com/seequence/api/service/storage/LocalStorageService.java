package com.seequence.api.service.storage;

import com.seequence.api.config.SeequenceProperties;
import com.seequence.api.util.PathValidator;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.EnumMap;
import java.util.Map;

/**
 * 로컬 파일 시스템 저장소
 * - seequence.narration.output-dir → AUDIO
 * - seequence.image.output-dir → IMAGE
 * WebConfig의 정적 리소스 핸들러가 같은 디렉토리를 서빙한다.
 */
@Slf4j
@Service
public class LocalStorageService implements StorageService {

    private final Map<StorageArea, Path> directories = new EnumMap<>(StorageArea.class);

    public LocalStorageService(SeequenceProperties properties) {
        directories.put(StorageArea.AUDIO, Paths.get(properties.getNarration().getOutputDir()).toAbsolutePath().normalize());
        directories.put(StorageArea.IMAGE, Paths.get(properties.getImage().getOutputDir()).toAbsolutePath().normalize());
    }

    @PostConstruct
    public void init() {
        for (Map.Entry<StorageArea, Path> entry : directories.entrySet()) {
            try {
                Files.createDirectories(entry.getValue());
                PathValidator.allowDirectory(entry.getValue());
                log.info("[STORAGE] {} directory: {}", entry.getKey(), entry.getValue());
            } catch (IOException e) {
                log.error("[STORAGE] Failed to create {} directory: {}", entry.getKey(), entry.getValue(), e);
            }
        }
    }

    @Override
    public String upload(StorageArea area, String fileName, byte[] data) {
        Path target = resolve(area, fileName);
        Path temp = target.resolveSibling("." + fileName + ".part");
        try {
            Files.createDirectories(target.getParent());
            Files.write(temp, data);
            moveIntoPlace(temp, target);
            log.debug("[STORAGE] Saved {} bytes: {}", data.length, target);
            return publicUrl(area, fileName);
        } catch (IOException e) {
            log.error("[STORAGE] Failed to save file: {}", target, e);
            throw new UncheckedIOException("Local storage failed: " + e.getMessage(), e);
        } finally {
            try {
                Files.deleteIfExists(temp);
            } catch (IOException e) {
                log.debug("[STORAGE] Temp file cleanup failed: {}", temp);
            }
        }
    }

    @Override
    public Path resolve(StorageArea area, String fileName) {
        if (fileName == null || fileName.isBlank() || fileName.contains("/") || fileName.contains("\\")
                || fileName.contains("..")) {
            throw new IllegalArgumentException("Invalid file name: " + fileName);
        }
        return directory(area).resolve(fileName);
    }

    @Override
    public String publicUrl(StorageArea area, String fileName) {
        return area.getUrlPrefix() + fileName;
    }

    @Override
    public Path directory(StorageArea area) {
        return directories.get(area);
    }

    private void moveIntoPlace(Path source, Path target) throws IOException {
        try {
            Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
