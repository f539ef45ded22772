package com.seequence.api.service.narration;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.nio.file.Path;

@Getter
@AllArgsConstructor
public class SceneAudioFile {
    private final int sceneId;
    private final Path path;
}
