package com.ryuqq.imagebatch.adapter.filesystem;

import com.ryuqq.imagebatch.core.model.OutputTarget;
import com.ryuqq.imagebatch.core.spi.OutputStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 로컬 파일 시스템 기반 OutputStore.
 *
 * <p>출력 대상의 location을 파일 경로로 해석합니다. 상대 경로는 baseDirectory 기준으로 해석됩니다.</p>
 *
 * @author ImageBatch Team
 * @since 1.0.0
 */
public final class FileSystemOutputStore implements OutputStore {

    private static final Logger log = LoggerFactory.getLogger(FileSystemOutputStore.class);

    private final Path baseDirectory;

    /**
     * 현재 작업 디렉터리 기준 생성자.
     */
    public FileSystemOutputStore() {
        this(Path.of(""));
    }

    /**
     * 생성자.
     *
     * @param baseDirectory 상대 경로 해석 기준 디렉터리
     * @throws IllegalArgumentException baseDirectory가 null인 경우
     */
    public FileSystemOutputStore(Path baseDirectory) {
        if (baseDirectory == null) {
            throw new IllegalArgumentException("baseDirectory cannot be null");
        }
        this.baseDirectory = baseDirectory;
    }

    @Override
    public boolean exists(OutputTarget target) {
        if (target == null) {
            throw new IllegalArgumentException("target cannot be null");
        }
        Path path = resolve(target);
        boolean exists = Files.isRegularFile(path);
        log.debug("Output check: {} exists={}", path, exists);
        return exists;
    }

    /**
     * 출력 대상을 실제 경로로 해석.
     *
     * @param target 출력 대상
     * @return 해석된 경로
     */
    public Path resolve(OutputTarget target) {
        return baseDirectory.resolve(target.toPath());
    }
}
