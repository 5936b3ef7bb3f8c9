package com.wikicrawler.core.frontier;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;

/** 프런티어 상태 JSON 파일 입출력. 저장은 임시 파일 + move 로 원자적 교체. */
public final class FrontierStateStore {
    private static final ObjectMapper OM = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .enable(SerializationFeature.INDENT_OUTPUT);

    private final Path file;

    public FrontierStateStore(Path file) {
        this.file = Objects.requireNonNull(file, "file");
    }

    public Path getFile() { return file; }

    /** 파일이 없으면 빈 상태. 깨진 파일은 IOException(조용히 초기화하지 않음). */
    public FrontierState load() throws IOException {
        if (!Files.exists(file)) return new FrontierState();
        FrontierState s = OM.readValue(file.toFile(), FrontierState.class);
        return s != null ? s : new FrontierState();
    }

    public void save(FrontierState state) throws IOException {
        Objects.requireNonNull(state, "state");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);

        Path tmp = file.resolveSibling(file.getFileName() + ".tmp");
        OM.writeValue(tmp.toFile(), state);
        try {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }
}
