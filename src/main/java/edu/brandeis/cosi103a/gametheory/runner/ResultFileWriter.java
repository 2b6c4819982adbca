package edu.brandeis.cosi103a.gametheory.runner;

import com.fasterxml.jackson.databind.ObjectMapper;
import edu.brandeis.cosi103a.gametheory.config.ObjectMapperFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes result objects as indented JSON. Files are written to a sibling temp file first and
 * then moved into place, so readers never see a partial file.
 */
public class ResultFileWriter {

    private final ObjectMapper objectMapper;

    public ResultFileWriter() {
        this(ObjectMapperFactory.createPretty());
    }

    public ResultFileWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public void write(Object result, Path target) throws IOException {
        Path absolute = target.toAbsolutePath();
        Path dir = absolute.getParent();
        if (dir != null) {
            Files.createDirectories(dir);
        }
        Path temp = absolute.resolveSibling(absolute.getFileName() + ".tmp");
        objectMapper.writeValue(temp.toFile(), result);
        Files.move(temp, absolute, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    }

    public String toJson(Object result) throws IOException {
        return objectMapper.writeValueAsString(result);
    }
}
