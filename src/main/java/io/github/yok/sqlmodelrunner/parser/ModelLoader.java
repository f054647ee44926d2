package io.github.yok.sqlmodelrunner.parser;

import io.github.yok.sqlmodelrunner.exception.ConfigurationException;
import io.github.yok.sqlmodelrunner.exception.ModelParseException;
import io.github.yok.sqlmodelrunner.model.Model;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.apache.commons.lang3.Validate;

/**
 * Discovers model files in a directory and parses them.
 *
 * <p>
 * Only regular files directly under the directory with the {@code .sql} extension
 * (case-insensitive) are read, as UTF-8, in file-name order. Subdirectories are not scanned.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@RequiredArgsConstructor
public class ModelLoader {

    private static final String MODEL_EXTENSION = "sql";

    private final ModelParser parser;

    /**
     * Creates a loader with a default {@link ModelParser}.
     */
    public ModelLoader() {
        this(new ModelParser());
    }

    /**
     * Loads every model file in {@code modelsDir}.
     *
     * @param modelsDir models directory
     * @return parsed models in file-name order
     * @throws ConfigurationException if the directory does not exist or cannot be listed
     * @throws ModelParseException if a file cannot be read or parsed
     */
    public List<Model> load(Path modelsDir) {
        Validate.notNull(modelsDir, "modelsDir must not be null.");
        if (!Files.isDirectory(modelsDir)) {
            throw new ConfigurationException(
                    "Models directory not found: " + modelsDir.toAbsolutePath());
        }

        List<Path> files;
        try (Stream<Path> stream = Files.list(modelsDir)) {
            files = stream.filter(Files::isRegularFile).filter(ModelLoader::isModelFile).sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new ConfigurationException("Failed to list models directory: " + modelsDir, e);
        }

        List<Model> models = new ArrayList<>(files.size());
        for (Path file : files) {
            String text;
            try {
                text = Files.readString(file, StandardCharsets.UTF_8);
            } catch (IOException e) {
                throw new ModelParseException(file.toString(), "failed to read model file", e);
            }
            models.add(parser.parse(text, file.toString()));
        }

        log.info("Loaded {} model(s) from {}", models.size(), modelsDir.toAbsolutePath());
        return models;
    }

    private static boolean isModelFile(Path path) {
        String ext = FilenameUtils.getExtension(path.getFileName().toString());
        return MODEL_EXTENSION.equalsIgnoreCase(ext);
    }
}
