package com.vehicle.anomaly.repository;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.vehicle.anomaly.config.DetectionConfig;
import com.vehicle.anomaly.engine.isolationforest.AnomalyModel;
import com.vehicle.anomaly.engine.isolationforest.IsolationForest;
import com.vehicle.anomaly.engine.isolationforest.IsolationForestModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads the pre-trained statistical models from the model directory.
 * Each {@code <name>.json} file holds one serialized {@link IsolationForest};
 * the file stem becomes the model name. A file that cannot be read is logged
 * and skipped, a missing directory yields no models.
 */
@Repository
public class AnomalyModelRepository {

    private static final Logger log = LoggerFactory.getLogger(AnomalyModelRepository.class);

    private static final String MODEL_SUFFIX = ".json";

    private final Path modelsDirectory;
    private final ObjectMapper objectMapper;

    public AnomalyModelRepository(DetectionConfig config) {
        this.modelsDirectory = Paths.get(config.getModels().getDirectory());
        this.objectMapper = new ObjectMapper();
    }

    /**
     * @return models keyed by name, in name order; never null
     */
    public Map<String, AnomalyModel> loadAll() {
        if (!Files.isDirectory(modelsDirectory)) {
            log.warn("Models directory {} does not exist, statistical detection disabled",
                    modelsDirectory.toAbsolutePath());
            return Collections.emptyMap();
        }

        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(modelsDirectory, "*" + MODEL_SUFFIX)) {
            stream.forEach(files::add);
        } catch (IOException e) {
            log.error("Failed to list models directory {}", modelsDirectory, e);
            return Collections.emptyMap();
        }
        Collections.sort(files);
        log.info("Found {} model files in {}", files.size(), modelsDirectory);

        Map<String, AnomalyModel> models = new LinkedHashMap<>();
        for (Path file : files) {
            String name = modelName(file);
            try {
                IsolationForest forest = objectMapper.readValue(file.toFile(), IsolationForest.class);
                models.put(name, new IsolationForestModel(forest));
                log.info("Loaded model {}: {} trees, sample size {}",
                        name, forest.getTrees().size(), forest.getSampleSize());
            } catch (IOException | IllegalArgumentException e) {
                log.error("Failed to load model {} from {}: {}", name, file, e.getMessage(), e);
            }
        }
        return Collections.unmodifiableMap(models);
    }

    /**
     * Write a forest in the format {@link #loadAll()} reads.
     */
    public void save(String name, IsolationForest forest) throws IOException {
        Files.createDirectories(modelsDirectory);
        Path target = modelsDirectory.resolve(name + MODEL_SUFFIX);
        objectMapper.writeValue(target.toFile(), forest);
        log.info("Saved model {} to {}", name, target);
    }

    private static String modelName(Path file) {
        String fileName = file.getFileName().toString();
        return fileName.substring(0, fileName.length() - MODEL_SUFFIX.length());
    }
}
