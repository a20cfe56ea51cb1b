package com.satfetch.utils;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.satfetch.models.Granule;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class GranuleMetadataWriter {

    private final ObjectMapper objectMapper;

    public GranuleMetadataWriter() {
        this(new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT));
    }

    public GranuleMetadataWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Path write(Granule granule, Path directory) throws IOException {
        Files.createDirectories(directory);
        Path file = directory.resolve(Granule.METADATA_FILE);
        objectMapper.writeValue(file.toFile(), granule);
        return file;
    }

    public Granule read(Path directory) throws IOException {
        return objectMapper.readValue(directory.resolve(Granule.METADATA_FILE).toFile(), Granule.class);
    }
}
