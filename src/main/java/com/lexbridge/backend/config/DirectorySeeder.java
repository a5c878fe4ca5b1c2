package com.lexbridge.backend.config;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexbridge.backend.models.AdvocateCapability;
import com.lexbridge.backend.service.AdvocateDirectory;
import com.lexbridge.backend.store.AdvocateStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * Loads the sample advocate directory into an empty store at startup when
 * {@code lexbridge.directory.seed=true}.
 */
@Slf4j
@Component
public class DirectorySeeder implements ApplicationRunner {

    private final LexBridgeProperties properties;
    private final AdvocateStore advocateStore;
    private final AdvocateDirectory advocateDirectory;
    private final ResourceLoader resourceLoader;
    private final ObjectMapper mapper;

    public DirectorySeeder(LexBridgeProperties properties,
                           AdvocateStore advocateStore,
                           AdvocateDirectory advocateDirectory,
                           ResourceLoader resourceLoader,
                           ObjectMapper mapper) {
        this.properties = properties;
        this.advocateStore = advocateStore;
        this.advocateDirectory = advocateDirectory;
        this.resourceLoader = resourceLoader;
        this.mapper = mapper;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.getDirectory().isSeed()) {
            return;
        }
        if (advocateStore.count() > 0) {
            log.info("Advocate directory already populated; skipping seed");
            return;
        }
        List<AdvocateCapability> advocates = load(properties.getDirectory().getSeedLocation());
        advocates.forEach(advocateDirectory::register);
        log.info("Seeded {} advocates from {}", advocates.size(), properties.getDirectory().getSeedLocation());
    }

    List<AdvocateCapability> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            return mapper.readValue(in, new TypeReference<List<AdvocateCapability>>() {
            });
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read advocate seed " + location, e);
        }
    }
}
