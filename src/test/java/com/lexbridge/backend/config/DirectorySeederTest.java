package com.lexbridge.backend.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.lexbridge.backend.models.AdvocateCapability;
import com.lexbridge.backend.models.FeeTier;
import com.lexbridge.backend.models.MatterType;
import com.lexbridge.backend.service.AdvocateDirectory;
import com.lexbridge.backend.support.InMemoryAdvocateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.UncheckedIOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectorySeederTest {

    private LexBridgeProperties properties;
    private InMemoryAdvocateStore store;
    private DirectorySeeder seeder;

    @BeforeEach
    void setUp() {
        properties = new LexBridgeProperties();
        store = new InMemoryAdvocateStore();
        seeder = new DirectorySeeder(properties, store, new AdvocateDirectory(store),
                new DefaultResourceLoader(), new ObjectMapper());
    }

    @Test
    void run_shouldDoNothing_whenSeedingDisabled() {
        seeder.run(new DefaultApplicationArguments());

        assertThat(store.count()).isZero();
    }

    @Test
    void run_shouldLoadSampleDirectoryIntoEmptyStore() {
        properties.getDirectory().setSeed(true);

        seeder.run(new DefaultApplicationArguments());

        assertThat(store.count()).isEqualTo(10);
        AdvocateCapability first = store.findAll().get(0);
        assertThat(first.getDisplayName()).isEqualTo("Adv. Rajesh Kumar Sharma");
        assertThat(first.getSpecializations()).contains(MatterType.CIVIL);
        assertThat(first.getFeeTier()).isEqualTo(FeeTier.PREMIUM);
        assertThat(first.getUpdatedAt()).isNotNull();
    }

    @Test
    void run_shouldSkip_whenDirectoryAlreadyPopulated() {
        properties.getDirectory().setSeed(true);
        store.create(AdvocateCapability.builder().displayName("Existing").build());

        seeder.run(new DefaultApplicationArguments());

        assertThat(store.count()).isEqualTo(1);
    }

    @Test
    void load_shouldFail_whenResourceMissing() {
        assertThatThrownBy(() -> seeder.load("classpath:seed/missing.json"))
                .isInstanceOf(UncheckedIOException.class);
    }
}
