package com.acme.wizard.remote.http;

import static org.assertj.core.api.Assertions.*;

import io.github.cdimascio.dotenv.Dotenv;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HttpRemoteConfigTest {

    @TempDir
    Path tempDir;

    private Dotenv load(String content) throws IOException {
        Files.writeString(tempDir.resolve(".env"), content);
        return Dotenv.configure()
                .directory(tempDir.toString())
                .filename(".env")
                .load();
    }

    @Test
    void testValuesFromEnvFile() throws IOException {
        Dotenv dotenv = load("""
                WIZARD_API_BASE_URL=https://surveys.example.test/
                WIZARD_API_TIMEOUT_SECONDS=12
                WIZARD_API_IDEMPOTENCY_HEADER=Idempotency-Key
                """);

        HttpRemoteConfig config = HttpRemoteConfig.from(dotenv);

        assertThat(config.getBaseUrl()).isEqualTo("https://surveys.example.test");
        assertThat(config.getTimeoutSeconds()).isEqualTo(12);
        assertThat(config.getIdempotencyHeader()).isEqualTo("Idempotency-Key");
    }

    @Test
    void testDefaults() throws IOException {
        HttpRemoteConfig config = HttpRemoteConfig.from(load("UNRELATED=1\n"));

        assertThat(config.getBaseUrl()).isEqualTo(HttpRemoteConfig.DEFAULT_BASE_URL);
        assertThat(config.getTimeoutSeconds()).isEqualTo(HttpRemoteConfig.DEFAULT_TIMEOUT_SECONDS);
        assertThat(config.getIdempotencyHeader()).isEqualTo(HttpRemoteConfig.DEFAULT_IDEMPOTENCY_HEADER);
    }

    @Test
    void testInvalidTimeoutFallsBackToDefault() throws IOException {
        HttpRemoteConfig config = HttpRemoteConfig.from(load("WIZARD_API_TIMEOUT_SECONDS=soon\n"));

        assertThat(config.getTimeoutSeconds()).isEqualTo(HttpRemoteConfig.DEFAULT_TIMEOUT_SECONDS);
    }

    @Test
    void testFromEnvironmentWithoutEnvFile() {
        assertThatCode(HttpRemoteConfig::fromEnvironment).doesNotThrowAnyException();
    }

    @Test
    void testRejectsInvalidValues() {
        assertThatThrownBy(() -> new HttpRemoteConfig(" ", 5, null))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new HttpRemoteConfig("http://localhost", 0, null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
