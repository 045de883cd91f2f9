package blokus.main;

import static org.junit.jupiter.api.Assertions.*;

import blokus.records.SelfPlayConfig;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigLoaderTest {

    @TempDir
    Path tempDir;

    @Test
    void defaultsComeFromReferenceConf() {
        Config config = ConfigLoader.load(tempDir.resolve("missing.conf").toFile());
        SelfPlayConfig sp = SelfPlayConfig.from(config);
        assertEquals(4, sp.games());
        assertEquals(20190101L, sp.seed());
        assertTrue(sp.renderFinalBoard());
        assertFalse(sp.ansi());
        assertEquals(3, sp.benchDepth());
    }

    @Test
    void fileOverridesDefaults() throws IOException {
        File file = tempDir.resolve(ConfigLoader.CONFIG_FILE_NAME).toFile();
        Files.writeString(file.toPath(), "blokus.selfplay { games = 2, ansi = true }\n", StandardCharsets.UTF_8);

        SelfPlayConfig sp = SelfPlayConfig.from(ConfigLoader.load(file));
        assertEquals(2, sp.games());
        assertTrue(sp.ansi());
        assertEquals(20190101L, sp.seed(), "untouched keys keep their default");
    }

    @Test
    void rejectsInvalidValues() {
        Config zeroGames = ConfigFactory.parseString("blokus.selfplay.games = 0")
                .withFallback(ConfigFactory.parseResources("reference.conf"));
        assertThrows(IllegalArgumentException.class, () -> SelfPlayConfig.from(zeroGames));

        Config wrongType = ConfigFactory.parseString("blokus.selfplay.games = many")
                .withFallback(ConfigFactory.parseResources("reference.conf"));
        assertThrows(ConfigException.WrongType.class, () -> SelfPlayConfig.from(wrongType));

        assertThrows(ConfigException.Missing.class, () -> SelfPlayConfig.from(ConfigFactory.empty()));
    }
}
