package autoexplore.learning;

import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

public class StrategyMemoryTest {

    @Test
    public void recordResult_keepsBestAcrossInstances() throws IOException {
        Path file = Files.createTempDirectory("strategy").resolve("memory.json");

        StrategyMemory memory = new StrategyMemory(file);
        assertThat(memory.getBestStrategy("com.app")).isNull();
        assertThat(memory.recordResult("com.app", "BREADTH_FIRST", 12)).isTrue();
        assertThat(memory.recordResult("com.app", "DEPTH_FIRST", 8)).as("worse result").isFalse();
        assertThat(memory.recordResult("com.app", "SCREEN_FIRST", 20)).isTrue();

        StrategyMemory reloaded = new StrategyMemory(file);
        assertThat(reloaded.getBestStrategy("com.app")).isEqualTo("SCREEN_FIRST");
        assertThat(reloaded.getBestDiscoveries("com.app")).isEqualTo(20);
    }

    @Test
    public void unreadableFile_startsEmpty() throws IOException {
        Path file = Files.createTempFile("strategy", ".json");
        Files.writeString(file, "{broken");

        assertThat(new StrategyMemory(file).getBestStrategy("com.app")).isNull();
    }
}
