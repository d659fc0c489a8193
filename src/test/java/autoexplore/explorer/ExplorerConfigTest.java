package autoexplore.explorer;

import autoexplore.model.ScreenGeometry;
import org.testng.annotations.Test;

import java.nio.file.Path;
import java.util.Properties;

import static org.assertj.core.api.Assertions.assertThat;

public class ExplorerConfigTest {

    private static ExplorerConfig with(String... keyValues) {
        Properties p = new Properties();
        for (int i = 0; i < keyValues.length; i += 2) p.setProperty(keyValues[i], keyValues[i + 1]);
        return new ExplorerConfig(p);
    }

    @Test
    public void emptyProperties_useDefaults() {
        ExplorerConfig config = with();

        assertThat(config.getScreenGeometry()).isEqualTo(ScreenGeometry.DEFAULT);
        assertThat(config.getCaptureRetries()).isEqualTo(3);
        assertThat(config.getCaptureBackoffMs()).isEqualTo(250L);
        assertThat(config.getStuckThreshold()).isEqualTo(5);
        assertThat(config.getRestartThreshold()).isEqualTo(15);
        assertThat(config.getPlateauMs()).isEqualTo(120_000L);
        assertThat(config.getMaxRerouteAttempts()).isEqualTo(3);
        assertThat(config.getMaxElementRetries()).isEqualTo(2);
        assertThat(config.getHelpWaitMs()).isEqualTo(30_000L);
        assertThat(config.getAdaptiveQuota()).isEqualTo(15);
        assertThat(config.getAdaptiveStagnation()).isEqualTo(6);
        assertThat(config.getPolicyStorePath()).isEqualTo(Path.of("policy-store.json"));
        assertThat(config.getStrategyStorePath()).isEqualTo(Path.of("strategy-memory.json"));
    }

    @Test
    public void overrides_areParsed() {
        ExplorerConfig config = with(
                ExplorerConfig.KEY_SCREEN_WIDTH, "720",
                ExplorerConfig.KEY_SCREEN_HEIGHT, " 1600 ",
                ExplorerConfig.KEY_STUCK_THRESHOLD, "8",
                ExplorerConfig.KEY_POLICY_STORE, "/tmp/q.json");

        assertThat(config.getScreenGeometry().width()).isEqualTo(720);
        assertThat(config.getScreenGeometry().height()).isEqualTo(1600);
        assertThat(config.getStuckThreshold()).isEqualTo(8);
        assertThat(config.getPolicyStorePath()).isEqualTo(Path.of("/tmp/q.json"));
    }

    @Test(description = "Malformed numbers fall back to the default instead of failing")
    public void invalidNumber_fallsBackToDefault() {
        ExplorerConfig config = with(
                ExplorerConfig.KEY_CAPTURE_RETRIES, "three",
                ExplorerConfig.KEY_PLATEAU_MS, "2m");

        assertThat(config.getCaptureRetries()).isEqualTo(3);
        assertThat(config.getPlateauMs()).isEqualTo(120_000L);
    }

    @Test
    public void asMap_onlyExplorerKeysSorted() {
        ExplorerConfig config = with(
                ExplorerConfig.KEY_STUCK_THRESHOLD, "4",
                "other.key", "x",
                ExplorerConfig.KEY_CAPTURE_RETRIES, "2");

        assertThat(config.asMap()).containsExactly(
                org.assertj.core.api.Assertions.entry(ExplorerConfig.KEY_CAPTURE_RETRIES, "2"),
                org.assertj.core.api.Assertions.entry(ExplorerConfig.KEY_STUCK_THRESHOLD, "4"));
    }

    @Test
    public void classpathConfig_loads() {
        ExplorerConfig config = new ExplorerConfig();
        assertThat(config.asMap()).containsKey(ExplorerConfig.KEY_STUCK_THRESHOLD);
        assertThat(config.getStuckThreshold()).isEqualTo(5);
    }
}
