package autoexplore.model;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class ExplorationResultIOTest {

    private Path file;

    @BeforeMethod
    public void setUp() throws IOException {
        file = Files.createTempFile("result", ".json");
    }

    @AfterMethod
    public void tearDown() throws IOException {
        Files.deleteIfExists(file);
    }

    @Test
    public void write_thenRead_keepsScreensIssuesAndTimes() throws IOException {
        Screen home = new Screen("com.shop", "com.shop.MainActivity")
                .addClickable(new ClickableElement("com.shop:id/open_cart", "Cart", null,
                        "android.widget.Button", new ElementBounds(340, 1100, 400, 120)));
        ExplorationResult result = new ExplorationResult();
        result.setPackageName("com.shop");
        result.setStatus(ExplorationStatus.STOPPED);
        result.setStartTime(Instant.parse("2026-01-01T00:00:00Z"));
        result.setScreens(List.of(home));
        result.setTransitions(List.of(new ScreenTransition(home.getScreenId(), "other", "open_cart_cart_button",
                Instant.parse("2026-01-01T00:00:05Z"))));

        ExplorationResultIO.write(result, file);
        ExplorationResult read = ExplorationResultIO.read(file);

        assertThat(read.getStatus()).isEqualTo(ExplorationStatus.STOPPED);
        assertThat(read.getStartTime()).isEqualTo(Instant.parse("2026-01-01T00:00:00Z"));
        assertThat(read.getScreens()).singleElement()
                .satisfies(s -> assertThat(s.getClickableIds()).containsExactly("open_cart_cart_button"));
        assertThat(read.getTransitions()).extracting(ScreenTransition::toScreenId).containsExactly("other");
    }

    @Test
    public void read_missingPackageName_failsValidation() throws IOException {
        Files.writeString(file, "{\"schemaVersion\":\"1.0\",\"status\":\"COMPLETED\",\"screens\":[]}");

        assertThatThrownBy(() -> ExplorationResultIO.read(file))
                .isInstanceOf(ExplorationResultIO.SchemaValidationException.class)
                .hasMessageContaining("packageName");
    }

    @Test
    public void read_unsupportedVersion_rejected() throws IOException {
        Files.writeString(file, "{\"schemaVersion\":\"9.0\",\"packageName\":\"com.shop\","
                + "\"status\":\"COMPLETED\",\"screens\":[]}");

        assertThatThrownBy(() -> ExplorationResultIO.read(file))
                .isInstanceOf(ExplorationResultIO.SchemaVersionException.class);
    }
}
