package com.traderank.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Named wall-clock windows used to rank fills by time of day, bound from the
 * {@code traderank.periods} prefix.
 *
 * <p>Hours are UTC, start inclusive, end exclusive. Windows need not be contiguous; fills
 * outside every window are ignored by the period ranking. When nothing is configured the
 * US equity session table below applies.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "traderank.periods")
public class TradingPeriodConfig {

    /** How many periods a top-N ranking returns by default. */
    @Min(1)
    private int topCount = 3;

    @Valid
    @NotEmpty
    private List<Window> windows = defaultWindows();

    public int getTopCount() {
        return topCount;
    }

    public void setTopCount(int topCount) {
        this.topCount = topCount;
    }

    public List<Window> getWindows() {
        return windows;
    }

    public void setWindows(List<Window> windows) {
        this.windows = windows;
    }

    public static List<Window> defaultWindows() {
        List<Window> defaults = new ArrayList<>();
        defaults.add(new Window("Pre-Market", 4, 9));
        defaults.add(new Window("Market Open", 9, 10));
        defaults.add(new Window("Morning", 10, 12));
        defaults.add(new Window("Lunch", 12, 13));
        defaults.add(new Window("Afternoon", 13, 15));
        defaults.add(new Window("Power Hour", 15, 16));
        defaults.add(new Window("After-Hours", 16, 20));
        return defaults;
    }

    /**
     * A single named window.
     */
    public static class Window {

        @NotBlank
        private String name;

        @Min(0)
        @Max(23)
        private int startHour;

        @Min(1)
        @Max(24)
        private int endHour;

        public Window() {}

        public Window(String name, int startHour, int endHour) {
            this.name = name;
            this.startHour = startHour;
            this.endHour = endHour;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public int getStartHour() {
            return startHour;
        }

        public void setStartHour(int startHour) {
            this.startHour = startHour;
        }

        public int getEndHour() {
            return endHour;
        }

        public void setEndHour(int endHour) {
            this.endHour = endHour;
        }
    }
}
