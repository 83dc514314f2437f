package io.clype.streamload.report;

import java.util.List;
import java.util.Locale;

import io.clype.streamload.model.MetricsSnapshot;
import io.clype.streamload.model.PoolSummary;
import io.clype.streamload.model.StatsSample;

/**
 * Renders stats lines and the final summary block.
 */
public final class StatsFormatter {

    private StatsFormatter() {
    }

    /**
     * Formats one periodic stats line, e.g.
     * {@code [15s] Connected: 10 | Disconnected: 2 | Errors: 3 | Messages: 500 | Rate: 100.0/s}.
     *
     * @param sample the sample
     * @return the line, without terminator
     */
    public static String formatLine(StatsSample sample) {
        MetricsSnapshot s = sample.snapshot();
        String rate = sample.rate().isPresent()
                ? String.format(Locale.ROOT, "%.1f", sample.rate().getAsDouble())
                : "-";
        return String.format(Locale.ROOT,
                "[%ds] Connected: %d | Disconnected: %d | Errors: %d | Messages: %d | Rate: %s/s",
                sample.elapsed().toSeconds(),
                s.connectedTotal(), s.disconnectedTotal(), s.errorTotal(), s.messageTotal(), rate);
    }

    /**
     * Formats the final summary block.
     *
     * @param summary the pool summary
     * @return the lines of the block
     */
    public static List<String> formatSummary(PoolSummary summary) {
        MetricsSnapshot totals = summary.totals();
        return List.of(
                "=== Final Stats ===",
                "Elapsed: " + summary.elapsed().toSeconds() + "s",
                "Workers Launched: " + summary.workersLaunched(),
                "Total Connected: " + totals.connectedTotal(),
                "Total Disconnected: " + totals.disconnectedTotal(),
                "Total Errors: " + totals.errorTotal(),
                "Total Messages: " + totals.messageTotal(),
                "Unaccounted Workers: " + summary.unaccountedWorkers());
    }
}
