package org.logsim.cli.rendering;

import com.typesafe.config.Config;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Renders signal histories as text traces, one line per signal:
 * <pre>
 * sw1   ___-----
 * ff1.Q __--__--
 * </pre>
 * Histories shorter than the number of cycles run (monitors added during a run) are
 * right-aligned so that every column is the same cycle.
 */
public class TraceRenderer {

    private final char high;
    private final char low;

    public TraceRenderer(char high, char low) {
        this.high = high;
        this.low = low;
    }

    /**
     * @param config The root configuration, containing {@code logsim.cli.trace}.
     * @return A renderer using the configured characters.
     */
    public static TraceRenderer fromConfig(Config config) {
        return new TraceRenderer(config.getString("logsim.cli.trace.high").charAt(0),
                config.getString("logsim.cli.trace.low").charAt(0));
    }

    /**
     * @param signals Signal name to history, in display order.
     * @param cycles The number of cycles the widest trace should span.
     * @return One line per signal.
     */
    public List<String> render(Map<String, List<Boolean>> signals, int cycles) {
        int width = 0;
        for (String name : signals.keySet()) {
            width = Math.max(width, name.length());
        }
        List<String> lines = new ArrayList<>(signals.size());
        for (Map.Entry<String, List<Boolean>> entry : signals.entrySet()) {
            StringBuilder line = new StringBuilder(entry.getKey());
            line.append(" ".repeat(width - entry.getKey().length() + 1));
            List<Boolean> history = entry.getValue();
            line.append(" ".repeat(Math.max(0, cycles - history.size())));
            for (boolean sample : history) {
                line.append(sample ? high : low);
            }
            lines.add(line.toString());
        }
        return lines;
    }
}
