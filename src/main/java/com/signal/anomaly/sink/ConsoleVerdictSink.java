package com.signal.anomaly.sink;

import com.signal.anomaly.model.DetectionSummary;
import com.signal.anomaly.model.Verdict;

import java.io.PrintStream;
import java.util.List;
import java.util.Locale;

/**
 * Prints one line per verdict, anomalies highlighted in red, with an optional pause
 * between lines to mimic a live feed.
 */
public class ConsoleVerdictSink implements VerdictSink {

    private static final String RED = "\u001B[31m";
    private static final String RESET = "\u001B[0m";

    private final PrintStream out;
    private final boolean color;
    private final long delayMillis;
    private boolean interrupted;

    public ConsoleVerdictSink(PrintStream out, boolean color, long delayMillis) {
        this.out = out;
        this.color = color;
        this.delayMillis = delayMillis;
    }

    @Override
    public void accept(List<Verdict> batch) {
        for (Verdict verdict : batch) {
            out.println(format(verdict));
            pause();
        }
    }

    @Override
    public void complete(DetectionSummary summary) {
        out.printf(Locale.ROOT, "Processed %d samples: %d verdicts, %d anomalies (%.1f%%), %d windows scored, %d failed%n",
                summary.getSamplesIngested(), summary.getVerdictsEmitted(), summary.getAnomalies(),
                summary.getAnomalyRatio() * 100.0, summary.getWindowsScored(), summary.getWindowsFailed());
    }

    String format(Verdict verdict) {
        String text = String.format(Locale.ROOT, "%.2f", verdict.getValue());
        if (!verdict.isAnomaly()) {
            return text;
        }
        text = text + " (Anomaly)";
        return color ? RED + text + RESET : text;
    }

    private void pause() {
        if (delayMillis <= 0 || interrupted) {
            return;
        }
        try {
            Thread.sleep(delayMillis);
        } catch (InterruptedException e) {
            // Keep printing without delay; the caller sees the interrupt flag.
            interrupted = true;
            Thread.currentThread().interrupt();
        }
    }
}
