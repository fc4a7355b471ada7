package io.judgebridge.observability;

import io.judgebridge.model.SessionView;

import java.util.List;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(List<SessionView> judges) {
        StringBuilder sb = new StringBuilder();
        long working = judges.stream().filter(SessionView::working).count();
        long draining = judges.stream().filter(view -> !view.accepting()).count();
        appendGauge(sb, "judgebridge_judges_total", "Authenticated judges connected", null, null, judges.size());
        appendGauge(sb, "judgebridge_judges_working", "Judges holding a submission", null, null, working);
        appendGauge(sb, "judgebridge_judges_draining", "Judges not accepting untargeted work", null, null, draining);
        for (SessionView judge : judges) {
            if (judge.latencySeconds() != null) {
                appendGauge(sb, "judgebridge_judge_latency_seconds", "Mean ping round trip per judge",
                        "judge", judge.judge(), judge.latencySeconds());
            }
        }
        for (SessionView judge : judges) {
            if (judge.clockOffsetSeconds() != null) {
                appendGauge(sb, "judgebridge_judge_clock_offset_seconds", "Estimated dispatcher minus judge clock",
                        "judge", judge.judge(), judge.clockOffsetSeconds());
            }
        }
        for (SessionView judge : judges) {
            // Unreported load is MAX_VALUE; leave it out rather than export a meaningless number.
            if (judge.load() < Double.MAX_VALUE) {
                appendGauge(sb, "judgebridge_judge_load", "Self-reported judge load", "judge", judge.judge(), judge.load());
            }
        }
        return sb.toString();
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, double value) {
        if (!sb.toString().contains("# HELP " + metric + " ")) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(formatValue(value)).append('\n');
    }

    private static String formatValue(double value) {
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return Double.toString(value);
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
