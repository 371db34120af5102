package com.petri.pnml.report;

import com.petri.pnml.validation.ValidationModels.Finding;

import java.util.List;

public final class ReportRenderer {
    private static final String NL = System.lineSeparator();

    private ReportRenderer() {
    }

    public static String render(NetReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append("=== Petri Net Summary ===").append(NL);
        sb.append("Places: ").append(report.counts().places()).append(NL);
        sb.append("Transitions: ").append(report.counts().transitions()).append(NL);
        sb.append("Arcs: ").append(report.counts().arcs()).append(NL);

        sb.append(NL).append("Places with initial marking = 1:").append(NL);
        for (NetReport.MarkedPlace p : report.markedPlaces()) {
            sb.append(" - ").append(p.id());
            if (p.name() != null) sb.append(" (").append(p.name()).append(')');
            sb.append(NL);
        }

        section(sb, "Errors:", report.errors());
        section(sb, "Warnings:", report.warnings());
        if (report.errors().isEmpty() && report.warnings().isEmpty()) {
            sb.append(NL).append("No errors or warnings detected.").append(NL);
        }
        return sb.toString();
    }

    private static void section(StringBuilder sb, String title, List<Finding> findings) {
        if (findings.isEmpty()) return;
        sb.append(NL).append(title).append(NL);
        findings.forEach(f -> sb.append("  ").append(f.message()).append(NL));
    }
}
