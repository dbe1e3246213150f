package com.buildcheck.core.export.impl;

import com.buildcheck.core.export.BuildFormatter;
import com.buildcheck.core.export.ExportContext;
import com.buildcheck.core.export.ExportLine;
import com.buildcheck.core.export.ExportResult;
import com.buildcheck.core.model.Build;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Formats a build as a Reddit markdown table with a right-aligned price column.
 */
public class RedditFormatter implements BuildFormatter {

    @Override
    public String getId() {
        return "reddit";
    }

    @Override
    public String getDisplayName() {
        return "Reddit Markdown";
    }

    @Override
    public ExportResult format(Build build, ExportContext context) {
        List<ExportLine> lines = ExportLine.of(build);
        BigDecimal total = build.totalPrice();

        List<String> out = new ArrayList<>();
        out.add("| Component | Selection | Price |");
        out.add("|:----------|:----------|------:|");
        for (ExportLine line : lines) {
            out.add("| " + line.label() + " | " + line.name() + " | " + line.price() + " |");
        }
        out.add("| **Total** | | **" + ExportLine.formatPrice(total) + "** |");
        out.add("");
        out.add("*Built with [BuildCheck](" + context.appUrl() + ")*");

        return new ExportResult(String.join("\n", out), total, lines.size(), null);
    }
}
