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
 * Formats a build as a PCPartPicker-style pipe table.
 *
 * <p><b>Example Output:</b>
 * <pre>
 * [PCPartPicker Build List]
 *
 * Type|Item|Price
 * :----|:----|:----
 * CPU|AMD Ryzen 5 7600X|$229.00
 * **Total**||**$229.00**
 *
 * *Generated by BuildCheck*
 * </pre>
 */
public class PcPartPickerFormatter implements BuildFormatter {

    @Override
    public String getId() {
        return "pcpartpicker";
    }

    @Override
    public String getDisplayName() {
        return "PCPartPicker";
    }

    @Override
    public ExportResult format(Build build, ExportContext context) {
        List<ExportLine> lines = ExportLine.of(build);
        BigDecimal total = build.totalPrice();

        List<String> out = new ArrayList<>();
        out.add("[PCPartPicker Build List]");
        out.add("");
        out.add("Type|Item|Price");
        out.add(":----|:----|:----");
        for (ExportLine line : lines) {
            out.add(line.label() + "|" + line.name() + "|" + line.price());
        }
        out.add("**Total**||**" + ExportLine.formatPrice(total) + "**");
        out.add("");
        out.add("*Generated by BuildCheck*");

        return new ExportResult(String.join("\n", out), total, lines.size(), null);
    }
}
