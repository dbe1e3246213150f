package com.buildcheck.core.export.impl;

import com.buildcheck.core.codec.BuildCodec;
import com.buildcheck.core.export.BuildFormatter;
import com.buildcheck.core.export.ExportContext;
import com.buildcheck.core.export.ExportLine;
import com.buildcheck.core.export.ExportResult;
import com.buildcheck.core.model.Build;

import java.math.BigDecimal;
import java.util.List;

/**
 * Formats a build as {@code {"components": {...}, "totalPrice": ...}}. The components object
 * reads back with {@link BuildCodec#readBuild(String)}.
 */
public class JsonFormatter implements BuildFormatter {

    @Override
    public String getId() {
        return "json";
    }

    @Override
    public String getDisplayName() {
        return "JSON";
    }

    @Override
    public ExportResult format(Build build, ExportContext context) {
        List<ExportLine> lines = ExportLine.of(build);
        BigDecimal total = build.totalPrice();
        return new ExportResult(BuildCodec.writeExportDocument(build, total), total, lines.size(), null);
    }
}
