package com.buildcheck.core.export.impl;

import com.buildcheck.core.codec.BuildCodec;
import com.buildcheck.core.codec.InvalidBuildRequestException;
import com.buildcheck.core.export.BuildFormatter;
import com.buildcheck.core.export.ExportContext;
import com.buildcheck.core.export.ExportLine;
import com.buildcheck.core.export.ExportResult;
import com.buildcheck.core.model.Build;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.List;

/**
 * Encodes a build into a share link: {@code <appUrl>/build?state=<base64url(json)>}.
 *
 * <p>The state is the compact build JSON, base64url-encoded without padding. Builds whose
 * JSON exceeds {@value #MAX_BUILD_JSON_BYTES} bytes are rejected.
 */
public class ShareLinkFormatter implements BuildFormatter {

    static final int MAX_BUILD_JSON_BYTES = 50 * 1024;

    private static final String STATE_PREFIX = "/build?state=";

    @Override
    public String getId() {
        return "link";
    }

    @Override
    public String getDisplayName() {
        return "Share Link";
    }

    @Override
    public ExportResult format(Build build, ExportContext context) {
        List<ExportLine> lines = ExportLine.of(build);

        byte[] json = BuildCodec.writeBuildCompact(build).getBytes(StandardCharsets.UTF_8);
        if (json.length > MAX_BUILD_JSON_BYTES) {
            throw new IllegalArgumentException("Build data too large for link format");
        }

        String state = Base64.getUrlEncoder().withoutPadding().encodeToString(json);
        String url = context.appUrl() + STATE_PREFIX + state;
        BigDecimal total = build.totalPrice();

        return new ExportResult(url, total, lines.size(), url);
    }

    /**
     * Restores the build carried by a share link or by its bare state value.
     *
     * @param linkOrState full share URL or the {@code state} parameter alone
     * @return decoded build
     * @throws InvalidBuildRequestException if the state is not a valid build
     */
    public static Build decode(String linkOrState) {
        String state = linkOrState;
        int index = linkOrState.indexOf(STATE_PREFIX);
        if (index >= 0) {
            state = linkOrState.substring(index + STATE_PREFIX.length());
        }
        // Other query parameters or a fragment may follow the state.
        int end = indexOfAny(state, '&', '#');
        if (end >= 0) {
            state = state.substring(0, end);
        }
        byte[] json;
        try {
            json = Base64.getUrlDecoder().decode(state);
        } catch (IllegalArgumentException e) {
            throw new InvalidBuildRequestException("Share state is not base64url", e);
        }
        return BuildCodec.readBuild(new String(json, StandardCharsets.UTF_8));
    }

    private static int indexOfAny(String value, char first, char second) {
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == first || c == second) {
                return i;
            }
        }
        return -1;
    }
}
