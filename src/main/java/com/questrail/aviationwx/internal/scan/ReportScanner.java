package com.questrail.aviationwx.internal.scan;

import com.questrail.aviationwx.codec.EmptyReportException;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * ReportScanner
 * -----------------------------------------------------------------------------
 * Splits a raw report line into classified tokens.
 *
 * <p>The scanner drops nothing and rejects nothing except an empty line:
 * malformed groups are passed through as {@link TokenShape#UNKNOWN} tokens so
 * that the decoders can reject them field by field.</p>
 */
public final class ReportScanner
{
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private ReportScanner() {}

    /**
     * Scans a raw report line.
     *
     * @param rawText report text, already stripped of any transport envelope
     * @return tokens in encoded order; never empty
     * @throws EmptyReportException if the trimmed input has zero length
     */
    public static List<ReportToken> scan(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            throw new EmptyReportException("Report text is empty");
        }

        String[] parts = WHITESPACE.split(rawText.strip());
        List<ReportToken> tokens = new ArrayList<>(parts.length);
        for (int i = 0; i < parts.length; i++) {
            tokens.add(ReportToken.of(i, parts[i]));
        }
        return List.copyOf(tokens);
    }
}
