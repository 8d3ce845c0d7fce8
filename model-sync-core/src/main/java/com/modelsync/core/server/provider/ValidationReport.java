package com.modelsync.core.server.provider;

import java.util.List;
import java.util.Objects;

/**
 * Result of validating a diagram.
 *
 * @param markers all findings
 * @param valid true when there are no errors
 * @param errorCount number of error markers
 * @param warningCount number of warning markers
 */
public record ValidationReport(
    List<DiagramMarker> markers,
    boolean valid,
    int errorCount,
    int warningCount
) {
    public ValidationReport {
        markers = List.copyOf(Objects.requireNonNull(markers, "markers must not be null"));
    }

    public static ValidationReport of(List<DiagramMarker> markers) {
        int errors = count(markers, MarkerSeverity.ERROR);
        int warnings = count(markers, MarkerSeverity.WARNING);
        return new ValidationReport(markers, errors == 0, errors, warnings);
    }

    public List<DiagramMarker> markersFor(String elementId) {
        return markers.stream().filter(marker -> Objects.equals(marker.elementId(), elementId)).toList();
    }

    public boolean hasCode(String code) {
        return markers.stream().anyMatch(marker -> marker.code().equals(code));
    }

    private static int count(List<DiagramMarker> markers, MarkerSeverity severity) {
        return (int) markers.stream().filter(marker -> marker.severity() == severity).count();
    }
}
