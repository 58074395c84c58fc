package treeqa.recorder;

/**
 * Rendered test source plus the file name it should be saved under,
 * {@code <appId>.<scenario>.<yyyyMMdd_HHmmss>.g.java}.
 */
public record ExportResult(String text, String suggestedFileName, int stepCount) {
}
