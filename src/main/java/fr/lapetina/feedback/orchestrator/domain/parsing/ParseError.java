package fr.lapetina.feedback.orchestrator.domain.parsing;

/**
 * Why a remote reply could not be turned into structured records.
 *
 * @param raw     the reply as received, kept for logging
 * @param message short description of the terminal failure
 * @param cause   terminal exception, may be null when the failure is a shape mismatch
 */
public record ParseError(String raw, String message, Exception cause) {

    private static final int PREVIEW_LENGTH = 200;

    /**
     * Raw reply truncated for log lines.
     */
    public String rawPreview() {
        if (raw == null) {
            return "<null>";
        }
        String flat = raw.replaceAll("\\s+", " ").trim();
        return flat.length() <= PREVIEW_LENGTH ? flat : flat.substring(0, PREVIEW_LENGTH) + "...";
    }
}
