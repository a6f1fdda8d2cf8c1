package fr.lapetina.feedback.orchestrator.domain.parsing;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Turns a raw model reply into a JSON tree.
 *
 * Attempts, in order, until one yields a JSON array or object:
 * - the whole reply
 * - the first fenced code block, without its language tag
 * - the span from the first opening bracket to the last matching closing bracket
 * - that span with single-quoted strings rewritten as double-quoted ones
 *
 * Never throws; exhausting the chain produces a {@link ParseError}.
 * Stateless and thread-safe.
 */
public final class ResponseParser {

    private static final Logger log = LoggerFactory.getLogger(ResponseParser.class);

    private static final String FENCE = "```";

    private final ObjectMapper objectMapper;

    public ResponseParser() {
        this(new ObjectMapper());
    }

    public ResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper.copy()
                .enable(DeserializationFeature.FAIL_ON_TRAILING_TOKENS);
    }

    public ParseResult<JsonNode> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return ParseResult.failure(raw, "Empty response");
        }

        Exception lastError;
        String candidate = raw.trim();

        Attempt direct = tryParse(candidate);
        if (direct.node != null) {
            return ParseResult.success(direct.node, ParseStrategy.DIRECT);
        }
        lastError = direct.error;

        Optional<String> fenced = extractFencedBlock(raw);
        if (fenced.isPresent()) {
            candidate = fenced.get();
            Attempt attempt = tryParse(candidate);
            if (attempt.node != null) {
                return ParseResult.success(attempt.node, ParseStrategy.FENCED_BLOCK);
            }
            lastError = attempt.error != null ? attempt.error : lastError;
        }

        Optional<String> span = extractBracketSpan(raw);
        if (span.isPresent()) {
            candidate = span.get();
            Attempt attempt = tryParse(candidate);
            if (attempt.node != null) {
                return ParseResult.success(attempt.node, ParseStrategy.BRACKET_SPAN);
            }
            lastError = attempt.error != null ? attempt.error : lastError;
        }

        if (candidate.indexOf('\'') >= 0) {
            Attempt attempt = tryParse(normalizeQuotes(candidate));
            if (attempt.node != null) {
                return ParseResult.success(attempt.node, ParseStrategy.QUOTE_NORMALIZED);
            }
            lastError = attempt.error != null ? attempt.error : lastError;
        }

        ParseError error = new ParseError(raw,
                lastError != null ? lastError.getMessage() : "No structured content found",
                lastError);
        log.debug("Response could not be parsed: error={}, raw={}", error.message(), error.rawPreview());
        return ParseResult.failure(error);
    }

    private Attempt tryParse(String text) {
        try {
            JsonNode node = objectMapper.readTree(text);
            if (node != null && node.isContainerNode()) {
                return new Attempt(node, null);
            }
            return new Attempt(null, null);
        } catch (JsonProcessingException e) {
            return new Attempt(null, e);
        }
    }

    /**
     * Contents of the first fenced block, with a leading format token such as {@code json} removed.
     * An unterminated fence extends to the end of the text.
     */
    static Optional<String> extractFencedBlock(String text) {
        int open = text.indexOf(FENCE);
        if (open < 0) {
            return Optional.empty();
        }
        int contentStart = open + FENCE.length();
        int close = text.indexOf(FENCE, contentStart);
        String block = close >= 0 ? text.substring(contentStart, close) : text.substring(contentStart);

        int newline = block.indexOf('\n');
        String firstLine = newline >= 0 ? block.substring(0, newline) : block;
        String token = firstLine.trim();
        if (!token.isEmpty() && token.matches("[A-Za-z][A-Za-z0-9_+-]*")) {
            block = newline >= 0 ? block.substring(newline + 1) : "";
        }
        block = block.trim();
        return block.isEmpty() ? Optional.empty() : Optional.of(block);
    }

    /**
     * Substring from the first '[' or '{' to the last matching closer.
     */
    static Optional<String> extractBracketSpan(String text) {
        int square = text.indexOf('[');
        int curly = text.indexOf('{');
        int start;
        char closer;
        if (square >= 0 && (curly < 0 || square < curly)) {
            start = square;
            closer = ']';
        } else if (curly >= 0) {
            start = curly;
            closer = '}';
        } else {
            return Optional.empty();
        }
        int end = text.lastIndexOf(closer);
        if (end <= start) {
            return Optional.empty();
        }
        return Optional.of(text.substring(start, end + 1));
    }

    /**
     * Rewrites single-quoted strings as double-quoted JSON strings. Double-quoted strings are
     * copied untouched, so apostrophes inside them survive. Inside a single-quoted string a quote
     * only terminates it when followed by a structural character, which keeps words like
     * "don't" intact.
     */
    static String normalizeQuotes(String text) {
        StringBuilder out = new StringBuilder(text.length() + 16);
        int i = 0;
        int n = text.length();
        while (i < n) {
            char c = text.charAt(i);
            if (c == '"') {
                int end = skipDoubleQuoted(text, i);
                out.append(text, i, end);
                i = end;
            } else if (c == '\'') {
                out.append('"');
                i++;
                while (i < n) {
                    char d = text.charAt(i);
                    if (d == '\\' && i + 1 < n) {
                        char escaped = text.charAt(i + 1);
                        if (escaped == '\'') {
                            out.append('\'');
                        } else {
                            out.append(d).append(escaped);
                        }
                        i += 2;
                        continue;
                    }
                    if (d == '\'' && closesString(text, i + 1)) {
                        i++;
                        break;
                    }
                    if (d == '"') {
                        out.append("\\\"");
                    } else {
                        out.append(d);
                    }
                    i++;
                }
                out.append('"');
            } else {
                out.append(c);
                i++;
            }
        }
        return out.toString();
    }

    private static int skipDoubleQuoted(String text, int start) {
        int i = start + 1;
        while (i < text.length()) {
            char c = text.charAt(i);
            if (c == '\\') {
                i += 2;
                continue;
            }
            if (c == '"') {
                return i + 1;
            }
            i++;
        }
        return text.length();
    }

    private static boolean closesString(String text, int from) {
        for (int i = from; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isWhitespace(c)) {
                continue;
            }
            return c == ',' || c == ':' || c == ']' || c == '}';
        }
        return true;
    }

    private record Attempt(JsonNode node, Exception error) {
    }
}
