package io.atom.governor.domain.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed catalogue of action identifiers known to governance, each tagged with its complexity tier.
 * <ul>
 *   <li>1 - read / present</li>
 *   <li>2 - generate / analyze / moderate risk</li>
 *   <li>3 - create / update / send</li>
 *   <li>4 - delete / execute / transfer / deploy</li>
 * </ul>
 * Identifiers outside the catalogue are treated as tier {@link #UNKNOWN_ACTION_COMPLEXITY}.
 */
public enum GovernedAction {

    // Tier 1
    SEARCH("search", 1),
    READ("read", 1),
    LIST("list", 1),
    GET("get", 1),
    FETCH("fetch", 1),
    SUMMARIZE("summarize", 1),
    PRESENT_CHART("present_chart", 1),
    PRESENT_MARKDOWN("present_markdown", 1),

    // Tier 2
    ANALYZE("analyze", 2),
    SUGGEST("suggest", 2),
    DRAFT("draft", 2),
    GENERATE("generate", 2),
    RECOMMEND("recommend", 2),
    STREAM_CHAT("stream_chat", 2),
    PRESENT_FORM("present_form", 2),
    LLM_STREAM("llm_stream", 2),
    BROWSER_NAVIGATE("browser_navigate", 2),
    BROWSER_SCREENSHOT("browser_screenshot", 2),
    BROWSER_EXTRACT("browser_extract", 2),
    DEVICE_CAMERA_SNAP("device_camera_snap", 2),
    DEVICE_GET_LOCATION("device_get_location", 2),
    DEVICE_SEND_NOTIFICATION("device_send_notification", 2),
    UPDATE_CANVAS("update_canvas", 2),

    // Tier 3
    CREATE("create", 3),
    UPDATE("update", 3),
    SEND_EMAIL("send_email", 3),
    POST_MESSAGE("post_message", 3),
    SCHEDULE("schedule", 3),
    SUBMIT_FORM("submit_form", 3),
    DEVICE_SCREEN_RECORD("device_screen_record", 3),
    DEVICE_SCREEN_RECORD_START("device_screen_record_start", 3),
    DEVICE_SCREEN_RECORD_STOP("device_screen_record_stop", 3),

    // Tier 4
    DELETE("delete", 4),
    EXECUTE("execute", 4),
    DEPLOY("deploy", 4),
    TRANSFER("transfer", 4),
    PAYMENT("payment", 4),
    APPROVE("approve", 4),
    DEVICE_EXECUTE_COMMAND("device_execute_command", 4),
    CANVAS_EXECUTE_JAVASCRIPT("canvas_execute_javascript", 4);

    /**
     * Tier assigned to identifiers that are not in the catalogue.
     */
    public static final int UNKNOWN_ACTION_COMPLEXITY = 4;

    private static final Map<String, GovernedAction> BY_IDENTIFIER = Collections.unmodifiableMap(
            Arrays.stream(values()).collect(Collectors.toMap(GovernedAction::getIdentifier, Function.identity())));

    private final String identifier;
    private final int complexity;

    GovernedAction(String identifier, int complexity) {
        this.identifier = identifier;
        this.complexity = complexity;
    }

    public String getIdentifier() {
        return identifier;
    }

    public int getComplexity() {
        return complexity;
    }

    /**
     * Look up a catalogued action, ignoring case and surrounding whitespace.
     */
    public static Optional<GovernedAction> fromIdentifier(String identifier) {
        if (identifier == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_IDENTIFIER.get(identifier.trim().toLowerCase()));
    }

    /**
     * Complexity tier of an action. Unknown identifiers fail closed to the highest tier.
     */
    public static int complexityOf(String identifier) {
        Optional<GovernedAction> action = fromIdentifier(identifier);
        if (action.isEmpty()) {
            return UNKNOWN_ACTION_COMPLEXITY;
        }
        return action.get().complexity;
    }

    /**
     * Identifiers of all catalogued actions within the given complexity bound.
     */
    public static List<String> identifiersUpTo(int maxComplexity) {
        return Arrays.stream(values())
                .filter(action -> action.complexity <= maxComplexity)
                .map(GovernedAction::getIdentifier)
                .toList();
    }

    /**
     * Identifiers of all catalogued actions above the given complexity bound.
     */
    public static List<String> identifiersAbove(int maxComplexity) {
        return Arrays.stream(values())
                .filter(action -> action.complexity > maxComplexity)
                .map(GovernedAction::getIdentifier)
                .toList();
    }
}
