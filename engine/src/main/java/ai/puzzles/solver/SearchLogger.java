package ai.puzzles.solver;

import ai.puzzles.game.Board;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Emits one structured JSON line per completed search for offline analysis.
 *
 * <p>Lines are prefixed with "SEARCH_SUMMARY " so downstream tools can filter them out of mixed
 * logs. Disabled unless the JVM is started with {@code -Dlog.searches=true}.</p>
 */
public class SearchLogger {
    private static final Logger log = LoggerFactory.getLogger(SearchLogger.class);
    private static final boolean ENABLED = Boolean.getBoolean("log.searches");

    private SearchLogger() {
    }

    /**
     * Return true if search logging is enabled via -Dlog.searches=true.
     */
    public static boolean isEnabled() {
        return ENABLED;
    }

    public static void logSearch(Board start, SearchResult result) {
        if (!ENABLED) {
            return;
        }
        log.info("SEARCH_SUMMARY {}", toJson(start, result));
    }

    static String toJson(Board start, SearchResult result) {
        StringBuilder sb = new StringBuilder();
        sb.append("{\"type\":\"search\"");
        sb.append(",\"algorithm\":\"").append(result.getAlgorithm().getLabel()).append('"');
        sb.append(",\"size\":").append(start.getSize());
        sb.append(",\"state_key\":").append(start.getStateKey());
        sb.append(",\"start\":[");
        for (int r = 0; r < start.getSize(); r++) {
            if (r > 0) {
                sb.append(',');
            }
            sb.append('[');
            for (int c = 0; c < start.getSize(); c++) {
                if (c > 0) {
                    sb.append(',');
                }
                sb.append(start.get(r, c));
            }
            sb.append(']');
        }
        sb.append(']');
        sb.append(",\"outcome\":\"").append(result.getOutcome()).append('"');
        sb.append(",\"solution_depth\":").append(result.getSolutionDepth());
        sb.append(",\"nodes_expanded\":").append(result.getNodesExpanded());
        sb.append(",\"max_frontier_size\":").append(result.getMaxFrontierSize());
        sb.append(",\"elapsed_nanos\":").append(result.getElapsedNanos());
        if (result.getDepthLimit() != null) {
            sb.append(",\"depth_limit\":").append(result.getDepthLimit());
        }
        sb.append('}');
        return sb.toString();
    }
}
