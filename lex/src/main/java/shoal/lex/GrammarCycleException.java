package shoal.lex;

import java.util.List;

import lombok.Getter;

/**
 * Raised when states include each other in a loop. The cycle starts and ends
 * with the same state, e.g. {@code [a, b, a]}.
 */
@Getter
public class GrammarCycleException extends GrammarException {

    private final List<String> cycle;

    GrammarCycleException(List<String> cycle) {
        super("include cycle: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }
}
