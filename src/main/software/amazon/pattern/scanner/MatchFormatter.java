package software.amazon.pattern.scanner;

import javax.annotation.Nonnull;
import java.io.IOException;
import java.util.List;

/**
 * Renders matches as human-readable lines, e.g. {@code Pattern "she" found from index 1 to 3}.
 */
public final class MatchFormatter {

    private MatchFormatter() { }

    public static String format(@Nonnull final MatchRecord match, @Nonnull final Automaton automaton) {
        return "Pattern \"" + automaton.getPattern(match.getPatternId()).getText()
                + "\" found from index " + match.getStartIndex()
                + " to " + match.getEndIndex();
    }

    /**
     * Writes one line per match, in list order.
     */
    public static void write(@Nonnull final List<MatchRecord> matches, @Nonnull final Automaton automaton,
                             @Nonnull final Appendable out) throws IOException {
        for (MatchRecord match : matches) {
            out.append(format(match, automaton)).append(System.lineSeparator());
        }
    }
}
