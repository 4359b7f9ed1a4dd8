package software.amazon.pattern.scanner;

import javax.annotation.Nonnull;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Objects;

/**
 * A pattern in the dictionary of an {@link Automaton}. The id is the pattern's insertion index and is what
 * {@link MatchRecord}s refer to.
 */
@Immutable
@ThreadSafe
public final class Pattern {

    private final int id;
    private final String text;

    Pattern(final int id, @Nonnull final String text) {
        this.id = id;
        this.text = Objects.requireNonNull(text, "text");
    }

    public int getId() {
        return id;
    }

    public String getText() {
        return text;
    }

    public int length() {
        return text.length();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Pattern pattern = (Pattern) o;
        return id == pattern.id && text.equals(pattern.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, text);
    }

    @Override
    public String toString() {
        return "Pattern{" + id + ":\"" + text + "\"}";
    }
}
