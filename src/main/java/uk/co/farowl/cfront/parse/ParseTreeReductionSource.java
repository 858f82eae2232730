package uk.co.farowl.cfront.parse;

import java.util.ArrayDeque;
import java.util.Deque;

import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.ParseTreeWalker;

import uk.co.farowl.cfront.event.ReductionEvent;
import uk.co.farowl.cfront.event.ReductionSource;

/**
 * A {@link ReductionSource} delivering the events of a parse tree (usually of a whole program) in
 * the order a bottom-up parser would reduce its rules.
 */
public class ParseTreeReductionSource implements ReductionSource {

    private final Deque<ReductionEvent> events = new ArrayDeque<>();

    /**
     * Create a source of the events from the given tree.
     *
     * @param tree from which to generate events
     */
    public ParseTreeReductionSource(ParseTree tree) {
        ParseTreeWalker.DEFAULT.walk(new ReductionListener(events::add), tree);
    }

    /** @return the number of events not yet delivered */
    public int remaining() {
        return events.size();
    }

    @Override
    public ReductionEvent nextOrNull() {
        return events.pollFirst();
    }
}
