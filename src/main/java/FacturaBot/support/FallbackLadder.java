package FacturaBot.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Ordered list of attempts with a terminal default, one per pipeline stage.
 *
 * Each attempt may decline (empty Optional) or fail (RuntimeException); both move on to
 * the next rung. The terminal default is always applied last and is expected not to throw.
 *
 * @param <I> stage input
 * @param <O> stage output
 */
public final class FallbackLadder<I, O> {

    private static final Logger log = LoggerFactory.getLogger(FallbackLadder.class);

    private final String stage;
    private final List<Attempt<I, O>> attempts;
    private final Function<I, O> terminal;

    private FallbackLadder(String stage, List<Attempt<I, O>> attempts, Function<I, O> terminal) {
        this.stage = stage;
        this.attempts = List.copyOf(attempts);
        this.terminal = terminal;
    }

    public static <I, O> Builder<I, O> forStage(String stage) {
        return new Builder<>(stage);
    }

    public O run(I input) {
        for (Attempt<I, O> attempt : attempts) {
            try {
                Optional<O> result = attempt.step().apply(input);
                if (result.isPresent()) {
                    log.debug("[{}] resolved by '{}'", stage, attempt.name());
                    return result.get();
                }
                log.debug("[{}] '{}' declined", stage, attempt.name());
            } catch (RuntimeException e) {
                log.warn("[{}] '{}' failed, falling back: {}", stage, attempt.name(), e.toString());
            }
        }
        return terminal.apply(input);
    }

    public String stage() {
        return stage;
    }

    private record Attempt<I, O>(String name, Function<I, Optional<O>> step) {
    }

    public static final class Builder<I, O> {

        private final String stage;
        private final List<Attempt<I, O>> attempts = new ArrayList<>();

        private Builder(String stage) {
            this.stage = Objects.requireNonNull(stage, "stage");
        }

        public Builder<I, O> attempt(String name, Function<I, Optional<O>> step) {
            attempts.add(new Attempt<>(name, Objects.requireNonNull(step, "step")));
            return this;
        }

        public FallbackLadder<I, O> orElse(Function<I, O> terminal) {
            return new FallbackLadder<>(stage, attempts, Objects.requireNonNull(terminal, "terminal"));
        }
    }
}
