package io.github.manjago.chimera.exec;

/**
 * Single-transition holder: {@code PENDING} moves to exactly one terminal verdict.
 */
public final class VerdictState {

    private Verdict verdict = Verdict.PENDING;

    public synchronized Verdict get() {
        return verdict;
    }

    public synchronized void transition(Verdict target) {
        if (!target.isTerminal()) {
            throw new IllegalStateException("Cannot transition to " + target);
        }
        if (verdict.isTerminal()) {
            throw new IllegalStateException("Verdict already " + verdict + ", cannot become " + target);
        }
        verdict = target;
    }
}
