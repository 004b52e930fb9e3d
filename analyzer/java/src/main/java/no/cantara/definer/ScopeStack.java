package no.cantara.definer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Nested lexical scopes, innermost first.
 *
 * <p>Immutable: {@link #push} returns a new stack and leaves this one untouched, so sibling
 * subtrees never observe each other's bindings.
 */
public final class ScopeStack {

    private static final ScopeStack EMPTY = new ScopeStack(List.of());

    private final List<Set<String>> scopes;

    private ScopeStack(List<Set<String>> scopes) {
        this.scopes = scopes;
    }

    public static ScopeStack empty() {
        return EMPTY;
    }

    /**
     * A new stack with {@code names} as the innermost scope.
     */
    public ScopeStack push(Collection<String> names) {
        List<Set<String>> next = new ArrayList<>(scopes.size() + 1);
        next.add(Set.copyOf(names));
        next.addAll(scopes);
        return new ScopeStack(List.copyOf(next));
    }

    public boolean binds(String name) {
        for (Set<String> scope : scopes) {
            if (scope.contains(name)) return true;
        }
        return false;
    }

    public int depth() {
        return scopes.size();
    }

    public boolean isEmpty() {
        return scopes.isEmpty();
    }

    /** The scopes, innermost first. */
    public List<Set<String>> scopes() {
        return scopes;
    }

    @Override
    public String toString() {
        return "ScopeStack" + scopes;
    }
}
