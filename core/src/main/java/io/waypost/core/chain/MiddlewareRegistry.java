package io.waypost.core.chain;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered prefix-scoped middleware registrations.
 *
 * <p>
 * Not thread-safe while middlewares are being added; {@link #snapshot()}
 * yields an immutable copy for concurrent use.
 */
public final class MiddlewareRegistry {

    private final List<MiddlewareRegistration> registrations;

    public MiddlewareRegistry() {
        this.registrations = new ArrayList<>();
    }

    private MiddlewareRegistry(List<MiddlewareRegistration> frozen) {
        this.registrations = frozen;
    }

    public MiddlewareRegistration register(String prefix, Middleware middleware) {
        MiddlewareRegistration registration = new MiddlewareRegistration(prefix, middleware);
        registrations.add(registration);
        return registration;
    }

    /** Middlewares whose prefix matches {@code path}, in registration order. */
    public List<Middleware> matching(String path) {
        List<Middleware> matched = new ArrayList<>();
        for (MiddlewareRegistration registration : registrations) {
            if (registration.appliesTo(path)) {
                matched.add(registration.middleware());
            }
        }
        return matched;
    }

    /** Builds the chain for {@code path}, terminated by {@code terminal}. */
    public MiddlewareChain resolve(String path, Handler terminal) {
        return new MiddlewareChain(matching(path), terminal);
    }

    public List<MiddlewareRegistration> registrations() {
        return Collections.unmodifiableList(registrations);
    }

    public int size() {
        return registrations.size();
    }

    public MiddlewareRegistry snapshot() {
        return new MiddlewareRegistry(List.copyOf(registrations));
    }
}
