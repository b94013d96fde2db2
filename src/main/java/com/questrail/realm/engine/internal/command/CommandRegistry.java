package com.questrail.realm.engine.internal.command;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * CommandRegistry
 * -----------------------------------------------------------------------------
 * Maps verbs and their aliases to handlers. Populated once at startup; lookups
 * are plain map reads.
 */
public final class CommandRegistry
{
    /**
     * A registered command.
     *
     * @param name        primary verb
     * @param aliases     alternative verbs
     * @param category    grouping for help output
     * @param description one-line summary
     * @param usage       argument synopsis, e.g. {@code attack <target>}
     */
    public record Registration(String name,
                               List<String> aliases,
                               String category,
                               String description,
                               String usage,
                               CommandHandler handler)
    {
        public Registration {
            Objects.requireNonNull(name, "name");
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(handler, "handler");
            aliases = List.copyOf(Objects.requireNonNullElse(aliases, List.of()));
            description = Objects.requireNonNullElse(description, "");
            usage = Objects.requireNonNullElse(usage, name);
        }
    }

    private final Map<String, Registration> byVerb = new LinkedHashMap<>();
    private final List<Registration> registrations = new ArrayList<>();

    /**
     * @throws IllegalArgumentException if the name or an alias is already taken
     */
    public CommandRegistry register(Registration registration) {
        Objects.requireNonNull(registration, "registration");
        List<String> verbs = new ArrayList<>();
        verbs.add(registration.name());
        verbs.addAll(registration.aliases());
        for (String verb : verbs) {
            if (byVerb.containsKey(key(verb))) {
                throw new IllegalArgumentException("verb already registered: " + verb);
            }
        }
        for (String verb : verbs) {
            byVerb.put(key(verb), registration);
        }
        registrations.add(registration);
        return this;
    }

    public CommandRegistry register(String name,
                                    String category,
                                    String description,
                                    String usage,
                                    CommandHandler handler,
                                    String... aliases) {
        return register(new Registration(name, List.of(aliases), category, description, usage, handler));
    }

    public Optional<Registration> resolve(String verb) {
        return verb == null ? Optional.empty() : Optional.ofNullable(byVerb.get(key(verb)));
    }

    public List<Registration> registrations() {
        return Collections.unmodifiableList(registrations);
    }

    /**
     * All commands grouped by category, in registration order.
     */
    public String help() {
        Map<String, List<Registration>> byCategory = new LinkedHashMap<>();
        for (Registration r : registrations) {
            byCategory.computeIfAbsent(r.category(), c -> new ArrayList<>()).add(r);
        }
        StringBuilder sb = new StringBuilder("Available commands:");
        for (Map.Entry<String, List<Registration>> e : byCategory.entrySet()) {
            sb.append("\n").append(e.getKey()).append(":");
            for (Registration r : e.getValue()) {
                sb.append("\n  ").append(r.usage());
                if (!r.description().isEmpty()) {
                    sb.append(" - ").append(r.description());
                }
            }
        }
        return sb.toString();
    }

    /**
     * Usage and aliases of one command.
     */
    public Optional<String> help(String verb) {
        return resolve(verb).map(r -> {
            StringBuilder sb = new StringBuilder(r.usage());
            if (!r.description().isEmpty()) {
                sb.append("\n  ").append(r.description());
            }
            if (!r.aliases().isEmpty()) {
                sb.append("\n  aliases: ").append(String.join(", ", r.aliases()));
            }
            return sb.toString();
        });
    }

    private static String key(String verb) {
        return verb.trim().toLowerCase(Locale.ROOT);
    }
}
