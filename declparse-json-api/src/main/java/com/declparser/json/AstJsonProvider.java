package com.declparser.json;

import java.util.List;
import java.util.Optional;
import java.util.ServiceLoader;
import java.util.stream.Collectors;

/**
 * Entry point for reading and writing declaration syntax trees as JSON. Implementations
 * register themselves under {@code META-INF/services} and are found with {@link ServiceLoader};
 * putting declparse-jackson on the classpath is enough to make {@link #getProvider()} work.
 *
 * <pre>{@code
 * AstJsonProvider provider = AstJsonProvider.getProvider();
 * String json = provider.getSerializer().serialize(variant);
 * Variant back = provider.getDeserializer().deserializeVariant(json);
 * }</pre>
 */
public interface AstJsonProvider {

    /**
     * @return the serializer for syntax tree nodes
     */
    AstJsonSerializer getSerializer();

    /**
     * @return the deserializer for syntax tree nodes
     */
    AstJsonDeserializer getDeserializer();

    /**
     * @return the name this provider is looked up by, e.g. "Jackson"
     */
    String getName();

    /**
     * Returns the first provider on the classpath.
     *
     * @return the provider
     * @throws IllegalStateException if no provider is registered
     */
    static AstJsonProvider getProvider() {
        return find(null).orElseThrow(() -> new IllegalStateException(
            "No AstJsonProvider registered; add declparse-jackson to the classpath"));
    }

    /**
     * Returns the provider whose name matches, ignoring case.
     *
     * @param name the provider name, e.g. "Jackson"
     * @return the provider
     * @throws IllegalStateException if no registered provider has that name; the message
     *         lists the names that are registered
     */
    static AstJsonProvider getProvider(String name) {
        return find(name).orElseThrow(() -> new IllegalStateException(
            "No AstJsonProvider named '" + name + "'; registered providers: " + availableProviders()));
    }

    /**
     * @return the names of every registered provider, in discovery order
     */
    static List<String> availableProviders() {
        return ServiceLoader.load(AstJsonProvider.class).stream()
            .map(p -> p.get().getName())
            .collect(Collectors.toList());
    }

    /**
     * @return true if at least one provider is registered
     */
    static boolean isProviderAvailable() {
        return find(null).isPresent();
    }

    // A null name matches any provider
    private static Optional<AstJsonProvider> find(String name) {
        return ServiceLoader.load(AstJsonProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .filter(p -> name == null || p.getName().equalsIgnoreCase(name))
            .findFirst();
    }
}
