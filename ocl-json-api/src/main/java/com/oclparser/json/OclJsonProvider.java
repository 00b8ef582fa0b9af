package com.oclparser.json;

import com.oclparser.view.Views;

import java.util.List;
import java.util.ServiceLoader;

/**
 * Provider interface for OCL JSON serialization.
 * Implementations are discovered via Java's ServiceLoader mechanism.
 *
 * <p>To use a provider, add the implementation JAR (e.g., ocl-jackson)
 * to your classpath. The provider will be automatically discovered.</p>
 *
 * <p>Example usage:</p>
 * <pre>{@code
 * OclJsonProvider provider = OclJsonProvider.getProvider();
 * String json = provider.toJson(source);
 * Object tree = provider.getDeserializer().readTree(json);
 * }</pre>
 */
public interface OclJsonProvider {

    /**
     * Returns the serializer for converting documents and views to JSON.
     *
     * @return the JSON serializer
     */
    OclJsonSerializer getSerializer();

    /**
     * Returns the deserializer for reading JSON back into plain data.
     *
     * @return the JSON deserializer
     */
    OclJsonDeserializer getDeserializer();

    /**
     * Returns the name of this provider (e.g., "Jackson").
     *
     * @return the provider name
     */
    String getName();

    /**
     * Parses OCL source and serializes its root view, the plain-data form of the document.
     *
     * @param source OCL source text
     * @return the JSON array of top-level members
     * @throws com.oclparser.ParseException on a lexical error
     * @throws OclJsonException if serialization fails
     */
    default String toJson(String source) throws OclJsonException {
        return getSerializer().serialize(Views.parse(source));
    }

    /**
     * All providers on the classpath, in ServiceLoader order.
     */
    static List<OclJsonProvider> providers() {
        return ServiceLoader.load(OclJsonProvider.class).stream()
            .map(ServiceLoader.Provider::get)
            .toList();
    }

    /**
     * Gets the first available provider.
     *
     * @throws IllegalStateException if no provider is found on the classpath
     */
    static OclJsonProvider getProvider() {
        return providers().stream()
            .findFirst()
            .orElseThrow(() -> new IllegalStateException(
                "No OclJsonProvider found on the classpath. Add ocl-jackson to your dependencies."));
    }

    /**
     * Gets a provider by name, ignoring case.
     *
     * @throws IllegalStateException if no matching provider is found
     */
    static OclJsonProvider getProvider(String name) {
        return providers().stream()
            .filter(provider -> provider.getName().equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new IllegalStateException("No OclJsonProvider found with name '" + name + "'"));
    }
}
