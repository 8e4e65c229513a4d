package com.quintstore.jena.assembler;

import org.apache.jena.assembler.exceptions.AssemblerException;
import org.apache.jena.rdf.model.Property;
import org.apache.jena.rdf.model.Resource;
import org.apache.jena.rdf.model.Statement;
import org.apache.jena.shared.JenaException;

/**
 * Reads optional literal properties of an assembler configuration
 * resource.
 */
final class AssemblerProperties {

    private AssemblerProperties() {
        throw new AssertionError("No instances");
    }

    /**
     * Read a string property.
     *
     * @param root the configuration resource
     * @param property the property
     * @param defaultValue value when the property is absent
     * @return the value
     */
    static String getString(final Resource root, final Property property,
            final String defaultValue) {
        Statement statement = root.getProperty(property);
        if (statement == null) {
            return defaultValue;
        }
        try {
            return statement.getString();
        } catch (JenaException e) {
            throw new AssemblerException(root,
                property.getLocalName() + " must be a literal", e);
        }
    }

    /**
     * Read an integer property.
     *
     * @param root the configuration resource
     * @param property the property
     * @param defaultValue value when the property is absent
     * @return the value
     */
    static int getInt(final Resource root, final Property property,
            final int defaultValue) {
        Statement statement = root.getProperty(property);
        if (statement == null) {
            return defaultValue;
        }
        try {
            return statement.getInt();
        } catch (JenaException e) {
            throw new AssemblerException(root,
                property.getLocalName() + " must be an integer", e);
        }
    }
}
