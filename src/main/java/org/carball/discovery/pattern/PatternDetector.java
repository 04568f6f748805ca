package org.carball.discovery.pattern;

import org.carball.discovery.model.pattern.Pattern;
import org.carball.discovery.model.schema.DataType;

import java.util.List;

/**
 * A single, independent pattern detector. Returns zero or more patterns for one attribute.
 */
public interface PatternDetector {

    String name();

    boolean supports(DataType dataType);

    /**
     * @param attribute attribute name, used only in descriptions
     * @param values    non-null values in sample order
     */
    List<Pattern> detect(String attribute, List<Object> values);
}
